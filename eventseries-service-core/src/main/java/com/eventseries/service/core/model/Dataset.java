package com.eventseries.service.core.model;

/** Backend table families a model can be answered from. */
public enum Dataset {
    EVENTS,
    TRANSACTIONS,
    ISSUE_PLATFORM,
    OUTCOMES,
    OUTCOMES_RAW;

    public boolean isOutcomes() {
        return this == OUTCOMES || this == OUTCOMES_RAW;
    }
}
