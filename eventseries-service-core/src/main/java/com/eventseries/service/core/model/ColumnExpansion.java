package com.eventseries.service.core.model;

/**
 * A projected column computed by expanding a collection column into one row per element, e.g.
 * {@code arrayJoin(group_ids) AS group_id}.
 */
public record ColumnExpansion(String function, String sourceColumn, String alias) {

    public static ColumnExpansion arrayJoin(String sourceColumn, String alias) {
        return new ColumnExpansion("arrayJoin", sourceColumn, alias);
    }
}
