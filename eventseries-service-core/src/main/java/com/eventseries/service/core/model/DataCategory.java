package com.eventseries.service.core.model;

import java.util.List;

/** Data categories recorded on outcomes. */
public enum DataCategory {
    DEFAULT(0),
    ERROR(1),
    TRANSACTION(2),
    SECURITY(3),
    ATTACHMENT(4),
    SESSION(5),
    PROFILE(6);

    private final int code;

    DataCategory(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Categories counted together as "errors". */
    public static List<Integer> errorCategoryCodes() {
        return List.of(DEFAULT.code, ERROR.code, SECURITY.code);
    }
}
