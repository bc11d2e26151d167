package com.eventseries.service.core.model;

/** Inbound filter reasons recorded on filtered outcomes, each with its own per-project count model. */
public enum FilterReason {
    IP_ADDRESS("ip-address", TsdbModel.PROJECT_TOTAL_RECEIVED_IP_ADDRESS),
    RELEASE_VERSION("release-version", TsdbModel.PROJECT_TOTAL_RECEIVED_RELEASE_VERSION),
    ERROR_MESSAGE("error-message", TsdbModel.PROJECT_TOTAL_RECEIVED_ERROR_MESSAGE),
    BROWSER_EXTENSIONS("browser-extensions", TsdbModel.PROJECT_TOTAL_RECEIVED_BROWSER_EXTENSIONS),
    LEGACY_BROWSERS("legacy-browsers", TsdbModel.PROJECT_TOTAL_RECEIVED_LEGACY_BROWSERS),
    LOCALHOST("localhost", TsdbModel.PROJECT_TOTAL_RECEIVED_LOCALHOST),
    WEB_CRAWLERS("web-crawlers", TsdbModel.PROJECT_TOTAL_RECEIVED_WEB_CRAWLERS),
    INVALID_CSP("invalid-csp", TsdbModel.PROJECT_TOTAL_RECEIVED_INVALID_CSP),
    CORS("cors", TsdbModel.PROJECT_TOTAL_RECEIVED_CORS),
    DISCARDED_HASH("discarded-hash", TsdbModel.PROJECT_TOTAL_RECEIVED_DISCARDED_HASH),
    HEALTH_CHECK("filtered-transaction", TsdbModel.PROJECT_TOTAL_RECEIVED_HEALTH_CHECK);

    private final String code;
    private final TsdbModel model;

    FilterReason(String code, TsdbModel model) {
        this.code = code;
        this.model = model;
    }

    /** Reason code as stored in the outcomes {@code reason} column. */
    public String code() {
        return code;
    }

    public TsdbModel model() {
        return model;
    }
}
