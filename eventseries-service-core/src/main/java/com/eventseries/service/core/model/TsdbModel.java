package com.eventseries.service.core.model;

/**
 * Logical metric series that can be queried. The numeric id is stable and is sent to the backend as part of the
 * request referrer.
 */
public enum TsdbModel {
    // events
    PROJECT(1),
    GROUP(4),
    RELEASE(7),
    GROUP_PERFORMANCE(10),
    GROUP_PROFILING(11),

    // distinct counts
    USERS_AFFECTED_BY_GROUP(300),
    USERS_AFFECTED_BY_PROJECT(301),
    USERS_AFFECTED_BY_PERF_GROUP(302),
    USERS_AFFECTED_BY_PROFILE_GROUP(303),

    // frequencies
    FREQUENT_ENVIRONMENTS_BY_GROUP(404),
    FREQUENT_RELEASES_BY_GROUP(406),
    FREQUENT_ISSUES_BY_PROJECT(407),

    // organization level outcomes
    ORGANIZATION_TOTAL_RECEIVED(500),
    ORGANIZATION_TOTAL_REJECTED(501),
    ORGANIZATION_TOTAL_BLACKLISTED(502),

    // project level outcomes
    PROJECT_TOTAL_RECEIVED(600),
    PROJECT_TOTAL_REJECTED(601),
    PROJECT_TOTAL_BLACKLISTED(602),
    PROJECT_TOTAL_RECEIVED_IP_ADDRESS(603),
    PROJECT_TOTAL_RECEIVED_RELEASE_VERSION(604),
    PROJECT_TOTAL_RECEIVED_ERROR_MESSAGE(605),
    PROJECT_TOTAL_RECEIVED_BROWSER_EXTENSIONS(606),
    PROJECT_TOTAL_RECEIVED_LEGACY_BROWSERS(607),
    PROJECT_TOTAL_RECEIVED_LOCALHOST(608),
    PROJECT_TOTAL_RECEIVED_WEB_CRAWLERS(609),
    PROJECT_TOTAL_RECEIVED_INVALID_CSP(610),
    PROJECT_TOTAL_RECEIVED_CORS(611),
    PROJECT_TOTAL_RECEIVED_DISCARDED_HASH(612),
    PROJECT_TOTAL_RECEIVED_HEALTH_CHECK(613),

    // key level outcomes
    KEY_TOTAL_RECEIVED(700),
    KEY_TOTAL_REJECTED(701),
    KEY_TOTAL_BLACKLISTED(702),

    // not backed by the analytics store
    PROJECT_TOTAL_FORWARDED(800);

    private final int id;

    TsdbModel(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** Key level outcome models, whose callers may pass numeric keys as strings. */
    public boolean isKeyLevel() {
        return this == KEY_TOTAL_RECEIVED || this == KEY_TOTAL_REJECTED || this == KEY_TOTAL_BLACKLISTED;
    }

    /** Models whose dataset cannot bucket by the native {@code time} column. */
    public boolean requiresManualGroupOnTime() {
        return this == GROUP_PROFILING || this == USERS_AFFECTED_BY_PROFILE_GROUP;
    }
}
