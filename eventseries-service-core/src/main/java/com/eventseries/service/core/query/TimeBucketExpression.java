package com.eventseries.service.core.query;

import java.util.Optional;

/**
 * Explicit time bucketing projected under {@code alias}, used for datasets that cannot group on the native
 * {@code time} column. Minute, hour and day rollups map to a start-of function; any other rollup integer-divides
 * the unix timestamp by the rollup and multiplies it back.
 */
public record TimeBucketExpression(int rollup, String alias) {

    /** Start-of function matching the rollup exactly, if any. */
    public Optional<String> startOfFunction() {
        return switch (rollup) {
            case 60 -> Optional.of("toStartOfMinute");
            case 3600 -> Optional.of("toStartOfHour");
            case 86400 -> Optional.of("toDate");
            default -> Optional.empty();
        };
    }
}
