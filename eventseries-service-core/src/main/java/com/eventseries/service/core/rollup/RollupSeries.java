package com.eventseries.service.core.rollup;

import java.time.Instant;
import java.util.List;

/**
 * Resolved rollup and the ordered bucket start timestamps (epoch seconds) covering a query window. Never empty.
 */
public record RollupSeries(int rollup, List<Long> buckets) {

    public RollupSeries {
        buckets = List.copyOf(buckets);
        if (buckets.isEmpty()) {
            throw new IllegalArgumentException("A rollup series needs at least one bucket");
        }
    }

    public int size() {
        return buckets.size();
    }

    public Instant start() {
        return Instant.ofEpochSecond(buckets.get(0));
    }

    /** End of the last bucket; queries always cover the full last bucket. */
    public Instant end() {
        return Instant.ofEpochSecond(buckets.get(buckets.size() - 1) + rollup);
    }
}
