package com.eventseries.service.core.rollup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Resolves rollups and produces the bucket series a query is executed and zero-filled over. */
public class RollupPlanner {

    private final List<RollupSpec> rollups;
    private final Clock clock;

    public RollupPlanner(List<RollupSpec> rollups, Clock clock) {
        if (rollups == null || rollups.isEmpty()) {
            throw new IllegalArgumentException("At least one rollup must be configured");
        }
        this.rollups =
                rollups.stream().sorted(Comparator.comparingInt(RollupSpec::seconds)).toList();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<RollupSpec> rollups() {
        return rollups;
    }

    /**
     * Finest rollup whose retention covers the requested window, or the coarsest configured rollup when none
     * does.
     */
    public int optimalRollup(Instant start, Instant end) {
        long seconds = Duration.between(start, end).getSeconds();
        for (RollupSpec spec : rollups) {
            if (spec.retentionSeconds() >= seconds) {
                return spec.seconds();
            }
        }
        return rollups.get(rollups.size() - 1).seconds();
    }

    /**
     * Plans the bucket series for {@code [start, end]}.
     *
     * @param end window end, defaults to now
     * @param rollup requested rollup in seconds, resolved with {@link #optimalRollup} when {@code null}
     */
    public RollupSeries plan(Instant start, Instant end, Integer rollup) {
        Objects.requireNonNull(start, "start");
        Instant effectiveEnd = end != null ? end : clock.instant();
        int resolved = rollup != null ? rollup : optimalRollup(start, effectiveEnd);
        if (resolved <= 0) {
            throw new IllegalArgumentException("Rollup must be positive: " + resolved);
        }

        List<Long> buckets = new ArrayList<>();
        long endTs = effectiveEnd.getEpochSecond();
        long cursor = start.getEpochSecond();
        while (cursor <= endTs) {
            buckets.add(normalize(cursor, resolved));
            cursor += resolved;
        }
        if (buckets.isEmpty()) {
            buckets.add(normalize(start.getEpochSecond(), resolved));
        }
        return new RollupSeries(resolved, buckets);
    }

    /**
     * Shifts every bucket by {@code floorMod(seed, rollup)} seconds so callers asking for the same window with
     * different seeds hit different boundaries. The shift moves back one rollup when the first bucket would
     * otherwise start after {@code start}.
     */
    public RollupSeries applyJitter(RollupSeries series, Instant start, Long jitterSeed) {
        if (jitterSeed == null) {
            return series;
        }
        int rollup = series.rollup();
        long jitter = Math.floorMod(jitterSeed, (long) rollup);
        if (start.getEpochSecond() - series.buckets().get(0) < jitter) {
            jitter -= rollup;
        }
        long shift = jitter;
        return new RollupSeries(
                rollup, series.buckets().stream().map(b -> b + shift).toList());
    }

    static long normalize(long epochSeconds, int rollup) {
        return epochSeconds - Math.floorMod(epochSeconds, (long) rollup);
    }
}
