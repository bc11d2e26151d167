package com.eventseries.service.core.rollup;

/** A supported rollup: bucket width in seconds and how many buckets of it are retained. */
public record RollupSpec(int seconds, int samples) {

    public RollupSpec {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Rollup must be positive: " + seconds);
        }
        if (samples <= 0) {
            throw new IllegalArgumentException("Rollup samples must be positive: " + samples);
        }
    }

    public long retentionSeconds() {
        return (long) seconds * samples;
    }
}
