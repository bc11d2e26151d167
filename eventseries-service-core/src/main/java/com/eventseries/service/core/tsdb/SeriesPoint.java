package com.eventseries.service.core.tsdb;

/** A value at a bucket start, in epoch seconds. */
public record SeriesPoint<V>(long timestamp, V value) {}
