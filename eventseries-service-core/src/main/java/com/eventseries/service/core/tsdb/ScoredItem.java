package com.eventseries.service.core.tsdb;

/** A most-frequent item; higher scores are more frequent, the least frequent item scores 1.0. */
public record ScoredItem(Object item, double score) {}
