package com.eventseries.service.core.query;

import java.util.Objects;

/**
 * Aggregate expression of a backend request.
 *
 * @param function aggregate function
 * @param parameter function parameter, only used by {@link AggregateFunction#TOP_K}
 * @param column target column, {@code null} aggregates whole rows
 * @param alias output name of the aggregate value
 */
public record Aggregation(AggregateFunction function, Integer parameter, String column, String alias) {

    public Aggregation {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(alias, "alias");
        if (function == AggregateFunction.TOP_K && (parameter == null || parameter <= 0)) {
            throw new IllegalArgumentException("topK requires a positive limit");
        }
    }

    /** Function expression as sent to the backend, e.g. {@code uniq} or {@code topK(10)}. */
    public String expression() {
        if (function == AggregateFunction.TOP_K) {
            return function.functionName() + "(" + parameter + ")";
        }
        return function.functionName();
    }
}
