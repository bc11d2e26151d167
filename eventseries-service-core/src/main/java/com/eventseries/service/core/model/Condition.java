package com.eventseries.service.core.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable filter predicate applied to a backend request. Collection values are copied on construction so a
 * condition can be shared by every request built from the same model settings.
 */
public record Condition(String column, Operator operator, Object value) {

    public Condition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        if (value instanceof Collection<?> values) {
            value = List.copyOf(values);
        }
        if (operator.multiValued() && !(value instanceof List<?>)) {
            throw new IllegalArgumentException("Operator " + operator.symbol() + " requires a collection value");
        }
    }

    public static Condition eq(String column, Object value) {
        return new Condition(column, Operator.EQ, value);
    }

    public static Condition neq(String column, Object value) {
        return new Condition(column, Operator.NEQ, value);
    }

    public static Condition in(String column, Collection<?> values) {
        return new Condition(column, Operator.IN, values);
    }

    public enum Operator {
        EQ("=", false),
        NEQ("!=", false),
        IN("IN", true),
        NOT_IN("NOT IN", true),
        GTE(">=", false),
        LT("<", false);

        private final String symbol;
        private final boolean multiValued;

        Operator(String symbol, boolean multiValued) {
            this.symbol = symbol;
            this.multiValued = multiValued;
        }

        public String symbol() {
            return symbol;
        }

        public boolean multiValued() {
            return multiValued;
        }
    }
}
