package com.eventseries.service.core.query;

public enum AggregateFunction {
    COUNT("count()"),
    SUM("sum"),
    UNIQ("uniq"),
    TOP_K("topK");

    private final String name;

    AggregateFunction(String name) {
        this.name = name;
    }

    public String functionName() {
        return name;
    }
}
