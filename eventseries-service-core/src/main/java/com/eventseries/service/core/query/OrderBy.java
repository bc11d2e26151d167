package com.eventseries.service.core.query;

public record OrderBy(String column, boolean descending) {

    public static OrderBy asc(String column) {
        return new OrderBy(column, false);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, true);
    }

    @Override
    public String toString() {
        return descending ? "-" + column : column;
    }
}
