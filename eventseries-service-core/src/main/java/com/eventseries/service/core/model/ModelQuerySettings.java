package com.eventseries.service.core.model;

import java.util.List;
import java.util.Objects;

/**
 * How a {@link TsdbModel} is answered by the backend.
 *
 * @param dataset table family to query
 * @param groupBy primary grouping column, {@code null} when the model has none
 * @param aggregateColumn column the aggregate function applies to, {@code null} for plain row counts
 * @param conditions mandatory filters always applied for this model
 * @param selectedColumns expansions projected explicitly, empty unless the grouping column is a collection
 */
public record ModelQuerySettings(
        Dataset dataset,
        String groupBy,
        String aggregateColumn,
        List<Condition> conditions,
        List<ColumnExpansion> selectedColumns) {

    public ModelQuerySettings {
        Objects.requireNonNull(dataset, "dataset");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        selectedColumns = selectedColumns == null ? List.of() : List.copyOf(selectedColumns);
    }

    public ModelQuerySettings(Dataset dataset, String groupBy, String aggregateColumn, List<Condition> conditions) {
        this(dataset, groupBy, aggregateColumn, conditions, List.of());
    }

    public boolean hasSelectedColumns() {
        return !selectedColumns.isEmpty();
    }
}
