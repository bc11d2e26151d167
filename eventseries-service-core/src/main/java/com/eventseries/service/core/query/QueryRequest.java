package com.eventseries.service.core.query;

import com.eventseries.service.core.model.ColumnExpansion;
import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.model.Dataset;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A single aggregation request handed to the backend executor. */
public record QueryRequest(
        Dataset dataset,
        Instant start,
        Instant end,
        List<String> groupBy,
        List<OrderBy> orderBy,
        List<Condition> conditions,
        Map<String, List<Object>> filterKeys,
        List<Aggregation> aggregations,
        TimeBucketExpression timeBucket,
        List<ColumnExpansion> selectedColumns,
        int rollup,
        int limit,
        String referrer,
        boolean useCache) {

    public QueryRequest {
        groupBy = List.copyOf(groupBy);
        orderBy = List.copyOf(orderBy);
        conditions = List.copyOf(conditions);
        filterKeys = Collections.unmodifiableMap(new LinkedHashMap<>(filterKeys));
        aggregations = List.copyOf(aggregations);
        selectedColumns = selectedColumns == null ? List.of() : List.copyOf(selectedColumns);
    }

    /** Whether the backend wraps each aggregate value together with other projected columns. */
    public boolean wrapsAggregate() {
        return timeBucket != null || !selectedColumns.isEmpty();
    }
}
