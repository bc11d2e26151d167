package com.eventseries.service.core.query;

import com.eventseries.service.core.keys.KeySet;
import com.eventseries.service.core.rollup.RollupSeries;
import java.util.List;
import java.util.Map;

/**
 * A built request together with what is needed to reshape its response.
 *
 * @param expectedKeys keys every group-by level must contain after zero-filling, by column
 * @param keys the requested keys, used to trim the response
 */
public record PlannedQuery(
        QueryRequest request,
        RollupSeries series,
        Map<String, List<Object>> expectedKeys,
        KeySet keys,
        String aggregateAlias) {

    public List<String> groupBy() {
        return request.groupBy();
    }

    /** No primary keys were requested, so the backend must not be called. */
    public boolean isEmpty() {
        return keys.isEmpty();
    }
}
