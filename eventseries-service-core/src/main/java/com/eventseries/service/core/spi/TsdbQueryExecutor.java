package com.eventseries.service.core.spi;

import com.eventseries.service.core.query.QueryRequest;
import com.eventseries.service.core.reshape.ResultNode;

/**
 * Runs one aggregation request against the analytics backend.
 *
 * <p>The response is nested one {@link ResultNode.Branch} level per {@link QueryRequest#groupBy()} column, in
 * order. Leaves hold the aggregate value; when {@link QueryRequest#wrapsAggregate()} is set each leaf is instead a
 * branch of projected column to value that includes the aggregate alias. A request without group-by columns
 * yields a single leaf or wrapper.
 *
 * <p>Failures surface as {@link BackendExecutionException} and are not retried by callers in this module.
 */
public interface TsdbQueryExecutor {

    ResultNode execute(QueryRequest request);
}
