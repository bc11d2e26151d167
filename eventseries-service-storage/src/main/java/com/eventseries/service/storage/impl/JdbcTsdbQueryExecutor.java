package com.eventseries.service.storage.impl;

import com.eventseries.service.core.query.QueryRequest;
import com.eventseries.service.core.reshape.ResultNode;
import com.eventseries.service.core.spi.BackendExecutionException;
import com.eventseries.service.core.spi.TsdbQueryExecutor;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** {@link TsdbQueryExecutor} over a ClickHouse JDBC data source. */
@Slf4j
@RequiredArgsConstructor
public class JdbcTsdbQueryExecutor implements TsdbQueryExecutor {

    private final NamedParameterJdbcTemplate jdbc;
    private final ClickHouseSqlRenderer renderer;

    @Override
    public ResultNode execute(QueryRequest request) {
        RenderedQuery query = renderer.render(request);
        long started = System.nanoTime();
        List<Map<String, Object>> rows;
        try {
            rows = jdbc.queryForList(query.sql(), query.params());
        } catch (DataAccessException e) {
            log.warn("TSDB query {} failed: {}", request.referrer(), e.getMessage());
            throw new BackendExecutionException(
                    request.referrer(), "Backend query failed for " + request.referrer(), e);
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "TSDB query {} returned {} row(s) in {} ms",
                    request.referrer(),
                    rows.size(),
                    (System.nanoTime() - started) / 1_000_000);
        }
        return ResultNester.nest(rows, query.groupColumns(), query.valueColumns());
    }
}
