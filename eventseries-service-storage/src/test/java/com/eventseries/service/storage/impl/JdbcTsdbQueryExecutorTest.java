package com.eventseries.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eventseries.service.core.model.Dataset;
import com.eventseries.service.core.query.AggregateFunction;
import com.eventseries.service.core.query.Aggregation;
import com.eventseries.service.core.query.OrderBy;
import com.eventseries.service.core.query.QueryRequest;
import com.eventseries.service.core.reshape.ResultNode;
import com.eventseries.service.core.spi.BackendExecutionException;
import com.eventseries.service.storage.config.StorageProperties;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcTsdbQueryExecutorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    private JdbcTsdbQueryExecutor executor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        StorageProperties properties = new StorageProperties();
        properties.setTables(Map.of(Dataset.OUTCOMES, "outcomes_daily"));
        executor = new JdbcTsdbQueryExecutor(jdbc, new ClickHouseSqlRenderer(properties));
    }

    @Test
    void executesRenderedSqlAndNestsRows() {
        when(jdbc.queryForList(anyString(), any(SqlParameterSource.class)))
                .thenReturn(List.of(
                        Map.<String, Object>of("org_id", 1L, "aggregate", 10L),
                        Map.<String, Object>of("org_id", 2L, "aggregate", 20L)));

        ResultNode result = executor.execute(request());

        assertThat(result)
                .isEqualTo(ResultNode.branch().put(1L, ResultNode.leaf(10L)).put(2L, ResultNode.leaf(20L)));
        verify(jdbc).queryForList(contains("FROM outcomes_daily"), any(SqlParameterSource.class));
    }

    @Test
    void wrapsDataAccessFailures() {
        when(jdbc.queryForList(anyString(), any(SqlParameterSource.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> executor.execute(request()))
                .isInstanceOf(BackendExecutionException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class)
                .satisfies(e -> assertThat(((BackendExecutionException) e).referrer()).isEqualTo("tsdb-modelid:500"));
    }

    private static QueryRequest request() {
        return new QueryRequest(
                Dataset.OUTCOMES,
                START,
                START.plusSeconds(86400),
                List.of("org_id"),
                List.of(OrderBy.asc("org_id")),
                List.of(),
                Map.of("org_id", List.of(1L, 2L)),
                List.of(new Aggregation(AggregateFunction.SUM, null, "quantity", "aggregate")),
                null,
                List.of(),
                86400,
                2,
                "tsdb-modelid:500",
                false);
    }
}
