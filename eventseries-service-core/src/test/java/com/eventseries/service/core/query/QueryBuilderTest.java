package com.eventseries.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.model.Dataset;
import com.eventseries.service.core.model.TsdbModel;
import com.eventseries.service.core.registry.ModelRegistry;
import com.eventseries.service.core.registry.UnsupportedModelException;
import com.eventseries.service.core.rollup.RollupPlanner;
import com.eventseries.service.core.rollup.RollupSpec;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryBuilderTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T05:00:00Z");

    private ModelRegistry registry;
    private QueryBuilder builder;

    @BeforeEach
    void setUp() {
        registry = ModelRegistry.createDefault();
        RollupPlanner planner = new RollupPlanner(
                List.of(new RollupSpec(10, 360), new RollupSpec(3600, 168), new RollupSpec(86400, 90)),
                Clock.fixed(END, ZoneOffset.UTC));
        builder = new QueryBuilder(registry, planner, 10000);
    }

    @Test
    void countOverAggregateColumnGroupsByThatColumnInstead() {
        Map<Object, List<Object>> keys = new LinkedHashMap<>();
        keys.put(1, List.of(10, 11));
        keys.put(2, List.of(12));

        PlannedQuery planned = builder.build(
                TsdbQuery.of(TsdbModel.FREQUENT_ISSUES_BY_PROJECT, keys, START, END).withRollup(3600),
                AggregateFunction.COUNT,
                null,
                true,
                false);

        QueryRequest request = planned.request();
        assertThat(request.groupBy()).containsExactly("project_id", "group_id");
        assertThat(request.aggregations())
                .containsExactly(new Aggregation(AggregateFunction.COUNT, null, null, QueryBuilder.AGGREGATE_ALIAS));
        assertThat(request.filterKeys())
                .containsEntry("project_id", List.of(1L, 2L))
                .containsEntry("group_id", List.of(10L, 11L, 12L));
        assertThat(request.orderBy()).containsExactly(OrderBy.asc("project_id"));
    }

    @Test
    void otherAggregatesTargetTheAggregateColumn() {
        PlannedQuery planned = builder.build(
                TsdbQuery.of(TsdbModel.USERS_AFFECTED_BY_GROUP, List.of(5), START, END).withRollup(3600),
                AggregateFunction.UNIQ,
                null,
                true,
                true);

        assertThat(planned.groupBy()).containsExactly("group_id", "time");
        assertThat(planned.request().aggregations().get(0).column()).isEqualTo("tags[user]");
        assertThat(planned.request().filterKeys()).containsOnlyKeys("group_id");
        assertThat(planned.request().orderBy()).containsExactly(OrderBy.desc("time"), OrderBy.asc("group_id"));
        assertThat(planned.expectedKeys().get("time")).hasSize(6);
    }

    @Test
    void tenSecondOutcomesQueriesUseTheRawDataset() {
        TsdbQuery query = TsdbQuery.of(TsdbModel.PROJECT_TOTAL_RECEIVED, List.of(1), START, START.plusSeconds(60));

        assertThat(builder.build(query.withRollup(10), AggregateFunction.SUM, null, true, true)
                        .request()
                        .dataset())
                .isEqualTo(Dataset.OUTCOMES_RAW);
        assertThat(builder.build(query.withRollup(3600), AggregateFunction.SUM, null, true, true)
                        .request()
                        .dataset())
                .isEqualTo(Dataset.OUTCOMES);
        assertThat(builder.build(
                                TsdbQuery.of(TsdbModel.PROJECT, List.of(1), START, START.plusSeconds(60))
                                        .withRollup(10),
                                AggregateFunction.COUNT,
                                null,
                                true,
                                true)
                        .request()
                        .dataset())
                .isEqualTo(Dataset.EVENTS);
    }

    @Test
    void profilingModelsBucketTimeExplicitly() {
        PlannedQuery planned = builder.build(
                TsdbQuery.of(TsdbModel.GROUP_PROFILING, List.of(3), START, END).withRollup(3600),
                AggregateFunction.COUNT,
                null,
                true,
                true);

        QueryRequest request = planned.request();
        assertThat(request.groupBy()).containsExactly("group_id", QueryBuilder.TIME_ALIAS);
        assertThat(request.orderBy()).containsExactly(OrderBy.desc(QueryBuilder.TIME_ALIAS), OrderBy.asc("group_id"));
        assertThat(request.timeBucket()).isEqualTo(new TimeBucketExpression(3600, QueryBuilder.TIME_ALIAS));
        assertThat(request.timeBucket().startOfFunction()).contains("toStartOfHour");
        assertThat(request.wrapsAggregate()).isTrue();
        assertThat(planned.expectedKeys()).containsKey(QueryBuilder.TIME_ALIAS);
    }

    @Test
    void profilingTotalsNeedNoTimeBucket() {
        PlannedQuery planned = builder.build(
                TsdbQuery.of(TsdbModel.GROUP_PROFILING, List.of(3), START, END).withRollup(3600),
                AggregateFunction.COUNT,
                null,
                true,
                false);

        assertThat(planned.request().timeBucket()).isNull();
        assertThat(planned.request().wrapsAggregate()).isFalse();
    }

    @Test
    void irregularRollupHasNoStartOfFunction() {
        assertThat(new TimeBucketExpression(7200, QueryBuilder.TIME_ALIAS).startOfFunction()).isEmpty();
        assertThat(new TimeBucketExpression(60, QueryBuilder.TIME_ALIAS).startOfFunction()).contains("toStartOfMinute");
        assertThat(new TimeBucketExpression(86400, QueryBuilder.TIME_ALIAS).startOfFunction()).contains("toDate");
    }

    @Test
    void limitIsKeysTimesBucketsCappedAtMaxRows() {
        TsdbQuery query = TsdbQuery.of(TsdbModel.PROJECT, List.of(1, 2), START, END).withRollup(3600);

        assertThat(builder.build(query, AggregateFunction.COUNT, null, true, true).request().limit())
                .isEqualTo(12);

        RollupPlanner planner = new RollupPlanner(List.of(new RollupSpec(3600, 168)), Clock.systemUTC());
        QueryBuilder capped = new QueryBuilder(registry, planner, 5);
        assertThat(capped.build(query, AggregateFunction.COUNT, null, true, true).request().limit())
                .isEqualTo(5);
    }

    @Test
    void callerConditionsAreNotMutatedAndModelConditionsFollowThem() {
        List<Condition> callerConditions = new ArrayList<>(List.of(Condition.eq("level", "error")));
        TsdbQuery query = TsdbQuery.of(TsdbModel.PROJECT, List.of(1), START, END)
                .withRollup(3600)
                .withConditions(callerConditions);

        QueryRequest first = builder.build(query, AggregateFunction.COUNT, null, true, true).request();
        QueryRequest second = builder.build(query, AggregateFunction.COUNT, null, true, true).request();

        assertThat(first.conditions())
                .containsExactly(Condition.eq("level", "error"), Condition.neq("type", "transaction"));
        assertThat(second.conditions()).isEqualTo(first.conditions());
        assertThat(callerConditions).hasSize(1);
        assertThat(registry.lookup(TsdbModel.PROJECT).conditions()).hasSize(1);
    }

    @Test
    void environmentAndCacheFlagArePassedThrough() {
        TsdbQuery query = TsdbQuery.of(TsdbModel.GROUP, List.of(1), START, END)
                .withRollup(3600)
                .withEnvironment(7L)
                .withCache(true);

        QueryRequest request = builder.build(query, AggregateFunction.COUNT, null, true, false).request();

        assertThat(request.filterKeys()).containsEntry(QueryBuilder.ENVIRONMENT_COLUMN, List.of(7L));
        assertThat(request.useCache()).isTrue();
        assertThat(request.referrer()).isEqualTo("tsdb-modelid:4");
    }

    @Test
    void unionDoesNotGroupOnModelButStillFiltersAndConditions() {
        QueryRequest request = builder.build(
                        TsdbQuery.of(TsdbModel.USERS_AFFECTED_BY_GROUP, List.of(1, 2), START, END)
                                .withRollup(3600),
                        AggregateFunction.UNIQ,
                        null,
                        false,
                        false)
                .request();

        assertThat(request.groupBy()).isEmpty();
        assertThat(request.orderBy()).isEmpty();
        assertThat(request.filterKeys()).containsEntry("group_id", List.of(1L, 2L));
        assertThat(request.conditions()).contains(Condition.neq("type", "transaction"));
    }

    @Test
    void keyLevelModelsCoerceStringKeys() {
        PlannedQuery planned = builder.build(
                TsdbQuery.of(TsdbModel.KEY_TOTAL_RECEIVED, List.of("1", "2", "1"), START, END).withRollup(3600),
                AggregateFunction.SUM,
                null,
                true,
                true);

        assertThat(planned.request().filterKeys()).containsEntry("key_id", List.of(1L, 2L));
        assertThat(planned.keys().contains(1L)).isTrue();
    }

    @Test
    void bucketsQueryTheFullLastBucket() {
        QueryRequest request = builder.build(
                        TsdbQuery.of(
                                        TsdbModel.PROJECT,
                                        List.of(1),
                                        Instant.parse("2024-01-01T00:00:05Z"),
                                        Instant.parse("2024-01-01T01:00:00Z"))
                                .withRollup(3600),
                        AggregateFunction.COUNT,
                        null,
                        true,
                        true)
                .request();

        assertThat(request.start()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(request.end()).isEqualTo(Instant.parse("2024-01-01T01:00:00Z"));
        assertThat(request.limit()).isEqualTo(1);
    }

    @Test
    void unknownModelFailsFast() {
        TsdbQuery query = TsdbQuery.of(TsdbModel.PROJECT_TOTAL_FORWARDED, List.of(1), START, END);

        assertThatThrownBy(() -> builder.build(query, AggregateFunction.SUM, null, true, true))
                .isInstanceOf(UnsupportedModelException.class);
    }

    @Test
    void topKRequiresALimit() {
        assertThatThrownBy(() -> new Aggregation(AggregateFunction.TOP_K, null, "environment", "aggregate"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Aggregation(AggregateFunction.TOP_K, 5, "environment", "aggregate").expression())
                .isEqualTo("topK(5)");
    }
}
