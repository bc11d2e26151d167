package com.eventseries.service.core.query;

import com.eventseries.service.core.keys.KeyNormalizer;
import com.eventseries.service.core.keys.KeySet;
import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.model.Dataset;
import com.eventseries.service.core.model.ModelQuerySettings;
import com.eventseries.service.core.model.TsdbModel;
import com.eventseries.service.core.registry.ModelRegistry;
import com.eventseries.service.core.rollup.RollupPlanner;
import com.eventseries.service.core.rollup.RollupSeries;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates a model query into a single backend request.
 *
 * <p>Two backend shims live here and nowhere else: a bare {@code count()} over a model with an aggregate column
 * becomes {@code count()} grouped by that column, and models that cannot group on the native time column get an
 * explicit bucketing expression projected under {@link #TIME_ALIAS}.
 */
@Slf4j
public class QueryBuilder {

    public static final String TIME_COLUMN = "time";
    public static final String TIME_ALIAS = "time_t";
    public static final String ENVIRONMENT_COLUMN = "environment";
    public static final String AGGREGATE_ALIAS = "aggregate";

    // the only sub-hour rollup served for outcomes, answered from the raw table
    static final int RAW_OUTCOMES_ROLLUP = 10;

    private final ModelRegistry registry;
    private final RollupPlanner planner;
    private final int maxRows;

    public QueryBuilder(ModelRegistry registry, RollupPlanner planner, int maxRows) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.planner = Objects.requireNonNull(planner, "planner");
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        this.maxRows = maxRows;
    }

    public PlannedQuery build(
            TsdbQuery query, AggregateFunction function, Integer parameter, boolean groupOnModel, boolean groupOnTime) {
        Objects.requireNonNull(query, "query");
        TsdbModel model = query.model();
        ModelQuerySettings settings = registry.lookup(model);

        KeySet keys = model.isKeyLevel() ? KeyNormalizer.coercePrimaryToIntegers(query.keys()) : query.keys();

        RollupSeries series = planner.plan(query.start(), query.end(), query.rollup());
        series = planner.applyJitter(series, query.start(), query.jitterSeed());
        int rollup = series.rollup();

        Dataset dataset = settings.dataset() == Dataset.OUTCOMES && rollup == RAW_OUTCOMES_ROLLUP
                ? Dataset.OUTCOMES_RAW
                : settings.dataset();

        boolean manualTime = model.requiresManualGroupOnTime();
        String timeColumn = manualTime ? TIME_ALIAS : TIME_COLUMN;
        String modelGroup = settings.groupBy();
        String aggregateColumn = settings.aggregateColumn();

        List<String> groupBy = new ArrayList<>();
        if (groupOnModel && modelGroup != null) {
            groupBy.add(modelGroup);
        }
        if (groupOnTime) {
            groupBy.add(timeColumn);
        }
        if (function == AggregateFunction.COUNT && aggregateColumn != null) {
            // COUNT(column) is answered as COUNT() GROUP BY column
            groupBy.add(aggregateColumn);
            aggregateColumn = null;
        }

        Map<String, List<Object>> filterKeys = new LinkedHashMap<>();
        if (modelGroup != null) {
            filterKeys.put(modelGroup, keys.primaryKeys());
        }
        if (settings.aggregateColumn() != null && keys.secondaryKeys() != null) {
            filterKeys.put(settings.aggregateColumn(), keys.secondaryKeys());
        }
        if (query.environmentId() != null) {
            filterKeys.put(ENVIRONMENT_COLUMN, List.of(query.environmentId()));
        }

        List<Aggregation> aggregations =
                List.of(new Aggregation(function, parameter, aggregateColumn, AGGREGATE_ALIAS));
        TimeBucketExpression timeBucket = groupOnTime && manualTime ? new TimeBucketExpression(rollup, TIME_ALIAS) : null;

        List<Condition> conditions = new ArrayList<>(query.conditions());
        conditions.addAll(settings.conditions());

        List<OrderBy> orderBy = new ArrayList<>();
        if (groupOnTime) {
            orderBy.add(OrderBy.desc(timeColumn));
        }
        if (groupOnModel && modelGroup != null) {
            orderBy.add(OrderBy.asc(modelGroup));
        }

        int limit = (int) Math.min(maxRows, (long) keys.size() * series.size());

        QueryRequest request = new QueryRequest(
                dataset,
                series.start(),
                series.end(),
                groupBy,
                orderBy,
                conditions,
                filterKeys,
                aggregations,
                timeBucket,
                settings.selectedColumns(),
                rollup,
                limit,
                "tsdb-modelid:" + model.id(),
                query.useCache());

        Map<String, List<Object>> expectedKeys = new LinkedHashMap<>(filterKeys);
        if (groupOnTime) {
            expectedKeys.put(timeColumn, new ArrayList<>(series.buckets()));
        }

        log.debug(
                "Built {} request for {}: dataset={} groupBy={} rollup={} limit={}",
                function,
                model,
                dataset,
                groupBy,
                rollup,
                limit);
        return new PlannedQuery(request, series, expectedKeys, keys, AGGREGATE_ALIAS);
    }
}
