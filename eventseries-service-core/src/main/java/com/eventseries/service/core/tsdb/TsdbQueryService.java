package com.eventseries.service.core.tsdb;

import com.eventseries.service.core.model.ModelQuerySettings;
import com.eventseries.service.core.query.AggregateFunction;
import com.eventseries.service.core.query.PlannedQuery;
import com.eventseries.service.core.query.QueryBuilder;
import com.eventseries.service.core.query.TsdbQuery;
import com.eventseries.service.core.registry.ModelRegistry;
import com.eventseries.service.core.reshape.ResultNode;
import com.eventseries.service.core.reshape.ResultReshaper;
import com.eventseries.service.core.spi.TsdbQueryExecutor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read operations over the analytics store. Each call builds one backend request, executes it (or skips the
 * backend entirely when no keys were requested) and reshapes the response: zero-filled for every requested key
 * and bucket, trimmed of keys nobody asked for.
 */
@Slf4j
@RequiredArgsConstructor
public class TsdbQueryService {

    public static final int DEFAULT_MOST_FREQUENT_LIMIT = 10;

    private static final Comparator<SeriesPoint<?>> BY_TIMESTAMP = Comparator.comparingLong(SeriesPoint::timestamp);

    private final ModelRegistry registry;
    private final QueryBuilder queryBuilder;
    private final TsdbQueryExecutor executor;

    /** Event counts (or summed outcome quantities) per key and bucket. */
    public Map<Object, List<SeriesPoint<Long>>> getRange(TsdbQuery query) {
        ModelQuerySettings settings = registry.lookup(query.model());
        AggregateFunction function =
                settings.dataset().isOutcomes() ? AggregateFunction.SUM : AggregateFunction.COUNT;
        ResultNode result = getData(query, function, null, true, true);
        return perKey(result, node -> series(node, ResultNode.Leaf::longValue));
    }

    public Map<Object, List<SeriesPoint<Long>>> getDistinctCountsSeries(TsdbQuery query) {
        ResultNode result = getData(query, AggregateFunction.UNIQ, null, true, true);
        return perKey(result, node -> series(node, ResultNode.Leaf::longValue));
    }

    public Map<Object, Long> getDistinctCountsTotals(TsdbQuery query) {
        ResultNode result = getData(query, AggregateFunction.UNIQ, null, true, false);
        return perKey(result, TsdbQueryService::longValue);
    }

    /** Distinct count across all keys together. */
    public long getDistinctCountsUnion(TsdbQuery query) {
        ResultNode result = getData(query, AggregateFunction.UNIQ, null, false, false);
        return longValue(result);
    }

    public Map<Object, List<ScoredItem>> getMostFrequent(TsdbQuery query) {
        return getMostFrequent(query, DEFAULT_MOST_FREQUENT_LIMIT);
    }

    /**
     * Most frequent items per key, most frequent first. Scores count up from 1.0 for the least frequent item, so a
     * backend answer of {@code [c, b, a]} comes back as {@code c=3.0, b=2.0, a=1.0} in that order.
     */
    public Map<Object, List<ScoredItem>> getMostFrequent(TsdbQuery query, int limit) {
        ResultNode result = getData(query, AggregateFunction.TOP_K, limit, true, false);
        return perKey(result, node -> {
            List<ScoredItem> scored = new ArrayList<>();
            Map<Object, Double> scores = score(topItems(node));
            scores.forEach((item, score) -> scored.add(new ScoredItem(item, score)));
            Collections.reverse(scored);
            return scored;
        });
    }

    public Map<Object, List<SeriesPoint<Map<Object, Double>>>> getMostFrequentSeries(TsdbQuery query) {
        return getMostFrequentSeries(query, DEFAULT_MOST_FREQUENT_LIMIT);
    }

    public Map<Object, List<SeriesPoint<Map<Object, Double>>>> getMostFrequentSeries(TsdbQuery query, int limit) {
        ResultNode result = getData(query, AggregateFunction.TOP_K, limit, true, true);
        return perKey(result, node -> series(node, leaf -> score(topItems(leaf))));
    }

    /** Per key and bucket, the count of each secondary key of the model. */
    public Map<Object, List<SeriesPoint<Map<Object, Long>>>> getFrequencySeries(TsdbQuery query) {
        ResultNode result = getData(query, AggregateFunction.COUNT, null, true, true);
        return perKey(result, node -> {
            List<SeriesPoint<Map<Object, Long>>> points = new ArrayList<>();
            children(node).forEach((ts, counts) -> points.add(new SeriesPoint<>(timestamp(ts), counts(counts))));
            points.sort(BY_TIMESTAMP);
            return points;
        });
    }

    public Map<Object, Map<Object, Long>> getFrequencyTotals(TsdbQuery query) {
        ResultNode result = getData(query, AggregateFunction.COUNT, null, true, false);
        return perKey(result, TsdbQueryService::counts);
    }

    /**
     * Builds, executes and reshapes a single request.
     *
     * @param groupOnModel group by the model's primary column
     * @param groupOnTime group by bucket
     */
    public ResultNode getData(
            TsdbQuery query, AggregateFunction function, Integer parameter, boolean groupOnModel, boolean groupOnTime) {
        Objects.requireNonNull(query, "query");
        PlannedQuery planned = queryBuilder.build(query, function, parameter, groupOnModel, groupOnTime);

        ResultNode result;
        if (planned.isEmpty()) {
            log.debug("No keys requested for {}, skipping backend query", query.model());
            result = ResultNode.branch();
        } else {
            result = executor.execute(planned.request());
        }

        ResultReshaper.zerofill(result, planned.groupBy(), planned.expectedKeys());
        ResultReshaper.trim(result, planned.groupBy(), planned.keys());
        if (planned.request().wrapsAggregate()) {
            result = ResultReshaper.unnest(result, planned.aggregateAlias());
        }
        return result;
    }

    private static <V> Map<Object, V> perKey(ResultNode result, Function<ResultNode, V> transform) {
        Map<Object, V> converted = new LinkedHashMap<>();
        children(result).forEach((key, node) -> converted.put(key, transform.apply(node)));
        return converted;
    }

    private static <V> List<SeriesPoint<V>> series(ResultNode node, Function<ResultNode.Leaf, V> value) {
        List<SeriesPoint<V>> points = new ArrayList<>();
        children(node).forEach((ts, child) -> points.add(new SeriesPoint<>(timestamp(ts), value.apply(asLeaf(child)))));
        points.sort(BY_TIMESTAMP);
        return points;
    }

    private static Map<Object, Long> counts(ResultNode node) {
        Map<Object, Long> counts = new LinkedHashMap<>();
        children(node).forEach((key, child) -> counts.put(key, longValue(child)));
        return counts;
    }

    /** Scores items given most frequent first; insertion order of the result is least frequent first. */
    private static Map<Object, Double> score(List<?> mostFrequentFirst) {
        List<Object> ascending = new ArrayList<>(mostFrequentFirst);
        Collections.reverse(ascending);
        Map<Object, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < ascending.size(); i++) {
            scores.put(ascending.get(i), (double) (i + 1));
        }
        return scores;
    }

    private static List<?> topItems(ResultNode node) {
        if (node instanceof ResultNode.Leaf leaf && leaf.value() instanceof List<?> items) {
            return items;
        }
        return List.of();
    }

    private static Map<Object, ResultNode> children(ResultNode node) {
        if (node instanceof ResultNode.Branch branch) {
            return branch.children();
        }
        return Map.of();
    }

    private static ResultNode.Leaf asLeaf(ResultNode node) {
        return node instanceof ResultNode.Leaf leaf ? leaf : ResultNode.Leaf.zero();
    }

    private static long longValue(ResultNode node) {
        return asLeaf(node).longValue();
    }

    private static long timestamp(Object key) {
        if (key instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Time bucket key is not numeric: " + key);
    }
}
