package com.eventseries.service.core.query;

import com.eventseries.service.core.keys.KeySet;
import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.model.TsdbModel;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Caller facing query parameters shared by every {@code TsdbQueryService} operation.
 *
 * @param end window end, {@code null} means now
 * @param rollup requested rollup in seconds, {@code null} picks the optimal one
 * @param environmentId restricts the query to one environment when set
 * @param conditions extra filters layered on top of the model's own
 * @param useCache forwarded untouched to the backend executor
 * @param jitterSeed shifts bucket boundaries when set
 */
public record TsdbQuery(
        TsdbModel model,
        KeySet keys,
        Instant start,
        Instant end,
        Integer rollup,
        Long environmentId,
        List<Condition> conditions,
        boolean useCache,
        Long jitterSeed) {

    public TsdbQuery {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(start, "start");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static TsdbQuery of(TsdbModel model, Object keys, Instant start, Instant end) {
        return new TsdbQuery(model, KeySet.of(keys), start, end, null, null, List.of(), false, null);
    }

    public TsdbQuery withRollup(Integer rollup) {
        return new TsdbQuery(model, keys, start, end, rollup, environmentId, conditions, useCache, jitterSeed);
    }

    public TsdbQuery withEnvironment(Long environmentId) {
        return new TsdbQuery(model, keys, start, end, rollup, environmentId, conditions, useCache, jitterSeed);
    }

    public TsdbQuery withConditions(List<Condition> conditions) {
        return new TsdbQuery(model, keys, start, end, rollup, environmentId, conditions, useCache, jitterSeed);
    }

    public TsdbQuery withCache(boolean useCache) {
        return new TsdbQuery(model, keys, start, end, rollup, environmentId, conditions, useCache, jitterSeed);
    }

    public TsdbQuery withJitter(Long jitterSeed) {
        return new TsdbQuery(model, keys, start, end, rollup, environmentId, conditions, useCache, jitterSeed);
    }
}
