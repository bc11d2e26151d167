package com.eventseries.service.core.registry;

import com.eventseries.service.core.model.ColumnExpansion;
import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.model.DataCategory;
import com.eventseries.service.core.model.Dataset;
import com.eventseries.service.core.model.FilterReason;
import com.eventseries.service.core.model.ModelQuerySettings;
import com.eventseries.service.core.model.Outcome;
import com.eventseries.service.core.model.TsdbModel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable mapping from {@link TsdbModel} to the settings used to query it.
 *
 * <p>The table is assembled from three disjoint parts: one filtered-outcome model per {@link FilterReason},
 * the organization/project/key outcome totals, and the event based models. Built once and shared by every
 * caller without locking.
 */
@Slf4j
public final class ModelRegistry {

    static final Condition EVENTS_TYPE_CONDITION = Condition.neq("type", "transaction");
    static final Condition OUTCOMES_CATEGORY_CONDITION =
            Condition.in("category", DataCategory.errorCategoryCodes());
    static final List<Integer> PROFILE_OCCURRENCE_TYPES = List.of(2000, 2001, 2002, 2003, 2004, 2005, 2006, 2007);
    static final Condition PROFILE_OCCURRENCE_CONDITION =
            Condition.in("occurrence_type_id", PROFILE_OCCURRENCE_TYPES);

    // client discards and invalid outcomes are left out so totals line up with org stats
    static final List<Integer> TOTAL_RECEIVED_OUTCOMES =
            List.of(Outcome.ACCEPTED.code(), Outcome.FILTERED.code(), Outcome.RATE_LIMITED.code());

    private static final String TAG_RELEASE = "tags[release]";
    private static final String TAG_USER = "tags[user]";

    private final Map<TsdbModel, ModelQuerySettings> settings;

    private ModelRegistry(Map<TsdbModel, ModelQuerySettings> settings) {
        this.settings = Collections.unmodifiableMap(settings);
    }

    public static ModelRegistry createDefault() {
        Map<TsdbModel, ModelQuerySettings> table = new EnumMap<>(TsdbModel.class);
        merge(table, filteredOutcomeModels());
        merge(table, outcomeTotalModels());
        merge(table, eventModels());
        log.info("Model registry assembled with {} model(s)", table.size());
        return new ModelRegistry(table);
    }

    /** Returns the settings for {@code model} or fails with {@link UnsupportedModelException}. */
    public ModelQuerySettings lookup(TsdbModel model) {
        Objects.requireNonNull(model, "model");
        ModelQuerySettings found = settings.get(model);
        if (found == null) {
            throw new UnsupportedModelException(model);
        }
        return found;
    }

    public boolean supports(TsdbModel model) {
        return settings.containsKey(model);
    }

    public Map<TsdbModel, ModelQuerySettings> asMap() {
        return settings;
    }

    private static void merge(Map<TsdbModel, ModelQuerySettings> target, Map<TsdbModel, ModelQuerySettings> part) {
        for (Map.Entry<TsdbModel, ModelQuerySettings> entry : part.entrySet()) {
            if (target.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                throw new IllegalStateException("Model registered twice: " + entry.getKey());
            }
        }
    }

    static Map<TsdbModel, ModelQuerySettings> filteredOutcomeModels() {
        Map<TsdbModel, ModelQuerySettings> table = new EnumMap<>(TsdbModel.class);
        for (FilterReason reason : FilterReason.values()) {
            table.put(
                    reason.model(),
                    outcomes(
                            "project_id",
                            Condition.eq("reason", reason.code()),
                            Condition.in("outcome", TOTAL_RECEIVED_OUTCOMES)));
        }
        return table;
    }

    static Map<TsdbModel, ModelQuerySettings> outcomeTotalModels() {
        Condition received = Condition.in("outcome", TOTAL_RECEIVED_OUTCOMES);
        Condition rejected = Condition.eq("outcome", Outcome.RATE_LIMITED.code());
        Condition blacklisted = Condition.eq("outcome", Outcome.FILTERED.code());

        Map<TsdbModel, ModelQuerySettings> table = new EnumMap<>(TsdbModel.class);
        table.put(TsdbModel.ORGANIZATION_TOTAL_RECEIVED, outcomes("org_id", received));
        table.put(TsdbModel.ORGANIZATION_TOTAL_REJECTED, outcomes("org_id", rejected));
        table.put(TsdbModel.ORGANIZATION_TOTAL_BLACKLISTED, outcomes("org_id", blacklisted));
        table.put(TsdbModel.PROJECT_TOTAL_RECEIVED, outcomes("project_id", received));
        table.put(TsdbModel.PROJECT_TOTAL_REJECTED, outcomes("project_id", rejected));
        table.put(TsdbModel.PROJECT_TOTAL_BLACKLISTED, outcomes("project_id", blacklisted));
        table.put(TsdbModel.KEY_TOTAL_RECEIVED, outcomes("key_id", received));
        table.put(TsdbModel.KEY_TOTAL_REJECTED, outcomes("key_id", rejected));
        table.put(TsdbModel.KEY_TOTAL_BLACKLISTED, outcomes("key_id", blacklisted));
        return table;
    }

    static Map<TsdbModel, ModelQuerySettings> eventModels() {
        List<Condition> events = List.of(EVENTS_TYPE_CONDITION);
        List<Condition> profiles = List.of(PROFILE_OCCURRENCE_CONDITION);
        List<ColumnExpansion> groupIds = List.of(ColumnExpansion.arrayJoin("group_ids", "group_id"));

        Map<TsdbModel, ModelQuerySettings> table = new EnumMap<>(TsdbModel.class);
        table.put(TsdbModel.PROJECT, new ModelQuerySettings(Dataset.EVENTS, "project_id", null, events));
        table.put(TsdbModel.GROUP, new ModelQuerySettings(Dataset.EVENTS, "group_id", null, events));
        table.put(
                TsdbModel.GROUP_PERFORMANCE,
                new ModelQuerySettings(Dataset.TRANSACTIONS, "group_id", null, List.of(), groupIds));
        table.put(
                TsdbModel.GROUP_PROFILING, new ModelQuerySettings(Dataset.ISSUE_PLATFORM, "group_id", null, profiles));
        table.put(TsdbModel.RELEASE, new ModelQuerySettings(Dataset.EVENTS, TAG_RELEASE, null, events));
        table.put(
                TsdbModel.USERS_AFFECTED_BY_GROUP,
                new ModelQuerySettings(Dataset.EVENTS, "group_id", TAG_USER, events));
        table.put(
                TsdbModel.USERS_AFFECTED_BY_PERF_GROUP,
                new ModelQuerySettings(Dataset.TRANSACTIONS, "group_id", TAG_USER, List.of(), groupIds));
        table.put(
                TsdbModel.USERS_AFFECTED_BY_PROFILE_GROUP,
                new ModelQuerySettings(Dataset.ISSUE_PLATFORM, "group_id", TAG_USER, profiles));
        table.put(
                TsdbModel.USERS_AFFECTED_BY_PROJECT,
                new ModelQuerySettings(Dataset.EVENTS, "project_id", TAG_USER, events));
        table.put(
                TsdbModel.FREQUENT_ENVIRONMENTS_BY_GROUP,
                new ModelQuerySettings(Dataset.EVENTS, "group_id", "environment", events));
        table.put(
                TsdbModel.FREQUENT_RELEASES_BY_GROUP,
                new ModelQuerySettings(Dataset.EVENTS, "group_id", TAG_RELEASE, events));
        table.put(
                TsdbModel.FREQUENT_ISSUES_BY_PROJECT,
                new ModelQuerySettings(Dataset.EVENTS, "project_id", "group_id", events));
        return table;
    }

    private static ModelQuerySettings outcomes(String groupBy, Condition... conditions) {
        List<Condition> all = new java.util.ArrayList<>(List.of(conditions));
        all.add(OUTCOMES_CATEGORY_CONDITION);
        return new ModelQuerySettings(Dataset.OUTCOMES, groupBy, "quantity", all);
    }
}
