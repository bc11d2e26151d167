package com.eventseries.service.core.reshape;

import com.eventseries.service.core.keys.KeySet;
import com.eventseries.service.core.query.QueryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** In-place transforms applied to a backend response, driven by the request's group-by order. */
public final class ResultReshaper {

    private ResultReshaper() {}

    /**
     * Inserts a zero for every expected key missing at each group-by level: a zero leaf at the last level, an
     * empty branch above it. Levels without expected keys are left as returned.
     *
     * @param groups nesting order of {@code node}, e.g. {@code [project_id, time]}
     * @param expectedKeys required keys per group-by column
     */
    public static void zerofill(ResultNode node, List<String> groups, Map<String, ? extends List<?>> expectedKeys) {
        if (groups.isEmpty() || !(node instanceof ResultNode.Branch branch)) {
            return;
        }
        String group = groups.get(0);
        List<String> subgroups = groups.subList(1, groups.size());
        List<?> expected = expectedKeys.get(group);
        if (expected != null) {
            for (Object key : expected) {
                if (!branch.children().containsKey(key)) {
                    branch.put(key, subgroups.isEmpty() ? ResultNode.Leaf.zero() : ResultNode.branch());
                }
            }
        }
        if (!subgroups.isEmpty()) {
            for (ResultNode child : branch.children().values()) {
                zerofill(child, subgroups, expectedKeys);
            }
        }
    }

    /**
     * Removes keys that were not requested. A nested key set scopes the allowed keys of deeper levels per
     * primary key; a flat one only constrains the first non-time level. Time levels are never trimmed.
     */
    public static void trim(ResultNode node, List<String> groups, KeySet keys) {
        if (groups.isEmpty() || !(node instanceof ResultNode.Branch branch)) {
            return;
        }
        String group = groups.get(0);
        List<String> subgroups = groups.subList(1, groups.size());
        for (Object key : new ArrayList<>(branch.children().keySet())) {
            if (isTimeGroup(group)) {
                trim(branch.get(key), subgroups, keys);
            } else if (keys.contains(key)) {
                Optional<KeySet> scoped = keys.scopeFor(key);
                if (scoped.isPresent()) {
                    trim(branch.get(key), subgroups, scoped.get());
                }
            } else {
                branch.children().remove(key);
            }
        }
    }

    /**
     * Collapses aggregate wrappers: any branch holding {@code aggregateAlias} is replaced by that value.
     *
     * @return the unnested node, which is a new leaf when {@code node} itself was a wrapper
     */
    public static ResultNode unnest(ResultNode node, String aggregateAlias) {
        if (!(node instanceof ResultNode.Branch branch)) {
            return node;
        }
        ResultNode wrapped = branch.get(aggregateAlias);
        if (wrapped != null) {
            return wrapped;
        }
        for (Map.Entry<Object, ResultNode> entry : branch.children().entrySet()) {
            entry.setValue(unnest(entry.getValue(), aggregateAlias));
        }
        return branch;
    }

    static boolean isTimeGroup(String group) {
        return QueryBuilder.TIME_COLUMN.equals(group) || QueryBuilder.TIME_ALIAS.equals(group);
    }
}
