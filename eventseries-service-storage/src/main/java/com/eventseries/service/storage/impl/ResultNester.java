package com.eventseries.service.storage.impl;

import com.eventseries.service.core.reshape.ResultNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Folds flat result rows into a {@link ResultNode} tree nested by group-by column. */
public final class ResultNester {

    private ResultNester() {}

    /**
     * @param groupColumns nesting order
     * @param valueColumns columns placed at the leaves; a single column yields plain leaves, several yield a
     *     branch of column to value per leaf
     */
    public static ResultNode nest(List<Map<String, Object>> rows, List<String> groupColumns, List<String> valueColumns) {
        if (groupColumns.isEmpty()) {
            return rows.isEmpty() ? ResultNode.Leaf.zero() : leaf(rows.get(0), valueColumns);
        }
        ResultNode.Branch root = ResultNode.branch();
        int last = groupColumns.size() - 1;
        for (Map<String, Object> row : rows) {
            ResultNode.Branch cursor = root;
            for (int i = 0; i < last; i++) {
                cursor = cursor.branch(key(row.get(groupColumns.get(i))));
            }
            cursor.put(key(row.get(groupColumns.get(last))), leaf(row, valueColumns));
        }
        return root;
    }

    private static ResultNode leaf(Map<String, Object> row, List<String> valueColumns) {
        if (valueColumns.size() == 1) {
            return ResultNode.leaf(value(row.get(valueColumns.get(0))));
        }
        ResultNode.Branch wrapper = ResultNode.branch();
        for (String column : valueColumns) {
            wrapper.put(column, ResultNode.leaf(value(row.get(column))));
        }
        return wrapper;
    }

    /** Group values compare as {@link Long} or {@link String}, the same forms requested keys are held in. */
    static Object key(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Long || raw instanceof String) {
            return raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte || raw instanceof BigInteger) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigDecimal decimal && decimal.scale() <= 0) {
            return decimal.longValueExact();
        }
        return raw.toString();
    }

    static Object value(Object raw) {
        if (raw instanceof Array array) {
            try {
                return toKeys(Arrays.asList((Object[]) array.getArray()));
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to read array value", e);
            }
        }
        if (raw instanceof Object[] objects) {
            return toKeys(Arrays.asList(objects));
        }
        if (raw instanceof Collection<?> collection) {
            return toKeys(collection);
        }
        if (raw instanceof BigInteger big) {
            return big.longValue();
        }
        return raw;
    }

    private static List<Object> toKeys(Collection<?> values) {
        List<Object> keys = new ArrayList<>(values.size());
        for (Object v : values) {
            keys.add(key(v));
        }
        return keys;
    }
}
