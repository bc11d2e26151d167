package com.eventseries.service.core.keys;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts caller supplied keys into a canonical {@link KeySet}. */
public final class KeyNormalizer {

    private KeyNormalizer() {}

    /**
     * Accepts either a collection of primary keys or a map of primary key to a collection of secondary keys.
     *
     * @throws UnsupportedKeyShapeException for any other container or for non-scalar keys
     */
    public static KeySet normalize(Object keys) {
        if (keys instanceof KeySet keySet) {
            return keySet;
        }
        if (keys instanceof Map<?, ?> map) {
            Map<Object, List<Object>> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getValue() instanceof Collection<?> secondary)) {
                    throw UnsupportedKeyShapeException.of(entry.getValue());
                }
                nested.put(canonicalize(entry.getKey()), canonicalizeAll(secondary));
            }
            return new KeySet.Nested(nested);
        }
        if (keys instanceof Collection<?> collection) {
            return new KeySet.Flat(canonicalizeAll(collection));
        }
        throw UnsupportedKeyShapeException.of(keys);
    }

    /**
     * Coerces primary keys given as numeric strings to integers. Key level callers pass ids as strings; the
     * backend stores them as integers.
     */
    public static KeySet coercePrimaryToIntegers(KeySet keys) {
        if (keys instanceof KeySet.Flat flat) {
            return new KeySet.Flat(flat.keys().stream().map(KeyNormalizer::toLong).toList());
        }
        KeySet.Nested nested = (KeySet.Nested) keys;
        Map<Object, List<Object>> coerced = new LinkedHashMap<>();
        nested.keys().forEach((k, v) -> coerced.merge(toLong(k), v, KeyNormalizer::concat));
        return new KeySet.Nested(coerced);
    }

    /** Canonical scalar form: integral numbers become {@link Long}, character sequences become {@link String}. */
    public static Object canonicalize(Object key) {
        if (key instanceof Long) {
            return key;
        }
        if (key instanceof Integer || key instanceof Short || key instanceof Byte || key instanceof BigInteger) {
            return ((Number) key).longValue();
        }
        if (key instanceof CharSequence chars) {
            return chars.toString();
        }
        throw new UnsupportedKeyShapeException(
                "Unsupported key value: " + (key == null ? "null" : key.getClass().getName()));
    }

    private static List<Object> canonicalizeAll(Collection<?> keys) {
        List<Object> result = new ArrayList<>(keys.size());
        for (Object key : keys) {
            result.add(canonicalize(key));
        }
        return result;
    }

    private static Object toLong(Object key) {
        if (key instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new UnsupportedKeyShapeException("Key is not an integer: " + s);
            }
        }
        return key;
    }

    private static List<Object> concat(List<Object> a, List<Object> b) {
        List<Object> merged = new ArrayList<>(a);
        merged.addAll(b);
        return merged;
    }
}
