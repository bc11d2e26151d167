package com.eventseries.service.core.keys;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keys requested from a query: either a flat collection of primary keys or a mapping from each primary key to
 * the secondary keys wanted for it. Scalar keys are canonical ({@link Long} or {@link String}).
 */
public sealed interface KeySet permits KeySet.Flat, KeySet.Nested {

    /** Primary keys in request order, without duplicates. */
    List<Object> primaryKeys();

    /** Union of all secondary keys, or {@code null} for a flat key set. */
    List<Object> secondaryKeys();

    boolean contains(Object key);

    /** Keys allowed one level below {@code key}; empty when the set does not scope deeper levels. */
    Optional<KeySet> scopeFor(Object key);

    default boolean isEmpty() {
        return primaryKeys().isEmpty();
    }

    default int size() {
        return primaryKeys().size();
    }

    /** Normalizes an arbitrary caller supplied key container. */
    static KeySet of(Object keys) {
        return KeyNormalizer.normalize(keys);
    }

    static KeySet flat(Collection<?> keys) {
        return KeyNormalizer.normalize(keys);
    }

    static KeySet nested(Map<?, ? extends Collection<?>> keys) {
        return KeyNormalizer.normalize(keys);
    }

    record Flat(List<Object> keys) implements KeySet {

        public Flat {
            keys = List.copyOf(new LinkedHashSet<>(keys));
        }

        @Override
        public List<Object> primaryKeys() {
            return keys;
        }

        @Override
        public List<Object> secondaryKeys() {
            return null;
        }

        @Override
        public boolean contains(Object key) {
            return keys.contains(key);
        }

        @Override
        public Optional<KeySet> scopeFor(Object key) {
            return Optional.empty();
        }
    }

    record Nested(Map<Object, List<Object>> keys) implements KeySet {

        public Nested {
            Map<Object, List<Object>> copy = new LinkedHashMap<>();
            keys.forEach((k, v) -> copy.put(k, List.copyOf(new LinkedHashSet<>(v))));
            keys = Collections.unmodifiableMap(copy);
        }

        @Override
        public List<Object> primaryKeys() {
            return List.copyOf(keys.keySet());
        }

        @Override
        public List<Object> secondaryKeys() {
            Set<Object> union = new LinkedHashSet<>();
            keys.values().forEach(union::addAll);
            return new ArrayList<>(union);
        }

        @Override
        public boolean contains(Object key) {
            return keys.containsKey(key);
        }

        @Override
        public Optional<KeySet> scopeFor(Object key) {
            List<Object> scoped = keys.get(key);
            return scoped == null ? Optional.empty() : Optional.of(new Flat(scoped));
        }
    }
}
