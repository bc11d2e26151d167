package com.eventseries.service.core.reshape;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Nested query result: one {@link Branch} level per group-by column, ending in a {@link Leaf} holding the
 * aggregate value. Branch children are mutable so the reshaper can fill and trim in place.
 */
public sealed interface ResultNode permits ResultNode.Leaf, ResultNode.Branch {

    static Leaf leaf(Object value) {
        return new Leaf(value);
    }

    static Branch branch() {
        return new Branch(new LinkedHashMap<>());
    }

    record Leaf(Object value) implements ResultNode {

        private static final Leaf ZERO = new Leaf(0L);

        public static Leaf zero() {
            return ZERO;
        }

        public long longValue() {
            if (value instanceof Number number) {
                return number.longValue();
            }
            return 0L;
        }
    }

    record Branch(Map<Object, ResultNode> children) implements ResultNode {

        public Branch {
            Objects.requireNonNull(children, "children");
        }

        public ResultNode get(Object key) {
            return children.get(key);
        }

        public Branch put(Object key, ResultNode child) {
            children.put(key, child);
            return this;
        }

        /** Child branch under {@code key}, created when absent. */
        public Branch branch(Object key) {
            ResultNode child = children.computeIfAbsent(key, k -> ResultNode.branch());
            if (!(child instanceof Branch branch)) {
                throw new IllegalStateException("Expected a branch under " + key + " but found " + child);
            }
            return branch;
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }
}
