package dev.aparikh.searchindexer.indexing;

import java.util.Objects;

/**
 * Backend-neutral delete predicate built from equality and exclusive upper-bound terms joined with AND.
 * Each backend renders it in its own query syntax.
 */
public sealed interface IndexQuery {

    static IndexQuery eq(String field, Object value) {
        return new Equals(field, value);
    }

    static IndexQuery lt(String field, Comparable<?> value) {
        return new LessThan(field, value);
    }

    default IndexQuery and(IndexQuery other) {
        return new And(this, other);
    }

    record Equals(String field, Object value) implements IndexQuery {
        public Equals {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record LessThan(String field, Comparable<?> value) implements IndexQuery {
        public LessThan {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record And(IndexQuery left, IndexQuery right) implements IndexQuery {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }
}
