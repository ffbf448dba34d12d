package dev.aparikh.searchindexer.indexing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which resolved values are left out of a document so they never overwrite index defaults.
 */
public enum EmptyValuePolicy {

    /**
     * Drops every "falsy" value: null, {@code false}, numeric zero, empty strings, collections, maps
     * and arrays, and empty optionals. A field that must store zero or {@code false} needs {@link #NULL_ONLY}
     * or a sentinel value.
     */
    FALSY {
        @Override
        public boolean isEmpty(Object value) {
            if (value == null) return true;
            if (value instanceof Optional<?> optional) return optional.isEmpty();
            if (value instanceof Boolean b) return !b;
            if (value instanceof CharSequence s) return s.length() == 0;
            if (value instanceof Collection<?> c) return c.isEmpty();
            if (value instanceof Map<?, ?> m) return m.isEmpty();
            if (value.getClass().isArray()) return isEmptyArray(value);
            if (value instanceof BigDecimal d) return d.signum() == 0;
            if (value instanceof BigInteger i) return i.signum() == 0;
            if (value instanceof Number n) return n.doubleValue() == 0.0d;
            return false;
        }
    },

    /**
     * Drops only null and empty optionals.
     */
    NULL_ONLY {
        @Override
        public boolean isEmpty(Object value) {
            return value == null || (value instanceof Optional<?> optional && optional.isEmpty());
        }
    };

    public abstract boolean isEmpty(Object value);

    private static boolean isEmptyArray(Object array) {
        if (array instanceof Object[] a) return a.length == 0;
        if (array instanceof int[] a) return a.length == 0;
        if (array instanceof long[] a) return a.length == 0;
        if (array instanceof double[] a) return a.length == 0;
        if (array instanceof float[] a) return a.length == 0;
        if (array instanceof short[] a) return a.length == 0;
        if (array instanceof byte[] a) return a.length == 0;
        if (array instanceof char[] a) return a.length == 0;
        return ((boolean[]) array).length == 0;
    }
}
