package com.flowgraph.flowgraph_engine.model.state;

import com.flowgraph.flowgraph_engine.exception.TypeCoercionException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for the JSON-shaped values that live in a {@link GraphState}:
 * recursive copy, structural equality and numeric coercion.
 */
public final class StateValues {

    private StateValues() {}

    /**
     * Recursively duplicates maps, lists, sets and arrays. Anything else is returned
     * as-is, which is safe for the immutable scalars (strings, numbers, booleans)
     * a JSON document can hold.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>(map.size());
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>(set.size());
            set.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            for (int i = 0; i < length; i++) {
                Array.set(copy, i, deepCopy(Array.get(value, i)));
            }
            return copy;
        }
        return value;
    }

    /** Copies every value of a string-keyed map; a null map yields an empty one. */
    public static Map<String, Object> deepCopyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, deepCopy(v)));
        }
        return copy;
    }

    /**
     * Structural equality: numbers compare by value regardless of boxed type
     * (so {@code 40} equals {@code 40L} and {@code 40.0}), maps compare entry by
     * entry, lists and arrays element by element.
     */
    public static boolean deepEquals(Object a, Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;

        if (a instanceof Number na && b instanceof Number nb) {
            BigDecimal da = toBigDecimalOrNull(na);
            BigDecimal db = toBigDecimalOrNull(nb);
            if (da != null && db != null) return da.compareTo(db) == 0;
            return na.equals(nb);
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) return false;
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                if (!mb.containsKey(e.getKey())) return false;
                if (!deepEquals(e.getValue(), mb.get(e.getKey()))) return false;
            }
            return true;
        }
        if (isSequence(a) && isSequence(b)) {
            Iterator<?> ia = iterate(a).iterator();
            Iterator<?> ib = iterate(b).iterator();
            while (ia.hasNext() && ib.hasNext()) {
                if (!deepEquals(ia.next(), ib.next())) return false;
            }
            return !ia.hasNext() && !ib.hasNext();
        }
        return Objects.equals(a, b);
    }

    /** True when {@code container} holds an element structurally equal to {@code item}. */
    public static boolean containsElement(Object container, Object item) {
        for (Object element : iterate(container)) {
            if (deepEquals(element, item)) return true;
        }
        return false;
    }

    public static boolean isSequence(Object value) {
        return value instanceof List<?> || value instanceof Set<?>
                || (value != null && value.getClass().isArray());
    }

    /**
     * Coerces integral and floating numbers and numeric strings to {@link BigDecimal}.
     *
     * @throws TypeCoercionException for anything else, including NaN and infinities
     */
    public static BigDecimal toNumber(Object value) {
        if (value instanceof Number n) {
            BigDecimal converted = toBigDecimalOrNull(n);
            if (converted != null) return converted;
        } else if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                throw new TypeCoercionException("cannot convert string '" + s + "' to number", e);
            }
        }
        String type = value == null ? "null" : value.getClass().getSimpleName();
        throw new TypeCoercionException("cannot convert " + type + " value " + value + " to number");
    }

    private static BigDecimal toBigDecimalOrNull(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) return null;
        return BigDecimal.valueOf(d);
    }

    private static Iterable<?> iterate(Object sequence) {
        if (sequence instanceof Collection<?> collection) return collection;
        int length = Array.getLength(sequence);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(sequence, i));
        }
        return elements;
    }
}
