package io.autolv.panel;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * Uniform view over the sequence shapes a session may hand over: lists and other iterables, object
 * arrays, primitive arrays and {@link NumericArray}s. Strings are never sequences.
 */
public final class Sequences {

    private Sequences() {
    }

    public static boolean isSequence(Object value) {
        if (value == null || value instanceof String) {
            return false;
        }
        return value instanceof Iterable<?> || value instanceof NumericArray || value.getClass().isArray();
    }

    /**
     * Copies the top level of a sequence into a list; nested sequences are left as they are.
     *
     * @throws IllegalArgumentException when the value is not a sequence
     */
    public static List<Object> toList(Object value) {
        if (value instanceof NumericArray array) {
            return array.toList();
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> items = new ArrayList<>();
            iterable.forEach(items::add);
            return items;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        throw new IllegalArgumentException("not a sequence: " + value);
    }
}
