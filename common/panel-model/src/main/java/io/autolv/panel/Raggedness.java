package io.autolv.panel;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects ragged nested sequences.
 * <p>
 * A sequence is ragged when two elements at the same nesting depth differ in length, a scalar
 * counting as a different length from any sequence. Depths are compared across the whole tree, so a
 * non-ragged sequence is always a dense rectangular array.
 */
public final class Raggedness {

    private static final int SCALAR = -1;

    private Raggedness() {
    }

    public static boolean isRagged(Object value) {
        if (!Sequences.isSequence(value)) {
            return false;
        }
        List<Object> level = Sequences.toList(value);
        while (!level.isEmpty()) {
            List<Object> next = new ArrayList<>();
            int expected = lengthOf(level.get(0));
            for (Object node : level) {
                int length = lengthOf(node);
                if (length != expected) {
                    return true;
                }
                if (length != SCALAR) {
                    next.addAll(Sequences.toList(node));
                }
            }
            level = next;
        }
        return false;
    }

    private static int lengthOf(Object node) {
        return Sequences.isSequence(node) ? Sequences.toList(node).size() : SCALAR;
    }
}
