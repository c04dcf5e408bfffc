package io.autolv.panel;

import java.math.BigInteger;

final class Integers {

    private Integers() {
    }

    /**
     * Returns the value as an {@code int} when it is an integral number that fits, otherwise {@code null}.
     */
    static Integer exact(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (int) l.longValue() : null;
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Integer.SIZE ? big.intValue() : null;
        }
        return null;
    }

    /**
     * Like {@link #exact(Object)}, but also takes a finite {@code double} or {@code float} without a
     * fractional part.
     */
    static Integer whole(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
            return null;
        }
        return exact(value);
    }
}
