package io.autolv.panel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense numeric array of any rank, stored row-major as {@code double}s.
 */
public final class NumericArray {

    private static final NumericArray EMPTY = new NumericArray(new int[] {0}, new double[0]);

    private final int[] shape;
    private final double[] data;

    private NumericArray(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    public static NumericArray empty() {
        return EMPTY;
    }

    public static NumericArray of(double... values) {
        Objects.requireNonNull(values, "values");
        return new NumericArray(new int[] {values.length}, values.clone());
    }

    /**
     * Normalises an array-like value.
     *
     * @throws IllegalArgumentException when the value is text, a scalar, ragged or holds non-numbers
     */
    public static NumericArray from(Object value) {
        if (value instanceof NumericArray array) {
            return array;
        }
        if (value instanceof double[] doubles) {
            return of(doubles);
        }
        if (value instanceof int[] ints) {
            return of(Arrays.stream(ints).asDoubleStream().toArray());
        }
        if (value instanceof long[] longs) {
            return of(Arrays.stream(longs).asDoubleStream().toArray());
        }
        if (value instanceof boolean[] || value instanceof char[]) {
            throw new IllegalArgumentException("not a numeric array");
        }
        if (!Sequences.isSequence(value)) {
            throw new IllegalArgumentException("not array like");
        }
        if (Raggedness.isRagged(value)) {
            throw new IllegalArgumentException("ragged sequence is not a dense array");
        }
        List<Integer> dims = new ArrayList<>();
        Object level = value;
        while (Sequences.isSequence(level)) {
            List<Object> items = Sequences.toList(level);
            dims.add(items.size());
            if (items.isEmpty()) {
                break;
            }
            level = items.get(0);
        }
        int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
        int size = Arrays.stream(shape).reduce(1, (a, b) -> a * b);
        double[] data = new double[size];
        int filled = flatten(value, data, 0);
        if (filled != size) {
            throw new IllegalArgumentException("sequence is not rectangular");
        }
        return new NumericArray(shape, data);
    }

    private static int flatten(Object node, double[] data, int offset) {
        if (!Sequences.isSequence(node)) {
            if (!(node instanceof Number number)) {
                throw new IllegalArgumentException("'" + node + "' is not a number");
            }
            data[offset] = number.doubleValue();
            return offset + 1;
        }
        int next = offset;
        for (Object item : Sequences.toList(node)) {
            next = flatten(item, data, next);
        }
        return next;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public double get(int... index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException("expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int d = 0; d < shape.length; d++) {
            Objects.checkIndex(index[d], shape[d]);
            flat = flat * shape[d] + index[d];
        }
        return data[flat];
    }

    /** Row-major copy of the values. */
    public double[] toDoubleArray() {
        return data.clone();
    }

    /** Nested lists of {@link Double}, one level per dimension. */
    public List<Object> toList() {
        return nest(0, 0);
    }

    private List<Object> nest(int dim, int offset) {
        int stride = 1;
        for (int d = dim + 1; d < shape.length; d++) {
            stride *= shape[d];
        }
        List<Object> items = new ArrayList<>(shape[dim]);
        for (int i = 0; i < shape[dim]; i++) {
            if (dim == shape.length - 1) {
                items.add(data[offset + i]);
            } else {
                items.add(nest(dim + 1, offset + i * stride));
            }
        }
        return Collections.unmodifiableList(items);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NumericArray that)) {
            return false;
        }
        return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
