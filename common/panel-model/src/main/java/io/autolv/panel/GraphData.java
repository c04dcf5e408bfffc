package io.autolv.panel;

import java.util.List;
import java.util.Objects;

/**
 * Payload of a waveform or XY graph: either a dense array or a sampled waveform.
 */
public sealed interface GraphData permits GraphData.Dense, GraphData.Sampled {

    static Dense dense(NumericArray values) {
        return new Dense(values);
    }

    static Sampled sampled(double t0, double dt, NumericArray y) {
        return new Sampled(t0, dt, y);
    }

    /**
     * Interprets a graph value by structure: a ragged {@code (t0, dt, Y)} triple is a sampled waveform,
     * anything dense is a plain array.
     *
     * @throws IllegalArgumentException when the value fits neither shape
     */
    static GraphData from(Object value) {
        if (value instanceof GraphData data) {
            return data;
        }
        if (Raggedness.isRagged(value)) {
            List<Object> parts = Sequences.toList(value);
            if (parts.size() != 3
                || !(parts.get(0) instanceof Number t0)
                || !(parts.get(1) instanceof Number dt)) {
                throw new IllegalArgumentException("ragged graph data must be a (t0, dt, Y) triple");
            }
            return sampled(t0.doubleValue(), dt.doubleValue(), NumericArray.from(parts.get(2)));
        }
        return dense(NumericArray.from(value));
    }

    /** A plain numeric array, e.g. a time series or XY pairs. */
    record Dense(NumericArray values) implements GraphData {
        public Dense {
            Objects.requireNonNull(values, "values");
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    /** A waveform sampled every {@code dt} starting at {@code t0}. */
    record Sampled(double t0, double dt, NumericArray y) implements GraphData {
        public Sampled {
            Objects.requireNonNull(y, "y");
        }

        @Override
        public String toString() {
            return "(" + t0 + ", " + dt + ", " + y + ")";
        }
    }
}
