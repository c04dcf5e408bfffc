package io.autolv.panel;

import java.util.Locale;

/**
 * Direction of a front-panel control. Exported VI strings do not encode it, so every control starts as
 * {@link #UNKNOWN}.
 */
public enum DataFlow {
    CONTROL,
    INDICATOR,
    UNKNOWN;

    /**
     * Parses {@code control}/{@code in}, {@code indicator}/{@code out} or {@code unknown}, ignoring case.
     */
    public static DataFlow parse(String direction) {
        if (direction == null || direction.isBlank()) {
            throw new IllegalArgumentException("dataflow direction must not be blank");
        }
        return switch (direction.trim().toLowerCase(Locale.ROOT)) {
            case "control", "in" -> CONTROL;
            case "indicator", "out" -> INDICATOR;
            case "unknown" -> UNKNOWN;
            default -> throw new IllegalArgumentException("Unknown dataflow direction: " + direction);
        };
    }

    /**
     * Whether values of a control with this direction are pushed before a run.
     */
    public boolean isInput() {
        return this != INDICATOR;
    }

    /**
     * Whether values of a control with this direction are pulled after a run.
     */
    public boolean isOutput() {
        return this != CONTROL;
    }
}
