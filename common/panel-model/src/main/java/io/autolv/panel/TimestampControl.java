package io.autolv.panel;

import java.time.LocalDateTime;

/**
 * Time stamp.
 * <p>
 * LabVIEW time stamps carry no time zone, so the value is a {@link LocalDateTime}. Adding or stripping
 * a zone tag for transport is the session layer's job; zoned values are rejected here.
 */
public final class TimestampControl extends Control<LocalDateTime> {

    /** LabVIEW's epoch, the default value. */
    public static final LocalDateTime LABVIEW_EPOCH = LocalDateTime.of(1904, 1, 1, 0, 0);

    private LocalDateTime value = LABVIEW_EPOCH;

    public TimestampControl(ControlAttributes attributes) {
        super(ControlKind.TIMESTAMP, attributes);
    }

    @Override
    public LocalDateTime value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (!(value instanceof LocalDateTime timestamp)) {
            throw ControlTypeException.rejected(this, value, "not a local date-time");
        }
        this.value = timestamp;
    }
}
