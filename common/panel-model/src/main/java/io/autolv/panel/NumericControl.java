package io.autolv.panel;

/**
 * Numeric scalar. NaN stands for a value the session could not read, such as fixed-point numbers.
 */
public final class NumericControl extends Control<Number> {

    private Number value = 0.0;

    public NumericControl(ControlAttributes attributes) {
        super(ControlKind.NUMERIC, attributes);
    }

    @Override
    public Number value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (!(value instanceof Number number)) {
            throw ControlTypeException.rejected(this, value, "not a number");
        }
        this.value = number;
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    /** Marks the value as unreadable. */
    public void markUnreadable() {
        this.value = Double.NaN;
    }

    public boolean isUnreadable() {
        return Double.isNaN(value.doubleValue());
    }
}
