package io.autolv.panel;

/**
 * Numeric array. Any dense sequence of numbers is accepted and normalised into a {@link NumericArray};
 * scalars, text and ragged sequences are rejected.
 */
public final class ArrayControl extends Control<NumericArray> {

    private NumericArray value = NumericArray.empty();

    public ArrayControl(ControlAttributes attributes) {
        super(ControlKind.ARRAY, attributes);
    }

    @Override
    public NumericArray value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        try {
            this.value = NumericArray.from(value);
        } catch (IllegalArgumentException ex) {
            throw ControlTypeException.rejected(this, value, ex.getMessage(), ex);
        }
    }
}
