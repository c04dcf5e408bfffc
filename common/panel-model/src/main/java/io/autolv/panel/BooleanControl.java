package io.autolv.panel;

/**
 * Boolean. Only {@link Boolean} values are accepted; {@code 1}/{@code 0} are rejected.
 */
public final class BooleanControl extends Control<Boolean> {

    private boolean value;

    public BooleanControl(ControlAttributes attributes) {
        super(ControlKind.BOOLEAN, attributes);
    }

    @Override
    public Boolean value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (!(value instanceof Boolean flag)) {
            throw ControlTypeException.rejected(this, value, "not a boolean");
        }
        this.value = flag;
    }

    public boolean isSet() {
        return value;
    }
}
