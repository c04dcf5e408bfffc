package io.autolv.panel;

public final class StringControl extends Control<String> {

    private String value = "";

    public StringControl(ControlAttributes attributes) {
        super(ControlKind.STRING, attributes);
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (!(value instanceof String text)) {
            throw ControlTypeException.rejected(this, value, "not a string");
        }
        this.value = text;
    }
}
