package io.autolv.panel;

/**
 * Thrown when a value does not match the shape a control accepts.
 */
public class ControlTypeException extends ControlException {

    public ControlTypeException(String message) {
        super(message);
    }

    public ControlTypeException(String message, Throwable cause) {
        super(message, cause);
    }

    static ControlTypeException rejected(Control<?> control, Object value, String expected) {
        return rejected(control, value, expected, null);
    }

    static ControlTypeException rejected(Control<?> control, Object value, String expected, Throwable cause) {
        return new ControlTypeException(
            "'" + describe(value) + "' rejected by " + control.kind().label() + " '" + control.name()
                + "': " + expected,
            cause
        );
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value.getClass().isArray()) {
            return value.getClass().getComponentType().getSimpleName() + "[]";
        }
        return String.valueOf(value);
    }
}
