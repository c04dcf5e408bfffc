package io.autolv.panel;

/**
 * Thrown when a composite is asked for a child name or position it does not have.
 */
public class UnknownControlException extends ControlException {

    public UnknownControlException(String message) {
        super(message);
    }

    public UnknownControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
