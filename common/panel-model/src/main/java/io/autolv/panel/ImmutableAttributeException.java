package io.autolv.panel;

/**
 * Thrown when a read-only descriptive attribute that is already populated is assigned again.
 */
public class ImmutableAttributeException extends ControlException {

    public ImmutableAttributeException(String message) {
        super(message);
    }

    public ImmutableAttributeException(String message, Throwable cause) {
        super(message, cause);
    }
}
