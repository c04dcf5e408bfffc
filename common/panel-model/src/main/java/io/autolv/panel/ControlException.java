package io.autolv.panel;

/**
 * Base class for per-call errors raised by the control tree.
 * <p>
 * These never invalidate the tree: the control that rejected the call keeps its previous state.
 */
public class ControlException extends RuntimeException {

    public ControlException(String message) {
        this(message, null);
    }

    public ControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
