package io.autolv.panel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder for a declared type the registry does not know.
 * <p>
 * It has no value and silently absorbs writes, so callers can walk every control of a panel uniformly.
 */
public final class UnsupportedControl extends Control<Void> {

    private static final Logger log = LoggerFactory.getLogger(UnsupportedControl.class);

    private boolean supported;

    public UnsupportedControl(ControlAttributes attributes) {
        super(ControlKind.UNSUPPORTED, attributes);
    }

    /** Always {@code null}. */
    @Override
    public Void value() {
        return null;
    }

    /** Discards the value. */
    @Override
    public void setValue(Object value) {
        log.debug("Ignoring value written to unsupported control '{}' ({})", name(), declaredType());
    }

    @Override
    public boolean isSupported() {
        return supported;
    }

    public void setSupported(boolean supported) {
        this.supported = supported;
    }

    @Override
    public String toString() {
        return "Not Implemented";
    }
}
