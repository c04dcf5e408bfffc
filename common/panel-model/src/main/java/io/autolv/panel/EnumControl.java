package io.autolv.panel;

import java.util.List;
import java.util.Objects;

/**
 * Enum. The value is the integer selector; a numeric string is coerced to it.
 */
public final class EnumControl extends Control<Integer> {

    private final List<String> items;
    private int value;

    public EnumControl(ControlAttributes attributes) {
        this(attributes, List.of());
    }

    public EnumControl(ControlAttributes attributes, List<String> items) {
        super(ControlKind.ENUM, attributes);
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public Integer value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (value instanceof String text) {
            try {
                this.value = Integer.parseInt(text.trim());
                return;
            } catch (NumberFormatException ex) {
                throw ControlTypeException.rejected(this, value, "not an integer", ex);
            }
        }
        Integer selector = Integers.exact(value);
        if (selector == null) {
            throw ControlTypeException.rejected(this, value, "not an integer");
        }
        this.value = selector;
    }

    /** Item labels from the export, empty when it listed none. */
    public List<String> items() {
        return items;
    }
}
