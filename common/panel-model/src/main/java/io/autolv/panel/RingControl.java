package io.autolv.panel;

import java.util.List;
import java.util.Objects;

/**
 * Ring. The value is an index into the fixed item list; an item's text selects it too. Whole
 * floating-point indexes are accepted since rings with a DBL representation report doubles.
 */
public final class RingControl extends Control<Integer> {

    private final List<String> items;
    private int value;

    public RingControl(ControlAttributes attributes, List<String> items) {
        super(ControlKind.RING, attributes);
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public Integer value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        if (value instanceof String item) {
            int index = items.indexOf(item);
            if (index < 0) {
                throw ControlTypeException.rejected(this, value, "not one of " + items);
            }
            this.value = index;
            return;
        }
        Integer index = Integers.whole(value);
        if (index == null) {
            throw ControlTypeException.rejected(this, value, "not an index or item");
        }
        if (!items.isEmpty() && (index < 0 || index >= items.size())) {
            throw ControlTypeException.rejected(this, value, "index outside 0.." + (items.size() - 1));
        }
        this.value = index;
    }

    public List<String> items() {
        return items;
    }

    /** Text of the selected item. */
    public String selectedItem() {
        return items.isEmpty() ? String.valueOf(value) : items.get(value);
    }

    @Override
    public String toString() {
        return selectedItem();
    }
}
