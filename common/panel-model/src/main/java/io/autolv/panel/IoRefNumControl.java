package io.autolv.panel;

import java.util.List;

/**
 * I/O refnum family: IVI logical name, VISA resource name, shared variable and user-defined refnum.
 * The kinds behave the same and differ only by their {@link ControlKind} tag.
 */
public final class IoRefNumControl extends Control<IoRefNum> {

    private IoRefNum value = IoRefNum.of("");

    public IoRefNumControl(ControlKind kind, ControlAttributes attributes) {
        super(kind, attributes);
        if (!kind.isIoRefNum()) {
            throw new IllegalArgumentException(kind + " is not an I/O refnum kind");
        }
    }

    @Override
    public IoRefNum value() {
        return value;
    }

    /**
     * Accepts a bare label (aux 0), an {@link IoRefNum}, or a {@code (label, aux)} pair.
     */
    @Override
    public void setValue(Object value) {
        if (value instanceof String label) {
            this.value = IoRefNum.of(label);
            return;
        }
        if (value instanceof IoRefNum refNum) {
            this.value = refNum;
            return;
        }
        if (Sequences.isSequence(value)) {
            List<Object> pair = Sequences.toList(value);
            if (pair.size() == 2 && pair.get(0) instanceof String label) {
                Integer aux = Integers.exact(pair.get(1));
                if (aux != null) {
                    this.value = new IoRefNum(label, aux);
                    return;
                }
            }
        }
        throw ControlTypeException.rejected(this, value, "not a (<string>, <int>) pair");
    }

    public String label() {
        return value.label();
    }
}
