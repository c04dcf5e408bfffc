package io.autolv.panel;

import java.util.Objects;

/**
 * Value of an I/O refnum: the resource label (e.g. {@code PXI1Slot1}) and an auxiliary number the
 * session passes along.
 */
public record IoRefNum(String label, int aux) {

    public IoRefNum {
        Objects.requireNonNull(label, "label");
    }

    public static IoRefNum of(String label) {
        return new IoRefNum(label, 0);
    }

    @Override
    public String toString() {
        return label;
    }
}
