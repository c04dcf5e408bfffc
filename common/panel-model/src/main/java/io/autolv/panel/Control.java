package io.autolv.panel;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * One addressable front-panel element and its current value.
 * <p>
 * The shape of a control (name, kind, descriptive attributes, nesting) is fixed at construction. Only
 * the value and the dataflow direction change afterwards. Every variant validates assignments itself
 * and rejects a value of the wrong shape with {@link ControlTypeException}, leaving the previous value
 * in place.
 *
 * @param <V> type of the value exposed by {@link #value()}
 */
public abstract sealed class Control<V>
    permits NumericControl, BooleanControl, StringControl, PathControl, TimestampControl, EnumControl,
    IoRefNumControl, RingControl, ArrayControl, ClusterControl, ArrayClusterControl, WaveformGraphControl,
    TabControl, UnsupportedControl {

    /** Orders controls by name. */
    public static final Comparator<Control<?>> BY_NAME = Comparator.comparing(Control::name);

    private final ControlKind kind;
    private final ControlAttributes attributes;
    private DataFlow dataflow = DataFlow.UNKNOWN;

    Control(ControlKind kind, ControlAttributes attributes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    public ControlKind kind() {
        return kind;
    }

    /** Label of the control, unique within its container. */
    public String name() {
        return attributes.name();
    }

    /** Opaque numeric identifier from the export, or {@code null} when it had none. */
    public Integer id() {
        return attributes.id();
    }

    /** Type name as declared in the export, e.g. {@code Slide} for a numeric. */
    public String declaredType() {
        return attributes.declaredType().orElse(kind.label());
    }

    public Optional<String> description() {
        return attributes.description();
    }

    public Optional<String> tip() {
        return attributes.tip();
    }

    public Optional<String> caption() {
        return attributes.caption();
    }

    public Optional<String> unitLabel() {
        return attributes.unitLabel();
    }

    public ControlAttributes attributes() {
        return attributes;
    }

    /**
     * Fills in a descriptive attribute that the export left empty.
     *
     * @throws ImmutableAttributeException when the attribute is already populated
     */
    public void setAttribute(String key, String value) {
        attributes.assign(key, value);
    }

    public void setDescription(String description) {
        setAttribute(ControlDefinition.DESCRIPTION, description);
    }

    public void setTip(String tip) {
        setAttribute(ControlDefinition.TIP, tip);
    }

    public void setCaption(String caption) {
        setAttribute(ControlDefinition.CAPTION, caption);
    }

    public void setUnitLabel(String unitLabel) {
        setAttribute(ControlDefinition.UNIT_LABEL, unitLabel);
    }

    public DataFlow dataflow() {
        return dataflow;
    }

    public void setDataflow(DataFlow dataflow) {
        this.dataflow = Objects.requireNonNull(dataflow, "dataflow");
    }

    /**
     * Sets the direction from {@code control}, {@code in}, {@code indicator}, {@code out} or {@code unknown}.
     */
    public void setDataflow(String direction) {
        setDataflow(DataFlow.parse(direction));
    }

    public boolean isSupported() {
        return true;
    }

    public abstract V value();

    /**
     * Validates and stores a new value.
     *
     * @throws ControlTypeException when the value has the wrong shape for this control
     */
    public abstract void setValue(Object value);

    /**
     * Captures the current value so a failed composite assignment can be undone.
     */
    Object snapshot() {
        return value();
    }

    void restore(Object snapshot) {
        setValue(snapshot);
    }

    boolean valueEquals(Control<?> other) {
        return Objects.equals(value(), other.value());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Control<?> that = (Control<?>) other;
        return kind == that.kind
            && dataflow == that.dataflow
            && attributes.equals(that.attributes)
            && valueEquals(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name());
    }

    /** Display form of the value. */
    @Override
    public String toString() {
        return String.valueOf(value());
    }
}
