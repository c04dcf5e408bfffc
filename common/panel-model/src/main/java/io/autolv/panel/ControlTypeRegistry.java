package io.autolv.panel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps declared LabVIEW control types to control variants and builds controls from their definitions.
 * <p>
 * The mapping is total: a declared type that is not registered builds an {@link UnsupportedControl}
 * instead of failing, so one unknown control never blocks its siblings.
 */
public final class ControlTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ControlTypeRegistry.class);

    private static final Map<String, ControlKind> DEFAULT_TYPES = defaultTypes();
    private static final ControlTypeRegistry DEFAULTS = new ControlTypeRegistry(DEFAULT_TYPES);

    private final Map<String, ControlKind> types;

    private ControlTypeRegistry(Map<String, ControlKind> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static ControlTypeRegistry defaults() {
        return DEFAULTS;
    }

    /** Starts from the default table. */
    public static Builder builder() {
        return new Builder(DEFAULT_TYPES);
    }

    private static Map<String, ControlKind> defaultTypes() {
        Map<String, ControlKind> types = new LinkedHashMap<>();
        types.put("Numeric", ControlKind.NUMERIC);
        types.put("Slide", ControlKind.NUMERIC);
        types.put("Boolean", ControlKind.BOOLEAN);
        types.put("String", ControlKind.STRING);
        types.put("Classic DAQmx Physical Channel", ControlKind.STRING);
        types.put("Path", ControlKind.PATH);
        types.put("Time Stamp", ControlKind.TIMESTAMP);
        types.put("Enum", ControlKind.ENUM);
        types.put("IVI Logical Name", ControlKind.IVI_LOGICAL_NAME);
        types.put("VISA resource name", ControlKind.VISA_RESOURCE_NAME);
        types.put("Classic Shared Variable Control", ControlKind.SHARED_VARIABLE);
        types.put("User Defined Refnum Tag", ControlKind.USER_DEFINED_REFNUM);
        types.put("Ring", ControlKind.RING);
        types.put("Array", ControlKind.ARRAY);
        types.put("ArrayCluster", ControlKind.ARRAY_CLUSTER);
        types.put("Cluster", ControlKind.CLUSTER);
        types.put("Measurement Data", ControlKind.CLUSTER);
        types.put("Waveform Graph", ControlKind.WAVEFORM_GRAPH);
        types.put("XY Graph", ControlKind.WAVEFORM_GRAPH);
        types.put("Tab Control", ControlKind.TAB_CONTROL);
        return types;
    }

    public ControlKind kindOf(String declaredType) {
        return declaredType == null ? ControlKind.UNSUPPORTED : types.getOrDefault(declaredType, ControlKind.UNSUPPORTED);
    }

    public boolean isRegistered(String declaredType) {
        return types.containsKey(declaredType);
    }

    /** Declared type to kind table, in registration order. */
    public Map<String, ControlKind> types() {
        return types;
    }

    public Control<?> create(Map<String, ?> attributes) {
        return create(ControlDefinition.of(attributes));
    }

    /**
     * Builds one control, including its members, pages or element layout, and applies the optional
     * initial {@code value}.
     *
     * @throws ControlTypeException when the initial value does not fit the control
     */
    public Control<?> create(ControlDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ControlKind kind = kindOf(definition.type());
        if (kind == ControlKind.UNSUPPORTED) {
            log.warn("Control '{}' has unsupported type '{}'", definition.name(), definition.type());
        }
        Control<?> control = instantiate(kind, definition);
        definition.value().ifPresent(control::setValue);
        return control;
    }

    /**
     * Builds every definition, keeping their order.
     */
    public Map<String, Control<?>> createAll(Map<String, ControlDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        Map<String, Control<?>> controls = new LinkedHashMap<>();
        definitions.forEach((name, definition) -> controls.put(name, create(definition)));
        return Collections.unmodifiableMap(controls);
    }

    private Control<?> instantiate(ControlKind kind, ControlDefinition definition) {
        ControlAttributes attributes = ControlAttributes.from(definition);
        return switch (kind) {
            case NUMERIC -> new NumericControl(attributes);
            case BOOLEAN -> new BooleanControl(attributes);
            case STRING -> new StringControl(attributes);
            case PATH -> new PathControl(attributes);
            case TIMESTAMP -> new TimestampControl(attributes);
            case ENUM -> new EnumControl(attributes, definition.items());
            case IVI_LOGICAL_NAME, VISA_RESOURCE_NAME, SHARED_VARIABLE, USER_DEFINED_REFNUM ->
                new IoRefNumControl(kind, attributes);
            case RING -> new RingControl(attributes, definition.items());
            case ARRAY -> new ArrayControl(attributes);
            case CLUSTER -> new ClusterControl(attributes, children(definition.members()));
            case ARRAY_CLUSTER -> new ArrayClusterControl(attributes, elementFactory(definition));
            case WAVEFORM_GRAPH -> new WaveformGraphControl(attributes);
            case TAB_CONTROL -> new TabControl(attributes, pages(definition));
            case UNSUPPORTED -> new UnsupportedControl(attributes);
        };
    }

    private List<Control<?>> children(Map<String, ControlDefinition> definitions) {
        List<Control<?>> children = new ArrayList<>(definitions.size());
        definitions.values().forEach(definition -> children.add(create(definition)));
        return children;
    }

    private List<TabPage> pages(ControlDefinition definition) {
        List<TabPage> pages = new ArrayList<>();
        definition.pages().forEach((name, controls) -> pages.add(new TabPage(name, children(controls))));
        return pages;
    }

    private Supplier<ClusterControl> elementFactory(ControlDefinition definition) {
        ControlDefinition element = definition.element()
            .orElseGet(() -> ControlDefinition.of(Map.of(
                ControlDefinition.NAME, definition.name(),
                ControlDefinition.TYPE, "Cluster")));
        ControlDefinition layout = element.with(ControlDefinition.VALUE, null);
        return () -> {
            Control<?> control = create(layout);
            if (!(control instanceof ClusterControl cluster)) {
                throw new IllegalArgumentException(
                    "element of '" + definition.name() + "' is a " + control.kind().label() + ", not a cluster");
            }
            return cluster;
        };
    }

    public static final class Builder {

        private final Map<String, ControlKind> types;

        private Builder(Map<String, ControlKind> types) {
            this.types = new LinkedHashMap<>(types);
        }

        /** Maps a declared type to a kind, replacing any existing mapping. */
        public Builder alias(String declaredType, ControlKind kind) {
            if (declaredType == null || declaredType.isBlank()) {
                throw new IllegalArgumentException("declaredType must not be blank");
            }
            types.put(declaredType, Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder aliases(Map<String, ControlKind> aliases) {
            Objects.requireNonNull(aliases, "aliases").forEach(this::alias);
            return this;
        }

        public ControlTypeRegistry build() {
            return new ControlTypeRegistry(types);
        }
    }
}
