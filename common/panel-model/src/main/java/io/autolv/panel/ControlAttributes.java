package io.autolv.panel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Descriptive attributes shared by every control.
 * <p>
 * The read-only keys are write-once: an absent one may be filled in, a populated one may not be
 * reassigned. Other textual attributes of the export (part labels such as {@code namelabel}) are kept
 * as extras and follow the same rule.
 */
public final class ControlAttributes {

    static final Set<String> READ_ONLY = Set.of(
        ControlDefinition.ID,
        ControlDefinition.TYPE,
        ControlDefinition.NAME,
        ControlDefinition.DESCRIPTION,
        ControlDefinition.TIP,
        ControlDefinition.CAPTION,
        ControlDefinition.UNIT_LABEL
    );

    private static final Set<String> STRUCTURAL = Set.of(
        ControlDefinition.ITEMS,
        ControlDefinition.MEMBERS,
        ControlDefinition.PAGES,
        ControlDefinition.ELEMENT,
        ControlDefinition.VALUE
    );

    private final Map<String, String> values = new LinkedHashMap<>();

    private ControlAttributes(String name) {
        values.put(ControlDefinition.NAME, Objects.requireNonNull(name, "name"));
    }

    public static ControlAttributes named(String name) {
        return new ControlAttributes(name);
    }

    /**
     * Copies every scalar attribute of the definition. Nested definitions, ring items and the initial
     * value are left to the control constructors.
     */
    public static ControlAttributes from(ControlDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ControlAttributes attributes = new ControlAttributes(definition.name());
        definition.attributes().forEach((key, value) -> {
            if (value != null && !STRUCTURAL.contains(key) && !ControlDefinition.NAME.equals(key)) {
                attributes.values.put(key, value.toString());
            }
        });
        return attributes;
    }

    public String name() {
        return values.get(ControlDefinition.NAME);
    }

    public Integer id() {
        String raw = values.get(ControlDefinition.ID);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public Optional<String> declaredType() {
        return get(ControlDefinition.TYPE);
    }

    public Optional<String> description() {
        return get(ControlDefinition.DESCRIPTION);
    }

    public Optional<String> tip() {
        return get(ControlDefinition.TIP);
    }

    public Optional<String> caption() {
        return get(ControlDefinition.CAPTION);
    }

    public Optional<String> unitLabel() {
        return get(ControlDefinition.UNIT_LABEL);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Sets an attribute that has not been populated yet.
     *
     * @throws ImmutableAttributeException when the attribute already holds a value
     */
    public void assign(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (values.containsKey(key)) {
            throw new ImmutableAttributeException(
                "can't set '" + key + "' of control '" + name() + "': already set to '" + values.get(key) + "'");
        }
        values.put(key, value);
    }

    public boolean isReadOnly(String key) {
        return READ_ONLY.contains(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ControlAttributes that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
