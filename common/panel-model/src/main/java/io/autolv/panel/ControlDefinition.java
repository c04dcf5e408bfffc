package io.autolv.panel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw attributes of one exported control, as extracted from VI strings.
 * <p>
 * Element attributes are kept verbatim ({@code ID}, {@code type}, {@code name}, ...). The walker adds
 * {@code description}, {@code tip}, part-derived labels ({@code caption}, {@code unitlabel}, ...), ring
 * {@code items}, cluster {@code members}, tab {@code pages} and the array {@code element}. Nested
 * definitions may be given either as {@link ControlDefinition} instances or as plain maps.
 */
public record ControlDefinition(Map<String, Object> attributes) {

    public static final String ID = "ID";
    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String TIP = "tip";
    public static final String CAPTION = "caption";
    public static final String UNIT_LABEL = "unitlabel";
    public static final String ITEMS = "items";
    public static final String MEMBERS = "members";
    public static final String PAGES = "pages";
    public static final String ELEMENT = "element";
    public static final String VALUE = "value";

    public ControlDefinition {
        Objects.requireNonNull(attributes, "attributes");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ControlDefinition of(Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        return new ControlDefinition(new LinkedHashMap<>(attributes));
    }

    public String type() {
        return text(TYPE).orElse("");
    }

    public String name() {
        Object name = attributes.get(NAME);
        if (name == null) {
            throw new IllegalArgumentException("Control definition has no name: " + attributes.keySet());
        }
        return name.toString();
    }

    public Integer id() {
        Object raw = attributes.get(ID);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.intValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Control ID is not numeric: " + raw, ex);
        }
    }

    public Optional<String> text(String key) {
        Object value = attributes.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public boolean has(String key) {
        return attributes.get(key) != null;
    }

    public Optional<Object> value() {
        return Optional.ofNullable(attributes.get(VALUE));
    }

    public List<String> items() {
        Object raw = attributes.get(ITEMS);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Iterable<?> iterable)) {
            throw new IllegalArgumentException("Control '" + name() + "' items must be a list");
        }
        List<String> items = new ArrayList<>();
        for (Object item : iterable) {
            items.add(item == null ? "" : item.toString());
        }
        return List.copyOf(items);
    }

    public Map<String, ControlDefinition> members() {
        return definitions(attributes.get(MEMBERS), MEMBERS);
    }

    public Map<String, Map<String, ControlDefinition>> pages() {
        Object raw = attributes.get(PAGES);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Control '" + name() + "' pages must be a map");
        }
        Map<String, Map<String, ControlDefinition>> pages = new LinkedHashMap<>();
        map.forEach((page, controls) -> pages.put(String.valueOf(page), definitions(controls, PAGES)));
        return Collections.unmodifiableMap(pages);
    }

    public Optional<ControlDefinition> element() {
        Object raw = attributes.get(ELEMENT);
        return raw == null ? Optional.empty() : Optional.of(asDefinition(raw, ELEMENT));
    }

    /**
     * Returns a copy with {@code key} set to {@code value}; a {@code null} value removes the key.
     */
    public ControlDefinition with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new ControlDefinition(copy);
    }

    private Map<String, ControlDefinition> definitions(Object raw, String key) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Control '" + name() + "' " + key + " must be a map");
        }
        Map<String, ControlDefinition> definitions = new LinkedHashMap<>();
        map.forEach((name, definition) -> definitions.put(String.valueOf(name), asDefinition(definition, key)));
        return Collections.unmodifiableMap(definitions);
    }

    @SuppressWarnings("unchecked")
    private ControlDefinition asDefinition(Object raw, String key) {
        if (raw instanceof ControlDefinition definition) {
            return definition;
        }
        if (raw instanceof Map<?, ?> map) {
            return ControlDefinition.of((Map<String, ?>) map);
        }
        throw new IllegalArgumentException(
            "Control '" + name() + "' " + key + " entry is not a control definition: " + raw);
    }
}
