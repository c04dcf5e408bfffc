package io.autolv.vistrings;

import io.autolv.panel.ControlDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing one VI's exported strings.
 *
 * @param viName         {@code name} attribute of the root {@code VI} element, if any
 * @param labviewVersion {@code LVversion} attribute of the root {@code VI} element, if any
 * @param definitions    top-level controls by name, in export order
 */
public record ViStringsDocument(String viName, String labviewVersion, Map<String, ControlDefinition> definitions) {

    public ViStringsDocument {
        Objects.requireNonNull(definitions, "definitions");
        definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public Optional<String> name() {
        return Optional.ofNullable(viName);
    }

    public Optional<String> version() {
        return Optional.ofNullable(labviewVersion);
    }

    public Optional<ControlDefinition> definition(String controlName) {
        return Optional.ofNullable(definitions.get(controlName));
    }
}
