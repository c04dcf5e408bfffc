package io.autolv.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.autolv.panel.ControlKind;
import io.autolv.panel.ControlTypeRegistry;
import io.autolv.panel.DataFlow;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings applied when a front panel is opened.
 *
 * @param typeAliases               extra declared type to kind mappings on top of the default registry
 * @param dataflow                  direction per control name; exports do not record it
 * @param tolerateInitialReadErrors log and skip controls whose first read fails instead of failing the open
 * @param timestampZone             zone attached to timestamps sent to the value source and dropped from
 *                                  timestamps read back
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PanelSettings(
    Map<String, ControlKind> typeAliases,
    Map<String, DataFlow> dataflow,
    boolean tolerateInitialReadErrors,
    ZoneId timestampZone
) {

  public static final ZoneId DEFAULT_TIMESTAMP_ZONE = ZoneOffset.UTC;
  public static final PanelSettings DEFAULTS = builder().build();

  public PanelSettings {
    typeAliases = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(typeAliases, "typeAliases")));
    dataflow = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(dataflow, "dataflow")));
    Objects.requireNonNull(timestampZone, "timestampZone");
  }

  /**
   * Binds the JSON/YAML form, where kinds, directions and the zone are plain strings.
   */
  @JsonCreator
  static PanelSettings fromDocument(
      @JsonProperty("typeAliases") Map<String, String> typeAliases,
      @JsonProperty("dataflow") Map<String, String> dataflow,
      @JsonProperty("tolerateInitialReadErrors") Boolean tolerateInitialReadErrors,
      @JsonProperty("timestampZone") String timestampZone) {
    Builder builder = builder();
    if (typeAliases != null) {
      typeAliases.forEach((type, kind) -> builder.typeAlias(type, parseKind(type, kind)));
    }
    if (dataflow != null) {
      dataflow.forEach((name, direction) -> builder.dataflow(name, DataFlow.parse(direction)));
    }
    if (tolerateInitialReadErrors != null) {
      builder.tolerateInitialReadErrors(tolerateInitialReadErrors);
    }
    if (timestampZone != null && !timestampZone.isBlank()) {
      try {
        builder.timestampZone(ZoneId.of(timestampZone.trim()));
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("Invalid timestampZone: " + timestampZone, ex);
      }
    }
    return builder.build();
  }

  private static ControlKind parseKind(String type, String kind) {
    if (kind == null || kind.isBlank()) {
      throw new IllegalArgumentException("typeAliases entry '" + type + "' has no kind");
    }
    String normalized = kind.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    try {
      return ControlKind.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown control kind '" + kind + "' for type '" + type + "'", ex);
    }
  }

  /** The default registry extended with {@link #typeAliases()}. */
  public ControlTypeRegistry registry() {
    if (typeAliases.isEmpty()) {
      return ControlTypeRegistry.defaults();
    }
    return ControlTypeRegistry.builder().aliases(typeAliases).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, ControlKind> typeAliases = new LinkedHashMap<>();
    private final Map<String, DataFlow> dataflow = new LinkedHashMap<>();
    private boolean tolerateInitialReadErrors = true;
    private ZoneId timestampZone = DEFAULT_TIMESTAMP_ZONE;

    private Builder() {
    }

    public Builder typeAlias(String declaredType, ControlKind kind) {
      if (declaredType == null || declaredType.isBlank()) {
        throw new IllegalArgumentException("declaredType must not be blank");
      }
      typeAliases.put(declaredType, Objects.requireNonNull(kind, "kind"));
      return this;
    }

    public Builder dataflow(String controlName, DataFlow direction) {
      Objects.requireNonNull(controlName, "controlName");
      dataflow.put(controlName, Objects.requireNonNull(direction, "direction"));
      return this;
    }

    public Builder tolerateInitialReadErrors(boolean tolerate) {
      this.tolerateInitialReadErrors = tolerate;
      return this;
    }

    public Builder timestampZone(ZoneId zone) {
      this.timestampZone = Objects.requireNonNull(zone, "zone");
      return this;
    }

    public PanelSettings build() {
      return new PanelSettings(typeAliases, dataflow, tolerateInitialReadErrors, timestampZone);
    }
  }
}
