package io.autolv.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link PanelSettings} from JSON ({@code .json}) or YAML ({@code .yaml}, {@code .yml}).
 */
public final class PanelSettingsLoader {

  private static final Logger log = LoggerFactory.getLogger(PanelSettingsLoader.class);

  private final ObjectMapper jsonMapper;
  private final ObjectMapper yamlMapper;

  public PanelSettingsLoader() {
    this.jsonMapper = new ObjectMapper().findAndRegisterModules();
    this.yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
  }

  public PanelSettings load(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Panel settings file not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.getFileName().toString());
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to load panel settings from " + path, ex);
    }
  }

  /**
   * Loads settings from the classpath.
   */
  public PanelSettings loadResource(String resource) {
    Objects.requireNonNull(resource, "resource");
    String location = resource.startsWith("/") ? resource : "/" + resource;
    try (InputStream in = PanelSettingsLoader.class.getResourceAsStream(location)) {
      if (in == null) {
        throw new IllegalArgumentException("Panel settings resource not found: " + resource);
      }
      return read(in, location);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to load panel settings resource " + resource, ex);
    }
  }

  private PanelSettings read(InputStream in, String name) throws IOException {
    ObjectMapper mapper = selectMapper(name);
    byte[] content = in.readAllBytes();
    if (content.length == 0) {
      log.debug("Panel settings {} are empty; using defaults", name);
      return PanelSettings.DEFAULTS;
    }
    PanelSettings settings = mapper.readValue(content, PanelSettings.class);
    if (settings == null) {
      return PanelSettings.DEFAULTS;
    }
    log.debug("Loaded panel settings from {}: {} type aliases, {} dataflow entries",
        name, settings.typeAliases().size(), settings.dataflow().size());
    return settings;
  }

  private ObjectMapper selectMapper(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
      return yamlMapper;
    }
    if (lower.endsWith(".json")) {
      return jsonMapper;
    }
    throw new IllegalArgumentException("Unsupported panel settings format: " + name);
  }
}
