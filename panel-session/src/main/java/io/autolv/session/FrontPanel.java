package io.autolv.session;

import io.autolv.panel.Control;
import io.autolv.panel.ControlException;
import io.autolv.panel.DataFlow;
import io.autolv.panel.NumericControl;
import io.autolv.panel.TabControl;
import io.autolv.panel.UnknownControlException;
import io.autolv.vistrings.ViStringsDocument;
import io.autolv.vistrings.ViStringsParser;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Control tree of one VI front panel bound to a live {@link ControlValueSource}.
 * <p>
 * The tree is built once from the VI's exported strings. Values then move between the tree and the
 * source in whole-panel passes: {@link #writeInputs()} before a run, {@link #readOutputs()} after it.
 * Controls on tab pages are exchanged individually by name, the tab control itself never is.
 * Unsupported controls are skipped unless marked supported.
 * <p>
 * Not thread-safe.
 */
public final class FrontPanel {

  private static final Logger log = LoggerFactory.getLogger(FrontPanel.class);

  private final ViStringsDocument document;
  private final Map<String, Control<?>> controls;
  private final Map<String, Control<?>> byName;
  private final ControlValueSource source;
  private final PanelSettings settings;
  private final TransportValues transport;

  private FrontPanel(
      ViStringsDocument document,
      Map<String, Control<?>> controls,
      ControlValueSource source,
      PanelSettings settings) {
    this.document = document;
    this.controls = controls;
    this.byName = index(controls);
    this.source = source;
    this.settings = settings;
    this.transport = new TransportValues(settings.timestampZone());
  }

  public static FrontPanel open(String exportedStrings, ControlValueSource source) {
    return open(exportedStrings, source, PanelSettings.DEFAULTS);
  }

  /**
   * Parses the export, builds the control tree, applies the configured dataflow and reads every
   * control once.
   *
   * @throws io.autolv.vistrings.ViStringsFormatException when the export is malformed
   * @throws UnknownControlException when the settings give a direction for a control the panel lacks
   */
  public static FrontPanel open(String exportedStrings, ControlValueSource source, PanelSettings settings) {
    Objects.requireNonNull(exportedStrings, "exportedStrings");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(settings, "settings");
    ViStringsDocument document = new ViStringsParser().parse(exportedStrings);
    Map<String, Control<?>> controls = settings.registry().createAll(document.definitions());
    FrontPanel panel = new FrontPanel(document, controls, source, settings);
    settings.dataflow().forEach((name, direction) -> panel.control(name).setDataflow(direction));
    panel.read(control -> true, settings.tolerateInitialReadErrors());
    log.info("Opened front panel of {} with {} controls", document.name().orElse("<unnamed VI>"), controls.size());
    return panel;
  }

  private static Map<String, Control<?>> index(Map<String, Control<?>> controls) {
    Map<String, Control<?>> index = new LinkedHashMap<>(controls);
    for (Control<?> control : controls.values()) {
      if (control instanceof TabControl tabs) {
        for (Control<?> onPage : tabs.controls()) {
          if (index.putIfAbsent(onPage.name(), onPage) != null) {
            log.warn("Control '{}' on tab '{}' shadows another control with the same name", onPage.name(), tabs.name());
          }
        }
      }
    }
    return Collections.unmodifiableMap(index);
  }

  public Optional<String> viName() {
    return document.name();
  }

  public ViStringsDocument document() {
    return document;
  }

  public PanelSettings settings() {
    return settings;
  }

  /** Top-level control names in export order. */
  public List<String> names() {
    return List.copyOf(controls.keySet());
  }

  /** Top-level controls in export order. */
  public Collection<Control<?>> controls() {
    return controls.values();
  }

  public boolean contains(String name) {
    return byName.containsKey(name);
  }

  /**
   * Looks up a top-level control or a control on a tab page.
   *
   * @throws UnknownControlException when there is no such control
   */
  public Control<?> control(String name) {
    Control<?> control = byName.get(name);
    if (control == null) {
      throw new UnknownControlException(
          "'" + document.name().orElse("front panel") + "' has no control named '" + name + "'");
    }
    return control;
  }

  public <T extends Control<?>> T control(String name, Class<T> type) {
    Control<?> control = control(name);
    if (!type.isInstance(control)) {
      throw new UnknownControlException(
          "control '" + name + "' is a " + control.kind().label() + ", not a " + type.getSimpleName());
    }
    return type.cast(control);
  }

  /** Sets a value in the tree only; it reaches the VI on the next {@link #writeInputs()}. */
  public void set(String name, Object value) {
    control(name).setValue(value);
  }

  /** Reads every control from the source. */
  public void readControls() {
    read(control -> true, false);
  }

  /** Reads controls whose direction is indicator or unknown. */
  public void readOutputs() {
    read(control -> control.dataflow().isOutput(), false);
  }

  /** Sends controls whose direction is control or unknown. */
  public void writeInputs() {
    for (Control<?> control : exchanged(control -> control.dataflow().isInput())) {
      source.setControlValue(control.name(), transport.toTransport(control));
    }
  }

  /** Reads one control from the source. */
  public void read(String name) {
    readOne(control(name));
  }

  /** Sends one control to the source. */
  public void write(String name) {
    Control<?> control = control(name);
    source.setControlValue(control.name(), transport.toTransport(control));
  }

  private void read(Predicate<Control<?>> selected, boolean tolerateErrors) {
    for (Control<?> control : exchanged(selected)) {
      try {
        readOne(control);
      } catch (ControlException | ControlValueUnavailableException ex) {
        if (!tolerateErrors) {
          throw ex;
        }
        log.warn("Skipping initial value of '{}': {}", control.name(), ex.getMessage());
      }
    }
  }

  private void readOne(Control<?> control) {
    Object value;
    try {
      value = source.getControlValue(control.name());
    } catch (ControlValueUnavailableException ex) {
      if (control instanceof NumericControl numeric) {
        log.debug("Value of numeric '{}' is unavailable; marking it unreadable", control.name());
        numeric.markUnreadable();
        return;
      }
      throw ex;
    }
    transport.apply(control, value);
  }

  private List<Control<?>> exchanged(Predicate<Control<?>> selected) {
    List<Control<?>> exchanged = new ArrayList<>();
    for (Control<?> control : controls.values()) {
      if (control instanceof TabControl tabs) {
        tabs.controls().stream().filter(this::isExchanged).filter(selected).forEach(exchanged::add);
      } else if (isExchanged(control) && selected.test(control)) {
        exchanged.add(control);
      }
    }
    return exchanged;
  }

  private boolean isExchanged(Control<?> control) {
    return control.isSupported();
  }

  /** Direction of every exchanged control, for diagnostics. */
  public Map<String, DataFlow> dataflow() {
    Map<String, DataFlow> directions = new LinkedHashMap<>();
    exchanged(control -> true).forEach(control -> directions.put(control.name(), control.dataflow()));
    return Collections.unmodifiableMap(directions);
  }
}
