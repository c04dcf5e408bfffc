package io.autolv.session;

/**
 * Live connection to a VI's front panel, implemented by the automation layer that drives LabVIEW.
 * <p>
 * Values cross this boundary in transport form: scalars as Java boxes, timestamps as zoned date-times,
 * clusters and arrays as (nested) lists. {@link TransportValues} converts between that form and the
 * control tree.
 */
public interface ControlValueSource {

  /**
   * @throws ControlValueUnavailableException when the value exists but cannot be transported
   */
  Object getControlValue(String name);

  void setControlValue(String name, Object value);
}
