package io.autolv.session;

/**
 * The value source could not hand over a control's value, e.g. a fixed-point numeric that the
 * automation interface cannot carry.
 */
public class ControlValueUnavailableException extends RuntimeException {

  public ControlValueUnavailableException(String message) {
    super(message);
  }

  public ControlValueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
