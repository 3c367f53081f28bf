package com.consullo.dynspec;

/**
 * Raised for invalid caller input: bad lane file names, missing files, lanes from different capture
 * sessions, unknown polarization or bandpass names, and inverted selection ranges.
 *
 * <p>Always fatal. Never retried.
 *
 * @since 1.0
 */
public class ConfigurationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
