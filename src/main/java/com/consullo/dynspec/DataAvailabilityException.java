package com.consullo.dynspec;

/**
 * Raised when a selection yields no data at all (unknown beam, or every lane skipped).
 *
 * <p>An empty product is never returned in place of this exception.
 *
 * @since 1.0
 */
public class DataAvailabilityException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public DataAvailabilityException(final String message) {
    super(message);
  }
}
