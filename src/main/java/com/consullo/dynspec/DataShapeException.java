package com.consullo.dynspec;

/**
 * Raised when decoded data violates a structural invariant: odd channel count, truncated header,
 * a file without a single complete block, or axis lengths that disagree with the data.
 *
 * @since 1.0
 */
public class DataShapeException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public DataShapeException(final String message) {
    super(message);
  }
}
