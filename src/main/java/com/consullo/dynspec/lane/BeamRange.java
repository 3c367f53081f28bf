package com.consullo.dynspec.lane;

/**
 * Contiguous range of the flattened lane frequency axis recorded for one beam.
 *
 * @param beam beam id
 * @param start first frequency index (inclusive)
 * @param stop last frequency index (exclusive)
 * @since 1.0
 */
public record BeamRange(int beam, int start, int stop) {

  public int channelCount() {
    return stop - start;
  }
}
