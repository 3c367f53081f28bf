package com.consullo.dynspec.polar;

import com.consullo.dynspec.DataShapeException;

/**
 * Channel-halves swap applied to every subband.
 *
 * <p>The receiver writes the upper half of each subband's channels first. Output channel {@code j} therefore
 * takes raw channel {@code (j + fftlen / 2) mod fftlen}.
 *
 * @since 1.0
 */
public final class ChannelReorder {

  private ChannelReorder() {
  }

  /**
   * Raw channel holding output channel {@code channel}.
   *
   * @param channel output channel within the subband
   * @param fftLength channels per subband
   * @return raw channel within the subband
   * @throws DataShapeException if {@code fftLength} is odd
   */
  public static int sourceChannel(final int channel, final int fftLength) {
    requireEven(fftLength);
    return (channel + fftLength / 2) % fftLength;
  }

  /**
   * Reorders a flattened run of whole subbands.
   *
   * @param raw raw values, {@code subbands * fftLength} long
   * @param fftLength channels per subband
   * @return reordered copy
   */
  static double[] reorder(final double[] raw, final int fftLength) {
    requireEven(fftLength);
    if (raw.length % fftLength != 0) {
      throw new DataShapeException("Cannot split " + raw.length + " channels into subbands of " + fftLength + ".");
    }
    final double[] result = new double[raw.length];
    for (int base = 0; base < raw.length; base += fftLength) {
      for (int j = 0; j < fftLength; j++) {
        result[base + j] = raw[base + sourceChannel(j, fftLength)];
      }
    }
    return result;
  }

  private static void requireEven(final int fftLength) {
    if (fftLength <= 0 || fftLength % 2 != 0) {
      throw new DataShapeException("Problem with fftlen value: " + fftLength + "!");
    }
  }
}
