package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets the first and last {@code n} channels of every subband to NaN.
 *
 * @since 1.0
 */
public final class EdgeChannelFlagging implements CorrectionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(EdgeChannelFlagging.class);

  private final int edgeChannels;

  public EdgeChannelFlagging(final int edgeChannels) {
    this.edgeChannels = edgeChannels;
  }

  /**
   * Clamps a requested edge count: a negative count, or one that would flag every channel, falls back to 0.
   *
   * @param requested requested count per edge
   * @param channelsPerSubband channels per subband
   * @return count to apply
   */
  public static int effectiveCount(final int requested, final int channelsPerSubband) {
    if (requested < 0) {
      LOGGER.warn("The number of channels to remove should be positive, got {}. Setting default value 0.",
          requested);
      return 0;
    }
    if (2L * requested >= channelsPerSubband) {
      LOGGER.warn("Each subband holds {} channels, removing {} at both edges would leave no data. "
          + "Setting default value 0.", channelsPerSubband, requested);
      return 0;
    }
    return requested;
  }

  @Override
  public String name() {
    return "edge-flagging(" + edgeChannels + ")";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    final int channels = slice.channelsPerSubband();
    final int n = edgeChannels == 0 ? 0 : effectiveCount(edgeChannels, channels);
    if (n == 0) {
      return slice;
    }
    LOGGER.info("{} channels set to NaN at the subband edges", n);
    return slice.withCube(slice.cube().map(chunk -> {
      for (int f = 0; f < chunk.frequencyCount(); f++) {
        final int k = (chunk.frequencyStart() + f) % channels;
        if (k >= n && k < channels - n) {
          continue;
        }
        for (int t = 0; t < chunk.timeCount(); t++) {
          for (int p = 0; p < chunk.polarizationCount(); p++) {
            chunk.set(t, f, p, Double.NaN);
          }
        }
      }
    }));
  }
}
