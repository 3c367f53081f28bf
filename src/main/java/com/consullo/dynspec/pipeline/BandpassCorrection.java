package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.CubeStatistics;
import com.consullo.dynspec.core.NanStatistics;
import com.consullo.dynspec.core.SpectralCube;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the response of every subband.
 *
 * <p>Runs on whole subbands, before edge channels are flagged.
 *
 * @since 1.0
 */
public final class BandpassCorrection implements CorrectionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(BandpassCorrection.class);

  private final BandpassMode mode;

  public BandpassCorrection(final BandpassMode mode) {
    Validate.notNull(mode, "mode must not be null");
    this.mode = mode;
  }

  @Override
  public String name() {
    return "bandpass(" + mode + ")";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    switch (mode) {
      case STANDARD:
        return slice.withCube(standard(slice));
      case MEDIAN:
        return slice.withCube(median(slice, evaluator));
      case ADJUSTED:
        return slice.withCube(adjusted(slice, evaluator));
      case NONE:
      default:
        return slice;
    }
  }

  private SpectralCube standard(final SpectrumSlice slice) {
    final int channels = slice.channelsPerSubband();
    final double[] gain = PolyphaseBandpass.gain(channels);
    LOGGER.info("Applying standard bandpass to {} subbands of {} channels", slice.subbandCount(), channels);
    return slice.cube().map(chunk -> {
      for (int t = 0; t < chunk.timeCount(); t++) {
        for (int f = 0; f < chunk.frequencyCount(); f++) {
          final double g = gain[(chunk.frequencyStart() + f) % channels];
          for (int p = 0; p < chunk.polarizationCount(); p++) {
            chunk.set(t, f, p, chunk.get(t, f, p) * g);
          }
        }
      }
    });
  }

  /**
   * Divides by the median spectrum, then restores each subband's median level.
   */
  private SpectralCube median(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    final SpectralCube cube = slice.cube();
    final int channels = slice.channelsPerSubband();
    final int npol = cube.polarizationCount();
    final double[] spectrum = CubeStatistics.medianOverTime(evaluator, cube);
    final double[] broadband = subbandMedians(spectrum, slice.subbandCount(), channels, npol);
    LOGGER.info("Applying median bandpass to {} subbands", slice.subbandCount());
    return cube.map(chunk -> {
      for (int t = 0; t < chunk.timeCount(); t++) {
        for (int f = 0; f < chunk.frequencyCount(); f++) {
          final int channel = chunk.frequencyStart() + f;
          final int subband = channel / channels;
          for (int p = 0; p < npol; p++) {
            final double factor = broadband[subband * npol + p] / spectrum[channel * npol + p];
            chunk.set(t, f, p, chunk.get(t, f, p) * factor);
          }
        }
      }
    });
  }

  /**
   * Divides by one per-channel curve: the median across subbands of each subband's profile normalized by its own
   * median.
   */
  private SpectralCube adjusted(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    final SpectralCube cube = slice.cube();
    final int channels = slice.channelsPerSubband();
    final int subbands = slice.subbandCount();
    final int npol = cube.polarizationCount();
    final double[] profile = CubeStatistics.medianOverTime(evaluator, cube);
    final double[] perSubband = subbandMedians(profile, subbands, channels, npol);
    final double[] curve = new double[channels * npol];
    final double[] normalized = new double[subbands];
    for (int k = 0; k < channels; k++) {
      for (int p = 0; p < npol; p++) {
        for (int s = 0; s < subbands; s++) {
          normalized[s] = profile[(s * channels + k) * npol + p] / perSubband[s * npol + p];
        }
        curve[k * npol + p] = NanStatistics.median(normalized);
      }
    }
    LOGGER.info("Applying adjusted bandpass shared by {} subbands", subbands);
    return cube.map(chunk -> {
      for (int t = 0; t < chunk.timeCount(); t++) {
        for (int f = 0; f < chunk.frequencyCount(); f++) {
          final int k = (chunk.frequencyStart() + f) % channels;
          for (int p = 0; p < npol; p++) {
            chunk.set(t, f, p, chunk.get(t, f, p) / curve[k * npol + p]);
          }
        }
      }
    });
  }

  static double[] subbandMedians(final double[] spectrum, final int subbands, final int channels, final int npol) {
    final double[] result = new double[subbands * npol];
    final double[] row = new double[channels];
    for (int s = 0; s < subbands; s++) {
      for (int p = 0; p < npol; p++) {
        for (int k = 0; k < channels; k++) {
          row[k] = spectrum[(s * channels + k) * npol + p];
        }
        result[s * npol + p] = NanStatistics.median(row);
      }
    }
    return result;
  }
}
