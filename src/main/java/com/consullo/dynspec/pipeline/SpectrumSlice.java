package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.DataShapeException;
import com.consullo.dynspec.core.SpectralCube;
import org.apache.commons.lang3.Validate;

/**
 * Data flowing between correction stages: a cube plus the axes describing it.
 *
 * <p>The frequency axis starts on a subband boundary and covers whole subbands until rebinning.
 *
 * @param cube data indexed (time, frequency, polarization)
 * @param times time axis, Unix seconds
 * @param frequencies frequency axis, Hz
 * @param dt native time resolution, seconds
 * @param df native frequency resolution, Hz
 * @param channelsPerSubband channels per subband
 * @since 1.0
 */
public record SpectrumSlice(
    SpectralCube cube,
    double[] times,
    double[] frequencies,
    double dt,
    double df,
    int channelsPerSubband) {

  public SpectrumSlice {
    Validate.notNull(cube, "cube must not be null");
    Validate.notNull(times, "times must not be null");
    Validate.notNull(frequencies, "frequencies must not be null");
    Validate.isTrue(channelsPerSubband > 0, "channelsPerSubband must be positive");
    if (times.length != cube.timeCount()) {
      throw new DataShapeException(
          "Time axis has " + times.length + " values for " + cube.timeCount() + " samples.");
    }
  }

  public SpectrumSlice withCube(final SpectralCube newCube) {
    return new SpectrumSlice(newCube, times, frequencies, dt, df, channelsPerSubband);
  }

  public int subbandCount() {
    return cube.frequencyCount() / channelsPerSubband;
  }
}
