package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.SpectralCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Block-averages time, then frequency, to the configured widths.
 *
 * @since 1.0
 */
public final class Rebinning implements CorrectionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(Rebinning.class);

  private final Double rebinDt;
  private final Double rebinDf;

  /**
   * @param rebinDt time bin width in seconds, null to keep the time axis
   * @param rebinDf frequency bin width in Hz, null to keep the frequency axis
   */
  public Rebinning(final Double rebinDt, final Double rebinDf) {
    this.rebinDt = rebinDt;
    this.rebinDf = rebinDf;
  }

  @Override
  public String name() {
    return "rebin(dt=" + rebinDt + ", df=" + rebinDf + ")";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    SpectralCube cube = slice.cube();
    double[] times = slice.times();
    double[] frequencies = slice.frequencies();
    if (rebinDt != null && cube.timeCount() > 0) {
      final RebinPlan plan = plan("spectra", cube.timeCount(), rebinDt, slice.dt());
      cube = new RebinnedCube(cube, RebinnedCube.Axis.TIME, plan);
      times = plan.average(times);
    }
    if (rebinDf != null && cube.frequencyCount() > 0) {
      final RebinPlan plan = plan("channels", cube.frequencyCount(), rebinDf, slice.df());
      cube = new RebinnedCube(cube, RebinnedCube.Axis.FREQUENCY, plan);
      frequencies = plan.average(frequencies);
    }
    return new SpectrumSlice(cube, times, frequencies, slice.dt(), slice.df(), slice.channelsPerSubband());
  }

  /**
   * Plans one axis and reports what it drops.
   *
   * @param what axis samples, for the log
   * @param length samples on the axis
   * @param target bin width, axis units
   * @param nativeWidth native sample width, axis units
   * @return plan
   */
  static RebinPlan plan(final String what, final int length, final double target, final double nativeWidth) {
    final RebinPlan plan = RebinPlan.of(length, target, nativeWidth);
    LOGGER.info("Averaging {} {} per bin into {} bins", plan.groupSize(), what, plan.bins());
    if (plan.leftover() > 0) {
      LOGGER.warn("Last {} {} are left over for averaging", plan.leftover(), what);
    }
    return plan;
  }
}
