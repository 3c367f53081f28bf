package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.DataShapeException;
import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.DenseCube;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shifts every channel back by its dispersion delay relative to a reference frequency.
 *
 * <p>Needs the complete time series of each channel, so the slice is materialized first. Samples that wrap
 * around after the cyclic shift are set to NaN.
 *
 * @since 1.0
 */
public final class Dedispersion implements CorrectionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(Dedispersion.class);

  private final Double dispersionMeasure;
  private final DispersionDelay dispersionDelay;
  private final double referenceFrequency;

  /**
   * @param dispersionMeasure pc cm^-3, null to disable
   * @param dispersionDelay delay relation
   * @param referenceFrequency frequency with zero relative delay, Hz
   */
  public Dedispersion(
      final Double dispersionMeasure, final DispersionDelay dispersionDelay, final double referenceFrequency) {
    Validate.notNull(dispersionDelay, "dispersionDelay must not be null");
    this.dispersionMeasure = dispersionMeasure;
    this.dispersionDelay = dispersionDelay;
    this.referenceFrequency = referenceFrequency;
  }

  @Override
  public String name() {
    return dispersionMeasure == null ? "dedispersion(off)" : "dedispersion(" + dispersionMeasure + ")";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    if (dispersionMeasure == null) {
      return slice;
    }
    LOGGER.info("Starting de-dispersion (DM={})...", dispersionMeasure);
    final DenseCube materialized = evaluator.materialize(slice.cube());
    final DenseCube data = materialized == slice.cube()
        ? new DenseCube(materialized.timeCount(), materialized.frequencyCount(), materialized.polarizationCount(),
            materialized.values().clone())
        : materialized;
    final double[] frequencies = slice.frequencies();
    if (frequencies.length != data.frequencyCount()) {
      throw new DataShapeException("Problem with frequency axis: " + frequencies.length + " values for "
          + data.frequencyCount() + " channels.");
    }
    final double referenceDelay = dispersionDelay.delay(referenceFrequency, dispersionMeasure);
    final int n = data.timeCount();
    final double[] column = new double[n];
    for (int f = 0; f < frequencies.length; f++) {
      final double delay = dispersionDelay.delay(frequencies[f], dispersionMeasure) - referenceDelay;
      final long cells = Math.round(delay / slice.dt());
      if (cells == 0 || n == 0) {
        continue;
      }
      for (int p = 0; p < data.polarizationCount(); p++) {
        for (int t = 0; t < n; t++) {
          column[t] = data.get(t, f, p);
        }
        for (int t = 0; t < n; t++) {
          final boolean wrapped = cells > 0 ? t >= n - cells : t < -cells;
          data.set(t, f, p, wrapped ? Double.NaN : column[(int) Math.floorMod(t + cells, (long) n)]);
        }
      }
    }
    LOGGER.info("Data are de-dispersed.");
    return slice.withCube(data);
  }
}
