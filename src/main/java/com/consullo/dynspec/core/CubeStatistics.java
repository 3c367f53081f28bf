package com.consullo.dynspec.core;

/**
 * Median reductions of deferred cubes along one axis.
 *
 * <p>Results are flat arrays indexed {@code axisIndex * polarizationCount + p}.
 *
 * @since 1.0
 */
public final class CubeStatistics {

  private CubeStatistics() {
  }

  /**
   * NaN-ignoring median over time for every (channel, polarization).
   *
   * @param evaluator worker pool
   * @param cube cube to reduce
   * @return medians indexed {@code f * polarizationCount + p}
   */
  public static double[] medianOverTime(final ChunkedEvaluator evaluator, final SpectralCube cube) {
    final int npol = cube.polarizationCount();
    final double[] result = new double[cube.frequencyCount() * npol];
    evaluator.forEachFrequencyBlock(cube, chunk -> {
      final double[] column = new double[chunk.timeCount()];
      for (int f = 0; f < chunk.frequencyCount(); f++) {
        for (int p = 0; p < npol; p++) {
          for (int t = 0; t < chunk.timeCount(); t++) {
            column[t] = chunk.get(t, f, p);
          }
          result[(chunk.frequencyStart() + f) * npol + p] = NanStatistics.median(column);
        }
      }
    });
    return result;
  }

  /**
   * NaN-ignoring median over frequency for every (time, polarization), optionally after dividing each channel by
   * a per-channel profile.
   *
   * @param evaluator worker pool
   * @param cube cube to reduce
   * @param divisor per-(channel, polarization) divisor indexed {@code f * polarizationCount + p}, or null
   * @return medians indexed {@code t * polarizationCount + p}
   */
  public static double[] medianOverFrequency(
      final ChunkedEvaluator evaluator, final SpectralCube cube, final double[] divisor) {
    final int npol = cube.polarizationCount();
    final double[] result = new double[cube.timeCount() * npol];
    evaluator.forEachTimeBlock(cube, chunk -> {
      final double[] row = new double[chunk.frequencyCount()];
      for (int t = 0; t < chunk.timeCount(); t++) {
        for (int p = 0; p < npol; p++) {
          for (int f = 0; f < chunk.frequencyCount(); f++) {
            final double value = chunk.get(t, f, p);
            row[f] = divisor == null ? value : value / divisor[(chunk.frequencyStart() + f) * npol + p];
          }
          result[(chunk.timeStart() + t) * npol + p] = NanStatistics.median(row);
        }
      }
    });
    return result;
  }
}
