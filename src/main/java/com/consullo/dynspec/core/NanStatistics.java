package com.consullo.dynspec.core;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Descriptive statistics that ignore NaN entries.
 *
 * <p>Flagged samples are NaN by convention, so every reduction in the pipeline goes through here. All methods
 * return NaN when no finite-or-infinite (non-NaN) value is present.
 *
 * @since 1.0
 */
public final class NanStatistics {

  private NanStatistics() {
  }

  public static double median(final double[] values) {
    return median(values, values.length);
  }

  /**
   * Median of the first {@code length} entries. The array is not modified.
   *
   * @param values values, may contain NaN
   * @param length number of leading entries to consider
   * @return median of the non-NaN entries
   */
  public static double median(final double[] values, final int length) {
    final double[] kept = withoutNaN(values, length);
    if (kept.length == 0) {
      return Double.NaN;
    }
    return new Median().evaluate(kept);
  }

  public static double mean(final double[] values) {
    final double[] kept = withoutNaN(values, values.length);
    if (kept.length == 0) {
      return Double.NaN;
    }
    return new Mean().evaluate(kept);
  }

  /**
   * Population standard deviation.
   *
   * @param values values, may contain NaN
   * @return standard deviation of the non-NaN entries
   */
  public static double standardDeviation(final double[] values) {
    final double[] kept = withoutNaN(values, values.length);
    if (kept.length == 0) {
      return Double.NaN;
    }
    return new StandardDeviation(false).evaluate(kept);
  }

  private static double[] withoutNaN(final double[] values, final int length) {
    int count = 0;
    for (int i = 0; i < length; i++) {
      if (!Double.isNaN(values[i])) {
        count++;
      }
    }
    final double[] kept = new double[count];
    int j = 0;
    for (int i = 0; i < length; i++) {
      if (!Double.isNaN(values[i])) {
        kept[j++] = values[i];
      }
    }
    return kept;
  }
}
