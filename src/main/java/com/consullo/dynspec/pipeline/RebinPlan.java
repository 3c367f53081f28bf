package com.consullo.dynspec.pipeline;

import org.apache.commons.lang3.Validate;

/**
 * Block averaging of one axis.
 *
 * <p>{@code width = floor(target / native)} samples (at least 1), {@code bins = floor(n / width)} (at least 1),
 * {@code leftover = n mod bins} trailing samples are dropped and each bin averages {@code (n - leftover) / bins}
 * consecutive samples.
 *
 * @param length samples before rebinning
 * @param width requested bin width in native samples
 * @param bins output samples
 * @param groupSize samples averaged per bin
 * @param leftover trailing samples dropped
 * @since 1.0
 */
public record RebinPlan(int length, int width, int bins, int groupSize, int leftover) {

  /** Absorbs rounding in {@code target / native} when the target is a whole number of native samples. */
  private static final double RATIO_TOLERANCE = 1e-9;

  public static RebinPlan of(final int length, final double target, final double nativeWidth) {
    Validate.isTrue(length > 0, "length must be positive");
    Validate.isTrue(target > 0 && nativeWidth > 0, "bin widths must be positive");
    final int width = (int) Math.max(1, Math.floor(target / nativeWidth + RATIO_TOLERANCE));
    final int bins = Math.max(1, length / width);
    final int leftover = length % bins;
    return new RebinPlan(length, width, bins, (length - leftover) / bins, leftover);
  }

  /**
   * NaN-ignoring mean of every group of an axis.
   *
   * @param axis axis values, {@link #length()} long
   * @return {@link #bins()} averaged values
   */
  public double[] average(final double[] axis) {
    Validate.isTrue(axis.length == length, "axis has %d values, expected %d", axis.length, length);
    final double[] result = new double[bins];
    for (int b = 0; b < bins; b++) {
      result[b] = nanMean(axis, b * groupSize, groupSize);
    }
    return result;
  }

  static double nanMean(final double[] values, final int start, final int count) {
    double sum = 0;
    int valid = 0;
    for (int i = start; i < start + count; i++) {
      if (!Double.isNaN(values[i])) {
        sum += values[i];
        valid++;
      }
    }
    return valid == 0 ? Double.NaN : sum / valid;
  }
}
