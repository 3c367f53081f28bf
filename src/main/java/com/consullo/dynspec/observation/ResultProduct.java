package com.consullo.dynspec.observation;

import com.consullo.dynspec.DataShapeException;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Dense dynamic spectrum returned by one retrieval.
 *
 * <p>Values are indexed (time, frequency, polarization), time-major. Flagged samples are NaN.
 *
 * @since 1.0
 */
public final class ResultProduct {

  private final int beam;
  private final double[] times;
  private final double[] frequencies;
  private final List<String> polarizations;
  private final double[] values;

  public ResultProduct(
      final int beam,
      final double[] times,
      final double[] frequencies,
      final List<String> polarizations,
      final double[] values) {
    Validate.notNull(times, "times must not be null");
    Validate.notNull(frequencies, "frequencies must not be null");
    Validate.notEmpty(polarizations, "polarizations must not be empty");
    Validate.notNull(values, "values must not be null");
    if ((long) times.length * frequencies.length * polarizations.size() != values.length) {
      throw new DataShapeException("Product of " + values.length + " values does not match "
          + times.length + "x" + frequencies.length + "x" + polarizations.size() + ".");
    }
    this.beam = beam;
    this.times = times;
    this.frequencies = frequencies;
    this.polarizations = List.copyOf(polarizations);
    this.values = values;
  }

  /**
   * Stacks per-lane products along frequency, in list order.
   *
   * @param parts products sharing beam, time axis length and polarizations
   * @return combined product
   * @throws DataShapeException if the parts have different time lengths or polarizations
   */
  public static ResultProduct concatFrequency(final List<ResultProduct> parts) {
    Validate.notEmpty(parts, "parts must not be empty");
    final ResultProduct first = parts.get(0);
    if (parts.size() == 1) {
      return first;
    }
    final int nt = first.timeCount();
    final int npol = first.polarizationCount();
    int nf = 0;
    for (ResultProduct part : parts) {
      if (part.timeCount() != nt) {
        throw new DataShapeException("Cannot stitch lanes with " + nt + " and " + part.timeCount() + " samples.");
      }
      if (!part.polarizations.equals(first.polarizations)) {
        throw new DataShapeException("Cannot stitch lanes with polarizations " + first.polarizations + " and "
            + part.polarizations + ".");
      }
      nf += part.frequencyCount();
    }
    final double[] frequencies = new double[nf];
    final double[] values = new double[nt * nf * npol];
    int offset = 0;
    for (ResultProduct part : parts) {
      final int width = part.frequencyCount();
      System.arraycopy(part.frequencies, 0, frequencies, offset, width);
      for (int t = 0; t < nt; t++) {
        System.arraycopy(part.values, t * width * npol, values, (t * nf + offset) * npol, width * npol);
      }
      offset += width;
    }
    return new ResultProduct(first.beam, first.times, frequencies, first.polarizations, values);
  }

  public int beam() {
    return beam;
  }

  public int timeCount() {
    return times.length;
  }

  public int frequencyCount() {
    return frequencies.length;
  }

  public int polarizationCount() {
    return polarizations.size();
  }

  /**
   * Time axis, shared.
   *
   * @return Unix seconds
   */
  public double[] times() {
    return times;
  }

  /**
   * Frequency axis, shared.
   *
   * @return Hz
   */
  public double[] frequencies() {
    return frequencies;
  }

  public List<String> polarizations() {
    return polarizations;
  }

  public double get(final int t, final int f, final int p) {
    return values[(t * frequencies.length + f) * polarizations.size() + p];
  }

  /**
   * Backing array, shared.
   *
   * @return values, time-major
   */
  public double[] values() {
    return values;
  }
}
