package com.consullo.dynspec.core;

import org.apache.commons.lang3.Validate;

/**
 * Dense rectangular block of a {@link SpectralCube}.
 *
 * <p>Values are stored time-major: {@code ((t * frequencyCount) + f) * polarizationCount + p}. Accessors take
 * indices local to the chunk; {@link #timeStart()} and {@link #frequencyStart()} give the chunk origin inside the
 * cube it was computed from.
 *
 * @since 1.0
 */
public final class CubeChunk {

  private final int timeStart;
  private final int timeCount;
  private final int frequencyStart;
  private final int frequencyCount;
  private final int polarizationCount;
  private final double[] values;

  public CubeChunk(
      final int timeStart,
      final int timeCount,
      final int frequencyStart,
      final int frequencyCount,
      final int polarizationCount) {
    this(timeStart, timeCount, frequencyStart, frequencyCount, polarizationCount, allocate(
        timeCount, frequencyCount, polarizationCount));
  }

  private CubeChunk(
      final int timeStart,
      final int timeCount,
      final int frequencyStart,
      final int frequencyCount,
      final int polarizationCount,
      final double[] values) {
    this.timeStart = timeStart;
    this.timeCount = timeCount;
    this.frequencyStart = frequencyStart;
    this.frequencyCount = frequencyCount;
    this.polarizationCount = polarizationCount;
    this.values = values;
  }

  private static double[] allocate(final int timeCount, final int frequencyCount, final int polarizationCount) {
    Validate.isTrue(timeCount >= 0 && frequencyCount >= 0 && polarizationCount >= 0,
        "chunk dimensions must be non-negative");
    return new double[Math.multiplyExact(Math.multiplyExact(timeCount, frequencyCount), polarizationCount)];
  }

  /**
   * Same values placed at another origin.
   *
   * @param newTimeStart time origin in the target cube
   * @param newFrequencyStart frequency origin in the target cube
   * @return chunk sharing this chunk's values
   */
  public CubeChunk withOrigin(final int newTimeStart, final int newFrequencyStart) {
    return new CubeChunk(newTimeStart, timeCount, newFrequencyStart, frequencyCount, polarizationCount, values);
  }

  public int timeStart() {
    return timeStart;
  }

  public int timeCount() {
    return timeCount;
  }

  public int frequencyStart() {
    return frequencyStart;
  }

  public int frequencyCount() {
    return frequencyCount;
  }

  public int polarizationCount() {
    return polarizationCount;
  }

  public int index(final int t, final int f, final int p) {
    return ((t * frequencyCount) + f) * polarizationCount + p;
  }

  public double get(final int t, final int f, final int p) {
    return values[index(t, f, p)];
  }

  public void set(final int t, final int f, final int p, final double value) {
    values[index(t, f, p)] = value;
  }

  /**
   * Backing array, shared rather than copied.
   *
   * @return values in time-major order
   */
  public double[] values() {
    return values;
  }
}
