package com.consullo.dynspec.core;

import org.apache.commons.lang3.Validate;

/**
 * Fully materialized cube.
 *
 * <p>Produced by {@link ChunkedEvaluator#materialize(SpectralCube)}. Stages that need random access into complete
 * time series (dedispersion) mutate it directly; afterwards it can be used as the source of further deferred
 * stages like any other cube.
 *
 * @since 1.0
 */
public final class DenseCube implements SpectralCube {

  private final int timeCount;
  private final int frequencyCount;
  private final int polarizationCount;
  private final double[] values;

  public DenseCube(final int timeCount, final int frequencyCount, final int polarizationCount) {
    this(timeCount, frequencyCount, polarizationCount,
        new double[Math.multiplyExact(Math.multiplyExact(timeCount, frequencyCount), polarizationCount)]);
  }

  public DenseCube(final int timeCount, final int frequencyCount, final int polarizationCount, final double[] values) {
    Validate.notNull(values, "values must not be null");
    Validate.isTrue(timeCount >= 0 && frequencyCount >= 0 && polarizationCount >= 0,
        "cube dimensions must be non-negative");
    Validate.isTrue(values.length == timeCount * frequencyCount * polarizationCount,
        "values length %d does not match %dx%dx%d", values.length, timeCount, frequencyCount, polarizationCount);
    this.timeCount = timeCount;
    this.frequencyCount = frequencyCount;
    this.polarizationCount = polarizationCount;
    this.values = values;
  }

  @Override
  public int timeCount() {
    return timeCount;
  }

  @Override
  public int frequencyCount() {
    return frequencyCount;
  }

  @Override
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

  public double[] values() {
    return values;
  }

  /**
   * Copies a chunk into this cube at the chunk's own origin.
   *
   * @param chunk chunk computed from a cube of identical shape
   */
  public void paste(final CubeChunk chunk) {
    for (int t = 0; t < chunk.timeCount(); t++) {
      final int dst = index(chunk.timeStart() + t, chunk.frequencyStart(), 0);
      final int src = chunk.index(t, 0, 0);
      System.arraycopy(chunk.values(), src, values, dst, chunk.frequencyCount() * polarizationCount);
    }
  }

  @Override
  public CubeChunk compute(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    final CubeChunk chunk = new CubeChunk(
        timeStart, timeStop - timeStart, frequencyStart, frequencyStop - frequencyStart, polarizationCount);
    final int rowLength = chunk.frequencyCount() * polarizationCount;
    for (int t = 0; t < chunk.timeCount(); t++) {
      System.arraycopy(values, index(timeStart + t, frequencyStart, 0), chunk.values(), chunk.index(t, 0, 0), rowLength);
    }
    return chunk;
  }
}
