package com.consullo.dynspec.core;

/**
 * Deferred three dimensional array indexed (time, frequency, polarization).
 *
 * <p>Nothing is evaluated until a rectangular region is requested through {@link #compute}. Implementations
 * either read from a memory-mapped lane file, wrap another cube with a per-chunk transform, or hold fully
 * materialized values ({@link DenseCube}). Regions are independent, so implementations must be safe to call
 * from several worker threads at once.
 *
 * @since 1.0
 */
public interface SpectralCube {

  int timeCount();

  int frequencyCount();

  int polarizationCount();

  /**
   * Evaluates the region [timeStart, timeStop) x [frequencyStart, frequencyStop) across all polarizations.
   *
   * @param timeStart first time index (inclusive)
   * @param timeStop last time index (exclusive)
   * @param frequencyStart first frequency index (inclusive)
   * @param frequencyStop last frequency index (exclusive)
   * @return newly allocated chunk owned by the caller
   */
  CubeChunk compute(int timeStart, int timeStop, int frequencyStart, int frequencyStop);

  /**
   * Returns a cube that applies {@code transform} to every chunk computed from this one.
   *
   * @param transform in-place chunk transform
   * @return deferred transformed cube
   */
  default SpectralCube map(final ChunkTransform transform) {
    return new TransformedCube(this, transform);
  }

  default boolean isEmpty() {
    return timeCount() == 0 || frequencyCount() == 0 || polarizationCount() == 0;
  }
}
