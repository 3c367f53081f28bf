package com.consullo.dynspec.core;

import org.apache.commons.lang3.Validate;

/**
 * Deferred cube that runs a {@link ChunkTransform} over every region computed from its source.
 *
 * @since 1.0
 */
public final class TransformedCube implements SpectralCube {

  private final SpectralCube source;
  private final ChunkTransform transform;

  public TransformedCube(final SpectralCube source, final ChunkTransform transform) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(transform, "transform must not be null");
    this.source = source;
    this.transform = transform;
  }

  @Override
  public int timeCount() {
    return source.timeCount();
  }

  @Override
  public int frequencyCount() {
    return source.frequencyCount();
  }

  @Override
  public int polarizationCount() {
    return source.polarizationCount();
  }

  @Override
  public CubeChunk compute(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    final CubeChunk chunk = source.compute(timeStart, timeStop, frequencyStart, frequencyStop);
    transform.apply(chunk);
    return chunk;
  }
}
