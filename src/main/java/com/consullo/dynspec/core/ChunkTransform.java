package com.consullo.dynspec.core;

/**
 * In-place transform applied to each chunk of a deferred cube.
 *
 * <p>Implementations may use the chunk origin to look up per-time or per-channel factors, and must not depend
 * on the order in which chunks are visited.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ChunkTransform {

  void apply(CubeChunk chunk);
}
