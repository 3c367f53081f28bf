package com.consullo.dynspec.core;

/**
 * Worker pool and chunking parameters for deferred cube evaluation.
 *
 * @param workerThreads number of worker threads evaluating chunks in parallel
 * @param timeChunkSize time samples per chunk when evaluating by time blocks (materialization, per-time medians)
 * @param frequencyChunkSize channels per chunk when evaluating by frequency blocks (per-channel medians)
 * @since 1.0
 */
public record EvaluationConfig(
    int workerThreads,
    int timeChunkSize,
    int frequencyChunkSize) {

  /**
   * One worker per available processor, 4096-sample time chunks and 256-channel frequency chunks.
   *
   * @return default configuration
   */
  public static EvaluationConfig defaults() {
    return new EvaluationConfig(Runtime.getRuntime().availableProcessors(), 4096, 256);
  }
}
