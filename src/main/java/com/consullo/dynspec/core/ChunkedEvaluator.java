package com.consullo.dynspec.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forces evaluation of deferred cubes on a fixed pool of worker threads.
 *
 * <p>Work is split into rectangular chunks that are computed independently:
 * <ul>
 * <li>time blocks ({@code timeChunkSize} samples, all channels) for materialization and per-time reductions</li>
 * <li>frequency blocks ({@code frequencyChunkSize} channels, all samples) for per-channel reductions</li>
 * </ul>
 * Consumers passed to the block iterators are called concurrently and must only write to locations owned by
 * the chunk they receive.
 * </p>
 *
 * @since 1.0
 */
public final class ChunkedEvaluator implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedEvaluator.class);

  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  private final EvaluationConfig config;
  private final ExecutorService workers;

  public ChunkedEvaluator(final EvaluationConfig config) {
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(config.workerThreads() > 0, "workerThreads must be positive");
    Validate.isTrue(config.timeChunkSize() > 0, "timeChunkSize must be positive");
    Validate.isTrue(config.frequencyChunkSize() > 0, "frequencyChunkSize must be positive");
    this.config = config;
    final int pool = POOL_SEQUENCE.incrementAndGet();
    final AtomicInteger threadSequence = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(config.workerThreads(), runnable -> {
      final Thread worker = new Thread(runnable, "DynspecWorker-" + pool + "-" + threadSequence.incrementAndGet());
      worker.setDaemon(true);
      return worker;
    });
  }

  public EvaluationConfig config() {
    return config;
  }

  /**
   * Computes every value of {@code cube}.
   *
   * @param cube deferred cube
   * @return materialized copy
   */
  public DenseCube materialize(final SpectralCube cube) {
    Validate.notNull(cube, "cube must not be null");
    if (cube instanceof DenseCube) {
      return (DenseCube) cube;
    }
    final DenseCube dense = new DenseCube(cube.timeCount(), cube.frequencyCount(), cube.polarizationCount());
    LOGGER.debug("materialize: {}x{}x{} in time blocks of {}",
        cube.timeCount(), cube.frequencyCount(), cube.polarizationCount(), config.timeChunkSize());
    forEachTimeBlock(cube, dense::paste);
    return dense;
  }

  /**
   * Computes {@code cube} in blocks of consecutive time samples spanning all channels.
   *
   * @param cube deferred cube
   * @param consumer called once per block, possibly concurrently
   */
  public void forEachTimeBlock(final SpectralCube cube, final Consumer<CubeChunk> consumer) {
    final int step = config.timeChunkSize();
    final List<Callable<Void>> tasks = new ArrayList<>();
    for (int start = 0; start < cube.timeCount(); start += step) {
      final int t0 = start;
      final int t1 = Math.min(cube.timeCount(), start + step);
      tasks.add(() -> {
        consumer.accept(cube.compute(t0, t1, 0, cube.frequencyCount()));
        return null;
      });
    }
    runAll(tasks);
  }

  /**
   * Computes {@code cube} in blocks of consecutive channels spanning all time samples.
   *
   * @param cube deferred cube
   * @param consumer called once per block, possibly concurrently
   */
  public void forEachFrequencyBlock(final SpectralCube cube, final Consumer<CubeChunk> consumer) {
    final int step = config.frequencyChunkSize();
    final List<Callable<Void>> tasks = new ArrayList<>();
    for (int start = 0; start < cube.frequencyCount(); start += step) {
      final int f0 = start;
      final int f1 = Math.min(cube.frequencyCount(), start + step);
      tasks.add(() -> {
        consumer.accept(cube.compute(0, cube.timeCount(), f0, f1));
        return null;
      });
    }
    runAll(tasks);
  }

  private void runAll(final List<Callable<Void>> tasks) {
    if (tasks.isEmpty()) {
      return;
    }
    final List<Future<Void>> futures;
    try {
      futures = workers.invokeAll(tasks);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating chunks.", e);
    }
    for (Future<Void> future : futures) {
      try {
        future.get();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while evaluating chunks.", e);
      } catch (final ExecutionException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new IllegalStateException("Chunk evaluation failed.", cause);
      }
    }
  }

  @Override
  public void close() {
    workers.shutdownNow();
  }
}
