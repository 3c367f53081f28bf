package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;

/**
 * One transform of the correction pipeline.
 *
 * <p>Stages return deferred cubes wherever possible; {@code evaluator} is only used for reductions the stage needs
 * and for stages that require the full time series.
 *
 * @since 1.0
 */
public interface CorrectionStage {

  String name();

  SpectrumSlice apply(SpectrumSlice slice, ChunkedEvaluator evaluator);
}
