package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;

/**
 * Placeholder for interference excision; passes data through unchanged.
 *
 * @since 1.0
 */
public final class RfiMitigation implements CorrectionStage {

  @Override
  public String name() {
    return "rfi";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    return slice;
  }
}
