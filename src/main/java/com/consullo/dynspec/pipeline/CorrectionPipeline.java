package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered correction stages, materialized once at the end.
 *
 * @since 1.0
 */
public final class CorrectionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionPipeline.class);

  private final List<CorrectionStage> stages;

  public CorrectionPipeline(final List<CorrectionStage> stages) {
    Validate.notNull(stages, "stages must not be null");
    this.stages = List.copyOf(stages);
  }

  /**
   * Fixed stage order: bandpass, edge flagging, RFI, gain jumps, dedispersion, rebinning.
   *
   * @param config pipeline settings
   * @param dispersionDelay delay relation used by dedispersion
   * @param referenceFrequency dedispersion reference (top of the selected band), Hz
   * @return pipeline
   */
  public static CorrectionPipeline standard(
      final PipelineConfig config, final DispersionDelay dispersionDelay, final double referenceFrequency) {
    Validate.notNull(config, "config must not be null");
    return new CorrectionPipeline(List.of(
        new BandpassCorrection(config.bandpassMode()),
        new EdgeChannelFlagging(config.edgeChannels()),
        new RfiMitigation(),
        new GainJumpCorrection(config.jumpCorrection()),
        new Dedispersion(config.dispersionMeasure(), dispersionDelay, referenceFrequency),
        new Rebinning(config.rebinDt(), config.rebinDf())));
  }

  public List<CorrectionStage> stages() {
    return stages;
  }

  /**
   * Runs every stage, then forces evaluation.
   *
   * @param slice input slice (deferred)
   * @param evaluator worker pool
   * @return slice backed by a materialized cube
   */
  public SpectrumSlice run(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    SpectrumSlice current = slice;
    for (CorrectionStage stage : stages) {
      LOGGER.debug("Stage {}", stage.name());
      current = stage.apply(current, evaluator);
    }
    return current.withCube(evaluator.materialize(current.cube()));
  }
}
