package com.consullo.dynspec.pipeline;

/**
 * Correction pipeline settings for one retrieval.
 *
 * @param bandpassMode bandpass strategy
 * @param edgeChannels channels flagged at each subband edge, 0 to disable
 * @param jumpCorrection whether to remove the periodic gain jumps
 * @param dispersionMeasure pc cm^-3, null to disable dedispersion
 * @param rebinDt target time bin width in seconds, null to keep native resolution
 * @param rebinDf target frequency bin width in Hz, null to keep native resolution
 * @since 1.0
 */
public record PipelineConfig(
    BandpassMode bandpassMode,
    int edgeChannels,
    boolean jumpCorrection,
    Double dispersionMeasure,
    Double rebinDt,
    Double rebinDf) {

  public static PipelineConfig defaults() {
    return new PipelineConfig(BandpassMode.NONE, 0, false, null, null, null);
  }
}
