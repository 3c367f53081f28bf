package com.consullo.dynspec.observation;

import java.time.Instant;
import java.util.List;

/**
 * Observation-level metadata handed to a {@link ProductSink}.
 *
 * @param timeStart first sample, Unix seconds
 * @param timeEnd last sample, Unix seconds
 * @param frequencyMin lower band edge, Hz
 * @param frequencyMax upper band edge, Hz
 * @param dt native time resolution, seconds
 * @param df native frequency resolution, Hz
 * @param channelsPerSubband channels per subband
 * @param beams available beam ids, ascending
 * @since 1.0
 */
public record ObservationSummary(
    double timeStart,
    double timeEnd,
    double frequencyMin,
    double frequencyMax,
    double dt,
    double df,
    int channelsPerSubband,
    List<Integer> beams) {

  public ObservationSummary {
    beams = List.copyOf(beams);
  }

  public Instant startInstant() {
    return toInstant(timeStart);
  }

  public Instant endInstant() {
    return toInstant(timeEnd);
  }

  public double frequencyCenter() {
    return (frequencyMin + frequencyMax) / 2;
  }

  static Instant toInstant(final double unixSeconds) {
    final long seconds = (long) Math.floor(unixSeconds);
    final long nanos = Math.round((unixSeconds - seconds) * 1e9);
    return Instant.ofEpochSecond(seconds, nanos);
  }
}
