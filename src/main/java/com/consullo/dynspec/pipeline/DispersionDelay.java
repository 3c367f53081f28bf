package com.consullo.dynspec.pipeline;

/**
 * Arrival delay of a dispersed signal.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DispersionDelay {

  /**
   * Delay at {@code frequency} relative to infinite frequency.
   *
   * @param frequency Hz
   * @param dispersionMeasure pc cm^-3
   * @return seconds
   */
  double delay(double frequency, double dispersionMeasure);
}
