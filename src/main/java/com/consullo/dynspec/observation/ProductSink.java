package com.consullo.dynspec.observation;

import java.io.IOException;

/**
 * Receives exported products, typically to write them into a container file.
 *
 * <p>Call order: {@link #begin} once, {@link #accept} once per (beam, polarization selector), {@link #end} once.
 *
 * @since 1.0
 */
public interface ProductSink {

  void begin(ObservationSummary summary) throws IOException;

  /**
   * Receives one product.
   *
   * @param product retrieved product; {@link ResultProduct#beam()} identifies the beam
   * @param polarization selector the product was retrieved with
   * @throws IOException if the product cannot be stored
   */
  void accept(ResultProduct product, String polarization) throws IOException;

  void end() throws IOException;
}
