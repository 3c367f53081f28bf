package com.consullo.dynspec.pipeline;

/**
 * Cold plasma delay, {@code 4148.808 s MHz² cm³ pc⁻¹ * DM / f²}.
 *
 * @since 1.0
 */
public final class ColdPlasmaDispersionDelay implements DispersionDelay {

  /** Dispersion constant, s MHz² cm³ pc⁻¹. */
  public static final double DISPERSION_CONSTANT = 4148.808;

  @Override
  public double delay(final double frequency, final double dispersionMeasure) {
    final double megahertz = frequency / 1e6;
    return DISPERSION_CONSTANT * dispersionMeasure / (megahertz * megahertz);
  }
}
