package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Bandpass correction strategies.
 *
 * @since 1.0
 */
public enum BandpassMode {

  /** No correction. */
  NONE,
  /** Gain curve synthesized from the polyphase filter bank prototype. */
  STANDARD,
  /** Per-channel median spectrum rescaled to the per-subband median level. */
  MEDIAN,
  /** One per-channel curve shared by all subbands, from normalized subband profiles. */
  ADJUSTED;

  /**
   * Case-insensitive lookup.
   *
   * @param name mode name
   * @return mode
   * @throws ConfigurationException if the name is unknown
   */
  public static BandpassMode fromName(final String name) {
    final String normalized = StringUtils.trimToEmpty(name).toUpperCase(Locale.ROOT);
    for (BandpassMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new ConfigurationException(
        "Unknown bandpass correction '" + name + "', expected one of " + Arrays.toString(values()) + ".");
  }
}
