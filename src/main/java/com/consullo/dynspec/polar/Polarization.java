package com.consullo.dynspec.polar;

import com.consullo.dynspec.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Quantities derived from the eJones matrix.
 *
 * @since 1.0
 */
public enum Polarization {

  /** Total intensity, {@code XX + YY}. */
  I {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return xx + yy;
    }
  },
  /** {@code XX - YY}. */
  Q {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return xx - yy;
    }
  },
  /** {@code 2 Re(XY*)}. */
  U {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return 2 * xyReal;
    }
  },
  /** {@code 2 Im(XY*)}. */
  V {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return 2 * xyImag;
    }
  },
  /** Linear polarization, {@code sqrt(Q² + U²)}. */
  L {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      final double q = xx - yy;
      final double u = 2 * xyReal;
      return Math.sqrt(q * q + u * u);
    }
  },
  XX {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return xx;
    }
  },
  YY {
    @Override
    public double extract(final double xx, final double yy, final double xyReal, final double xyImag) {
      return yy;
    }
  };

  /**
   * Computes this quantity from the real components of one eJones matrix.
   *
   * @param xx Re(XX)
   * @param yy Re(YY)
   * @param xyReal Re(XY*)
   * @param xyImag Im(XY*)
   * @return derived value
   */
  public abstract double extract(double xx, double yy, double xyReal, double xyImag);

  /**
   * Parses a single token, case-insensitively.
   *
   * @param token polarization name
   * @return polarization
   * @throws ConfigurationException if the name is unknown
   */
  public static Polarization fromToken(final String token) {
    final String name = StringUtils.trimToEmpty(token).toUpperCase(Locale.ROOT);
    for (Polarization polarization : values()) {
      if (polarization.name().equals(name)) {
        return polarization;
      }
    }
    throw new ConfigurationException("Unsupported polarization '" + token + "'.");
  }

  /**
   * Parses a selector such as {@code "IV"}, {@code "xx"} or {@code "I,XX,V"}.
   *
   * <p>A selector containing a comma is a token list; {@code XX} and {@code YY} alone are single tokens; any other
   * selector is read one letter per polarization.
   *
   * @param selector selector string
   * @return polarizations in request order
   * @throws ConfigurationException if the selector is empty or names an unknown polarization
   */
  public static List<Polarization> parseAll(final String selector) {
    if (StringUtils.isBlank(selector)) {
      throw new ConfigurationException("Polarization selector must not be empty.");
    }
    final String trimmed = selector.trim();
    final List<Polarization> result = new ArrayList<>();
    if (trimmed.contains(",")) {
      for (String token : trimmed.split(",")) {
        result.add(fromToken(token));
      }
    } else if (trimmed.equalsIgnoreCase(XX.name()) || trimmed.equalsIgnoreCase(YY.name())) {
      result.add(fromToken(trimmed));
    } else {
      for (char letter : trimmed.toCharArray()) {
        result.add(fromToken(String.valueOf(letter)));
      }
    }
    return Collections.unmodifiableList(result);
  }
}
