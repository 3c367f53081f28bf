package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.DataShapeException;
import edu.emory.mathcs.jtransforms.fft.DoubleFFT_1D;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-channel power gain of the receiver's polyphase filter bank.
 *
 * <p>The prototype low-pass filter is 16 taps of a 1024-point bank, read from the classpath resource
 * {@value #RESOURCE}. For {@code n} channels it is zero-padded to {@code (n / 16) * 16384} samples and transformed
 * once; the response of each channel is the sum of the squared magnitudes of the middle slice
 * and of its left and right neighbours, and the gain is {@code (2^25 / sqrt(sum))^2}.
 *
 * @since 1.0
 */
public final class PolyphaseBandpass {

  private static final Logger LOGGER = LoggerFactory.getLogger(PolyphaseBandpass.class);

  static final String RESOURCE = "/bandpass_coeffs.dat";

  static final int TAPS = 16;

  private static final double FULL_SCALE = Math.pow(2, 25);

  private static final Map<Integer, double[]> CURVES = new ConcurrentHashMap<>();

  private PolyphaseBandpass() {
  }

  /**
   * Gain curve for subbands of {@code channels} channels, computed once per channel count.
   *
   * @param channels channels per subband, at least {@value #TAPS}
   * @return gain per channel (shared; callers must not modify it)
   * @throws DataShapeException if there are fewer than {@value #TAPS} channels
   */
  public static double[] gain(final int channels) {
    if (channels < TAPS) {
      throw new DataShapeException(
          "Standard bandpass needs at least " + TAPS + " channels per subband, got " + channels + ".");
    }
    return CURVES.computeIfAbsent(channels, n -> synthesize(Coefficients.VALUES, n));
  }

  static double[] synthesize(final double[] kernel, final int channels) {
    final int transformLength = Math.multiplyExact(channels / TAPS, kernel.length);
    final int mid = channels / 2;
    LOGGER.debug("Synthesizing bandpass for {} channels ({}-point transform)", channels, transformLength);
    final double[] spectrum = new double[Math.multiplyExact(2, transformLength)];
    System.arraycopy(kernel, 0, spectrum, 0, kernel.length);
    new DoubleFFT_1D(transformLength).realForwardFull(spectrum);
    final double[] curve = new double[channels];
    for (int k = 0; k < channels; k++) {
      final int middle = Math.floorMod(k - mid, transformLength);
      final int left = Math.floorMod(k - mid - channels, transformLength);
      final int right = k + mid;
      final double power = power(spectrum, middle) + power(spectrum, left) + power(spectrum, right);
      final double g = FULL_SCALE / Math.sqrt(power);
      curve[k] = g * g;
    }
    return curve;
  }

  /**
   * Squared magnitude of bin {@code bin} of an interleaved complex spectrum.
   */
  private static double power(final double[] spectrum, final int bin) {
    final double re = spectrum[2 * bin];
    final double im = spectrum[2 * bin + 1];
    return re * re + im * im;
  }

  static double[] load(final String resource) {
    try (InputStream in = PolyphaseBandpass.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + resource + ".");
      }
      final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      return reader.lines()
          .map(String::trim)
          .filter(StringUtils::isNotEmpty)
          .mapToDouble(Double::parseDouble)
          .toArray();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  private static final class Coefficients {

    static final double[] VALUES = load(RESOURCE);

    private Coefficients() {
    }
  }
}
