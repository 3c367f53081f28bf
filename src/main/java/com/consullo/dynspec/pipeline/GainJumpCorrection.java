package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.CubeStatistics;
import com.consullo.dynspec.core.NanStatistics;
import com.consullo.dynspec.core.SpectralCube;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the instrumental gain jumps that recur every six minutes.
 *
 * <p>For each polarization the time profile (median over frequency of the data divided by its median spectrum)
 * is clipped at {@code mean + 4 std}, the first jump is placed at the steepest descent of the profile modulo the
 * jump period, and every interval between jumps is fitted with {@code a log10(t) + b}, {@code t} counting samples
 * from 1 within the interval. Data are divided by the fitted curve.
 *
 * <p>The jumps are assumed to be exactly periodic; a drifting cadence misplaces the later intervals.
 *
 * @since 1.0
 */
public final class GainJumpCorrection implements CorrectionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(GainJumpCorrection.class);

  /** Switching period of the analog beamformer, seconds. */
  static final double JUMP_PERIOD = 360.0;

  private static final double CLIP_SIGMA = 4.0;

  private final boolean enabled;

  public GainJumpCorrection(final boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public String name() {
    return enabled ? "gain-jumps" : "gain-jumps(off)";
  }

  @Override
  public SpectrumSlice apply(final SpectrumSlice slice, final ChunkedEvaluator evaluator) {
    if (!enabled) {
      return slice;
    }
    LOGGER.info("Correcting for 6 min pointing jumps...");
    final SpectralCube cube = slice.cube();
    final int npol = cube.polarizationCount();
    final int n = cube.timeCount();
    final double[] frequencyProfile = CubeStatistics.medianOverTime(evaluator, cube);
    final double[] timeProfile = CubeStatistics.medianOverFrequency(evaluator, cube, frequencyProfile);
    final double[] fitted = new double[n * npol];
    final double[] profile = new double[n];
    for (int p = 0; p < npol; p++) {
      for (int t = 0; t < n; t++) {
        profile[t] = timeProfile[t * npol + p];
      }
      final double[] curve = fitCurve(profile, slice.dt());
      for (int t = 0; t < n; t++) {
        fitted[t * npol + p] = curve[t];
      }
    }
    return slice.withCube(cube.map(chunk -> {
      for (int t = 0; t < chunk.timeCount(); t++) {
        for (int f = 0; f < chunk.frequencyCount(); f++) {
          for (int p = 0; p < npol; p++) {
            chunk.set(t, f, p, chunk.get(t, f, p) / fitted[(chunk.timeStart() + t) * npol + p]);
          }
        }
      }
    }));
  }

  /**
   * Piecewise logarithmic model of a time profile.
   *
   * @param timeProfile profile, may contain NaN; not modified
   * @param dt sample spacing, seconds
   * @return product of the interval fits covering each sample, 1 where no interval could be fitted
   */
  static double[] fitCurve(final double[] timeProfile, final double dt) {
    final int n = timeProfile.length;
    final double[] curve = new double[n];
    Arrays.fill(curve, 1.0);
    if (n < 2) {
      return curve;
    }
    final double[] profile = clip(timeProfile);
    final List<Integer> edges = intervalEdges(profile, dt);
    for (int i = 0; i < edges.size() - 1; i++) {
      final int low = edges.get(i);
      final int high = edges.get(i + 1);
      final SimpleRegression regression = new SimpleRegression();
      for (int t = 1; t <= high - low + 1; t++) {
        final double y = profile[low + t - 1];
        if (!Double.isNaN(y)) {
          regression.addData(Math.log10(t), y);
        }
      }
      if (regression.getN() < 2) {
        LOGGER.warn("Interval [{}, {}] has too few valid samples to fit, left uncorrected", low, high);
        continue;
      }
      final double a = regression.getSlope();
      final double b = regression.getIntercept();
      for (int t = 1; t <= high - low + 1; t++) {
        curve[low + t - 1] *= a * Math.log10(t) + b;
      }
    }
    LOGGER.info("Found and corrected {} jump(s)", edges.size() - 2);
    return curve;
  }

  /**
   * Interval edges: 0, the periodic jump indices, and {@code n - 1}. Adjacent intervals share their edge sample,
   * which is divided by both fits.
   */
  static List<Integer> intervalEdges(final double[] profile, final double dt) {
    final int n = profile.length;
    final int jumpSamples = (int) Math.max(1, Math.round(JUMP_PERIOD / dt));
    final int intervals = (int) Math.ceil(n * dt / JUMP_PERIOD);
    final int firstJump = steepestDescent(profile) % jumpSamples;
    final List<Integer> edges = new ArrayList<>();
    edges.add(0);
    for (int j = 0; j < intervals - 1; j++) {
      final long jump = firstJump + (long) j * jumpSamples;
      if (jump > edges.get(edges.size() - 1) && jump < n - 1) {
        edges.add((int) jump);
      }
    }
    edges.add(n - 1);
    return edges;
  }

  private static double[] clip(final double[] values) {
    final double mean = NanStatistics.mean(values);
    final double threshold = mean + CLIP_SIGMA * NanStatistics.standardDeviation(values);
    final double[] result = values.clone();
    for (int i = 0; i < result.length; i++) {
      if (result[i] > threshold) {
        result[i] = mean;
      }
    }
    return result;
  }

  /**
   * Index of the minimum of the discrete derivative (central differences, one-sided at both ends).
   */
  static int steepestDescent(final double[] values) {
    final int n = values.length;
    int best = 0;
    double bestSlope = Double.POSITIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      final double slope;
      if (i == 0) {
        slope = values[1] - values[0];
      } else if (i == n - 1) {
        slope = values[n - 1] - values[n - 2];
      } else {
        slope = (values[i + 1] - values[i - 1]) / 2;
      }
      if (slope < bestSlope) {
        bestSlope = slope;
        best = i;
      }
    }
    return best;
  }
}
