package com.consullo.dynspec.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for NaN-aware reductions.
 *
 * @since 1.0
 */
public class CubeStatisticsTest {

  @Test
  @DisplayName("Should ignore NaN in median, mean and standard deviation")
  void nanStatistics_WithNaN_Ignored() {
    final double[] values = {1, Double.NaN, 3, 2, Double.NaN};

    assertThat(NanStatistics.median(values)).isEqualTo(2.0);
    assertThat(NanStatistics.mean(values)).isEqualTo(2.0);
    assertThat(NanStatistics.standardDeviation(new double[] {2, 4, Double.NaN, 4, 4, 5, 5, 7, 9})).isEqualTo(2.0);
    assertThat(NanStatistics.median(new double[] {Double.NaN})).isNaN();
  }

  @Test
  @DisplayName("Should reduce along time per channel and along frequency per sample")
  void medians_BothAxes_PerPolarization() {
    // value = 10 * t + f for p = 0 and -(10 * t + f) for p = 1
    final DenseCube cube = new DenseCube(5, 3, 2);
    for (int t = 0; t < 5; t++) {
      for (int f = 0; f < 3; f++) {
        cube.set(t, f, 0, 10 * t + f);
        cube.set(t, f, 1, -(10 * t + f));
      }
    }
    cube.set(4, 2, 0, Double.NaN);

    try (ChunkedEvaluator evaluator = new ChunkedEvaluator(new EvaluationConfig(2, 2, 2))) {
      final double[] overTime = CubeStatistics.medianOverTime(evaluator, cube);
      final double[] overFrequency = CubeStatistics.medianOverFrequency(evaluator, cube, null);

      assertThat(overTime).containsExactly(20, -20, 21, -21, 17, -22);
      assertThat(overFrequency).containsExactly(1, -1, 11, -11, 21, -21, 31, -31, 40.5, -41);
    }
  }

  @Test
  @DisplayName("Should divide by the per-channel profile before reducing along frequency")
  void medianOverFrequency_WithDivisor_Normalizes() {
    final DenseCube cube = new DenseCube(2, 3, 1, new double[] {2, 4, 8, 4, 8, 16});

    try (ChunkedEvaluator evaluator = new ChunkedEvaluator(new EvaluationConfig(1, 1, 1))) {
      final double[] profile = CubeStatistics.medianOverFrequency(evaluator, cube, new double[] {1, 2, 4});

      assertThat(profile).containsExactly(2, 4);
    }
  }
}
