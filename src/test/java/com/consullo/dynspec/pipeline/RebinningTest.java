package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.DenseCube;
import com.consullo.dynspec.core.EvaluationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for block averaging.
 *
 * @since 1.0
 */
public class RebinningTest {

  @Test
  @DisplayName("Should split 100 samples into 10 bins of 10 without leftover")
  void plan_Width10_NoLeftover() {
    final RebinPlan plan = RebinPlan.of(100, 10 * 0.1, 0.1);

    assertThat(plan.bins()).isEqualTo(10);
    assertThat(plan.groupSize()).isEqualTo(10);
    assertThat(plan.leftover()).isZero();
  }

  @Test
  @DisplayName("Should split 100 samples into 3 bins of 33 and leave 1 over")
  void plan_Width33_LeftoverOne() {
    final RebinPlan plan = RebinPlan.of(100, 33, 1);

    assertThat(plan.width()).isEqualTo(33);
    assertThat(plan.bins()).isEqualTo(3);
    assertThat(plan.groupSize()).isEqualTo(33);
    assertThat(plan.leftover()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should clamp widths below one sample and above the axis length")
  void plan_ExtremeWidths_Clamped() {
    assertThat(RebinPlan.of(10, 0.2, 1).bins()).isEqualTo(10);
    assertThat(RebinPlan.of(10, 50, 1).bins()).isEqualTo(1);
    assertThat(RebinPlan.of(10, 50, 1).groupSize()).isEqualTo(10);
  }

  @Test
  @DisplayName("Should average data and axes ignoring NaN, time before frequency")
  void apply_BothAxes_NanMean() {
    final DenseCube cube = new DenseCube(100, 4, 1);
    for (int t = 0; t < 100; t++) {
      for (int f = 0; f < 4; f++) {
        cube.set(t, f, 0, t + 1000 * f);
      }
    }
    cube.set(0, 0, 0, Double.NaN);
    final SpectrumSlice slice = PipelineFixtures.slice(cube, 2);

    try (ChunkedEvaluator evaluator = new ChunkedEvaluator(new EvaluationConfig(2, 3, 1))) {
      final SpectrumSlice result = new Rebinning(33 * PipelineFixtures.DT, 2 * PipelineFixtures.DF)
          .apply(slice, evaluator);
      final DenseCube data = evaluator.materialize(result.cube());

      assertThat(data.timeCount()).isEqualTo(3);
      assertThat(data.frequencyCount()).isEqualTo(2);
      assertThat(result.times()).hasSize(3);
      assertThat(result.times()[0]).isCloseTo(1_600_000_000.0 + 16 * PipelineFixtures.DT, within(1e-6));
      assertThat(result.frequencies()).containsExactly(50e6 + 500, 50e6 + 2500);
      // bin (0, 0): channel 0 mean over t = 1..32 is 16.5, channel 1 over t = 0..32 is 1016
      assertThat(data.get(0, 0, 0)).isCloseTo((16.5 + 1016) / 2, within(1e-9));
      assertThat(data.get(2, 1, 0)).isCloseTo(82 + 2500, within(1e-9));
    }
  }

  @Test
  @DisplayName("Should leave axes without a configured width untouched")
  void apply_NoWidths_Identity() {
    final SpectrumSlice slice = PipelineFixtures.slice(new DenseCube(5, 2, 1), 2);

    try (ChunkedEvaluator evaluator = new ChunkedEvaluator(EvaluationConfig.defaults())) {
      final SpectrumSlice result = new Rebinning(null, null).apply(slice, evaluator);

      assertThat(result.cube()).isSameAs(slice.cube());
      assertThat(result.times()).isSameAs(slice.times());
    }
  }
}
