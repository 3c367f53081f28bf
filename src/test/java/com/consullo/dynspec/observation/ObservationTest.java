package com.consullo.dynspec.observation;

import com.consullo.dynspec.ConfigurationException;
import com.consullo.dynspec.DataAvailabilityException;
import com.consullo.dynspec.DataShapeException;
import com.consullo.dynspec.core.EvaluationConfig;
import com.consullo.dynspec.lane.LaneFileFixture;
import com.consullo.dynspec.pipeline.BandpassMode;
import com.consullo.dynspec.pipeline.PolyphaseBandpass;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for lane aggregation, selection and stitching.
 *
 * @since 1.0
 */
public class ObservationTest {

  private static final EvaluationConfig SMALL_CHUNKS = new EvaluationConfig(2, 3, 8);

  @TempDir
  Path tempDir;

  private Observation open(final Path... files) throws Exception {
    return Observation.builder().laneFiles(List.of(files)).evaluationConfig(SMALL_CHUNKS).open();
  }

  private Path fourChannelLane(final String name, final int channelId) throws Exception {
    return LaneFileFixture.lane()
        .fftLength(4)
        .subbands(new int[] {channelId}, new int[] {0})
        .write(tempDir.resolve(name));
  }

  @Test
  @DisplayName("Should stitch two one-subband lanes along frequency over the full selection")
  void get_TwoLanes_ConcatenatedFrequencyAxis() throws Exception {
    try (Observation observation = open(fourChannelLane("obs_0.spectra", 100), fourChannelLane("obs_1.spectra", 101))) {
      final ResultProduct product = observation.get("I");

      assertThat(product.frequencyCount()).isEqualTo(8);
      assertThat(product.polarizationCount()).isEqualTo(1);
      assertThat(product.polarizations()).containsExactly("I");
      // the selection stops before the sample nearest to tmax
      assertThat(product.timeCount()).isEqualTo(7);
      assertThat(product.frequencies()).isSorted();
      assertThat(product.values()).containsOnly(2.0);
    }
  }

  @Test
  @DisplayName("Should keep the attach order of lanes when stitching")
  void get_LaneOrder_Preserved() throws Exception {
    try (Observation observation = open(fourChannelLane("obs_1.spectra", 101), fourChannelLane("obs_0.spectra", 100))) {
      final double[] frequencies = observation.get("I").frequencies();

      assertThat(frequencies[0]).isGreaterThan(frequencies[4]);
    }
  }

  @Test
  @DisplayName("Should derive global extents from all lanes")
  void extents_TwoLanes_Aggregated() throws Exception {
    try (Observation observation = open(fourChannelLane("obs_0.spectra", 100), fourChannelLane("obs_1.spectra", 101))) {
      final double subband = 195312.5;

      assertThat(observation.fmin()).isCloseTo(99.5 * subband, within(1e-6));
      assertThat(observation.fmax()).isCloseTo(101.5 * subband, within(1e-6));
      assertThat(observation.dt()).isCloseTo(5.12e-6 * 4, within(1e-15));
      assertThat(observation.channelsPerSubband()).isEqualTo(4);
      assertThat(observation.timeRange()).containsExactly(observation.tmin(), observation.tmax());
      assertThat(observation.summary().beams()).containsExactly(0);
    }
  }

  @Test
  @DisplayName("Should slice time by nearest sample, stop exclusive")
  void get_TimeRange_NearestSamples() throws Exception {
    final Path lane = LaneFileFixture.lane()
        .blocks(3)
        .samples((component, time, subband, channel) -> component == 0 ? time : 0)
        .write(tempDir.resolve("obs_0.spectra"));

    try (Observation observation = open(lane)) {
      final double t0 = observation.tmin();
      final double dt = observation.dt();
      observation.setTimeRange(t0 + 2.2 * dt, t0 + 6.6 * dt);

      final ResultProduct product = observation.get("XX");

      assertThat(product.timeCount()).isEqualTo(5);
      assertThat(product.times()[0]).isCloseTo(t0 + 2 * dt, within(1e-6));
      assertThat(product.get(0, 0, 0)).isEqualTo(2.0);
      assertThat(product.get(4, 15, 0)).isEqualTo(6.0);
    }
  }

  @Test
  @DisplayName("Should return only the channels of the selected beam, skipping lanes without it")
  void get_BeamSelection_OnlyBeamChannels() throws Exception {
    final Path lane0 = LaneFileFixture.lane()
        .subbands(new int[] {100, 101}, new int[] {0, 2})
        .write(tempDir.resolve("obs_0.spectra"));
    final Path lane1 = LaneFileFixture.lane()
        .subbands(new int[] {102}, new int[] {0})
        .write(tempDir.resolve("obs_1.spectra"));

    try (Observation observation = open(lane0, lane1)) {
      assertThat(observation.beams()).containsExactly(0, 2);
      assertThat(observation.get("I").frequencyCount()).isEqualTo(32);

      assertThat(observation.selectBeam(2)).isEqualTo(2);
      final ResultProduct beam2 = observation.get("I");
      assertThat(beam2.beam()).isEqualTo(2);
      assertThat(beam2.frequencyCount()).isEqualTo(16);
      assertThat(beam2.frequencies()[0]).isCloseTo(101 * 195312.5 - 8 * 195312.5 / 16, within(1e-6));
    }
  }

  @Test
  @DisplayName("Should snap the frequency selection outward to whole subbands")
  void get_FrequencyRange_SnappedToSubbands() throws Exception {
    final Path lane = LaneFileFixture.lane()
        .subbands(new int[] {100, 101, 102}, new int[] {0, 0, 0})
        .write(tempDir.resolve("obs_0.spectra"));

    try (Observation observation = open(lane)) {
      observation.setFrequencyRange(100.2 * 195312.5, 101.1 * 195312.5);

      assertThat(observation.get("I").frequencyCount()).isEqualTo(32);
    }
  }

  @Test
  @DisplayName("Should fall back to the smallest beam when the requested one is absent")
  void selectBeam_Absent_FallsBack() throws Exception {
    final Path lane = LaneFileFixture.lane()
        .subbands(new int[] {100, 101}, new int[] {3, 1})
        .write(tempDir.resolve("obs_0.spectra"));

    try (Observation observation = open(lane)) {
      assertThat(observation.beam()).isEqualTo(1);
      assertThat(observation.selectBeam(3)).isEqualTo(3);
      assertThat(observation.selectBeam(9)).isEqualTo(1);
      assertThat(observation.beam()).isEqualTo(1);
    }
  }

  @Test
  @DisplayName("Should report no data when the frequency selection misses every lane")
  void get_EmptySelection_Throws() throws Exception {
    try (Observation observation = open(fourChannelLane("obs_0.spectra", 100))) {
      observation.setFrequencyRange(1e9, 2e9);

      assertThatThrownBy(() -> observation.get("I")).isInstanceOf(DataAvailabilityException.class);
    }
  }

  @Test
  @DisplayName("Should refuse to stitch lanes with different time lengths")
  void get_DifferentTimeLengths_Throws() throws Exception {
    final Path lane0 = LaneFileFixture.lane().blocks(2).write(tempDir.resolve("obs_0.spectra"));
    final Path lane1 = LaneFileFixture.lane().blocks(3).subbands(new int[] {101}, new int[] {0})
        .write(tempDir.resolve("obs_1.spectra"));

    try (Observation observation = open(lane0, lane1)) {
      assertThatThrownBy(() -> observation.get("I")).isInstanceOf(DataShapeException.class);
    }
  }

  @Test
  @DisplayName("Should run the configured pipeline on every lane")
  void get_StandardBandpassAndEdges_Applied() throws Exception {
    try (Observation observation = open(LaneFileFixture.lane().write(tempDir.resolve("obs_0.spectra")))) {
      observation.setBandpassMode("Standard");
      assertThat(observation.setEdgeChannelsToRemove(1)).isEqualTo(1);

      final ResultProduct product = observation.get("I");
      final double[] gain = PolyphaseBandpass.gain(16);

      assertThat(observation.bandpassMode()).isEqualTo(BandpassMode.STANDARD);
      assertThat(product.get(0, 0, 0)).isNaN();
      assertThat(product.get(0, 15, 0)).isNaN();
      assertThat(product.get(0, 2, 0)).isCloseTo(2 * gain[2], within(1e-9));
    }
  }

  @Test
  @DisplayName("Should rebin the stitched product when widths are set")
  void get_Rebinning_Applied() throws Exception {
    try (Observation observation = open(LaneFileFixture.lane().blocks(5).write(tempDir.resolve("obs_0.spectra")))) {
      observation.setRebinDt(observation.dt() * 4);
      observation.setRebinDf(observation.df() * 8);

      final ResultProduct product = observation.get("I");

      assertThat(product.timeCount()).isEqualTo(4);
      assertThat(product.frequencyCount()).isEqualTo(2);
    }
  }

  @Test
  @DisplayName("Should validate selection and pipeline settings")
  void setters_InvalidValues_Rejected() throws Exception {
    try (Observation observation = open(fourChannelLane("obs_0.spectra", 100))) {
      assertThatThrownBy(() -> observation.setTimeRange(10, 10)).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.setFrequencyRange(2e6, 1e6)).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.setBandpassMode("fancy")).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.setDispersionMeasure(-1.0)).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.setRebinDt(0.0)).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.setRebinDf(-5.0)).isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> observation.get("IW")).isInstanceOf(ConfigurationException.class);

      assertThat(observation.setEdgeChannelsToRemove(2)).isZero();
      observation.setDispersionMeasure(null);
      observation.setRebinDt(null);
      assertThat(observation.pipelineConfig().dispersionMeasure()).isNull();
    }
  }

  @Test
  @DisplayName("Should reject lanes from different sessions and empty lane lists")
  void open_InvalidLaneSets_Rejected() throws Exception {
    final Path a = fourChannelLane("alpha_0.spectra", 100);
    final Path b = fourChannelLane("beta_1.spectra", 101);

    assertThatThrownBy(() -> open(a, b))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("same observation");
    assertThatThrownBy(() -> Observation.builder().open()).isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> open(tempDir.resolve("alpha_1.spectra"))).isInstanceOf(ConfigurationException.class);
  }
}
