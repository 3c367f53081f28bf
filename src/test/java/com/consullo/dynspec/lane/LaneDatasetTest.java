package com.consullo.dynspec.lane;

import com.consullo.dynspec.ConfigurationException;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for lane attachment and axis reconstruction.
 *
 * @since 1.0
 */
public class LaneDatasetTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("Should build the time axis from capture start, sequence number and dt")
  void open_TimeAxis_FollowsHeader() throws Exception {
    final Path file = LaneFileFixture.lane()
        .timestamp(1_700_000_000L)
        .blockSequenceNumber(19531)
        .fftToIntegrate(4)
        .samplesPerBlock(5)
        .blocks(3)
        .write(tempDir.resolve("obs_1.spectra"));

    try (LaneDataset lane = LaneDataset.open(file)) {
      final LaneAxes axes = lane.axes();
      final double dt = 5.12e-6 * 16 * 4;
      assertThat(lane.laneIndex()).isEqualTo(1);
      assertThat(lane.session()).isEqualTo("obs");
      assertThat(axes.timeCount()).isEqualTo(15);
      assertThat(lane.dt()).isCloseTo(dt, within(1e-15));
      assertThat(lane.tmin()).isCloseTo(1_700_000_000L + 19531 / 195312.5, within(1e-6));
      assertThat(lane.tmax() - lane.tmin()).isCloseTo(14 * dt, within(1e-6));
      assertThat(axes.times(0, 15)).isSorted();
    }
  }

  @Test
  @DisplayName("Should place channels around each subband centre and pad fmin/fmax by half a subband")
  void open_FrequencyAxis_FollowsChannelIds() throws Exception {
    final Path file = LaneFileFixture.lane()
        .subbands(new int[] {300, 310}, new int[] {0, 0})
        .write(tempDir.resolve("obs_0.spectra"));

    try (LaneDataset lane = LaneDataset.open(file)) {
      final LaneAxes axes = lane.axes();
      final double df = 195312.5 / 16;
      assertThat(axes.frequencyCount()).isEqualTo(32);
      assertThat(axes.frequency(0)).isCloseTo(300 * 195312.5 - 8 * df, within(1e-6));
      assertThat(axes.frequency(8)).isCloseTo(300 * 195312.5, within(1e-6));
      assertThat(axes.frequency(16)).isCloseTo(310 * 195312.5 - 8 * df, within(1e-6));
      assertThat(lane.fmin()).isCloseTo(299.5 * 195312.5, within(1e-6));
      assertThat(lane.fmax()).isCloseTo(310.5 * 195312.5, within(1e-6));
    }
  }

  @Test
  @DisplayName("Should map each beam to the channel range of its subband run, in ascending beam order")
  void open_BeamMap_AscendingRanges() throws Exception {
    final Path file = LaneFileFixture.lane()
        .subbands(new int[] {100, 101, 102, 103}, new int[] {3, 3, 1, 1})
        .write(tempDir.resolve("obs_0.spectra"));

    try (LaneDataset lane = LaneDataset.open(file)) {
      assertThat(lane.axes().beamRanges()).containsExactly(
          new BeamRange(1, 32, 64),
          new BeamRange(3, 0, 32));
      assertThat(lane.beams()).containsExactly(1, 3);
      assertThat(lane.beamRange(2)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should pick the first of two equally near samples")
  void nearestTimeIndex_Tie_PicksFirst() {
    final LaneAxes axes = new LaneAxes(100.0, 0.5, 10, 1.0, 2, new int[] {0}, new int[] {0});

    assertThat(axes.nearestTimeIndex(101.25)).isEqualTo(2);
    assertThat(axes.nearestTimeIndex(101.3)).isEqualTo(3);
    assertThat(axes.nearestTimeIndex(50.0)).isEqualTo(0);
    assertThat(axes.nearestTimeIndex(500.0)).isEqualTo(9);
  }

  @Test
  @DisplayName("Should reject a missing file as a configuration error")
  void open_MissingFile_Throws() {
    assertThatThrownBy(() -> LaneDataset.open(tempDir.resolve("absent_0.spectra")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("not found");
  }
}
