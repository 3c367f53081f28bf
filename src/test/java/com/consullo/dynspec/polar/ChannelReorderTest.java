package com.consullo.dynspec.polar;

import com.consullo.dynspec.DataShapeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the channel-halves swap.
 *
 * @since 1.0
 */
public class ChannelReorderTest {

  @Test
  @DisplayName("Should swap the two halves of every subband independently")
  void reorder_TwoSubbands_MatchesHandcraftedOutput() {
    final double[] raw = {0, 1, 2, 3, 4, 5, 6, 7, 10, 11, 12, 13, 14, 15, 16, 17};

    final double[] reordered = ChannelReorder.reorder(raw, 8);

    assertThat(reordered).containsExactly(4, 5, 6, 7, 0, 1, 2, 3, 14, 15, 16, 17, 10, 11, 12, 13);
  }

  @Test
  @DisplayName("Should restore the raw order when applied twice")
  void reorder_AppliedTwice_IsIdentity() {
    final double[] raw = new double[64];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = i * 1.5;
    }

    assertThat(ChannelReorder.reorder(ChannelReorder.reorder(raw, 16), 16)).containsExactly(raw);
  }

  @Test
  @DisplayName("Should reject an odd channel count")
  void sourceChannel_OddLength_Throws() {
    assertThatThrownBy(() -> ChannelReorder.sourceChannel(0, 7))
        .isInstanceOf(DataShapeException.class);
  }
}
