package com.consullo.dynspec.polar;

import com.consullo.dynspec.lane.CaptureHeader;
import com.consullo.dynspec.lane.LaneDataset;
import com.consullo.dynspec.lane.LaneFileDecoder;
import com.consullo.dynspec.lane.RawBlockRecord;
import org.apache.commons.lang3.Validate;

/**
 * Deferred eJones view of a whole lane, indexed (time, frequency) with channel halves already swapped.
 *
 * <p>Time index {@code T = block * nffte + sample}; frequency index {@code F = subband * fftlen + channel}.
 *
 * @since 1.0
 */
public final class CoherencyCube {

  private final LaneFileDecoder decoder;
  private final int samplesPerBlock;
  private final int fftLength;
  private final int timeCount;
  private final int frequencyCount;

  public CoherencyCube(final LaneFileDecoder decoder) {
    Validate.notNull(decoder, "decoder must not be null");
    final CaptureHeader header = decoder.header();
    this.decoder = decoder;
    this.samplesPerBlock = header.samplesPerBlock();
    this.fftLength = header.fftLength();
    this.timeCount = Math.toIntExact(decoder.blockCount() * samplesPerBlock);
    this.frequencyCount = header.subbandCount() * fftLength;
  }

  public static CoherencyCube of(final LaneDataset lane) {
    return new CoherencyCube(lane.decoder());
  }

  public int timeCount() {
    return timeCount;
  }

  public int frequencyCount() {
    return frequencyCount;
  }

  /**
   * Reads the region [timeStart, timeStop) x [frequencyStart, frequencyStop), mapping only the blocks it spans.
   *
   * @param timeStart first time index (inclusive)
   * @param timeStop last time index (exclusive)
   * @param frequencyStart first frequency index (inclusive)
   * @param frequencyStop last frequency index (exclusive)
   * @return coherency values of the region
   */
  public CoherencyBlock read(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    Validate.isTrue(0 <= timeStart && timeStart <= timeStop && timeStop <= timeCount,
        "invalid time region [%d, %d)", timeStart, timeStop);
    Validate.isTrue(0 <= frequencyStart && frequencyStart <= frequencyStop && frequencyStop <= frequencyCount,
        "invalid frequency region [%d, %d)", frequencyStart, frequencyStop);
    final CoherencyBlock result = new CoherencyBlock(timeStop - timeStart, frequencyStop - frequencyStart);
    if (timeStart == timeStop || frequencyStart == frequencyStop) {
      return result;
    }
    final int[] subbands = new int[frequencyStop - frequencyStart];
    final int[] rawChannels = new int[subbands.length];
    for (int f = frequencyStart; f < frequencyStop; f++) {
      subbands[f - frequencyStart] = f / fftLength;
      rawChannels[f - frequencyStart] = ChannelReorder.sourceChannel(f % fftLength, fftLength);
    }
    for (int blockIndex = timeStart / samplesPerBlock; blockIndex <= (timeStop - 1) / samplesPerBlock; blockIndex++) {
      final RawBlockRecord block = decoder.block(blockIndex);
      final int blockStart = blockIndex * samplesPerBlock;
      final int from = Math.max(timeStart, blockStart);
      final int to = Math.min(timeStop, blockStart + samplesPerBlock);
      for (int t = from; t < to; t++) {
        final int sample = t - blockStart;
        for (int f = 0; f < subbands.length; f++) {
          final int subband = subbands[f];
          final int channel = rawChannels[f];
          result.set(result.index(t - timeStart, f),
              block.fft0(subband, sample, channel, 0),
              block.fft0(subband, sample, channel, 1),
              block.fft1(subband, sample, channel, 0),
              block.fft1(subband, sample, channel, 1));
        }
      }
    }
    return result;
  }
}
