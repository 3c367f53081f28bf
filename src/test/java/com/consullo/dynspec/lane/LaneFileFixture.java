package com.consullo.dynspec.lane;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes synthetic lane files in the capture layout.
 *
 * @since 1.0
 */
public final class LaneFileFixture {

  /** Raw value of one component: 0 = |X|², 1 = |Y|², 2 = Re(XY*), 3 = Im(XY*). */
  @FunctionalInterface
  public interface Samples {

    double value(int component, int time, int subband, int rawChannel);
  }

  private long laneIndex;
  private long timestamp = 1_600_000_000L;
  private long blockSequenceNumber;
  private int fftLength = 16;
  private int fftToIntegrate = 1;
  private int samplesPerBlock = 4;
  private int blocks = 2;
  private int[] channelIds = {100};
  private int[] beamIds = {0};
  private int trailingBytes;
  private Samples samples = (component, time, subband, channel) -> component < 2 ? 1.0 : 0.0;

  public static LaneFileFixture lane() {
    return new LaneFileFixture();
  }

  public LaneFileFixture laneIndex(final long value) {
    this.laneIndex = value;
    return this;
  }

  public LaneFileFixture timestamp(final long value) {
    this.timestamp = value;
    return this;
  }

  public LaneFileFixture blockSequenceNumber(final long value) {
    this.blockSequenceNumber = value;
    return this;
  }

  public LaneFileFixture fftLength(final int value) {
    this.fftLength = value;
    return this;
  }

  public LaneFileFixture fftToIntegrate(final int value) {
    this.fftToIntegrate = value;
    return this;
  }

  public LaneFileFixture samplesPerBlock(final int value) {
    this.samplesPerBlock = value;
    return this;
  }

  public LaneFileFixture blocks(final int value) {
    this.blocks = value;
    return this;
  }

  /**
   * One subband per entry.
   *
   * @param channels recorded channel id per subband
   * @param beams beam id per subband
   * @return this fixture
   */
  public LaneFileFixture subbands(final int[] channels, final int[] beams) {
    this.channelIds = channels.clone();
    this.beamIds = beams.clone();
    return this;
  }

  public LaneFileFixture trailingBytes(final int value) {
    this.trailingBytes = value;
    return this;
  }

  public LaneFileFixture samples(final Samples value) {
    this.samples = value;
    return this;
  }

  public byte[] header() {
    final ByteBuffer buffer = ByteBuffer.allocate(CaptureHeader.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putLong(laneIndex);
    buffer.putLong(timestamp);
    buffer.putLong(blockSequenceNumber);
    buffer.putInt(fftLength);
    buffer.putInt(fftToIntegrate);
    buffer.putInt(0);
    buffer.putInt(0);
    buffer.putInt(samplesPerBlock);
    buffer.putInt(channelIds.length);
    return buffer.array();
  }

  public byte[] bytes() {
    final int record = 12 + 16 * samplesPerBlock * fftLength;
    final int block = CaptureHeader.BYTES + channelIds.length * record;
    final ByteBuffer buffer = ByteBuffer.allocate(blocks * block + trailingBytes).order(ByteOrder.LITTLE_ENDIAN);
    for (int b = 0; b < blocks; b++) {
      buffer.put(header());
      for (int s = 0; s < channelIds.length; s++) {
        buffer.putInt((int) laneIndex);
        buffer.putInt(beamIds[s]);
        buffer.putInt(channelIds[s]);
        for (int array = 0; array < 2; array++) {
          for (int t = 0; t < samplesPerBlock; t++) {
            for (int k = 0; k < fftLength; k++) {
              final int time = b * samplesPerBlock + t;
              buffer.putFloat((float) samples.value(2 * array, time, s, k));
              buffer.putFloat((float) samples.value(2 * array + 1, time, s, k));
            }
          }
        }
      }
    }
    return buffer.array();
  }

  public Path write(final Path file) throws IOException {
    return Files.write(file, bytes());
  }
}
