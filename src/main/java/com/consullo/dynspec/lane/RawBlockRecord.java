package com.consullo.dynspec.lane;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Read-only view over one decoded block.
 *
 * <p>Each subband record holds the lane, beam and channel ids followed by two arrays of shape
 * {@code [nffte][fftlen][2]}: {@code fft0 = [|X|², |Y|²]} and {@code fft1 = [Re(XY*), Im(XY*)]}. Channel indices
 * here are raw, i.e. before the channel-halves swap.
 *
 * @since 1.0
 */
public final class RawBlockRecord {

  private final CaptureHeader header;
  private final ByteBuffer buffer;
  private final long blockIndex;

  RawBlockRecord(final CaptureHeader header, final ByteBuffer buffer, final long blockIndex) {
    this.header = header;
    this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
    this.blockIndex = blockIndex;
  }

  public long blockIndex() {
    return blockIndex;
  }

  public int laneId(final int subband) {
    return buffer.getInt(subbandOffset(subband));
  }

  public int beamId(final int subband) {
    return buffer.getInt(subbandOffset(subband) + Integer.BYTES);
  }

  public int channelId(final int subband) {
    return buffer.getInt(subbandOffset(subband) + 2 * Integer.BYTES);
  }

  /**
   * Reads {@code fft0[sample][channel][component]}.
   *
   * @param subband subband index within the block
   * @param sample time sample within the block
   * @param channel raw channel
   * @param component 0 for |X|², 1 for |Y|²
   * @return stored value
   */
  public float fft0(final int subband, final int sample, final int channel, final int component) {
    return buffer.getFloat(fftOffset(subband, 0, sample, channel, component));
  }

  /**
   * Reads {@code fft1[sample][channel][component]}.
   *
   * @param subband subband index within the block
   * @param sample time sample within the block
   * @param channel raw channel
   * @param component 0 for Re(XY*), 1 for Im(XY*)
   * @return stored value
   */
  public float fft1(final int subband, final int sample, final int channel, final int component) {
    return buffer.getFloat(fftOffset(subband, 1, sample, channel, component));
  }

  private int subbandOffset(final int subband) {
    return (int) (CaptureHeader.BYTES + subband * header.subbandRecordBytes());
  }

  private int fftOffset(final int subband, final int array, final int sample, final int channel, final int component) {
    final int arrayFloats = header.samplesPerBlock() * header.fftLength() * 2;
    final int floatIndex = array * arrayFloats + (sample * header.fftLength() + channel) * 2 + component;
    return subbandOffset(subband) + CaptureHeader.SUBBAND_ID_BYTES + floatIndex * Float.BYTES;
  }
}
