package com.consullo.dynspec.lane;

import com.consullo.dynspec.DataShapeException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.apache.commons.lang3.Validate;

/**
 * Fixed header written by the capture system at the start of every lane file and repeated at the start of every
 * block.
 *
 * <p>Layout (little-endian, packed, {@value #BYTES} bytes):
 * <pre>
 *   uint64 idx              lane index
 *   uint64 TIMESTAMP        capture start, Unix seconds
 *   uint64 BLOCKSEQNUMBER   sequence number of the first block, in 195312.5 Hz ticks
 *   int32  fftlen           channels per subband
 *   int32  nfft2int         spectra integrated per sample
 *   int32  fftovlp          overlap factor
 *   int32  apodisation      apodisation window id
 *   int32  nffte            time samples per block
 *   int32  nbchan           subbands per block
 * </pre>
 *
 * @param laneIndex lane index recorded by the backend
 * @param timestamp capture start, Unix seconds
 * @param blockSequenceNumber sequence number of the first block
 * @param fftLength channels per subband, even
 * @param fftToIntegrate spectra integrated per time sample
 * @param fftOverlap overlap factor
 * @param apodisation apodisation window id
 * @param samplesPerBlock time samples per block
 * @param subbandCount subbands per block
 * @since 1.0
 */
public record CaptureHeader(
    long laneIndex,
    long timestamp,
    long blockSequenceNumber,
    int fftLength,
    int fftToIntegrate,
    int fftOverlap,
    int apodisation,
    int samplesPerBlock,
    int subbandCount) {

  /** Encoded size of the header. */
  public static final int BYTES = 48;

  /** Sampling period of the digitized signal, seconds. */
  public static final double SAMPLE_PERIOD = 5.12e-6;

  /** Rate of the block sequence counter, Hz. */
  public static final double SEQUENCE_RATE = 195312.5;

  /** lane, beam and channel ids preceding every subband record. */
  static final int SUBBAND_ID_BYTES = 12;

  /**
   * Decodes a header at the current position of {@code buffer}, advancing it by {@value #BYTES} bytes.
   *
   * @param buffer source, at least {@value #BYTES} bytes remaining
   * @return validated header
   * @throws DataShapeException if fewer than {@value #BYTES} bytes remain or a field is out of range
   */
  public static CaptureHeader read(final ByteBuffer buffer) {
    Validate.notNull(buffer, "buffer must not be null");
    if (buffer.remaining() < BYTES) {
      throw new DataShapeException(
          "Malformed capture header: expected " + BYTES + " bytes, found " + buffer.remaining() + ".");
    }
    final ByteBuffer le = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
    final CaptureHeader header = new CaptureHeader(
        le.getLong(),
        le.getLong(),
        le.getLong(),
        le.getInt(),
        le.getInt(),
        le.getInt(),
        le.getInt(),
        le.getInt(),
        le.getInt());
    buffer.position(buffer.position() + BYTES);
    header.validate();
    return header;
  }

  private void validate() {
    if (fftLength <= 0 || fftLength % 2 != 0) {
      throw new DataShapeException("Problem with fftlen value: " + fftLength + " (must be positive and even).");
    }
    if (fftToIntegrate <= 0) {
      throw new DataShapeException("Problem with nfft2int value: " + fftToIntegrate + ".");
    }
    if (samplesPerBlock <= 0) {
      throw new DataShapeException("Problem with nffte value: " + samplesPerBlock + ".");
    }
    if (subbandCount <= 0) {
      throw new DataShapeException("Problem with nbchan value: " + subbandCount + ".");
    }
    if (blockBytes() > Integer.MAX_VALUE) {
      throw new DataShapeException("Block of " + blockBytes() + " bytes cannot be mapped.");
    }
  }

  /**
   * Native time resolution.
   *
   * @return seconds per time sample
   */
  public double dt() {
    return SAMPLE_PERIOD * fftLength * fftToIntegrate;
  }

  /**
   * Native frequency resolution.
   *
   * @return Hz per channel
   */
  public double df() {
    return 1.0 / (SAMPLE_PERIOD * fftLength);
  }

  /**
   * Absolute time of the first sample.
   *
   * @return Unix seconds
   */
  public double captureStart() {
    return timestamp + blockSequenceNumber / SEQUENCE_RATE;
  }

  /**
   * Bytes of one subband record: three ids followed by {@code fft0} and {@code fft1}.
   *
   * @return record size
   */
  public long subbandRecordBytes() {
    return SUBBAND_ID_BYTES + 2L * samplesPerBlock * fftLength * 2 * Float.BYTES;
  }

  /**
   * Bytes of one block: a header copy followed by {@code nbchan} subband records.
   *
   * @return block size
   */
  public long blockBytes() {
    return BYTES + subbandCount * subbandRecordBytes();
  }
}
