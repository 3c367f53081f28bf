package com.consullo.dynspec.lane;

import com.consullo.dynspec.DataShapeException;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoder for one lane file.
 *
 * <p>Only the leading header is read when the decoder is opened. Blocks are mapped read-only on demand through
 * {@link #block(long)}, so files larger than memory can be processed chunk by chunk and the same decoder can be
 * shared by several worker threads.
 *
 * @since 1.0
 */
public final class LaneFileDecoder implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(LaneFileDecoder.class);

  private final Path path;
  private final FileChannel channel;
  private final CaptureHeader header;
  private final long blockCount;

  private LaneFileDecoder(final Path path, final FileChannel channel, final CaptureHeader header, final long blockCount) {
    this.path = path;
    this.channel = channel;
    this.header = header;
    this.blockCount = blockCount;
  }

  /**
   * Opens {@code path} and decodes its header.
   *
   * @param path lane file
   * @return decoder owning an open file channel
   * @throws IOException if the file cannot be read
   * @throws DataShapeException if the header is malformed or the file holds no complete block
   */
  public static LaneFileDecoder open(final Path path) throws IOException {
    Validate.notNull(path, "path must not be null");
    LOGGER.info("Decoding header of {}...", path);
    final FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
    try {
      final long size = channel.size();
      final ByteBuffer buffer = ByteBuffer.allocate(CaptureHeader.BYTES);
      int read = 0;
      while (buffer.hasRemaining() && read >= 0) {
        read = channel.read(buffer, buffer.position());
      }
      buffer.flip();
      final CaptureHeader header = CaptureHeader.read(buffer);
      final long blockCount = size / header.blockBytes();
      if (blockCount == 0) {
        throw new DataShapeException("No complete block in " + path + " (" + size + " bytes, block of "
            + header.blockBytes() + " bytes).");
      }
      final long trailing = size - blockCount * header.blockBytes();
      if (trailing > 0) {
        LOGGER.debug("{}: ignoring {} trailing bytes", path, trailing);
      }
      LOGGER.debug("{}: fftlen={} nffte={} nbchan={} blocks={}",
          path, header.fftLength(), header.samplesPerBlock(), header.subbandCount(), blockCount);
      return new LaneFileDecoder(path, channel, header, blockCount);
    } catch (final IOException | RuntimeException e) {
      channel.close();
      throw e;
    }
  }

  public Path path() {
    return path;
  }

  public CaptureHeader header() {
    return header;
  }

  public long blockCount() {
    return blockCount;
  }

  /**
   * Maps block {@code index} read-only.
   *
   * @param index block index, {@code 0 <= index < blockCount()}
   * @return view over the block
   * @throws UncheckedIOException if the region cannot be mapped
   */
  public RawBlockRecord block(final long index) {
    Validate.isTrue(index >= 0 && index < blockCount, "block index %d out of range [0, %d)", index, blockCount);
    try {
      final ByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, index * header.blockBytes(),
          header.blockBytes());
      return new RawBlockRecord(header, mapped, index);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to map block " + index + " of " + path, e);
    }
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
