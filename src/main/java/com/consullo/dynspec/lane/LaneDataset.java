package com.consullo.dynspec.lane;

import com.consullo.dynspec.ConfigurationException;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One attached lane file: its decoder and reconstructed axes.
 *
 * <p>Attaching reads the header and the ids of the first block only. Sample data stays in the file until a
 * region is evaluated.
 *
 * @since 1.0
 */
public final class LaneDataset implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(LaneDataset.class);

  private final LaneFileName name;
  private final LaneFileDecoder decoder;
  private final LaneAxes axes;

  private LaneDataset(final LaneFileName name, final LaneFileDecoder decoder, final LaneAxes axes) {
    this.name = name;
    this.decoder = decoder;
    this.axes = axes;
  }

  /**
   * Attaches a lane file.
   *
   * @param path lane file, named {@code <session>_<lane>.<extension>}
   * @return attached dataset
   * @throws ConfigurationException if the file is missing or wrongly named
   * @throws IOException if the file cannot be read
   */
  public static LaneDataset open(final Path path) throws IOException {
    Validate.notNull(path, "path must not be null");
    final LaneFileName name = LaneFileName.parse(path.toAbsolutePath());
    if (!Files.isRegularFile(name.path())) {
      throw new ConfigurationException(name.path() + " not found.");
    }
    final LaneFileDecoder decoder = LaneFileDecoder.open(name.path());
    try {
      final LaneAxes axes = LaneAxes.of(decoder);
      LOGGER.info("Lane {} attached: {} samples, {} channels, beams {}",
          name.laneIndex(), axes.timeCount(), axes.frequencyCount(), beams(axes));
      return new LaneDataset(name, decoder, axes);
    } catch (final RuntimeException e) {
      decoder.close();
      throw e;
    }
  }

  private static List<Integer> beams(final LaneAxes axes) {
    return axes.beamRanges().stream().map(BeamRange::beam).toList();
  }

  public Path path() {
    return name.path();
  }

  public String session() {
    return name.session();
  }

  public int laneIndex() {
    return name.laneIndex();
  }

  public CaptureHeader header() {
    return decoder.header();
  }

  public LaneFileDecoder decoder() {
    return decoder;
  }

  public LaneAxes axes() {
    return axes;
  }

  public double dt() {
    return axes.dt();
  }

  public double df() {
    return axes.df();
  }

  public int channelsPerSubband() {
    return axes.channelsPerSubband();
  }

  public double tmin() {
    return axes.tmin();
  }

  public double tmax() {
    return axes.tmax();
  }

  public double fmin() {
    return axes.fmin();
  }

  public double fmax() {
    return axes.fmax();
  }

  public List<Integer> beams() {
    return beams(axes);
  }

  public Optional<BeamRange> beamRange(final int beam) {
    return axes.beamRange(beam);
  }

  @Override
  public void close() throws IOException {
    decoder.close();
  }
}
