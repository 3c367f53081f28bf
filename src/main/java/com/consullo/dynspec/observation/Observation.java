package com.consullo.dynspec.observation;

import com.consullo.dynspec.ConfigurationException;
import com.consullo.dynspec.DataAvailabilityException;
import com.consullo.dynspec.core.ChunkedEvaluator;
import com.consullo.dynspec.core.EvaluationConfig;
import com.consullo.dynspec.core.RegionCube;
import com.consullo.dynspec.lane.BeamRange;
import com.consullo.dynspec.lane.LaneAxes;
import com.consullo.dynspec.lane.LaneDataset;
import com.consullo.dynspec.lane.LaneFileName;
import com.consullo.dynspec.pipeline.BandpassMode;
import com.consullo.dynspec.pipeline.ColdPlasmaDispersionDelay;
import com.consullo.dynspec.pipeline.CorrectionPipeline;
import com.consullo.dynspec.pipeline.DispersionDelay;
import com.consullo.dynspec.pipeline.EdgeChannelFlagging;
import com.consullo.dynspec.pipeline.PipelineConfig;
import com.consullo.dynspec.pipeline.SpectrumSlice;
import com.consullo.dynspec.polar.CoherencyCube;
import com.consullo.dynspec.polar.Polarization;
import com.consullo.dynspec.polar.StokesCube;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lane files of one capture session together with the current selection and pipeline settings.
 *
 * <p>Typical use:
 * <pre>
 *   try (Observation obs = Observation.builder().laneFiles(files).open()) {
 *     obs.setTimeRange(t0, t1);
 *     obs.setBandpassMode("standard");
 *     ResultProduct product = obs.get("I");
 *   }
 * </pre>
 * Selection setters must not be called while a {@link #get} is in flight.
 * </p>
 *
 * @since 1.0
 */
public final class Observation implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Observation.class);

  private final List<LaneDataset> lanes;
  private final ChunkedEvaluator evaluator;
  private final DispersionDelay dispersionDelay;

  private double timeStart;
  private double timeStop;
  private double frequencyStart;
  private double frequencyStop;
  private int beam;
  private BandpassMode bandpassMode = BandpassMode.NONE;
  private int edgeChannels;
  private boolean jumpCorrection;
  private Double dispersionMeasure;
  private Double rebinDt;
  private Double rebinDf;

  private Observation(final Builder b, final List<LaneDataset> lanes) {
    this.lanes = List.copyOf(lanes);
    this.evaluator = new ChunkedEvaluator(b.evaluationConfig);
    this.dispersionDelay = b.dispersionDelay;
    this.timeStart = tmin();
    this.timeStop = tmax();
    this.frequencyStart = fmin();
    this.frequencyStop = fmax();
    this.beam = beams().get(0);
    checkConsistency();
  }

  public static Builder builder() {
    return new Builder();
  }

  private void checkConsistency() {
    final LaneDataset first = lanes.get(0);
    for (LaneDataset lane : lanes) {
      if (lane.dt() != first.dt()) {
        LOGGER.warn("Lanes have different dt values ({} and {}).", first.dt(), lane.dt());
      }
      if (lane.df() != first.df()) {
        LOGGER.warn("Lanes have different df values ({} and {}).", first.df(), lane.df());
      }
      if (lane.channelsPerSubband() != first.channelsPerSubband()) {
        LOGGER.warn("Lanes have different number of channel values ({} and {}).",
            first.channelsPerSubband(), lane.channelsPerSubband());
      }
    }
  }

  public List<LaneDataset> lanes() {
    return lanes;
  }

  public double tmin() {
    return lanes.stream().mapToDouble(LaneDataset::tmin).min().getAsDouble();
  }

  public double tmax() {
    return lanes.stream().mapToDouble(LaneDataset::tmax).max().getAsDouble();
  }

  public double fmin() {
    return lanes.stream().mapToDouble(LaneDataset::fmin).min().getAsDouble();
  }

  public double fmax() {
    return lanes.stream().mapToDouble(LaneDataset::fmax).max().getAsDouble();
  }

  public double dt() {
    return lanes.get(0).dt();
  }

  public double df() {
    return lanes.get(0).df();
  }

  public int channelsPerSubband() {
    return lanes.get(0).channelsPerSubband();
  }

  /**
   * Beam ids recorded in any lane.
   *
   * @return ascending, without duplicates
   */
  public List<Integer> beams() {
    final TreeSet<Integer> beams = new TreeSet<>();
    for (LaneDataset lane : lanes) {
      beams.addAll(lane.beams());
    }
    return List.copyOf(beams);
  }

  public ObservationSummary summary() {
    return new ObservationSummary(tmin(), tmax(), fmin(), fmax(), dt(), df(), channelsPerSubband(), beams());
  }

  public double[] timeRange() {
    return new double[] {timeStart, timeStop};
  }

  /**
   * Selects [start, stop].
   *
   * @param start Unix seconds
   * @param stop Unix seconds
   * @throws ConfigurationException if {@code start >= stop}
   */
  public void setTimeRange(final double start, final double stop) {
    if (!(start < stop)) {
      throw new ConfigurationException("time range start >= stop (" + start + " >= " + stop + ").");
    }
    LOGGER.info("Time-range set: {} to {}.", ObservationSummary.toInstant(start), ObservationSummary.toInstant(stop));
    this.timeStart = start;
    this.timeStop = stop;
  }

  public double[] frequencyRange() {
    return new double[] {frequencyStart, frequencyStop};
  }

  /**
   * Selects [start, stop].
   *
   * @param start Hz
   * @param stop Hz
   * @throws ConfigurationException if {@code start >= stop}
   */
  public void setFrequencyRange(final double start, final double stop) {
    if (!(start < stop)) {
      throw new ConfigurationException("frequency range start >= stop (" + start + " >= " + stop + ").");
    }
    LOGGER.info("Frequency-range set: {} to {} MHz.", start / 1e6, stop / 1e6);
    this.frequencyStart = start;
    this.frequencyStop = stop;
  }

  public int beam() {
    return beam;
  }

  /**
   * Selects a beam, falling back to the smallest available beam if {@code requested} was not recorded.
   *
   * @param requested beam id
   * @return selected beam id
   */
  public int selectBeam(final int requested) {
    final List<Integer> available = beams();
    if (available.contains(requested)) {
      this.beam = requested;
    } else {
      LOGGER.warn("Available beam indices are {}. Setting default to {}.", available, available.get(0));
      this.beam = available.get(0);
    }
    return beam;
  }

  public BandpassMode bandpassMode() {
    return bandpassMode;
  }

  public void setBandpassMode(final BandpassMode mode) {
    Validate.notNull(mode, "mode must not be null");
    this.bandpassMode = mode;
  }

  /**
   * Selects a bandpass mode by name.
   *
   * @param mode one of none, standard, median, adjusted (any case)
   * @throws ConfigurationException if the name is unknown
   */
  public void setBandpassMode(final String mode) {
    setBandpassMode(BandpassMode.fromName(mode));
  }

  public int edgeChannelsToRemove() {
    return edgeChannels;
  }

  /**
   * Sets the channels flagged at each subband edge. Negative counts, or counts that would flag every channel, fall
   * back to 0 with a warning.
   *
   * @param count channels per edge
   * @return count applied
   */
  public int setEdgeChannelsToRemove(final int count) {
    this.edgeChannels = EdgeChannelFlagging.effectiveCount(count, channelsPerSubband());
    if (edgeChannels > 0) {
      LOGGER.info("{} channels will be removed at subband edges.", edgeChannels);
    }
    return edgeChannels;
  }

  public boolean isJumpCorrection() {
    return jumpCorrection;
  }

  public void setJumpCorrection(final boolean enabled) {
    this.jumpCorrection = enabled;
  }

  public Double dispersionMeasure() {
    return dispersionMeasure;
  }

  /**
   * Sets the dispersion measure used for dedispersion.
   *
   * @param dm pc cm^-3, or null to disable dedispersion
   * @throws ConfigurationException if {@code dm} is negative or not finite
   */
  public void setDispersionMeasure(final Double dm) {
    if (dm != null && !(dm >= 0 && Double.isFinite(dm))) {
      throw new ConfigurationException("dispersion measure must be a non-negative number, got " + dm + ".");
    }
    this.dispersionMeasure = dm;
  }

  public Double rebinDt() {
    return rebinDt;
  }

  /**
   * Sets the time bin width.
   *
   * @param dt seconds, or null to keep native resolution
   * @throws ConfigurationException if {@code dt} is not positive
   */
  public void setRebinDt(final Double dt) {
    this.rebinDt = positiveOrNull(dt, "rebin dt");
  }

  public Double rebinDf() {
    return rebinDf;
  }

  /**
   * Sets the frequency bin width.
   *
   * @param df Hz, or null to keep native resolution
   * @throws ConfigurationException if {@code df} is not positive
   */
  public void setRebinDf(final Double df) {
    this.rebinDf = positiveOrNull(df, "rebin df");
  }

  private static Double positiveOrNull(final Double value, final String what) {
    if (value != null && !(value > 0 && Double.isFinite(value))) {
      throw new ConfigurationException(what + " must be positive, got " + value + ".");
    }
    return value;
  }

  public PipelineConfig pipelineConfig() {
    return new PipelineConfig(bandpassMode, edgeChannels, jumpCorrection, dispersionMeasure, rebinDt, rebinDf);
  }

  /**
   * Retrieves the current selection.
   *
   * @param polarizations selector, e.g. {@code "I"}, {@code "IV"}, {@code "XX"} or {@code "I,L"}
   * @return corrected product of the selected beam
   * @throws ConfigurationException if the selector names an unknown polarization
   * @throws DataAvailabilityException if no lane holds data for the selection
   */
  public ResultProduct get(final String polarizations) {
    return get(Polarization.parseAll(polarizations));
  }

  /**
   * Retrieves the current selection: every lane recording the selected beam is sliced, corrected and the results
   * are stacked along frequency in lane order.
   *
   * @param polarizations polarizations, in output order
   * @return corrected product of the selected beam
   * @throws DataAvailabilityException if no lane holds data for the selection
   */
  public ResultProduct get(final List<Polarization> polarizations) {
    Validate.notEmpty(polarizations, "polarizations must not be empty");
    final PipelineConfig config = pipelineConfig();
    final CorrectionPipeline pipeline = CorrectionPipeline.standard(config, dispersionDelay, frequencyStop);
    final List<String> labels = polarizations.stream().map(Polarization::name).toList();
    final List<ResultProduct> parts = new ArrayList<>();
    for (LaneDataset lane : lanes) {
      final SpectrumSlice slice = select(lane, polarizations);
      if (slice == null) {
        continue;
      }
      LOGGER.info("Retrieving data selection from lane {}...", lane.laneIndex());
      final SpectrumSlice corrected = pipeline.run(slice, evaluator);
      final double[] values = evaluator.materialize(corrected.cube()).values();
      parts.add(new ResultProduct(beam, corrected.times(), corrected.frequencies(), labels, values));
    }
    if (parts.isEmpty()) {
      throw new DataAvailabilityException("No data for beam " + beam + " within time range "
          + Arrays.toString(timeRange()) + " and frequency range " + Arrays.toString(frequencyRange()) + ".");
    }
    LOGGER.info("Stokes {} data gathered.", labels);
    return ResultProduct.concatFrequency(parts);
  }

  /**
   * Slices one lane to the current selection, or returns null if the lane has nothing to contribute.
   */
  SpectrumSlice select(final LaneDataset lane, final List<Polarization> polarizations) {
    final BeamRange range = lane.beamRange(beam).orElse(null);
    if (range == null) {
      LOGGER.debug("Lane {} does not record beam {}", lane.laneIndex(), beam);
      return null;
    }
    final LaneAxes axes = lane.axes();
    final int tminIdx = axes.nearestTimeIndex(timeStart);
    final int tmaxIdx = axes.nearestTimeIndex(timeStop);
    if (tmaxIdx <= tminIdx) {
      LOGGER.debug("Lane {} has no sample in the selected time range", lane.laneIndex());
      return null;
    }
    int fminIdx = axes.nearestFrequencyOffset(frequencyStart, range.start(), range.stop());
    int fmaxIdx = axes.nearestFrequencyOffset(frequencyStop, range.start(), range.stop());
    if (fminIdx == fmaxIdx) {
      LOGGER.debug("Lane {} has no channel in the selected frequency range", lane.laneIndex());
      return null;
    }
    final int channels = lane.channelsPerSubband();
    fminIdx = (fminIdx / channels) * channels;
    fmaxIdx = (fmaxIdx / channels + 1) * channels;
    if (fmaxIdx <= fminIdx) {
      LOGGER.warn("Lane {}: frequency selection is not ascending within beam {}, skipped", lane.laneIndex(), beam);
      return null;
    }
    final StokesCube stokes = new StokesCube(CoherencyCube.of(lane), polarizations);
    final RegionCube region = new RegionCube(
        stokes, tminIdx, tmaxIdx, range.start() + fminIdx, range.start() + fmaxIdx);
    return new SpectrumSlice(region, axes.times(tminIdx, tmaxIdx),
        axes.frequencies(range.start() + fminIdx, range.start() + fmaxIdx), lane.dt(), lane.df(), channels);
  }

  /**
   * Retrieves every (beam, polarization selector) pair into {@code sink}. The selected beam is restored
   * afterwards.
   *
   * @param sink destination
   * @param beams beam ids to export
   * @param polarizations polarization selectors, one product each
   * @throws DataAvailabilityException if a beam was not recorded
   * @throws IOException if the sink fails
   */
  public void export(final ProductSink sink, final Collection<Integer> beams, final Collection<String> polarizations)
      throws IOException {
    Validate.notNull(sink, "sink must not be null");
    Validate.notEmpty(beams, "beams must not be empty");
    Validate.notEmpty(polarizations, "polarizations must not be empty");
    final List<Integer> available = beams();
    for (Integer requested : beams) {
      if (!available.contains(requested)) {
        throw new DataAvailabilityException(
            "Invalid beam index request: " + requested + ". (Available beam indices: " + available + ")");
      }
    }
    final List<List<Polarization>> parsed = new ArrayList<>();
    for (String selector : polarizations) {
      parsed.add(Polarization.parseAll(selector));
    }
    final int previous = beam;
    try {
      sink.begin(summary());
      for (Integer requested : beams) {
        LOGGER.info("Working on Beam #{}...", requested);
        this.beam = requested;
        int i = 0;
        for (String selector : polarizations) {
          sink.accept(get(parsed.get(i++)), selector);
        }
      }
      sink.end();
    } finally {
      this.beam = previous;
    }
  }

  @Override
  public void close() throws IOException {
    evaluator.close();
    IOException failure = null;
    for (LaneDataset lane : lanes) {
      try {
        lane.close();
      } catch (final IOException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Builder attaching lane files.
   *
   * @since 1.0
   */
  public static final class Builder {

    private final List<Path> laneFiles = new ArrayList<>();
    private EvaluationConfig evaluationConfig = EvaluationConfig.defaults();
    private DispersionDelay dispersionDelay = new ColdPlasmaDispersionDelay();

    private Builder() {
    }

    public Builder laneFile(final Path path) {
      Validate.notNull(path, "path must not be null");
      this.laneFiles.add(path);
      return this;
    }

    public Builder laneFiles(final Collection<Path> paths) {
      Validate.notNull(paths, "paths must not be null");
      paths.forEach(this::laneFile);
      return this;
    }

    public Builder evaluationConfig(final EvaluationConfig config) {
      Validate.notNull(config, "config must not be null");
      this.evaluationConfig = config;
      return this;
    }

    public Builder dispersionDelay(final DispersionDelay delay) {
      Validate.notNull(delay, "delay must not be null");
      this.dispersionDelay = delay;
      return this;
    }

    /**
     * Attaches every lane file.
     *
     * @return observation owning the opened lanes
     * @throws ConfigurationException if no file was given, a file is missing or misnamed, or files belong to
     *     different sessions
     * @throws IOException if a file cannot be read
     */
    public Observation open() throws IOException {
      if (laneFiles.isEmpty()) {
        throw new ConfigurationException("At least one lane file is required.");
      }
      final LaneFileName first = LaneFileName.parse(laneFiles.get(0));
      for (Path path : laneFiles) {
        final LaneFileName name = LaneFileName.parse(path);
        if (!name.session().equals(first.session())) {
          throw new ConfigurationException("Input files seem not to belong to the same observation: "
              + first.path().getFileName() + " and " + path.getFileName() + ".");
        }
      }
      final List<LaneDataset> lanes = new ArrayList<>();
      try {
        for (Path path : laneFiles) {
          lanes.add(LaneDataset.open(path));
        }
        return new Observation(this, lanes);
      } catch (final IOException | RuntimeException e) {
        for (LaneDataset lane : lanes) {
          try {
            lane.close();
          } catch (final IOException closeFailure) {
            e.addSuppressed(closeFailure);
          }
        }
        throw e;
      }
    }
  }
}
