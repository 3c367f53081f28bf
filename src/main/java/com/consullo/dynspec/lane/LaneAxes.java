package com.consullo.dynspec.lane;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.commons.lang3.Validate;

/**
 * Absolute time and frequency axes of one lane, plus its beam map.
 *
 * <p>Sample {@code i} is at {@code captureStart + i * dt}. Channel {@code k} of subband {@code s} with recorded
 * channel id {@code c} is at {@code df * fftlen * c + df * (k - fftlen / 2)}, i.e. the axis is monotone within a
 * subband but subbands need not be adjacent. Channel ids and beam ids are taken from the first block and assumed
 * constant across the file.
 *
 * @since 1.0
 */
public final class LaneAxes {

  private final double timeStart;
  private final double dt;
  private final int timeCount;
  private final double df;
  private final int channelsPerSubband;
  private final int[] channelIds;
  private final double[] frequencies;
  private final List<BeamRange> beamRanges;
  private final double fmin;
  private final double fmax;

  LaneAxes(
      final double timeStart,
      final double dt,
      final int timeCount,
      final double df,
      final int channelsPerSubband,
      final int[] channelIds,
      final int[] beamIds) {
    Validate.isTrue(channelIds.length == beamIds.length, "one beam id per subband required");
    Validate.isTrue(channelIds.length > 0, "at least one subband required");
    this.timeStart = timeStart;
    this.dt = dt;
    this.timeCount = timeCount;
    this.df = df;
    this.channelsPerSubband = channelsPerSubband;
    this.channelIds = channelIds.clone();
    this.frequencies = computeFrequencies(df, channelsPerSubband, channelIds);
    this.beamRanges = computeBeamRanges(beamIds, channelsPerSubband);

    int minId = Integer.MAX_VALUE;
    int maxId = Integer.MIN_VALUE;
    for (int id : channelIds) {
      minId = Math.min(minId, id);
      maxId = Math.max(maxId, id);
    }
    this.fmin = df * channelsPerSubband * (minId - 0.5);
    this.fmax = df * channelsPerSubband * (maxId + 0.5);
  }

  /**
   * Builds the axes of a decoded lane from its header and first block.
   *
   * @param decoder open decoder
   * @return lane axes
   */
  public static LaneAxes of(final LaneFileDecoder decoder) {
    final CaptureHeader header = decoder.header();
    final RawBlockRecord first = decoder.block(0);
    final int subbands = header.subbandCount();
    final int[] channelIds = new int[subbands];
    final int[] beamIds = new int[subbands];
    for (int s = 0; s < subbands; s++) {
      channelIds[s] = first.channelId(s);
      beamIds[s] = first.beamId(s);
    }
    final long timeCount = decoder.blockCount() * header.samplesPerBlock();
    Validate.isTrue(timeCount <= Integer.MAX_VALUE, "too many time samples: %d", timeCount);
    return new LaneAxes(header.captureStart(), header.dt(), (int) timeCount, header.df(), header.fftLength(),
        channelIds, beamIds);
  }

  static double[] computeFrequencies(final double df, final int channelsPerSubband, final int[] channelIds) {
    final double subbandWidth = df * channelsPerSubband;
    final double[] result = new double[channelIds.length * channelsPerSubband];
    for (int s = 0; s < channelIds.length; s++) {
      for (int k = 0; k < channelsPerSubband; k++) {
        result[s * channelsPerSubband + k] = channelIds[s] * subbandWidth + (k - channelsPerSubband / 2.0) * df;
      }
    }
    return result;
  }

  static List<BeamRange> computeBeamRanges(final int[] beamIds, final int channelsPerSubband) {
    final TreeMap<Integer, int[]> runs = new TreeMap<>();
    for (int s = 0; s < beamIds.length; s++) {
      final int subband = s;
      runs.computeIfAbsent(beamIds[s], b -> new int[] {subband, subband})[1] = s;
    }
    final List<BeamRange> ranges = new ArrayList<>(runs.size());
    runs.forEach((beam, run) -> ranges.add(
        new BeamRange(beam, run[0] * channelsPerSubband, (run[1] + 1) * channelsPerSubband)));
    return Collections.unmodifiableList(ranges);
  }

  public int timeCount() {
    return timeCount;
  }

  public int frequencyCount() {
    return frequencies.length;
  }

  public double dt() {
    return dt;
  }

  public double df() {
    return df;
  }

  public int channelsPerSubband() {
    return channelsPerSubband;
  }

  public int subbandCount() {
    return channelIds.length;
  }

  public int channelId(final int subband) {
    return channelIds[subband];
  }

  public double time(final int index) {
    return timeStart + index * dt;
  }

  /**
   * Time axis values of samples [start, stop).
   *
   * @param start first index (inclusive)
   * @param stop last index (exclusive)
   * @return Unix seconds
   */
  public double[] times(final int start, final int stop) {
    Validate.isTrue(0 <= start && start <= stop && stop <= timeCount, "invalid time slice [%d, %d)", start, stop);
    final double[] result = new double[stop - start];
    for (int i = 0; i < result.length; i++) {
      result[i] = time(start + i);
    }
    return result;
  }

  public double frequency(final int index) {
    return frequencies[index];
  }

  /**
   * Frequency axis values of channels [start, stop).
   *
   * @param start first index (inclusive)
   * @param stop last index (exclusive)
   * @return Hz
   */
  public double[] frequencies(final int start, final int stop) {
    Validate.isTrue(0 <= start && start <= stop && stop <= frequencies.length,
        "invalid frequency slice [%d, %d)", start, stop);
    final double[] result = new double[stop - start];
    System.arraycopy(frequencies, start, result, 0, result.length);
    return result;
  }

  public double tmin() {
    return time(0);
  }

  public double tmax() {
    return time(timeCount - 1);
  }

  /**
   * Lower edge of the recorded band, half a subband below the lowest channel id.
   *
   * @return Hz
   */
  public double fmin() {
    return fmin;
  }

  /**
   * Upper edge of the recorded band, half a subband above the highest channel id.
   *
   * @return Hz
   */
  public double fmax() {
    return fmax;
  }

  /**
   * Beam ranges in ascending beam id order.
   *
   * @return unmodifiable list
   */
  public List<BeamRange> beamRanges() {
    return beamRanges;
  }

  public Optional<BeamRange> beamRange(final int beam) {
    return beamRanges.stream().filter(range -> range.beam() == beam).findFirst();
  }

  /**
   * Index of the sample closest to {@code time}; the first one wins a tie.
   *
   * @param time Unix seconds
   * @return sample index
   */
  public int nearestTimeIndex(final double time) {
    final double position = (time - timeStart) / dt;
    if (!(position > 0)) {
      return 0;
    }
    if (position >= timeCount - 1) {
      return timeCount - 1;
    }
    final int below = (int) Math.floor(position);
    final double distanceBelow = Math.abs(time(below) - time);
    final double distanceAbove = Math.abs(time(below + 1) - time);
    return distanceAbove < distanceBelow ? below + 1 : below;
  }

  /**
   * Index, relative to {@code start}, of the channel in [start, stop) closest to {@code frequency}; the first one
   * wins a tie.
   *
   * @param frequency Hz
   * @param start first candidate index (inclusive)
   * @param stop last candidate index (exclusive)
   * @return offset from {@code start}
   */
  public int nearestFrequencyOffset(final double frequency, final int start, final int stop) {
    Validate.isTrue(0 <= start && start < stop && stop <= frequencies.length,
        "invalid frequency slice [%d, %d)", start, stop);
    int best = 0;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = start; i < stop; i++) {
      final double distance = Math.abs(frequencies[i] - frequency);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = i - start;
      }
    }
    return best;
  }
}
