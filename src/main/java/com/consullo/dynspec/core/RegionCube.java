package com.consullo.dynspec.core;

import org.apache.commons.lang3.Validate;

/**
 * Rectangular window [timeStart, timeStop) x [frequencyStart, frequencyStop) of another cube, re-indexed from
 * zero.
 *
 * @since 1.0
 */
public final class RegionCube implements SpectralCube {

  private final SpectralCube source;
  private final int timeOffset;
  private final int timeCount;
  private final int frequencyOffset;
  private final int frequencyCount;

  public RegionCube(
      final SpectralCube source,
      final int timeStart,
      final int timeStop,
      final int frequencyStart,
      final int frequencyStop) {
    Validate.notNull(source, "source must not be null");
    Validate.isTrue(0 <= timeStart && timeStart <= timeStop && timeStop <= source.timeCount(),
        "invalid time window [%d, %d) of %d", timeStart, timeStop, source.timeCount());
    Validate.isTrue(0 <= frequencyStart && frequencyStart <= frequencyStop && frequencyStop <= source.frequencyCount(),
        "invalid frequency window [%d, %d) of %d", frequencyStart, frequencyStop, source.frequencyCount());
    this.source = source;
    this.timeOffset = timeStart;
    this.timeCount = timeStop - timeStart;
    this.frequencyOffset = frequencyStart;
    this.frequencyCount = frequencyStop - frequencyStart;
  }

  @Override
  public int timeCount() {
    return timeCount;
  }

  @Override
  public int frequencyCount() {
    return frequencyCount;
  }

  @Override
  public int polarizationCount() {
    return source.polarizationCount();
  }

  @Override
  public CubeChunk compute(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    return source.compute(
        timeOffset + timeStart, timeOffset + timeStop, frequencyOffset + frequencyStart, frequencyOffset + frequencyStop)
        .withOrigin(timeStart, frequencyStart);
  }
}
