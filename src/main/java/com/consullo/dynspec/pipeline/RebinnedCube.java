package com.consullo.dynspec.pipeline;

import com.consullo.dynspec.core.CubeChunk;
import com.consullo.dynspec.core.SpectralCube;
import org.apache.commons.lang3.Validate;

/**
 * Deferred block average of a cube along one axis.
 *
 * @since 1.0
 */
public final class RebinnedCube implements SpectralCube {

  /** Axis being averaged. */
  public enum Axis {
    TIME,
    FREQUENCY
  }

  private final SpectralCube source;
  private final Axis axis;
  private final RebinPlan plan;

  public RebinnedCube(final SpectralCube source, final Axis axis, final RebinPlan plan) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(axis, "axis must not be null");
    Validate.notNull(plan, "plan must not be null");
    final int length = axis == Axis.TIME ? source.timeCount() : source.frequencyCount();
    Validate.isTrue(plan.length() == length, "plan covers %d samples, axis has %d", plan.length(), length);
    this.source = source;
    this.axis = axis;
    this.plan = plan;
  }

  @Override
  public int timeCount() {
    return axis == Axis.TIME ? plan.bins() : source.timeCount();
  }

  @Override
  public int frequencyCount() {
    return axis == Axis.FREQUENCY ? plan.bins() : source.frequencyCount();
  }

  @Override
  public int polarizationCount() {
    return source.polarizationCount();
  }

  @Override
  public CubeChunk compute(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    final int group = plan.groupSize();
    final boolean time = axis == Axis.TIME;
    final CubeChunk raw = time
        ? source.compute(timeStart * group, timeStop * group, frequencyStart, frequencyStop)
        : source.compute(timeStart, timeStop, frequencyStart * group, frequencyStop * group);
    final int npol = source.polarizationCount();
    final CubeChunk result = new CubeChunk(
        timeStart, timeStop - timeStart, frequencyStart, frequencyStop - frequencyStart, npol);
    for (int t = 0; t < result.timeCount(); t++) {
      for (int f = 0; f < result.frequencyCount(); f++) {
        for (int p = 0; p < npol; p++) {
          double sum = 0;
          int valid = 0;
          for (int g = 0; g < group; g++) {
            final double value = time ? raw.get(t * group + g, f, p) : raw.get(t, f * group + g, p);
            if (!Double.isNaN(value)) {
              sum += value;
              valid++;
            }
          }
          result.set(t, f, p, valid == 0 ? Double.NaN : sum / valid);
        }
      }
    }
    return result;
  }
}
