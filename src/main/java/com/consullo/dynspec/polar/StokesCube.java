package com.consullo.dynspec.polar;

import com.consullo.dynspec.core.CubeChunk;
import com.consullo.dynspec.core.SpectralCube;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Deferred cube of derived polarizations, stacked along the polarization axis in request order.
 *
 * @since 1.0
 */
public final class StokesCube implements SpectralCube {

  private final CoherencyCube source;
  private final Polarization[] polarizations;

  public StokesCube(final CoherencyCube source, final List<Polarization> polarizations) {
    Validate.notNull(source, "source must not be null");
    Validate.notEmpty(polarizations, "polarizations must not be empty");
    this.source = source;
    this.polarizations = polarizations.toArray(new Polarization[0]);
  }

  @Override
  public int timeCount() {
    return source.timeCount();
  }

  @Override
  public int frequencyCount() {
    return source.frequencyCount();
  }

  @Override
  public int polarizationCount() {
    return polarizations.length;
  }

  @Override
  public CubeChunk compute(final int timeStart, final int timeStop, final int frequencyStart, final int frequencyStop) {
    final CoherencyBlock block = source.read(timeStart, timeStop, frequencyStart, frequencyStop);
    final CubeChunk chunk = new CubeChunk(
        timeStart, block.timeCount(), frequencyStart, block.frequencyCount(), polarizations.length);
    for (int t = 0; t < block.timeCount(); t++) {
      for (int f = 0; f < block.frequencyCount(); f++) {
        final int i = block.index(t, f);
        for (int p = 0; p < polarizations.length; p++) {
          chunk.set(t, f, p, polarizations[p].extract(block.xx(i), block.yy(i), block.xyReal(i), block.xyImag(i)));
        }
      }
    }
    return chunk;
  }
}
