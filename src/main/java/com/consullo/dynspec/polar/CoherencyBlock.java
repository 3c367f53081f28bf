package com.consullo.dynspec.polar;

import org.apache.commons.math3.complex.Complex;

/**
 * eJones (coherency) matrices of a rectangular (time, frequency) region.
 *
 * <p>Per sample:
 * <pre>
 *   [ XX                  Re(XY*) - i Im(XY*) ]
 *   [ Re(XY*) + i Im(XY*)  YY                 ]
 * </pre>
 * The four real components are stored in separate arrays indexed {@code t * frequencyCount + f}.
 *
 * @since 1.0
 */
public final class CoherencyBlock {

  private final int timeCount;
  private final int frequencyCount;
  private final double[] xx;
  private final double[] yy;
  private final double[] xyReal;
  private final double[] xyImag;

  public CoherencyBlock(final int timeCount, final int frequencyCount) {
    this.timeCount = timeCount;
    this.frequencyCount = frequencyCount;
    final int size = Math.multiplyExact(timeCount, frequencyCount);
    this.xx = new double[size];
    this.yy = new double[size];
    this.xyReal = new double[size];
    this.xyImag = new double[size];
  }

  public int timeCount() {
    return timeCount;
  }

  public int frequencyCount() {
    return frequencyCount;
  }

  public int index(final int t, final int f) {
    return t * frequencyCount + f;
  }

  void set(final int index, final double xxValue, final double yyValue, final double re, final double im) {
    xx[index] = xxValue;
    yy[index] = yyValue;
    xyReal[index] = re;
    xyImag[index] = im;
  }

  public double xx(final int index) {
    return xx[index];
  }

  public double yy(final int index) {
    return yy[index];
  }

  public double xyReal(final int index) {
    return xyReal[index];
  }

  public double xyImag(final int index) {
    return xyImag[index];
  }

  /**
   * Element {@code [row][column]} of the eJones matrix at (t, f).
   *
   * @param t time index within the block
   * @param f frequency index within the block
   * @param row 0 or 1
   * @param column 0 or 1
   * @return matrix element
   */
  public Complex element(final int t, final int f, final int row, final int column) {
    final int i = index(t, f);
    if (row == 0 && column == 0) {
      return new Complex(xx[i]);
    }
    if (row == 1 && column == 1) {
      return new Complex(yy[i]);
    }
    if (row == 0 && column == 1) {
      return new Complex(xyReal[i], -xyImag[i]);
    }
    if (row == 1 && column == 0) {
      return new Complex(xyReal[i], xyImag[i]);
    }
    throw new IndexOutOfBoundsException("eJones element [" + row + "][" + column + "]");
  }
}
