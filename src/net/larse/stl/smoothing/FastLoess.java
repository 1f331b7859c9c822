/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.stl.smoothing;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sampling approximation of {@link Loess} for long inputs.
 *
 * <p>Up to {@code sampleSize} points the input is smoothed as is. Beyond that, {@code sampleSize}
 * points are taken at a uniform stride, only those are fitted, and the fitted surface is
 * evaluated at every original x to get a full-length estimate. The fit cost then no longer
 * grows with the input length. Values differ slightly from an exact fit of a long input;
 * this is accepted.
 */
public class FastLoess {
  private static final Logger LOG = LoggerFactory.getLogger(FastLoess.class);

  /** Largest input fitted without sampling. */
  public static final int DEFAULT_SAMPLE_SIZE = 100;

  private final DoubleList x;
  private final int length;
  private final boolean sampled;
  private final LocalSmoother smoother;

  private double[] estimates;

  public FastLoess(DoubleList x, DoubleList y, boolean temporal) throws SmoothingException {
    this(x, y, temporal, Loess.DEFAULT_WINDOW);
  }

  public FastLoess(DoubleList x, DoubleList y, boolean temporal, int window)
      throws SmoothingException {
    this(x, y, null, temporal, window, DEFAULT_SAMPLE_SIZE, Loess.FACTORY);
  }

  /**
   * @param x input coordinates
   * @param y input values, same length as x
   * @param weights robustness weights, or null
   * @param temporal whether x is a time axis
   * @param window neighbourhood size, or {@link Loess#DEFAULT_WINDOW}
   * @param sampleSize largest input fitted without sampling
   * @param factory builds the underlying fit
   */
  public FastLoess(DoubleList x, DoubleList y, double[] weights, boolean temporal, int window,
      int sampleSize, LocalSmoother.Factory factory) throws SmoothingException {
    Preconditions.checkNotNull(x, "x");
    Preconditions.checkNotNull(y, "y");
    Preconditions.checkNotNull(factory, "factory");
    Preconditions.checkArgument(sampleSize >= Loess.MIN_LENGTH, "sample size too small: %s", sampleSize);

    if (y.size() < Loess.MIN_LENGTH) {
      throw new SmoothingException(
          String.format("loess needs at least %d points, got %d", Loess.MIN_LENGTH, y.size()));
    }
    if (x.size() != y.size()) {
      throw new SmoothingException(
          String.format("x and y differ in length: %d vs %d", x.size(), y.size()));
    }
    if (weights != null && weights.length != y.size()) {
      throw new SmoothingException(
          String.format("weights and y differ in length: %d vs %d", weights.length, y.size()));
    }

    this.x = x;
    this.length = y.size();
    this.sampled = length > sampleSize;

    if (!sampled) {
      this.smoother = factory.create(x, y, weights, temporal, window);
    } else {
      double step = length * 1.0 / sampleSize;
      DoubleArrayList sampleX = new DoubleArrayList(sampleSize);
      DoubleArrayList sampleY = new DoubleArrayList(sampleSize);
      double[] sampleWeights = weights == null ? null : new double[sampleSize];
      for (int i = 0; i < sampleSize; i++) {
        int index = (int) (i * step);
        sampleX.add(x.getDouble(index));
        sampleY.add(y.getDouble(index));
        if (sampleWeights != null) {
          sampleWeights[i] = weights[index];
        }
      }
      LOG.debug("Sampling {} of {} points at stride {}", sampleSize, length, step);
      this.smoother = factory.create(sampleX, sampleY, sampleWeights, temporal, window);
    }
  }

  /** True if the fit was made on a sample of the input. */
  public boolean isSampled() {
    return sampled;
  }

  /**
   * Smoothed values at every input x. Computed on the first call and kept; the returned
   * array is shared by later calls.
   */
  public double[] estimate() {
    if (estimates == null) {
      if (!sampled) {
        estimates = smoother.estimateAll();
      } else {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
          values[i] = smoother.estimateAt(x.getDouble(i));
        }
        estimates = values;
      }
    }
    return estimates;
  }

  /** Evaluates the fit at any x, including outside the input range. */
  public double estimateAt(double xValue) {
    return smoother.estimateAt(xValue);
  }
}
