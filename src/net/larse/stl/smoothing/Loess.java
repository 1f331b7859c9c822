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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.ints.IntArrays;

import net.larse.stl.helper.FitGenerator;

/**
 * Locally weighted linear regression (loess), following the neighbourhood weighting of
 * the stlest routine in:
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3–73.
 *
 * <p>An estimate at x uses the {@code window} samples nearest to x, weighted by the tricube
 * of their distance relative to the farthest one, and fits a weighted straight line through
 * them. Because the line is evaluated at x, estimates outside the sampled range extrapolate
 * the local slope.
 *
 * <p>Instances are immutable once built.
 */
public class Loess implements LocalSmoother {
  /** Window value asking for the default neighbourhood size. */
  public static final int DEFAULT_WINDOW = -1;

  /** Fewest samples a fit accepts. */
  public static final int MIN_LENGTH = 2;

  // Spans are at least three, as in the Fortran stl.
  @VisibleForTesting
  static final int MIN_WINDOW = 3;

  // Fraction of the samples in a default neighbourhood.
  private static final double DEFAULT_SPAN = 0.3;

  /** Factory for {@link FastLoess} and the decomposition. */
  public static final LocalSmoother.Factory FACTORY = Loess::new;

  private final DoubleList inputX;
  // Samples in ascending x.
  private final DoubleList xs;
  private final DoubleList ys;
  private final double[] robustnessWeights;
  private final int length;
  private final int window;
  private final double spacing;

  public Loess(DoubleList x, DoubleList y, boolean temporal) throws SmoothingException {
    this(x, y, null, temporal, DEFAULT_WINDOW);
  }

  public Loess(DoubleList x, DoubleList y, boolean temporal, int window)
      throws SmoothingException {
    this(x, y, null, temporal, window);
  }

  /**
   * @param x sample coordinates; must be non-decreasing when temporal
   * @param y sample values
   * @param weights robustness weights in [0, 1], or null
   * @param temporal true for time-ordered data, false for scatter data in any order
   * @param window number of neighbours per estimate, or {@link #DEFAULT_WINDOW}
   */
  public Loess(DoubleList x, DoubleList y, double[] weights, boolean temporal, int window)
      throws SmoothingException {
    Preconditions.checkNotNull(x, "x");
    Preconditions.checkNotNull(y, "y");

    if (x.size() != y.size()) {
      throw new SmoothingException(
          String.format("x and y differ in length: %d vs %d", x.size(), y.size()));
    }
    if (y.size() < MIN_LENGTH) {
      throw new SmoothingException(
          String.format("loess needs at least %d points, got %d", MIN_LENGTH, y.size()));
    }
    if (weights != null && weights.length != y.size()) {
      throw new SmoothingException(
          String.format("weights and y differ in length: %d vs %d", weights.length, y.size()));
    }
    if (window != DEFAULT_WINDOW && window < 1) {
      throw new SmoothingException("window must be positive: " + window);
    }
    for (int i = 0; i < x.size(); i++) {
      if (Double.isNaN(x.getDouble(i))) {
        throw new SmoothingException("x contains NaN at " + i);
      }
    }

    this.inputX = x;
    this.length = y.size();

    if (temporal) {
      for (int i = 1; i < length; i++) {
        if (x.getDouble(i) < x.getDouble(i - 1)) {
          throw new SmoothingException("temporal x must be non-decreasing, see index " + i);
        }
      }
      this.xs = x;
      this.ys = y;
      this.robustnessWeights = weights;
    } else {
      int[] order = new int[length];
      for (int i = 0; i < length; i++) {
        order[i] = i;
      }
      // stable, so ties keep their input order
      IntArrays.mergeSort(order, (a, b) -> Double.compare(x.getDouble(a), x.getDouble(b)));

      DoubleArrayList sortedX = new DoubleArrayList(length);
      DoubleArrayList sortedY = new DoubleArrayList(length);
      double[] sortedWeights = weights == null ? null : new double[length];
      for (int i = 0; i < length; i++) {
        int k = order[i];
        sortedX.add(x.getDouble(k));
        sortedY.add(y.getDouble(k));
        if (sortedWeights != null) {
          sortedWeights[i] = weights[k];
        }
      }
      this.xs = sortedX;
      this.ys = sortedY;
      this.robustnessWeights = sortedWeights;
    }

    this.window = window == DEFAULT_WINDOW ? defaultWindow(length) : Math.max(MIN_WINDOW, window);
    this.spacing = (xs.getDouble(length - 1) - xs.getDouble(0)) / (length - 1);
  }

  /** Smallest odd window covering the default span of n samples. */
  @VisibleForTesting
  static int defaultWindow(int n) {
    int window = (int) Math.ceil(DEFAULT_SPAN * n);
    if (window % 2 == 0) {
      window++;
    }
    return Math.max(MIN_WINDOW, window);
  }

  public int getWindow() {
    return window;
  }

  @Override
  public double[] estimateAll() {
    double[] fitted = new double[length];
    for (int i = 0; i < length; i++) {
      fitted[i] = estimateAt(inputX.getDouble(i));
    }
    return fitted;
  }

  @Override
  public double estimateAt(double x) {
    int count = Math.min(window, length);

    // Start from the block centred on x, then slide it towards the closer samples.
    int left = Math.max(0, Math.min(lowerBound(x) - count / 2, length - count));
    int right = left + count - 1;
    while (left > 0 && x - xs.getDouble(left - 1) < xs.getDouble(right) - x) {
      left--;
      right--;
    }
    while (right < length - 1 && xs.getDouble(right + 1) - x < x - xs.getDouble(left)) {
      left++;
      right++;
    }

    double h = Math.max(x - xs.getDouble(left), xs.getDouble(right) - x);
    if (window > length) {
      h += (window - length) / 2.0 * spacing;
    }

    double[] w = new double[count];
    int positive = 0;
    double weightSum = 0;
    double weightedY = 0;
    for (int j = 0; j < count; j++) {
      int k = left + j;
      w[j] = tricube(Math.abs(xs.getDouble(k) - x), h);
      if (robustnessWeights != null) {
        w[j] *= robustnessWeights[k];
      }
      if (w[j] > 0) {
        positive++;
        weightSum += w[j];
        weightedY += w[j] * ys.getDouble(k);
      }
    }

    if (positive == 0) {
      // Every neighbour was weighted out: take the nearest raw value, as stless does.
      return robustnessWeights == null ? Double.NaN : ys.getDouble(nearest(x, left, right));
    }
    double weightedMean = weightedY / weightSum;
    if (positive < 2 || h <= 0) {
      return weightedMean;
    }

    FitGenerator fit = new FitGenerator();
    fit.init(positive);
    int row = 0;
    for (int j = 0; j < count; j++) {
      if (w[j] > 0) {
        int k = left + j;
        // Centre and scale on x so the intercept is the estimate.
        fit.setObservation(row++, (xs.getDouble(k) - x) / h, ys.getDouble(k), w[j]);
      }
    }
    double[] coefficients = new double[2];
    if (!fit.linearFit(coefficients)) {
      return weightedMean;
    }
    return coefficients[0];
  }

  /** Neighbour weight for distance d in a neighbourhood of radius h. */
  @VisibleForTesting
  static double tricube(double d, double h) {
    if (d <= 0.001 * h) {
      return 1.0;
    }
    if (d <= 0.999 * h) {
      double r = d / h;
      double c = 1.0 - r * r * r;
      return c * c * c;
    }
    return 0.0;
  }

  // Index in [left, right] closest to x; the first one on ties.
  private int nearest(double x, int left, int right) {
    int best = left;
    for (int k = left + 1; k <= right; k++) {
      if (Math.abs(xs.getDouble(k) - x) < Math.abs(xs.getDouble(best) - x)) {
        best = k;
      }
    }
    return best;
  }

  // First index whose x is not below the query.
  private int lowerBound(double x) {
    int lo = 0;
    int hi = length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (xs.getDouble(mid) < x) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
