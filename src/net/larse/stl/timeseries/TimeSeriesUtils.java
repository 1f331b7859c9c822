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

package net.larse.stl.timeseries;

import com.google.common.base.Preconditions;

import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Array routines used by the STL inner and outer loops, after the stl
 * implementation from the R package (stlss, stlfts, stlrwt).
 */
public class TimeSeriesUtils {

  /**
   * Trailing moving average. Output i is the mean of {@code s[i .. i + window - 1]}, so the
   * result has {@code s.length - window + 1} values.
   */
  public static double[] movingAverage(double[] s, int window) {
    Preconditions.checkArgument(window >= 1 && window <= s.length,
        "window %s does not fit a series of length %s", window, s.length);

    double[] results = new double[s.length - window + 1];
    double partialSum = 0;
    for (int i = 0; i < window; i++) {
      partialSum += s[i];
    }
    for (int i = window; i < s.length; i++) {
      results[i - window] = partialSum / window;
      partialSum = partialSum - s[i - window] + s[i];
    }
    results[results.length - 1] = partialSum / window;
    return results;
  }

  /**
   * Splits values into period cycle-subseries: subseries j holds the values at
   * j, j + period, j + 2 * period, ... in order.
   */
  public static double[][] cycleSubseries(double[] values, int period) {
    Preconditions.checkArgument(period >= 1, "period must be positive: %s", period);

    double[][] subseries = new double[period][];
    for (int j = 0; j < period; j++) {
      // ceil((n - j) / period), zero when j is beyond the series
      int k = values.length > j ? (values.length - j + period - 1) / period : 0;
      subseries[j] = new double[k];
      for (int i = 0; i < k; i++) {
        subseries[j][i] = values[i * period + j];
      }
    }
    return subseries;
  }

  /**
   * Inverse of {@link #cycleSubseries}: takes position 0 of every subseries, then position 1,
   * and so on. Subseries must be ordered by decreasing length, as cycleSubseries makes them.
   */
  public static double[] recombine(double[][] subseries) {
    int total = 0;
    for (double[] s : subseries) {
      total += s.length;
    }

    double[] combined = new double[total];
    int idx = 0;
    for (int i = 0; i < subseries[0].length; i++) {
      for (int j = 0; j < subseries.length; j++) {
        if (subseries[j].length <= i) {
          break;
        }
        combined[idx++] = subseries[j][i];
      }
    }
    return combined;
  }

  /** Index of the first NaN in values, or -1. */
  public static int firstNaN(double[] values) {
    for (int i = 0; i < values.length; i++) {
      if (Double.isNaN(values[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Robustness weights from the residuals {@code y - seasonal - trend} (stlrwt): bisquare of
   * the residual over six times the median absolute residual. When that scale is zero every
   * weight is 1.
   */
  public static double[] robustnessWeights(double[] y, double[] seasonal, double[] trend) {
    Preconditions.checkArgument(y.length == seasonal.length && y.length == trend.length,
        "component lengths differ");

    double[] absResiduals = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      absResiduals[i] = Math.abs(y[i] - seasonal[i] - trend[i]);
    }

    double h = 6.0 * new Median().evaluate(absResiduals);
    double[] weights = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      weights[i] = bisquare(absResiduals[i], h);
    }
    return weights;
  }

  private static double bisquare(double r, double h) {
    if (!(h > 0)) {
      return 1.0;
    }
    double u = r / h;
    if (u <= 0.001) {
      return 1.0;
    }
    if (u <= 0.999) {
      double c = 1.0 - u * u;
      return c * c;
    }
    return 0.0;
  }
}
