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

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Outcome of {@link STLDecomposition#decompose}: either the three additive components and
 * the slope, or a {@link StlFailure}.
 *
 * <p>For every index i, {@code seasonal[i] + trend[i] + residual[i]} equals the input value
 * up to rounding. The arrays belong to the caller.
 */
public final class StlResult {
  private final double[] seasonal;
  private final double[] trend;
  private final double[] residual;
  private final double[] robustnessWeights;
  private final double slope;
  private final StlFailure failure;

  private StlResult(double[] seasonal, double[] trend, double[] residual,
      double[] robustnessWeights, double slope, StlFailure failure) {
    this.seasonal = seasonal;
    this.trend = trend;
    this.residual = residual;
    this.robustnessWeights = robustnessWeights;
    this.slope = slope;
    this.failure = failure;
  }

  static StlResult success(double[] seasonal, double[] trend, double[] residual,
      double[] robustnessWeights, double slope) {
    return new StlResult(seasonal, trend, residual, robustnessWeights, slope, null);
  }

  static StlResult failure(StlFailure failure) {
    Preconditions.checkNotNull(failure);
    return new StlResult(null, null, null, null, Double.NaN, failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /** The failure, or null for a successful decomposition. */
  public StlFailure getFailure() {
    return failure;
  }

  public double[] getSeasonal() {
    checkSuccess();
    return seasonal;
  }

  public double[] getTrend() {
    checkSuccess();
    return trend;
  }

  /** What remains after seasonal and trend are removed. */
  public double[] getResidual() {
    checkSuccess();
    return residual;
  }

  /**
   * Slope of the decomposition, {@code (trend[n - 1] - seasonal[0]) / (n - 1)}.
   */
  public double getSlope() {
    checkSuccess();
    return slope;
  }

  /** Final robustness weights; all 1.0 when no robustness iterations ran. */
  public double[] getRobustnessWeights() {
    checkSuccess();
    return robustnessWeights;
  }

  /** Indexes whose robustness weight is zero, in ascending order. */
  public int[] getOutlierIndexes() {
    checkSuccess();
    IntArrayList outliers = new IntArrayList();
    for (int i = 0; i < robustnessWeights.length; i++) {
      if (robustnessWeights[i] == 0.0) {
        outliers.add(i);
      }
    }
    return outliers.toIntArray();
  }

  private void checkSuccess() {
    Preconditions.checkState(failure == null, "decomposition failed: %s", failure);
  }
}
