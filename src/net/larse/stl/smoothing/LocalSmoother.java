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

import it.unimi.dsi.fastutil.doubles.DoubleList;

/**
 * A fitted local regression surface over a set of (x, y) samples.
 */
public interface LocalSmoother {

  /** Fitted values at each input x, in input order. */
  double[] estimateAll();

  /**
   * Evaluates the fitted surface at an arbitrary x, which may lie outside the sampled range.
   */
  double estimateAt(double x);

  /**
   * Creates smoothers. Lets callers such as {@link FastLoess} be exercised with a stub fit.
   */
  @FunctionalInterface
  interface Factory {
    /**
     * @param x sample coordinates
     * @param y sample values, same length as x
     * @param weights per-sample robustness weights, or null for uniform weights
     * @param temporal whether x is a time axis (non-decreasing)
     * @param window neighbourhood size, or {@link Loess#DEFAULT_WINDOW}
     */
    LocalSmoother create(DoubleList x, DoubleList y, double[] weights, boolean temporal, int window)
        throws SmoothingException;
  }
}
