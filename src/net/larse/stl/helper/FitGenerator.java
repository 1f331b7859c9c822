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

package net.larse.stl.helper;

import com.google.common.base.Preconditions;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * A wrapper for the weighted straight-line fit behind a single local regression estimate.
 *
 * <p>Each observation contributes the row {@code [sqrt(w), sqrt(w) * x]} with target
 * {@code sqrt(w) * y}, so an ordinary least squares solve gives the weighted fit.
 */
public class FitGenerator {
  private static final int NUM_COLS = 2;

  // Below this the solver is considered to have seen a singular design.
  private static final double MIN_QUALITY = 1e-10;

  private int numRows;

  private DenseMatrix64F matrixA;
  private DenseMatrix64F matrixB;

  public void init(int numRows) {
    Preconditions.checkArgument(numRows >= NUM_COLS, "need at least %s rows: %s", NUM_COLS, numRows);
    this.numRows = numRows;
    matrixA = new DenseMatrix64F(numRows, NUM_COLS);
    matrixB = new DenseMatrix64F(numRows, 1);
  }

  public void setObservation(int idx, double x, double y, double weight) {
    double root = Math.sqrt(weight);
    matrixA.set(idx, 0, root);
    matrixA.set(idx, 1, root * x);
    matrixB.set(idx, 0, root * y);
  }

  /**
   * Solves for {intercept, slope}.
   *
   * @param coefficients receives the intercept at index 0 and the slope at index 1
   * @return false if the design matrix is singular, in which case coefficients is untouched
   */
  public boolean linearFit(double[] coefficients) {
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(numRows, NUM_COLS);
    if (!solver.setA(matrixA) || !(solver.quality() > MIN_QUALITY)) {
      return false;
    }
    DenseMatrix64F matrixX = new DenseMatrix64F(NUM_COLS, 1);
    solver.solve(matrixB, matrixX);
    double intercept = matrixX.get(0, 0);
    double slope = matrixX.get(1, 0);
    if (Double.isNaN(intercept) || Double.isNaN(slope)) {
      return false;
    }
    coefficients[0] = intercept;
    coefficients[1] = slope;
    return true;
  }
}
