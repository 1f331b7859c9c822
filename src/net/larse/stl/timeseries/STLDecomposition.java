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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;

import net.larse.stl.helper.CoordinateCache;
import net.larse.stl.smoothing.FastLoess;
import net.larse.stl.smoothing.LocalSmoother;
import net.larse.stl.smoothing.Loess;
import net.larse.stl.smoothing.SmoothingException;

import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Implements Seasonal Decomposition of Time Series by Loess:
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3–73.
 *
 * <p>A series with x-values 0, 1, 2, ... is split into additive seasonal, trend and residual
 * components. Each inner loop pass
 * <ol>
 *   <li>detrends the series with the current trend (zero at first),</li>
 *   <li>smooths every cycle-subseries and extends it by one point on each side,</li>
 *   <li>low-pass filters the recombined subseries (two moving averages of the period, one of
 *       3, then loess),</li>
 *   <li>takes the seasonal component as the smoothed subseries minus the low-pass,</li>
 *   <li>smooths the deseasonalized series to get the next trend.</li>
 * </ol>
 * Every smoothing goes through {@link FastLoess}, so long series are fitted on a sample.
 *
 * <p>By default only the inner loop runs. With robustness iterations configured, the inner
 * loop is repeated with bisquare weights derived from the residuals, which limits the pull
 * of outliers on seasonal and trend.
 *
 * <p>An instance keeps no state between calls besides the coordinate cache, and may be used
 * from several threads.
 */
public class STLDecomposition {
  private static final Logger LOG = LoggerFactory.getLogger(STLDecomposition.class);

  private final CoordinateCache coordinates;
  private final LocalSmoother.Factory smootherFactory;

  public STLDecomposition() {
    this(new CoordinateCache());
  }

  /**
   * @param coordinates cache of synthetic x-values, typically shared by all decompositions
   */
  public STLDecomposition(CoordinateCache coordinates) {
    this(coordinates, Loess.FACTORY);
  }

  @VisibleForTesting
  STLDecomposition(CoordinateCache coordinates, LocalSmoother.Factory smootherFactory) {
    this.coordinates = Preconditions.checkNotNull(coordinates);
    this.smootherFactory = Preconditions.checkNotNull(smootherFactory);
  }

  /**
   * Decomposes a series with the default settings and the given period.
   *
   * @param series equally spaced observations
   * @param seasonalPeriod observations per cycle, must be positive
   * @param isTemporal whether the series is a time series rather than scatter data
   */
  public StlResult decompose(double[] series, int seasonalPeriod, boolean isTemporal) {
    return decompose(series, StlConfig.of(seasonalPeriod, isTemporal));
  }

  public StlResult decompose(double[] series, StlConfig config) {
    Preconditions.checkNotNull(config, "config");

    if (ArrayUtils.isEmpty(series)) {
      return StlResult.failure(StlFailure.invalidInput("series is empty"));
    }
    if (!config.hasValidPeriod()) {
      return StlResult.failure(StlFailure.invalidInput(
          "seasonal period must be positive: " + config.getSeasonalPeriod()));
    }

    int n = series.length;
    Stopwatch stopwatch = Stopwatch.createStarted();
    LOG.debug("Decomposing {} values, period {}, low-pass window {}, trend window {}",
        n, config.getSeasonalPeriod(), config.getLowPassWindow(), config.getTrendWindow());

    double[] y = series.clone();
    double[] season = new double[n];
    double[] trend = new double[n];
    double[] weights = null;

    try {
      if (!innerLoop(y, config, null, season, trend)) {
        return degenerate(n);
      }
      for (int k = 0; k < config.getRobustnessIterations(); k++) {
        weights = TimeSeriesUtils.robustnessWeights(y, season, trend);
        if (!innerLoop(y, config, weights, season, trend)) {
          return degenerate(n);
        }
      }
    } catch (SmoothingException e) {
      LOG.warn("Decomposition of {} values failed in loess: {}", n, e.getMessage());
      return StlResult.failure(StlFailure.primitiveFailure(e));
    }

    if (config.getRobustnessIterations() > 0) {
      weights = TimeSeriesUtils.robustnessWeights(y, season, trend);
    } else {
      weights = new double[n];
      Arrays.fill(weights, 1.0);
    }

    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      residual[i] = y[i] - season[i] - trend[i];
    }

    // Starts from seasonal[0], not trend[0].
    double slope = (trend[n - 1] - season[0]) / (n - 1);

    LOG.debug("Decomposed {} values in {}, slope {}", n, stopwatch, slope);
    return StlResult.success(season, trend, residual, weights, slope);
  }

  /**
   * Runs {@link StlConfig#INNER_ITERATIONS} passes, updating season and trend in place.
   * Trend is used as the starting trend.
   *
   * @param weights robustness weights, or null for none
   * @return false if the recombined cycle-subseries or the trend contain NaN
   */
  private boolean innerLoop(double[] y, StlConfig config, double[] weights,
      double[] season, double[] trend) throws SmoothingException {
    int n = y.length;
    int np = config.getSeasonalPeriod();
    boolean temporal = config.isTemporal();
    int budget = config.getSampleBudget();

    double[][] subWeights = weights == null ? null : TimeSeriesUtils.cycleSubseries(weights, np);

    for (int iter = 0; iter < StlConfig.INNER_ITERATIONS; iter++) {
      // step1: detrending
      double[] detrended = new double[n];
      for (int i = 0; i < n; i++) {
        detrended[i] = y[i] - trend[i];
      }

      // step2: cycle-subseries smoothing, each extended by a point before and after
      double[][] subseries = TimeSeriesUtils.cycleSubseries(detrended, np);
      double[][] smoothed = new double[np][];
      for (int j = 0; j < np; j++) {
        int k = subseries[j].length;
        FastLoess model = new FastLoess(xValues(k), DoubleArrayList.wrap(subseries[j]),
            subWeights == null ? null : subWeights[j], temporal, StlConfig.SEASONAL_WINDOW,
            budget, smootherFactory);

        smoothed[j] = new double[k + 2];
        smoothed[j][0] = model.estimateAt(-1.0);
        System.arraycopy(model.estimate(), 0, smoothed[j], 1, k);
        smoothed[j][k + 1] = model.estimateAt(k);
      }

      // c holds n + 2 * np points
      double[] c = TimeSeriesUtils.recombine(smoothed);
      int nan = TimeSeriesUtils.firstNaN(c);
      if (nan >= 0) {
        LOG.warn("Smoothed cycle-subseries contain NaN at {} of {}", nan, c.length);
        return false;
      }

      // step3: low-pass filtering of the smoothed cycle-subseries
      double[] c1 = TimeSeriesUtils.movingAverage(c, np);
      double[] c2 = TimeSeriesUtils.movingAverage(c1, np);
      double[] c3 = TimeSeriesUtils.movingAverage(c2, 3);
      FastLoess lowPass = new FastLoess(xValues(c3.length), DoubleArrayList.wrap(c3), null,
          temporal, config.getLowPassWindow(), budget, smootherFactory);
      double[] low = lowPass.estimate();

      // step4: detrending of the smoothed cycle-subseries
      for (int i = 0; i < n; i++) {
        season[i] = c[i] - low[i];
      }

      // step5: deseasonalizing
      double[] deseasoned = new double[n];
      for (int i = 0; i < n; i++) {
        deseasoned[i] = y[i] - season[i];
      }

      // step6: trend smoothing
      FastLoess trender = new FastLoess(xValues(n), DoubleArrayList.wrap(deseasoned), weights,
          temporal, config.getTrendWindow(), budget, smootherFactory);
      System.arraycopy(trender.estimate(), 0, trend, 0, n);
      nan = TimeSeriesUtils.firstNaN(trend);
      if (nan >= 0) {
        LOG.warn("Trend contains NaN at {} of {}", nan, n);
        return false;
      }
    }
    return true;
  }

  private DoubleList xValues(int length) {
    // An empty subseries is left for the smoother to reject.
    return length == 0 ? DoubleLists.EMPTY_LIST : coordinates.getCoordinates(length);
  }

  private static StlResult degenerate(int n) {
    return StlResult.failure(StlFailure.numericDegeneracy(
        "NaN in smoothed components of a series of length " + n));
  }
}
