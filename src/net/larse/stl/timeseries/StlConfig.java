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

import net.larse.stl.smoothing.FastLoess;

/**
 * Settings of one STL decomposition. Build with {@link #builder()}.
 *
 * <p>The smoothing spans follow section 2 and 3 of
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess.
 */
public final class StlConfig {
  /** Period value for a series whose seasonality has not been resolved. */
  public static final int UNSET_PERIOD = -1;

  /** Span of the cycle-subseries smoother. Odd, and at least 7. */
  public static final int SEASONAL_WINDOW = 9;

  /** Passes through the inner loop. Two works for most series. */
  public static final int INNER_ITERATIONS = 2;

  /** Suggested number of robustness iterations when they are wanted. */
  public static final int OUTER_ITERATIONS = 10;

  private final int seasonalPeriod;
  private final boolean temporal;
  private final int sampleBudget;
  private final int robustnessIterations;

  private StlConfig(Builder builder) {
    this.seasonalPeriod = builder.seasonalPeriod;
    this.temporal = builder.temporal;
    this.sampleBudget = builder.sampleBudget;
    this.robustnessIterations = builder.robustnessIterations;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shorthand for a configuration that differs from the defaults only in period. */
  public static StlConfig of(int seasonalPeriod, boolean temporal) {
    return builder().seasonalPeriod(seasonalPeriod).temporal(temporal).build();
  }

  /** Observations per seasonal cycle, or {@link #UNSET_PERIOD}. */
  public int getSeasonalPeriod() {
    return seasonalPeriod;
  }

  public boolean hasValidPeriod() {
    return seasonalPeriod > 0;
  }

  public boolean isTemporal() {
    return temporal;
  }

  public int getSampleBudget() {
    return sampleBudget;
  }

  public int getRobustnessIterations() {
    return robustnessIterations;
  }

  /**
   * Span of the low-pass filter: the least odd integer not below the period, so that trend
   * and seasonal do not compete for the same variation.
   */
  public int getLowPassWindow() {
    checkPeriod();
    if (seasonalPeriod % 2 == 0) {
      return seasonalPeriod + 1;
    }
    return seasonalPeriod;
  }

  /**
   * Span of the trend smoother, the odd integer above {@code 1.5 * np / (1 - 1.5 / ns)}.
   */
  public int getTrendWindow() {
    checkPeriod();
    double value = 1.5 * seasonalPeriod / (1.0 - 1.5 / SEASONAL_WINDOW);
    int result = (int) value + 1;
    if (result % 2 == 0) {
      result++;
    }
    return result;
  }

  private void checkPeriod() {
    Preconditions.checkState(hasValidPeriod(), "seasonal period is not set: %s", seasonalPeriod);
  }

  @Override
  public String toString() {
    return String.format("StlConfig{period=%d, temporal=%b, sampleBudget=%d, robustnessIterations=%d}",
        seasonalPeriod, temporal, sampleBudget, robustnessIterations);
  }

  public static final class Builder {
    private int seasonalPeriod = UNSET_PERIOD;
    private boolean temporal = true;
    private int sampleBudget = FastLoess.DEFAULT_SAMPLE_SIZE;
    private int robustnessIterations = 0;

    private Builder() {
    }

    /**
     * Any value is accepted here; a decomposition with a period that is not positive
     * reports invalid input.
     */
    public Builder seasonalPeriod(int seasonalPeriod) {
      this.seasonalPeriod = seasonalPeriod;
      return this;
    }

    public Builder temporal(boolean temporal) {
      this.temporal = temporal;
      return this;
    }

    public Builder sampleBudget(int sampleBudget) {
      this.sampleBudget = sampleBudget;
      return this;
    }

    public Builder robustnessIterations(int robustnessIterations) {
      this.robustnessIterations = robustnessIterations;
      return this;
    }

    /** Turns on the robustness loop with {@link #OUTER_ITERATIONS} passes. */
    public Builder robust() {
      return robustnessIterations(OUTER_ITERATIONS);
    }

    public StlConfig build() {
      Preconditions.checkArgument(sampleBudget >= 2, "sample budget must be at least 2: %s", sampleBudget);
      Preconditions.checkArgument(robustnessIterations >= 0,
          "robustness iterations must not be negative: %s", robustnessIterations);
      return new StlConfig(this);
    }
  }
}
