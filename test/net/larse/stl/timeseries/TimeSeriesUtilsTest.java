package net.larse.stl.timeseries;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class TimeSeriesUtilsTest {

  @Test
  public void testMovingAverage() {
    double[] averaged = TimeSeriesUtils.movingAverage(new double[] {1, 2, 3, 4, 5}, 3);
    assertArrayEquals(new double[] {2.0, 3.0, 4.0}, averaged, 1e-12);
  }

  @Test
  public void testMovingAverageWindowBoundaries() {
    double[] s = {4, 8, 6};
    assertArrayEquals(new double[] {6.0}, TimeSeriesUtils.movingAverage(s, 3), 1e-12);
    assertArrayEquals(s, TimeSeriesUtils.movingAverage(s, 1), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMovingAverageWindowTooLarge() {
    TimeSeriesUtils.movingAverage(new double[] {1, 2}, 3);
  }

  @Test
  public void testCycleSubseries() {
    double[] values = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};
    double[][] subseries = TimeSeriesUtils.cycleSubseries(values, 4);

    assertEquals(4, subseries.length);
    assertArrayEquals(new double[] {0, 4, 8}, subseries[0], 0.0);
    assertArrayEquals(new double[] {1, 5, 9}, subseries[1], 0.0);
    assertArrayEquals(new double[] {2, 6}, subseries[2], 0.0);
    assertArrayEquals(new double[] {3, 7}, subseries[3], 0.0);

    assertArrayEquals(values, TimeSeriesUtils.recombine(subseries), 0.0);
  }

  @Test
  public void testCycleSubseriesLongerPeriodThanSeries() {
    double[][] subseries = TimeSeriesUtils.cycleSubseries(new double[] {5, 6}, 4);

    assertArrayEquals(new double[] {5}, subseries[0], 0.0);
    assertArrayEquals(new double[] {6}, subseries[1], 0.0);
    assertEquals(0, subseries[2].length);
    assertEquals(0, subseries[3].length);
  }

  @Test
  public void testRecombinePaddedSubseries() {
    double[][] padded = {{-1, 0, 4, 8, 12}, {-2, 1, 5, 9, 13}, {-3, 2, 6, 14}, {-4, 3, 7, 15}};
    double[] combined = TimeSeriesUtils.recombine(padded);

    assertArrayEquals(
        new double[] {-1, -2, -3, -4, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 14, 15, 12, 13},
        combined, 0.0);
  }

  @Test
  public void testFirstNaN() {
    assertEquals(-1, TimeSeriesUtils.firstNaN(new double[] {1, 2, 3}));
    assertEquals(1, TimeSeriesUtils.firstNaN(new double[] {1, Double.NaN, Double.NaN}));
  }

  @Test
  public void testRobustnessWeights() {
    double[] y = {1, -1, 1, -1, 1, -1, 1, -1, 1, 50};
    double[] zero = new double[y.length];

    double[] weights = TimeSeriesUtils.robustnessWeights(y, zero, zero);

    double u = 1.0 / 6.0;
    double expected = (1 - u * u) * (1 - u * u);
    for (int i = 0; i < 9; i++) {
      assertEquals(expected, weights[i], 1e-12);
    }
    assertEquals(0.0, weights[9], 0.0);
  }

  @Test
  public void testRobustnessWeightsOfExactFit() {
    double[] y = {3, 4, 5};
    double[] weights = TimeSeriesUtils.robustnessWeights(y, new double[] {1, 1, 1},
        new double[] {2, 3, 4});

    assertArrayEquals(new double[] {1, 1, 1}, weights, 0.0);
  }
}
