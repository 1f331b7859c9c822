package net.larse.stl.timeseries;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StlConfigTest {

  @Test
  public void testDefaults() {
    StlConfig config = StlConfig.builder().build();

    assertEquals(StlConfig.UNSET_PERIOD, config.getSeasonalPeriod());
    assertFalse(config.hasValidPeriod());
    assertTrue(config.isTemporal());
    assertEquals(100, config.getSampleBudget());
    assertEquals(0, config.getRobustnessIterations());
  }

  @Test
  public void testLowPassWindowIsOdd() {
    assertEquals(5, StlConfig.of(4, true).getLowPassWindow());
    assertEquals(7, StlConfig.of(7, true).getLowPassWindow());
    assertEquals(13, StlConfig.of(12, true).getLowPassWindow());
  }

  @Test
  public void testTrendWindow() {
    assertEquals(9, StlConfig.of(4, true).getTrendWindow());
    assertEquals(13, StlConfig.of(7, true).getTrendWindow());
    assertEquals(19, StlConfig.of(10, true).getTrendWindow());
    assertEquals(23, StlConfig.of(12, true).getTrendWindow());
    assertEquals(45, StlConfig.of(24, true).getTrendWindow());
  }

  @Test(expected = IllegalStateException.class)
  public void testWindowsNeedPeriod() {
    StlConfig.builder().build().getTrendWindow();
  }

  @Test
  public void testRobust() {
    StlConfig config = StlConfig.builder().seasonalPeriod(12).robust().temporal(false).build();

    assertEquals(StlConfig.OUTER_ITERATIONS, config.getRobustnessIterations());
    assertFalse(config.isTemporal());
  }

  @Test
  public void testNonPositivePeriodIsAccepted() {
    assertFalse(StlConfig.of(0, true).hasValidPeriod());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSampleBudgetTooSmall() {
    StlConfig.builder().seasonalPeriod(4).sampleBudget(1).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeRobustnessIterations() {
    StlConfig.builder().seasonalPeriod(4).robustnessIterations(-1).build();
  }
}
