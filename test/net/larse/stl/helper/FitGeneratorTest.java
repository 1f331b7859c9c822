package net.larse.stl.helper;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FitGeneratorTest {

  @Test
  public void testWeightedLineIsExact() {
    FitGenerator fit = new FitGenerator();
    fit.init(4);
    fit.setObservation(0, -1.0, -1.0, 0.5);
    fit.setObservation(1, 0.0, 1.0, 1.0);
    fit.setObservation(2, 1.0, 3.0, 0.25);
    fit.setObservation(3, 2.0, 5.0, 0.8);

    double[] coefficients = new double[2];
    assertTrue(fit.linearFit(coefficients));
    assertEquals(1.0, coefficients[0], 1e-12);
    assertEquals(2.0, coefficients[1], 1e-12);
  }

  @Test
  public void testSingularDesignIsReported() {
    FitGenerator fit = new FitGenerator();
    fit.init(3);
    for (int i = 0; i < 3; i++) {
      fit.setObservation(i, 0.0, i, 1.0);
    }

    double[] coefficients = {7.0, 7.0};
    assertFalse(fit.linearFit(coefficients));
    assertEquals(7.0, coefficients[0], 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooFewRows() {
    new FitGenerator().init(1);
  }
}
