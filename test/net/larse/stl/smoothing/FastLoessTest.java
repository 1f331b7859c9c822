package net.larse.stl.smoothing;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class FastLoessTest {

  /** Records what it is built with and answers estimateAt(x) with x + 0.5. */
  static class RecordingFactory implements LocalSmoother.Factory {
    DoubleList x;
    DoubleList y;
    double[] weights;
    int window;
    final double[] all;

    RecordingFactory(double[] all) {
      this.all = all;
    }

    @Override
    public LocalSmoother create(DoubleList x, DoubleList y, double[] weights, boolean temporal,
        int window) {
      this.x = x;
      this.y = y;
      this.weights = weights;
      this.window = window;
      return new LocalSmoother() {
        @Override
        public double[] estimateAll() {
          return all;
        }

        @Override
        public double estimateAt(double value) {
          return value + 0.5;
        }
      };
    }
  }

  private static DoubleArrayList range(int n) {
    DoubleArrayList values = new DoubleArrayList(n);
    for (int i = 0; i < n; i++) {
      values.add(i);
    }
    return values;
  }

  @Test
  public void testShortInputMatchesLoess() throws Exception {
    DoubleArrayList x = range(60);
    DoubleArrayList y = new DoubleArrayList();
    for (int i = 0; i < 60; i++) {
      y.add(Math.sin(i / 3.0) + (i % 5) * 0.1);
    }

    FastLoess fast = new FastLoess(x, y, true, 9);
    Loess loess = new Loess(x, y, true, 9);

    assertFalse(fast.isSampled());
    assertArrayEquals(loess.estimateAll(), fast.estimate(), 0.0);
    assertEquals(loess.estimateAt(-1.0), fast.estimateAt(-1.0), 0.0);
  }

  @Test
  public void testShortInputDelegatesWholeFit() throws Exception {
    double[] all = new double[100];
    RecordingFactory factory = new RecordingFactory(all);
    DoubleArrayList x = range(100);

    FastLoess fast = new FastLoess(x, x, null, true, 9, 100, factory);

    assertFalse(fast.isSampled());
    assertSame(x, factory.x);
    assertEquals(9, factory.window);
    assertSame(all, fast.estimate());
  }

  @Test
  public void testLongInputIsSampledAtUniformStride() throws Exception {
    RecordingFactory factory = new RecordingFactory(null);
    DoubleArrayList x = range(1000);
    DoubleArrayList y = new DoubleArrayList();
    double[] weights = new double[1000];
    for (int i = 0; i < 1000; i++) {
      y.add(3.0 * i);
      weights[i] = i;
    }

    FastLoess fast = new FastLoess(x, y, weights, true, 9, 100, factory);

    assertTrue(fast.isSampled());
    assertEquals(100, factory.x.size());
    for (int i = 0; i < 100; i++) {
      assertEquals(10.0 * i, factory.x.getDouble(i), 0.0);
      assertEquals(30.0 * i, factory.y.getDouble(i), 0.0);
      assertEquals(10.0 * i, factory.weights[i], 0.0);
    }

    double[] estimates = fast.estimate();
    assertEquals(1000, estimates.length);
    for (int i = 0; i < 1000; i++) {
      assertEquals(i + 0.5, estimates[i], 0.0);
    }
  }

  @Test
  public void testFractionalStrideTruncatesIndexes() throws Exception {
    RecordingFactory factory = new RecordingFactory(null);
    DoubleArrayList x = range(250);

    new FastLoess(x, x, null, true, 9, 100, factory);

    assertEquals(0.0, factory.x.getDouble(0), 0.0);
    assertEquals(2.0, factory.x.getDouble(1), 0.0);
    assertEquals(5.0, factory.x.getDouble(2), 0.0);
    assertEquals(7.0, factory.x.getDouble(3), 0.0);
    assertEquals(247.0, factory.x.getDouble(99), 0.0);
    assertNull(factory.weights);
  }

  @Test
  public void testSampledLineIsReconstructed() throws Exception {
    DoubleArrayList x = range(250);
    DoubleArrayList y = new DoubleArrayList();
    for (int i = 0; i < 250; i++) {
      y.add(0.5 * i - 3.0);
    }

    FastLoess fast = new FastLoess(x, y, true, 9);
    double[] estimates = fast.estimate();

    assertTrue(fast.isSampled());
    for (int i = 0; i < 250; i++) {
      assertEquals(0.5 * i - 3.0, estimates[i], 1e-9);
    }
    assertEquals(0.5 * 250 - 3.0, fast.estimateAt(250.0), 1e-9);
  }

  @Test
  public void testEstimateIsComputedOnce() throws Exception {
    FastLoess fast = new FastLoess(range(30), range(30), true, 5);
    assertSame(fast.estimate(), fast.estimate());
  }

  @Test(expected = SmoothingException.class)
  public void testEmptyInputIsRejected() throws Exception {
    new FastLoess(new DoubleArrayList(), new DoubleArrayList(), true);
  }

  @Test(expected = SmoothingException.class)
  public void testMismatchedLengthsAreRejected() throws Exception {
    new FastLoess(range(10), range(9), true);
  }
}
