package net.larse.stl.helper;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CoordinateCacheTest {
  CoordinateCache cache;

  @Before
  public void setUp() {
    cache = new CoordinateCache();
  }

  @Test
  public void testCoordinatesAreIndexes() {
    DoubleList x = cache.getCoordinates(5);
    assertEquals(5, x.size());
    for (int i = 0; i < 5; i++) {
      assertEquals(i, x.getDouble(i), 0.0);
    }
  }

  @Test
  public void testSameLengthIsCachedOnce() {
    DoubleList first = cache.getCoordinates(17);
    DoubleList second = cache.getCoordinates(17);
    cache.getCoordinates(3);

    assertSame(first, second);
    assertEquals(2, cache.size());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testCoordinatesAreReadOnly() {
    cache.getCoordinates(4).set(0, 42.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroLengthIsRejected() {
    cache.getCoordinates(0);
  }

  @Test
  public void testConcurrentRequestsShareOneSequence() throws Exception {
    int threads = 8;
    int length = 500;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<DoubleList>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        Callable<DoubleList> task = () -> {
          start.await();
          return cache.getCoordinates(length);
        };
        futures.add(pool.submit(task));
      }
      start.countDown();

      DoubleList expected = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<DoubleList> future : futures) {
        DoubleList x = future.get(10, TimeUnit.SECONDS);
        assertSame(expected, x);
      }
      for (int i = 0; i < length; i++) {
        assertEquals(i, expected.getDouble(i), 0.0);
      }
      assertEquals(1, cache.size());
    } finally {
      pool.shutdownNow();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }
  }
}
