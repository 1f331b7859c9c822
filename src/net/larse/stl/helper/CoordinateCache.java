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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Provides the synthetic x-axis values 0, 1, ..., length - 1 used when smoothing an equally
 * spaced series. A single decomposition asks for the same few lengths many times, so the
 * sequences are built once per length and shared.
 *
 * <p>An instance can be shared by concurrent decompositions. Entries are never removed and
 * the returned lists are unmodifiable.
 */
public class CoordinateCache {
  private static final Logger LOG = LoggerFactory.getLogger(CoordinateCache.class);

  private final ConcurrentMap<Integer, DoubleList> coordinates = new ConcurrentHashMap<>();

  /**
   * Returns the coordinates {0.0, 1.0, ..., length - 1} for the given length, building
   * and caching them on first use.
   *
   * @param length number of coordinates, at least 1
   */
  public DoubleList getCoordinates(int length) {
    Preconditions.checkArgument(length >= 1, "coordinate length must be positive: %s", length);
    // computeIfAbsent runs the builder at most once per key.
    return coordinates.computeIfAbsent(length, CoordinateCache::build);
  }

  /** Number of distinct lengths cached so far. */
  public int size() {
    return coordinates.size();
  }

  private static DoubleList build(int length) {
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = i;
    }
    LOG.debug("Cached {} synthetic coordinates", length);
    return DoubleLists.unmodifiable(DoubleArrayList.wrap(values));
  }
}
