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

import net.larse.stl.smoothing.SmoothingException;

/**
 * Why a decomposition produced no result.
 */
public final class StlFailure {
  public enum Kind {
    /** Empty series or a period that is not positive. Nothing was computed. */
    INVALID_INPUT,
    /** NaN showed up while recombining the smoothed cycle-subseries. */
    NUMERIC_DEGENERACY,
    /** The local regression rejected its input. */
    PRIMITIVE_FAILURE
  }

  private final Kind kind;
  private final String message;
  private final SmoothingException cause;

  private StlFailure(Kind kind, String message, SmoothingException cause) {
    this.kind = Preconditions.checkNotNull(kind);
    this.message = message;
    this.cause = cause;
  }

  static StlFailure invalidInput(String message) {
    return new StlFailure(Kind.INVALID_INPUT, message, null);
  }

  static StlFailure numericDegeneracy(String message) {
    return new StlFailure(Kind.NUMERIC_DEGENERACY, message, null);
  }

  static StlFailure primitiveFailure(SmoothingException cause) {
    return new StlFailure(Kind.PRIMITIVE_FAILURE, cause.getMessage(), cause);
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /** The rejected smoothing call, for {@link Kind#PRIMITIVE_FAILURE}; null otherwise. */
  public SmoothingException getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
