/*
 * Copyright 2025 The Stockflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stockflow.code;

/**
 * The runtime implementations of operators and builtin functions that don't map onto a single JVM
 * instruction. Generated code calls these directly (so each must be public, static, and take and
 * return only doubles, apart from {@link #truthy}); the interpreter calls them through the {@link
 * Op} that wraps them.
 *
 * <p>Booleans are represented as 1.0 (true) and 0.0 (false). A value is true if it is neither zero
 * nor NaN.
 */
public final class Functions {

  private Functions() {}

  public static boolean truthy(double x) {
    // NaN compares unequal to everything, including 0
    return x == x && x != 0;
  }

  private static double bool(boolean b) {
    return b ? 1 : 0;
  }

  public static double add(double x, double y) {
    return x + y;
  }

  public static double subtract(double x, double y) {
    return x - y;
  }

  public static double multiply(double x, double y) {
    return x * y;
  }

  public static double divide(double x, double y) {
    return x / y;
  }

  public static double mod(double x, double y) {
    return x % y;
  }

  public static double negate(double x) {
    return -x;
  }

  public static double pow(double x, double y) {
    return Math.pow(x, y);
  }

  public static double not(double x) {
    return bool(!truthy(x));
  }

  public static double and(double x, double y) {
    return bool(truthy(x) && truthy(y));
  }

  public static double or(double x, double y) {
    return bool(truthy(x) || truthy(y));
  }

  public static double eq(double x, double y) {
    return bool(x == y);
  }

  public static double ne(double x, double y) {
    return bool(x != y);
  }

  public static double lt(double x, double y) {
    return bool(x < y);
  }

  public static double le(double x, double y) {
    return bool(x <= y);
  }

  public static double gt(double x, double y) {
    return bool(x > y);
  }

  public static double ge(double x, double y) {
    return bool(x >= y);
  }

  /** Used for comparisons against the literal {@code nan}, which would otherwise always fail. */
  public static double isNaN(double x) {
    return bool(Double.isNaN(x));
  }

  public static double abs(double x) {
    return Math.abs(x);
  }

  public static double arccos(double x) {
    return Math.acos(x);
  }

  public static double arcsin(double x) {
    return Math.asin(x);
  }

  public static double arctan(double x) {
    return Math.atan(x);
  }

  public static double cos(double x) {
    return Math.cos(x);
  }

  public static double exp(double x) {
    return Math.exp(x);
  }

  public static double inf() {
    return Double.POSITIVE_INFINITY;
  }

  /** Truncates toward zero. */
  public static double integer(double x) {
    return (int) x;
  }

  public static double ln(double x) {
    return Math.log(x);
  }

  public static double log10(double x) {
    return Math.log10(x);
  }

  public static double max(double x, double y) {
    return x > y ? x : y;
  }

  public static double min(double x, double y) {
    return x < y ? x : y;
  }

  public static double pi() {
    return Math.PI;
  }

  public static double sin(double x) {
    return Math.sin(x);
  }

  public static double sqrt(double x) {
    return Math.sqrt(x);
  }

  public static double tan(double x) {
    return Math.tan(x);
  }

  /** {@code x / y}, or 0 if {@code y} is zero. */
  public static double safediv(double x, double y) {
    return safediv(x, y, 0);
  }

  /** {@code x / y}, or {@code alternative} if {@code y} is zero. */
  public static double safediv(double x, double y, double alternative) {
    return (y != 0) ? x / y : alternative;
  }

  /** A single pulse; see {@link #pulse(double, double, double, double, double)}. */
  public static double pulse(double dt, double time, double volume, double firstPulse) {
    return pulse(dt, time, volume, firstPulse, 0);
  }

  /**
   * Returns {@code volume / dt} during the step containing {@code firstPulse} and, if {@code
   * interval} is positive, during the step containing each {@code firstPulse + k*interval};
   * otherwise returns 0. Integrating the result over time adds {@code volume} for each pulse.
   */
  public static double pulse(
      double dt, double time, double volume, double firstPulse, double interval) {
    if (time < firstPulse) {
      return 0;
    }
    double nextPulse = firstPulse;
    while (time >= nextPulse) {
      if (time < nextPulse + dt) {
        return volume / dt;
      } else if (interval <= 0) {
        break;
      }
      nextPulse += interval;
    }
    return 0;
  }
}
