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

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.List;
import org.stockflow.util.Ordered;

/**
 * A graphical function: a piecewise-linear function through a list of points with ascending x
 * coordinates. Immutable.
 */
public final class LookupTable {

  /** Used only for {@code toString()}. */
  public final String name;

  private final double[] x;
  private final double[] y;

  public LookupTable(String name, double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length, "%s: x and y sizes differ", name);
    this.name = name;
    this.x = x.clone();
    this.y = y.clone();
  }

  public LookupTable(String name, List<Double> x, List<Double> y) {
    this(name, toArray(x), toArray(y));
  }

  private static double[] toArray(List<Double> list) {
    return list.stream().mapToDouble(Double::doubleValue).toArray();
  }

  public int size() {
    return x.length;
  }

  /**
   * Returns the value of the function at {@code index}. Indices outside the table's range are
   * clamped to its first or last point. Returns NaN if the table is empty or the index is NaN.
   */
  public double lookup(double index) {
    int size = x.length;
    if (size == 0 || Double.isNaN(index)) {
      return Double.NaN;
    } else if (index <= x[0]) {
      return y[0];
    } else if (index >= x[size - 1]) {
      return y[size - 1];
    }
    int i = Ordered.search(index, x);
    if (i >= 0) {
      return y[i];
    }
    // x[i-1] < index < x[i]
    i = Ordered.insertionPoint(i);
    double slope = (y[i] - y[i - 1]) / (x[i] - x[i - 1]);
    return (index - x[i - 1]) * slope + y[i - 1];
  }

  @Override
  public String toString() {
    return name + Arrays.toString(x) + "→" + Arrays.toString(y);
  }
}
