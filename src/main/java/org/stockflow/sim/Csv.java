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

package org.stockflow.sim;

import java.util.ArrayList;
import java.util.List;

/** A statics-only class for formatting simulation results as delimiter-separated text. */
public class Csv {

  private Csv() {}

  /**
   * Returns a header line ({@code time} followed by each series' name) and one line for each saved
   * step. All series must have the same times; series named {@code time} are skipped.
   */
  public static String format(List<Series> series, String delim) {
    List<Series> columns = new ArrayList<>();
    for (Series s : series) {
      if (!s.name.equals("time")) {
        columns.add(s);
      }
    }
    StringBuilder sb = new StringBuilder("time");
    for (Series s : columns) {
      sb.append(delim).append(s.name);
    }
    sb.append('\n');
    int rows = series.isEmpty() ? 0 : series.get(0).size();
    for (int i = 0; i < rows; i++) {
      sb.append(formatNumber(series.get(0).time.get(i)));
      for (Series s : columns) {
        sb.append(delim).append(formatNumber(s.values.get(i)));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Formats integral values without a trailing "{@code .0}". */
  static String formatNumber(double x) {
    if (x == Math.rint(x) && Math.abs(x) < 1e15) {
      return Long.toString((long) x);
    }
    return Double.toString(x);
  }
}
