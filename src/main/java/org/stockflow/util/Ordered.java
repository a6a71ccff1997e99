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

package org.stockflow.util;

import java.util.function.IntToDoubleFunction;

/**
 * A static-only class with methods for working with arrays and lists that have elements sorted in
 * ascending order.
 */
public class Ordered {
  /**
   * Searches the results of {@code keyFn} from 0 to {@code limit-1} for {@code key}, assuming that
   * it returns values in non-decreasing order. If a match is found, returns its index; otherwise
   * returns {@code -(i+1)} where {@code i} is the index at which {@code key} should be inserted to
   * preserve ordering.
   *
   * <p>NaN is never found; searching for it returns {@code -(limit+1)}.
   */
  public static int search(double key, IntToDoubleFunction keyFn, int limit) {
    int start = 0;
    while (start < limit) {
      int mid = (start + limit) >>> 1;
      double midKey = keyFn.applyAsDouble(mid);
      if (midKey < key || Double.isNaN(key)) {
        start = mid + 1;
      } else if (midKey > key) {
        limit = mid;
      } else {
        return mid;
      }
    }
    return -(start + 1);
  }

  /** Searches a sorted array; see {@link #search(double, IntToDoubleFunction, int)}. */
  public static int search(double key, double[] keys) {
    return search(key, i -> keys[i], keys.length);
  }

  /** Converts the result of {@link #search} to the index at which the key would be inserted. */
  public static int insertionPoint(int searchResult) {
    return (searchResult >= 0) ? searchResult : -(searchResult + 1);
  }

  private Ordered() {}
}
