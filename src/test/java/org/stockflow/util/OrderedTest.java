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

import static com.google.common.truth.Truth.assertThat;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class OrderedTest {

  private static final double[] KEYS = {1, 3, 3, 7};

  private static Object[] searches() {
    return new Object[] {
      new Object[] {1.0, 0},
      new Object[] {7.0, 3},
      new Object[] {0.0, -1},
      new Object[] {2.0, -2},
      new Object[] {5.0, -4},
      new Object[] {8.0, -5},
      new Object[] {Double.NaN, -5},
    };
  }

  @Test
  @Parameters(method = "searches")
  public void search(double key, int expected) {
    assertThat(Ordered.search(key, KEYS)).isEqualTo(expected);
  }

  @Test
  public void duplicateKeys() {
    int i = Ordered.search(3, KEYS);
    assertThat(i).isAnyOf(1, 2);
  }

  @Test
  public void insertionPoint() {
    assertThat(Ordered.insertionPoint(2)).isEqualTo(2);
    assertThat(Ordered.insertionPoint(-1)).isEqualTo(0);
    assertThat(Ordered.insertionPoint(Ordered.search(5, KEYS))).isEqualTo(3);
  }

  @Test
  public void emptyArray() {
    assertThat(Ordered.search(1, new double[0])).isEqualTo(-1);
  }
}
