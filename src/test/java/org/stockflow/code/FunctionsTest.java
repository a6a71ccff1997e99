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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FunctionsTest {

  @Test
  public void truthiness() {
    assertThat(Functions.truthy(1)).isTrue();
    assertThat(Functions.truthy(-0.5)).isTrue();
    assertThat(Functions.truthy(0)).isFalse();
    assertThat(Functions.truthy(Double.NaN)).isFalse();
    assertThat(Functions.not(Double.NaN)).isEqualTo(1.0);
    assertThat(Functions.and(2, 3)).isEqualTo(1.0);
    assertThat(Functions.and(2, 0)).isEqualTo(0.0);
    assertThat(Functions.or(0, Double.NaN)).isEqualTo(0.0);
    assertThat(Functions.or(0, -1)).isEqualTo(1.0);
  }

  @Test
  public void comparisons() {
    assertThat(Functions.eq(1, 1)).isEqualTo(1.0);
    assertThat(Functions.ne(1, 1)).isEqualTo(0.0);
    assertThat(Functions.le(1, 1)).isEqualTo(1.0);
    assertThat(Functions.lt(1, 1)).isEqualTo(0.0);
    assertThat(Functions.eq(Double.NaN, Double.NaN)).isEqualTo(0.0);
    assertThat(Functions.isNaN(Double.NaN)).isEqualTo(1.0);
  }

  @Test
  public void arithmetic() {
    assertThat(Functions.mod(7, 3)).isEqualTo(1.0);
    assertThat(Functions.mod(-7, 3)).isEqualTo(-1.0);
    assertThat(Functions.pow(2, 10)).isEqualTo(1024.0);
    assertThat(Functions.integer(-2.7)).isEqualTo(-2.0);
    assertThat(Functions.max(1, Double.NaN)).isNaN();
    assertThat(Functions.min(1, 2)).isEqualTo(1.0);
  }

  @Test
  public void safediv() {
    assertThat(Functions.safediv(6, 3)).isEqualTo(2.0);
    assertThat(Functions.safediv(6, 0)).isEqualTo(0.0);
    assertThat(Functions.safediv(6, 0, 42)).isEqualTo(42.0);
  }

  @Test
  public void singlePulse() {
    double dt = 0.5;
    assertThat(Functions.pulse(dt, 0.5, 10, 1)).isEqualTo(0.0);
    assertThat(Functions.pulse(dt, 1, 10, 1)).isEqualTo(20.0);
    assertThat(Functions.pulse(dt, 1.25, 10, 1)).isEqualTo(20.0);
    assertThat(Functions.pulse(dt, 1.5, 10, 1)).isEqualTo(0.0);
    assertThat(Functions.pulse(dt, 3, 10, 1)).isEqualTo(0.0);
  }

  @Test
  public void repeatedPulse() {
    double dt = 1;
    double[] expected = {0, 0, 5, 0, 0, 5, 0, 0, 5};
    for (int t = 0; t < expected.length; t++) {
      assertThat(Functions.pulse(dt, t, 5, 2, 3)).isEqualTo(expected[t]);
    }
  }
}
