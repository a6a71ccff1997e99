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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LookupTableTest {

  private static final LookupTable TABLE =
      new LookupTable("t", new double[] {0, 10, 20}, new double[] {0, 100, 50});

  @Test
  public void interpolates() {
    assertThat(TABLE.lookup(5)).isEqualTo(50.0);
    assertThat(TABLE.lookup(15)).isEqualTo(75.0);
    assertThat(TABLE.lookup(2.5)).isEqualTo(25.0);
  }

  @Test
  public void exactMatches() {
    assertThat(TABLE.lookup(0)).isEqualTo(0.0);
    assertThat(TABLE.lookup(10)).isEqualTo(100.0);
    assertThat(TABLE.lookup(20)).isEqualTo(50.0);
  }

  @Test
  public void clampsOutsideRange() {
    assertThat(TABLE.lookup(-5)).isEqualTo(0.0);
    assertThat(TABLE.lookup(25)).isEqualTo(50.0);
    assertThat(TABLE.lookup(Double.NEGATIVE_INFINITY)).isEqualTo(0.0);
    assertThat(TABLE.lookup(Double.POSITIVE_INFINITY)).isEqualTo(50.0);
  }

  @Test
  public void nan() {
    assertThat(TABLE.lookup(Double.NaN)).isNaN();
    LookupTable empty = new LookupTable("empty", ImmutableList.of(), ImmutableList.of());
    assertThat(empty.size()).isEqualTo(0);
    assertThat(empty.lookup(1)).isNaN();
  }

  @Test
  public void singlePoint() {
    LookupTable one = new LookupTable("one", ImmutableList.of(3.0), ImmutableList.of(7.0));
    assertThat(one.lookup(0)).isEqualTo(7.0);
    assertThat(one.lookup(3)).isEqualTo(7.0);
    assertThat(one.lookup(9)).isEqualTo(7.0);
  }

  @Test
  public void mismatchedSizes() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new LookupTable("bad", new double[] {1, 2}, new double[] {1}));
    assertThat(e).hasMessageThat().isEqualTo("bad: x and y sizes differ");
  }
}
