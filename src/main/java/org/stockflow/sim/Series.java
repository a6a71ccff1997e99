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

import com.google.common.base.Preconditions;
import com.google.common.primitives.ImmutableDoubleArray;

/** The saved values of one variable, with the time of each. */
public final class Series {
  public final String name;
  public final ImmutableDoubleArray time;
  public final ImmutableDoubleArray values;

  public Series(String name, ImmutableDoubleArray time, ImmutableDoubleArray values) {
    Preconditions.checkArgument(time.length() == values.length());
    this.name = name;
    this.time = time;
    this.values = values;
  }

  public int size() {
    return time.length();
  }

  @Override
  public String toString() {
    return name + values;
  }
}
