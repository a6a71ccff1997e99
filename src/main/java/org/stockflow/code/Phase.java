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

/** The three parts of a simulation step, each compiled into its own {@link StepFunction}. */
public enum Phase {
  /** Computes initial values (run once, by {@code reset}). */
  INITIALS("calcInitials"),
  /** Computes auxiliaries and flows from the current state. */
  FLOWS("calcFlows"),
  /** Integrates stocks into the next state. */
  STOCKS("calcStocks");

  /** The name of the generated method for this phase. */
  public final String methodName;

  Phase(String methodName) {
    this.methodName = methodName;
  }

  /** True if the phase writes a separate {@code next} array. */
  public boolean writesNext() {
    return this == STOCKS;
  }
}
