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

/** Implements StepFunctions by executing the IR directly, without generating any code. */
public final class Interpreter implements StepFunctions {
  private final StepFunction initials;
  private final StepFunction flows;
  private final StepFunction stocks;

  public Interpreter(StepFunction initials, StepFunction flows, StepFunction stocks) {
    this.initials = initials;
    this.flows = flows;
    this.stocks = stocks;
  }

  @Override
  public void calcInitials(Frame self, double[] curr, double dt) {
    initials.execute(self, curr, null, dt);
  }

  @Override
  public void calcFlows(Frame self, double[] curr, double dt) {
    flows.execute(self, curr, null, dt);
  }

  @Override
  public void calcStocks(Frame self, double[] curr, double[] next, double dt) {
    stocks.execute(self, curr, next, dt);
  }
}
