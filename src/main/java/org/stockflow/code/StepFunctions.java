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
 * The compiled phases of one model class. Implemented either by calling generated bytecode ({@link
 * Backend#BYTECODE}) or by the {@link Interpreter}.
 *
 * <p>{@code curr} and {@code next} are the whole state arrays; each function uses {@code self} to
 * find where its instance's variables live.
 */
public interface StepFunctions {
  void calcInitials(Frame self, double[] curr, double dt);

  void calcFlows(Frame self, double[] curr, double dt);

  void calcStocks(Frame self, double[] curr, double[] next, double dt);
}
