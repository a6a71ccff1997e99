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

/** The ways a model class's {@link StepFunction}s can be turned into runnable code. */
public enum Backend {
  /** Generate JVM bytecode for each model class. */
  BYTECODE {
    @Override
    public StepFunctions compile(
        String className, StepFunction initials, StepFunction flows, StepFunction stocks) {
      return BytecodeEmitter.compile(className, initials, flows, stocks, new Loader.DebugInfo());
    }
  },

  /** Walk the IR. Slower, but useful for checking the bytecode backend. */
  INTERPRETED {
    @Override
    public StepFunctions compile(
        String className, StepFunction initials, StepFunction flows, StepFunction stocks) {
      return new Interpreter(initials, flows, stocks);
    }
  };

  public abstract StepFunctions compile(
      String className, StepFunction initials, StepFunction flows, StepFunction stocks);
}
