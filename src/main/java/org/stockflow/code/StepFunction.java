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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The statements of one phase of one model class, in execution order. This is the IR that both
 * backends start from.
 */
public final class StepFunction {
  public final Phase phase;
  public final ImmutableList<Statement> statements;

  public StepFunction(Phase phase, ImmutableList<Statement> statements) {
    Preconditions.checkArgument(
        phase.writesNext()
            || statements.stream()
                .noneMatch(
                    s -> s instanceof Statement.Assign a && a.target == Statement.Target.NEXT),
        "only the stock phase may write the next state");
    this.phase = phase;
    this.statements = statements;
  }

  /** Executes the statements in order. */
  public void execute(Frame self, double[] curr, double[] next, double dt) {
    for (Statement s : statements) {
      s.execute(self, curr, next, dt);
    }
  }

  /** Returns a readable listing of the statements, one per line. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(phase.methodName).append(":\n");
    for (Statement s : statements) {
      sb.append("  ").append(s).append('\n');
    }
    return sb.toString();
  }
}
