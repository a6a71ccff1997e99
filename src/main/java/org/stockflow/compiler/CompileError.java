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

package org.stockflow.compiler;

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * All semantic errors that prevent a model from being compiled (duplicate identifiers, unknown
 * variables or functions, dependency cycles, ...) throw a CompileError. Syntax errors in a single
 * equation are reported through {@link ParseResult} instead.
 */
public class CompileError extends RuntimeException {
  public final String msg;

  /** The model being compiled, if known. */
  public final @Nullable String model;

  /** The variable whose equation caused the error, if known. */
  public final @Nullable String variable;

  public CompileError(String msg, @Nullable String model, @Nullable String variable) {
    super(msg);
    this.msg = msg;
    this.model = model;
    this.variable = variable;
  }

  public CompileError(String msg) {
    this(msg, null, null);
  }

  @FormatMethod
  public static CompileError of(String fmt, Object... fmtArgs) {
    return new CompileError(String.format(fmt, fmtArgs));
  }

  /** Returns a copy of this error with the given model and variable filled in where missing. */
  public CompileError in(String model, @Nullable String variable) {
    if (this.model != null) {
      return this;
    }
    CompileError result =
        new CompileError(msg, model, (this.variable != null) ? this.variable : variable);
    result.setStackTrace(getStackTrace());
    return result;
  }

  @Override
  public String getMessage() {
    if (model == null) {
      return msg;
    } else if (variable == null) {
      return String.format("%s (in model %s)", msg, model);
    } else {
      return String.format("%s (%s.%s)", msg, model, variable);
    }
  }
}
