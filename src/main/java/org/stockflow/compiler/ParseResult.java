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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The result of parsing one equation. There are three possibilities:
 *
 * <ul>
 *   <li>a successful parse: {@link #expr} is non-null and {@link #errors} is empty;
 *   <li>an empty equation: {@link #expr} is null and {@link #errors} is empty;
 *   <li>a failed parse: {@link #expr} is null and {@link #errors} is non-empty.
 * </ul>
 */
public final class ParseResult {
  public static final ParseResult EMPTY = new ParseResult(null, ImmutableList.of());

  public final @Nullable Expr expr;
  public final ImmutableList<String> errors;

  private ParseResult(@Nullable Expr expr, ImmutableList<String> errors) {
    Preconditions.checkArgument(expr == null || errors.isEmpty());
    this.expr = expr;
    this.errors = errors;
  }

  static ParseResult success(Expr expr) {
    return new ParseResult(expr, ImmutableList.of());
  }

  static ParseResult failure(ImmutableList<String> errors) {
    Preconditions.checkArgument(!errors.isEmpty());
    return new ParseResult(null, errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** True if the equation was empty (which is not an error). */
  public boolean isEmpty() {
    return expr == null && errors.isEmpty();
  }

  @Override
  public String toString() {
    return hasErrors() ? errors.toString() : String.valueOf(expr);
  }
}
