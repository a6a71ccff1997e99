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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The functions that may be called from an equation. There are two kinds:
 *
 * <ul>
 *   <li>primitives, which are evaluated directly by the generated code; and
 *   <li>standard-library templates, which {@link BuiltinDesugarer} replaces by an instance of the
 *       corresponding standard-library model.
 * </ul>
 */
public final class Builtins {

  private Builtins() {}

  /** A primitive builtin function. */
  public static final class Builtin {
    public final String name;
    public final int minArgs;
    public final int maxArgs;

    /**
     * If true, the generated call passes {@code dt} and the current time before the arguments
     * from the equation.
     */
    public final boolean usesTime;

    private Builtin(String name, int minArgs, int maxArgs, boolean usesTime) {
      this.name = name;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      this.usesTime = usesTime;
    }

    /** Throws a CompileError if this builtin can't be called with {@code numArgs} arguments. */
    public void checkArity(int numArgs) {
      if (numArgs < minArgs || numArgs > maxArgs) {
        String expected =
            (minArgs == maxArgs) ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
        throw CompileError.of(
            "%s() takes %s argument%s, not %s",
            name, expected, (maxArgs == 1) ? "" : "s", numArgs);
      }
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private static final ImmutableMap<String, Builtin> PRIMITIVES;

  static {
    ImmutableMap.Builder<String, Builtin> builder = ImmutableMap.builder();
    for (String unary :
        ImmutableList.of(
            "abs", "arccos", "arcsin", "arctan", "cos", "exp", "int", "ln", "log10", "sin", "sqrt",
            "tan")) {
      builder.put(unary, new Builtin(unary, 1, 1, false));
    }
    builder.put("inf", new Builtin("inf", 0, 0, false));
    builder.put("pi", new Builtin("pi", 0, 0, false));
    builder.put("max", new Builtin("max", 2, 2, false));
    builder.put("min", new Builtin("min", 2, 2, false));
    builder.put("lookup", new Builtin("lookup", 2, 2, false));
    builder.put("safediv", new Builtin("safediv", 2, 3, false));
    builder.put("pulse", new Builtin("pulse", 2, 3, true));
    PRIMITIVES = builder.buildOrThrow();
  }

  /** The parameters of every standard-library template, in the order they are passed. */
  public static final ImmutableMap<String, ImmutableList<String>> STDLIB_PARAMS;

  static {
    ImmutableList<String> params = ImmutableList.of("input", "delay_time", "initial_value");
    STDLIB_PARAMS =
        ImmutableMap.of(
            "smth1", params, "smth3", params, "delay1", params, "delay3", params, "trend", params);
  }

  /** The prefix of the names of standard-library models. */
  public static final String STDLIB_PREFIX = "stdlib·";

  /** Returns the primitive builtin with the given name, or null if there isn't one. */
  public static @Nullable Builtin primitive(String name) {
    return PRIMITIVES.get(name);
  }

  public static boolean isPrimitive(String name) {
    return PRIMITIVES.containsKey(name);
  }
}
