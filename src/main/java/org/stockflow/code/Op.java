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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Collections;
import org.jspecify.annotations.Nullable;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * An Op is an operation on doubles that can be performed by the JVM, either by a single opcode or
 * by calling one of the static methods in {@link Functions}. Each Op has a fixed number of double
 * arguments and returns a double.
 *
 * <p>Every Op has a MethodHandle for its implementing method, which the {@link Interpreter} uses;
 * Ops with an opcode emit it in place of the method call.
 */
public final class Op {

  /** Used only for {@code toString()} and error messages. */
  public final String name;

  /** The name of the method in {@link Functions} that implements this Op. */
  public final String methodName;

  public final int arity;

  /** If non-zero, the JVM instruction that implements this Op. */
  private final int opcode;

  /** Invokes the implementing method with its arguments spread from a {@code double[]}. */
  private final MethodHandle spreader;

  private final MethodType methodType;

  private Op(Builder builder) {
    this.name = builder.name;
    this.methodName = builder.methodName;
    this.arity = builder.arity;
    this.opcode = builder.opcode;
    this.methodType =
        MethodType.methodType(double.class, Collections.nCopies(arity, double.class));
    MethodHandle mh;
    try {
      mh = MethodHandles.publicLookup().findStatic(Functions.class, methodName, methodType);
    } catch (ReflectiveOperationException e) {
      throw new AssertionError(e);
    }
    this.spreader = mh.asSpreader(double[].class, arity);
  }

  /** A Builder is used to construct a new Op. */
  public static class Builder {
    final String name;
    final String methodName;
    final int arity;
    private int opcode;

    public Builder(String name, String methodName, int arity) {
      this.name = name;
      this.methodName = methodName;
      this.arity = arity;
    }

    /** Emits {@code opcode} instead of a call to the implementing method. */
    @CanIgnoreReturnValue
    public Builder withOpcode(int opcode) {
      this.opcode = opcode;
      return this;
    }

    public Op build() {
      return new Op(this);
    }
  }

  private static Op op(String name, int arity) {
    return new Builder(name, name, arity).build();
  }

  public static final Op ADD = new Builder("+", "add", 2).withOpcode(Opcodes.DADD).build();
  public static final Op SUBTRACT =
      new Builder("-", "subtract", 2).withOpcode(Opcodes.DSUB).build();
  public static final Op MULTIPLY =
      new Builder("*", "multiply", 2).withOpcode(Opcodes.DMUL).build();
  public static final Op DIVIDE = new Builder("/", "divide", 2).withOpcode(Opcodes.DDIV).build();
  public static final Op MOD = new Builder("%", "mod", 2).withOpcode(Opcodes.DREM).build();
  public static final Op NEGATE = new Builder("-", "negate", 1).withOpcode(Opcodes.DNEG).build();
  public static final Op POW = new Builder("^", "pow", 2).build();
  public static final Op NOT = new Builder("!", "not", 1).build();
  public static final Op IS_NAN = op("isNaN", 1);

  /** The binary operators, keyed by their (single-char) source form. */
  private static final ImmutableMap<String, Op> BINARY =
      ImmutableMap.<String, Op>builder()
          .put("+", ADD)
          .put("-", SUBTRACT)
          .put("*", MULTIPLY)
          .put("/", DIVIDE)
          .put("%", MOD)
          .put("^", POW)
          .put("&", new Builder("&", "and", 2).build())
          .put("|", new Builder("|", "or", 2).build())
          .put("=", new Builder("=", "eq", 2).build())
          .put("≠", new Builder("≠", "ne", 2).build())
          .put("<", new Builder("<", "lt", 2).build())
          .put("≤", new Builder("≤", "le", 2).build())
          .put(">", new Builder(">", "gt", 2).build())
          .put("≥", new Builder("≥", "ge", 2).build())
          .buildOrThrow();

  /**
   * Builtin functions keyed by name and the number of arguments passed at runtime (for {@code
   * pulse} that includes the leading {@code dt} and {@code time}).
   */
  private static final ImmutableMap<String, Op> BUILTINS;

  static {
    ImmutableMap.Builder<String, Op> builder = ImmutableMap.builder();
    for (String unary :
        new String[] {
          "abs", "arccos", "arcsin", "arctan", "cos", "exp", "ln", "log10", "sin", "sqrt", "tan"
        }) {
      builder.put(key(unary, 1), op(unary, 1));
    }
    builder.put(key("int", 1), new Builder("int", "integer", 1).build());
    builder.put(key("inf", 0), op("inf", 0));
    builder.put(key("pi", 0), op("pi", 0));
    builder.put(key("max", 2), op("max", 2));
    builder.put(key("min", 2), op("min", 2));
    builder.put(key("safediv", 2), op("safediv", 2));
    builder.put(key("safediv", 3), op("safediv", 3));
    builder.put(key("pulse", 4), op("pulse", 4));
    builder.put(key("pulse", 5), op("pulse", 5));
    BUILTINS = builder.buildOrThrow();
  }

  private static String key(String name, int arity) {
    return name + "/" + arity;
  }

  /** Returns the Op for a binary operator, or null if there is none. */
  public static @Nullable Op binary(String op) {
    return BINARY.get(op);
  }

  /** Returns the Op for a builtin function called with {@code arity} arguments, or null. */
  public static @Nullable Op builtin(String name, int arity) {
    return BUILTINS.get(key(name, arity));
  }

  /** Emits the instruction(s) to apply this Op to the arguments already on the stack. */
  void emit(MethodVisitor mv) {
    if (opcode != 0) {
      mv.visitInsn(opcode);
    } else {
      mv.visitMethodInsn(
          Opcodes.INVOKESTATIC,
          Loader.asmType(Functions.class),
          methodName,
          methodType.toMethodDescriptorString(),
          false);
    }
  }

  /** Applies this Op to the given arguments. */
  public double apply(double[] args) {
    Preconditions.checkArgument(args.length == arity);
    try {
      return (double) spreader.invokeExact(args);
    } catch (Throwable e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
