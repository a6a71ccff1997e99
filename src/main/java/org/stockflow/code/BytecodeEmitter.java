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

import com.google.common.base.Throwables;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Translates the three {@link StepFunction}s of a model class into the static methods of a new
 * hidden class, and returns a {@link StepFunctions} that calls them.
 *
 * <p>Each generated method has the same signature as the corresponding {@link StepFunctions}
 * method, with {@code self} as an explicit first argument. The method starts by copying {@code
 * self.base} and {@code self.refs} into locals.
 */
public final class BytecodeEmitter {

  static final MethodType CALC_TYPE =
      MethodType.methodType(void.class, Frame.class, double[].class, double.class);

  static final MethodType CALC_STOCKS_TYPE =
      MethodType.methodType(
          void.class, Frame.class, double[].class, double[].class, double.class);

  final Loader loader;
  final MethodVisitor mv;

  final int selfLocal = 0;
  final int currLocal = 1;
  private final int nextLocal;
  final int dtLocal;
  final int baseLocal;
  final int refsLocal;

  private BytecodeEmitter(Loader loader, Phase phase) {
    this.loader = loader;
    this.mv = loader.methodVisitor();
    // dt takes two slots
    if (phase.writesNext()) {
      nextLocal = 2;
      dtLocal = 3;
    } else {
      nextLocal = -1;
      dtLocal = 2;
    }
    baseLocal = dtLocal + 2;
    refsLocal = baseLocal + 1;
  }

  int nextLocal() {
    if (nextLocal < 0) {
      throw new IllegalStateException("next is only available in the stock phase");
    }
    return nextLocal;
  }

  /**
   * Returns a StepFunctions that runs the bytecode generated for the given functions.
   *
   * @param className used (after sanitizing) as the name of the generated class
   * @param debugInfo populated with the class bytes and constants
   */
  public static StepFunctions compile(
      String className,
      StepFunction initials,
      StepFunction flows,
      StepFunction stocks,
      Loader.DebugInfo debugInfo) {
    Loader loader = Loader.newLoader();
    loader.initialize(className, MethodHandles.lookup(), className);
    for (StepFunction fn : new StepFunction[] {initials, flows, stocks}) {
      loader.startMethod(fn.phase.methodName, methodType(fn.phase));
      new BytecodeEmitter(loader, fn.phase).emitBody(fn);
    }
    loader.load(debugInfo);
    return new Compiled(
        loader.findMethod(Phase.INITIALS.methodName, CALC_TYPE),
        loader.findMethod(Phase.FLOWS.methodName, CALC_TYPE),
        loader.findMethod(Phase.STOCKS.methodName, CALC_STOCKS_TYPE));
  }

  private static MethodType methodType(Phase phase) {
    return phase.writesNext() ? CALC_STOCKS_TYPE : CALC_TYPE;
  }

  private void emitBody(StepFunction fn) {
    mv.visitVarInsn(Opcodes.ALOAD, selfLocal);
    mv.visitFieldInsn(Opcodes.GETFIELD, Loader.asmType(Frame.class), "base", "I");
    mv.visitVarInsn(Opcodes.ISTORE, baseLocal);
    mv.visitVarInsn(Opcodes.ALOAD, selfLocal);
    mv.visitFieldInsn(Opcodes.GETFIELD, Loader.asmType(Frame.class), "refs", "[I");
    mv.visitVarInsn(Opcodes.ASTORE, refsLocal);
    for (Statement s : fn.statements) {
      s.emit(this);
    }
    mv.visitInsn(Opcodes.RETURN);
  }

  /** Pushes the given array and the index {@code base + offset}. */
  void emitIndex(int arrayLocal, int offset) {
    mv.visitVarInsn(Opcodes.ALOAD, arrayLocal);
    mv.visitVarInsn(Opcodes.ILOAD, baseLocal);
    if (offset != 0) {
      emitInt(offset);
      mv.visitInsn(Opcodes.IADD);
    }
  }

  void emitInt(int i) {
    if (i >= -1 && i <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + i);
    } else if (i >= Byte.MIN_VALUE && i <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, i);
    } else if (i >= Short.MIN_VALUE && i <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, i);
    } else {
      mv.visitLdcInsn(i);
    }
  }

  /** Calls the generated methods. */
  private static class Compiled implements StepFunctions {
    final MethodHandle initials;
    final MethodHandle flows;
    final MethodHandle stocks;

    Compiled(MethodHandle initials, MethodHandle flows, MethodHandle stocks) {
      this.initials = initials;
      this.flows = flows;
      this.stocks = stocks;
    }

    @Override
    public void calcInitials(Frame self, double[] curr, double dt) {
      try {
        initials.invokeExact(self, curr, dt);
      } catch (Throwable e) {
        throw rethrow(e);
      }
    }

    @Override
    public void calcFlows(Frame self, double[] curr, double dt) {
      try {
        flows.invokeExact(self, curr, dt);
      } catch (Throwable e) {
        throw rethrow(e);
      }
    }

    @Override
    public void calcStocks(Frame self, double[] curr, double[] next, double dt) {
      try {
        stocks.invokeExact(self, curr, next, dt);
      } catch (Throwable e) {
        throw rethrow(e);
      }
    }

    private static RuntimeException rethrow(Throwable e) {
      Throwables.throwIfUnchecked(e);
      // The generated methods don't throw checked exceptions.
      throw new AssertionError(e);
    }
  }
}
