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
import java.util.Locale;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/** A single statement of a {@link StepFunction}: either an assignment or a module call. */
public abstract class Statement {

  // Subclasses are all defined here.
  private Statement() {}

  abstract void emit(BytecodeEmitter emitter);

  /** Executes this statement. {@code next} is null except in the stock phase. */
  public abstract void execute(Frame self, double[] curr, double[] next, double dt);

  /** Which of the state arrays an {@link Assign} writes to. */
  public enum Target {
    CURR,
    NEXT
  }

  /** Stores a value into one of the current instance's locals. */
  public static final class Assign extends Statement {
    public final Target target;
    public final int offset;

    /** Used only for {@code toString()}. */
    public final String name;

    public final CodeValue value;

    public Assign(Target target, int offset, String name, CodeValue value) {
      this.target = target;
      this.offset = offset;
      this.name = name;
      this.value = value;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      emitter.emitIndex(
          (target == Target.CURR) ? emitter.currLocal : emitter.nextLocal(), offset);
      value.emit(emitter);
      emitter.mv.visitInsn(Opcodes.DASTORE);
    }

    @Override
    public void execute(Frame self, double[] curr, double[] next, double dt) {
      double[] dest = (target == Target.CURR) ? curr : next;
      dest[self.base + offset] = value.eval(self, curr, dt);
    }

    @Override
    public String toString() {
      return String.format(
          "%s[%s@%s] = %s", target.name().toLowerCase(Locale.ROOT), name, offset, value);
    }
  }

  /** Runs one phase of a child module. */
  public static final class CallModule extends Statement {
    /** The index of the child in its parent's frame. */
    public final int child;

    /** Used only for {@code toString()}. */
    public final String name;

    public final Phase phase;

    public CallModule(int child, String name, Phase phase) {
      Preconditions.checkArgument(child >= 0);
      this.child = child;
      this.name = name;
      this.phase = phase;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      MethodVisitor mv = emitter.mv;
      mv.visitVarInsn(Opcodes.ALOAD, emitter.selfLocal);
      emitter.emitInt(child);
      mv.visitVarInsn(Opcodes.ALOAD, emitter.currLocal);
      String desc;
      if (phase.writesNext()) {
        mv.visitVarInsn(Opcodes.ALOAD, emitter.nextLocal());
        desc = "(I[D[DD)V";
      } else {
        desc = "(I[DD)V";
      }
      mv.visitVarInsn(Opcodes.DLOAD, emitter.dtLocal);
      mv.visitMethodInsn(
          Opcodes.INVOKEVIRTUAL, Loader.asmType(Frame.class), methodName(), desc, false);
    }

    private String methodName() {
      switch (phase) {
        case INITIALS:
          return "initialsOf";
        case FLOWS:
          return "flowsOf";
        case STOCKS:
          return "stocksOf";
      }
      throw new AssertionError(phase);
    }

    @Override
    public void execute(Frame self, double[] curr, double[] next, double dt) {
      switch (phase) {
        case INITIALS:
          self.initialsOf(child, curr, dt);
          break;
        case FLOWS:
          self.flowsOf(child, curr, dt);
          break;
        case STOCKS:
          self.stocksOf(child, curr, next, dt);
          break;
      }
    }

    @Override
    public String toString() {
      return String.format("%s.%s()", name, phase.methodName);
    }
  }
}
