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
import java.util.Objects;
import java.util.stream.Collectors;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * A CodeValue represents a double that can be computed during a simulation step. The subclasses
 * are
 *
 * <ul>
 *   <li>{@link Const}: a constant value
 *   <li>{@link Local}: a variable of the current instance, at a fixed offset from its base
 *   <li>{@link Ref}: a variable of some other instance, found through the instance's references
 *   <li>{@link #TIME} and {@link #DT}: the current time and the time step
 *   <li>{@link Call}: an {@link Op} applied to other CodeValues
 *   <li>{@link Cond}: one of two CodeValues, chosen by a third
 *   <li>{@link Lookup}: a {@link LookupTable} evaluated at another CodeValue
 * </ul>
 *
 * <p>CodeValues are immutable. Each can either emit the bytecode to push its value on the stack or
 * compute its value directly (for the {@link Interpreter}).
 */
public abstract class CodeValue {

  // Subclasses are all defined here.
  private CodeValue() {}

  /** Emits the instructions to push this value on the stack. */
  abstract void emit(BytecodeEmitter emitter);

  /** Returns this value, given the frame of the current instance and the current state. */
  public abstract double eval(Frame self, double[] curr, double dt);

  public static Const of(double value) {
    return new Const(value);
  }

  public static final CodeValue TIME =
      new CodeValue() {
        @Override
        void emit(BytecodeEmitter emitter) {
          MethodVisitor mv = emitter.mv;
          mv.visitVarInsn(Opcodes.ALOAD, emitter.currLocal);
          mv.visitInsn(Opcodes.ICONST_0);
          mv.visitInsn(Opcodes.DALOAD);
        }

        @Override
        public double eval(Frame self, double[] curr, double dt) {
          return curr[0];
        }

        @Override
        public String toString() {
          return "time";
        }
      };

  public static final CodeValue DT =
      new CodeValue() {
        @Override
        void emit(BytecodeEmitter emitter) {
          emitter.mv.visitVarInsn(Opcodes.DLOAD, emitter.dtLocal);
        }

        @Override
        public double eval(Frame self, double[] curr, double dt) {
          return dt;
        }

        @Override
        public String toString() {
          return "dt";
        }
      };

  /** A constant value. */
  public static final class Const extends CodeValue {
    public final double value;

    private Const(double value) {
      this.value = value;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      if (value == 0 && Double.doubleToRawLongBits(value) == 0) {
        emitter.mv.visitInsn(Opcodes.DCONST_0);
      } else if (value == 1) {
        emitter.mv.visitInsn(Opcodes.DCONST_1);
      } else {
        emitter.mv.visitLdcInsn(value);
      }
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      return value;
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Const c) && Double.compare(value, c.value) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A variable of the current instance. */
  public static final class Local extends CodeValue {
    /** The offset from the instance's base. */
    public final int offset;

    /** Used only for {@code toString()}. */
    public final String name;

    public Local(int offset, String name) {
      Preconditions.checkArgument(offset >= 0);
      this.offset = offset;
      this.name = name;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      emitter.emitIndex(emitter.currLocal, offset);
      emitter.mv.visitInsn(Opcodes.DALOAD);
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      return curr[self.base + offset];
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Local l) && offset == l.offset;
    }

    @Override
    public int hashCode() {
      return offset;
    }

    @Override
    public String toString() {
      return name + "@" + offset;
    }
  }

  /** A variable that the current instance finds through its {@code index}th reference. */
  public static final class Ref extends CodeValue {
    public final int index;

    /** Used only for {@code toString()}. */
    public final String name;

    public Ref(int index, String name) {
      this.index = index;
      this.name = name;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      MethodVisitor mv = emitter.mv;
      mv.visitVarInsn(Opcodes.ALOAD, emitter.currLocal);
      mv.visitVarInsn(Opcodes.ALOAD, emitter.refsLocal);
      emitter.emitInt(index);
      mv.visitInsn(Opcodes.IALOAD);
      mv.visitInsn(Opcodes.DALOAD);
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      return curr[self.refs[index]];
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Ref r) && index == r.index;
    }

    @Override
    public int hashCode() {
      return index * 31 + 1;
    }

    @Override
    public String toString() {
      return "&" + name;
    }
  }

  /** The result of applying an Op to some arguments. */
  public static final class Call extends CodeValue {
    public final Op op;
    public final ImmutableList<CodeValue> args;

    public Call(Op op, ImmutableList<CodeValue> args) {
      Preconditions.checkArgument(args.size() == op.arity, "wrong number of args to %s", op);
      this.op = op;
      this.args = args;
    }

    public Call(Op op, CodeValue... args) {
      this(op, ImmutableList.copyOf(args));
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      args.forEach(arg -> arg.emit(emitter));
      op.emit(emitter.mv);
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      double[] values = new double[args.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = args.get(i).eval(self, curr, dt);
      }
      return op.apply(values);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Call c) && op == c.op && args.equals(c.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public String toString() {
      return op + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** {@code ifTrue} if {@code test} is true (non-zero and not NaN), otherwise {@code ifFalse}. */
  public static final class Cond extends CodeValue {
    public final CodeValue test;
    public final CodeValue ifTrue;
    public final CodeValue ifFalse;

    public Cond(CodeValue test, CodeValue ifTrue, CodeValue ifFalse) {
      this.test = test;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      MethodVisitor mv = emitter.mv;
      Label elseLabel = new Label();
      Label done = new Label();
      test.emit(emitter);
      mv.visitMethodInsn(
          Opcodes.INVOKESTATIC, Loader.asmType(Functions.class), "truthy", "(D)Z", false);
      mv.visitJumpInsn(Opcodes.IFEQ, elseLabel);
      ifTrue.emit(emitter);
      mv.visitJumpInsn(Opcodes.GOTO, done);
      mv.visitLabel(elseLabel);
      ifFalse.emit(emitter);
      mv.visitLabel(done);
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      return Functions.truthy(test.eval(self, curr, dt))
          ? ifTrue.eval(self, curr, dt)
          : ifFalse.eval(self, curr, dt);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Cond c)
          && test.equals(c.test)
          && ifTrue.equals(c.ifTrue)
          && ifFalse.equals(c.ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(test, ifTrue, ifFalse);
    }

    @Override
    public String toString() {
      return String.format("(%s ? %s : %s)", test, ifTrue, ifFalse);
    }
  }

  /** A graphical function evaluated at {@code index}. */
  public static final class Lookup extends CodeValue {
    public final LookupTable table;
    public final CodeValue index;

    public Lookup(LookupTable table, CodeValue index) {
      this.table = table;
      this.index = index;
    }

    @Override
    void emit(BytecodeEmitter emitter) {
      emitter.loader.emitLoadConstant(table, LookupTable.class);
      index.emit(emitter);
      emitter.mv.visitMethodInsn(
          Opcodes.INVOKEVIRTUAL, Loader.asmType(LookupTable.class), "lookup", "(D)D", false);
    }

    @Override
    public double eval(Frame self, double[] curr, double dt) {
      return table.lookup(index.eval(self, curr, dt));
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Lookup l) && table == l.table && index.equals(l.index);
    }

    @Override
    public int hashCode() {
      return Objects.hash(table.name, index);
    }

    @Override
    public String toString() {
      return "lookup(" + table.name + ", " + index + ")";
    }
  }
}
