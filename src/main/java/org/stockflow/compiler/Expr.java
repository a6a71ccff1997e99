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
import java.util.Objects;

/**
 * An Expr is a node in the abstract syntax tree of an equation. The set of subclasses is closed:
 *
 * <ul>
 *   <li>{@link Ident}: a reference to a variable (possibly a dotted path into a module)
 *   <li>{@link Table}: a reference to a variable's graphical function, only produced by rewriting
 *       the first argument of {@code lookup()}
 *   <li>{@link Constant}: a number
 *   <li>{@link Paren}, {@link Unary}, {@link Binary}, {@link If}: the usual
 *   <li>{@link Call}: a call to a builtin (or a standard-library model, before desugaring)
 * </ul>
 *
 * <p>Exprs are immutable; passes that rewrite a tree return new nodes, so trees can be shared
 * freely. Two Exprs are equal if they have the same structure (source positions are not compared).
 */
public abstract class Expr {

  /** Each pass over an Expr tree implements a Visitor. */
  public interface Visitor<T> {
    T visitIdent(Ident n);

    T visitTable(Table n);

    T visitConstant(Constant n);

    T visitCall(Call n);

    T visitIf(If n);

    T visitParen(Paren n);

    T visitUnary(Unary n);

    T visitBinary(Binary n);
  }

  // Subclasses are all defined here.
  private Expr() {}

  /** The location of the first char of this expression. */
  public abstract SourceLoc pos();

  /** The location just after the last char of this expression. */
  public abstract SourceLoc end();

  public abstract <T> T walk(Visitor<T> visitor);

  @Override
  public String toString() {
    return walk(new PrintVisitor());
  }

  /** The common superclass of {@link Ident} and {@link Table}. */
  public abstract static class Name extends Expr {
    /** The canonicalized identifier. */
    public final String name;

    private final SourceLoc pos;

    /** The length of the name as it appeared in the source. */
    private final int len;

    private Name(SourceLoc pos, String name, int len) {
      this.pos = pos;
      this.name = name;
      this.len = len;
    }

    @Override
    public SourceLoc pos() {
      return pos;
    }

    @Override
    public SourceLoc end() {
      return pos.offset(len);
    }

    @Override
    public boolean equals(Object obj) {
      return obj != null && obj.getClass() == getClass() && name.equals(((Name) obj).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + getClass().hashCode();
    }
  }

  public static final class Ident extends Name {
    /** {@code rawName} is canonicalized. */
    public Ident(SourceLoc pos, String rawName) {
      super(pos, Canonical.canonicalize(rawName), rawName.length());
    }

    /** Returns a synthesized Ident; {@code ident} must already be canonical. */
    public static Ident of(String ident) {
      return new Ident(SourceLoc.UNKNOWN, ident);
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitIdent(this);
    }
  }

  public static final class Table extends Name {
    public Table(SourceLoc pos, String name, int len) {
      super(pos, name, len);
    }

    /** Returns a Table with the same name and location as the given Ident. */
    public static Table from(Ident ident) {
      return new Table(ident.pos(), ident.name, ident.name.length());
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitTable(this);
    }
  }

  public static final class Constant extends Expr {
    public final double value;
    private final SourceLoc pos;
    private final int len;

    public Constant(SourceLoc pos, double value, int len) {
      this.pos = pos;
      this.value = value;
      this.len = len;
    }

    public static Constant of(double value) {
      return new Constant(SourceLoc.UNKNOWN, value, 0);
    }

    @Override
    public SourceLoc pos() {
      return pos;
    }

    @Override
    public SourceLoc end() {
      return pos.offset(len);
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object obj) {
      // Double.compare so that NaN constants are equal to each other
      return (obj instanceof Constant c) && Double.compare(value, c.value) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }
  }

  public static final class Paren extends Expr {
    public final Expr inner;
    private final SourceLoc lParen;
    private final SourceLoc rParen;

    public Paren(SourceLoc lParen, Expr inner, SourceLoc rParen) {
      this.lParen = lParen;
      this.inner = inner;
      this.rParen = rParen;
    }

    @Override
    public SourceLoc pos() {
      return lParen;
    }

    @Override
    public SourceLoc end() {
      return rParen.offset(1);
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitParen(this);
    }

    /** Returns a Paren with the same location as this one enclosing a different expression. */
    public Paren with(Expr newInner) {
      return (newInner == inner) ? this : new Paren(lParen, newInner, rParen);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Paren p) && inner.equals(p.inner);
    }

    @Override
    public int hashCode() {
      return inner.hashCode() * 3;
    }
  }

  public static final class Unary extends Expr {
    /** One of "{@code +}", "{@code -}", or "{@code !}". */
    public final String op;

    public final Expr operand;
    private final SourceLoc opPos;

    public Unary(SourceLoc opPos, String op, Expr operand) {
      this.opPos = opPos;
      this.op = op;
      this.operand = operand;
    }

    @Override
    public SourceLoc pos() {
      return opPos;
    }

    @Override
    public SourceLoc end() {
      return operand.end();
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    public Unary with(Expr newOperand) {
      return (newOperand == operand) ? this : new Unary(opPos, op, newOperand);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Unary u) && op.equals(u.op) && operand.equals(u.operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }
  }

  public static final class Binary extends Expr {
    public final Expr left;

    /**
     * One of "{@code ^ * / % + - < > ≤ ≥ = ≠ & |}" (word operators and two-char relational
     * operators are represented by their single-char equivalents).
     */
    public final String op;

    public final Expr right;
    public final SourceLoc opPos;

    public Binary(Expr left, SourceLoc opPos, String op, Expr right) {
      this.left = left;
      this.opPos = opPos;
      this.op = op;
      this.right = right;
    }

    @Override
    public SourceLoc pos() {
      return left.pos();
    }

    @Override
    public SourceLoc end() {
      return right.end();
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }

    public Binary with(Expr newLeft, Expr newRight) {
      if (newLeft == left && newRight == right) {
        return this;
      }
      return new Binary(newLeft, opPos, op, newRight);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Binary b)
          && op.equals(b.op)
          && left.equals(b.left)
          && right.equals(b.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, op, right);
    }
  }

  public static final class If extends Expr {
    public final Expr cond;
    public final Expr ifTrue;
    public final Expr ifFalse;
    private final SourceLoc ifPos;
    private final SourceLoc thenPos;
    private final SourceLoc elsePos;

    public If(
        SourceLoc ifPos,
        Expr cond,
        SourceLoc thenPos,
        Expr ifTrue,
        SourceLoc elsePos,
        Expr ifFalse) {
      this.ifPos = ifPos;
      this.cond = cond;
      this.thenPos = thenPos;
      this.ifTrue = ifTrue;
      this.elsePos = elsePos;
      this.ifFalse = ifFalse;
    }

    @Override
    public SourceLoc pos() {
      return ifPos;
    }

    @Override
    public SourceLoc end() {
      return ifFalse.end();
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    public If with(Expr newCond, Expr newTrue, Expr newFalse) {
      if (newCond == cond && newTrue == ifTrue && newFalse == ifFalse) {
        return this;
      }
      return new If(ifPos, newCond, thenPos, newTrue, elsePos, newFalse);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof If i)
          && cond.equals(i.cond)
          && ifTrue.equals(i.ifTrue)
          && ifFalse.equals(i.ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(cond, ifTrue, ifFalse);
    }
  }

  public static final class Call extends Expr {
    /** The function being called; in this language always a simple identifier. */
    public final Ident fn;

    public final ImmutableList<Expr> args;
    private final SourceLoc lParen;
    private final SourceLoc rParen;

    public Call(Ident fn, SourceLoc lParen, ImmutableList<Expr> args, SourceLoc rParen) {
      this.fn = fn;
      this.lParen = lParen;
      this.args = args;
      this.rParen = rParen;
    }

    @Override
    public SourceLoc pos() {
      return fn.pos();
    }

    @Override
    public SourceLoc end() {
      return rParen.offset(1);
    }

    @Override
    public <T> T walk(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }

    public Call with(Ident newFn, ImmutableList<Expr> newArgs) {
      if (newFn == fn && newArgs.equals(args)) {
        return this;
      }
      return new Call(newFn, lParen, newArgs, rParen);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Call c) && fn.equals(c.fn) && args.equals(c.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }
  }
}
