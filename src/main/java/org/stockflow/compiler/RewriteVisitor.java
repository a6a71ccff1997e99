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

/**
 * A base class for passes that rewrite an Expr tree. Each visit method rewrites the node's
 * children and returns a new node if any of them changed (or the original node if none did);
 * subclasses override the methods for the node types they care about.
 */
public abstract class RewriteVisitor implements Expr.Visitor<Expr> {

  /** Rewrites {@code expr}; a convenience for {@code expr.walk(this)}. */
  public Expr rewrite(Expr expr) {
    return expr.walk(this);
  }

  @Override
  public Expr visitIdent(Expr.Ident n) {
    return n;
  }

  @Override
  public Expr visitTable(Expr.Table n) {
    return n;
  }

  @Override
  public Expr visitConstant(Expr.Constant n) {
    return n;
  }

  @Override
  public Expr visitCall(Expr.Call n) {
    return n.with(n.fn, rewriteArgs(n.args));
  }

  /** Rewrites each of the given call arguments. */
  protected ImmutableList<Expr> rewriteArgs(ImmutableList<Expr> args) {
    ImmutableList.Builder<Expr> result = ImmutableList.builderWithExpectedSize(args.size());
    boolean changed = false;
    for (Expr arg : args) {
      Expr newArg = arg.walk(this);
      changed |= (newArg != arg);
      result.add(newArg);
    }
    return changed ? result.build() : args;
  }

  @Override
  public Expr visitIf(Expr.If n) {
    return n.with(n.cond.walk(this), n.ifTrue.walk(this), n.ifFalse.walk(this));
  }

  @Override
  public Expr visitParen(Expr.Paren n) {
    return n.with(n.inner.walk(this));
  }

  @Override
  public Expr visitUnary(Expr.Unary n) {
    return n.with(n.operand.walk(this));
  }

  @Override
  public Expr visitBinary(Expr.Binary n) {
    return n.with(n.left.walk(this), n.right.walk(this));
  }
}
