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

import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * Collects the identifiers referenced by an Expr. The names of called functions are not included
 * (they are builtins, not variables), but the tables named by {@code lookup()} calls are.
 */
public final class IdentifierSetVisitor implements Expr.Visitor<Void> {

  private final ImmutableSet.Builder<String> idents = ImmutableSet.builder();

  private IdentifierSetVisitor() {}

  /** Returns the identifiers referenced by {@code expr}, in the order they first appear. */
  public static ImmutableSet<String> identifiers(@Nullable Expr expr) {
    if (expr == null) {
      return ImmutableSet.of();
    }
    IdentifierSetVisitor visitor = new IdentifierSetVisitor();
    expr.walk(visitor);
    return visitor.idents.build();
  }

  @Override
  public Void visitIdent(Expr.Ident n) {
    idents.add(n.name);
    return null;
  }

  @Override
  public Void visitTable(Expr.Table n) {
    idents.add(n.name);
    return null;
  }

  @Override
  public Void visitConstant(Expr.Constant n) {
    return null;
  }

  @Override
  public Void visitCall(Expr.Call n) {
    n.args.forEach(arg -> arg.walk(this));
    return null;
  }

  @Override
  public Void visitIf(Expr.If n) {
    n.cond.walk(this);
    n.ifTrue.walk(this);
    n.ifFalse.walk(this);
    return null;
  }

  @Override
  public Void visitParen(Expr.Paren n) {
    return n.inner.walk(this);
  }

  @Override
  public Void visitUnary(Expr.Unary n) {
    return n.operand.walk(this);
  }

  @Override
  public Void visitBinary(Expr.Binary n) {
    n.left.walk(this);
    n.right.walk(this);
    return null;
  }
}
