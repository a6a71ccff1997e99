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

import com.google.common.collect.ImmutableMap;
import java.util.stream.Collectors;

/**
 * Converts an Expr back into equation source that the {@link Parser} accepts and that parses to an
 * equal Expr. Parentheses from the original source are kept (they are {@link Expr.Paren} nodes);
 * additional parentheses are only added where a synthesized tree would otherwise be re-parsed
 * differently.
 */
public final class PrintVisitor implements Expr.Visitor<String> {

  /** Operators whose source form differs from their internal one. */
  private static final ImmutableMap<String, String> SOURCE_FORM =
      ImmutableMap.of(
          "≥", ">=", "≤", "<=", "≠", "<>", "&", "and", "|", "or", "%", "mod", "!", "not ");

  private static final ImmutableMap<String, Integer> PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("|", 1)
          .put("&", 2)
          .put("=", 3)
          .put("≠", 3)
          .put("<", 4)
          .put(">", 4)
          .put("≤", 4)
          .put("≥", 4)
          .put("+", 5)
          .put("-", 5)
          .put("*", 6)
          .put("/", 6)
          .put("%", 6)
          .put("^", 8)
          .buildOrThrow();

  private static final int UNARY_PRECEDENCE = 7;

  /** Anything that isn't an operator expression binds tighter than all operators. */
  private static final int ATOM_PRECEDENCE = 9;

  public static String print(Expr expr) {
    return expr.walk(new PrintVisitor());
  }

  @Override
  public String visitIdent(Expr.Ident n) {
    return n.name;
  }

  @Override
  public String visitTable(Expr.Table n) {
    return n.name;
  }

  @Override
  public String visitConstant(Expr.Constant n) {
    double v = n.value;
    if (Double.isNaN(v)) {
      return "nan";
    } else if (Double.isInfinite(v)) {
      return (v > 0) ? "inf()" : "-inf()";
    } else if (v == Math.rint(v) && Math.abs(v) < 1e15) {
      return Long.toString((long) v);
    }
    return Double.toString(v);
  }

  @Override
  public String visitCall(Expr.Call n) {
    return n.args.stream()
        .map(arg -> arg.walk(this))
        .collect(Collectors.joining(", ", n.fn.name + "(", ")"));
  }

  @Override
  public String visitIf(Expr.If n) {
    return String.format(
        "if %s then %s else %s", n.cond.walk(this), n.ifTrue.walk(this), n.ifFalse.walk(this));
  }

  @Override
  public String visitParen(Expr.Paren n) {
    return "(" + n.inner.walk(this) + ")";
  }

  @Override
  public String visitUnary(Expr.Unary n) {
    String op = SOURCE_FORM.getOrDefault(n.op, n.op);
    // The operand of a prefix operator is parsed as a power expression.
    return op + operand(n.operand, precedence(n.operand) < PRECEDENCE.get("^"));
  }

  @Override
  public String visitBinary(Expr.Binary n) {
    int prec = PRECEDENCE.get(n.op);
    boolean rightAssoc = n.op.equals("^");
    int leftPrec = precedence(n.left);
    int rightPrec = precedence(n.right);
    String left = operand(n.left, leftPrec < prec || (rightAssoc && leftPrec == prec));
    String right = operand(n.right, rightPrec < prec || (!rightAssoc && rightPrec == prec));
    return left + " " + SOURCE_FORM.getOrDefault(n.op, n.op).trim() + " " + right;
  }

  private String operand(Expr expr, boolean needsParens) {
    String s = expr.walk(this);
    return (needsParens || expr instanceof Expr.If) ? "(" + s + ")" : s;
  }

  private static int precedence(Expr expr) {
    if (expr instanceof Expr.Binary b) {
      return PRECEDENCE.get(b.op);
    } else if (expr instanceof Expr.Unary) {
      return UNARY_PRECEDENCE;
    }
    return ATOM_PRECEDENCE;
  }
}
