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
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A recursive-descent parser for equations. Binary operators are parsed by precedence climbing;
 * from lowest to highest precedence the levels are
 *
 * <pre>
 *   |
 *   &amp;
 *   =  ≠
 *   &lt;  &gt;  ≤  ≥
 *   +  -
 *   *  /  %
 *   ! (prefix)
 *   ^ (right-associative)
 * </pre>
 *
 * All binary operators other than {@code ^} are left-associative.
 *
 * <p>The parser doesn't throw on bad input; errors are collected and returned in the {@link
 * ParseResult}.
 */
public final class Parser {

  private static final ImmutableList<String> BINARY_LEVELS =
      ImmutableList.of("|", "&", "=≠", "<>≤≥", "+-", "*/%");

  private static final String UNARY = "+-!";

  private final Lexer lexer;
  private final List<String> errors = new ArrayList<>();

  /** The end of the most recently consumed token, used to locate errors at the end of input. */
  private SourceLoc lastEnd = new SourceLoc(0, 0);

  private Parser(String source) {
    this.lexer = new Lexer(source);
  }

  /** Parses the given equation. */
  public static ParseResult parse(String source) {
    return new Parser(source).parseEquation();
  }

  private ParseResult parseEquation() {
    if (lexer.peek() == null) {
      return ParseResult.EMPTY;
    }
    Expr result = parseLevel(0);
    if (result != null && errors.isEmpty()) {
      Token extra = lexer.peek();
      if (extra != null) {
        error(extra.start, "unexpected \"%s\" after end of expression", extra.text);
      }
    } else if (errors.isEmpty()) {
      Token t = lexer.peek();
      error(t == null ? lastEnd : t.start, "expected an expression");
    }
    return errors.isEmpty()
        ? ParseResult.success(result)
        : ParseResult.failure(ImmutableList.copyOf(errors));
  }

  /**
   * Parses a left-associative sequence of binary operators at the given level of {@link
   * #BINARY_LEVELS}; once past the last level, parses a prefix-{@code !} expression.
   */
  private @Nullable Expr parseLevel(int level) {
    if (level == BINARY_LEVELS.size()) {
      return parseNot();
    }
    Expr lhs = parseLevel(level + 1);
    if (lhs == null) {
      return null;
    }
    String ops = BINARY_LEVELS.get(level);
    for (Token op = consumeAnyOf(ops); op != null; op = consumeAnyOf(ops)) {
      Expr rhs = parseLevel(level + 1);
      if (rhs == null) {
        return expected(op, "right hand side of expression after \"%s\"", op.text);
      }
      lhs = new Expr.Binary(lhs, op.start, op.text, rhs);
    }
    return lhs;
  }

  private @Nullable Expr parseNot() {
    Token op = consumeAnyOf("!");
    if (op == null) {
      return parsePower();
    }
    Expr operand = parseNot();
    if (operand == null) {
      return expected(op, "operand of \"%s\"", op.text);
    }
    return new Expr.Unary(op.start, op.text, operand);
  }

  private @Nullable Expr parsePower() {
    Expr base = factor();
    if (base == null) {
      return null;
    }
    Token op = consumeAnyOf("^");
    if (op == null) {
      return base;
    }
    // Right-associative: the exponent may itself be a power.
    Expr exponent = parsePower();
    if (exponent == null) {
      return expected(op, "exponent after \"^\"");
    }
    return new Expr.Binary(base, op.start, op.text, exponent);
  }

  /**
   * Parses a parenthesized expression, a prefix operator applied to a power expression, a number,
   * an if-then-else, or an identifier (possibly a function call). Returns null without adding an
   * error if the next token can't start any of these.
   */
  private @Nullable Expr factor() {
    if (!errors.isEmpty()) {
      return null;
    }
    Token t = lexer.peek();
    if (t == null) {
      return null;
    }
    switch (t.kind) {
      case OPERATOR:
        if (t.isOperator("(")) {
          return paren(consume());
        } else if (UNARY.contains(t.text)) {
          Token op = consume();
          Expr operand = parsePower();
          if (operand == null) {
            return expected(op, "operand of unary \"%s\"", op.text);
          }
          return new Expr.Unary(op.start, op.text, operand);
        }
        return null;
      case NUMBER:
        return number(consume());
      case RESERVED:
        return t.isReserved("if") ? ifThenElse(consume()) : null;
      case IDENT:
        Token ident = consume();
        Token lParen = consumeAnyOf("(");
        if (lParen != null) {
          return call(ident, lParen);
        } else if (ident.text.equals("nan")) {
          return new Expr.Constant(ident.start, Double.NaN, ident.text.length());
        }
        return new Expr.Ident(ident.start, ident.text);
    }
    throw new AssertionError(t.kind);
  }

  private @Nullable Expr paren(Token lParen) {
    Expr inner = parseLevel(0);
    if (inner == null) {
      return expected(lParen, "expression after \"(\"");
    }
    Token rParen = consumeAnyOf(")");
    if (rParen == null) {
      return expected(null, "\")\"");
    }
    return new Expr.Paren(lParen.start, inner, rParen.start);
  }

  private @Nullable Expr number(Token t) {
    double value;
    try {
      value = Double.parseDouble(t.text);
    } catch (NumberFormatException e) {
      error(t.start, "invalid number \"%s\"", t.text);
      return null;
    }
    return new Expr.Constant(t.start, value, t.text.length());
  }

  private @Nullable Expr ifThenElse(Token ifToken) {
    Expr cond = parseLevel(0);
    if (cond == null) {
      return expected(ifToken, "condition after \"if\"");
    }
    Token thenToken = consumeReserved("then");
    if (thenToken == null) {
      return expected(null, "\"then\"");
    }
    Expr ifTrue = parseLevel(0);
    if (ifTrue == null) {
      return expected(thenToken, "expression after \"then\"");
    }
    Token elseToken = consumeReserved("else");
    if (elseToken == null) {
      return expected(null, "\"else\"");
    }
    Expr ifFalse = parseLevel(0);
    if (ifFalse == null) {
      return expected(elseToken, "expression after \"else\"");
    }
    return new Expr.If(ifToken.start, cond, thenToken.start, ifTrue, elseToken.start, ifFalse);
  }

  private @Nullable Expr call(Token fn, Token lParen) {
    ImmutableList.Builder<Expr> args = ImmutableList.builder();
    Token rParen = consumeAnyOf(")");
    while (rParen == null) {
      Expr arg = parseLevel(0);
      if (arg == null) {
        return expected(null, "argument in call to %s", fn.text);
      }
      args.add(arg);
      if (consumeAnyOf(",") == null) {
        rParen = consumeAnyOf(")");
        if (rParen == null) {
          return expected(null, "\",\" or \")\" in call to %s", fn.text);
        }
      }
    }
    return new Expr.Call(
        new Expr.Ident(fn.start, fn.text), lParen.start, args.build(), rParen.start);
  }

  private Token consume() {
    Token t = lexer.next();
    lastEnd = t.end;
    return t;
  }

  /** If the next token is an operator that appears in {@code ops}, consumes and returns it. */
  private @Nullable Token consumeAnyOf(String ops) {
    Token t = lexer.peek();
    if (t != null && t.kind == Token.Kind.OPERATOR && ops.contains(t.text)) {
      return consume();
    }
    return null;
  }

  private @Nullable Token consumeReserved(String word) {
    Token t = lexer.peek();
    return (t != null && t.isReserved(word)) ? consume() : null;
  }

  /**
   * Records an error saying that we expected something else at the current token (or after {@code
   * after}, if the input ended), and returns null. Only the first error is recorded.
   */
  @FormatMethod
  private @Nullable Expr expected(@Nullable Token after, String fmt, Object... fmtArgs) {
    if (errors.isEmpty()) {
      Token t = lexer.peek();
      SourceLoc loc = (t != null) ? t.start : (after != null ? after.end : lastEnd);
      String found = (t != null) ? "\"" + t.text + "\"" : "end of equation";
      error(loc, "expected %s, not %s", String.format(fmt, fmtArgs), found);
    }
    return null;
  }

  @FormatMethod
  private void error(SourceLoc loc, String fmt, Object... fmtArgs) {
    errors.add(loc + ": " + String.format(fmt, fmtArgs));
  }
}
