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

/** A single lexical token of an equation, with the span of source text it was read from. */
public final class Token {

  public enum Kind {
    NUMBER,
    IDENT,
    RESERVED,
    OPERATOR
  }

  public final Kind kind;

  /**
   * The token's text after case folding. Word operators and two-char relational operators have
   * already been replaced by their single-char forms (e.g. "{@code and}" is "{@code &}" and
   * "{@code >=}" is "{@code ≥}").
   */
  public final String text;

  public final SourceLoc start;

  /** The location just after the last char of this token. */
  public final SourceLoc end;

  public Token(Kind kind, String text, SourceLoc start, SourceLoc end) {
    this.kind = kind;
    this.text = text;
    this.start = start;
    this.end = end;
  }

  /** Returns true if this is an operator token with the given text. */
  public boolean isOperator(String op) {
    return kind == Kind.OPERATOR && text.equals(op);
  }

  /** Returns true if this is a reserved word with the given text. */
  public boolean isReserved(String word) {
    return kind == Kind.RESERVED && text.equals(word);
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + start;
  }
}
