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
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Splits an equation into {@link Token}s. The source is case-folded before lexing, so identifiers,
 * reserved words and number exponents are all lower case.
 *
 * <p>Comments (enclosed in curly braces) are skipped wherever they appear. The word operators
 * {@code not}, {@code and}, {@code or} and {@code mod} are returned as the operator tokens {@code
 * !}, {@code &}, {@code |} and {@code %}, and {@code >=}, {@code <=} and {@code <>} are returned as
 * the single-char operators {@code ≥}, {@code ≤} and {@code ≠}.
 *
 * <p>The lexer never throws: when it can't make sense of the remaining input it just stops
 * returning tokens.
 */
public final class Lexer {

  private static final ImmutableMap<String, String> WORD_OPERATORS =
      ImmutableMap.of("not", "!", "and", "&", "or", "|", "mod", "%");

  /** Chars that are always single-char operators (some may be extended to two-char operators). */
  private static final String OPERATOR_CHARS = "=<>()[]^+-*/,!&|%";

  /**
   * An optional integer part, an optional fractional part, and an optional exponent. Only applied
   * at a digit or '.', so it always matches at least one char.
   */
  private static final Pattern NUMBER = Pattern.compile("\\d*(\\.\\d*)?(e[-+]?\\d+)?");

  private final String text;
  private final Matcher numberMatcher;

  /** The index in {@link #text} of the next char to be examined. */
  private int pos;

  /** The number of newlines before {@link #pos}. */
  private int line;

  /** The index in {@link #text} of the first char of the current line. */
  private int lineStart;

  /** If non-null, the result of a call to {@link #peek} that hasn't been consumed yet. */
  private Token peeked;

  public Lexer(String source) {
    this.text = source.toLowerCase(Locale.ROOT);
    this.numberMatcher = NUMBER.matcher(text);
  }

  /** Returns all the tokens in {@code source}. */
  public static ImmutableList<Token> tokenize(String source) {
    Lexer lexer = new Lexer(source);
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    for (Token t = lexer.next(); t != null; t = lexer.next()) {
      result.add(t);
    }
    return result.build();
  }

  /** Returns the next token without consuming it, or null at the end of the input. */
  public @Nullable Token peek() {
    if (peeked == null) {
      peeked = lex();
    }
    return peeked;
  }

  /** Consumes and returns the next token, or returns null at the end of the input. */
  public @Nullable Token next() {
    Token result = peek();
    peeked = null;
    return result;
  }

  private @Nullable Token lex() {
    skipWhitespaceAndComments();
    if (pos >= text.length()) {
      return null;
    }
    SourceLoc start = new SourceLoc(line, pos - lineStart);
    char ch = text.charAt(pos);
    if (isNumberStart(ch)) {
      return lexNumber(start);
    } else if (ch == '"' || isIdentifierStart(ch)) {
      return lexIdentifier(start);
    }
    int len = 1;
    String op = String.valueOf(ch);
    char nextCh = (pos + 1 < text.length()) ? text.charAt(pos + 1) : 0;
    if (ch == '=' && nextCh == '=') {
      len = 2;
    } else if (ch == '<' && nextCh == '=') {
      op = "≤";
      len = 2;
    } else if (ch == '<' && nextCh == '>') {
      op = "≠";
      len = 2;
    } else if (ch == '>' && nextCh == '=') {
      op = "≥";
      len = 2;
    }
    pos += len;
    return new Token(Token.Kind.OPERATOR, op, start, start.offset(len));
  }

  private void skipWhitespaceAndComments() {
    boolean inComment = false;
    for (; pos < text.length(); pos++) {
      char ch = text.charAt(pos);
      if (ch == '\n') {
        line++;
        lineStart = pos + 1;
      } else if (inComment) {
        if (ch == '}') {
          inComment = false;
        }
      } else if (ch == '{') {
        inComment = true;
      } else if (!Character.isWhitespace(ch)) {
        return;
      }
    }
  }

  private Token lexNumber(SourceLoc start) {
    numberMatcher.region(pos, text.length());
    boolean matched = numberMatcher.lookingAt();
    assert matched;
    int len = numberMatcher.end() - pos;
    String numText = text.substring(pos, pos + len);
    pos += len;
    return new Token(Token.Kind.NUMBER, numText, start, start.offset(len));
  }

  private Token lexIdentifier(SourceLoc start) {
    int begin = pos;
    if (text.charAt(pos) == '"') {
      // Anything goes inside quotes; an unterminated quote runs to the end of the input.
      int close = text.indexOf('"', pos + 1);
      pos = (close < 0) ? text.length() : close + 1;
    } else {
      pos++;
      while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
        pos++;
      }
    }
    int len = pos - begin;
    String ident = text.substring(begin, pos);
    Token.Kind kind = Token.Kind.IDENT;
    String op = WORD_OPERATORS.get(ident);
    if (op != null) {
      ident = op;
      kind = Token.Kind.OPERATOR;
    } else if (Canonical.RESERVED.contains(ident)) {
      kind = Token.Kind.RESERVED;
    }
    return new Token(kind, ident, start, start.offset(len));
  }

  private static boolean isNumberStart(char ch) {
    return (ch >= '0' && ch <= '9') || ch == '.';
  }

  private static boolean isIdentifierStart(char ch) {
    return !isNumberStart(ch)
        && !Character.isWhitespace(ch)
        && OPERATOR_CHARS.indexOf(ch) < 0
        && ch != '{'
        && ch != '}'
        && ch != '"';
  }

  /** Digits and '.' may continue an identifier (the latter separates module path components). */
  private static boolean isIdentifierPart(char ch) {
    return isIdentifierStart(ch) || isNumberStart(ch);
  }
}
