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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/** A statics-only class for the canonical forms of identifiers. */
public class Canonical {

  private Canonical() {}

  /** Words that are part of the equation syntax and can never be identifiers. */
  public static final ImmutableSet<String> RESERVED = ImmutableSet.of("if", "then", "else");

  /** Prefix of every identifier that was synthesized by the compiler rather than declared. */
  public static final String HIDDEN_PREFIX = "$·";

  private static final CharMatcher QUOTE = CharMatcher.is('"');

  /**
   * Returns the canonical form of a variable or model name: surrounding whitespace and quotes are
   * removed, the name is lower-cased, and each run of whitespace (including an escaped "{@code
   * \n}") becomes a single underscore.
   */
  public static String canonicalize(String name) {
    String s = name.trim();
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
      s = s.substring(1, s.length() - 1);
    } else {
      s = QUOTE.removeFrom(s);
    }
    s = s.replace("\\n", " ");
    s = CharMatcher.whitespace().trimAndCollapseFrom(s, '_');
    return s.toLowerCase(Locale.ROOT);
  }

  /** Returns true if the given (canonical) identifier was synthesized by the compiler. */
  public static boolean isHidden(String ident) {
    return ident.startsWith(HIDDEN_PREFIX);
  }

  /**
   * Converts an identifier to the form used for generated class names, e.g. "{@code smth1_0}"
   * becomes "{@code Smth1_0}".
   */
  public static String titleCase(String ident) {
    if (ident.isEmpty()) {
      return ident;
    }
    return Character.toUpperCase(ident.charAt(0)) + ident.substring(1);
  }
}
