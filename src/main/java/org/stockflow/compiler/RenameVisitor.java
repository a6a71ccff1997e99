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

/**
 * Renames references to one variable. A reference matches if it is the old name, or a dotted path
 * whose first component is the old name (so renaming a module also fixes {@code module.output}).
 */
public final class RenameVisitor extends RewriteVisitor {
  private final String from;
  private final String to;

  /** Both names must be canonical. */
  public RenameVisitor(String from, String to) {
    this.from = from;
    this.to = to;
  }

  /** Returns the renamed form of {@code ident}, or {@code ident} if it doesn't refer to us. */
  public String rename(String ident) {
    if (ident.equals(from)) {
      return to;
    } else if (ident.startsWith(from) && ident.charAt(from.length()) == '.') {
      return to + ident.substring(from.length());
    } else if (ident.startsWith(".")) {
      String rest = rename(ident.substring(1));
      return (rest.equals(ident.substring(1))) ? ident : "." + rest;
    }
    return ident;
  }

  @Override
  public Expr visitIdent(Expr.Ident n) {
    String renamed = rename(n.name);
    return renamed.equals(n.name) ? n : new Expr.Ident(n.pos(), renamed);
  }

  @Override
  public Expr visitTable(Expr.Table n) {
    String renamed = rename(n.name);
    return renamed.equals(n.name) ? n : new Expr.Table(n.pos(), renamed, renamed.length());
  }
}
