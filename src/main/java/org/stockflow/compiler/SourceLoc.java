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
 * A position in an equation's source text. Lines and columns are both zero-based; columns count
 * chars from the start of the line.
 */
public final class SourceLoc implements Comparable<SourceLoc> {

  /** Used for nodes that were synthesized rather than parsed. */
  public static final SourceLoc UNKNOWN = new SourceLoc(-1, -1);

  public final int line;
  public final int column;

  public SourceLoc(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** Returns the location {@code n} columns after this one, on the same line. */
  public SourceLoc offset(int n) {
    return (this == UNKNOWN) ? UNKNOWN : new SourceLoc(line, column + n);
  }

  @Override
  public int compareTo(SourceLoc other) {
    int cmp = Integer.compare(line, other.line);
    return (cmp != 0) ? cmp : Integer.compare(column, other.column);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof SourceLoc loc) && line == loc.line && column == loc.column;
  }

  @Override
  public int hashCode() {
    return line * 31 + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
