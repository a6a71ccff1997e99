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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RenameVisitorTest {

  private static String rename(String source, String from, String to) {
    Expr expr = Parser.parse(source).expr;
    return PrintVisitor.print(new RenameVisitor(from, to).rewrite(expr));
  }

  @Test
  public void renamesIdentsAndModulePaths() {
    assertThat(rename("a + b * a", "a", "c")).isEqualTo("c + b * c");
    assertThat(rename("m.output + m2.output", "m", "n")).isEqualTo("n.output + m2.output");
    assertThat(rename("lookup(tbl, tbl2)", "tbl", "t")).isEqualTo("lookup(t, tbl2)");
    assertThat(rename("abc + ab", "ab", "x")).isEqualTo("abc + x");
  }

  @Test
  public void unchangedTreeIsShared() {
    Expr expr = Parser.parse("max(a, b) + if c then 1 else 2").expr;
    assertThat(new RenameVisitor("z", "y").rewrite(expr)).isSameInstanceAs(expr);
  }

  @Test
  public void renameString() {
    RenameVisitor renamer = new RenameVisitor("stock", "level");
    assertThat(renamer.rename("stock")).isEqualTo("level");
    assertThat(renamer.rename("stock.x")).isEqualTo("level.x");
    assertThat(renamer.rename(".stock")).isEqualTo(".level");
    assertThat(renamer.rename(".other")).isEqualTo(".other");
    assertThat(renamer.rename("stocks")).isEqualTo("stocks");
  }

  @Test
  public void identifiers() {
    Expr expr = Parser.parse("if time > t then max(a, b.c) else lookup(tbl, a)").expr;
    assertThat(IdentifierSetVisitor.identifiers(expr))
        .containsExactly("time", "t", "a", "b.c", "tbl")
        .inOrder();
    assertThat(IdentifierSetVisitor.identifiers(null)).isEmpty();
  }

  @Test
  public void canonicalNames() {
    assertThat(Canonical.canonicalize("  Birth   Rate ")).isEqualTo("birth_rate");
    assertThat(Canonical.canonicalize("\"Net\\nFlow\"")).isEqualTo("net_flow");
    assertThat(Canonical.canonicalize("already_canonical")).isEqualTo("already_canonical");
    assertThat(Canonical.isHidden("$·x·0·smth1")).isTrue();
    assertThat(Canonical.isHidden("x")).isFalse();
    assertThat(Canonical.titleCase("smth1_0")).isEqualTo("Smth1_0");
  }
}
