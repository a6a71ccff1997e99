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

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class PrintVisitorTest {

  private static Expr parse(String source) {
    ParseResult result = Parser.parse(source);
    assertThat(result.errors).isEmpty();
    return result.expr;
  }

  @Test
  public void printedFormReparses(
      @TestParameter({
            "2+3*4",
            "2^3^2",
            "(2^3)^2",
            "10 - (4 - 3)",
            "-x^2",
            "-(x+1)",
            "not a and b or c",
            "a <> b",
            "a >= b and a <= c",
            "x mod 3",
            "if a > 1 then max(a, 2) else min(b, 3)",
            "1 + (if a then 1 else 2)",
            "\"Birth Rate\" * 0.25",
            "lookup(tbl, time)",
            "smth1(x, 5)",
            "m.output / 1e-3",
            "nan"
          })
          String source) {
    Expr expr = parse(source);
    String printed = PrintVisitor.print(expr);
    assertThat(parse(printed)).isEqualTo(expr);
    // Printing is stable.
    assertThat(PrintVisitor.print(parse(printed))).isEqualTo(printed);
  }

  @Test
  public void printedForms() {
    assertThat(PrintVisitor.print(parse("2+3*4"))).isEqualTo("2 + 3 * 4");
    assertThat(PrintVisitor.print(parse("(1+2)*3"))).isEqualTo("(1 + 2) * 3");
    assertThat(PrintVisitor.print(parse("a>=b"))).isEqualTo("a >= b");
    assertThat(PrintVisitor.print(parse("NOT x"))).isEqualTo("not x");
    assertThat(PrintVisitor.print(parse("a AND b"))).isEqualTo("a and b");
    assertThat(PrintVisitor.print(parse("7 MOD 2"))).isEqualTo("7 mod 2");
    assertThat(PrintVisitor.print(parse("1.50"))).isEqualTo("1.5");
    assertThat(PrintVisitor.print(parse("3.0"))).isEqualTo("3");
    assertThat(PrintVisitor.print(parse("f( a ,b )"))).isEqualTo("f(a, b)");
  }

  @Test
  public void synthesizedTreesGetParens() {
    SourceLoc loc = SourceLoc.UNKNOWN;
    Expr sum = new Expr.Binary(Expr.Constant.of(1), loc, "+", Expr.Constant.of(2));
    Expr product = new Expr.Binary(sum, loc, "*", Expr.Constant.of(3));
    assertThat(PrintVisitor.print(product)).isEqualTo("(1 + 2) * 3");

    Expr difference = new Expr.Binary(Expr.Constant.of(10), loc, "-", sum);
    assertThat(PrintVisitor.print(difference)).isEqualTo("10 - (1 + 2)");

    Expr square = new Expr.Binary(Expr.Ident.of("x"), loc, "^", Expr.Constant.of(2));
    Expr power = new Expr.Binary(square, loc, "^", Expr.Constant.of(3));
    assertThat(PrintVisitor.print(power)).isEqualTo("(x ^ 2) ^ 3");
  }
}
