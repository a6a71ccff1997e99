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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stockflow.datamodel.Datamodel;

@RunWith(JUnit4.class)
public class BuiltinDesugarerTest {

  private static Expr parse(String source) {
    return Parser.parse(source).expr;
  }

  @Test
  public void primitiveCallsAreUnchanged() {
    Expr expr = parse("max(a, 2) + abs(b) * safediv(c, d, 0)");
    BuiltinDesugarer desugarer = new BuiltinDesugarer("x");
    Expr result = desugarer.rewrite(expr);
    assertThat(desugarer.didRewrite()).isFalse();
    assertThat(result).isSameInstanceAs(expr);
    assertThat(desugarer.synthesized()).isEmpty();
  }

  @Test
  public void rewritingIsIdempotent() {
    BuiltinDesugarer first = new BuiltinDesugarer("x");
    Expr once = first.rewrite(parse("smth1(a + 1, 3) + lookup(tbl, time)"));
    assertThat(first.didRewrite()).isTrue();
    BuiltinDesugarer second = new BuiltinDesugarer("x");
    Expr twice = second.rewrite(once);
    assertThat(second.didRewrite()).isFalse();
    assertThat(twice).isEqualTo(once);
  }

  @Test
  public void lookupTableArgument() {
    BuiltinDesugarer desugarer = new BuiltinDesugarer("x");
    Expr.Call call = (Expr.Call) desugarer.rewrite(parse("lookup(Effect, time)"));
    assertThat(desugarer.didRewrite()).isTrue();
    assertThat(call.args.get(0)).isInstanceOf(Expr.Table.class);
    assertThat(((Expr.Table) call.args.get(0)).name).isEqualTo("effect");
    assertThat(call.args.get(1)).isEqualTo(Expr.Ident.of("time"));
  }

  @Test
  public void stdlibCallBecomesModule() {
    BuiltinDesugarer desugarer = new BuiltinDesugarer("smoothed");
    Expr result = desugarer.rewrite(parse("smth1(input_level, delay * 2)"));
    assertThat(result).isEqualTo(Expr.Ident.of("$·smoothed·0·smth1.output"));

    ImmutableList<Datamodel.Variable> synthesized = desugarer.synthesized();
    assertThat(synthesized).hasSize(2);
    Datamodel.Variable arg = synthesized.get(0);
    assertThat(arg.kind).isEqualTo(Datamodel.Kind.AUX);
    assertThat(arg.ident()).isEqualTo("$·smoothed·0·arg1");
    assertThat(arg.equation).isEqualTo("delay * 2");

    Datamodel.Variable module = synthesized.get(1);
    assertThat(module.kind).isEqualTo(Datamodel.Kind.MODULE);
    assertThat(module.ident()).isEqualTo("$·smoothed·0·smth1");
    assertThat(module.modelName).isEqualTo("stdlib·smth1");
    assertThat(module.connections)
        .containsExactly(
            new Datamodel.Connection("input_level", "input"),
            new Datamodel.Connection("$·smoothed·0·arg1", "delay_time"))
        .inOrder();
  }

  @Test
  public void dtArgumentGetsItsOwnAux() {
    BuiltinDesugarer desugarer = new BuiltinDesugarer("y");
    desugarer.rewrite(parse("smth1(x, dt)"));
    ImmutableList<Datamodel.Variable> synthesized = desugarer.synthesized();
    assertThat(synthesized.get(0).ident()).isEqualTo("$·y·0·arg1");
    assertThat(synthesized.get(0).equation).isEqualTo("dt");
    assertThat(synthesized.get(1).connections)
        .contains(new Datamodel.Connection("$·y·0·arg1", "delay_time"));

    // A declared dt is an ordinary variable.
    BuiltinDesugarer withDt = new BuiltinDesugarer("y", true);
    withDt.rewrite(parse("smth1(x, dt)"));
    assertThat(withDt.synthesized()).hasSize(1);
    assertThat(withDt.synthesized().get(0).connections)
        .contains(new Datamodel.Connection("dt", "delay_time"));
  }

  @Test
  public void eachCallGetsItsOwnModule() {
    BuiltinDesugarer desugarer = new BuiltinDesugarer("y");
    Expr result = desugarer.rewrite(parse("delay1(a, 1) + delay3(b, 2, 0)"));
    assertThat(IdentifierSetVisitor.identifiers(result))
        .containsExactly("$·y·0·delay1.output", "$·y·1·delay3.output");
    assertThat(
            desugarer.synthesized().stream()
                .map(Datamodel.Variable::ident)
                .collect(Collectors.toList()))
        .containsAtLeast("$·y·0·delay1", "$·y·1·delay3");
  }

  @Test
  public void unknownFunctionBecomesZero() {
    BuiltinDesugarer desugarer = new BuiltinDesugarer("x");
    Expr result = desugarer.rewrite(parse("1 + frobnicate(a)"));
    assertThat(result).isEqualTo(parse("1 + 0"));
    assertThat(desugarer.synthesized()).isEmpty();
  }

  @Test
  public void tooManyArguments() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> new BuiltinDesugarer("x").rewrite(parse("smth3(a, 1, 2, 3)")));
    assertThat(e).hasMessageThat().isEqualTo("smth3() takes at most 3 arguments, not 4");
  }

  @Test
  public void builtinArity() {
    Builtins.Builtin max = Builtins.primitive("max");
    max.checkArity(2);
    CompileError e = assertThrows(CompileError.class, () -> max.checkArity(3));
    assertThat(e).hasMessageThat().isEqualTo("max() takes 2 arguments, not 3");
    Builtins.Builtin safediv = Builtins.primitive("safediv");
    safediv.checkArity(3);
    e = assertThrows(CompileError.class, () -> safediv.checkArity(1));
    assertThat(e).hasMessageThat().isEqualTo("safediv() takes 2 to 3 arguments, not 1");
    assertThat(Builtins.primitive("smth1")).isNull();
  }
}
