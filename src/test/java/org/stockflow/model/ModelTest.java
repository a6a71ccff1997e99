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

package org.stockflow.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Variable.Builder;

@RunWith(JUnit4.class)
public class ModelTest {

  private static final Datamodel.Model POPULATION =
      new Datamodel.Model(
          "main",
          Datamodel.Variable.stock("Population", "100", "Births"),
          Datamodel.Variable.flow("Births", "Population * \"Birth Rate\""),
          Datamodel.Variable.aux("Birth Rate", "0.1"));

  @Test
  public void build() {
    Model model = Model.build(POPULATION);
    assertThat(model.ident).isEqualTo("main");
    assertThat(model.vars.keySet()).containsExactly("population", "births", "birth_rate").inOrder();
    Variable population = model.variable("population");
    assertThat(population).isInstanceOf(Variable.Stock.class);
    assertThat(((Variable.Stock) population).inflows).containsExactly("births");
    assertThat(population.isConst()).isTrue();
    Variable births = model.variable("births");
    assertThat(births.kind()).isEqualTo(Variable.Kind.ORDINARY);
    assertThat(births.deps).containsExactly("population", "birth_rate");
    assertThat(births.isConst()).isFalse();
    assertThat(model.isSimulatable()).isTrue();
    assertThat(model.modules).isEmpty();
  }

  @Test
  public void duplicateVariable() {
    Datamodel.Model decl =
        new Datamodel.Model(
            "main", Datamodel.Variable.aux("x", "1"), Datamodel.Variable.aux("X", "2"));
    CompileError e = assertThrows(CompileError.class, () -> Model.build(decl));
    assertThat(e.msg).isEqualTo("Variable 'x' already exists");
    assertThat(e.model).isEqualTo("main");
    assertThat(e.variable).isEqualTo("x");
  }

  @Test
  public void syntaxErrorsAreKeptPerVariable() {
    Datamodel.Model decl =
        new Datamodel.Model(
            "main",
            Datamodel.Variable.aux("good", "1"),
            Datamodel.Variable.aux("bad", "(1 +"),
            Datamodel.Variable.builder(Datamodel.Kind.AUX, "missing").build());
    Model model = Model.build(decl);
    assertThat(model.isSimulatable()).isFalse();
    assertThat(model.errors().keySet()).containsExactly("bad", "missing");
    assertThat(model.errors().get("missing")).containsExactly("Missing equation");
    assertThat(model.variable("bad").ast).isNull();
  }

  @Test
  public void stdlibCallsAreDesugared() {
    Datamodel.Model decl =
        new Datamodel.Model(
            "main",
            Datamodel.Variable.aux("x", "time"),
            Datamodel.Variable.aux("smoothed", "smth1(x, 2 + 1)"));
    Model model = Model.build(decl);
    assertThat(model.vars.keySet())
        .containsExactly("x", "smoothed", "$·smoothed·0·arg1", "$·smoothed·0·smth1")
        .inOrder();
    assertThat(model.variable("smoothed").deps).containsExactly("$·smoothed·0·smth1.output");
    Variable.Module module = model.modules.get("$·smoothed·0·smth1");
    assertThat(module.modelName).isEqualTo("stdlib·smth1");
    assertThat(module.refs.keySet()).containsExactly("input", "delay_time");
    assertThat(module.refs.get("input").ptr).isEqualTo("x");
    assertThat(module.deps).containsExactly("x", "$·smoothed·0·arg1");
    assertThat(model.variable("$·smoothed·0·arg1").isConst()).isFalse();
  }

  @Test
  public void tables() {
    Datamodel.GraphicalFunction gf =
        new Datamodel.GraphicalFunction(
            null, ImmutableList.of(0.0, 5.0, 20.0), new Datamodel.Scale(0, 10));
    Builder builder = Datamodel.Variable.builder(Datamodel.Kind.AUX, "effect").equation("time");
    Model model = Model.build(new Datamodel.Model("main", builder.gf(gf).build()));
    Variable.Table table = model.tables.get("effect");
    assertThat(table.x).containsExactly(0.0, 5.0, 10.0).inOrder();
    assertThat(table.y).containsExactly(0.0, 5.0, 20.0).inOrder();
  }

  @Test
  public void setEquation() {
    Model model = Model.build(POPULATION).setEquation("birth_rate", "0.2 * 2");
    assertThat(model.variable("birth_rate").isConst()).isFalse();
    assertThat(model.decl.variable("birth_rate").equation).isEqualTo("0.2 * 2");
  }

  @Test
  public void rename() {
    Model model = Model.build(POPULATION).rename("Births", "New Births");
    assertThat(model.vars.keySet()).containsExactly("population", "new_births", "birth_rate");
    assertThat(((Variable.Stock) model.variable("population")).inflows)
        .containsExactly("new_births");
    assertThat(model.variable("new_births").deps).containsExactly("population", "birth_rate");

    Model renamed = model.rename("Birth Rate", "fertility");
    assertThat(renamed.decl.variable("new_births").equation).isEqualTo("population * fertility");
  }

  @Test
  public void addAndDeleteVariables() {
    Model model = Model.build(POPULATION).addNewVariable(Datamodel.Kind.FLOW, "Deaths");
    assertThat(model.vars).containsKey("deaths");
    assertThat(model.variable("deaths").hasErrors()).isTrue();
    assertThrows(
        IllegalArgumentException.class,
        () -> model.addNewVariable(Datamodel.Kind.MODULE, "m"));

    Model fewer = model.deleteVariables(ImmutableList.of("deaths", "birth_rate"));
    assertThat(fewer.vars.keySet()).containsExactly("population", "births");
  }

  @Test
  public void stocksFlows() {
    Model model =
        Model.build(POPULATION)
            .addNewVariable(Datamodel.Kind.FLOW, "deaths")
            .addStocksFlow("population", "deaths", Model.FlowDirection.OUT);
    Variable.Stock stock = (Variable.Stock) model.variable("population");
    assertThat(stock.outflows).containsExactly("deaths");
    stock =
        (Variable.Stock)
            model
                .removeStocksFlow("population", "births", Model.FlowDirection.IN)
                .variable("population");
    assertThat(stock.inflows).isEmpty();
    assertThat(stock.outflows).containsExactly("deaths");
  }

  @Test
  public void simSpecOverride() {
    Datamodel.SimSpec spec = Datamodel.SimSpec.builder().stop(50).build();
    Model model = Model.build(POPULATION).setSimSpec(spec);
    assertThat(model.simSpec()).isEqualTo(spec);
    assertThat(model.setSimSpec(null).simSpec()).isNull();
  }
}
