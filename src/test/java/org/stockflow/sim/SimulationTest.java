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

package org.stockflow.sim;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.stockflow.code.Backend;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Connection;
import org.stockflow.datamodel.Datamodel.Variable;
import org.stockflow.model.Project;

/** Runs small models end to end, with each backend. */
@RunWith(TestParameterInjector.class)
public class SimulationTest {

  @TestParameter Backend backend;

  private Simulation simulate(Datamodel.SimSpec simSpec, Datamodel.Model... models) {
    return SimBuilder.build(
        Project.build(new Datamodel.Project("test", simSpec, models)), backend);
  }

  private static Datamodel.SimSpec stopAt(double stop) {
    return Datamodel.SimSpec.builder().stop(stop).build();
  }

  private Simulation growth() {
    return simulate(
        stopAt(2),
        new Datamodel.Model(
            "main", Variable.stock("s", "100", "f"), Variable.flow("f", "s / 10")));
  }

  private static double[] values(Series series) {
    return series.values.toArray();
  }

  /** Runs {@code y = equation} where {@code x} steps from {@code lo} to {@code hi} at time 1. */
  private double[] stepResponse(String equation, double lo, double hi, double stop) {
    Simulation sim =
        simulate(
            stopAt(stop),
            new Datamodel.Model(
                "main",
                Variable.aux("x", "if time < 1 then " + lo + " else " + hi),
                Variable.aux("y", equation)));
    sim.runToEnd();
    return values(sim.series("y"));
  }

  @Test
  public void constantInflow() {
    Simulation sim =
        simulate(
            stopAt(2),
            new Datamodel.Model(
                "main", Variable.stock("s", "100", "f"), Variable.flow("f", "10")));
    assertThat(sim.time()).isEqualTo(0.0);
    assertThat(sim.runToEnd()).isEqualTo(3.0);
    assertThat(values(sim.series("s"))).isEqualTo(new double[] {100, 110, 120});
    assertThat(sim.series("time").values.toArray()).isEqualTo(new double[] {0, 1, 2});
    assertThat(sim.csv(",")).isEqualTo("time,s,f\n0,100,10\n1,110,10\n2,120,10\n");
    assertThat(sim.csv("\t")).startsWith("time\ts\tf\n0\t100\t10\n");
  }

  @Test
  public void flowsFollowStocks() {
    Simulation sim = growth();
    assertThat(sim.value("f")).isEqualTo(10.0);
    sim.runToEnd();
    assertThat(values(sim.series("s"))).usingTolerance(1e-9).containsExactly(100, 110, 121);
    assertThat(values(sim.series("f"))).usingTolerance(1e-9).containsExactly(10, 11, 12.1);
  }

  @Test
  public void runTo() {
    Simulation sim = growth();
    assertThat(sim.runTo(0.5)).isEqualTo(1.0);
    assertThat(sim.value("s")).isEqualTo(110.0);
    assertThat(sim.series("s").size()).isEqualTo(1);
    sim.reset();
    assertThat(sim.time()).isEqualTo(0.0);
    assertThat(sim.value("s")).isEqualTo(100.0);
    assertThat(sim.series("s").size()).isEqualTo(0);
  }

  @Test
  public void setValue() {
    Simulation sim = growth();
    sim.setValue("s", 200);
    assertThat(sim.value("f")).isEqualTo(20.0);
    sim.setValue("nope", 1);
    assertThat(sim.value("nope")).isNaN();
    assertThat(sim.series("nope")).isNull();
  }

  @Test
  public void dominance() {
    Simulation sim = growth();
    ImmutableMap<String, Double> result =
        sim.dominance(ImmutableMap.of("s", 200.0), ImmutableList.of("s", "f", "nope"));
    assertThat(result).containsExactly("s", 220.0, "f", 22.0).inOrder();
    // The simulation itself is unchanged.
    assertThat(sim.value("s")).isEqualTo(100.0);
    assertThat(sim.value("f")).isEqualTo(10.0);
    assertThat(sim.dominance(ImmutableMap.of("nope", 1.0), ImmutableList.of("s"))).isEmpty();
  }

  @Test
  public void saveStep() {
    Simulation sim =
        simulate(
            Datamodel.SimSpec.builder().stop(2).dt(0.5).saveStep(1).build(),
            new Datamodel.Model(
                "main", Variable.stock("s", "0", "f"), Variable.flow("f", "1")));
    assertThat(sim.saveEvery()).isEqualTo(2);
    sim.runToEnd();
    assertThat(sim.series("s").time.toArray()).isEqualTo(new double[] {0, 1, 2});
    assertThat(values(sim.series("s"))).isEqualTo(new double[] {0, 1, 2});
  }

  @Test
  public void reciprocalDt() {
    Simulation sim =
        simulate(
            Datamodel.SimSpec.builder().stop(1).dt(4).dtIsReciprocal(true).build(),
            new Datamodel.Model("main", Variable.aux("x", "dt")));
    assertThat(sim.dt()).isEqualTo(0.25);
    assertThat(sim.saveEvery()).isEqualTo(1);
    assertThat(sim.value("x")).isEqualTo(0.25);
  }

  @Test
  public void smoothing() {
    Simulation sim =
        simulate(
            stopAt(3),
            new Datamodel.Model(
                "main",
                Variable.aux("x", "if time < 1 then 0 else 10"),
                Variable.aux("smoothed", "smth1(x, 2)")));
    sim.runToEnd();
    assertThat(values(sim.series("smoothed"))).isEqualTo(new double[] {0, 0, 5, 7.5});
    assertThat(sim.varNames(false)).containsExactly("x", "smoothed", "time").inOrder();
    assertThat(sim.varNames(true)).contains("$·smoothed·0·smth1.output");
  }

  @Test
  public void smoothingOverDt() {
    Simulation sim =
        simulate(
            stopAt(2),
            new Datamodel.Model(
                "main",
                Variable.aux("x", "if time < 1 then 0 else 10"),
                Variable.aux("y", "smth1(x, dt)")));
    sim.runToEnd();
    assertThat(values(sim.series("y"))).isEqualTo(new double[] {0, 0, 10});
    assertThat(sim.varNames(true)).contains("$·y·0·arg1");
  }

  @Test
  public void thirdOrderSmoothing() {
    assertThat(stepResponse("smth3(x, 6)", 0, 8, 5))
        .usingTolerance(1e-9)
        .containsExactly(0, 0, 0, 0, 1, 2.5)
        .inOrder();
  }

  @Test
  public void firstOrderDelay() {
    // The initial contents drain while the step flows in.
    assertThat(stepResponse("delay1(x, 2, 4)", 0, 8, 4))
        .usingTolerance(1e-9)
        .containsExactly(4, 2, 5, 6.5, 7.25)
        .inOrder();
  }

  @Test
  public void thirdOrderDelay() {
    assertThat(stepResponse("delay3(x, 6)", 0, 8, 5))
        .usingTolerance(1e-9)
        .containsExactly(0, 0, 0, 0, 1, 2.5)
        .inOrder();
  }

  @Test
  public void trend() {
    assertThat(stepResponse("trend(x, 2)", 4, 8, 3))
        .usingTolerance(1e-9)
        .containsExactly(0, 0.5, 1.0 / 6, 1.0 / 14)
        .inOrder();
  }

  @Test
  public void tables() {
    Simulation sim =
        simulate(
            stopAt(2),
            new Datamodel.Model(
                "main",
                Variable.builder(Datamodel.Kind.AUX, "effect")
                    .equation("time")
                    .gf(
                        Datamodel.GraphicalFunction.of(
                            ImmutableList.of(0.0, 1.0, 2.0), ImmutableList.of(0.0, 10.0, 5.0)))
                    .build(),
                Variable.aux("from_fn", "lookup(effect, time + 0.5)")));
    sim.runToEnd();
    assertThat(values(sim.series("effect"))).isEqualTo(new double[] {0, 10, 5});
    assertThat(values(sim.series("from_fn"))).isEqualTo(new double[] {5, 7.5, 5});
  }

  @Test
  public void modules() {
    Simulation sim =
        simulate(
            stopAt(1),
            new Datamodel.Model(
                "main",
                Variable.aux("a", "1"),
                Variable.aux("b", "2"),
                Variable.module("m1", "sub", new Connection("a", "input")),
                Variable.module("m2", "sub", new Connection("b", "input")),
                Variable.module("m3", "sub"),
                Variable.aux("total", "m1.out + m2.out + m3.out")),
            new Datamodel.Model(
                "sub", Variable.aux("input", "0"), Variable.aux("out", "input * 2")));
    assertThat(sim.value("m1.out")).isEqualTo(2.0);
    assertThat(sim.value("m2.out")).isEqualTo(4.0);
    assertThat(sim.value("m3.out")).isEqualTo(0.0);
    assertThat(sim.value("total")).isEqualTo(6.0);
    // m1's input is a's slot
    assertThat(sim.root().offsetOf("m1.input")).isEqualTo(sim.root().offsetOf("a"));
    assertThat(sim.varNames(false))
        .containsExactly("a", "b", "total", "m1.out", "m2.out", "m3.input", "m3.out", "time")
        .inOrder();

    sim.setValue("b", 5);
    assertThat(sim.value("m2.out")).isEqualTo(10.0);
    assertThat(sim.value("total")).isEqualTo(12.0);
  }

  @Test
  public void rootRelativeBinding() {
    Simulation sim =
        simulate(
            stopAt(1),
            new Datamodel.Model(
                "main", Variable.aux("rate", "3"), Variable.module("outer", "middle")),
            new Datamodel.Model(
                "middle", Variable.module("inner", "sub", new Connection(".rate", "input"))),
            new Datamodel.Model(
                "sub", Variable.aux("input", "0"), Variable.aux("out", "input * 2")));
    assertThat(sim.value("outer.inner.out")).isEqualTo(6.0);
    assertThat(sim.root().offsetOf("outer.inner.input")).isEqualTo(sim.root().offsetOf("rate"));
  }

  @Test
  public void siblingBindingDeclaredFirst() {
    Simulation sim =
        simulate(
            stopAt(1),
            new Datamodel.Model(
                "main",
                Variable.aux("a", "7"),
                Variable.module("m2", "sub", new Connection("m1.input", "input")),
                Variable.module("m1", "sub", new Connection("a", "input"))),
            new Datamodel.Model(
                "sub", Variable.aux("input", "0"), Variable.aux("out", "input * 2")));
    assertThat(sim.value("m1.out")).isEqualTo(14.0);
    assertThat(sim.value("m2.out")).isEqualTo(14.0);
    assertThat(sim.root().offsetOf("m2.input")).isEqualTo(sim.root().offsetOf("a"));
  }

  @Test
  public void circularBinding() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () ->
                simulate(
                    stopAt(1),
                    new Datamodel.Model(
                        "main",
                        Variable.module("m1", "sub", new Connection("m2.input", "input")),
                        Variable.module("m2", "sub", new Connection("m1.input", "input"))),
                    new Datamodel.Model(
                        "sub", Variable.aux("input", "0"), Variable.aux("out", "input * 2"))));
    assertThat(e).hasMessageThat().contains("circular");
  }

  @Test
  public void longRunGrowsSavedStates() {
    Simulation sim =
        simulate(
            Datamodel.SimSpec.builder().stop(1e12).dt(0.5).build(),
            new Datamodel.Model(
                "main", Variable.stock("s", "0", "f"), Variable.flow("f", "1")));
    int steps = 400_000;
    for (int i = 0; i < steps; i++) {
      sim.step();
    }
    Series series = sim.series("s");
    assertThat(series.size()).isEqualTo(steps);
    assertThat(series.values.get(steps - 1)).isEqualTo(0.5 * (steps - 1));
  }
}
