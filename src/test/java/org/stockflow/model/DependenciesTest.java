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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Connection;
import org.stockflow.datamodel.Datamodel.Variable;

@RunWith(JUnit4.class)
public class DependenciesTest {

  /** main has a stock fed by a flow, and an instance of "sub" whose output it reads. */
  private static final Project PROJECT =
      Project.build(
          new Datamodel.Project(
              "test",
              Datamodel.SimSpec.DEFAULT,
              new Datamodel.Model(
                  "main",
                  Variable.stock("s", "f * 2", "f"),
                  Variable.flow("f", "g + 1"),
                  Variable.aux("g", "time + dt"),
                  Variable.aux("reads_stock", "m.level + s"),
                  Variable.aux("reads_aux", "m.rate"),
                  Variable.module("m", "sub", new Connection("g", "input"))),
              new Datamodel.Model(
                  "sub",
                  Variable.aux("input", "0"),
                  Variable.stock("level", "input", "rate"),
                  Variable.flow("rate", "input - level"))));

  private static Model main() {
    return PROJECT.model("main");
  }

  private static Dependencies deps(boolean isInitials) {
    return new Dependencies(new Context(PROJECT, main(), isInitials));
  }

  @Test
  public void initialDependencies() {
    Dependencies deps = deps(true);
    assertThat(deps.direct(main().variable("s"))).containsExactly("f");
    assertThat(deps.direct(main().variable("f"))).containsExactly("g");
    // time and dt aren't variables
    assertThat(deps.direct(main().variable("g"))).isEmpty();
    assertThat(deps.transitive(main().variable("s"))).containsExactly("f", "g").inOrder();
    // A module depends on the sources of its connections.
    assertThat(deps.direct(main().variable("m"))).containsExactly("g");
    assertThat(deps.direct(main().variable("reads_stock"))).containsExactly("m", "s");
  }

  @Test
  public void flowDependencies() {
    Dependencies deps = deps(false);
    // Stocks are known before any flows are computed.
    assertThat(deps.direct(main().variable("s"))).isEmpty();
    assertThat(deps.direct(main().variable("reads_stock"))).isEmpty();
    assertThat(deps.direct(main().variable("reads_aux"))).containsExactly("m");
    assertThat(deps.transitive(main().variable("reads_aux"))).containsExactly("m", "g");
  }

  @Test
  public void contextLookup() {
    Context ctx = new Context(PROJECT, main(), false);
    assertThat(ctx.isRoot()).isTrue();
    assertThat(ctx.lookup("s")).isInstanceOf(org.stockflow.model.Variable.Stock.class);
    assertThat(ctx.lookup("m.level")).isInstanceOf(org.stockflow.model.Variable.Stock.class);
    assertThat(ctx.lookup("m.rate").ident).isEqualTo("rate");
    assertThat(ctx.lookup(".g").ident).isEqualTo("g");
    assertThat(ctx.lookup("m.nope")).isNull();
    assertThat(ctx.lookup("nope.x")).isNull();

    Context inner = ctx.push(PROJECT.model("sub"));
    assertThat(inner.isRoot()).isFalse();
    assertThat(inner.parent().ident).isEqualTo("sub");
    assertThat(inner.lookup("level").ident).isEqualTo("level");
    assertThat(inner.lookup(".f").ident).isEqualTo("f");
  }
}
