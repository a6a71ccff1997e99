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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Connection;
import org.stockflow.datamodel.Datamodel.Variable;

@RunWith(JUnit4.class)
public class ProjectTest {

  private static final Datamodel.Model SUB =
      new Datamodel.Model("sub", Variable.aux("input", "0"), Variable.aux("out", "input * 2"));

  private static Project project(Datamodel.Model... models) {
    return Project.build(new Datamodel.Project("test", Datamodel.SimSpec.DEFAULT, models));
  }

  @Test
  public void stdlibIsAlwaysAvailable() {
    Project project = project(new Datamodel.Model("main", Variable.aux("x", "1")));
    assertThat(project.model("stdlib·smth1")).isNotNull();
    assertThat(project.model("smth3").ident).isEqualTo("stdlib·smth3");
    assertThat(project.model(null).ident).isEqualTo("main");
    assertThat(project.model("")).isSameInstanceAs(project.model("main"));
    assertThat(project.model("nope")).isNull();
    assertThat(project.isSimulatable(null)).isTrue();
  }

  @Test
  public void duplicateModel() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> project(new Datamodel.Model("main"), new Datamodel.Model("Main")));
    assertThat(e.msg).isEqualTo("duplicate model name main");
  }

  @Test
  public void editsReturnNewProjects() {
    Project project = project(new Datamodel.Model("main", Variable.aux("x", "1")));
    Project edited = project.setEquation("main", "x", "2");
    assertThat(edited).isNotSameInstanceAs(project);
    assertThat(edited.model("main").decl.variable("x").equation).isEqualTo("2");
    assertThat(project.model("main").decl.variable("x").equation).isEqualTo("1");

    // Edits to unknown (or standard library) models are ignored.
    assertThat(project.setEquation("nope", "x", "3")).isSameInstanceAs(project);
    assertThat(project.setEquation("smth1", "input", "3")).isSameInstanceAs(project);

    assertThat(edited.toDatamodel().models.get(0).variables.get(0).equation).isEqualTo("2");
  }

  @Test
  public void simSpecFor() {
    Datamodel.SimSpec override = Datamodel.SimSpec.builder().stop(7).build();
    Project project =
        project(
            new Datamodel.Model("main", Variable.aux("x", "1")),
            SUB.withSimSpec(override));
    assertThat(project.simSpecFor(project.model("main"))).isEqualTo(Datamodel.SimSpec.DEFAULT);
    assertThat(project.simSpecFor(project.model("sub"))).isEqualTo(override);
    Datamodel.SimSpec replaced = Datamodel.SimSpec.builder().dt(0.5).build();
    assertThat(project.setSimSpec(replaced).simSpec).isEqualTo(replaced);
  }

  @Test
  public void monomorphizations() {
    Project project =
        project(
            new Datamodel.Model(
                "main",
                Variable.aux("a", "1"),
                Variable.aux("b", "2"),
                Variable.module("m1", "sub", new Connection("a", "input")),
                Variable.module("m2", "sub", new Connection("b", "input")),
                Variable.module("m3", "sub")),
            SUB);
    ImmutableMap<String, ModelDef> defs = ModelDef.referencedModels(project, project.main());
    assertThat(defs.keySet()).containsExactly("main", "sub").inOrder();
    ModelDef sub = defs.get("sub");
    assertThat(sub.instances()).hasSize(3);
    // m1 and m2 bind the same inputs, so they share an implementation.
    assertThat(sub.monomorphizations())
        .containsExactly(ImmutableSet.of("input"), "Sub_0", ImmutableSet.of(), "Sub_1")
        .inOrder();
    assertThat(defs.get("main").monomorphizations()).containsExactly(ImmutableSet.of(), "Main_0");
  }

  @Test
  public void unknownModel() {
    Project project =
        project(new Datamodel.Model("main", Variable.module("m", "missing")));
    CompileError e =
        assertThrows(
            CompileError.class, () -> ModelDef.referencedModels(project, project.main()));
    assertThat(e.msg).isEqualTo("unknown model missing");
  }

  @Test
  public void recursiveModel() {
    Project project =
        project(
            new Datamodel.Model("main", Variable.module("a", "loop")),
            new Datamodel.Model("loop", Variable.module("again", "loop")));
    CompileError e =
        assertThrows(
            CompileError.class, () -> ModelDef.referencedModels(project, project.main()));
    assertThat(e.msg).isEqualTo("model loop contains itself (main > loop)");
  }
}
