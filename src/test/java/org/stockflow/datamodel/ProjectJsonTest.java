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

package org.stockflow.datamodel;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableList;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.stockflow.datamodel.Datamodel.Connection;
import org.stockflow.datamodel.Datamodel.Variable;

@RunWith(JUnitParamsRunner.class)
public class ProjectJsonTest {

  private static final String GROWTH =
      "{\"name\": \"growth\",\n"
          + " \"simSpec\": {\"start\": 0, \"stop\": 10, \"dt\": 0.5, \"method\": \"Euler\"},\n"
          + " \"models\": [\n"
          + "   {\"name\": \"main\",\n"
          + "    \"variables\": [\n"
          + "      {\"kind\": \"stock\", \"name\": \"population\", \"equation\": \"100\",\n"
          + "       \"inflows\": [\"births\"]},\n"
          + "      {\"kind\": \"flow\", \"name\": \"births\","
          + " \"equation\": \"population * birth_rate\"},\n"
          + "      {\"name\": \"birth rate\", \"equation\": \"0.1\", \"units\": \"1/year\"}]}]}";

  @Test
  public void parse() throws Exception {
    Datamodel.Project project = ProjectJson.parse(GROWTH);
    assertThat(project.name).isEqualTo("growth");
    assertThat(project.simSpec)
        .isEqualTo(Datamodel.SimSpec.builder().stop(10).dt(0.5).method("euler").build());
    Datamodel.Model main = project.models.get(0);
    assertThat(main.name).isEqualTo("main");
    assertThat(main.simSpec).isNull();
    assertThat(main.variables)
        .containsExactly(
            Variable.stock("population", "100", "births"),
            Variable.flow("births", "population * birth_rate"),
            Variable.aux("birth rate", "0.1").toBuilder().units("1/year").build())
        .inOrder();
  }

  @Test
  public void roundTrip() throws Exception {
    Datamodel.Project project =
        new Datamodel.Project(
            "everything",
            Datamodel.SimSpec.builder().dt(4).dtIsReciprocal(true).saveStep(1).build(),
            new Datamodel.Model(
                "main",
                Variable.builder(Datamodel.Kind.STOCK, "s")
                    .equation("1")
                    .inflows("in")
                    .outflows("out")
                    .build(),
                Variable.builder(Datamodel.Kind.AUX, "table")
                    .equation("time")
                    .gf(
                        new Datamodel.GraphicalFunction(
                            null, ImmutableList.of(1.0, 2.0), new Datamodel.Scale(0, 5)))
                    .build(),
                Variable.module("m", "sub", new Connection("s", "input"))),
            new Datamodel.Model("sub", Variable.aux("input", "0"))
                .withSimSpec(Datamodel.SimSpec.builder().timeUnits("days").build()));
    String json = ProjectJson.toJson(project);
    assertThat(json).contains("\"dtIsReciprocal\" : true");
    assertThat(ProjectJson.parse(json)).isEqualTo(project);
  }

  private static Object[] invalidProjects() {
    return new Object[] {
      new Object[] {"[]", "expected a project object"},
      new Object[] {"{\"models\": 3}", "models should be an array"},
      new Object[] {
        "{\"models\": [{\"variables\": [{\"equation\": \"1\"}]}]}", "variable has no name"
      },
      new Object[] {
        "{\"models\": [{\"variables\": [{\"kind\": \"cloud\", \"name\": \"x\"}]}]}",
        "invalid variable x"
      },
      new Object[] {
        "{\"models\": [{\"variables\": [{\"name\": \"t\", \"gf\": {\"xPoints\": [1, 2],"
            + " \"yPoints\": [1]}}]}]}",
        "invalid variable t: 2 x points but 1 y points"
      },
      new Object[] {"{\"simSpec\": {\"stop\": \"ten\"}}", "stop should be a number"},
    };
  }

  @Test
  @Parameters(method = "invalidProjects")
  public void invalid(String json, String message) {
    JsonProcessingException e =
        assertThrows(JsonProcessingException.class, () -> ProjectJson.parse(json));
    assertThat(e).hasMessageThat().contains(message);
  }

  @Test
  public void notJson() {
    assertThrows(JsonProcessingException.class, () -> ProjectJson.parse("{\"name\": "));
  }
}
