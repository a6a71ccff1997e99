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

package org.stockflow.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Variable;
import org.stockflow.datamodel.ProjectJson;

@RunWith(JUnit4.class)
public class RunTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private PrintStream savedOut;

  @Before
  public void captureOutput() {
    savedOut = System.out;
    System.setOut(new PrintStream(out, true, UTF_8));
  }

  @After
  public void restoreOutput() {
    System.setOut(savedOut);
  }

  private String writeProject() throws Exception {
    Datamodel.Project project =
        new Datamodel.Project(
            "growth",
            Datamodel.SimSpec.builder().stop(2).build(),
            new Datamodel.Model(
                "main", Variable.stock("s", "100", "f"), Variable.flow("f", "s / 10")));
    File file = tmp.newFile("growth.json");
    Files.writeString(file.toPath(), ProjectJson.toJson(project));
    return file.getPath();
  }

  @Test
  public void printsCsv() throws Exception {
    Run.main(new String[] {writeProject()});
    assertThat(out.toString(UTF_8)).isEqualTo("time,s,f\n0,100,10\n1,110,11\n2,121,12.1\n");
  }

  @Test
  public void setsInitialValues() throws Exception {
    Run.main(new String[] {writeProject(), "s = 200"});
    assertThat(out.toString(UTF_8)).startsWith("time,s,f\n0,200,20\n1,220,22\n");
  }
}
