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

import java.io.IOException;
import java.nio.file.Path;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.ProjectJson;
import org.stockflow.model.Project;
import org.stockflow.sim.SimBuilder;
import org.stockflow.sim.SimOptions;
import org.stockflow.sim.Simulation;

/**
 * A simple command-line tool for running a single project to its stop time and printing the
 * results as CSV. Each {@code <var>=<val>} argument sets that variable in the initial state.
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run <project.json> [ <var>=<val> ...]");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    SimOptions options = SimOptions.fromSystemProperties();
    checkUsage(args.length != 0);
    String[] argNames = new String[args.length - 1];
    double[] argValues = new double[args.length - 1];
    for (int i = 1; i < args.length; i++) {
      int eq = args[i].indexOf('=');
      checkUsage(eq > 0);
      argNames[i - 1] = args[i].substring(0, eq).trim();
      try {
        argValues[i - 1] = Double.parseDouble(args[i].substring(eq + 1).trim());
      } catch (NumberFormatException e) {
        checkUsage(false);
      }
    }
    Datamodel.Project datamodel = ProjectJson.read(Path.of(args[0]));
    Simulation sim;
    try {
      sim = SimBuilder.build(Project.build(datamodel), options.backend);
    } catch (CompileError e) {
      System.err.println("Compile error: " + e.getMessage());
      System.exit(2);
      return;
    }
    for (int i = 0; i < argNames.length; i++) {
      sim.setValue(argNames[i], argValues[i]);
    }
    sim.runToEnd();
    System.out.print(sim.csv(options.delim));
  }
}
