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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.stockflow.datamodel.Datamodel;

/**
 * A running simulation of a compiled model. All state is a flat array of doubles, with the time at
 * offset 0 and each instance's variables at the offsets chosen by its {@link Instance}.
 *
 * <p>The current state always has its flows computed: {@link #reset} runs the initial phase and
 * then the flow phase, and each {@link #step} integrates the stocks into the next state and then
 * computes its flows. A copy of the current state is saved before every {@code saveEvery}th step.
 *
 * <p>Simulations are not thread-safe; {@link Sim} confines one to a single thread.
 */
public final class Simulation {

  private static final Logger logger = LogManager.getLogger();

  /** The most slots {@link #reset} preallocates for saved states; {@link #save} grows past it. */
  private static final int MAX_PREALLOCATED = 1 << 20;

  private final Instance root;
  private final Datamodel.SimSpec simSpec;
  private final double dt;
  private final int saveEvery;
  private final int nVars;

  private double[] curr;
  private double[] next;

  /** Saved states, {@code nVars} per row. */
  private double[] saved;

  private int numSaved;
  private int stepNum;

  /**
   * Creates a Simulation of the given root class and resets it.
   *
   * @throws org.stockflow.compiler.CompileError if some reference can't be resolved
   */
  public Simulation(ModelClass rootClass, Datamodel.SimSpec simSpec) {
    this.root = Instance.root(rootClass);
    this.simSpec = simSpec;
    this.dt = simSpec.effectiveDt();
    this.saveEvery = Math.max(1, (int) (simSpec.effectiveSaveStep() / dt + 0.5));
    this.nVars = root.size();
    reset();
  }

  public Datamodel.SimSpec simSpec() {
    return simSpec;
  }

  public double dt() {
    return dt;
  }

  /** The number of steps between saved states. */
  public int saveEvery() {
    return saveEvery;
  }

  public Instance root() {
    return root;
  }

  /** Discards all results and recomputes the initial state. */
  public void reset() {
    curr = new double[nVars];
    next = new double[nVars];
    double expectedRows = (simSpec.stop - simSpec.start) / (dt * saveEvery) + 2;
    double expectedSlots = Math.max(1, expectedRows) * nVars;
    saved = new double[(int) Math.max(nVars, Math.min(expectedSlots, MAX_PREALLOCATED))];
    numSaved = 0;
    stepNum = 0;
    curr[0] = simSpec.start;
    root.calcInitials(curr, dt);
    root.calcFlows(curr, dt);
  }

  /** The current time. */
  public double time() {
    return curr[0];
  }

  /** Advances the simulation by one time step. */
  public void step() {
    if (stepNum++ % saveEvery == 0) {
      save();
    }
    root.calcStocks(curr, next, dt);
    next[0] = curr[0] + dt;
    root.calcFlows(next, dt);
    double[] tmp = curr;
    curr = next;
    next = tmp;
  }

  private void save() {
    int start = numSaved * nVars;
    if (start + nVars > saved.length) {
      saved = Arrays.copyOf(saved, Math.max(Ints.saturatedCast(saved.length * 2L), start + nVars));
    }
    System.arraycopy(curr, 0, saved, start, nVars);
    numSaved++;
  }

  /** Steps until the current time is after {@code endTime}; returns the new current time. */
  public double runTo(double endTime) {
    while (curr[0] <= endTime) {
      step();
    }
    return curr[0];
  }

  /** Runs to the end of the simulation, saving the state at the stop time. */
  public double runToEnd() {
    return runTo(simSpec.stop + 0.5 * dt);
  }

  /**
   * Sets the current value of a variable and recomputes the flows; does nothing (other than log a
   * warning) if there is no such variable.
   */
  public void setValue(String name, double value) {
    int offset = root.offsetOf(name);
    if (offset < 0) {
      logger.warn("setValue: unknown variable {}", name);
      return;
    }
    curr[offset] = value;
    root.calcFlows(curr, dt);
  }

  /** Returns the current value of a variable, or NaN if there is no such variable. */
  public double value(String name) {
    int offset = root.offsetOf(name);
    return (offset < 0) ? Double.NaN : curr[offset];
  }

  /** Returns the saved values of a variable, or null if there is no such variable. */
  public @Nullable Series series(String name) {
    int offset = root.offsetOf(name);
    if (offset < 0) {
      return null;
    }
    ImmutableDoubleArray.Builder time = ImmutableDoubleArray.builder(numSaved);
    ImmutableDoubleArray.Builder values = ImmutableDoubleArray.builder(numSaved);
    for (int i = 0; i < numSaved; i++) {
      time.add(saved[i * nVars]);
      values.add(saved[i * nVars + offset]);
    }
    return new Series(name, time.build(), values.build());
  }

  /**
   * Returns the names of all variables: the root's locals, then each module's variables prefixed
   * by the module name, then {@code time}.
   */
  public ImmutableList<String> varNames(boolean includeHidden) {
    List<String> result = new ArrayList<>(root.varNames(includeHidden));
    result.add("time");
    return ImmutableList.copyOf(result);
  }

  /**
   * Computes one step from a copy of the current state with the given values overridden, and
   * returns the resulting values of the indicators. The simulation itself is unchanged. Returns an
   * empty map if any override names an unknown variable; unknown indicators are omitted.
   */
  public ImmutableMap<String, Double> dominance(
      Map<String, Double> overrides, List<String> indicators) {
    double[] state = curr.clone();
    double[] result = new double[nVars];
    for (Map.Entry<String, Double> entry : overrides.entrySet()) {
      int offset = root.offsetOf(entry.getKey());
      if (offset < 0) {
        logger.warn("dominance: unknown variable {}", entry.getKey());
        return ImmutableMap.of();
      }
      state[offset] = entry.getValue();
    }
    root.calcFlows(state, dt);
    root.calcStocks(state, result, dt);
    result[0] = state[0] + dt;
    root.calcFlows(result, dt);
    Map<String, Double> values = new LinkedHashMap<>();
    for (String name : indicators) {
      int offset = root.offsetOf(name);
      if (offset < 0) {
        logger.warn("dominance: unknown variable {}", name);
        continue;
      }
      values.put(name, result[offset]);
    }
    return ImmutableMap.copyOf(values);
  }

  /** Returns the saved results of every (non-hidden) variable, one column per variable. */
  public String csv(String delim) {
    List<Series> series = new ArrayList<>();
    for (String name : varNames(false)) {
      series.add(series(name));
    }
    return Csv.format(series, delim);
  }
}
