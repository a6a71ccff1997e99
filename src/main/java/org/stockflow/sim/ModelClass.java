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
import com.google.common.collect.ImmutableSet;
import org.stockflow.code.StepFunction;
import org.stockflow.code.StepFunctions;
import org.stockflow.model.Model;

/**
 * One compiled monomorphization of a model: the layout of its locals, the references it needs
 * resolved, its child modules, and its step functions. Each module instance in a simulation is an
 * {@link Instance} of some ModelClass.
 */
public final class ModelClass {

  /** A child module: the name of the module variable and the class it instantiates. */
  public static final class Child {
    public final String ident;
    public final ModelClass modelClass;

    /**
     * The module's bound inputs: the input's name within the child, and the identifier it is bound
     * to (relative to this class's model, or to the root if it starts with "{@code .}").
     */
    public final ImmutableMap<String, String> bindings;

    Child(String ident, ModelClass modelClass, ImmutableMap<String, String> bindings) {
      this.ident = ident;
      this.modelClass = modelClass;
      this.bindings = bindings;
    }
  }

  /** The (unique) class name, e.g. {@code Smth1_0}. */
  public final String name;

  public final Model model;

  /** The names of the inputs bound by every instance of this class. */
  public final ImmutableSet<String> inputs;

  /** The offset of each local relative to the instance's base, in declaration order. */
  public final ImmutableMap<String, Integer> offsets;

  /** The number of slots used by this class's own locals (including time, for the root). */
  public final int numLocals;

  /**
   * The names resolved by each instance into absolute offsets, in the order generated code indexes
   * them: the inputs first (sorted), then any dotted paths the equations use.
   */
  public final ImmutableList<String> refNames;

  public final ImmutableList<Child> children;

  public final StepFunction initials;
  public final StepFunction flows;
  public final StepFunction stocks;

  /** The runnable form of the step functions. */
  public final StepFunctions fns;

  private final int size;

  ModelClass(
      String name,
      Model model,
      ImmutableSet<String> inputs,
      ImmutableMap<String, Integer> offsets,
      int numLocals,
      ImmutableList<String> refNames,
      ImmutableList<Child> children,
      StepFunction initials,
      StepFunction flows,
      StepFunction stocks,
      StepFunctions fns) {
    this.name = name;
    this.model = model;
    this.inputs = inputs;
    this.offsets = offsets;
    this.numLocals = numLocals;
    this.refNames = refNames;
    this.children = children;
    this.initials = initials;
    this.flows = flows;
    this.stocks = stocks;
    this.fns = fns;
    this.size = numLocals + children.stream().mapToInt(c -> c.modelClass.size()).sum();
  }

  /** The number of slots an instance of this class uses, including those of its children. */
  public int size() {
    return size;
  }

  /** Returns a readable listing of this class's layout and step functions. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("class ").append(name).append(" (").append(model.ident).append(")\n");
    sb.append("  locals: ").append(offsets).append('\n');
    if (!refNames.isEmpty()) {
      sb.append("  refs: ").append(refNames).append('\n');
    }
    for (Child child : children) {
      sb.append("  module ")
          .append(child.ident)
          .append(": ")
          .append(child.modelClass.name)
          .append(' ')
          .append(child.bindings)
          .append('\n');
    }
    sb.append(initials).append(flows).append(stocks);
    return sb.toString();
  }

  @Override
  public String toString() {
    return name;
  }
}
