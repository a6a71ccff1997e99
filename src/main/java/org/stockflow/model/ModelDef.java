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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.stockflow.compiler.Canonical;
import org.stockflow.compiler.CompileError;

/**
 * All the instances of one model within a simulation. Instances whose inputs are bound to the same
 * set of names share a generated implementation (a "monomorphization"), so a model may be
 * compiled several times.
 */
public final class ModelDef {
  public final Model model;
  private final List<Variable.Module> instances = new ArrayList<>();

  private ModelDef(Model model) {
    this.model = model;
  }

  /** The modules instantiating this model, in the order they were found. */
  public List<Variable.Module> instances() {
    return instances;
  }

  /**
   * Returns a unique name for each distinct set of bound input names among the instances, in the
   * order they were first found.
   */
  public ImmutableMap<ImmutableSet<String>, String> monomorphizations() {
    Map<ImmutableSet<String>, String> result = new LinkedHashMap<>();
    for (Variable.Module module : instances) {
      ImmutableSet<String> inputs = module.refs.keySet();
      if (!result.containsKey(inputs)) {
        result.put(inputs, Canonical.titleCase(model.ident + "_" + result.size()));
      }
    }
    return ImmutableMap.copyOf(result);
  }

  /**
   * Returns a ModelDef for each model instantiated by {@code root} or, recursively, by any of the
   * modules within it. Models are ordered by when they were first found, {@code root}'s first.
   *
   * @throws CompileError if a module's model doesn't exist, or a model (indirectly) contains
   *     itself
   */
  public static ImmutableMap<String, ModelDef> referencedModels(
      Project project, Variable.Module root) {
    Map<String, ModelDef> all = new LinkedHashMap<>();
    addReferencedModels(project, root, all, new ArrayList<>());
    return ImmutableMap.copyOf(all);
  }

  private static void addReferencedModels(
      Project project, Variable.Module module, Map<String, ModelDef> all, List<String> stack) {
    Model model = project.model(module.modelName);
    if (model == null) {
      throw new CompileError("unknown model " + module.modelName, null, module.ident);
    } else if (stack.contains(model.ident)) {
      throw new CompileError(
          "model " + model.ident + " contains itself (" + String.join(" > ", stack) + ")");
    }
    all.computeIfAbsent(model.ident, k -> new ModelDef(model)).instances.add(module);
    stack.add(model.ident);
    for (Variable.Module child : model.modules.values()) {
      addReferencedModels(project, child, all, stack);
    }
    stack.remove(stack.size() - 1);
  }
}
