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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.stockflow.compiler.Builtins;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;

/**
 * A project: the user's models plus the standard library, and the default SimSpec. Like Models,
 * Projects are immutable and each edit returns a new Project.
 */
public final class Project {

  private static final Logger logger = LogManager.getLogger();

  /** The standard library is the same for every project, so it is only built once. */
  private static final ImmutableMap<String, Model> STDLIB =
      Stdlib.MODELS.stream()
          .map(Model::build)
          .collect(ImmutableMap.toImmutableMap(m -> m.ident, m -> m));

  public final String name;
  public final Datamodel.SimSpec simSpec;

  /** The user's models, keyed by identifier. */
  public final ImmutableMap<String, Model> models;

  private Project(String name, Datamodel.SimSpec simSpec, ImmutableMap<String, Model> models) {
    this.name = name;
    this.simSpec = simSpec;
    this.models = models;
  }

  /**
   * Builds a Project from its declarations.
   *
   * @throws CompileError if two models have the same name, or a model can't be built
   */
  public static Project build(Datamodel.Project decl) {
    Map<String, Model> models = new LinkedHashMap<>();
    for (Datamodel.Model mDecl : decl.models) {
      Model model = Model.build(mDecl);
      if (models.containsKey(model.ident) || STDLIB.containsKey(model.ident)) {
        throw new CompileError("duplicate model name " + model.ident, model.ident, null);
      }
      models.put(model.ident, model);
    }
    return new Project(decl.name, decl.simSpec, ImmutableMap.copyOf(models));
  }

  /** Returns the declarations of the user's models. */
  public Datamodel.Project toDatamodel() {
    return new Datamodel.Project(
        name,
        simSpec,
        models.values().stream().map(m -> m.decl).collect(ImmutableList.toImmutableList()));
  }

  /**
   * Returns the model with the given name: a user model if there is one, otherwise the
   * standard-library model of that name. A null or empty name means {@code main}.
   */
  public @Nullable Model model(@Nullable String modelName) {
    if (modelName == null || modelName.isEmpty()) {
      modelName = "main";
    }
    Model result = models.get(modelName);
    if (result == null) {
      result = STDLIB.get(modelName);
      if (result == null) {
        result = STDLIB.get(Builtins.STDLIB_PREFIX + modelName);
      }
    }
    return result;
  }

  /** The implicit module instantiating the {@code main} model. */
  public Variable.Module main() {
    return Variable.Module.root();
  }

  /** The SimSpec to use when simulating the given model. */
  public Datamodel.SimSpec simSpecFor(Model model) {
    Datamodel.SimSpec override = model.simSpec();
    return (override != null) ? override : simSpec;
  }

  public boolean isSimulatable(@Nullable String modelName) {
    Model model = model(modelName);
    return model != null && model.isSimulatable();
  }

  /** Returns a Project in which the named model has been replaced by {@code edit}. */
  private Project edit(String op, @Nullable String modelName, UnaryOperator<Model> edit) {
    Model model = model(modelName);
    if (model == null || !models.containsKey(model.ident)) {
      logger.warn("{}: unknown model {}", op, modelName);
      return this;
    }
    Map<String, Model> newModels = new LinkedHashMap<>(models);
    newModels.put(model.ident, edit.apply(model));
    return new Project(name, simSpec, ImmutableMap.copyOf(newModels));
  }

  public Project setEquation(@Nullable String modelName, String ident, String equation) {
    return edit("setEquation", modelName, m -> m.setEquation(ident, equation));
  }

  public Project rename(@Nullable String modelName, String oldName, String newName) {
    return edit("rename", modelName, m -> m.rename(oldName, newName));
  }

  public Project addNewVariable(@Nullable String modelName, Datamodel.Kind kind, String name) {
    return edit("addNewVariable", modelName, m -> m.addNewVariable(kind, name));
  }

  public Project deleteVariables(@Nullable String modelName, Collection<String> idents) {
    return edit("deleteVariables", modelName, m -> m.deleteVariables(idents));
  }

  public Project addStocksFlow(
      @Nullable String modelName, String stock, String flow, Model.FlowDirection dir) {
    return edit("addStocksFlow", modelName, m -> m.addStocksFlow(stock, flow, dir));
  }

  public Project removeStocksFlow(
      @Nullable String modelName, String stock, String flow, Model.FlowDirection dir) {
    return edit("removeStocksFlow", modelName, m -> m.removeStocksFlow(stock, flow, dir));
  }

  public Project setTable(
      @Nullable String modelName, String ident, Datamodel.@Nullable GraphicalFunction gf) {
    return edit("setTable", modelName, m -> m.setTable(ident, gf));
  }

  /** Replaces the project's default SimSpec. */
  public Project setSimSpec(Datamodel.SimSpec newSimSpec) {
    return new Project(name, newSimSpec, models);
  }
}
