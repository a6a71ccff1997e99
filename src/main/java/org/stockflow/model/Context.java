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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The environment for resolving identifiers: a project, the stack of models being compiled (the
 * last is the innermost), and whether we are ordering the initial phase or the flow phase.
 */
public final class Context {
  public final Project project;
  public final ImmutableList<Model> models;
  public final boolean isInitials;

  private Context(Project project, ImmutableList<Model> models, boolean isInitials) {
    Preconditions.checkArgument(!models.isEmpty());
    this.project = project;
    this.models = models;
    this.isInitials = isInitials;
  }

  public Context(Project project, Model model, boolean isInitials) {
    this(project, ImmutableList.of(model), isInitials);
  }

  /** Returns a Context for resolving identifiers within {@code model}, nested in this one. */
  public Context push(Model model) {
    return new Context(
        project, ImmutableList.<Model>builder().addAll(models).add(model).build(), isInitials);
  }

  /** The innermost model. */
  public Model parent() {
    return models.get(models.size() - 1);
  }

  /** The project's main model. */
  public @Nullable Model mainModel() {
    return project.model(project.main().modelName);
  }

  /** True if the innermost model is the project's main model. */
  public boolean isRoot() {
    return parent() == mainModel();
  }

  /**
   * Resolves a (possibly dotted) identifier within the innermost model, following module
   * boundaries for each dotted component. A leading "{@code .}" resolves from the main model.
   * Returns null if there is no such variable.
   */
  public @Nullable Variable lookup(String path) {
    if (path.startsWith(".")) {
      Model main = mainModel();
      if (main == null) {
        return null;
      }
      return new Context(project, main, isInitials).lookup(path.substring(1));
    }
    Model model = parent();
    Variable v = model.vars.get(path);
    if (v != null) {
      return v;
    }
    int dot = path.indexOf('.');
    if (dot < 0) {
      return null;
    }
    Variable.Module module = model.modules.get(path.substring(0, dot));
    if (module == null) {
      return null;
    }
    Model next = project.model(module.modelName);
    return (next == null) ? null : push(next).lookup(path.substring(dot + 1));
  }
}
