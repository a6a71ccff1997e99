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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.stockflow.code.Frame;
import org.stockflow.compiler.Canonical;
import org.stockflow.compiler.CompileError;

/**
 * One module instance in a running simulation: a {@link ModelClass} placed at a particular offset
 * in the state array, with its references resolved to absolute offsets.
 *
 * <p>The instance tree is laid out depth-first: each instance's locals come first, followed by the
 * slots of each of its children in order.
 */
public final class Instance extends Frame {

  /** The name of the module variable (or "{@code main}" for the root). */
  public final String name;

  public final ModelClass modelClass;

  private final @Nullable Instance parent;

  /** The binding of each of this instance's inputs, from the parent's child description. */
  private final ImmutableMap<String, String> bindings;

  private final ImmutableMap<String, Instance> children;

  private boolean inputsResolved;
  private boolean resolvingInputs;

  private Instance(
      String name,
      ModelClass modelClass,
      @Nullable Instance parent,
      ImmutableMap<String, String> bindings,
      int base) {
    this.name = name;
    this.modelClass = modelClass;
    this.parent = parent;
    this.bindings = bindings;
    setBase(base);
    setFunctions(modelClass.fns);
    setNumRefs(modelClass.refNames.size());
    ImmutableMap.Builder<String, Instance> children = ImmutableMap.builder();
    List<Frame> frames = new ArrayList<>();
    int childBase = base + modelClass.numLocals;
    for (ModelClass.Child child : modelClass.children) {
      Instance instance =
          new Instance(child.ident, child.modelClass, this, child.bindings, childBase);
      children.put(child.ident, instance);
      frames.add(instance);
      childBase += child.modelClass.size();
    }
    this.children = children.buildOrThrow();
    setChildren(frames.toArray(new Frame[0]));
  }

  /**
   * Creates the instance tree for the given root class and resolves every reference.
   *
   * @throws CompileError if some reference can't be resolved
   */
  public static Instance root(ModelClass modelClass) {
    Instance root = new Instance("main", modelClass, null, ImmutableMap.of(), 0);
    // Inputs first, then paths into child modules. An input bound to another input is resolved on
    // demand, so siblings may refer to each other in any order.
    root.resolveAllInputs();
    root.resolvePaths();
    return root;
  }

  private Instance root() {
    return (parent == null) ? this : parent.root();
  }

  private void resolveAllInputs() {
    resolveInputs();
    children.values().forEach(Instance::resolveAllInputs);
  }

  /** Sets the refs of this instance's bound inputs, if that hasn't already been done. */
  private void resolveInputs() {
    if (inputsResolved) {
      return;
    } else if (resolvingInputs) {
      throw new CompileError(
          "circular input binding through " + this, modelClass.model.ident, name);
    }
    resolvingInputs = true;
    ImmutableList<String> refNames = modelClass.refNames;
    for (int i = 0; i < refNames.size(); i++) {
      String ptr = bindings.get(refNames.get(i));
      if (ptr != null) {
        Instance ctx = (ptr.startsWith(".") || parent == null) ? root() : parent;
        setRef(i, ctx.resolve(ptr, refNames.get(i)));
      }
    }
    resolvingInputs = false;
    inputsResolved = true;
  }

  private void resolvePaths() {
    ImmutableList<String> refNames = modelClass.refNames;
    for (int i = 0; i < refNames.size(); i++) {
      String path = refNames.get(i);
      if (!bindings.containsKey(path)) {
        Instance ctx = path.startsWith(".") ? root() : this;
        setRef(i, ctx.resolve(path, path));
      }
    }
    children.values().forEach(Instance::resolvePaths);
  }

  private int resolve(String path, String refName) {
    int offset = offsetOf(path);
    if (offset < 0) {
      throw new CompileError(
          "can't resolve " + path + " (bound to " + refName + ")", modelClass.model.ident, name);
    }
    return offset;
  }

  /**
   * Returns the absolute offset in the state array of the named variable, or -1 if there is no
   * such variable. The name may be a dotted path into child modules; a leading "{@code .}" is
   * ignored. {@code time} is always at offset 0.
   */
  public int offsetOf(String path) {
    if (path.startsWith(".")) {
      path = path.substring(1);
    }
    if (path.equals("time")) {
      return 0;
    }
    Integer local = modelClass.offsets.get(path);
    if (local != null) {
      return base() + local;
    }
    int refIndex = modelClass.inputs.contains(path) ? modelClass.refNames.indexOf(path) : -1;
    if (refIndex >= 0) {
      resolveInputs();
      return ref(refIndex);
    }
    int dot = path.indexOf('.');
    if (dot < 0) {
      return -1;
    }
    Instance child = children.get(path.substring(0, dot));
    return (child == null) ? -1 : child.offsetOf(path.substring(dot + 1));
  }

  /**
   * Returns the names of this instance's locals followed by those of its children (prefixed by the
   * child's name and a dot). Names synthesized by the compiler are omitted unless {@code
   * includeHidden} is true.
   */
  public List<String> varNames(boolean includeHidden) {
    List<String> result = new ArrayList<>();
    for (String local : modelClass.offsets.keySet()) {
      if (includeHidden || !Canonical.isHidden(local)) {
        result.add(local);
      }
    }
    children.forEach(
        (ident, child) -> {
          if (includeHidden || !Canonical.isHidden(ident)) {
            child.varNames(includeHidden).forEach(n -> result.add(ident + "." + n));
          }
        });
    return result;
  }

  public ImmutableMap<String, Instance> children() {
    return children;
  }

  /** The number of slots used by this instance and its children. */
  public int size() {
    return modelClass.size();
  }

  @Override
  public String toString() {
    return name + ":" + modelClass.name + "@" + base();
  }
}
