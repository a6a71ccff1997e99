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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stockflow.code.Backend;
import org.stockflow.code.CodeValue;
import org.stockflow.code.Op;
import org.stockflow.code.Phase;
import org.stockflow.code.Statement;
import org.stockflow.code.StepFunction;
import org.stockflow.compiler.CompileError;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.model.Context;
import org.stockflow.model.Dependencies;
import org.stockflow.model.Model;
import org.stockflow.model.ModelDef;
import org.stockflow.model.Project;
import org.stockflow.model.Variable;

/**
 * Compiles a project into {@link ModelClass}es, one for each distinct set of bound inputs of each
 * model reachable from the root module.
 *
 * <p>Each model class has three phases:
 *
 * <ul>
 *   <li>initials: stocks, constants and modules, plus everything they depend on (directly or
 *       indirectly), so that each stock's initial equation can be evaluated;
 *   <li>flows: everything except stocks and constants;
 *   <li>stocks: stocks are integrated, constants copied and modules stepped.
 * </ul>
 *
 * The initials and flows are ordered so that each variable is computed after the variables it
 * depends on (and otherwise in declaration order); a cycle is a {@link CompileError}. Stocks only
 * depend on values from the flow phase, so they stay in declaration order.
 */
public final class SimBuilder {

  private static final Logger logger = LogManager.getLogger();

  private final Project project;
  private final Backend backend;

  /** For each model, the class name for each set of bound inputs. */
  private final Map<String, ImmutableMap<ImmutableSet<String>, String>> classNames =
      new HashMap<>();

  /** The classes compiled so far, keyed by name. */
  private final Map<String, ModelClass> classes = new LinkedHashMap<>();

  public SimBuilder(Project project, Backend backend) {
    this.project = project;
    this.backend = backend;
  }

  /**
   * Compiles the project's main model (and everything it instantiates) and returns a Simulation of
   * it, using the backend from {@link SimOptions}.
   *
   * @throws CompileError if the project can't be compiled
   */
  public static Simulation build(Project project) {
    return build(project, SimOptions.fromSystemProperties().backend);
  }

  public static Simulation build(Project project, Backend backend) {
    SimBuilder builder = new SimBuilder(project, backend);
    ModelClass root = builder.compileRoot();
    Datamodel.SimSpec simSpec = project.simSpecFor(root.model);
    if (!simSpec.method.toLowerCase(Locale.ROOT).equals("euler")) {
      logger.warn("unsupported simulation method {}, using euler", simSpec.method);
    }
    return new Simulation(root, simSpec);
  }

  /** Compiles the root module and returns its class. */
  public ModelClass compileRoot() {
    Variable.Module root = project.main();
    // Name every monomorphization before compiling any of them.
    ModelDef.referencedModels(project, root)
        .forEach((ident, def) -> classNames.put(ident, def.monomorphizations()));
    return compile(root);
  }

  /** All the classes compiled so far, in the order they were completed. */
  public ImmutableMap<String, ModelClass> classes() {
    return ImmutableMap.copyOf(classes);
  }

  private ModelClass compile(Variable.Module module) {
    Model model = project.model(module.modelName);
    if (model == null) {
      throw new CompileError("unknown model " + module.modelName, null, module.ident);
    }
    ImmutableSet<String> inputs = module.refs.keySet();
    String name = classNames.get(model.ident).get(inputs);
    ModelClass result = classes.get(name);
    if (result == null) {
      result = compileModel(name, model, inputs);
      classes.put(name, result);
    }
    return result;
  }

  private ModelClass compileModel(String name, Model model, ImmutableSet<String> inputs) {
    for (Variable v : model.vars.values()) {
      if (v.hasErrors() && !inputs.contains(v.ident)) {
        throw new CompileError(v.errors.get(0), model.ident, v.ident);
      }
    }
    // Time is slot 0 of the root.
    int numLocals = model.ident.equals("main") ? 1 : 0;
    ImmutableMap.Builder<String, Integer> offsetsBuilder = ImmutableMap.builder();
    for (Variable v : model.vars.values()) {
      if (!(v instanceof Variable.Module) && !inputs.contains(v.ident)) {
        offsetsBuilder.put(v.ident, numLocals++);
      }
    }
    ImmutableMap<String, Integer> offsets = offsetsBuilder.buildOrThrow();

    ImmutableList.Builder<ModelClass.Child> children = ImmutableList.builder();
    Map<String, Integer> childIndex = new HashMap<>();
    for (Variable.Module module : model.modules.values()) {
      childIndex.put(module.ident, childIndex.size());
      ImmutableMap<String, String> bindings =
          module.refs.values().stream()
              .collect(ImmutableMap.toImmutableMap(r -> r.ident, r -> r.ptr));
      children.add(new ModelClass.Child(module.ident, compile(module), bindings));
    }

    Dependencies initialDeps = new Dependencies(new Context(project, model, true));
    Dependencies flowDeps = new Dependencies(new Context(project, model, false));
    Map<String, Variable> initials = new LinkedHashMap<>();
    Map<String, Variable> flows = new LinkedHashMap<>();
    List<Variable> stocks = new ArrayList<>();
    for (Variable v : model.vars.values()) {
      if (inputs.contains(v.ident)) {
        // Bound to a variable outside this instance; nothing to compute.
        continue;
      }
      boolean isModule = v instanceof Variable.Module;
      boolean isStock = v instanceof Variable.Stock;
      boolean isConst = !isModule && v.isConst();
      if (isModule || isStock || isConst) {
        for (String dep : initialDeps.transitive(v)) {
          if (!inputs.contains(dep)) {
            initials.putIfAbsent(dep, model.vars.get(dep));
          }
        }
        initials.putIfAbsent(v.ident, v);
        stocks.add(v);
      }
      if (isModule || !(isStock || isConst)) {
        flows.put(v.ident, v);
      }
    }

    EquationCompiler compiler =
        new EquationCompiler(model, offsets, inputs.stream().sorted().collect(Collectors.toList()));
    PhaseEmitter emitter = new PhaseEmitter(model, offsets, childIndex, compiler);
    StepFunction initialsFn = emitter.emit(Phase.INITIALS, sort(model, initials, initialDeps));
    StepFunction flowsFn = emitter.emit(Phase.FLOWS, sort(model, flows, flowDeps));
    StepFunction stocksFn = emitter.emit(Phase.STOCKS, stocks);
    logger.debug("compiled {} for {} with inputs {}", name, model.ident, inputs);
    return new ModelClass(
        name,
        model,
        inputs,
        offsets,
        numLocals,
        compiler.refNames(),
        children.build(),
        initialsFn,
        flowsFn,
        stocksFn,
        backend.compile(name, initialsFn, flowsFn, stocksFn));
  }

  /**
   * Returns the given variables ordered so that each comes after the ones it depends on, and
   * otherwise in their original order.
   */
  private static List<Variable> sort(Model model, Map<String, Variable> vars, Dependencies deps) {
    List<Variable> result = new ArrayList<>(vars.size());
    Set<String> done = new HashSet<>();
    LinkedHashSet<String> inProgress = new LinkedHashSet<>();
    for (Variable v : vars.values()) {
      visit(model, v, vars, deps, done, inProgress, result);
    }
    return result;
  }

  private static void visit(
      Model model,
      Variable v,
      Map<String, Variable> vars,
      Dependencies deps,
      Set<String> done,
      LinkedHashSet<String> inProgress,
      List<Variable> result) {
    if (done.contains(v.ident)) {
      return;
    } else if (!inProgress.add(v.ident)) {
      List<String> path = new ArrayList<>(inProgress);
      List<String> cycle = new ArrayList<>(path.subList(path.indexOf(v.ident), path.size()));
      cycle.add(v.ident);
      throw new CompileError(
          "circular dependency: " + String.join(" → ", cycle), model.ident, v.ident);
    }
    for (String dep : deps.direct(v)) {
      Variable depVar = vars.get(dep);
      if (depVar != null) {
        visit(model, depVar, vars, deps, done, inProgress, result);
      }
    }
    inProgress.remove(v.ident);
    done.add(v.ident);
    result.add(v);
  }

  /** Emits the statements of each phase of one model class. */
  private static class PhaseEmitter {
    final Model model;
    final ImmutableMap<String, Integer> offsets;
    final Map<String, Integer> childIndex;
    final EquationCompiler compiler;

    PhaseEmitter(
        Model model,
        ImmutableMap<String, Integer> offsets,
        Map<String, Integer> childIndex,
        EquationCompiler compiler) {
      this.model = model;
      this.offsets = offsets;
      this.childIndex = childIndex;
      this.compiler = compiler;
    }

    StepFunction emit(Phase phase, List<Variable> vars) {
      ImmutableList.Builder<Statement> result = ImmutableList.builder();
      for (Variable v : vars) {
        if (v instanceof Variable.Module) {
          result.add(new Statement.CallModule(childIndex.get(v.ident), v.ident, phase));
          continue;
        }
        int offset = offsets.get(v.ident);
        CodeValue value;
        if (phase != Phase.STOCKS) {
          value =
              (v instanceof Variable.Table table)
                  ? compiler.compileTable(table)
                  : compiler.compile(v);
        } else if (v instanceof Variable.Stock stock) {
          value = integrate(stock, offset);
        } else {
          // Constants keep their value.
          value = new CodeValue.Local(offset, v.ident);
        }
        Statement.Target target =
            (phase == Phase.STOCKS) ? Statement.Target.NEXT : Statement.Target.CURR;
        result.add(new Statement.Assign(target, offset, v.ident, value));
      }
      return new StepFunction(phase, result.build());
    }

    /** Returns {@code curr + (inflows - outflows) * dt}. */
    private CodeValue integrate(Variable.Stock stock, int offset) {
      CodeValue net;
      try {
        net = new CodeValue.Call(Op.SUBTRACT, sum(stock.inflows), sum(stock.outflows));
      } catch (CompileError e) {
        throw e.in(model.ident, stock.ident);
      }
      return new CodeValue.Call(
          Op.ADD,
          new CodeValue.Local(offset, stock.ident),
          new CodeValue.Call(Op.MULTIPLY, net, CodeValue.DT));
    }

    /** Returns the sum of the given flows (each counted once), or 0 if there are none. */
    private CodeValue sum(List<String> flows) {
      CodeValue result = null;
      for (String flow : new LinkedHashSet<>(flows)) {
        CodeValue value = compiler.resolve(flow);
        result = (result == null) ? value : new CodeValue.Call(Op.ADD, result, value);
      }
      return (result == null) ? CodeValue.of(0) : result;
    }
  }
}
