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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.stockflow.compiler.BuiltinDesugarer;
import org.stockflow.compiler.Canonical;
import org.stockflow.compiler.CompileError;
import org.stockflow.compiler.Expr;
import org.stockflow.compiler.Parser;
import org.stockflow.compiler.PrintVisitor;
import org.stockflow.compiler.RenameVisitor;
import org.stockflow.datamodel.Datamodel;

/**
 * A model: its variables, built from a {@link Datamodel.Model} by parsing every equation and
 * desugaring calls to standard-library functions into (hidden) module instances.
 *
 * <p>Models are immutable. The edit operations return a new Model built from scratch from the
 * edited declarations.
 */
public final class Model {

  public enum FlowDirection {
    IN,
    OUT
  }

  /** The declarations this model was built from. */
  public final Datamodel.Model decl;

  public final String ident;

  /** All variables, declared ones first (in declaration order) followed by synthesized ones. */
  public final ImmutableMap<String, Variable> vars;

  public final ImmutableMap<String, Variable.Module> modules;
  public final ImmutableMap<String, Variable.Table> tables;

  private Model(Datamodel.Model decl, ImmutableMap<String, Variable> vars) {
    this.decl = decl;
    this.ident = decl.ident();
    this.vars = vars;
    ImmutableMap.Builder<String, Variable.Module> modules = ImmutableMap.builder();
    ImmutableMap.Builder<String, Variable.Table> tables = ImmutableMap.builder();
    vars.forEach(
        (name, v) -> {
          if (v instanceof Variable.Module m) {
            modules.put(name, m);
          } else if (v instanceof Variable.Table t) {
            tables.put(name, t);
          }
        });
    this.modules = modules.buildOrThrow();
    this.tables = tables.buildOrThrow();
  }

  /**
   * Builds a Model from its declarations.
   *
   * @throws CompileError if two variables have the same identifier
   */
  public static Model build(Datamodel.Model decl) {
    Map<String, Variable> vars = new LinkedHashMap<>();
    Deque<Datamodel.Variable> pending = new ArrayDeque<>(decl.variables);
    int numDeclared = decl.variables.size();
    for (int i = 0; !pending.isEmpty(); i++) {
      Datamodel.Variable vDecl = pending.removeFirst();
      String ident = vDecl.ident();
      if (vars.containsKey(ident)) {
        throw (i < numDeclared)
            ? new CompileError("Variable '" + ident + "' already exists", decl.ident(), ident)
            : new CompileError(
                "Synthesized variable '" + ident + "' already exists", decl.ident(), ident);
      }
      Variable v = Variable.of(vDecl);
      if (v.ast != null) {
        BuiltinDesugarer desugarer =
            new BuiltinDesugarer(ident, decl.variable("dt") != null);
        Expr desugared;
        try {
          desugared = desugarer.rewrite(v.ast);
        } catch (CompileError e) {
          throw e.in(decl.ident(), ident);
        }
        if (desugarer.didRewrite()) {
          v = v.withAst(desugared);
        }
        // Synthesized variables are processed after all the declared ones.
        pending.addAll(desugarer.synthesized());
      }
      vars.put(ident, v);
    }
    return new Model(decl, ImmutableMap.copyOf(vars));
  }

  /** If non-null, overrides the project's SimSpec. */
  public Datamodel.@Nullable SimSpec simSpec() {
    return decl.simSpec;
  }

  public @Nullable Variable variable(String ident) {
    return vars.get(ident);
  }

  /** True if no variable of this model has errors. */
  public boolean isSimulatable() {
    return vars.values().stream().noneMatch(Variable::hasErrors);
  }

  /** Returns the errors of each variable that has any. */
  public ImmutableMap<String, ImmutableList<String>> errors() {
    return vars.values().stream()
        .filter(Variable::hasErrors)
        .collect(ImmutableMap.toImmutableMap(v -> v.ident, v -> v.errors));
  }

  /** Returns a Model with the declarations edited by {@code edit}. */
  private Model rebuild(UnaryOperator<Datamodel.Variable> edit) {
    return build(
        decl.withVariables(
            decl.variables.stream().map(edit).collect(ImmutableList.toImmutableList())));
  }

  /** Returns a Model with one declaration edited by {@code edit}. */
  private Model rebuild(String ident, UnaryOperator<Datamodel.Variable> edit) {
    return rebuild(v -> v.ident().equals(ident) ? edit.apply(v) : v);
  }

  public Model setEquation(String ident, String equation) {
    return rebuild(ident, v -> v.toBuilder().equation(equation).build());
  }

  /** Adds a new stock, flow or auxiliary with an empty equation. */
  public Model addNewVariable(Datamodel.Kind kind, String name) {
    if (kind == Datamodel.Kind.MODULE) {
      throw new IllegalArgumentException("unsupported new type (" + kind + ") for " + name);
    }
    Datamodel.Variable v = Datamodel.Variable.builder(kind, name).equation("").build();
    return build(
        decl.withVariables(
            ImmutableList.<Datamodel.Variable>builder().addAll(decl.variables).add(v).build()));
  }

  public Model deleteVariables(Collection<String> idents) {
    ImmutableSet<String> toDelete = ImmutableSet.copyOf(idents);
    return build(
        decl.withVariables(
            decl.variables.stream()
                .filter(v -> !toDelete.contains(v.ident()))
                .collect(ImmutableList.toImmutableList())));
  }

  /**
   * Renames a variable, updating every equation, stock flow list and module connection that
   * refers to it.
   */
  public Model rename(String oldName, String newName) {
    String oldIdent = Canonical.canonicalize(oldName);
    String newIdent = Canonical.canonicalize(newName);
    RenameVisitor renamer = new RenameVisitor(oldIdent, newIdent);
    return rebuild(
        v -> {
          Datamodel.Variable.Builder builder = v.toBuilder();
          if (v.ident().equals(oldIdent)) {
            builder.name(newName);
          }
          if (v.equation != null) {
            Expr ast = Parser.parse(v.equation).expr;
            if (ast != null) {
              Expr renamed = renamer.rewrite(ast);
              if (renamed != ast) {
                builder.equation(PrintVisitor.print(renamed));
              }
            }
          }
          builder.inflows(renameAll(v.inflows, renamer));
          builder.outflows(renameAll(v.outflows, renamer));
          builder.connections(
              v.connections.stream()
                  .map(c -> new Datamodel.Connection(renamer.rename(c.from), c.to))
                  .collect(ImmutableList.toImmutableList()));
          return builder.build();
        });
  }

  private static ImmutableList<String> renameAll(
      ImmutableList<String> idents, RenameVisitor renamer) {
    return idents.stream().map(renamer::rename).collect(ImmutableList.toImmutableList());
  }

  public Model addStocksFlow(String stock, String flow, FlowDirection dir) {
    return rebuild(
        stock,
        v -> {
          if (v.kind != Datamodel.Kind.STOCK) {
            return v;
          }
          ImmutableList<String> flows = (dir == FlowDirection.IN) ? v.inflows : v.outflows;
          ImmutableList<String> updated =
              ImmutableList.<String>builder().addAll(flows).add(flow).build();
          return (dir == FlowDirection.IN)
              ? v.toBuilder().inflows(updated).build()
              : v.toBuilder().outflows(updated).build();
        });
  }

  public Model removeStocksFlow(String stock, String flow, FlowDirection dir) {
    return rebuild(
        stock,
        v -> {
          if (v.kind != Datamodel.Kind.STOCK) {
            return v;
          }
          ImmutableList<String> flows = (dir == FlowDirection.IN) ? v.inflows : v.outflows;
          ImmutableList<String> updated =
              flows.stream().filter(f -> !f.equals(flow)).collect(ImmutableList.toImmutableList());
          return (dir == FlowDirection.IN)
              ? v.toBuilder().inflows(updated).build()
              : v.toBuilder().outflows(updated).build();
        });
  }

  /** Sets a variable's graphical function, or removes it if {@code gf} is null. */
  public Model setTable(String ident, Datamodel.@Nullable GraphicalFunction gf) {
    return rebuild(ident, v -> v.toBuilder().gf(gf).build());
  }

  public Model setSimSpec(Datamodel.@Nullable SimSpec simSpec) {
    return build(decl.withSimSpec(simSpec));
  }

  @Override
  public String toString() {
    return "Model " + ident + vars.values();
  }
}
