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

package org.stockflow.compiler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stockflow.datamodel.Datamodel;

/**
 * Rewrites builtin calls in one variable's equation:
 *
 * <ul>
 *   <li>The first argument of a {@code lookup()} call is changed from an {@link Expr.Ident} to an
 *       {@link Expr.Table}.
 *   <li>A call to a standard-library template (e.g. {@code smth1(x, 5)}) is replaced by a
 *       reference to the {@code output} of a new module instantiating the corresponding
 *       standard-library model. Arguments that aren't plain identifiers are first moved into new
 *       auxiliary variables, so that each of the module's inputs can be connected to a variable.
 *       {@code dt} counts as such an argument unless the model declares a variable of that name,
 *       since it has no slot that a connection could refer to.
 *   <li>A call to any other function that isn't a primitive builtin is replaced by {@code 0} (after
 *       logging a warning), so that a single bad call doesn't make the whole model unusable.
 * </ul>
 *
 * <p>The synthesized modules and auxiliaries are returned by {@link #synthesized}; their names
 * start with {@link Canonical#HIDDEN_PREFIX} and include the owning variable and a counter, so
 * they can't collide with declared variables or with each other.
 *
 * <p>A new BuiltinDesugarer should be used for each variable.
 */
public final class BuiltinDesugarer extends RewriteVisitor {

  private static final Logger logger = LogManager.getLogger();

  /** The identifier of the variable whose equation is being rewritten. */
  private final String owner;

  /** True if the model declares a variable named {@code dt}. */
  private final boolean dtIsVariable;

  /** The number of rewrites so far; also used to name synthesized variables. */
  private int count;

  private final List<Datamodel.Variable> synthesized = new ArrayList<>();

  public BuiltinDesugarer(String owner) {
    this(owner, false);
  }

  public BuiltinDesugarer(String owner, boolean dtIsVariable) {
    this.owner = owner;
    this.dtIsVariable = dtIsVariable;
  }

  /** True if any part of the equation was rewritten. */
  public boolean didRewrite() {
    return count > 0;
  }

  /** The declarations of the variables that must be added to the model. */
  public ImmutableList<Datamodel.Variable> synthesized() {
    return ImmutableList.copyOf(synthesized);
  }

  @Override
  public Expr visitCall(Expr.Call n) {
    ImmutableList<Expr> args = rewriteArgs(n.args);
    String fn = n.fn.name;
    if (Builtins.isPrimitive(fn)) {
      if (fn.equals("lookup") && !args.isEmpty() && args.get(0) instanceof Expr.Ident table) {
        args =
            ImmutableList.<Expr>builder()
                .add(Expr.Table.from(table))
                .addAll(args.subList(1, args.size()))
                .build();
        count++;
      }
      return n.with(n.fn, args);
    }
    ImmutableList<String> params = Builtins.STDLIB_PARAMS.get(fn);
    if (params == null) {
      logger.warn("unknown builtin {} in equation for {}; using 0", fn, owner);
      return new Expr.Constant(n.pos(), 0, 0);
    }
    if (args.size() > params.size()) {
      throw CompileError.of(
          "%s() takes at most %s arguments, not %s", fn, params.size(), args.size());
    }
    String prefix = Canonical.HIDDEN_PREFIX + owner + "·" + count + "·";
    ImmutableList.Builder<Datamodel.Connection> connections = ImmutableList.builder();
    for (int i = 0; i < args.size(); i++) {
      Expr arg = args.get(i);
      String argIdent;
      if (arg instanceof Expr.Ident ident && (dtIsVariable || !ident.name.equals("dt"))) {
        argIdent = ident.name;
      } else {
        argIdent = prefix + "arg" + i;
        synthesized.add(Datamodel.Variable.aux(argIdent, PrintVisitor.print(arg)));
      }
      connections.add(new Datamodel.Connection(argIdent, params.get(i)));
    }
    String moduleIdent = prefix + fn;
    synthesized.add(
        Datamodel.Variable.builder(Datamodel.Kind.MODULE, moduleIdent)
            .modelName(Builtins.STDLIB_PREFIX + fn)
            .connections(connections.build())
            .build());
    count++;
    return new Expr.Ident(n.pos(), moduleIdent + ".output");
  }
}
