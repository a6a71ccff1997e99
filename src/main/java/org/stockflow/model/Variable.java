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
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.stockflow.compiler.Expr;
import org.stockflow.compiler.IdentifierSetVisitor;
import org.stockflow.compiler.ParseResult;
import org.stockflow.compiler.Parser;
import org.stockflow.datamodel.Datamodel;

/**
 * A variable of a {@link Model}, built from its declaration by parsing the equation. There are
 * exactly five kinds of Variable, each a nested subclass:
 *
 * <ul>
 *   <li>{@link Ordinary}: an auxiliary or flow, computed from its equation at each step;
 *   <li>{@link Stock}: integrated from its inflows and outflows, with its equation giving the
 *       initial value;
 *   <li>{@link Table}: an auxiliary or flow with a graphical function; its equation computes the
 *       index into the function;
 *   <li>{@link Module}: an instance of another model;
 *   <li>{@link Reference}: an input of a module, bound to a variable outside it.
 * </ul>
 *
 * <p>Variables are immutable; editing a model rebuilds all of its Variables.
 */
public abstract class Variable {

  public enum Kind {
    ORDINARY,
    STOCK,
    TABLE,
    MODULE,
    REFERENCE
  }

  /** A decimal number, as accepted by {@link #isConst}. */
  private static final Pattern NUMBER =
      Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  /** The declaration this variable was built from; null for a Reference. */
  public final Datamodel.@Nullable Variable decl;

  /** The canonical name of this variable. */
  public final String ident;

  /** The parsed (and desugared) equation, or null if there is none or it didn't parse. */
  public final @Nullable Expr ast;

  /** Problems with this variable's definition; a model can't be simulated if there are any. */
  public final ImmutableList<String> errors;

  /**
   * The identifiers this variable refers to directly. For a Module these are the sources of its
   * connections; for other variables, the identifiers in its equation.
   */
  public final ImmutableSet<String> deps;

  // Subclasses are all defined here.
  private Variable(
      Datamodel.@Nullable Variable decl,
      String ident,
      @Nullable Expr ast,
      ImmutableList<String> errors,
      ImmutableSet<String> deps) {
    this.decl = decl;
    this.ident = ident;
    this.ast = ast;
    this.errors = errors;
    this.deps = deps;
  }

  public abstract Kind kind();

  /** Returns a copy of this variable with a rewritten equation (and the corresponding deps). */
  abstract Variable withAst(Expr newAst);

  /** True if this variable's equation is just a (finite) number. */
  public boolean isConst() {
    if (decl == null || decl.equation == null || kind() == Kind.MODULE) {
      return false;
    }
    String eqn = decl.equation.trim();
    return NUMBER.matcher(eqn).matches() && Double.isFinite(Double.parseDouble(eqn));
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Returns the Variable described by the given declaration. */
  public static Variable of(Datamodel.Variable decl) {
    switch (decl.kind) {
      case MODULE:
        return new Module(decl);
      case STOCK:
        return new Stock(decl, parse(decl));
      case AUX:
      case FLOW:
        ParseResult parsed = parse(decl);
        if (decl.gf != null && !decl.gf.yPoints.isEmpty()) {
          return new Table(decl, parsed);
        }
        return new Ordinary(decl, parsed);
    }
    throw new AssertionError(decl.kind);
  }

  private static ParseResult parse(Datamodel.Variable decl) {
    return (decl.equation == null) ? ParseResult.EMPTY : Parser.parse(decl.equation);
  }

  private static ImmutableList<String> errors(ParseResult parsed) {
    if (parsed.isEmpty()) {
      return ImmutableList.of("Missing equation");
    }
    return parsed.errors;
  }

  @Override
  public String toString() {
    return kind() + " " + ident + ((ast == null) ? "" : " = " + ast);
  }

  /** An auxiliary or flow. */
  public static final class Ordinary extends Variable {
    private Ordinary(Datamodel.Variable decl, ParseResult parsed) {
      this(decl, parsed.expr, errors(parsed));
    }

    private Ordinary(Datamodel.Variable decl, @Nullable Expr ast, ImmutableList<String> errors) {
      super(decl, decl.ident(), ast, errors, IdentifierSetVisitor.identifiers(ast));
    }

    @Override
    public Kind kind() {
      return Kind.ORDINARY;
    }

    @Override
    Variable withAst(Expr newAst) {
      return new Ordinary(decl, newAst, errors);
    }
  }

  /** A stock; its equation gives its initial value. */
  public static final class Stock extends Variable {
    public final ImmutableList<String> inflows;
    public final ImmutableList<String> outflows;

    private Stock(Datamodel.Variable decl, ParseResult parsed) {
      this(decl, parsed.expr, errors(parsed));
    }

    private Stock(Datamodel.Variable decl, @Nullable Expr ast, ImmutableList<String> errors) {
      super(decl, decl.ident(), ast, errors, IdentifierSetVisitor.identifiers(ast));
      this.inflows = decl.inflows;
      this.outflows = decl.outflows;
    }

    @Override
    public Kind kind() {
      return Kind.STOCK;
    }

    @Override
    Variable withAst(Expr newAst) {
      return new Stock(decl, newAst, errors);
    }
  }

  /**
   * An auxiliary or flow with a graphical function. Its value is the function evaluated at the
   * value of its equation.
   */
  public static final class Table extends Variable {
    /** Ascending x coordinates. */
    public final ImmutableList<Double> x;

    public final ImmutableList<Double> y;

    private Table(Datamodel.Variable decl, ParseResult parsed) {
      this(decl, parsed.expr, errors(parsed));
    }

    private Table(Datamodel.Variable decl, @Nullable Expr ast, ImmutableList<String> errors) {
      super(decl, decl.ident(), ast, errors, IdentifierSetVisitor.identifiers(ast));
      Datamodel.GraphicalFunction gf = decl.gf;
      this.y = gf.yPoints;
      if (gf.xPoints != null) {
        this.x = gf.xPoints;
      } else {
        // Spread the points evenly over the x scale, inclusive at both ends.
        double min = (gf.xScale == null) ? 0 : gf.xScale.min;
        double max = (gf.xScale == null) ? 0 : gf.xScale.max;
        int n = y.size();
        ImmutableList.Builder<Double> xs = ImmutableList.builderWithExpectedSize(n);
        for (int i = 0; i < n; i++) {
          xs.add((n == 1) ? min : min + (max - min) * i / (n - 1));
        }
        this.x = xs.build();
      }
    }

    @Override
    public Kind kind() {
      return Kind.TABLE;
    }

    @Override
    Variable withAst(Expr newAst) {
      return new Table(decl, newAst, errors);
    }
  }

  /** An instance of another model, with some of its variables bound to ours. */
  public static final class Module extends Variable {
    /** The name of the instantiated model. */
    public final String modelName;

    /** The module's bound inputs, keyed by the name of the input within the module's model. */
    public final ImmutableMap<String, Reference> refs;

    private Module(Datamodel.Variable decl) {
      super(
          decl,
          decl.ident(),
          null,
          ImmutableList.of(),
          decl.connections.stream().map(c -> c.from).collect(ImmutableSet.toImmutableSet()));
      this.modelName = (decl.modelName != null) ? decl.modelName : decl.ident();
      ImmutableMap.Builder<String, Reference> builder = ImmutableMap.builder();
      for (Datamodel.Connection conn : decl.connections) {
        builder.put(conn.to, new Reference(conn));
      }
      this.refs = builder.buildOrThrow();
    }

    /** The implicit module that instantiates a project's {@code main} model. */
    static Module root() {
      return new Module(Datamodel.Variable.builder(Datamodel.Kind.MODULE, "main").build());
    }

    @Override
    public Kind kind() {
      return Kind.MODULE;
    }

    @Override
    Variable withAst(Expr newAst) {
      throw new IllegalStateException("modules have no equation");
    }
  }

  /** A module input, bound to a variable of the model containing the module. */
  public static final class Reference extends Variable {
    /** The identifier bound to this input; may be a dotted path or start with "{@code .}". */
    public final String ptr;

    private Reference(Datamodel.Connection conn) {
      super(null, conn.to, null, ImmutableList.of(), ImmutableSet.of(conn.from));
      this.ptr = conn.from;
    }

    @Override
    public Kind kind() {
      return Kind.REFERENCE;
    }

    @Override
    Variable withAst(Expr newAst) {
      throw new IllegalStateException("references have no equation");
    }
  }
}
