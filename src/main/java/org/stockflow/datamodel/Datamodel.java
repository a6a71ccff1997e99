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

package org.stockflow.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Locale;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.stockflow.compiler.Canonical;

/**
 * The plain, declarative description of a project that the compiler consumes: models made of
 * variable declarations with their equations as source text, plus simulation specs. Instances are
 * produced by a reader (e.g. {@link ProjectJson}) or by the edit operations of {@code
 * org.stockflow.model}, and are never modified.
 */
public final class Datamodel {

  private Datamodel() {}

  /** Simulation parameters; a model may override its project's. */
  public static final class SimSpec {
    public static final SimSpec DEFAULT = new Builder().build();

    public final double start;
    public final double stop;

    /** The time step as declared; see {@link #effectiveDt}. */
    public final double dt;

    /** If true, {@link #dt} is the number of steps per time unit rather than the step size. */
    public final boolean dtIsReciprocal;

    /** The interval between saved results; zero means every step. */
    public final double saveStep;

    public final String method;
    public final @Nullable String timeUnits;

    private SimSpec(Builder builder) {
      this.start = builder.start;
      this.stop = builder.stop;
      this.dt = builder.dt;
      this.dtIsReciprocal = builder.dtIsReciprocal;
      this.saveStep = builder.saveStep;
      this.method = builder.method;
      this.timeUnits = builder.timeUnits;
    }

    /** The size of each time step. */
    public double effectiveDt() {
      return dtIsReciprocal ? 1 / dt : dt;
    }

    /** The interval between saved results. */
    public double effectiveSaveStep() {
      return (saveStep == 0) ? effectiveDt() : saveStep;
    }

    public static Builder builder() {
      return new Builder();
    }

    public Builder toBuilder() {
      return new Builder(this);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof SimSpec s)
          && start == s.start
          && stop == s.stop
          && dt == s.dt
          && dtIsReciprocal == s.dtIsReciprocal
          && saveStep == s.saveStep
          && method.equals(s.method)
          && Objects.equals(timeUnits, s.timeUnits);
    }

    @Override
    public int hashCode() {
      return Objects.hash(start, stop, dt, dtIsReciprocal, saveStep, method, timeUnits);
    }

    @Override
    public String toString() {
      return String.format(
          "SimSpec{start=%s, stop=%s, dt=%s%s, saveStep=%s, method=%s}",
          start, stop, dtIsReciprocal ? "1/" : "", dt, saveStep, method);
    }

    public static final class Builder {
      private double start = 0;
      private double stop = 1;
      private double dt = 1;
      private boolean dtIsReciprocal;
      private double saveStep;
      private String method = "euler";
      private @Nullable String timeUnits;

      private Builder() {}

      private Builder(SimSpec spec) {
        this.start = spec.start;
        this.stop = spec.stop;
        this.dt = spec.dt;
        this.dtIsReciprocal = spec.dtIsReciprocal;
        this.saveStep = spec.saveStep;
        this.method = spec.method;
        this.timeUnits = spec.timeUnits;
      }

      @CanIgnoreReturnValue
      public Builder start(double start) {
        this.start = start;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder stop(double stop) {
        this.stop = stop;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder dt(double dt) {
        this.dt = dt;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder dtIsReciprocal(boolean dtIsReciprocal) {
        this.dtIsReciprocal = dtIsReciprocal;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder saveStep(double saveStep) {
        this.saveStep = saveStep;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder method(String method) {
        this.method = method;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder timeUnits(@Nullable String timeUnits) {
        this.timeUnits = timeUnits;
        return this;
      }

      public SimSpec build() {
        Preconditions.checkArgument(dt > 0, "dt must be positive (was %s)", dt);
        Preconditions.checkArgument(saveStep >= 0, "saveStep must not be negative");
        return new SimSpec(this);
      }
    }
  }

  /** The kinds of variable that may be declared. */
  public enum Kind {
    STOCK,
    FLOW,
    AUX,
    MODULE;

    /** Returns the Kind with the given (case-insensitive) name. */
    public static Kind parse(String name) {
      return Kind.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
  }

  /** The x-axis range of a graphical function. */
  public static final class Scale {
    public final double min;
    public final double max;

    public Scale(double min, double max) {
      this.min = min;
      this.max = max;
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Scale s) && min == s.min && max == s.max;
    }

    @Override
    public int hashCode() {
      return Objects.hash(min, max);
    }
  }

  /**
   * A graphical function (lookup table). Either the x points are given explicitly (one per y
   * point), or the y points are spread evenly over {@link #xScale}.
   */
  public static final class GraphicalFunction {
    public final @Nullable ImmutableList<Double> xPoints;
    public final ImmutableList<Double> yPoints;
    public final @Nullable Scale xScale;

    public GraphicalFunction(
        @Nullable ImmutableList<Double> xPoints,
        ImmutableList<Double> yPoints,
        @Nullable Scale xScale) {
      Preconditions.checkArgument(
          xPoints == null || xPoints.size() == yPoints.size(),
          "%s x points but %s y points",
          (xPoints == null) ? 0 : xPoints.size(),
          yPoints.size());
      this.xPoints = xPoints;
      this.yPoints = yPoints;
      this.xScale = xScale;
    }

    /** Returns a table with the given points. */
    public static GraphicalFunction of(
        ImmutableList<Double> xPoints, ImmutableList<Double> yPoints) {
      return new GraphicalFunction(xPoints, yPoints, null);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof GraphicalFunction gf)
          && Objects.equals(xPoints, gf.xPoints)
          && yPoints.equals(gf.yPoints)
          && Objects.equals(xScale, gf.xScale);
    }

    @Override
    public int hashCode() {
      return Objects.hash(xPoints, yPoints, xScale);
    }
  }

  /**
   * Binds one input of a module ({@link #to}, a variable of the module's model) to a variable of
   * the model containing the module ({@link #from}). A {@code from} that starts with "{@code .}"
   * is resolved in the root model instead. Both are canonical.
   */
  public static final class Connection {
    public final String from;
    public final String to;

    public Connection(String from, String to) {
      this.from = Canonical.canonicalize(from);
      this.to = Canonical.canonicalize(to);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Connection c) && from.equals(c.from) && to.equals(c.to);
    }

    @Override
    public int hashCode() {
      return Objects.hash(from, to);
    }

    @Override
    public String toString() {
      return from + " -> " + to;
    }
  }

  /** A declared variable. */
  public static final class Variable {
    public final Kind kind;

    /** The name as displayed; {@link #ident} is its canonical form. */
    public final String name;

    /** The equation source, or null if none has been given. */
    public final @Nullable String equation;

    public final @Nullable String units;

    /** Canonical names of a stock's inflows; empty for other kinds. */
    public final ImmutableList<String> inflows;

    public final ImmutableList<String> outflows;
    public final @Nullable GraphicalFunction gf;

    /** The model instantiated by a module; if null, the module's own name is used. */
    public final @Nullable String modelName;

    public final ImmutableList<Connection> connections;

    private Variable(Builder builder) {
      this.kind = builder.kind;
      this.name = builder.name;
      this.equation = builder.equation;
      this.units = builder.units;
      this.inflows = canonicalize(builder.inflows);
      this.outflows = canonicalize(builder.outflows);
      this.gf = builder.gf;
      this.modelName = builder.modelName;
      this.connections = builder.connections;
    }

    private static ImmutableList<String> canonicalize(ImmutableList<String> names) {
      return names.stream().map(Canonical::canonicalize).collect(ImmutableList.toImmutableList());
    }

    public String ident() {
      return Canonical.canonicalize(name);
    }

    public static Builder builder(Kind kind, String name) {
      return new Builder(kind, name);
    }

    public static Variable stock(String name, String equation, String... inflows) {
      return builder(Kind.STOCK, name).equation(equation).inflows(inflows).build();
    }

    public static Variable flow(String name, String equation) {
      return builder(Kind.FLOW, name).equation(equation).build();
    }

    public static Variable aux(String name, String equation) {
      return builder(Kind.AUX, name).equation(equation).build();
    }

    public static Variable module(String name, String modelName, Connection... connections) {
      return builder(Kind.MODULE, name)
          .modelName(modelName)
          .connections(ImmutableList.copyOf(connections))
          .build();
    }

    public Builder toBuilder() {
      return new Builder(this);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Variable v)
          && kind == v.kind
          && name.equals(v.name)
          && Objects.equals(equation, v.equation)
          && Objects.equals(units, v.units)
          && inflows.equals(v.inflows)
          && outflows.equals(v.outflows)
          && Objects.equals(gf, v.gf)
          && Objects.equals(modelName, v.modelName)
          && connections.equals(v.connections);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, name, equation, inflows, outflows, gf, modelName, connections);
    }

    @Override
    public String toString() {
      return kind + " " + name + ((equation == null) ? "" : " = " + equation);
    }

    public static final class Builder {
      private Kind kind;
      private String name;
      private @Nullable String equation;
      private @Nullable String units;
      private ImmutableList<String> inflows = ImmutableList.of();
      private ImmutableList<String> outflows = ImmutableList.of();
      private @Nullable GraphicalFunction gf;
      private @Nullable String modelName;
      private ImmutableList<Connection> connections = ImmutableList.of();

      private Builder(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
      }

      private Builder(Variable v) {
        this.kind = v.kind;
        this.name = v.name;
        this.equation = v.equation;
        this.units = v.units;
        this.inflows = v.inflows;
        this.outflows = v.outflows;
        this.gf = v.gf;
        this.modelName = v.modelName;
        this.connections = v.connections;
      }

      @CanIgnoreReturnValue
      public Builder name(String name) {
        this.name = name;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder equation(@Nullable String equation) {
        this.equation = equation;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder units(@Nullable String units) {
        this.units = units;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder inflows(String... inflows) {
        return inflows(ImmutableList.copyOf(inflows));
      }

      @CanIgnoreReturnValue
      public Builder inflows(ImmutableList<String> inflows) {
        this.inflows = inflows;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder outflows(String... outflows) {
        return outflows(ImmutableList.copyOf(outflows));
      }

      @CanIgnoreReturnValue
      public Builder outflows(ImmutableList<String> outflows) {
        this.outflows = outflows;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder gf(@Nullable GraphicalFunction gf) {
        this.gf = gf;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder modelName(@Nullable String modelName) {
        this.modelName = modelName;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder connections(ImmutableList<Connection> connections) {
        this.connections = connections;
        return this;
      }

      public Variable build() {
        Preconditions.checkArgument(!Canonical.canonicalize(name).isEmpty(), "empty name");
        Preconditions.checkArgument(
            kind == Kind.STOCK || (inflows.isEmpty() && outflows.isEmpty()),
            "only stocks have inflows or outflows (%s)",
            name);
        return new Variable(this);
      }
    }
  }

  /** A named collection of variable declarations. */
  public static final class Model {
    public final String name;
    public final ImmutableList<Variable> variables;

    /** If non-null, overrides the project's SimSpec when this model is simulated. */
    public final @Nullable SimSpec simSpec;

    public Model(String name, ImmutableList<Variable> variables, @Nullable SimSpec simSpec) {
      this.name = name;
      this.variables = variables;
      this.simSpec = simSpec;
    }

    public Model(String name, Variable... variables) {
      this(name, ImmutableList.copyOf(variables), null);
    }

    /** The canonical name of this model; an unnamed model is "{@code main}". */
    public String ident() {
      return name.isEmpty() ? "main" : Canonical.canonicalize(name);
    }

    /** Returns the declaration with the given canonical identifier, or null. */
    public @Nullable Variable variable(String ident) {
      return variables.stream().filter(v -> v.ident().equals(ident)).findFirst().orElse(null);
    }

    public Model withVariables(ImmutableList<Variable> newVariables) {
      return new Model(name, newVariables, simSpec);
    }

    public Model withSimSpec(@Nullable SimSpec newSimSpec) {
      return new Model(name, variables, newSimSpec);
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Model m)
          && name.equals(m.name)
          && variables.equals(m.variables)
          && Objects.equals(simSpec, m.simSpec);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, variables, simSpec);
    }
  }

  /** A set of models and the default simulation spec. */
  public static final class Project {
    public final String name;
    public final SimSpec simSpec;
    public final ImmutableList<Model> models;

    public Project(String name, SimSpec simSpec, ImmutableList<Model> models) {
      this.name = name;
      this.simSpec = simSpec;
      this.models = models;
    }

    public Project(String name, SimSpec simSpec, Model... models) {
      this(name, simSpec, ImmutableList.copyOf(models));
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof Project p)
          && name.equals(p.name)
          && simSpec.equals(p.simSpec)
          && models.equals(p.models);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, simSpec, models);
    }
  }
}
