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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.stockflow.code.CodeValue;
import org.stockflow.code.LookupTable;
import org.stockflow.code.Op;
import org.stockflow.compiler.Builtins;
import org.stockflow.compiler.CompileError;
import org.stockflow.compiler.Expr;
import org.stockflow.model.Model;
import org.stockflow.model.Variable;

/**
 * Translates equations of one model class into {@link CodeValue}s. Identifiers are resolved, in
 * order, as
 *
 * <ul>
 *   <li>{@code time};
 *   <li>{@code dt}, unless the model declares a variable of that name;
 *   <li>a path starting with "{@code .}", which is resolved from the root instance at runtime;
 *   <li>one of the class's locals;
 *   <li>one of the class's bound inputs;
 *   <li>a dotted path into one of the class's modules, resolved at runtime.
 * </ul>
 *
 * Anything else is a {@link CompileError}.
 */
final class EquationCompiler implements Expr.Visitor<CodeValue> {

  private final Model model;
  private final ImmutableMap<String, Integer> offsets;

  /** Each name that will be resolved at runtime, with its index in the instance's refs. */
  private final Map<String, Integer> refs = new LinkedHashMap<>();

  private final Map<String, LookupTable> tables = new HashMap<>();

  EquationCompiler(Model model, ImmutableMap<String, Integer> offsets, Iterable<String> inputs) {
    this.model = model;
    this.offsets = offsets;
    for (String input : inputs) {
      refIndex(input);
    }
  }

  /** The names of the refs allocated so far, in index order. */
  ImmutableList<String> refNames() {
    return ImmutableList.copyOf(refs.keySet());
  }

  /** Returns the code to compute {@code v}'s equation; {@code v} must have one. */
  CodeValue compile(Variable v) {
    if (v.ast == null) {
      throw new CompileError("no equation", model.ident, v.ident);
    }
    try {
      return v.ast.walk(this);
    } catch (CompileError e) {
      throw e.in(model.ident, v.ident);
    }
  }

  /** Returns the code for a Table variable: its graphical function applied to its equation. */
  CodeValue compileTable(Variable.Table v) {
    return new CodeValue.Lookup(table(v.ident), compile(v));
  }

  /** Returns the value of a (possibly dotted) identifier. */
  CodeValue resolve(String name) {
    if (name.equals("time")) {
      return CodeValue.TIME;
    } else if (name.equals("dt") && !offsets.containsKey(name)) {
      return CodeValue.DT;
    } else if (name.startsWith(".")) {
      return new CodeValue.Ref(refIndex(name), name);
    }
    Integer offset = offsets.get(name);
    if (offset != null) {
      return new CodeValue.Local(offset, name);
    } else if (refs.containsKey(name) || name.indexOf('.') > 0) {
      return new CodeValue.Ref(refIndex(name), name);
    }
    throw CompileError.of("unknown variable %s", name);
  }

  private int refIndex(String name) {
    return refs.computeIfAbsent(name, k -> refs.size());
  }

  private LookupTable table(String name) {
    LookupTable result = tables.get(name);
    if (result == null) {
      Variable.Table v = model.tables.get(name);
      if (v == null) {
        throw CompileError.of("unknown table %s", name);
      }
      result = new LookupTable(model.ident + "." + name, v.x, v.y);
      tables.put(name, result);
    }
    return result;
  }

  @Override
  public CodeValue visitIdent(Expr.Ident n) {
    return resolve(n.name);
  }

  @Override
  public CodeValue visitTable(Expr.Table n) {
    throw CompileError.of("table %s can only be used as the first argument of lookup()", n.name);
  }

  @Override
  public CodeValue visitConstant(Expr.Constant n) {
    return CodeValue.of(n.value);
  }

  @Override
  public CodeValue visitCall(Expr.Call n) {
    String fn = n.fn.name;
    Builtins.Builtin builtin = Builtins.primitive(fn);
    if (builtin == null) {
      throw CompileError.of("unknown function %s", fn);
    }
    builtin.checkArity(n.args.size());
    if (fn.equals("lookup")) {
      Expr tableArg = n.args.get(0);
      String tableName;
      if (tableArg instanceof Expr.Name name) {
        tableName = name.name;
      } else {
        throw CompileError.of("the first argument of lookup() must be a table, not %s", tableArg);
      }
      return new CodeValue.Lookup(table(tableName), n.args.get(1).walk(this));
    }
    ImmutableList.Builder<CodeValue> args = ImmutableList.builder();
    if (builtin.usesTime) {
      args.add(CodeValue.DT, CodeValue.TIME);
    }
    n.args.forEach(arg -> args.add(arg.walk(this)));
    ImmutableList<CodeValue> argValues = args.build();
    Op op = Op.builtin(fn, argValues.size());
    if (op == null) {
      throw CompileError.of("%s() can't be called with %s arguments", fn, n.args.size());
    }
    return new CodeValue.Call(op, argValues);
  }

  @Override
  public CodeValue visitIf(Expr.If n) {
    return new CodeValue.Cond(n.cond.walk(this), n.ifTrue.walk(this), n.ifFalse.walk(this));
  }

  @Override
  public CodeValue visitParen(Expr.Paren n) {
    return n.inner.walk(this);
  }

  @Override
  public CodeValue visitUnary(Expr.Unary n) {
    CodeValue operand = n.operand.walk(this);
    switch (n.op) {
      case "+":
        return operand;
      case "-":
        return new CodeValue.Call(Op.NEGATE, operand);
      case "!":
        return new CodeValue.Call(Op.NOT, operand);
      default:
        throw CompileError.of("unknown unary operator %s", n.op);
    }
  }

  @Override
  public CodeValue visitBinary(Expr.Binary n) {
    if (n.op.equals("=") || n.op.equals("≠")) {
      // Nothing is equal to NaN, so comparisons with the literal nan test for it instead.
      @Nullable Expr other = isNaN(n.right) ? n.left : isNaN(n.left) ? n.right : null;
      if (other != null) {
        CodeValue test = new CodeValue.Call(Op.IS_NAN, other.walk(this));
        return n.op.equals("=") ? test : new CodeValue.Call(Op.NOT, test);
      }
    }
    Op op = Op.binary(n.op);
    if (op == null) {
      throw CompileError.of("unknown binary operator %s", n.op);
    }
    return new CodeValue.Call(op, n.left.walk(this), n.right.walk(this));
  }

  private static boolean isNaN(Expr e) {
    return e instanceof Expr.Constant c && Double.isNaN(c.value);
  }
}
