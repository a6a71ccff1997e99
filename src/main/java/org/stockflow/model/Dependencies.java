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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Computes which variables of one model must be computed before each other, within either the
 * initial phase or the flow phase (as given by the {@link Context}).
 *
 * <p>Only the first component of a dotted identifier matters (a reference to {@code m.x} is a
 * dependency on module {@code m}), with one exception: in the flow phase a reference to a stock
 * inside a module doesn't depend on the module, since stock values are known before any flows are
 * computed. For the same reason, in the flow phase a stock never depends on anything.
 */
public final class Dependencies {

  /** Identifiers that aren't variables. */
  private static final ImmutableSet<String> SPECIAL = ImmutableSet.of("time", "dt");

  private final Context ctx;
  private final Map<String, ImmutableSet<String>> direct = new HashMap<>();

  public Dependencies(Context ctx) {
    this.ctx = ctx;
  }

  /**
   * Returns the identifiers of the variables in the context's innermost model that {@code v}
   * refers to directly.
   */
  public ImmutableSet<String> direct(Variable v) {
    ImmutableSet<String> result = direct.get(v.ident);
    if (result == null) {
      result = computeDirect(v);
      direct.put(v.ident, result);
    }
    return result;
  }

  private ImmutableSet<String> computeDirect(Variable v) {
    if (!ctx.isInitials && v instanceof Variable.Stock) {
      return ImmutableSet.of();
    }
    Model model = ctx.parent();
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (String ident : v.deps) {
      if (ident.startsWith(".")) {
        if (!ctx.isRoot()) {
          // Resolved at runtime from the root; nothing to order here.
          continue;
        }
        ident = ident.substring(1);
      }
      int dot = ident.indexOf('.');
      String first = (dot < 0) ? ident : ident.substring(0, dot);
      if (SPECIAL.contains(first) || first.equals(v.ident)) {
        continue;
      }
      Variable dep = model.vars.get(first);
      if (dep == null) {
        continue;
      }
      if (!ctx.isInitials) {
        if (dep instanceof Variable.Stock) {
          continue;
        } else if (dot >= 0 && ctx.lookup(ident) instanceof Variable.Stock) {
          continue;
        }
      }
      result.add(first);
    }
    return result.build();
  }

  /** Returns every variable that {@code v} depends on, directly or indirectly. */
  public ImmutableSet<String> transitive(Variable v) {
    Set<String> result = new LinkedHashSet<>();
    Deque<Variable> pending = new ArrayDeque<>();
    pending.add(v);
    while (!pending.isEmpty()) {
      for (String dep : direct(pending.removeFirst())) {
        if (!dep.equals(v.ident) && result.add(dep)) {
          pending.add(ctx.parent().vars.get(dep));
        }
      }
    }
    return ImmutableSet.copyOf(result);
  }
}
