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
import org.stockflow.compiler.Builtins;
import org.stockflow.datamodel.Datamodel;
import org.stockflow.datamodel.Datamodel.Variable;

/**
 * The standard library: the models instantiated by calls to {@code smth1}, {@code smth3}, {@code
 * delay1}, {@code delay3} and {@code trend}. Each has the inputs {@code input}, {@code delay_time}
 * and {@code initial_value}, and its result in {@code output}.
 */
public final class Stdlib {

  private Stdlib() {}

  public static final ImmutableList<Datamodel.Model> MODELS =
      ImmutableList.of(smth1(), smth3(), delay1(), delay3(), trend());

  private static Datamodel.Model model(String name, Variable... variables) {
    return new Datamodel.Model(Builtins.STDLIB_PREFIX + name, variables);
  }

  private static Variable stock(String name, String initial, String inflow, String outflow) {
    Variable.Builder builder = Variable.builder(Datamodel.Kind.STOCK, name).equation(initial);
    if (!inflow.isEmpty()) {
      builder.inflows(inflow);
    }
    if (!outflow.isEmpty()) {
      builder.outflows(outflow);
    }
    return builder.build();
  }

  private static Datamodel.Model smth1() {
    return model(
        "smth1",
        Variable.aux("input", "0"),
        Variable.aux("delay_time", "1"),
        Variable.aux("initial_value", "input"),
        stock("output", "initial_value", "flow", ""),
        Variable.flow("flow", "(input - output) / delay_time"));
  }

  private static Datamodel.Model smth3() {
    return model(
        "smth3",
        Variable.aux("input", "0"),
        Variable.aux("delay_time", "1"),
        Variable.aux("initial_value", "input"),
        stock("stock_1", "initial_value", "flow_1", ""),
        Variable.flow("flow_1", "(input - stock_1) / (delay_time / 3)"),
        stock("stock_2", "initial_value", "flow_2", ""),
        Variable.flow("flow_2", "(stock_1 - stock_2) / (delay_time / 3)"),
        stock("output", "initial_value", "flow_3", ""),
        Variable.flow("flow_3", "(stock_2 - output) / (delay_time / 3)"));
  }

  private static Datamodel.Model delay1() {
    return model(
        "delay1",
        Variable.aux("input", "0"),
        Variable.aux("delay_time", "1"),
        Variable.aux("initial_value", "input"),
        stock("contents", "initial_value * delay_time", "input", "output"),
        Variable.flow("output", "contents / delay_time"));
  }

  private static Datamodel.Model delay3() {
    return model(
        "delay3",
        Variable.aux("input", "0"),
        Variable.aux("delay_time", "1"),
        Variable.aux("initial_value", "input"),
        stock("stock_1", "initial_value * delay_time / 3", "input", "flow_1"),
        Variable.flow("flow_1", "stock_1 / (delay_time / 3)"),
        stock("stock_2", "initial_value * delay_time / 3", "flow_1", "flow_2"),
        Variable.flow("flow_2", "stock_2 / (delay_time / 3)"),
        stock("stock_3", "initial_value * delay_time / 3", "flow_2", "output"),
        Variable.flow("output", "stock_3 / (delay_time / 3)"));
  }

  private static Datamodel.Model trend() {
    return model(
        "trend",
        Variable.aux("input", "0"),
        Variable.aux("delay_time", "1"),
        Variable.aux("initial_value", "0"),
        stock("average", "input / (1 + initial_value * delay_time)", "change_in_average", ""),
        Variable.flow("change_in_average", "(input - average) / delay_time"),
        Variable.aux("output", "safediv(input - average, abs(average) * delay_time)"));
  }
}
