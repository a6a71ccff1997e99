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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Owns a {@link Simulation} and carries out {@link Request}s on it, one at a time. A SimWorker is
 * only ever used from the single thread that {@link Sim} gives it.
 */
final class SimWorker {

  private static final Logger logger = LogManager.getLogger();

  /** The operations a {@link Request} may ask for. */
  enum Command {
    RESET,
    SET_VALUE,
    VALUE,
    SERIES,
    RUN_TO,
    RUN_TO_END,
    VAR_NAMES,
    DOMINANCE
  }

  /** A message from the driver to the worker. */
  static final class Request {
    final long seq;
    final Command command;
    final ImmutableList<Object> args;

    Request(long seq, Command command, ImmutableList<Object> args) {
      this.seq = seq;
      this.command = command;
      this.args = args;
    }

    Object arg(int i) {
      Preconditions.checkArgument(i < args.size(), "%s: missing argument %s", command, i);
      return args.get(i);
    }

    @Override
    public String toString() {
      return String.format("#%s %s%s", seq, command, args);
    }
  }

  /** The worker's answer to a {@link Request}; exactly one of result and error is non-null. */
  static final class Reply {
    final long seq;
    final @Nullable Object result;
    final @Nullable Throwable error;

    private Reply(long seq, @Nullable Object result, @Nullable Throwable error) {
      this.seq = seq;
      this.result = result;
      this.error = error;
    }

    static Reply success(long seq, Object result) {
      return new Reply(seq, result, null);
    }

    static Reply failure(long seq, Throwable error) {
      return new Reply(seq, null, error);
    }

    @Override
    public String toString() {
      return "#" + seq + ((error != null) ? " failed: " + error : " " + result);
    }
  }

  private final Simulation simulation;

  SimWorker(Simulation simulation) {
    this.simulation = simulation;
  }

  Simulation simulation() {
    return simulation;
  }

  /** Carries out the request. Never throws; a failure is returned as the reply's error. */
  Reply handle(Request request) {
    try {
      return Reply.success(request.seq, execute(request));
    } catch (RuntimeException e) {
      logger.debug("{} failed", request, e);
      return Reply.failure(request.seq, e);
    }
  }

  @SuppressWarnings("unchecked")
  private Object execute(Request request) {
    switch (request.command) {
      case RESET:
        simulation.reset();
        return simulation.time();
      case SET_VALUE:
        simulation.setValue((String) request.arg(0), (Double) request.arg(1));
        return simulation.time();
      case VALUE:
        return values((List<String>) request.arg(0));
      case SERIES:
        return series((List<String>) request.arg(0));
      case RUN_TO:
        return simulation.runTo((Double) request.arg(0));
      case RUN_TO_END:
        return simulation.runToEnd();
      case VAR_NAMES:
        return simulation.varNames((Boolean) request.arg(0));
      case DOMINANCE:
        return simulation.dominance(
            (Map<String, Double>) request.arg(0), (List<String>) request.arg(1));
    }
    throw new AssertionError(request.command);
  }

  private ImmutableMap<String, Double> values(List<String> names) {
    Map<String, Double> result = new LinkedHashMap<>();
    for (String name : names) {
      if (simulation.root().offsetOf(name) < 0) {
        logger.warn("value: unknown variable {}", name);
      } else {
        result.put(name, simulation.value(name));
      }
    }
    return ImmutableMap.copyOf(result);
  }

  private ImmutableMap<String, Series> series(List<String> names) {
    Map<String, Series> result = new LinkedHashMap<>();
    for (String name : names) {
      Series series = simulation.series(name);
      if (series == null) {
        logger.warn("series: unknown variable {}", name);
      } else {
        result.put(name, series);
      }
    }
    return ImmutableMap.copyOf(result);
  }
}
