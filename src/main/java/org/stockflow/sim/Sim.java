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
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stockflow.code.Backend;
import org.stockflow.model.Project;
import org.stockflow.sim.SimWorker.Command;
import org.stockflow.sim.SimWorker.Reply;
import org.stockflow.sim.SimWorker.Request;

/**
 * An asynchronous handle on a {@link Simulation}. The simulation is owned by a {@link SimWorker}
 * running on its own thread; each operation posts a request to the worker and returns a future
 * that is completed with the worker's reply. Requests are carried out in the order they were
 * posted.
 *
 * <p>After {@link #close} any requests that have not been carried out are abandoned (their futures
 * never complete) and new requests fail immediately.
 */
public final class Sim implements AutoCloseable {

  private static final Logger logger = LogManager.getLogger();

  private final SimWorker worker;
  private final ExecutorService executor;
  private final AtomicLong nextSeq = new AtomicLong(1);

  /** The futures of requests that have been posted but not yet answered, keyed by seq. */
  private final Map<Long, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();

  private volatile boolean closed;

  public Sim(Simulation simulation) {
    this.worker = new SimWorker(simulation);
    this.executor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("sim-worker-%d").setDaemon(true).build());
  }

  /**
   * Compiles the project and starts a worker for it.
   *
   * @throws org.stockflow.compiler.CompileError if the project can't be compiled
   */
  public static Sim start(Project project) {
    return new Sim(SimBuilder.build(project));
  }

  public static Sim start(Project project, Backend backend) {
    return new Sim(SimBuilder.build(project, backend));
  }

  @SuppressWarnings("unchecked")
  private <T> CompletableFuture<T> post(Command command, Object... args) {
    if (closed) {
      return CompletableFuture.failedFuture(new IllegalStateException("Sim is closed"));
    }
    long seq = nextSeq.getAndIncrement();
    CompletableFuture<Object> future = new CompletableFuture<>();
    pending.put(seq, future);
    Request request = new Request(seq, command, ImmutableList.copyOf(args));
    try {
      executor.execute(() -> deliver(worker.handle(request)));
    } catch (RejectedExecutionException e) {
      pending.remove(seq);
      future.completeExceptionally(new IllegalStateException("Sim is closed", e));
    }
    return (CompletableFuture<T>) future;
  }

  private void deliver(Reply reply) {
    CompletableFuture<Object> future = pending.remove(reply.seq);
    if (future == null) {
      logger.warn("No request waiting for reply {}", reply);
    } else if (reply.error != null) {
      future.completeExceptionally(reply.error);
    } else {
      future.complete(reply.result);
    }
  }

  /** The number of requests that have been posted but not yet answered. */
  public int numPending() {
    return pending.size();
  }

  /** Discards all results and recomputes the initial state; completes with the start time. */
  public CompletableFuture<Double> reset() {
    return post(Command.RESET);
  }

  /** Overrides the current value of a variable; completes with the current time. */
  public CompletableFuture<Double> setValue(String name, double value) {
    return post(Command.SET_VALUE, name, value);
  }

  /** Completes with the current value of each named variable; unknown names are omitted. */
  public CompletableFuture<ImmutableMap<String, Double>> value(String... names) {
    return post(Command.VALUE, ImmutableList.copyOf(names));
  }

  /** Completes with the saved results of each named variable; unknown names are omitted. */
  public CompletableFuture<ImmutableMap<String, Series>> series(String... names) {
    return series(ImmutableList.copyOf(names));
  }

  public CompletableFuture<ImmutableMap<String, Series>> series(List<String> names) {
    return post(Command.SERIES, ImmutableList.copyOf(names));
  }

  /** Steps until the current time is after {@code time}; completes with the new current time. */
  public CompletableFuture<Double> runTo(double time) {
    return post(Command.RUN_TO, time);
  }

  public CompletableFuture<Double> runToEnd() {
    return post(Command.RUN_TO_END);
  }

  public CompletableFuture<ImmutableList<String>> varNames(boolean includeHidden) {
    return post(Command.VAR_NAMES, includeHidden);
  }

  public CompletableFuture<ImmutableList<String>> varNames() {
    return varNames(false);
  }

  /** See {@link Simulation#dominance}. */
  public CompletableFuture<ImmutableMap<String, Double>> dominance(
      Map<String, Double> overrides, List<String> indicators) {
    return post(
        Command.DOMINANCE, ImmutableMap.copyOf(overrides), ImmutableList.copyOf(indicators));
  }

  /** Completes with the saved results of every (non-hidden) variable, formatted by {@link Csv}. */
  public CompletableFuture<String> csv(String delim) {
    return varNames()
        .thenCompose(
            names ->
                series(names)
                    .thenApply(
                        data -> {
                          List<Series> columns = new ArrayList<>();
                          for (String name : names) {
                            Series s = data.get(name);
                            if (s != null) {
                              columns.add(s);
                            }
                          }
                          return Csv.format(columns, delim);
                        }));
  }

  public CompletableFuture<String> csv() {
    return csv(",");
  }

  /** Stops the worker. */
  @Override
  public void close() {
    closed = true;
    List<Runnable> dropped = executor.shutdownNow();
    if (!dropped.isEmpty()) {
      logger.debug("Sim closed with {} requests outstanding", dropped.size());
    }
  }

  @Override
  public String toString() {
    return String.format("Sim{%s, pending=%s}", worker.simulation().root(), pending.size());
  }
}
