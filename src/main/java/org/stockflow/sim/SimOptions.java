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

import java.util.Locale;
import org.stockflow.code.Backend;

/**
 * Settings that aren't part of a project, read from system properties:
 *
 * <ul>
 *   <li>{@code stockflow.backend}: {@code bytecode} (the default) or {@code interpreted}
 *   <li>{@code stockflow.delim}: the column delimiter used by {@link Simulation#csv} callers that
 *       don't choose one (default {@code ","})
 * </ul>
 */
public final class SimOptions {
  public static final String BACKEND_PROPERTY = "stockflow.backend";
  public static final String DELIM_PROPERTY = "stockflow.delim";

  public final Backend backend;
  public final String delim;

  public SimOptions(Backend backend, String delim) {
    this.backend = backend;
    this.delim = delim;
  }

  /**
   * Returns the options given by the current system properties.
   *
   * @throws IllegalArgumentException if {@code stockflow.backend} names an unknown backend
   */
  public static SimOptions fromSystemProperties() {
    String backend = System.getProperty(BACKEND_PROPERTY, "bytecode");
    String delim = System.getProperty(DELIM_PROPERTY, ",");
    return new SimOptions(Backend.valueOf(backend.trim().toUpperCase(Locale.ROOT)), delim);
  }

  @Override
  public String toString() {
    return String.format("SimOptions{backend=%s, delim=\"%s\"}", backend, delim);
  }
}
