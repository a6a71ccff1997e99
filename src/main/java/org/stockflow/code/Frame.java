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

package org.stockflow.code;

import java.util.Arrays;

/**
 * The runtime state of one module instance: where its variables live in the shared state array,
 * where each of its references points, and the frames of its child modules.
 *
 * <p>Generated code reads {@link #base} and {@link #refs} directly, and calls child modules through
 * {@link #initialsOf}, {@link #flowsOf} and {@link #stocksOf}; the subclass is responsible for
 * filling these in (through the protected setters) before the first step is run.
 */
public abstract class Frame {

  /** The offset of this instance's first local in the state array. */
  int base;

  /**
   * The absolute offset in the state array of each of this instance's references, in the order of
   * {@code ModelClass.refNames}.
   */
  int[] refs = new int[0];

  Frame[] children = new Frame[0];

  private StepFunctions fns;

  protected Frame() {}

  protected void setBase(int base) {
    this.base = base;
  }

  protected int base() {
    return base;
  }

  protected void setFunctions(StepFunctions fns) {
    this.fns = fns;
  }

  /** Allocates the refs, each initially -1 (unresolved). */
  protected void setNumRefs(int numRefs) {
    refs = new int[numRefs];
    Arrays.fill(refs, -1);
  }

  protected void setRef(int index, int offset) {
    refs[index] = offset;
  }

  protected int ref(int index) {
    return refs[index];
  }

  protected void setChildren(Frame[] children) {
    this.children = children;
  }

  public final void calcInitials(double[] curr, double dt) {
    fns.calcInitials(this, curr, dt);
  }

  public final void calcFlows(double[] curr, double dt) {
    fns.calcFlows(this, curr, dt);
  }

  public final void calcStocks(double[] curr, double[] next, double dt) {
    fns.calcStocks(this, curr, next, dt);
  }

  public final void initialsOf(int child, double[] curr, double dt) {
    children[child].calcInitials(curr, dt);
  }

  public final void flowsOf(int child, double[] curr, double dt) {
    children[child].calcFlows(curr, dt);
  }

  public final void stocksOf(int child, double[] curr, double[] next, double dt) {
    children[child].calcStocks(curr, next, dt);
  }
}
