/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.wscomp;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Compiler options */
public class CompilerOptions implements Serializable {

  /** Default limit on how deeply blocks and if statements may nest in one body. */
  public static final int DEFAULT_MAX_CONTROL_FLOW_NESTING_DEPTH = 128;

  private int maxControlFlowNestingDepth = DEFAULT_MAX_CONTROL_FLOW_NESTING_DEPTH;

  /** Whether if statements whose condition folds to a boolean keep only the taken branch. */
  private boolean foldConstantConditions = true;

  private CheckLevel unreachableCodeLevel = CheckLevel.WARNING;

  /** Whether every finished graph is checked for structural consistency. */
  private boolean validateControlFlowGraphs = true;

  private String sourceName = "input.ws";

  public CompilerOptions() {}

  public int getMaxControlFlowNestingDepth() {
    return maxControlFlowNestingDepth;
  }

  public void setMaxControlFlowNestingDepth(int depth) {
    checkArgument(depth > 0, "nesting depth must be positive: %s", depth);
    this.maxControlFlowNestingDepth = depth;
  }

  public boolean getFoldConstantConditions() {
    return foldConstantConditions;
  }

  public void setFoldConstantConditions(boolean foldConstantConditions) {
    this.foldConstantConditions = foldConstantConditions;
  }

  public CheckLevel getUnreachableCodeLevel() {
    return unreachableCodeLevel;
  }

  /** Sets the level at which unreachable code is reported. {@code OFF} skips the check. */
  public void setUnreachableCodeLevel(CheckLevel level) {
    this.unreachableCodeLevel = level;
  }

  public boolean getValidateControlFlowGraphs() {
    return validateControlFlowGraphs;
  }

  public void setValidateControlFlowGraphs(boolean validateControlFlowGraphs) {
    this.validateControlFlowGraphs = validateControlFlowGraphs;
  }

  public String getSourceName() {
    return sourceName;
  }

  public void setSourceName(String sourceName) {
    this.sourceName = sourceName;
  }
}
