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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Compilation results */
public class Result {
  public final boolean success;
  public final ImmutableList<WsError> errors;
  public final ImmutableList<WsError> warnings;

  /** Graphs of the declarations that could be lowered. */
  public final ControlFlowMap controlFlowMap;

  /** Generated code of each lowered declaration, in declaration order. */
  public final ImmutableList<String> definitions;

  Result(
      ImmutableList<WsError> errors,
      ImmutableList<WsError> warnings,
      ControlFlowMap controlFlowMap,
      ImmutableList<String> definitions) {
    this.success = errors.isEmpty();
    this.errors = errors;
    this.warnings = warnings;
    this.controlFlowMap = controlFlowMap;
    this.definitions = definitions;
  }

  /** Returns the generated definitions separated by blank lines. */
  public String getCode() {
    return Joiner.on('\n').join(definitions);
  }
}
