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

import com.google.common.collect.ImmutableList;

/** The error handler used during compilation. */
public interface ErrorManager {

  /**
   * Reports an error. The level of the error is given separately from its type so that options
   * can promote or demote it.
   */
  void report(CheckLevel level, WsError error);

  /** Writes a report of all errors and warnings collected so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<WsError> getErrors();

  ImmutableList<WsError> getWarnings();

  /** Whether an error that was an error by default, rather than by promotion, was reported. */
  boolean hasHaltingErrors();
}
