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
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that collects and sorts the errors and warnings reported to it. Subclasses
 * decide how the report is printed by implementing {@link #println} and {@link #printSummary}.
 *
 * <p>Messages are ordered by source name, then source position, then level and description.
 * Reporting the same message twice has no effect.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private static final Comparator<ErrorWithLevel> ORDER =
      Comparator.<ErrorWithLevel, String>comparing(
              e -> e.error().sourceName(), Comparator.nullsFirst(Comparator.naturalOrder()))
          .thenComparingInt(e -> e.error().span().start())
          .thenComparing(ErrorWithLevel::level)
          .thenComparing(e -> e.error().type())
          .thenComparing(e -> e.error().description());

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(ORDER);
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, WsError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        if (error.defaultLevel() == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<WsError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<WsError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<WsError> toList(CheckLevel level) {
    ImmutableList.Builder<WsError> errors = ImmutableList.builder();
    for (ErrorWithLevel e : messages) {
      if (e.level() == level) {
        errors.add(e.error());
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level(), message.error());
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the
   * {@link #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, WsError error);

  /** Print the summary of the compilation - number of errors and warnings. */
  protected abstract void printSummary();

  private record ErrorWithLevel(WsError error, CheckLevel level) {}
}
