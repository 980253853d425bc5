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

import static java.util.Objects.requireNonNull;

import com.google.wscomp.ast.Span;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, if known.
 * @param span Source region of the error, or {@link Span#NONE}.
 * @param defaultLevel The level of the diagnostic type, before options are applied.
 */
public record WsError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    Span span,
    CheckLevel defaultLevel) {
  public WsError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(span, "span");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a WsError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static WsError make(DiagnosticType type, String... arguments) {
    return new WsError(type, type.format(arguments), null, Span.NONE, type.level);
  }

  /**
   * Creates a WsError at a given source location
   *
   * @param sourceName The source file name
   * @param span The region the error applies to
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static WsError make(
      @Nullable String sourceName, Span span, DiagnosticType type, String... arguments) {
    return new WsError(type, type.format(arguments), sourceName, span, type.level);
  }

  /** Formats the error as {@code source:span: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName);
      if (span.isKnown()) {
        b.append(':').append(span);
      }
      b.append(": ");
    }
    b.append(level).append(" - [").append(type.key).append("] ").append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}
