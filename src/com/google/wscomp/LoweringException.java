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

import com.google.wscomp.ast.Span;

/**
 * Thrown when a function or component body cannot be lowered to a control flow graph. The
 * compiler reports it as a diagnostic and moves on to the next declaration.
 */
public final class LoweringException extends RuntimeException {
  private final DiagnosticType type;
  private final Span span;
  private final String[] arguments;

  public LoweringException(DiagnosticType type, Span span, String... arguments) {
    super(type.format(arguments));
    this.type = type;
    this.span = span;
    this.arguments = arguments.clone();
  }

  public DiagnosticType getType() {
    return type;
  }

  public Span getSpan() {
    return span;
  }

  WsError toError(String sourceName) {
    return WsError.make(sourceName, span, type, arguments);
  }
}
