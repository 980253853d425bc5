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

package com.google.wscomp.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * The declaration a name resolves to. Produced by name resolution, which runs before control flow
 * analysis; the engine only reads bindings.
 *
 * @param kind what kind of declaration introduced the name
 * @param name the source name
 * @param declaration the declaring {@code let} or {@code state} statement, if any
 * @param value the value expression of a {@code const}, if any
 */
public record Binding(
    Kind kind, String name, @Nullable StatementId declaration, @Nullable ExpressionId value) {

  /** Kinds of declarations. */
  public enum Kind {
    LET,
    STATE,
    CONST,
    PARAMETER,
    FUNCTION,
    GLOBAL
  }

  public Binding {
    requireNonNull(kind, "kind");
    requireNonNull(name, "name");
    checkArgument(
        declaration == null || kind == Kind.LET || kind == Kind.STATE,
        "only let and state bindings have a declaring statement: %s",
        name);
    checkArgument(value == null || kind == Kind.CONST, "only consts carry a value: %s", name);
  }

  public static Binding let(String name, StatementId declaration) {
    return new Binding(Kind.LET, name, declaration, null);
  }

  public static Binding state(String name, StatementId declaration) {
    return new Binding(Kind.STATE, name, declaration, null);
  }

  public static Binding constant(String name, ExpressionId value) {
    return new Binding(Kind.CONST, name, null, value);
  }

  public static Binding parameter(String name) {
    return new Binding(Kind.PARAMETER, name, null, null);
  }

  public static Binding function(String name) {
    return new Binding(Kind.FUNCTION, name, null, null);
  }

  public static Binding global(String name) {
    return new Binding(Kind.GLOBAL, name, null, null);
  }

  public boolean isState() {
    return kind == Kind.STATE;
  }
}
