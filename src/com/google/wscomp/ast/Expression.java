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

import com.google.common.collect.ImmutableList;

/** An expression of the ws language, stored in an {@link AstArena}. */
public interface Expression {

  /** Tag of each expression shape. */
  enum Kind {
    NUMBER,
    BOOLEAN,
    STRING,
    REFERENCE,
    BINARY,
    CALL
  }

  Kind getKind();

  /** A numeric literal. */
  record NumberLiteral(double value) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.NUMBER;
    }
  }

  /** {@code true} or {@code false}. */
  record BooleanLiteral(boolean value) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.BOOLEAN;
    }
  }

  /** A string literal, without quotes. */
  record StringLiteral(String value) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.STRING;
    }
  }

  /** A use of a resolved name. */
  record Reference(Binding binding) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.REFERENCE;
    }
  }

  /** {@code left op right} */
  record Binary(BinaryOperator op, ExpressionId left, ExpressionId right) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.BINARY;
    }
  }

  /** {@code callee(arguments...)} */
  record Call(ExpressionId callee, ImmutableList<ExpressionId> arguments) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.CALL;
    }
  }
}
