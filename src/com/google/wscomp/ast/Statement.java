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

import org.jspecify.annotations.Nullable;

/**
 * A statement of the ws language. Statements are plain values stored in an {@link AstArena} and
 * refer to their children through handles.
 */
public interface Statement {

  /** Tag of each statement shape, used to dispatch over statements exhaustively. */
  enum Kind {
    LET,
    STATE,
    EXPRESSION,
    ASSIGNMENT,
    RETURN,
    IF,
    WHILE,
    FOR
  }

  Kind getKind();

  /** {@code let name = value} */
  record Let(String name, ExpressionId value) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.LET;
    }
  }

  /** {@code state name = value}, a reactive local backed by a signal. */
  record State(String name, ExpressionId value) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.STATE;
    }
  }

  /** An expression evaluated for its side effects. */
  record ExpressionStatement(ExpressionId expression) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.EXPRESSION;
    }
  }

  /** {@code target = value} */
  record Assignment(Binding target, ExpressionId value) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.ASSIGNMENT;
    }
  }

  /** {@code return value} */
  record Return(ExpressionId value) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.RETURN;
    }
  }

  /**
   * {@code if condition { body }}, optionally followed by either an {@code else} block or an
   * {@code else if}.
   */
  record If(
      ExpressionId condition, BlockId body, @Nullable BlockId elseBlock, @Nullable If elseIf)
      implements Statement {
    public If {
      checkArgument(elseBlock == null || elseIf == null, "if has both an else block and else-if");
    }

    public boolean hasAlternate() {
      return elseBlock != null || elseIf != null;
    }

    @Override
    public Kind getKind() {
      return Kind.IF;
    }
  }

  /** {@code while condition { body }} */
  record While(ExpressionId condition, BlockId body) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.WHILE;
    }
  }

  /** {@code for binding in iterable { body }} */
  record For(String binding, ExpressionId iterable, BlockId body) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.FOR;
    }
  }
}
