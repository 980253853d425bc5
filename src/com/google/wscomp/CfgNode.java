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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of a {@link ControlFlowGraph}. Entry and exit are sentinels without payload, a basic
 * block holds a straight-line run of statements and a branch or loop condition holds the
 * expression it tests.
 *
 * @param <S> statement handle type
 * @param <E> expression handle type
 */
public final class CfgNode<S, E> {

  /** The shape of a node. */
  public enum Kind {
    ENTRY,
    EXIT,
    BASIC_BLOCK,
    BRANCH_CONDITION,
    LOOP_CONDITION
  }

  private final Kind kind;
  private final ImmutableList<S> statements;
  private final @Nullable E condition;

  private CfgNode(Kind kind, ImmutableList<S> statements, @Nullable E condition) {
    this.kind = kind;
    this.statements = statements;
    this.condition = condition;
  }

  static <S, E> CfgNode<S, E> entry() {
    return new CfgNode<>(Kind.ENTRY, ImmutableList.of(), null);
  }

  static <S, E> CfgNode<S, E> exit() {
    return new CfgNode<>(Kind.EXIT, ImmutableList.of(), null);
  }

  public static <S, E> CfgNode<S, E> basicBlock(List<S> statements) {
    return new CfgNode<>(Kind.BASIC_BLOCK, ImmutableList.copyOf(statements), null);
  }

  public static <S, E> CfgNode<S, E> branchCondition(E condition) {
    return new CfgNode<>(Kind.BRANCH_CONDITION, ImmutableList.of(), checkNotNull(condition));
  }

  public static <S, E> CfgNode<S, E> loopCondition(E condition) {
    return new CfgNode<>(Kind.LOOP_CONDITION, ImmutableList.of(), checkNotNull(condition));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isSentinel() {
    return kind == Kind.ENTRY || kind == Kind.EXIT;
  }

  /** Whether this node tests a condition and leaves through ON_TRUE and ON_FALSE edges. */
  public boolean isCondition() {
    return kind == Kind.BRANCH_CONDITION || kind == Kind.LOOP_CONDITION;
  }

  public ImmutableList<S> getStatements() {
    checkState(kind == Kind.BASIC_BLOCK, "not a basic block: %s", this);
    return statements;
  }

  public E getCondition() {
    checkState(isCondition(), "not a condition: %s", this);
    return condition;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof CfgNode)) {
      return false;
    }
    CfgNode<?, ?> that = (CfgNode<?, ?>) o;
    return kind == that.kind
        && statements.equals(that.statements)
        && Objects.equals(condition, that.condition);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, statements, condition);
  }

  @Override
  public String toString() {
    switch (kind) {
      case BASIC_BLOCK:
        return "BasicBlock" + statements;
      case BRANCH_CONDITION:
        return "BranchCondition(" + condition + ")";
      case LOOP_CONDITION:
        return "LoopCondition(" + condition + ")";
      case ENTRY:
        return "Entry";
      case EXIT:
        return "Exit";
    }
    throw new AssertionError(kind);
  }
}
