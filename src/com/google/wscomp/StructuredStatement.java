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

/**
 * Structured code recovered from a control flow graph.
 *
 * @param <S> statement handle type
 * @param <E> expression handle type
 */
public interface StructuredStatement<S, E> {

  /** A statement copied from a basic block. */
  record Simple<S, E>(S statement) implements StructuredStatement<S, E> {}

  /** {@code if (condition) { thenBranch } else { elseBranch }}; the else branch may be empty. */
  record If<S, E>(
      E condition,
      ImmutableList<StructuredStatement<S, E>> thenBranch,
      ImmutableList<StructuredStatement<S, E>> elseBranch)
      implements StructuredStatement<S, E> {
    public boolean hasElse() {
      return !elseBranch.isEmpty();
    }

    /** Whether the else branch is a single if, printed as {@code else if}. */
    public boolean hasElseIf() {
      return elseBranch.size() == 1 && elseBranch.get(0) instanceof If;
    }
  }

  /** {@code while (condition) { body }} */
  record While<S, E>(E condition, ImmutableList<StructuredStatement<S, E>> body)
      implements StructuredStatement<S, E> {}
}
