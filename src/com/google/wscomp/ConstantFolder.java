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

import com.google.wscomp.ast.ExpressionId;
import org.jspecify.annotations.Nullable;

/** Evaluates expressions whose value is known at compile time. */
public interface ConstantFolder {

  /** Returns the literal value of {@code expression}, or {@code null} if it is not constant. */
  @Nullable Value evaluate(ExpressionId expression);
}
