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
import com.google.wscomp.ast.StatementId;

/** The control flow graph of a function or component body. */
public final class AstControlFlowGraph extends ControlFlowGraph<StatementId, ExpressionId, Value> {}
