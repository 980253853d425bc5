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

/**
 * A component declaration. Each component body gets its own control flow graph.
 *
 * @param name declared name
 * @param parameters parameter names in declaration order
 * @param body the component body
 * @param isPublic whether the declaration is exported from its module
 */
public record ComponentDecl(
    String name, ImmutableList<String> parameters, BlockId body, boolean isPublic)
    implements Declaration {}
