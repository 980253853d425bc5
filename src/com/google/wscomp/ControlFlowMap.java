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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.wscomp.ast.Declaration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The control flow graphs of one module, keyed by the function or component whose body they
 * describe. Iteration follows declaration order.
 */
public final class ControlFlowMap {
  private final ImmutableMap<Declaration, AstControlFlowGraph> graphs;

  private ControlFlowMap(ImmutableMap<Declaration, AstControlFlowGraph> graphs) {
    this.graphs = graphs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the graph of {@code declaration}, or null if its body could not be lowered. */
  public @Nullable AstControlFlowGraph getGraph(Declaration declaration) {
    return graphs.get(declaration);
  }

  /** Returns the graph of the function or component named {@code name}, if there is one. */
  public @Nullable AstControlFlowGraph getGraph(String name) {
    for (Map.Entry<Declaration, AstControlFlowGraph> entry : graphs.entrySet()) {
      if (entry.getKey().name().equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  public ImmutableList<Declaration> getDeclarations() {
    return graphs.keySet().asList();
  }

  public int size() {
    return graphs.size();
  }

  /** Accumulates graphs in declaration order. */
  public static final class Builder {
    private final Map<Declaration, AstControlFlowGraph> graphs = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder put(Declaration declaration, AstControlFlowGraph cfg) {
      checkArgument(!graphs.containsKey(declaration), "duplicate declaration %s", declaration);
      graphs.put(declaration, cfg);
      return this;
    }

    public ControlFlowMap build() {
      return new ControlFlowMap(ImmutableMap.copyOf(graphs));
    }
  }
}
