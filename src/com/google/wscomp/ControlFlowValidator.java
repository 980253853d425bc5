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

import static com.google.common.base.Preconditions.checkState;

import com.google.wscomp.ControlFlowGraph.Branch;
import com.google.wscomp.graph.DiGraphEdge;

/**
 * Checks the structure of a finished control flow graph. A violation means lowering or
 * composition is broken, so it is reported as an {@link IllegalStateException} rather than as a
 * user diagnostic.
 */
public final class ControlFlowValidator {

  private ControlFlowValidator() {}

  public static void validate(ControlFlowGraph<?, ?, ?> cfg) {
    int entries = 0;
    int exits = 0;
    for (int node = 0; node < cfg.getNodeCount(); node++) {
      CfgNode<?, ?> value = cfg.getNodeValue(node);
      switch (value.getKind()) {
        case ENTRY:
          entries++;
          checkState(node == cfg.getEntry(), "stray entry node %s", node);
          checkState(cfg.getInEdges(node).isEmpty(), "entry node has incoming edges");
          break;
        case EXIT:
          exits++;
          checkState(node == cfg.getExit(), "stray exit node %s", node);
          checkState(cfg.getOutEdges(node).isEmpty(), "exit node has outgoing edges");
          break;
        case BASIC_BLOCK:
          checkState(!value.getStatements().isEmpty(), "empty basic block %s", node);
          for (DiGraphEdge<Branch> edge : cfg.getOutEdges(node)) {
            checkState(
                !edge.value().isConditional(), "basic block %s has a condition edge", node);
          }
          break;
        case BRANCH_CONDITION:
        case LOOP_CONDITION:
          validateCondition(cfg, node);
          break;
      }
    }
    checkState(entries == 1, "expected one entry node, found %s", entries);
    checkState(exits == 1, "expected one exit node, found %s", exits);
    checkState(!cfg.hasPendingEdges(), "unresolved edges %s", cfg.getPendingEdges());
  }

  /** A condition leaves through exactly one ON_TRUE and one ON_FALSE edge. */
  private static void validateCondition(ControlFlowGraph<?, ?, ?> cfg, int node) {
    int onTrue = 0;
    int onFalse = 0;
    for (DiGraphEdge<Branch> edge : cfg.getOutEdges(node)) {
      switch (edge.value()) {
        case ON_TRUE:
          onTrue++;
          break;
        case ON_FALSE:
          onFalse++;
          break;
        default:
          throw new IllegalStateException(
              "condition " + node + " has a " + edge.value() + " edge");
      }
    }
    checkState(
        onTrue == 1 && onFalse == 1,
        "condition %s has %s ON_TRUE and %s ON_FALSE edges",
        node,
        onTrue,
        onFalse);
  }
}
