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
import com.google.wscomp.ControlFlowGraph.Branch;
import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.Span;
import com.google.wscomp.ast.StatementId;
import com.google.wscomp.graph.GraphReachability;

/**
 * Use {@link ControlFlowGraph} and {@link GraphReachability} to inform user about unreachable
 * code.
 */
final class CheckUnreachableCode {

  static final DiagnosticType UNREACHABLE_CODE =
      DiagnosticType.warning("WSC_UNREACHABLE_CODE", "unreachable code");

  private final AbstractCompiler compiler;

  CheckUnreachableCode(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  /** Reports the unreachable regions of {@code cfg} and returns the nodes reported. */
  ImmutableList<Integer> process(AstControlFlowGraph cfg) {
    if (!compiler.getOptions().getUnreachableCodeLevel().isOn()) {
      return ImmutableList.of();
    }
    ImmutableList<Integer> unreachable = cfg.findUnreachableBlocks();
    if (unreachable.isEmpty()) {
      return ImmutableList.of();
    }
    GraphReachability<CfgNode<StatementId, ExpressionId>, Branch> reachability =
        new GraphReachability<>(cfg).compute(cfg.getEntry());
    ImmutableList.Builder<Integer> reported = ImmutableList.builder();
    for (int node : unreachable) {
      if (reachability.isReachable(node)) {
        continue;
      }
      Span span = getSpan(cfg.getNodeValue(node));
      compiler.report(
          WsError.make(compiler.getOptions().getSourceName(), span, UNREACHABLE_CODE));
      reported.add(node);
      // From now on, we are going to assume the user fixed the error and not
      // give more warning related to code section reachable from this node.
      reachability.recompute(node);
    }
    return reported.build();
  }

  private Span getSpan(CfgNode<StatementId, ExpressionId> node) {
    AstArena arena = compiler.getArena();
    if (node.getKind() == CfgNode.Kind.BASIC_BLOCK) {
      return arena.getSpan(node.getStatements().get(0));
    }
    return arena.getSpan(node.getCondition());
  }
}
