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

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.wscomp.ControlFlowGraph.Branch;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.StatementId;
import com.google.wscomp.graph.DiGraphEdge;
import java.util.ArrayList;
import java.util.List;

/**
 * DotFormatter prints out a dot file of a control flow graph. For a detailed description of the
 * dot format and visualization tool refer to <a href="http://www.graphviz.org">Graphviz</a>.
 *
 * <p>Nodes are named after their index and listed in index order; edges are listed in the order
 * they were added, so the output is deterministic.
 */
public final class DotFormatter {
  private static final String INDENT = "  ";
  private static final String ARROW = " -> ";

  private DotFormatter() {}

  /** Converts a control flow graph to dot, labeling nodes with {@link CfgNode#toString}. */
  public static <S, E> String toDot(ControlFlowGraph<S, E, ?> cfg) {
    return toDot(cfg, CfgNode::toString);
  }

  /** Converts a control flow graph to dot, labeling nodes with generated code. */
  public static String toDot(AstControlFlowGraph cfg, CodeGenerator generator) {
    return toDot(cfg, (CfgNode<StatementId, ExpressionId> node) -> codeLabel(node, generator));
  }

  public static <S, E> String toDot(
      ControlFlowGraph<S, E, ?> cfg, Function<CfgNode<S, E>, String> labeler) {
    StringBuilder builder = new StringBuilder();
    builder.append("digraph CFG {\n");
    builder.append(INDENT);
    builder.append("node [color=lightblue2, style=filled];\n");
    for (int node = 0; node < cfg.getNodeCount(); node++) {
      builder.append(INDENT);
      builder.append(formatNodeName(node));
      builder.append(" [label=\"");
      builder.append(escape(labeler.apply(cfg.getNodeValue(node))));
      builder.append("\"];\n");
    }
    for (DiGraphEdge<Branch> edge : cfg.getEdges()) {
      builder.append(INDENT);
      builder.append(formatNodeName(edge.source()));
      builder.append(ARROW);
      builder.append(formatNodeName(edge.destination()));
      builder.append(" [label=\"").append(edge.value()).append("\"];\n");
    }
    builder.append("}\n");
    return builder.toString();
  }

  private static String codeLabel(
      CfgNode<StatementId, ExpressionId> node, CodeGenerator generator) {
    switch (node.getKind()) {
      case BASIC_BLOCK:
        List<String> lines = new ArrayList<>();
        for (StatementId statement : node.getStatements()) {
          lines.add(generator.statement(statement));
        }
        return Joiner.on('\n').join(lines);
      case BRANCH_CONDITION:
        return "if " + generator.expression(node.getCondition());
      case LOOP_CONDITION:
        return "while " + generator.expression(node.getCondition());
      default:
        return node.toString();
    }
  }

  private static String escape(String label) {
    return label.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }

  private static String formatNodeName(int key) {
    return "node" + key;
  }
}
