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

import com.google.common.collect.ImmutableList;
import com.google.wscomp.ControlFlowGraph.Branch;
import com.google.wscomp.graph.DiGraphEdge;
import com.google.wscomp.graph.GraphReachability;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * Recovers nested {@code if}/{@code else}/{@code while} structure from a finished control flow
 * graph.
 *
 * <p>The walk starts at the graph's first node and emits each node once. A branch condition
 * looks up its ON_TRUE and ON_FALSE successors by label and searches forward from both for the
 * node where they join; each side is walked up to, but not including, that join. A side that
 * always returns never joins: when the true side returns, the false side simply follows the if;
 * when the false side returns, the if ends where the true side passes the last node of the false
 * side. A loop
 * condition walks its ON_TRUE successor up to the back edge and then continues at its ON_FALSE
 * successor.
 *
 * <p>The visited set belongs to one call of {@link #detect} and is shared by all of its nested
 * walks. A walk's stop node is not marked visited, so the enclosing walk resumes there.
 *
 * @param <S> statement handle type
 * @param <E> expression handle type
 */
public final class StructureDetector<S, E> {
  private static final int NONE = ControlFlowGraph.NONE;

  private final ControlFlowGraph<S, E, ?> cfg;
  private final BitSet visited = new BitSet();

  private StructureDetector(ControlFlowGraph<S, E, ?> cfg) {
    this.cfg = cfg;
  }

  /** Returns the structured statements of {@code cfg}, starting from its first node. */
  public static <S, E> ImmutableList<StructuredStatement<S, E>> detect(
      ControlFlowGraph<S, E, ?> cfg) {
    StructureDetector<S, E> detector = new StructureDetector<>(cfg);
    int start = cfg.hasFirst() ? cfg.getFirst() : cfg.getEntry();
    ImmutableList.Builder<StructuredStatement<S, E>> out = ImmutableList.builder();
    detector.walk(start, NONE, out);
    return out.build();
  }

  private ImmutableList<StructuredStatement<S, E>> walk(int start, int stop) {
    ImmutableList.Builder<StructuredStatement<S, E>> out = ImmutableList.builder();
    walk(start, stop, out);
    return out.build();
  }

  private void walk(int start, int stop, ImmutableList.Builder<StructuredStatement<S, E>> out) {
    int node = start;
    while (node != NONE && node != stop && node != cfg.getExit() && !visited.get(node)) {
      visited.set(node);
      CfgNode<S, E> value = cfg.getNodeValue(node);
      switch (value.getKind()) {
        case ENTRY:
          node = fallthrough(node);
          break;
        case BASIC_BLOCK:
          for (S statement : value.getStatements()) {
            out.add(new StructuredStatement.Simple<>(statement));
          }
          node = fallthrough(node);
          break;
        case BRANCH_CONDITION:
          node = walkBranch(node, value.getCondition(), stop, out);
          break;
        case LOOP_CONDITION:
          out.add(
              new StructuredStatement.While<>(
                  value.getCondition(), walk(successor(node, Branch.ON_TRUE), node)));
          node = successor(node, Branch.ON_FALSE);
          break;
        case EXIT:
          throw new IllegalStateException("walked into exit node " + node);
      }
    }
  }

  /** Emits the if statement at {@code node} and returns the node that follows it. */
  private int walkBranch(
      int node, E condition, int stop, ImmutableList.Builder<StructuredStatement<S, E>> out) {
    int onTrue = successor(node, Branch.ON_TRUE);
    int onFalse = successor(node, Branch.ON_FALSE);
    BitSet reachFromTrue = forwardClosure(onTrue, node);
    int join = findJoin(onFalse, node, reachFromTrue);
    if (join == onFalse) {
      out.add(
          new StructuredStatement.If<>(condition, walk(onTrue, join), ImmutableList.of()));
      return onFalse;
    } else if (join != NONE) {
      ImmutableList<StructuredStatement<S, E>> thenBranch = walk(onTrue, join);
      ImmutableList<StructuredStatement<S, E>> elseBranch = walk(onFalse, join);
      out.add(new StructuredStatement.If<>(condition, thenBranch, elseBranch));
      return join;
    } else if (!reachFromTrue.get(cfg.getExit())) {
      // The true side always returns, so the false side is what follows the if.
      out.add(
          new StructuredStatement.If<>(condition, walk(onTrue, stop), ImmutableList.of()));
      return onFalse;
    }
    BitSet reachFromFalse = forwardClosure(onFalse, node);
    int follow =
        reachFromFalse.get(cfg.getExit()) ? NONE : findFollow(onTrue, node, stop, reachFromFalse);
    ImmutableList<StructuredStatement<S, E>> thenBranch = walk(onTrue, follow);
    ImmutableList<StructuredStatement<S, E>> elseBranch = walk(onFalse, stop);
    out.add(new StructuredStatement.If<>(condition, thenBranch, elseBranch));
    return follow;
  }

  /**
   * Finds the first node after an if whose false side always returns. Nodes are numbered in the
   * order they were lowered, so the code following the if is the lowest numbered node the true
   * side reaches past every node of the false side.
   */
  private int findFollow(int onTrue, int node, int stop, BitSet falseSide) {
    int lastOfFalseSide = falseSide.length() - 1;
    BitSet candidates =
        new GraphReachability<>(
                cfg,
                (DiGraphEdge<Branch> edge) ->
                    edge.value() != Branch.RETURN
                        && edge.destination() != node
                        && edge.destination() != stop)
            .compute(onTrue)
            .getReachable();
    candidates.clear(cfg.getExit());
    int follow = candidates.nextSetBit(lastOfFalseSide + 1);
    return follow < 0 ? NONE : follow;
  }

  /** Nodes reachable from {@code start} without passing {@code excluded} or a RETURN edge. */
  private BitSet forwardClosure(int start, int excluded) {
    if (start == excluded) {
      return new BitSet();
    }
    return new GraphReachability<>(
            cfg,
            (DiGraphEdge<Branch> edge) ->
                edge.value() != Branch.RETURN && edge.destination() != excluded)
        .compute(start)
        .getReachable();
  }

  /** Breadth-first search from {@code start} for the nearest node in {@code targets}. */
  private int findJoin(int start, int excluded, BitSet targets) {
    BitSet seen = new BitSet();
    Deque<Integer> worklist = new ArrayDeque<>();
    seen.set(start);
    worklist.add(start);
    while (!worklist.isEmpty()) {
      int node = worklist.remove();
      if (targets.get(node)) {
        return node;
      }
      for (DiGraphEdge<Branch> edge : cfg.getOutEdges(node)) {
        int next = edge.destination();
        if (edge.value() != Branch.RETURN && next != excluded && !seen.get(next)) {
          seen.set(next);
          worklist.add(next);
        }
      }
    }
    return NONE;
  }

  /** Follows the single non-return edge out of a block, if there is one. */
  private int fallthrough(int node) {
    int next = NONE;
    for (DiGraphEdge<Branch> edge : cfg.getOutEdges(node)) {
      if (edge.value() != Branch.RETURN) {
        checkState(next == NONE, "node %s falls through to more than one node", node);
        next = edge.destination();
      }
    }
    return next;
  }

  private int successor(int node, Branch branch) {
    for (DiGraphEdge<Branch> edge : cfg.getOutEdges(node)) {
      if (edge.value() == branch) {
        return edge.destination();
      }
    }
    throw new IllegalStateException("node " + node + " has no " + branch + " edge");
  }
}
