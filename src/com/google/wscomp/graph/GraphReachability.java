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

package com.google.wscomp.graph;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * Computes the set of nodes that can be reached from a given node. Only edges accepted by the
 * edge predicate are followed.
 *
 * <p>The result accumulates: {@link #recompute} marks additional nodes reachable without
 * forgetting earlier results, which lets a caller report the head of an unreachable region and
 * then treat the rest of that region as already handled.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public final class GraphReachability<N, E> {
  private final LinkedDirectedGraph<N, E> graph;
  private final Predicate<? super DiGraphEdge<E>> edgePredicate;
  private final BitSet reachable = new BitSet();

  public GraphReachability(LinkedDirectedGraph<N, E> graph) {
    this(graph, Predicates.alwaysTrue());
  }

  public GraphReachability(
      LinkedDirectedGraph<N, E> graph, Predicate<? super DiGraphEdge<E>> edgePredicate) {
    this.graph = graph;
    this.edgePredicate = edgePredicate;
  }

  /** Clears earlier results and marks everything reachable from {@code entry}. */
  @CanIgnoreReturnValue
  public GraphReachability<N, E> compute(int entry) {
    reachable.clear();
    return recompute(entry);
  }

  /** Marks {@code node} and everything reachable from it, keeping earlier results. */
  @CanIgnoreReturnValue
  public GraphReachability<N, E> recompute(int node) {
    Deque<Integer> worklist = new ArrayDeque<>();
    if (!reachable.get(node)) {
      reachable.set(node);
      worklist.add(node);
    }
    while (!worklist.isEmpty()) {
      int current = worklist.remove();
      for (DiGraphEdge<E> edge : graph.getOutEdges(current)) {
        int destination = edge.destination();
        if (!reachable.get(destination) && edgePredicate.apply(edge)) {
          reachable.set(destination);
          worklist.add(destination);
        }
      }
    }
    return this;
  }

  public boolean isReachable(int node) {
    return reachable.get(node);
  }

  /** Returns a copy of the reachable set, indexed by node. */
  public BitSet getReachable() {
    return (BitSet) reachable.clone();
  }
}
