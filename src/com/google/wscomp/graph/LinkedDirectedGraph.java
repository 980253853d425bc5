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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * A directed graph using linked lists within nodes to store edge information.
 *
 * <p>Nodes are addressed by the dense integer index returned from {@link #createNode}; nodes are
 * never removed, so an index stays valid for the lifetime of the graph. Each node keeps its out
 * and in edges in insertion order. Parallel edges are permitted; callers that want to suppress
 * duplicates check {@link #isConnected} first.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public class LinkedDirectedGraph<N, E> {
  private final List<N> nodes = new ArrayList<>();
  private final List<List<DiGraphEdge<E>>> outEdges = new ArrayList<>();
  private final List<List<DiGraphEdge<E>>> inEdges = new ArrayList<>();
  private final List<DiGraphEdge<E>> edges = new ArrayList<>();

  protected LinkedDirectedGraph() {}

  public static <N, E> LinkedDirectedGraph<N, E> create() {
    return new LinkedDirectedGraph<>();
  }

  /** Adds a node holding {@code value} and returns its index. */
  public int createNode(N value) {
    nodes.add(value);
    outEdges.add(new ArrayList<>());
    inEdges.add(new ArrayList<>());
    return nodes.size() - 1;
  }

  public N getNodeValue(int node) {
    checkElementIndex(node, nodes.size(), "node");
    return nodes.get(node);
  }

  public boolean hasNode(int node) {
    return node >= 0 && node < nodes.size();
  }

  public int getNodeCount() {
    return nodes.size();
  }

  @CanIgnoreReturnValue
  public DiGraphEdge<E> connect(int source, E value, int destination) {
    checkElementIndex(source, nodes.size(), "source");
    checkElementIndex(destination, nodes.size(), "destination");
    DiGraphEdge<E> edge = new DiGraphEdge<>(source, value, destination);
    outEdges.get(source).add(edge);
    inEdges.get(destination).add(edge);
    edges.add(edge);
    return edge;
  }

  /**
   * Removes one edge from {@code source} to {@code destination} carrying {@code value}.
   *
   * @return whether such an edge existed
   */
  @CanIgnoreReturnValue
  public boolean disconnect(int source, E value, int destination) {
    DiGraphEdge<E> edge = new DiGraphEdge<>(source, value, destination);
    if (!outEdges.get(source).remove(edge)) {
      return false;
    }
    inEdges.get(destination).remove(edge);
    edges.remove(edge);
    return true;
  }

  public boolean isConnected(int source, E value, int destination) {
    for (DiGraphEdge<E> edge : outEdges.get(source)) {
      if (edge.destination() == destination && edge.value().equals(value)) {
        return true;
      }
    }
    return false;
  }

  public List<DiGraphEdge<E>> getOutEdges(int node) {
    checkElementIndex(node, nodes.size(), "node");
    return ImmutableList.copyOf(outEdges.get(node));
  }

  public List<DiGraphEdge<E>> getInEdges(int node) {
    checkElementIndex(node, nodes.size(), "node");
    return ImmutableList.copyOf(inEdges.get(node));
  }

  /** Returns every edge of the graph in the order the edges were added. */
  public List<DiGraphEdge<E>> getEdges() {
    return ImmutableList.copyOf(edges);
  }
}
