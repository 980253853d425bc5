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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.wscomp.graph.DiGraphEdge;
import com.google.wscomp.graph.GraphReachability;
import com.google.wscomp.graph.LinkedDirectedGraph;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Control flow graph.
 *
 * <p>Every graph owns exactly one entry and one exit node, created by the constructor at indices
 * {@code 0} and {@code 1}. Real nodes are appended after them. The graph also tracks the first
 * and the most recently appended real node, a FIFO queue of {@link PendingEdge}s whose target is
 * not known yet, and whether every path through the fragment ends in an explicit return.
 *
 * <p>Fragments are combined with {@link #consumeSubgraph} and {@link #appendSubgraph}, which copy
 * the child's nodes into this graph. The child is not used afterwards.
 *
 * @param <S> statement handle type
 * @param <E> expression handle type
 * @param <V> type of folded constant values
 */
public class ControlFlowGraph<S, E, V>
    extends LinkedDirectedGraph<CfgNode<S, E>, ControlFlowGraph.Branch> {

  private static final Logger logger = Logger.getLogger(ControlFlowGraph.class.getName());

  /** Marks the absence of a node index. */
  public static final int NONE = -1;

  private final int entry;
  private final int exit;
  private int first = NONE;
  private int last = NONE;
  private final Deque<PendingEdge> edgeQueue = new ArrayDeque<>();
  private boolean hasEarlyReturn = false;

  // Folded value of the live returns seen so far, and whether two of them disagreed.
  private @Nullable V returnValue = null;
  private boolean returnValueUnknown = false;

  public ControlFlowGraph() {
    this.entry = createNode(CfgNode.entry());
    this.exit = createNode(CfgNode.exit());
  }

  /** The edge object for the control flow graph. */
  public static enum Branch {
    /** Edge is taken if the condition is true. */
    ON_TRUE,
    /** Edge is taken if the condition is false. */
    ON_FALSE,
    /** Unconditional branch. */
    UNCOND,
    /** Control leaves the function through a return statement. */
    RETURN;

    public boolean isConditional() {
      return this == ON_TRUE || this == ON_FALSE;
    }
  }

  /**
   * An edge whose source is known but whose target is not.
   *
   * @param source index of the node the edge will leave
   * @param branch label the edge will carry
   */
  public record PendingEdge(int source, Branch branch) {}

  public int getEntry() {
    return entry;
  }

  public int getExit() {
    return exit;
  }

  /** Returns the first real node wired from the entry, or {@link #NONE}. */
  public int getFirst() {
    return first;
  }

  public boolean hasFirst() {
    return first != NONE;
  }

  /** Returns the most recently appended real node, or {@link #NONE}. */
  public int getLast() {
    return last;
  }

  public boolean isSentinel(int node) {
    return node == entry || node == exit;
  }

  public boolean hasEarlyReturn() {
    return hasEarlyReturn;
  }

  public void setHasEarlyReturn(boolean hasEarlyReturn) {
    this.hasEarlyReturn = hasEarlyReturn;
  }

  // Node creation

  /** Appends a basic block holding {@code statements}. */
  public int addBasicBlock(List<S> statements) {
    checkArgument(!statements.isEmpty(), "empty basic block");
    return appendNode(CfgNode.basicBlock(statements));
  }

  public int addBranchCondition(E condition) {
    return appendNode(CfgNode.branchCondition(condition));
  }

  public int addLoopCondition(E condition) {
    return appendNode(CfgNode.loopCondition(condition));
  }

  private int appendNode(CfgNode<S, E> value) {
    int node = createNode(value);
    if (first == NONE) {
      first = node;
      addEdgeFromEntry(node, Branch.UNCOND);
    }
    last = node;
    flushEdgeQueue(node);
    return node;
  }

  // Edges

  /**
   * Connects {@code from} to {@code to}. An UNCOND or RETURN edge that already exists between the
   * same nodes is not added again; condition edges are always added.
   *
   * @return whether an edge was added
   */
  @CanIgnoreReturnValue
  public boolean addEdge(int from, int to, Branch branch) {
    checkArgument(from != exit, "edge leaving the exit node");
    checkArgument(to != entry, "edge entering the entry node");
    if (!branch.isConditional() && isConnected(from, branch, to)) {
      return false;
    }
    connect(from, branch, to);
    return true;
  }

  @CanIgnoreReturnValue
  public boolean addEdgeToExit(int from, Branch branch) {
    return addEdge(from, exit, branch);
  }

  /** Connects the entry node to {@code to}. */
  @CanIgnoreReturnValue
  public boolean addEdgeFromEntry(int to, Branch branch) {
    return addEdge(entry, to, branch);
  }

  /** Removes an UNCOND edge between two nodes, returning whether one existed. */
  @CanIgnoreReturnValue
  public boolean removeUncondEdge(int from, int to) {
    return disconnect(from, Branch.UNCOND, to);
  }

  // Deferred edges

  public void enqueueEdge(int source, Branch branch) {
    checkArgument(source != exit, "edge leaving the exit node");
    edgeQueue.add(new PendingEdge(source, branch));
  }

  public ImmutableList<PendingEdge> getPendingEdges() {
    return ImmutableList.copyOf(edgeQueue);
  }

  public boolean hasPendingEdges() {
    return !edgeQueue.isEmpty();
  }

  /** Connects every pending edge to {@code target} and empties the queue. */
  public void flushEdgeQueue(int target) {
    for (DiGraphEdge<Branch> edge : resolve(edgeQueue, target)) {
      addEdge(edge.source(), edge.destination(), edge.value());
    }
    edgeQueue.clear();
  }

  /** Returns the edges that result from pointing every pending edge at {@code target}. */
  public static ImmutableList<DiGraphEdge<Branch>> resolve(
      Collection<PendingEdge> queue, int target) {
    ImmutableList.Builder<DiGraphEdge<Branch>> edges = ImmutableList.builder();
    for (PendingEdge pending : queue) {
      edges.add(new DiGraphEdge<>(pending.source(), pending.branch(), target));
    }
    return edges.build();
  }

  // Return values

  /**
   * Records the folded value of a return statement that can execute, or {@code null} if it did
   * not fold.
   */
  public void recordReturnValue(@Nullable V value) {
    if (returnValueUnknown) {
      return;
    }
    if (value == null || (returnValue != null && !returnValue.equals(value))) {
      returnValueUnknown = true;
      returnValue = null;
    } else {
      returnValue = value;
    }
  }

  /**
   * Returns the value every path returns, if the fragment always returns and all of its live
   * returns fold to the same constant.
   */
  public @Nullable V getValue() {
    return hasEarlyReturn && !returnValueUnknown ? returnValue : null;
  }

  private void mergeReturnValues(ControlFlowGraph<S, E, V> child) {
    if (child.returnValueUnknown) {
      recordReturnValue(null);
    } else if (child.returnValue != null) {
      recordReturnValue(child.returnValue);
    }
  }

  // Analysis

  /**
   * Returns every real node that cannot be reached from the entry, in index order. A graph that is
   * still being composed may report nodes that later composition wires up.
   */
  public ImmutableList<Integer> findUnreachableBlocks() {
    GraphReachability<CfgNode<S, E>, Branch> reachability =
        new GraphReachability<>(this).compute(entry);
    ImmutableList.Builder<Integer> unreachable = ImmutableList.builder();
    for (int node = 0; node < getNodeCount(); node++) {
      if (!isSentinel(node) && !reachability.isReachable(node)) {
        unreachable.add(node);
      }
    }
    return unreachable.build();
  }

  // Composition

  /**
   * Copies {@code child} into this graph hanging off {@code anchor}. Edges that left the child's
   * entry leave {@code anchor} instead and carry {@code entryBranch}. If the child is empty the
   * anchor edge is queued.
   *
   * @return the index of the child's first node in this graph, or {@link #NONE}
   */
  @CanIgnoreReturnValue
  public int consumeSubgraph(ControlFlowGraph<S, E, V> child, Branch entryBranch, int anchor) {
    checkArgument(hasNode(anchor) && !isSentinel(anchor), "bad anchor %s", anchor);
    int[] remap = copyNodes(child);
    for (DiGraphEdge<Branch> edge : child.getOutEdges(child.entry)) {
      if (edge.destination() == child.exit) {
        enqueueEdge(anchor, entryBranch);
      } else {
        addEdge(anchor, remap[edge.destination()], entryBranch);
      }
    }
    copyInnerEdges(child, remap);
    copyExitEdges(child, remap);
    mergeReturnValues(child);
    return finishComposition(child, remap, "anchored at " + anchor + " on " + entryBranch);
  }

  /**
   * Copies {@code child} into this graph so that it runs after everything appended so far: the
   * child's entry edges are fed by the pending edges, or by the entry node if this graph has no
   * real node yet. If the pending queue is empty because this graph always returned, the child's
   * nodes stay unreachable.
   *
   * @return the index of the child's first node in this graph, or {@link #NONE}
   */
  @CanIgnoreReturnValue
  public int appendSubgraph(ControlFlowGraph<S, E, V> child) {
    boolean wasReturned = hasEarlyReturn;
    boolean hadFirst = hasFirst();
    int[] remap = copyNodes(child);
    ImmutableList<PendingEdge> pending = ImmutableList.copyOf(edgeQueue);
    edgeQueue.clear();
    boolean passThrough = false;
    for (DiGraphEdge<Branch> edge : child.getOutEdges(child.entry)) {
      if (edge.destination() == child.exit) {
        passThrough = true;
      } else if (!hadFirst) {
        addEdgeFromEntry(remap[edge.destination()], edge.value());
      } else {
        for (DiGraphEdge<Branch> resolved : resolve(pending, remap[edge.destination()])) {
          addEdge(resolved.source(), resolved.destination(), resolved.value());
        }
      }
    }
    if (passThrough) {
      edgeQueue.addAll(pending);
    }
    if (!hadFirst && child.hasFirst()) {
      first = remap[child.first];
    }
    copyInnerEdges(child, remap);
    copyExitEdges(child, remap);
    if (!wasReturned) {
      mergeReturnValues(child);
    }
    return finishComposition(child, remap, "appended");
  }

  private int[] copyNodes(ControlFlowGraph<S, E, V> child) {
    checkArgument(child != this, "graph composed into itself");
    checkState(!child.hasPendingEdges(), "child graph has unresolved edges");
    int[] remap = new int[child.getNodeCount()];
    remap[child.entry] = NONE;
    remap[child.exit] = NONE;
    for (int node = 0; node < child.getNodeCount(); node++) {
      if (!child.isSentinel(node)) {
        remap[node] = createNode(child.getNodeValue(node));
      }
    }
    return remap;
  }

  private void copyInnerEdges(ControlFlowGraph<S, E, V> child, int[] remap) {
    for (DiGraphEdge<Branch> edge : child.getEdges()) {
      if (edge.source() != child.entry && edge.destination() != child.exit) {
        addEdge(remap[edge.source()], remap[edge.destination()], edge.value());
      }
    }
  }

  private void copyExitEdges(ControlFlowGraph<S, E, V> child, int[] remap) {
    for (DiGraphEdge<Branch> edge : child.getInEdges(child.exit)) {
      if (edge.source() == child.entry) {
        continue;
      }
      int source = remap[edge.source()];
      if (edge.value() == Branch.RETURN || child.hasEarlyReturn) {
        // After a return every other edge into the exit leaves dead code.
        addEdgeToExit(source, edge.value());
      } else {
        enqueueEdge(source, edge.value());
      }
    }
  }

  private int finishComposition(ControlFlowGraph<S, E, V> child, int[] remap, String how) {
    if (child.last != NONE) {
      last = remap[child.last];
    }
    int childFirst = child.hasFirst() ? remap[child.first] : NONE;
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(
          "Composed "
              + (child.getNodeCount() - 2)
              + " node(s) "
              + how
              + ", first "
              + childFirst
              + ", "
              + edgeQueue.size()
              + " pending edge(s)");
    }
    return childFirst;
  }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder("CFG:\n");
    for (int node = 0; node < getNodeCount(); node++) {
      s.append(node).append(": ").append(getNodeValue(node)).append('\n');
    }
    for (DiGraphEdge<Branch> edge : getEdges()) {
      s.append(edge).append('\n');
    }
    return s.toString();
  }
}
