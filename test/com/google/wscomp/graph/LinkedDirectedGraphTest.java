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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LinkedDirectedGraph}. */
@RunWith(JUnit4.class)
public final class LinkedDirectedGraphTest {

  @Test
  public void testNodesAreIndexedInCreationOrder() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    assertThat(graph.createNode("a")).isEqualTo(0);
    assertThat(graph.createNode("b")).isEqualTo(1);
    assertThat(graph.createNode("c")).isEqualTo(2);
    assertThat(graph.getNodeCount()).isEqualTo(3);
    assertThat(graph.getNodeValue(1)).isEqualTo("b");
    assertThat(graph.hasNode(2)).isTrue();
    assertThat(graph.hasNode(3)).isFalse();
    assertThat(graph.hasNode(-1)).isFalse();
  }

  @Test
  public void testConnect() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    int a = graph.createNode("a");
    int b = graph.createNode("b");
    int c = graph.createNode("c");
    graph.connect(a, "ab", b);
    graph.connect(a, "ac", c);
    graph.connect(b, "bc", c);

    assertThat(graph.getOutEdges(a))
        .containsExactly(new DiGraphEdge<>(a, "ab", b), new DiGraphEdge<>(a, "ac", c))
        .inOrder();
    assertThat(graph.getInEdges(c))
        .containsExactly(new DiGraphEdge<>(a, "ac", c), new DiGraphEdge<>(b, "bc", c))
        .inOrder();
    assertThat(graph.getEdges()).hasSize(3);
    assertThat(graph.isConnected(a, "ab", b)).isTrue();
    assertThat(graph.isConnected(a, "ac", b)).isFalse();
  }

  @Test
  public void testParallelEdgesAreKept() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    int a = graph.createNode("a");
    int b = graph.createNode("b");
    graph.connect(a, "x", b);
    graph.connect(a, "x", b);
    assertThat(graph.getOutEdges(a)).hasSize(2);
    assertThat(graph.getInEdges(b)).hasSize(2);
  }

  @Test
  public void testDisconnect() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    int a = graph.createNode("a");
    int b = graph.createNode("b");
    graph.connect(a, "x", b);
    graph.connect(a, "y", b);

    assertThat(graph.disconnect(a, "x", b)).isTrue();
    assertThat(graph.disconnect(a, "x", b)).isFalse();
    assertThat(graph.getOutEdges(a)).containsExactly(new DiGraphEdge<>(a, "y", b));
    assertThat(graph.getInEdges(b)).containsExactly(new DiGraphEdge<>(a, "y", b));
    assertThat(graph.getEdges()).containsExactly(new DiGraphEdge<>(a, "y", b));
  }

  @Test
  public void testSelfLoop() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    int a = graph.createNode("a");
    graph.connect(a, "loop", a);
    assertThat(graph.getOutEdges(a)).containsExactly(new DiGraphEdge<>(a, "loop", a));
    assertThat(graph.getInEdges(a)).containsExactly(new DiGraphEdge<>(a, "loop", a));
    assertThat(graph.isConnected(a, "loop", a)).isTrue();
  }

  @Test
  public void testConnectUnknownNode() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    int a = graph.createNode("a");
    assertThrows(IndexOutOfBoundsException.class, () -> graph.connect(a, "x", 7));
    assertThrows(IndexOutOfBoundsException.class, () -> graph.getOutEdges(7));
  }
}
