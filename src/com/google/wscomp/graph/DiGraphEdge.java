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

import static java.util.Objects.requireNonNull;

/**
 * A directed, annotated edge of a {@link LinkedDirectedGraph}. Endpoints are node indices.
 *
 * @param <E> Value type that the graph edge stores.
 * @param source index of the node the edge leaves
 * @param value the edge annotation, such as a branch label
 * @param destination index of the node the edge enters
 */
public record DiGraphEdge<E>(int source, E value, int destination) {
  public DiGraphEdge {
    requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return source + " -> " + destination + " [" + value + "]";
  }
}
