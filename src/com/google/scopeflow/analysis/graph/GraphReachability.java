/*
 * Copyright 2026 The Scopeflow Authors.
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
package com.google.scopeflow.analysis.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphEdge;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Computes the set of nodes reachable from a given node, optionally following only the edges
 * accepted by a predicate.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public final class GraphReachability<N, E> {

  private final DiGraph<N, E> graph;
  private final Predicate<? super DiGraphEdge<N, E>> edgePredicate;

  public GraphReachability(DiGraph<N, E> graph) {
    this(graph, edge -> true);
  }

  public GraphReachability(DiGraph<N, E> graph, Predicate<? super DiGraphEdge<N, E>> edgePredicate) {
    this.graph = graph;
    this.edgePredicate = edgePredicate;
  }

  /** Returns the values of all nodes reachable from {@code entry}, including {@code entry}. */
  public ImmutableSet<N> compute(N entry) {
    DiGraphNode<N, E> start = graph.getNode(entry);
    checkArgument(start != null, "%s does not exist in graph", entry);
    Set<N> reachable = new LinkedHashSet<>();
    Deque<DiGraphNode<N, E>> worklist = new ArrayDeque<>();
    worklist.add(start);
    reachable.add(entry);
    while (!worklist.isEmpty()) {
      DiGraphNode<N, E> current = worklist.remove();
      for (DiGraphEdge<N, E> edge : current.getOutEdges()) {
        DiGraphNode<N, E> dest = edge.getDestination();
        if (edgePredicate.test(edge) && reachable.add(dest.getValue())) {
          worklist.add(dest);
        }
      }
    }
    return ImmutableSet.copyOf(reachable);
  }
}
