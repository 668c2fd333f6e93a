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

import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph.
 *
 * <p>Out edges of a node are ordered by creation. In edges carry no meaningful order.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public abstract class DiGraph<N, E> {

  /** Returns all nodes, in creation order. */
  public abstract Collection<? extends DiGraphNode<N, E>> getNodes();

  /** Returns all edges. */
  public abstract List<? extends DiGraphEdge<N, E>> getEdges();

  /** Returns the node wrapping {@code value}, or null if there is none. */
  public abstract @Nullable DiGraphNode<N, E> getNode(N value);

  public final boolean hasNode(N value) {
    return getNode(value) != null;
  }

  /** Returns the node wrapping {@code value}, creating it if necessary. */
  public abstract DiGraphNode<N, E> createNode(N value);

  /** Connects {@code source} to {@code destination} with a new edge labeled {@code edgeValue}. */
  public abstract DiGraphEdge<N, E> connect(N source, E edgeValue, N destination);

  /** Connects two nodes unless an edge with the same label already connects them. */
  public abstract void connectIfNotFound(N source, E edgeValue, N destination);

  public abstract List<? extends DiGraphEdge<N, E>> getOutEdges(N nodeValue);

  public abstract List<? extends DiGraphEdge<N, E>> getInEdges(N nodeValue);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> node);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> node);

  public final int getNodeCount() {
    return getNodes().size();
  }

  public final int getEdgeCount() {
    return getEdges().size();
  }

  /**
   * A generic directed graph node.
   *
   * @param <N> Value type that the graph node stores.
   * @param <E> Value type that the graph edge stores.
   */
  public interface DiGraphNode<N, E> extends GraphNode<N, E> {

    /** Out edges, in creation order. */
    List<? extends DiGraphEdge<N, E>> getOutEdges();

    List<? extends DiGraphEdge<N, E>> getInEdges();

    /** Whether a priority was assigned to this node. */
    boolean hasPriority();

    /**
     * Returns a nonnegative integer priority which can be used to order nodes.
     *
     * <p>Throws if a priority hasn't been set yet.
     */
    int getPriority();

    /** Sets a node priority, must be non-negative. */
    void setPriority(int priority);
  }

  /**
   * A generic directed graph edge.
   *
   * @param <N> Value type that the graph node stores.
   * @param <E> Value type that the graph edge stores.
   */
  public interface DiGraphEdge<N, E> {

    E getValue();

    DiGraphNode<N, E> getSource();

    DiGraphNode<N, E> getDestination();

    <A extends Annotation> @Nullable A getAnnotation();

    void setAnnotation(@Nullable Annotation data);
  }
}
