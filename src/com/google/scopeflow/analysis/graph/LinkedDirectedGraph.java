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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph using adjacency lists, keyed by node value.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public class LinkedDirectedGraph<N, E> extends DiGraph<N, E> {

  private final Map<N, LinkedDirectedGraphNode<N, E>> nodes = new LinkedHashMap<>();
  private final List<LinkedDirectedGraphEdge<N, E>> edges = new ArrayList<>();

  public static <N, E> LinkedDirectedGraph<N, E> create() {
    return new LinkedDirectedGraph<>();
  }

  protected LinkedDirectedGraph() {}

  @Override
  public Collection<LinkedDirectedGraphNode<N, E>> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getEdges() {
    return Collections.unmodifiableList(edges);
  }

  @Override
  public @Nullable LinkedDirectedGraphNode<N, E> getNode(N value) {
    return nodes.get(value);
  }

  @Override
  public LinkedDirectedGraphNode<N, E> createNode(N value) {
    checkNotNull(value);
    return createDirectedGraphNode(value);
  }

  /**
   * Like {@link #createNode}, but also accepts null. Subclasses use a null-valued node for a
   * synthetic node that stands for no value of the graph's domain.
   */
  protected final LinkedDirectedGraphNode<N, E> createDirectedGraphNode(@Nullable N value) {
    return nodes.computeIfAbsent(value, LinkedDirectedGraphNode::new);
  }

  @Override
  public LinkedDirectedGraphEdge<N, E> connect(N source, E edgeValue, N destination) {
    LinkedDirectedGraphNode<N, E> src = getNodeOrFail(source);
    LinkedDirectedGraphNode<N, E> dest = getNodeOrFail(destination);
    LinkedDirectedGraphEdge<N, E> edge = new LinkedDirectedGraphEdge<>(src, edgeValue, dest);
    src.outEdges.add(edge);
    dest.inEdges.add(edge);
    edges.add(edge);
    return edge;
  }

  @Override
  public void connectIfNotFound(N source, E edgeValue, N destination) {
    LinkedDirectedGraphNode<N, E> src = getNodeOrFail(source);
    for (LinkedDirectedGraphEdge<N, E> outEdge : src.outEdges) {
      if (Objects.equals(outEdge.getDestination().getValue(), destination)
          && outEdge.getValue().equals(edgeValue)) {
        return;
      }
    }
    connect(source, edgeValue, destination);
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getOutEdges(N nodeValue) {
    return getNodeOrFail(nodeValue).getOutEdges();
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getInEdges(N nodeValue) {
    return getNodeOrFail(nodeValue).getInEdges();
  }

  @Override
  public List<LinkedDirectedGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> node) {
    ImmutableList.Builder<LinkedDirectedGraphNode<N, E>> succs = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<N, E> edge : asLinked(node).outEdges) {
      succs.add(edge.destination);
    }
    return succs.build();
  }

  @Override
  public List<LinkedDirectedGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> node) {
    ImmutableList.Builder<LinkedDirectedGraphNode<N, E>> preds = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<N, E> edge : asLinked(node).inEdges) {
      preds.add(edge.source);
    }
    return preds.build();
  }

  private LinkedDirectedGraphNode<N, E> getNodeOrFail(N value) {
    LinkedDirectedGraphNode<N, E> node = nodes.get(value);
    checkArgument(node != null, "%s does not exist in graph", value);
    return node;
  }

  private LinkedDirectedGraphNode<N, E> asLinked(DiGraphNode<N, E> node) {
    checkArgument(
        node instanceof LinkedDirectedGraphNode && nodes.get(node.getValue()) == node,
        "%s does not belong to this graph",
        node);
    return (LinkedDirectedGraphNode<N, E>) node;
  }

  /** A directed graph node that stores outgoing and incoming edges. */
  public static final class LinkedDirectedGraphNode<N, E> implements DiGraphNode<N, E> {
    private final N value;
    private final List<LinkedDirectedGraphEdge<N, E>> outEdges = new ArrayList<>();
    private final List<LinkedDirectedGraphEdge<N, E>> inEdges = new ArrayList<>();
    private @Nullable Annotation annotation;
    private int priority = -1;

    private LinkedDirectedGraphNode(N value) {
      this.value = value;
    }

    @Override
    public N getValue() {
      return value;
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getOutEdges() {
      return Collections.unmodifiableList(outEdges);
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getInEdges() {
      return Collections.unmodifiableList(inEdges);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A extends Annotation> @Nullable A getAnnotation() {
      return (A) annotation;
    }

    @Override
    public void setAnnotation(@Nullable Annotation data) {
      this.annotation = data;
    }

    @Override
    public boolean hasPriority() {
      return priority >= 0;
    }

    @Override
    public int getPriority() {
      checkState(hasPriority(), "Priority is not set for %s", value);
      return priority;
    }

    @Override
    public void setPriority(int priority) {
      checkArgument(priority >= 0, priority);
      this.priority = priority;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A directed graph edge. */
  public static final class LinkedDirectedGraphEdge<N, E> implements DiGraphEdge<N, E> {
    private final LinkedDirectedGraphNode<N, E> source;
    private final E value;
    private final LinkedDirectedGraphNode<N, E> destination;
    private @Nullable Annotation annotation;

    private LinkedDirectedGraphEdge(
        LinkedDirectedGraphNode<N, E> source, E value, LinkedDirectedGraphNode<N, E> destination) {
      this.source = source;
      this.value = value;
      this.destination = destination;
    }

    @Override
    public E getValue() {
      return value;
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getSource() {
      return source;
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getDestination() {
      return destination;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A extends Annotation> @Nullable A getAnnotation() {
      return (A) annotation;
    }

    @Override
    public void setAnnotation(@Nullable Annotation data) {
      this.annotation = data;
    }

    @Override
    public String toString() {
      return source + " -> " + value + " -> " + destination;
    }
  }
}
