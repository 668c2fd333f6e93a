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

import org.jspecify.annotations.Nullable;

/**
 * A node of a graph, wrapping a value and carrying one mutable annotation.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public interface GraphNode<N, E> {

  /** Returns the value of this node. */
  N getValue();

  /** Gets the annotation associated with this node. */
  <A extends Annotation> @Nullable A getAnnotation();

  /** Sets an annotation for this node. */
  void setAnnotation(@Nullable Annotation data);
}
