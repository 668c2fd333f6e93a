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

package com.google.scopeflow.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The arena that owns an indexed program tree.
 *
 * <p>Indexing assigns every node a stable integer id in pre-order, so a parent always has a smaller
 * id than its descendants and siblings are numbered left to right. Side tables keyed by these ids
 * stay valid for the lifetime of the tree because an indexed tree can no longer be modified.
 */
public final class SyntaxTree {

  private final Node root;
  private final ImmutableList<Node> nodes;

  private SyntaxTree(Node root, ImmutableList<Node> nodes) {
    this.root = root;
    this.nodes = nodes;
  }

  /**
   * Indexes and freezes the tree rooted at {@code root}.
   *
   * @throws IllegalArgumentException if {@code root} has a parent
   * @throws IllegalStateException if any node was already indexed by another tree
   */
  public static SyntaxTree index(Node root) {
    checkArgument(!root.hasParent(), "Only a root node can be indexed: %s", root);
    ImmutableList.Builder<Node> preOrder = ImmutableList.builder();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      preOrder.add(n);
      // Push children right to left so they pop left to right.
      for (Node c = n.getLastChild(); c != null; c = c.getPrevious()) {
        stack.push(c);
      }
    }
    ImmutableList<Node> nodes = preOrder.build();
    SyntaxTree tree = new SyntaxTree(root, nodes);
    for (int i = 0; i < nodes.size(); i++) {
      nodes.get(i).index(tree, i);
    }
    return tree;
  }

  public Node getRoot() {
    return root;
  }

  /** Returns the node with the given id. */
  public Node getNode(int id) {
    checkArgument(id >= 0 && id < nodes.size(), "No node with id %s", id);
    return nodes.get(id);
  }

  public boolean contains(Node n) {
    return n.getTree() == this;
  }

  public int size() {
    return nodes.size();
  }

  /** All nodes in pre-order. */
  public ImmutableList<Node> getNodes() {
    return nodes;
  }
}
