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
package com.google.scopeflow.analysis;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.scopeflow.tree.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * Depth-first walk over a subtree of a session's tree. Children are entered left to right; the
 * callback sees each node on the way down and again on the way up. The walker knows which scope
 * root encloses the node being visited.
 */
public final class NodeTraversal {
  private final AnalysisSession session;
  private final Callback callback;

  /** Innermost first. */
  private final Deque<Node> scopeRoots = new ArrayDeque<>();

  private @Nullable Node currentNode;

  /** Receives the nodes of a traversal. */
  public interface Callback {
    /**
     * Called before the children of {@code n}. Returning false skips {@code n} entirely: neither
     * its children nor its own {@link #visit} are reached.
     *
     * @param parent null for the node the traversal started at
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Called after all children of {@code n} have been visited.
     *
     * @param parent null for the node the traversal started at
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** A callback that only cares about the post-order {@link #visit}. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  private NodeTraversal(AnalysisSession session, Callback callback) {
    this.session = checkNotNull(session);
    this.callback = checkNotNull(callback);
  }

  /**
   * Walks the subtree rooted at {@code root}.
   *
   * @throws IllegalStateException if {@code root} does not belong to the session's tree
   */
  public static void traverse(AnalysisSession session, Node root, Callback cb) {
    checkState(session.getTree().contains(root), "%s is not part of the analyzed tree", root);
    new NodeTraversal(session, cb).walk(root, null);
  }

  private void walk(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    boolean opensScope = n.getToken().isScope();
    if (opensScope) {
      scopeRoots.push(n);
    }
    for (Node child : n.children()) {
      walk(child, n);
    }
    currentNode = n;
    callback.visit(this, n, parent);
    if (opensScope) {
      scopeRoots.pop();
    }
  }

  public AnalysisSession getSession() {
    return session;
  }

  public Node getCurrentNode() {
    return checkNotNull(currentNode);
  }

  /**
   * Returns the innermost scope root around the current node, counting the node itself, or null
   * when the walk began below every scope root.
   */
  public @Nullable Node getScopeRoot() {
    return scopeRoots.peek();
  }
}
