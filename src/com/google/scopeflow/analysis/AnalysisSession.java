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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.SyntaxTree;

/**
 * The state shared by the passes analyzing one tree: the tree, the caller's configuration and the
 * annotations written so far. It is passed explicitly to every pass.
 *
 * <p>Sessions share nothing, so independent sessions can be analyzed on different threads. A
 * single session must be used by one thread at a time.
 */
public final class AnalysisSession {

  private final SyntaxTree tree;
  private final ScopeContext context;
  private final AnnotationStore annotations;

  private AnalysisSession(SyntaxTree tree, ScopeContext context) {
    this.tree = checkNotNull(tree);
    this.context = checkNotNull(context);
    this.annotations = new AnnotationStore(tree);
  }

  public static AnalysisSession create(SyntaxTree tree, ScopeContext context) {
    return new AnalysisSession(tree, context);
  }

  public SyntaxTree getTree() {
    return tree;
  }

  public ScopeContext getContext() {
    return context;
  }

  public AnnotationStore getAnnotations() {
    return annotations;
  }

  /**
   * Checks that {@code root} belongs to this session's tree and introduces a scope.
   *
   * @throws InvalidScopeException if {@code root} is not a scope root
   */
  Node checkScopeRoot(Node root) {
    checkArgument(tree.contains(root), "%s is not part of the analyzed tree", root);
    if (!root.getToken().isScope()) {
      throw new InvalidScopeException(root);
    }
    return root;
  }

  @Override
  public String toString() {
    return "AnalysisSession{" + context.getScopeName() + "}";
  }
}
