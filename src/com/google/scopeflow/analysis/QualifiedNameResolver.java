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

import com.google.scopeflow.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Annotates every reference node of a scope, nested scopes included, with its {@link
 * NodeAnnotations#CANONICAL_NAME}.
 *
 * <p>Resolution never fails. A subscript whose index is not a number or string literal ends the
 * resolvable part of the chain, and anything that is not a reference at all resolves to an opaque
 * name of its own.
 */
public final class QualifiedNameResolver extends AbstractPostOrderCallback
    implements AnalysisPass {

  private static final Logger logger = Logger.getLogger(QualifiedNameResolver.class.getName());

  private @Nullable AnnotationStore.Writer writer;
  private int resolved;

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    writer = session.getAnnotations().writer(AnnotationOwner.QUALIFIED_NAMES);
    resolved = 0;
    try {
      NodeTraversal.traverse(session, scopeRoot, this);
    } finally {
      writer = null;
    }
    logger.fine(() -> "Resolved " + resolved + " references in " + scopeRoot);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case NAME, ATTRIBUTE, SUBSCRIPT -> {
        writer.set(n, NodeAnnotations.CANONICAL_NAME, resolve(n));
        resolved++;
      }
      default -> {}
    }
  }

  /**
   * Returns the canonical name of the reference chain rooted at {@code n}. Structurally equal
   * literal chains resolve to equal names; every other node resolves to an opaque name identified
   * by {@code n}.
   */
  public static QualifiedName resolve(Node n) {
    switch (n.getToken()) {
      case NAME:
        return QualifiedName.simple(n.getString());
      case ATTRIBUTE:
        return resolve(n.getFirstChild()).withAttribute(n.getString());
      case SUBSCRIPT:
        {
          QualifiedName owner = resolve(n.getFirstChild());
          Node index = n.getSecondChild();
          if (index.isNumber()) {
            return owner.withSubscript(index.getDouble());
          } else if (index.isString()) {
            return owner.withSubscript(index.getString());
          }
          // The index is only known at runtime.
          return QualifiedName.opaque(owner, n);
        }
      default:
        return QualifiedName.opaque(null, n);
    }
  }
}
