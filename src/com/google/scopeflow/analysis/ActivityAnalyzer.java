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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes what every scope and every control point reads and modifies.
 *
 * <p>Statements are walked in pre-order. Each nested function or lambda is analyzed as a scope of
 * its own when the walk reaches it. Writes {@link NodeAnnotations#SCOPE_ACTIVITY} on every scope
 * root and {@link NodeAnnotations#STATEMENT_ACTIVITY} on every control point.
 *
 * <p>Requires the {@link NodeAnnotations#CANONICAL_NAME} annotations of {@link
 * QualifiedNameResolver}.
 */
public final class ActivityAnalyzer implements AnalysisPass {

  private static final Logger logger = Logger.getLogger(ActivityAnalyzer.class.getName());

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    analyze(session, scopeRoot);
  }

  /**
   * Analyzes the scope rooted at {@code scopeRoot} and the scopes nested in it.
   *
   * @return the activity of {@code scopeRoot}
   * @throws InvalidScopeException if {@code scopeRoot} does not introduce a scope
   * @throws UnsupportedConstructException if the scope contains a statement kind that is not
   *     modeled, or a declaration whose language feature is disabled
   */
  public ScopeActivity analyze(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    ScopeActivity activity = new Walker(session).analyzeScope(scopeRoot);
    logger.fine(() -> "Analyzed " + activity);
    return activity;
  }

  /**
   * Adds the free reads of {@code inner} to the activity of its enclosing scope, for languages
   * whose closures read the enclosing scope's variables. Symbols {@code inner} declares global or
   * nonlocal were already accounted for by {@link #analyze}.
   *
   * @return the widened activity of the enclosing scope, which also replaces its annotation
   */
  public ScopeActivity propagateFreeReads(AnalysisSession session, ScopeActivity inner) {
    Node enclosing = inner.getEnclosingScopeRoot();
    checkArgument(enclosing != null, "%s has no enclosing scope", inner.getRoot());
    AnnotationStore store = session.getAnnotations();
    ScopeActivity outer = store.get(enclosing, NodeAnnotations.SCOPE_ACTIVITY);
    ImmutableSet<QualifiedName> declared = inner.getGlobalsOrNonlocals();
    ImmutableList.Builder<QualifiedName> propagated = ImmutableList.builder();
    for (QualifiedName q : inner.getFreeReads()) {
      if (!declared.contains(q.getRoot())) {
        propagated.add(q);
      }
    }
    ScopeActivity widened = outer.withReads(propagated.build());
    store.writer(AnnotationOwner.ACTIVITY).set(enclosing, NodeAnnotations.SCOPE_ACTIVITY, widened);
    return widened;
  }

  /**
   * Returns the activity of one control point of the graph of {@code scopeRoot}. The scope root
   * itself stands for binding the parameters, so it modifies them and reads nothing.
   *
   * @throws MissingAnnotationException if the scope was not analyzed
   */
  static StatementActivity getControlPointActivity(AnnotationStore store, Node scopeRoot, Node n) {
    if (n == scopeRoot) {
      ScopeActivity scope = store.get(scopeRoot, NodeAnnotations.SCOPE_ACTIVITY);
      return StatementActivity.create(ImmutableSet.of(), scope.getParameters());
    }
    return store.get(n, NodeAnnotations.STATEMENT_ACTIVITY);
  }

  /** The sets of one scope while it is being walked. */
  private static final class ScopeState {
    final Node root;
    final Set<QualifiedName> read = new LinkedHashSet<>();
    final Set<QualifiedName> modified = new LinkedHashSet<>();
    final Set<QualifiedName> assigned = new LinkedHashSet<>();
    final Set<QualifiedName> globals = new LinkedHashSet<>();
    final Set<QualifiedName> nonlocals = new LinkedHashSet<>();
    final Set<QualifiedName> parameters = new LinkedHashSet<>();

    ScopeState(Node root) {
      this.root = root;
    }

    ScopeActivity build() {
      ImmutableSet<QualifiedName> bound =
          Sets.difference(Sets.union(parameters, assigned), Sets.union(globals, nonlocals))
              .immutableCopy();
      return new ScopeActivity(
          root,
          root.getEnclosingScopeRoot(),
          ImmutableSet.copyOf(read),
          ImmutableSet.copyOf(modified),
          bound,
          ImmutableSet.copyOf(globals),
          ImmutableSet.copyOf(nonlocals),
          ImmutableSet.copyOf(parameters));
    }
  }

  /** The sets of one control point while it is being walked. */
  private static final class StatementState {
    final Set<QualifiedName> read = new LinkedHashSet<>();
    final Set<QualifiedName> modified = new LinkedHashSet<>();
  }

  private static final class Walker {
    private final AnalysisSession session;
    private final AnnotationStore store;
    private final AnnotationStore.Writer writer;

    Walker(AnalysisSession session) {
      this.session = session;
      this.store = session.getAnnotations();
      this.writer = store.writer(AnnotationOwner.ACTIVITY);
    }

    ScopeActivity analyzeScope(Node root) {
      ScopeState scope = new ScopeState(root);
      switch (root.getToken()) {
        case MODULE -> visitStatements(root, scope);
        case FUNCTION -> {
          visitParams(root.getSecondChild(), scope);
          visitStatements(root.getLastChild(), scope);
        }
        case LAMBDA -> {
          visitParams(root.getFirstChild(), scope);
          // The body expression is the lambda's only control point.
          Node body = root.getLastChild();
          StatementState stmt = new StatementState();
          readExpression(body, stmt, scope);
          finish(body, stmt, scope);
        }
        default -> throw new InvalidScopeException(root);
      }
      ScopeActivity activity = scope.build();
      writer.set(root, NodeAnnotations.SCOPE_ACTIVITY, activity);
      return activity;
    }

    private void visitParams(Node paramList, ScopeState scope) {
      for (Node param : paramList.children()) {
        QualifiedName name = canonicalName(param.isDefaultValue() ? param.getFirstChild() : param);
        scope.parameters.add(name);
        scope.modified.add(name);
      }
    }

    private void visitStatements(Node container, ScopeState scope) {
      for (Node stmt : container.children()) {
        visitStatement(stmt, scope);
      }
    }

    private void visitStatement(Node n, ScopeState scope) {
      StatementState stmt = new StatementState();
      switch (n.getToken()) {
        case EXPR_RESULT -> readExpression(n.getFirstChild(), stmt, scope);
        case ASSIGN -> {
          readExpression(n.getSecondChild(), stmt, scope);
          writeTarget(n.getFirstChild(), stmt, scope);
        }
        case ASSIGN_ADD, ASSIGN_SUB, ASSIGN_MUL, ASSIGN_DIV -> {
          // x += y reads x.
          readExpression(n.getFirstChild(), stmt, scope);
          readExpression(n.getSecondChild(), stmt, scope);
          writeTarget(n.getFirstChild(), stmt, scope);
        }
        case DEL -> {
          for (Node target : n.children()) {
            writeTarget(target, stmt, scope);
          }
        }
        case IF -> {
          readExpression(n.getFirstChild(), stmt, scope);
          finish(n, stmt, scope);
          for (Node block = n.getSecondChild(); block != null; block = block.getNext()) {
            visitStatements(block, scope);
          }
          return;
        }
        case WHILE -> {
          readExpression(n.getFirstChild(), stmt, scope);
          finish(n, stmt, scope);
          visitStatements(n.getLastChild(), scope);
          return;
        }
        case FOR -> {
          // The header reads the iterable and assigns the target on every iteration.
          readExpression(n.getSecondChild(), stmt, scope);
          writeTarget(n.getFirstChild(), stmt, scope);
          finish(n, stmt, scope);
          visitStatements(n.getLastChild(), scope);
          return;
        }
        case RETURN, RAISE -> {
          if (n.hasChildren()) {
            readExpression(n.getFirstChild(), stmt, scope);
          }
        }
        case BREAK, CONTINUE, PASS -> {}
        case GLOBAL -> {
          checkFeature(n, LanguageFeature.GLOBAL_DECLARATIONS);
          declare(n, scope.globals);
        }
        case NONLOCAL -> {
          checkFeature(n, LanguageFeature.NONLOCAL_DECLARATIONS);
          if (scope.root.isModule()) {
            throw new UnsupportedConstructException("nonlocal declaration at module level", n);
          }
          declare(n, scope.nonlocals);
        }
        case FUNCTION -> {
          // A def statement evaluates the defaults and binds the name. The body is a scope of its
          // own.
          readDefaults(n.getSecondChild(), stmt, scope);
          writeTarget(n.getFirstChild(), stmt, scope);
          finish(n, stmt, scope);
          analyzeNested(n, scope);
          return;
        }
        default -> throw new UnsupportedConstructException(n);
      }
      finish(n, stmt, scope);
    }

    private void finish(Node n, StatementState stmt, ScopeState scope) {
      StatementActivity activity =
          StatementActivity.create(
              ImmutableSet.copyOf(stmt.read), ImmutableSet.copyOf(stmt.modified));
      writer.set(n, NodeAnnotations.STATEMENT_ACTIVITY, activity);
      scope.read.addAll(stmt.read);
      scope.modified.addAll(stmt.modified);
    }

    private void checkFeature(Node n, LanguageFeature feature) {
      if (!session.getContext().isEnabled(feature)) {
        throw new UnsupportedConstructException(
            n.getToken() + " requires language feature " + feature, n);
      }
    }

    private void declare(Node declaration, Set<QualifiedName> declared) {
      for (Node name : declaration.children()) {
        declared.add(canonicalName(name));
      }
    }

    private void readDefaults(Node paramList, StatementState stmt, ScopeState scope) {
      for (Node param : paramList.children()) {
        if (param.isDefaultValue()) {
          readExpression(param.getSecondChild(), stmt, scope);
        }
      }
    }

    /**
     * Analyzes a nested scope and copies the symbols it declares global or nonlocal into the
     * enclosing scope.
     */
    private void analyzeNested(Node inner, ScopeState scope) {
      ScopeActivity activity = analyzeScope(inner);
      ImmutableSet<QualifiedName> declared = activity.getGlobalsOrNonlocals();
      if (declared.isEmpty()) {
        return;
      }
      for (QualifiedName q : activity.getRead()) {
        if (declared.contains(q.getRoot())) {
          scope.read.add(q);
        }
      }
      for (QualifiedName q : activity.getModified()) {
        if (declared.contains(q.getRoot())) {
          scope.modified.add(q);
        }
      }
    }

    /** Records the symbols read by evaluating {@code n}. */
    private void readExpression(Node n, StatementState stmt, ScopeState scope) {
      switch (n.getToken().getCategory()) {
        case REFERENCE -> {
          // Reading a.b[0] also reads a.b and a, and whatever the index reads.
          stmt.read.add(canonicalName(n));
          for (Node child : n.children()) {
            readExpression(child, stmt, scope);
          }
        }
        case LITERAL, OPERATOR -> {
          for (Node child : n.children()) {
            readExpression(child, stmt, scope);
          }
        }
        case SCOPE -> {
          if (!n.isLambda()) {
            throw new UnsupportedConstructException(n);
          }
          readDefaults(n.getFirstChild(), stmt, scope);
          analyzeNested(n, scope);
        }
        case STRUCTURE, STATEMENT -> throw new UnsupportedConstructException(n);
      }
    }

    /** Records the symbols modified, bound and read by assigning to {@code target}. */
    private void writeTarget(Node target, StatementState stmt, ScopeState scope) {
      switch (target.getToken()) {
        case NAME -> {
          QualifiedName name = canonicalName(target);
          stmt.modified.add(name);
          scope.assigned.add(name);
        }
        case ATTRIBUTE, SUBSCRIPT -> {
          // Assigning to a.b modifies a.b but only reads a.
          stmt.modified.add(canonicalName(target));
          for (Node child : target.children()) {
            readExpression(child, stmt, scope);
          }
        }
        case TUPLE, LIST -> {
          for (Node element : target.children()) {
            writeTarget(element, stmt, scope);
          }
        }
        default -> throw new UnsupportedConstructException("Cannot assign to " + target, target);
      }
    }

    private QualifiedName canonicalName(Node reference) {
      return store.get(reference, NodeAnnotations.CANONICAL_NAME);
    }
  }
}
