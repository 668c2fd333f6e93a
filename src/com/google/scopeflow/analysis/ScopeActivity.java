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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import org.jspecify.annotations.Nullable;

/**
 * The symbols a scope reads, modifies and binds, aggregated over all of its statements.
 *
 * <p>Nested scopes are accounted for separately. The enclosing scope only sees the name a nested
 * function is bound to and the symbols the nested scope declares {@code global} or {@code
 * nonlocal}.
 */
public final class ScopeActivity {

  private final Node root;
  private final @Nullable Node enclosingScopeRoot;
  private final ImmutableSet<QualifiedName> read;
  private final ImmutableSet<QualifiedName> modified;
  private final ImmutableSet<QualifiedName> bound;
  private final ImmutableSet<QualifiedName> globals;
  private final ImmutableSet<QualifiedName> nonlocals;
  private final ImmutableSet<QualifiedName> parameters;
  private final ImmutableSet<QualifiedName> freeReads;

  ScopeActivity(
      Node root,
      @Nullable Node enclosingScopeRoot,
      ImmutableSet<QualifiedName> read,
      ImmutableSet<QualifiedName> modified,
      ImmutableSet<QualifiedName> bound,
      ImmutableSet<QualifiedName> globals,
      ImmutableSet<QualifiedName> nonlocals,
      ImmutableSet<QualifiedName> parameters) {
    this.root = checkNotNull(root);
    this.enclosingScopeRoot = enclosingScopeRoot;
    this.read = read;
    this.modified = modified;
    this.bound = bound;
    this.globals = globals;
    this.nonlocals = nonlocals;
    this.parameters = parameters;
    this.freeReads = computeFreeReads();
  }

  private ImmutableSet<QualifiedName> computeFreeReads() {
    ImmutableSet.Builder<QualifiedName> free = ImmutableSet.builder();
    for (QualifiedName q : read) {
      QualifiedName base = q.getRoot();
      if (base != null && !isLocal(base)) {
        free.add(q);
      }
    }
    return free.build();
  }

  /** Whether the simple name {@code name} refers to a variable of this scope. */
  public boolean isLocal(QualifiedName name) {
    return bound.contains(name) && !globals.contains(name) && !nonlocals.contains(name);
  }

  /** The scope root this activity describes. */
  public Node getRoot() {
    return root;
  }

  /** The root of the enclosing scope, or null for the outermost scope. */
  public @Nullable Node getEnclosingScopeRoot() {
    return enclosingScopeRoot;
  }

  public ImmutableSet<QualifiedName> getRead() {
    return read;
  }

  public ImmutableSet<QualifiedName> getModified() {
    return modified;
  }

  /** Simple names that are local to this scope: parameters, assigned names and nested defs. */
  public ImmutableSet<QualifiedName> getBound() {
    return bound;
  }

  public ImmutableSet<QualifiedName> getGlobals() {
    return globals;
  }

  public ImmutableSet<QualifiedName> getNonlocals() {
    return nonlocals;
  }

  public ImmutableSet<QualifiedName> getGlobalsOrNonlocals() {
    return Sets.union(globals, nonlocals).immutableCopy();
  }

  public ImmutableSet<QualifiedName> getParameters() {
    return parameters;
  }

  /** Read symbols whose root name is not local to this scope. */
  public ImmutableSet<QualifiedName> getFreeReads() {
    return freeReads;
  }

  /** Returns a copy of this activity that also reads {@code extraReads}. */
  ScopeActivity withReads(Iterable<QualifiedName> extraReads) {
    return new ScopeActivity(
        root,
        enclosingScopeRoot,
        ImmutableSet.<QualifiedName>builder().addAll(read).addAll(extraReads).build(),
        modified,
        bound,
        globals,
        nonlocals,
        parameters);
  }

  @Override
  public String toString() {
    return "ScopeActivity{root="
        + root
        + ", read="
        + read
        + ", modified="
        + modified
        + ", bound="
        + bound
        + ", globalsOrNonlocals="
        + getGlobalsOrNonlocals()
        + "}";
  }
}
