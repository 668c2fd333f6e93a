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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.SyntaxTree;
import org.jspecify.annotations.Nullable;

/**
 * Side table of analysis results, keyed by node id and {@link AnnotationKey}.
 *
 * <p>Anyone holding the store can read it. Writing requires a {@link Writer}, which is bound to a
 * single {@link AnnotationOwner} and refuses keys of other owners. There is at most one value per
 * node and key.
 *
 * <p>Not thread safe. Every {@link AnalysisSession} owns its own store.
 */
public final class AnnotationStore {

  private final SyntaxTree tree;
  private final Table<Integer, AnnotationKey<?>, Object> values = HashBasedTable.create();

  AnnotationStore(SyntaxTree tree) {
    this.tree = checkNotNull(tree);
  }

  /**
   * Returns the value stored for {@code n} under {@code key}.
   *
   * @throws MissingAnnotationException if there is none
   */
  public <T> T get(Node n, AnnotationKey<T> key) {
    T value = getIfPresent(n, key);
    if (value == null) {
      throw new MissingAnnotationException(n, key);
    }
    return value;
  }

  @SuppressWarnings("unchecked") // Writer.set only stores values of the key's type.
  public <T> @Nullable T getIfPresent(Node n, AnnotationKey<T> key) {
    return (T) values.get(checkNode(n), checkNotNull(key));
  }

  public boolean has(Node n, AnnotationKey<?> key) {
    return values.contains(checkNode(n), checkNotNull(key));
  }

  /** Returns the keys that have a value on {@code n}. */
  public ImmutableSet<AnnotationKey<?>> keys(Node n) {
    return ImmutableSet.copyOf(values.row(checkNode(n)).keySet());
  }

  /** Returns the ids of all annotated nodes, in ascending order. */
  public ImmutableSortedSet<Integer> annotatedNodeIds() {
    return ImmutableSortedSet.copyOf(values.rowKeySet());
  }

  SyntaxTree getTree() {
    return tree;
  }

  /** Returns a writer for the keys owned by {@code owner}. */
  public Writer writer(AnnotationOwner owner) {
    return new Writer(checkNotNull(owner));
  }

  private int checkNode(Node n) {
    checkArgument(tree.contains(n), "%s is not part of the analyzed tree", n);
    return n.getId();
  }

  /** Writes and removes the values of one owner's keys. */
  public final class Writer {
    private final AnnotationOwner owner;

    private Writer(AnnotationOwner owner) {
      this.owner = owner;
    }

    /** Stores {@code value}, replacing any previous value of {@code key} on {@code n}. */
    @CanIgnoreReturnValue
    public <T> Writer set(Node n, AnnotationKey<T> key, T value) {
      checkOwned(key);
      values.put(checkNode(n), key, checkNotNull(value));
      return this;
    }

    /** Removes the value of {@code key} on {@code n}, if any. */
    @CanIgnoreReturnValue
    public Writer remove(Node n, AnnotationKey<?> key) {
      checkOwned(key);
      values.remove(checkNode(n), key);
      return this;
    }

    public AnnotationOwner getOwner() {
      return owner;
    }

    private void checkOwned(AnnotationKey<?> key) {
      checkArgument(
          key.getOwner() == owner, "%s may not write %s, it is owned by %s", owner, key,
          key.getOwner());
    }
  }
}
