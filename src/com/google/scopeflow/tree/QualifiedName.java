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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Canonical identity of a reference chain. Essentially, a qualified name is a linked list of
 * {@linkplain #getComponent components}, starting from the outermost access and ending with the
 * root of the name, which is a {@linkplain #isSimple simple name} with no {@linkplain #getOwner
 * owner}.
 *
 * <p>Attribute steps ({@code a.b}) and literal subscript steps ({@code a[0]}, {@code a['k']}) are
 * compared structurally, so equal chains are interchangeable as set and map keys. A step whose
 * index is computed at runtime ({@code a[i]}) is opaque: it is identified by the tree node it was
 * resolved from and never equals any other name.
 */
@Immutable
public abstract class QualifiedName {

  // Closed hierarchy: the step kinds below are the only subclasses.
  private QualifiedName() {}

  /** Parses a dotted name such as {@code "a.b.c"}. */
  public static QualifiedName of(String dotted) {
    int lastIndex = 0;
    int index;
    QualifiedName result = null;
    do {
      index = dotted.indexOf('.', lastIndex);
      String term = dotted.substring(lastIndex, index < 0 ? dotted.length() : index);
      checkArgument(!term.isEmpty(), "Malformed qualified name: %s", dotted);
      result = result == null ? new SimpleQname(term) : result.withAttribute(term);
      lastIndex = index + 1;
    } while (index >= 0);
    return result;
  }

  public static QualifiedName simple(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return new SimpleQname(name);
  }

  /**
   * Returns a name that stands for a reference which could not be resolved to a literal chain.
   *
   * @param owner the resolved part of the chain, or null if nothing could be resolved
   * @param origin the indexed node the opaque step was resolved from
   * @throws IllegalArgumentException if {@code origin} has not been indexed
   */
  public static QualifiedName opaque(@Nullable QualifiedName owner, Node origin) {
    return new OpaqueQname(owner, origin);
  }

  /**
   * The chain without its last step: {@code foo.bar} for {@code foo.bar.baz}. Null for a simple
   * name.
   */
  public abstract @Nullable QualifiedName getOwner();

  /**
   * The last step as it is written: {@code [0]} for {@code foo.bar[0]}, the name itself when the
   * name is simple.
   */
  public abstract String getComponent();

  /** Returns true if this is a simple name. */
  public abstract boolean isSimple();

  /** Returns true if this name has an owner. */
  public final boolean isComposite() {
    return getOwner() != null;
  }

  /** Whether this is an opaque step. */
  public boolean isOpaque() {
    return false;
  }

  /** Whether any step of this chain is opaque. */
  public final boolean hasOpaqueStep() {
    for (QualifiedName q = this; q != null; q = q.getOwner()) {
      if (q.isOpaque()) {
        return true;
      }
    }
    return false;
  }

  /** Returns the simple name this chain is rooted at, or null if the root could not be resolved. */
  public final @Nullable QualifiedName getRoot() {
    QualifiedName q = this;
    while (q.getOwner() != null) {
      q = q.getOwner();
    }
    return q.isSimple() ? q : null;
  }

  /** Writes the dotted and bracketed form to {@code sb}. */
  abstract void appendTo(StringBuilder sb);

  /**
   * Returns the components of this name, starting at the root. For the qualified name foo.bar[0],
   * this returns ["foo", "bar", "[0]"].
   */
  public ImmutableList<String> components() {
    ImmutableList.Builder<String> components = ImmutableList.builder();
    buildComponents(components);
    return components.build();
  }

  private void buildComponents(ImmutableList.Builder<String> builder) {
    QualifiedName owner = getOwner();
    if (owner != null) {
      owner.buildComponents(builder);
    }
    builder.add(getComponent());
  }

  /** The dotted and bracketed form, e.g. {@code a.b[0]}. */
  public String join() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  /** Extends this chain by one attribute step. */
  public QualifiedName withAttribute(String attribute) {
    checkArgument(!attribute.isEmpty(), "empty attribute");
    return new AttributeQname(this, attribute);
  }

  /** Returns {@code this[index]} for a numeric literal index. */
  public QualifiedName withSubscript(double index) {
    checkArgument(!Double.isNaN(index), "NaN index");
    // Normalize so that 0.0 and -0.0 name the same element.
    return new SubscriptQname(this, index == 0 ? 0.0 : index);
  }

  /** Returns {@code this['key']} for a string literal index. */
  public QualifiedName withSubscript(String key) {
    return new SubscriptQname(this, key);
  }

  @Override
  public final String toString() {
    return join();
  }

  /** A plain identifier. */
  private static final class SimpleQname extends QualifiedName {
    final String name;

    SimpleQname(String name) {
      this.name = name;
    }

    @Override
    public @Nullable QualifiedName getOwner() {
      return null;
    }

    @Override
    public String getComponent() {
      return name;
    }

    @Override
    public boolean isSimple() {
      return true;
    }

    @Override
    void appendTo(StringBuilder sb) {
      sb.append(name);
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof SimpleQname && ((SimpleQname) o).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A qualified name built with an extra attribute access on an existing qualified name. */
  private static final class AttributeQname extends QualifiedName {
    final QualifiedName owner;
    final String attribute;

    AttributeQname(QualifiedName owner, String attribute) {
      this.owner = checkNotNull(owner);
      this.attribute = attribute;
    }

    @Override
    public QualifiedName getOwner() {
      return owner;
    }

    @Override
    public String getComponent() {
      return attribute;
    }

    @Override
    public boolean isSimple() {
      return false;
    }

    @Override
    void appendTo(StringBuilder sb) {
      owner.appendTo(sb);
      sb.append('.').append(attribute);
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (!(o instanceof AttributeQname)) {
        return false;
      }
      AttributeQname that = (AttributeQname) o;
      return attribute.equals(that.attribute) && owner.equals(that.owner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(owner, '.', attribute);
    }
  }

  /** A qualified name built with a literal subscript on an existing qualified name. */
  private static final class SubscriptQname extends QualifiedName {
    final QualifiedName owner;

    // Either a Double or a String. The two never compare equal, so a[0] and a['0'] differ.
    @SuppressWarnings("Immutable")
    final Object key;

    SubscriptQname(QualifiedName owner, Object key) {
      this.owner = checkNotNull(owner);
      this.key = key;
    }

    @Override
    public QualifiedName getOwner() {
      return owner;
    }

    @Override
    public String getComponent() {
      return "[" + formatKey() + "]";
    }

    private String formatKey() {
      return key instanceof Double
          ? Node.formatNumber((Double) key)
          : "'" + key + "'";
    }

    @Override
    public boolean isSimple() {
      return false;
    }

    @Override
    void appendTo(StringBuilder sb) {
      owner.appendTo(sb);
      sb.append('[').append(formatKey()).append(']');
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (!(o instanceof SubscriptQname)) {
        return false;
      }
      SubscriptQname that = (SubscriptQname) o;
      return key.equals(that.key) && owner.equals(that.owner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(owner, '[', key);
    }
  }

  /**
   * A reference that could not be resolved further. Identified by the id of the node it came from,
   * so names from different trees are only comparable within one tree.
   */
  private static final class OpaqueQname extends QualifiedName {
    final @Nullable QualifiedName owner;
    final int originId;

    OpaqueQname(@Nullable QualifiedName owner, Node origin) {
      checkArgument(origin.isIndexed(), "opaque origin is not indexed: %s", origin);
      this.owner = owner;
      this.originId = origin.getId();
    }

    @Override
    public @Nullable QualifiedName getOwner() {
      return owner;
    }

    @Override
    public String getComponent() {
      return owner == null ? "<?>" : "[?]";
    }

    @Override
    public boolean isSimple() {
      return false;
    }

    @Override
    public boolean isOpaque() {
      return true;
    }

    @Override
    void appendTo(StringBuilder sb) {
      if (owner != null) {
        owner.appendTo(sb);
      }
      sb.append(getComponent());
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (!(o instanceof OpaqueQname)) {
        return false;
      }
      OpaqueQname that = (OpaqueQname) o;
      return originId == that.originId && Objects.equals(owner, that.owner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(owner, "[?]", originId);
    }
  }
}
