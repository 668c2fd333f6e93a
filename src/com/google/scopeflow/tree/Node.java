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
import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of the program tree.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so that appending is constant time. A node can be modified until the tree it belongs to is
 * indexed by {@link SyntaxTree#index}; from then on it is frozen and carries a stable id.
 */
public class Node {

  private final Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private int id = -1;
  private @Nullable SyntaxTree tree;

  private int lineno = -1;
  private int charno = -1;

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNullString(str);
    }

    @Override
    public String getString() {
      return str;
    }

    private static String checkNotNullString(String str) {
      checkArgument(str != null, "string payload must not be null");
      return str;
    }
  }

  private static final class NumberNode extends Node {
    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      checkArgument(!Double.isNaN(number), "NaN literals are not supported");
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }
  }

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the string payload of NAME, STRING and ATTRIBUTE nodes. */
  public String getString() {
    throw new UnsupportedOperationException(token + " does not carry a string");
  }

  /** Returns the payload of NUMBER nodes. */
  public double getDouble() {
    throw new UnsupportedOperationException(token + " does not carry a number");
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public final boolean hasXChildren(int x) {
    return getChildCount() == x;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0 && n != null) {
      n = n.next;
      i--;
    }
    checkArgument(n != null, "no child at index %s", i);
    return n;
  }

  /** Whether {@code node} is this node or one of its ancestors. */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** Returns the closest strict ancestor that introduces a scope, or null. */
  public final @Nullable Node getEnclosingScopeRoot() {
    for (Node n = parent; n != null; n = n.parent) {
      if (n.token.isScope()) {
        return n;
      }
    }
    return null;
  }

  public final void addChildToBack(Node child) {
    checkMutable();
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  /** Returns the id assigned by the tree that indexed this node, or -1 if not indexed yet. */
  public final int getId() {
    return id;
  }

  public final boolean isIndexed() {
    return tree != null;
  }

  /** Returns the tree that indexed this node, or null if the node is not indexed yet. */
  public final @Nullable SyntaxTree getTree() {
    return tree;
  }

  final void index(SyntaxTree tree, int id) {
    checkState(this.tree == null, "%s is already indexed", this);
    this.tree = tree;
    this.id = id;
  }

  public final Node setLinenoCharno(int lineno, int charno) {
    checkMutable();
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  private void checkMutable() {
    checkState(tree == null, "Cannot modify indexed node %s", this);
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isAttribute() {
    return token == Token.ATTRIBUTE;
  }

  public final boolean isSubscript() {
    return token == Token.SUBSCRIPT;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isWhile() {
    return token == Token.WHILE;
  }

  public final boolean isFor() {
    return token == Token.FOR;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  public final boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(formatNumber(getDouble()));
    }
    if (id >= 0) {
      sb.append(" #").append(id);
    }
    if (lineno >= 0) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  /** Renders integral numbers without a fractional part. */
  public static String formatNumber(double number) {
    if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
      return Long.toString((long) number);
    }
    return Double.toString(number);
  }

  /** Prints the tree rooted at this node, one node per line. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(this, 0, sb);
    return sb.toString();
  }

  private static void appendStringTree(Node n, int level, StringBuilder sb) {
    sb.append("    ".repeat(level)).append(n).append('\n');
    for (Node c = n.first; c != null; c = c.next) {
      appendStringTree(c, level + 1, sb);
    }
  }
}
