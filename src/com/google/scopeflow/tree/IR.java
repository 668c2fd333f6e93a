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

import com.google.common.collect.ImmutableSet;

/** A tree construction helper class. */
public final class IR {

  private IR() {}

  public static Node module(Node... stmts) {
    for (Node stmt : stmts) {
      checkStatement(stmt);
    }
    return new Node(Token.MODULE, stmts);
  }

  public static Node function(String name, Node params, Node body) {
    return function(name(name), params, body);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node lambda(Node params, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST);
    checkExpression(body);
    return new Node(Token.LAMBDA, params, body);
  }

  public static Node paramList(Node... params) {
    for (Node param : params) {
      checkState(param.isName() || param.isDefaultValue(), param);
    }
    return new Node(Token.PARAM_LIST, params);
  }

  public static Node paramList(String first, String... rest) {
    Node params = new Node(Token.PARAM_LIST, name(first));
    for (String name : rest) {
      params.addChildToBack(name(name));
    }
    return params;
  }

  public static Node defaultValue(Node name, Node value) {
    checkState(name.isName());
    checkExpression(value);
    return new Node(Token.DEFAULT_VALUE, name, value);
  }

  public static Node block(Node... stmts) {
    for (Node stmt : stmts) {
      checkStatement(stmt);
    }
    return new Node(Token.BLOCK, stmts);
  }

  // Statements

  public static Node exprResult(Node expr) {
    checkExpression(expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node assign(Node target, Node value) {
    checkAssignmentTarget(target);
    checkExpression(value);
    return new Node(Token.ASSIGN, target, value);
  }

  /** Creates an augmented assignment such as {@code target += value}. */
  public static Node augAssign(Token op, Node target, Node value) {
    checkArgument(op.isAugmentedAssignment(), op);
    checkReference(target);
    checkExpression(value);
    return new Node(op, target, value);
  }

  public static Node del(Node... targets) {
    checkArgument(targets.length > 0, "del requires a target");
    for (Node target : targets) {
      checkAssignmentTarget(target);
    }
    return new Node(Token.DEL, targets);
  }

  public static Node ifNode(Node cond, Node then) {
    checkExpression(cond);
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkExpression(cond);
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkExpression(cond);
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node forNode(Node target, Node iterable, Node body) {
    checkAssignmentTarget(target);
    checkExpression(iterable);
    checkState(body.isBlock());
    return new Node(Token.FOR, target, iterable, body);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkExpression(expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node raise() {
    return new Node(Token.RAISE);
  }

  public static Node raise(Node expr) {
    checkExpression(expr);
    return new Node(Token.RAISE, expr);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node global(String... names) {
    return declaration(Token.GLOBAL, names);
  }

  public static Node nonlocal(String... names) {
    return declaration(Token.NONLOCAL, names);
  }

  private static Node declaration(Token token, String... names) {
    checkArgument(names.length > 0, "%s requires a name", token);
    Node decl = new Node(token);
    for (String name : names) {
      decl.addChildToBack(name(name));
    }
    return decl;
  }

  public static Node tryNode(Node body, Node handler) {
    checkState(body.isBlock());
    checkState(handler.isBlock());
    return new Node(Token.TRY, body, handler);
  }

  public static Node with(Node resource, Node body) {
    checkExpression(resource);
    checkState(body.isBlock());
    return new Node(Token.WITH, resource, body);
  }

  // References

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return Node.newString(Token.NAME, name);
  }

  public static Node attribute(Node object, String attribute) {
    checkExpression(object);
    Node n = Node.newString(Token.ATTRIBUTE, attribute);
    n.addChildToBack(object);
    return n;
  }

  /** Creates an attribute chain such as {@code a.b.c} from its dotted form. */
  public static Node attributeChain(String dotted) {
    String[] parts = dotted.split("\\.", -1);
    Node n = name(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      n = attribute(n, parts[i]);
    }
    return n;
  }

  public static Node subscript(Node object, Node index) {
    checkExpression(object);
    checkExpression(index);
    return new Node(Token.SUBSCRIPT, object, index);
  }

  // Literals

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(Token.STRING, s);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node none() {
    return new Node(Token.NONE);
  }

  public static Node tuple(Node... elements) {
    for (Node element : elements) {
      checkExpression(element);
    }
    return new Node(Token.TUPLE, elements);
  }

  public static Node list(Node... elements) {
    for (Node element : elements) {
      checkExpression(element);
    }
    return new Node(Token.LIST, elements);
  }

  // Operators

  public static Node call(Node callee, Node... args) {
    checkExpression(callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkExpression(arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node binaryOp(Token op, Node left, Node right) {
    checkArgument(BINARY_OPS.contains(op), "%s is not a binary operator", op);
    checkExpression(left);
    checkExpression(right);
    return new Node(op, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node sub(Node left, Node right) {
    return binaryOp(Token.SUB, left, right);
  }

  public static Node mul(Node left, Node right) {
    return binaryOp(Token.MUL, left, right);
  }

  public static Node gt(Node left, Node right) {
    return binaryOp(Token.GT, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node eq(Node left, Node right) {
    return binaryOp(Token.EQ, left, right);
  }

  public static Node and(Node left, Node right) {
    return binaryOp(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryOp(Token.OR, left, right);
  }

  public static Node not(Node expr) {
    checkExpression(expr);
    return new Node(Token.NOT, expr);
  }

  public static Node neg(Node expr) {
    checkExpression(expr);
    return new Node(Token.NEG, expr);
  }

  public static Node pos(Node expr) {
    checkExpression(expr);
    return new Node(Token.POS, expr);
  }

  public static Node hook(Node cond, Node thenExpr, Node elseExpr) {
    checkExpression(cond);
    checkExpression(thenExpr);
    checkExpression(elseExpr);
    return new Node(Token.HOOK, cond, thenExpr, elseExpr);
  }

  private static final ImmutableSet<Token> BINARY_OPS =
      ImmutableSet.of(
          Token.ADD,
          Token.SUB,
          Token.MUL,
          Token.DIV,
          Token.MOD,
          Token.EQ,
          Token.NE,
          Token.LT,
          Token.LE,
          Token.GT,
          Token.GE,
          Token.AND,
          Token.OR);

  private static void checkStatement(Node n) {
    // Nested functions are definitions, which are statements too.
    checkState(
        n.getToken().getCategory() == Token.Category.STATEMENT || n.isFunction(),
        "%s is not a statement",
        n);
  }

  private static void checkExpression(Node n) {
    switch (n.getToken().getCategory()) {
      case REFERENCE, LITERAL, OPERATOR -> {}
      case SCOPE -> checkState(n.isLambda(), "%s is not an expression", n);
      case STRUCTURE, STATEMENT -> throw new IllegalStateException(n + " is not an expression");
    }
  }

  private static void checkReference(Node n) {
    checkState(n.getToken().getCategory() == Token.Category.REFERENCE, "%s is not a reference", n);
  }

  private static void checkAssignmentTarget(Node n) {
    if (n.getToken() == Token.TUPLE || n.getToken() == Token.LIST) {
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        checkAssignmentTarget(c);
      }
      return;
    }
    checkReference(n);
  }
}
