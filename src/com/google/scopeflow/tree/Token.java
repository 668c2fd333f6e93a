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

/**
 * The node kinds of the program tree.
 *
 * <p>Statement kinds may only appear as children of a {@link #BLOCK} or a {@link #MODULE}.
 */
public enum Token {
  // Scopes
  MODULE, // top level unit, children are statements
  FUNCTION, // NAME PARAM_LIST BLOCK
  LAMBDA, // PARAM_LIST expression

  // Structure
  BLOCK,
  PARAM_LIST, // NAME or DEFAULT_VALUE children
  DEFAULT_VALUE, // NAME expression

  // Statements
  EXPR_RESULT,
  ASSIGN, // target value
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  DEL,
  IF, // condition BLOCK [BLOCK]
  WHILE, // condition BLOCK
  FOR, // target iterable BLOCK
  BREAK,
  CONTINUE,
  RETURN,
  RAISE,
  PASS,
  GLOBAL,
  NONLOCAL,
  TRY,
  WITH,

  // References
  NAME,
  ATTRIBUTE, // object, attribute name is the string payload
  SUBSCRIPT, // object index

  // Literals
  NUMBER,
  STRING,
  TRUE,
  FALSE,
  NONE,
  TUPLE,
  LIST,

  // Operators
  CALL, // callee arguments...
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  AND,
  OR,
  NOT,
  NEG,
  POS,
  HOOK; // condition then else

  /** Broad classification of node kinds. */
  public enum Category {
    SCOPE,
    STRUCTURE,
    STATEMENT,
    REFERENCE,
    LITERAL,
    OPERATOR
  }

  /** Returns the category of this kind. Every kind belongs to exactly one category. */
  public Category getCategory() {
    return switch (this) {
      case MODULE, FUNCTION, LAMBDA -> Category.SCOPE;
      case BLOCK, PARAM_LIST, DEFAULT_VALUE -> Category.STRUCTURE;
      case EXPR_RESULT,
          ASSIGN,
          ASSIGN_ADD,
          ASSIGN_SUB,
          ASSIGN_MUL,
          ASSIGN_DIV,
          DEL,
          IF,
          WHILE,
          FOR,
          BREAK,
          CONTINUE,
          RETURN,
          RAISE,
          PASS,
          GLOBAL,
          NONLOCAL,
          TRY,
          WITH -> Category.STATEMENT;
      case NAME, ATTRIBUTE, SUBSCRIPT -> Category.REFERENCE;
      case NUMBER, STRING, TRUE, FALSE, NONE, TUPLE, LIST -> Category.LITERAL;
      case CALL,
          ADD,
          SUB,
          MUL,
          DIV,
          MOD,
          EQ,
          NE,
          LT,
          LE,
          GT,
          GE,
          AND,
          OR,
          NOT,
          NEG,
          POS,
          HOOK -> Category.OPERATOR;
    };
  }

  /** Whether this kind introduces a new lexical scope. */
  public boolean isScope() {
    return getCategory() == Category.SCOPE;
  }

  /** Whether this is a plain or augmented assignment statement. */
  public boolean isAssignment() {
    return switch (this) {
      case ASSIGN, ASSIGN_ADD, ASSIGN_SUB, ASSIGN_MUL, ASSIGN_DIV -> true;
      default -> false;
    };
  }

  /** Whether this is an augmented assignment, which reads its target before writing it. */
  public boolean isAugmentedAssignment() {
    return isAssignment() && this != ASSIGN;
  }
}
