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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testFunction() {
    Node function = IR.function("f", IR.paramList("a", "b"), IR.block(IR.pass()));

    assertThat(function.getToken()).isEqualTo(Token.FUNCTION);
    assertThat(function.getFirstChild().getString()).isEqualTo("f");
    assertThat(function.getSecondChild().getChildCount()).isEqualTo(2);
    assertThat(function.getSecondChild().getLastChild().getString()).isEqualTo("b");
    assertThat(function.getLastChild().isBlock()).isTrue();
  }

  @Test
  public void testDefaultValue() {
    Node params = IR.paramList(IR.name("a"), IR.defaultValue(IR.name("b"), IR.number(1)));
    assertThat(params.getLastChild().isDefaultValue()).isTrue();
    assertThrows(
        IllegalStateException.class, () -> IR.paramList(IR.number(1)));
  }

  @Test
  public void testAttributeChain() {
    Node chain = IR.attributeChain("a.b.c");

    assertThat(chain.isAttribute()).isTrue();
    assertThat(chain.getString()).isEqualTo("c");
    assertThat(chain.getFirstChild().getString()).isEqualTo("b");
    assertThat(chain.getFirstChild().getFirstChild().isName()).isTrue();
    assertThat(IR.attributeChain("a").isName()).isTrue();
  }

  @Test
  public void testStatementsMustBeStatements() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.name("a")));
    assertThrows(IllegalStateException.class, () -> IR.module(IR.number(1)));
    // A nested def is a statement.
    assertThat(IR.block(IR.function("g", IR.paramList(), IR.block())).hasChildren()).isTrue();
  }

  @Test
  public void testExpressionsMustBeExpressions() {
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.pass()));
    assertThrows(IllegalStateException.class, () -> IR.add(IR.name("a"), IR.block()));
    assertThrows(
        IllegalStateException.class,
        () -> IR.exprResult(IR.function("g", IR.paramList(), IR.block())));
    assertThat(IR.exprResult(IR.lambda(IR.paramList(), IR.none())).hasChildren()).isTrue();
  }

  @Test
  public void testAssignmentTargets() {
    assertThat(IR.assign(IR.tuple(IR.name("a"), IR.attributeChain("b.c")), IR.name("d")))
        .isNotNull();
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.number(1), IR.name("a")));
    assertThrows(
        IllegalStateException.class,
        () -> IR.assign(IR.tuple(IR.name("a"), IR.call(IR.name("f"))), IR.name("b")));
    assertThrows(IllegalArgumentException.class, () -> IR.del());
  }

  @Test
  public void testAugmentedAssignment() {
    Node n = IR.augAssign(Token.ASSIGN_ADD, IR.name("n"), IR.number(1));
    assertThat(n.getToken().isAugmentedAssignment()).isTrue();
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.augAssign(Token.ASSIGN, IR.name("n"), IR.number(1)));
    assertThrows(
        IllegalStateException.class,
        () -> IR.augAssign(Token.ASSIGN_ADD, IR.tuple(IR.name("n")), IR.number(1)));
  }

  @Test
  public void testBinaryOperators() {
    assertThat(IR.binaryOp(Token.MOD, IR.name("a"), IR.number(2)).getToken())
        .isEqualTo(Token.MOD);
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.binaryOp(Token.NOT, IR.name("a"), IR.name("b")));
  }

  @Test
  public void testDeclarations() {
    Node global = IR.global("a", "b");
    assertThat(global.getToken()).isEqualTo(Token.GLOBAL);
    assertThat(global.getChildCount()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> IR.nonlocal());
  }

  @Test
  public void testEveryTokenHasOneCategory() {
    for (Token token : Token.values()) {
      assertThat(token.getCategory()).isNotNull();
    }
    assertThat(Token.LAMBDA.isScope()).isTrue();
    assertThat(Token.BLOCK.isScope()).isFalse();
    assertThat(Token.ASSIGN.isAssignment()).isTrue();
    assertThat(Token.ASSIGN.isAugmentedAssignment()).isFalse();
  }
}
