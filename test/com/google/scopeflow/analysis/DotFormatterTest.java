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

import static com.google.common.truth.Truth.assertThat;

import com.google.scopeflow.tree.IR;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.SyntaxTree;
import com.google.scopeflow.tree.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DotFormatterTest {
  /** Tests that keys are assigned sequentially. */
  @Test
  public void testKeyAssignementSequential() throws Exception {
    DotFormatter dot = DotFormatter.newInstanceForTesting();
    assertThat(dot.key(new Node(Token.BLOCK))).isEqualTo(0);
    assertThat(dot.key(new Node(Token.BLOCK))).isEqualTo(1);
    assertThat(dot.key(new Node(Token.BLOCK))).isEqualTo(2);
  }

  /** Tests that keys are assigned once per node. */
  @Test
  public void testKeyAssignementOncePerNode() throws Exception {
    DotFormatter dot = DotFormatter.newInstanceForTesting();
    Node node0 = new Node(Token.BLOCK);
    Node node1 = new Node(Token.BLOCK);

    assertThat(dot.key(node0)).isEqualTo(0);
    assertThat(dot.key(node1)).isEqualTo(1);
    assertThat(dot.key(node0)).isEqualTo(0);
    assertThat(dot.key(node1)).isEqualTo(1);
  }

  /** Tests the formatting (simple tree). */
  @Test
  public void testToDotSimpleName() throws Exception {
    Node ast = IR.name("dummy");

    String expected =
        "digraph AST {\n"
            + "  node [color=lightblue2, style=filled];\n"
            + "  node0 [label=\"NAME(dummy)\"];\n"
            + "}\n";
    assertThat(DotFormatter.toDot(ast)).isEqualTo(expected);
  }

  /** Tests the formatting (3 element tree). */
  @Test
  public void testToDot3Elements() throws Exception {
    Node ast = IR.add(IR.name("a"), IR.number(1));

    String expected =
        "digraph AST {\n"
            + "  node [color=lightblue2, style=filled];\n"
            + "  node0 [label=\"ADD\"];\n"
            + "  node1 [label=\"NAME(a)\"];\n"
            + "  node0 -> node1 [weight=1];\n"
            + "  node2 [label=\"NUMBER(1)\"];\n"
            + "  node0 -> node2 [weight=1];\n"
            + "}\n";
    assertThat(DotFormatter.toDot(ast)).isEqualTo(expected);
  }

  @Test
  public void testQuotesAreEscaped() throws Exception {
    assertThat(DotFormatter.toDot(IR.string("say \"hi\"")))
        .contains("node0 [label=\"STRING(say \\\"hi\\\")\"];");
  }

  /** Tests the formatting with control flow edges. */
  @Test
  public void testToDotWithControlFlow() throws Exception {
    Node module = IR.module(IR.pass());
    AnalysisSession session =
        AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("test"));
    ControlFlowGraph<Node> cfg = new ControlFlowAnalysis().computeCfg(session, module);

    String expected =
        "digraph AST {\n"
            + "  node [color=lightblue2, style=filled];\n"
            + "  node0 [label=\"MODULE\"];\n"
            + "  node1 [label=\"PASS\"];\n"
            + "  node0 -> node1 [weight=1];\n"
            + "  node1 -> EXIT [label=\"UNCOND\", fontcolor=\"red\", weight=0.01,"
            + " color=\"red\"];\n"
            + "  node0 -> node1 [label=\"UNCOND\", fontcolor=\"red\", weight=0.01,"
            + " color=\"red\"];\n"
            + "}\n";
    assertThat(DotFormatter.toDot(module, cfg)).isEqualTo(expected);

    StringBuilder builder = new StringBuilder();
    DotFormatter.appendDot(module, cfg, builder);
    assertThat(builder.toString()).isEqualTo(expected);
  }

  @Test
  public void testUnreachableNodesAreGray() throws Exception {
    Node module = IR.module(IR.raise(), IR.pass());
    AnalysisSession session =
        AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("test"));
    ControlFlowGraph<Node> cfg = new ControlFlowAnalysis().computeCfg(session, module);

    String dot = DotFormatter.toDot(module, cfg);
    assertThat(dot).contains("  node2 [label=\"PASS\" color=\"gray\"];\n");
    assertThat(dot).contains("  node1 -> EXIT [label=\"EXIT\"");
    // The dead statement keeps its edge, but is not marked as an exit.
    assertThat(dot).contains("  node2 -> EXIT [label=\"UNCOND\"");
    assertThat(dot).doesNotContain("  node2 -> EXIT [label=\"EXIT\"");
  }

  @Test
  public void testToDotWithAnnotations() throws Exception {
    Node f =
        IR.function(
            "f", IR.paramList(), IR.block(IR.returnNode(IR.name("a"))));
    AnalysisSession session =
        AnalysisSession.create(SyntaxTree.index(f), ScopeContext.forScope("test"));
    ControlFlowGraph<Node> cfg = ScopeAnalyzer.create().analyze(session, f);

    String dot = DotFormatter.toDotWithAnnotations(f, cfg, session.getAnnotations());
    // The live-in and live-out sets are printed below the label.
    assertThat(dot).contains("[label=\"RETURN\\nIN: [a] OUT: []\"];");
  }

  @Test
  public void testFallingOffTheEndIsAnEdgeToExit() throws Exception {
    // if a:
    //   pass
    Node ifNode = IR.ifNode(IR.name("a"), IR.block(IR.pass()));
    Node module = IR.module(ifNode);
    AnalysisSession session =
        AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("test"));
    ControlFlowGraph<Node> cfg = new ControlFlowAnalysis().computeCfg(session, module);

    String dot = DotFormatter.toDot(module, cfg);
    assertThat(dot)
        .contains(
            "  node1 -> EXIT [label=\"ON_FALSE\", fontcolor=\"red\", weight=0.01,"
                + " color=\"red\"];\n");
    assertThat(dot).doesNotContain("label=\"EXIT\"");
  }
}
