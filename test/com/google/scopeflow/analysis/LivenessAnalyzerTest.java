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
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.IR;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import com.google.scopeflow.tree.SyntaxTree;
import com.google.scopeflow.tree.Token;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link LivenessAnalyzer}. Assertions are made on the live-in and live-out sets of
 * individual control points.
 */
@RunWith(JUnit4.class)
public final class LivenessAnalyzerTest {

  private AnalysisSession session;

  private ControlFlowGraph<Node> computeLiveness(Node root) {
    return computeLiveness(root, new LivenessAnalyzer());
  }

  private ControlFlowGraph<Node> computeLiveness(Node root, LivenessAnalyzer analyzer) {
    session = AnalysisSession.create(SyntaxTree.index(root), ScopeContext.forScope("test"));
    new QualifiedNameResolver().process(session, root);
    new ActivityAnalyzer().process(session, root);
    new ControlFlowAnalysis().process(session, root);
    analyzer.process(session, root);
    return session.getAnnotations().get(root, NodeAnnotations.CFG);
  }

  private ImmutableList<String> liveIn(Node n) {
    return joined(session.getAnnotations().get(n, NodeAnnotations.LIVE_IN));
  }

  private ImmutableList<String> liveOut(Node n) {
    return joined(session.getAnnotations().get(n, NodeAnnotations.LIVE_OUT));
  }

  private static ImmutableList<String> joined(ImmutableSet<QualifiedName> names) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (QualifiedName name : names) {
      result.add(name.join());
    }
    return result.build();
  }

  private void assertLiveBefore(Node n, String name) {
    assertWithMessage("%s should be live before %s", name, n).that(liveIn(n)).contains(name);
  }

  private void assertNotLiveBefore(Node n, String name) {
    assertWithMessage("%s should not be live before %s", name, n)
        .that(liveIn(n))
        .doesNotContain(name);
  }

  private void assertNotLiveAfter(Node n, String name) {
    assertWithMessage("%s should not be live after %s", name, n)
        .that(liveOut(n))
        .doesNotContain(name);
  }

  @Test
  public void testStraightLine() {
    // def f():
    //   b = a + 1
    //   return b
    Node assign = IR.assign(IR.name("b"), IR.add(IR.name("a"), IR.number(1)));
    Node ret = IR.returnNode(IR.name("b"));
    Node f = IR.function("f", IR.paramList(), IR.block(assign, ret));

    computeLiveness(f);

    assertThat(liveIn(assign)).containsExactly("a");
    assertThat(liveOut(assign)).containsExactly("b");
    assertThat(liveIn(ret)).containsExactly("b");
    assertThat(liveOut(ret)).isEmpty();
    assertThat(liveIn(f)).containsExactly("a");
  }

  @Test
  public void testBranches() {
    // def f():
    //   if a > 0:
    //     return a
    //   else:
    //     b = -a
    Node ret = IR.returnNode(IR.name("a"));
    Node assign = IR.assign(IR.name("b"), IR.neg(IR.name("a")));
    Node ifNode =
        IR.ifNode(IR.gt(IR.name("a"), IR.number(0)), IR.block(ret), IR.block(assign));
    Node f = IR.function("f", IR.paramList(), IR.block(ifNode));

    computeLiveness(f);

    assertThat(liveIn(ifNode)).containsExactly("a");
    assertThat(liveOut(ifNode)).containsExactly("a");
    assertThat(liveIn(assign)).containsExactly("a");
    // b is never read afterwards.
    assertNotLiveAfter(assign, "b");
  }

  @Test
  public void testParametersAreDefinedOnEntry() {
    // def f(x):
    //   return x + y
    Node ret = IR.returnNode(IR.add(IR.name("x"), IR.name("y")));
    Node f = IR.function("f", IR.paramList("x"), IR.block(ret));

    computeLiveness(f);

    assertThat(liveOut(f)).containsExactly("x", "y");
    assertThat(liveIn(f)).containsExactly("y");
  }

  @Test
  public void testLoop() {
    // def f(n):
    //   i = 0
    //   while i < n:
    //     i += 1
    //   return i
    Node init = IR.assign(IR.name("i"), IR.number(0));
    Node increment = IR.augAssign(Token.ASSIGN_ADD, IR.name("i"), IR.number(1));
    Node loop = IR.whileNode(IR.lt(IR.name("i"), IR.name("n")), IR.block(increment));
    Node ret = IR.returnNode(IR.name("i"));
    Node f = IR.function("f", IR.paramList("n"), IR.block(init, loop, ret));

    computeLiveness(f);

    assertThat(liveIn(loop)).containsExactly("i", "n");
    // n stays live around the back edge.
    assertThat(liveOut(increment)).containsExactly("i", "n");
    assertThat(liveIn(init)).containsExactly("n");
    assertNotLiveBefore(init, "i");
    assertThat(liveIn(f)).isEmpty();
  }

  @Test
  public void testAttributes() {
    // a.b = 1
    // return a.b
    Node assign = IR.assign(IR.attributeChain("a.b"), IR.number(1));
    Node ret = IR.returnNode(IR.attributeChain("a.b"));
    Node f = IR.function("f", IR.paramList(), IR.block(assign, ret));

    computeLiveness(f);

    assertThat(liveIn(ret)).containsExactly("a.b", "a");
    // Assigning a.b kills a.b but reads a.
    assertThat(liveIn(assign)).containsExactly("a");
  }

  @Test
  public void testDeleteKills() {
    // del a
    // return a
    Node del = IR.del(IR.name("a"));
    Node ret = IR.returnNode(IR.name("a"));
    computeLiveness(IR.function("f", IR.paramList(), IR.block(del, ret)));

    assertLiveBefore(ret, "a");
    assertNotLiveBefore(del, "a");
  }

  @Test
  public void testAssignmentKillsSymbolReadByNestedFunction() {
    // x = 1
    // def g():
    //   return x
    // x = 2
    // print(x)
    Node first = IR.assign(IR.name("x"), IR.number(1));
    Node g = IR.function("g", IR.paramList(), IR.block(IR.returnNode(IR.name("x"))));
    Node second = IR.assign(IR.name("x"), IR.number(2));
    Node print = IR.exprResult(IR.call(IR.name("print"), IR.name("x")));
    Node module = IR.module(first, g, second, print);

    computeLiveness(module);

    assertThat(liveIn(print)).containsExactly("print", "x");
    assertThat(liveIn(second)).containsExactly("print");
    assertThat(liveIn(g)).containsExactly("print");
    assertThat(liveIn(first)).containsExactly("print");
  }

  @Test
  public void testClosureReadsCanBeKeptLive() {
    // x = 1
    // def g():
    //   return x
    // x = 2
    // print(x)
    Node first = IR.assign(IR.name("x"), IR.number(1));
    Node g = IR.function("g", IR.paramList(), IR.block(IR.returnNode(IR.name("x"))));
    Node second = IR.assign(IR.name("x"), IR.number(2));
    Node print = IR.exprResult(IR.call(IR.name("print"), IR.name("x")));
    Node module = IR.module(first, g, second, print);

    computeLiveness(module, LivenessAnalyzer.keepingClosureReadsLive());

    assertThat(liveIn(second)).containsExactly("print", "x");
    assertLiveBefore(first, "x");
  }

  @Test
  public void testClosureReadsAreOpaqueByDefault() {
    Node outer = closureProgram();
    Node init = outer.getLastChild().getFirstChild();
    Node innerDef = init.getNext();

    computeLiveness(outer);

    // x is live only because of the final return, and the assignment kills it.
    assertThat(liveIn(innerDef)).containsExactly("x");
    assertNotLiveBefore(init, "x");
    assertThat(liveIn(outer)).isEmpty();
  }

  @Test
  public void testKeptClosureReadsAreNeverKilled() {
    Node outer = closureProgram();
    Node init = outer.getLastChild().getFirstChild();
    Node innerDef = init.getNext();
    Node call = innerDef.getNext();
    Node ret = call.getNext();

    computeLiveness(outer, LivenessAnalyzer.keepingClosureReadsLive());

    assertThat(liveIn(ret)).containsExactly("x");
    assertThat(liveIn(call)).containsExactly("inner", "x");
    // The def kills the function name, but x is read by the closure.
    assertThat(liveIn(innerDef)).containsExactly("x");
    assertLiveBefore(init, "x");
    // y is not a symbol of outer.
    assertThat(liveIn(outer)).containsExactly("x");
  }

  /**
   * <pre>
   * def outer():
   *   x = 1
   *   def inner():
   *     nonlocal x
   *     x = x + 1
   *     return y
   *   inner()
   *   return x
   * </pre>
   */
  private static Node closureProgram() {
    Node innerDef =
        IR.function(
            "inner",
            IR.paramList(),
            IR.block(
                IR.nonlocal("x"),
                IR.assign(IR.name("x"), IR.add(IR.name("x"), IR.number(1))),
                IR.returnNode(IR.name("y"))));
    Node init = IR.assign(IR.name("x"), IR.number(1));
    Node call = IR.exprResult(IR.call(IR.name("inner")));
    Node ret = IR.returnNode(IR.name("x"));
    return IR.function("outer", IR.paramList(), IR.block(init, innerDef, call, ret));
  }

  @Test
  public void testLambdaScope() {
    Node body = IR.add(IR.name("a"), IR.name("d"));
    Node lambda = IR.lambda(IR.paramList("a"), body);

    computeLiveness(lambda);

    assertThat(liveIn(body)).containsExactly("a", "d");
    assertThat(liveOut(body)).isEmpty();
    assertThat(liveIn(lambda)).containsExactly("d");
  }

  @Test
  public void testUnreachableNodesAreAnnotated() {
    // def f():
    //   return a
    //   b = c
    Node ret = IR.returnNode(IR.name("a"));
    Node dead = IR.assign(IR.name("b"), IR.name("c"));
    computeLiveness(IR.function("f", IR.paramList(), IR.block(ret, dead)));

    assertThat(liveIn(dead)).containsExactly("c");
    assertThat(liveOut(dead)).isEmpty();
    assertThat(liveIn(ret)).containsExactly("a");
  }

  @Test
  public void testLiveInCoversReadsNotModified() {
    for (Node root : samplePrograms()) {
      ControlFlowGraph<Node> cfg = computeLiveness(root);
      AnnotationStore store = session.getAnnotations();
      for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
        StatementActivity activity =
            ActivityAnalyzer.getControlPointActivity(store, root, node.getValue());
        ImmutableSet<QualifiedName> liveIn = store.get(node.getValue(), NodeAnnotations.LIVE_IN);
        assertWithMessage("live-in of %s", node.getValue())
            .that(liveIn)
            .containsAtLeastElementsIn(
                Sets.difference(activity.getRead(), activity.getModified()));
      }
    }
  }

  @Test
  public void testLivenessEquationsHoldExactly() {
    for (Node root : samplePrograms()) {
      ControlFlowGraph<Node> cfg = computeLiveness(root);
      AnnotationStore store = session.getAnnotations();
      for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
        Node n = node.getValue();
        StatementActivity activity = ActivityAnalyzer.getControlPointActivity(store, root, n);
        Set<QualifiedName> successorsLiveIn = new HashSet<>();
        for (DiGraphNode<Node, Branch> succ : cfg.getDirectedSuccNodes(node)) {
          // Nothing is live once control leaves the scope.
          if (!cfg.isImplicitReturn(succ)) {
            successorsLiveIn.addAll(store.get(succ.getValue(), NodeAnnotations.LIVE_IN));
          }
        }
        ImmutableSet<QualifiedName> liveOut = store.get(n, NodeAnnotations.LIVE_OUT);
        assertWithMessage("live-out of %s", n).that(liveOut).isEqualTo(successorsLiveIn);
        assertWithMessage("live-in of %s", n)
            .that(store.get(n, NodeAnnotations.LIVE_IN))
            .isEqualTo(
                Sets.union(Sets.difference(liveOut, activity.getModified()), activity.getRead()));
      }
    }
  }

  @Test
  public void testRunningAgainGivesTheSameAnnotations() {
    Node root = samplePrograms().get(0);
    ControlFlowGraph<Node> cfg = computeLiveness(root);
    AnnotationStore store = session.getAnnotations();
    Map<Node, ImmutableSet<QualifiedName>> firstIn = new HashMap<>();
    Map<Node, ImmutableSet<QualifiedName>> firstOut = new HashMap<>();
    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      firstIn.put(node.getValue(), store.get(node.getValue(), NodeAnnotations.LIVE_IN));
      firstOut.put(node.getValue(), store.get(node.getValue(), NodeAnnotations.LIVE_OUT));
    }

    new LivenessAnalyzer().process(session, root);

    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      assertThat(store.get(node.getValue(), NodeAnnotations.LIVE_IN))
          .isEqualTo(firstIn.get(node.getValue()));
      assertThat(store.get(node.getValue(), NodeAnnotations.LIVE_OUT))
          .isEqualTo(firstOut.get(node.getValue()));
    }
  }

  @Test
  public void testRequiresControlFlowGraph() {
    Node module = IR.module(IR.pass());
    session = AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("test"));
    new QualifiedNameResolver().process(session, module);
    new ActivityAnalyzer().process(session, module);

    MissingAnnotationException e =
        assertThrows(
            MissingAnnotationException.class,
            () -> new LivenessAnalyzer().process(session, module));
    assertThat(e.getKey()).isSameInstanceAs(NodeAnnotations.CFG);
  }

  @Test
  public void testRequiresActivity() {
    Node module = IR.module(IR.pass());
    session = AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("test"));
    new ControlFlowAnalysis().process(session, module);

    assertThrows(
        MissingAnnotationException.class, () -> new LivenessAnalyzer().process(session, module));
  }

  private static ImmutableList<Node> samplePrograms() {
    // def f(n):
    //   total = 0
    //   for x in xs:
    //     if x > n:
    //       break
    //     total += x
    //   while total:
    //     total = total - n
    //     continue
    //   return total
    Node first =
        IR.function(
            "f",
            IR.paramList("n"),
            IR.block(
                IR.assign(IR.name("total"), IR.number(0)),
                IR.forNode(
                    IR.name("x"),
                    IR.name("xs"),
                    IR.block(
                        IR.ifNode(IR.gt(IR.name("x"), IR.name("n")), IR.block(IR.breakNode())),
                        IR.augAssign(Token.ASSIGN_ADD, IR.name("total"), IR.name("x")))),
                IR.whileNode(
                    IR.name("total"),
                    IR.block(
                        IR.assign(IR.name("total"), IR.sub(IR.name("total"), IR.name("n"))),
                        IR.continueNode())),
                IR.returnNode(IR.name("total"))));
    // a, b = b, a
    // a.c = a[0]
    // del b
    Node second =
        IR.module(
            IR.assign(
                IR.tuple(IR.name("a"), IR.name("b")), IR.tuple(IR.name("b"), IR.name("a"))),
            IR.assign(IR.attributeChain("a.c"), IR.subscript(IR.name("a"), IR.number(0))),
            IR.del(IR.name("b")));
    // x = 1
    // def g():
    //   return x
    // if x:
    //   x = 2
    Node third =
        IR.module(
            IR.assign(IR.name("x"), IR.number(1)),
            IR.function("g", IR.paramList(), IR.block(IR.returnNode(IR.name("x")))),
            IR.ifNode(IR.name("x"), IR.block(IR.assign(IR.name("x"), IR.number(2)))));
    return ImmutableList.of(first, second, third);
  }
}
