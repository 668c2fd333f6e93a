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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.scopeflow.tree.IR;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import com.google.scopeflow.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeAnalyzer}. */
@RunWith(JUnit4.class)
public final class ScopeAnalyzerTest {

  /** Builds {@code def f(): b = a + 1; return b}. */
  private static Node createFunction() {
    return IR.function(
        "f",
        IR.paramList(),
        IR.block(
            IR.assign(IR.name("b"), IR.add(IR.name("a"), IR.number(1))),
            IR.returnNode(IR.name("b"))));
  }

  private static AnalysisSession createSession(Node root) {
    return AnalysisSession.create(SyntaxTree.index(root), ScopeContext.forScope("test"));
  }

  @Test
  public void testAnalyzeRunsEveryPass() {
    Node f = createFunction();
    Node assign = f.getLastChild().getFirstChild();
    AnalysisSession session = createSession(f);

    ControlFlowGraph<Node> cfg = ScopeAnalyzer.create().analyze(session, f);

    AnnotationStore store = session.getAnnotations();
    assertThat(store.get(f, NodeAnnotations.CFG)).isSameInstanceAs(cfg);
    assertThat(store.keys(f))
        .containsExactly(
            NodeAnnotations.SCOPE_ACTIVITY,
            NodeAnnotations.CFG,
            NodeAnnotations.LIVE_IN,
            NodeAnnotations.LIVE_OUT);
    assertThat(store.keys(assign))
        .containsExactly(
            NodeAnnotations.STATEMENT_ACTIVITY, NodeAnnotations.LIVE_IN, NodeAnnotations.LIVE_OUT);
    assertThat(store.get(assign.getFirstChild(), NodeAnnotations.CANONICAL_NAME))
        .isEqualTo(QualifiedName.of("b"));
  }

  @Test
  public void testProcess() {
    Node f = createFunction();
    AnalysisSession session = createSession(f);

    ScopeAnalyzer.create().process(session, f);

    assertThat(session.getAnnotations().has(f, NodeAnnotations.LIVE_IN)).isTrue();
  }

  @Test
  public void testFailureKeepsEarlierAnnotations() {
    // def f():
    //   a = 1
    //   with r: pass
    Node name = IR.name("a");
    Node f =
        IR.function(
            "f",
            IR.paramList(),
            IR.block(IR.assign(name, IR.number(1)), IR.with(IR.name("r"), IR.block(IR.pass()))));
    AnalysisSession session = createSession(f);

    assertThrows(
        UnsupportedConstructException.class, () -> ScopeAnalyzer.create().analyze(session, f));

    AnnotationStore store = session.getAnnotations();
    assertThat(store.has(name, NodeAnnotations.CANONICAL_NAME)).isTrue();
    assertThat(store.has(f, NodeAnnotations.CFG)).isFalse();
    assertThat(store.has(f, NodeAnnotations.LIVE_IN)).isFalse();
  }

  @Test
  public void testInvalidScope() {
    Node f = createFunction();
    AnalysisSession session = createSession(f);

    assertThrows(
        InvalidScopeException.class,
        () -> ScopeAnalyzer.create().analyze(session, f.getLastChild()));
    assertThat(session.getAnnotations().annotatedNodeIds()).isEmpty();
  }

  @Test
  public void testNodeOfAnotherTree() {
    AnalysisSession session = createSession(createFunction());
    Node other = createFunction();
    createSession(other);

    assertThrows(
        IllegalArgumentException.class, () -> ScopeAnalyzer.create().analyze(session, other));
  }

  @Test
  public void testIndependentSessionsOnSeveralThreads() throws Exception {
    ScopeAnalyzer analyzer = ScopeAnalyzer.createWithReachingDefinitions();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<ImmutableSet<QualifiedName>>> results = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        results.add(
            executor.submit(
                () -> {
                  Node f = createFunction();
                  AnalysisSession session = createSession(f);
                  analyzer.analyze(session, f);
                  Node assign = f.getLastChild().getFirstChild();
                  return session.getAnnotations().get(assign, NodeAnnotations.LIVE_IN);
                }));
      }
      for (Future<ImmutableSet<QualifiedName>> result : results) {
        assertThat(result.get()).containsExactly(QualifiedName.of("a"));
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
