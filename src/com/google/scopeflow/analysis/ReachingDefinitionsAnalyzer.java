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

import com.google.common.collect.ImmutableSet;
import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.logging.Logger;

/**
 * Writes {@link NodeAnnotations#DEFS_IN} on every control point of a scope. Has the same
 * requirements as {@link LivenessAnalyzer}.
 */
public final class ReachingDefinitionsAnalyzer implements AnalysisPass {

  private static final Logger logger =
      Logger.getLogger(ReachingDefinitionsAnalyzer.class.getName());

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    AnnotationStore store = session.getAnnotations();
    ControlFlowGraph<Node> cfg = store.get(scopeRoot, NodeAnnotations.CFG);

    ReachingDefinitionsAnalysis analysis = new ReachingDefinitionsAnalysis(cfg, store);
    analysis.analyze();

    AnnotationStore.Writer writer = store.writer(AnnotationOwner.REACHING_DEFINITIONS);
    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      writer.set(node.getValue(), NodeAnnotations.DEFS_IN, analysis.getReachingIn(node));
    }
    logger.fine(
        () ->
            "Reaching definitions of "
                + scopeRoot
                + " converged after "
                + analysis.getStepCount()
                + " steps over "
                + analysis.getDefinitions().size()
                + " definitions");
  }

  /**
   * Returns the definitions of {@code symbol} that may reach {@code n}, which must be a control
   * point of an analyzed scope.
   *
   * @throws MissingAnnotationException if {@code n} was not analyzed
   */
  public static ImmutableSet<Definition> getReachingDefinitions(
      AnnotationStore store, Node n, QualifiedName symbol) {
    ImmutableSet.Builder<Definition> result = ImmutableSet.builder();
    for (Definition definition : store.get(n, NodeAnnotations.DEFS_IN)) {
      if (definition.getSymbol().equals(symbol)) {
        result.add(definition);
      }
    }
    return result.build();
  }
}
