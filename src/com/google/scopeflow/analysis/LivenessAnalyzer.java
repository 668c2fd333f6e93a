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

import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.Node;
import java.util.logging.Logger;

/**
 * Writes {@link NodeAnnotations#LIVE_IN} and {@link NodeAnnotations#LIVE_OUT} on every control
 * point of a scope. Requires the {@link NodeAnnotations#CFG} annotation on the scope root and the
 * activity annotations of the scope. Running it again recomputes the same annotations.
 *
 * <p>By default every control point follows {@code live_in = (live_out \ modified) union read}
 * exactly, and nested scopes only count through the statement that defines them. {@link
 * #keepingClosureReadsLive()} treats the free reads of nested scopes as live throughout the scope.
 */
public final class LivenessAnalyzer implements AnalysisPass {

  private static final Logger logger = Logger.getLogger(LivenessAnalyzer.class.getName());

  private final boolean escapeClosureReads;

  public LivenessAnalyzer() {
    this(false);
  }

  private LivenessAnalyzer(boolean escapeClosureReads) {
    this.escapeClosureReads = escapeClosureReads;
  }

  /**
   * Returns an analyzer that never kills a symbol read freely by a nested function or lambda, since
   * the closure may run at any later point.
   */
  public static LivenessAnalyzer keepingClosureReadsLive() {
    return new LivenessAnalyzer(true);
  }

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    AnnotationStore store = session.getAnnotations();
    ControlFlowGraph<Node> cfg = store.get(scopeRoot, NodeAnnotations.CFG);

    LiveVariablesAnalysis liveness = new LiveVariablesAnalysis(cfg, session, escapeClosureReads);
    liveness.analyze();

    AnnotationStore.Writer writer = store.writer(AnnotationOwner.LIVENESS);
    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      writer.set(node.getValue(), NodeAnnotations.LIVE_IN, liveness.getLiveIn(node));
      writer.set(node.getValue(), NodeAnnotations.LIVE_OUT, liveness.getLiveOut(node));
    }
    logger.fine(
        () ->
            "Liveness of "
                + scopeRoot
                + " converged after "
                + liveness.getStepCount()
                + " steps over "
                + liveness.getSymbols().size()
                + " symbols");
  }
}
