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

import com.google.common.collect.ImmutableList;
import com.google.scopeflow.tree.Node;
import java.util.logging.Logger;

/**
 * Runs the core passes over one scope in dependency order: qualified names, activity, control flow
 * and liveness, optionally followed by reaching definitions.
 *
 * <p>Each call creates fresh pass instances, so one analyzer can serve independent sessions on
 * several threads.
 */
public final class ScopeAnalyzer implements AnalysisPass {

  private static final Logger logger = Logger.getLogger(ScopeAnalyzer.class.getName());

  private final boolean computeReachingDefinitions;

  private ScopeAnalyzer(boolean computeReachingDefinitions) {
    this.computeReachingDefinitions = computeReachingDefinitions;
  }

  public static ScopeAnalyzer create() {
    return new ScopeAnalyzer(false);
  }

  /** Also runs {@link ReachingDefinitionsAnalyzer} after the core passes. */
  public static ScopeAnalyzer createWithReachingDefinitions() {
    return new ScopeAnalyzer(true);
  }

  private ImmutableList<AnalysisPass> createPasses() {
    ImmutableList.Builder<AnalysisPass> passes = ImmutableList.builder();
    passes.add(
        new QualifiedNameResolver(),
        new ActivityAnalyzer(),
        new ControlFlowAnalysis(),
        new LivenessAnalyzer());
    if (computeReachingDefinitions) {
      passes.add(new ReachingDefinitionsAnalyzer());
    }
    return passes.build();
  }

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    analyze(session, scopeRoot);
  }

  /**
   * Analyzes the scope rooted at {@code scopeRoot}. If a pass fails, the passes after it do not
   * run and the annotations of the passes before it are kept.
   *
   * @return the control flow graph of the scope
   */
  public ControlFlowGraph<Node> analyze(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    for (AnalysisPass pass : createPasses()) {
      logger.fine(() -> "Running " + pass.getClass().getSimpleName() + " on " + scopeRoot);
      pass.process(session, scopeRoot);
    }
    return session.getAnnotations().get(scopeRoot, NodeAnnotations.CFG);
  }
}
