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

import com.google.scopeflow.tree.Node;

/**
 * One analysis over a scope. Passes read the tree and the annotations of earlier passes and write
 * their own annotations into the session's store. They never change the tree.
 *
 * <p>The caller runs the passes in dependency order: {@link QualifiedNameResolver}, {@link
 * ActivityAnalyzer}, {@link ControlFlowAnalysis}, then the dataflow passes.
 */
public interface AnalysisPass {

  /**
   * Processes the scope rooted at {@code scopeRoot}.
   *
   * @throws InvalidScopeException if {@code scopeRoot} does not introduce a scope
   */
  void process(AnalysisSession session, Node scopeRoot);
}
