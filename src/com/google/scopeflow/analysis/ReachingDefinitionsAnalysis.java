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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.analysis.graph.LatticeElement;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Computes which definitions may reach each control point of a scope. This is a forward
 * may-analysis: a definition reaches a point if some path from the definition to the point does
 * not modify its symbol again.
 */
final class ReachingDefinitionsAnalysis
    extends DataFlowAnalysis<Node, ReachingDefinitionsAnalysis.ReachingDefinitionsLattice> {

  /** The set of definitions that may reach a point, indexed into the scope's definitions. */
  static final class ReachingDefinitionsLattice implements LatticeElement {
    private final BitSet reaching;

    private ReachingDefinitionsLattice(int numDefinitions) {
      this.reaching = new BitSet(numDefinitions);
    }

    private ReachingDefinitionsLattice(ReachingDefinitionsLattice other) {
      checkNotNull(other);
      this.reaching = (BitSet) other.reaching.clone();
    }

    @Override
    public boolean equals(@Nullable Object other) {
      return other instanceof ReachingDefinitionsLattice
          && reaching.equals(((ReachingDefinitionsLattice) other).reaching);
    }

    @Override
    public int hashCode() {
      return reaching.hashCode();
    }

    @Override
    public String toString() {
      return reaching.toString();
    }
  }

  private final ImmutableList<Definition> definitions;
  private final Map<Node, BitSet> gen = new HashMap<>();
  private final Map<Node, BitSet> kill = new HashMap<>();

  /**
   * @param cfg the graph of the scope, annotated on its root
   * @param store the annotations holding the activity of the scope
   * @throws MissingAnnotationException if the activity of the scope was not computed
   */
  ReachingDefinitionsAnalysis(ControlFlowGraph<Node> cfg, AnnotationStore store) {
    super(cfg);
    Node scopeRoot = cfg.getEntry().getValue();

    ImmutableList.Builder<Definition> allDefinitions = ImmutableList.builder();
    Map<QualifiedName, BitSet> definitionsBySymbol = new HashMap<>();
    Map<Node, StatementActivity> activities = new HashMap<>();
    int count = 0;
    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      Node site = node.getValue();
      StatementActivity activity =
          ActivityAnalyzer.getControlPointActivity(store, scopeRoot, site);
      activities.put(site, activity);
      BitSet nodeGen = new BitSet();
      for (QualifiedName symbol : activity.getModified()) {
        allDefinitions.add(Definition.create(symbol, site));
        definitionsBySymbol.computeIfAbsent(symbol, k -> new BitSet()).set(count);
        nodeGen.set(count);
        count++;
      }
      gen.put(site, nodeGen);
    }
    this.definitions = allDefinitions.build();

    for (Map.Entry<Node, StatementActivity> entry : activities.entrySet()) {
      BitSet nodeKill = new BitSet(count);
      for (QualifiedName symbol : entry.getValue().getModified()) {
        nodeKill.or(definitionsBySymbol.get(symbol));
      }
      kill.put(entry.getKey(), nodeKill);
    }
  }

  @Override
  boolean isForward() {
    return true;
  }

  @Override
  int getMaxSteps() {
    ControlFlowGraph<Node> cfg = getCfg();
    return propagationStepBound(cfg.getNodeCount(), cfg.getEdgeCount(), definitions.size());
  }

  @Override
  ReachingDefinitionsLattice flowThrough(Node node, ReachingDefinitionsLattice input) {
    ReachingDefinitionsLattice result = new ReachingDefinitionsLattice(input);
    result.reaching.andNot(kill.get(node));
    result.reaching.or(gen.get(node));
    return result;
  }

  @Override
  FlowJoiner<ReachingDefinitionsLattice> createFlowJoiner() {
    return new FlowJoiner<ReachingDefinitionsLattice>() {
      private final ReachingDefinitionsLattice result = createInitialEstimateLattice();

      @Override
      public void joinFlow(ReachingDefinitionsLattice input) {
        result.reaching.or(input.reaching);
      }

      @Override
      public ReachingDefinitionsLattice finish() {
        return result;
      }
    };
  }

  @Override
  ReachingDefinitionsLattice createEntryLattice() {
    return new ReachingDefinitionsLattice(definitions.size());
  }

  @Override
  ReachingDefinitionsLattice createInitialEstimateLattice() {
    return new ReachingDefinitionsLattice(definitions.size());
  }

  ImmutableList<Definition> getDefinitions() {
    return definitions;
  }

  /** Returns the definitions reaching the entry of {@code node}. */
  ImmutableSet<Definition> getReachingIn(DiGraphNode<Node, Branch> node) {
    BitSet reaching = getFlowState(node).getIn().reaching;
    ImmutableSet.Builder<Definition> result = ImmutableSet.builder();
    for (int i = reaching.nextSetBit(0); i >= 0; i = reaching.nextSetBit(i + 1)) {
      result.add(definitions.get(i));
    }
    return result.build();
  }
}
