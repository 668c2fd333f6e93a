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
import com.google.scopeflow.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.analysis.graph.LatticeElement;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Compute the "liveness" of all symbols of a scope at every control point.
 *
 * <p>A symbol is live at a point if some path from that point reads it before it is modified. This
 * is a backward may-analysis:
 *
 * <pre>
 * live_out(n) = union of live_in(s) for every successor s of n
 * live_in(n)  = (live_out(n) \ modified(n)) union read(n)
 * </pre>
 *
 * <p>Nested functions and lambdas are opaque by default: a symbol they read is not live in this
 * scope unless this scope reads it too. With {@code escapeClosureReads}, the free reads of nested
 * scopes are escaped instead: they may be read whenever the closure runs, so an assignment never
 * kills them.
 */
final class LiveVariablesAnalysis
    extends DataFlowAnalysis<Node, LiveVariablesAnalysis.LiveVariableLattice> {

  private static final class LiveVariableJoinOp implements FlowJoiner<LiveVariableLattice> {
    private final LiveVariableLattice result;

    LiveVariableJoinOp(int numSymbols) {
      this.result = new LiveVariableLattice(numSymbols);
    }

    @Override
    public void joinFlow(LiveVariableLattice input) {
      result.liveSet.or(input.liveSet);
    }

    @Override
    public LiveVariableLattice finish() {
      return result;
    }
  }

  /**
   * The lattice that stores the liveness of all symbols at a given point in the program. The whole
   * lattice is the power set of all symbols and a symbol is live if it is in the set.
   */
  static final class LiveVariableLattice implements LatticeElement {
    private final BitSet liveSet;

    /** @param numSymbols Number of all symbols. */
    private LiveVariableLattice(int numSymbols) {
      this.liveSet = new BitSet(numSymbols);
    }

    private LiveVariableLattice(LiveVariableLattice other) {
      checkNotNull(other);
      this.liveSet = (BitSet) other.liveSet.clone();
    }

    @Override
    public boolean equals(@Nullable Object other) {
      return (other instanceof LiveVariableLattice)
          && this.liveSet.equals(((LiveVariableLattice) other).liveSet);
    }

    public boolean isLive(int index) {
      return liveSet.get(index);
    }

    @Override
    public String toString() {
      return liveSet.toString();
    }

    @Override
    public int hashCode() {
      return liveSet.hashCode();
    }
  }

  // Every symbol the scope reads or modifies, in order of first appearance.
  private final ImmutableList<QualifiedName> symbols;
  private final Map<QualifiedName, Integer> symbolIndex = new HashMap<>();

  private final Map<Node, BitSet> gen = new HashMap<>();
  private final Map<Node, BitSet> kill = new HashMap<>();
  private final BitSet escaped = new BitSet();

  /**
   * @param cfg the graph of the scope, annotated on its root
   * @param session the session holding the activity annotations of the scope and its nested scopes
   * @param escapeClosureReads whether the free reads of nested scopes are never killed
   * @throws MissingAnnotationException if the activity of the scope was not computed
   */
  LiveVariablesAnalysis(
      ControlFlowGraph<Node> cfg, AnalysisSession session, boolean escapeClosureReads) {
    super(cfg);
    AnnotationStore store = session.getAnnotations();
    Node scopeRoot = cfg.getEntry().getValue();

    Map<Node, StatementActivity> activities = new LinkedHashMap<>();
    ImmutableList.Builder<QualifiedName> orderedSymbols = ImmutableList.builder();
    for (DiGraphNode<Node, Branch> node : cfg.getControlPoints()) {
      StatementActivity activity =
          ActivityAnalyzer.getControlPointActivity(store, scopeRoot, node.getValue());
      activities.put(node.getValue(), activity);
      for (QualifiedName q : activity.getRead()) {
        addSymbol(q, orderedSymbols);
      }
      for (QualifiedName q : activity.getModified()) {
        addSymbol(q, orderedSymbols);
      }
    }
    this.symbols = orderedSymbols.build();

    if (escapeClosureReads) {
      for (QualifiedName q : computeEscaped(session, scopeRoot)) {
        Integer index = symbolIndex.get(q);
        if (index != null) {
          escaped.set(index);
        }
      }
    }

    for (Map.Entry<Node, StatementActivity> entry : activities.entrySet()) {
      BitSet nodeGen = new BitSet(symbols.size());
      BitSet nodeKill = new BitSet(symbols.size());
      for (QualifiedName q : entry.getValue().getRead()) {
        nodeGen.set(symbolIndex.get(q));
      }
      for (QualifiedName q : entry.getValue().getModified()) {
        nodeKill.set(symbolIndex.get(q));
      }
      nodeKill.andNot(escaped);
      gen.put(entry.getKey(), nodeGen);
      kill.put(entry.getKey(), nodeKill);
    }
  }

  private void addSymbol(QualifiedName q, ImmutableList.Builder<QualifiedName> orderedSymbols) {
    if (!symbolIndex.containsKey(q)) {
      symbolIndex.put(q, symbolIndex.size());
      orderedSymbols.add(q);
    }
  }

  /**
   * Computes the symbols read by the scopes nested in {@code scopeRoot} that are not local to
   * them. At any depth, such a read may refer to a variable of {@code scopeRoot}.
   */
  private static ImmutableSet<QualifiedName> computeEscaped(
      AnalysisSession session, Node scopeRoot) {
    ImmutableSet.Builder<QualifiedName> escaped = ImmutableSet.builder();
    AnnotationStore store = session.getAnnotations();
    NodeTraversal.traverse(
        session,
        scopeRoot,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n != scopeRoot && n.getToken().isScope()) {
              escaped.addAll(store.get(n, NodeAnnotations.SCOPE_ACTIVITY).getFreeReads());
            }
          }
        });
    return escaped.build();
  }

  @Override
  boolean isForward() {
    return false;
  }

  @Override
  int getMaxSteps() {
    ControlFlowGraph<Node> cfg = getCfg();
    return propagationStepBound(cfg.getNodeCount(), cfg.getEdgeCount(), symbols.size());
  }

  @Override
  LiveVariableLattice flowThrough(Node node, LiveVariableLattice input) {
    LiveVariableLattice result = new LiveVariableLattice(input);
    result.liveSet.andNot(kill.get(node));
    result.liveSet.or(gen.get(node));
    return result;
  }

  @Override
  FlowJoiner<LiveVariableLattice> createFlowJoiner() {
    return new LiveVariableJoinOp(symbols.size());
  }

  @Override
  LiveVariableLattice createEntryLattice() {
    return new LiveVariableLattice(symbols.size());
  }

  @Override
  LiveVariableLattice createInitialEstimateLattice() {
    return new LiveVariableLattice(symbols.size());
  }

  ImmutableList<QualifiedName> getSymbols() {
    return symbols;
  }

  /** Returns the symbols live on entry to {@code node}. Only valid after {@link #analyze()}. */
  ImmutableSet<QualifiedName> getLiveIn(DiGraphNode<Node, Branch> node) {
    return toSymbols(getFlowState(node).getIn());
  }

  /** Returns the symbols live on exit from {@code node}. Only valid after {@link #analyze()}. */
  ImmutableSet<QualifiedName> getLiveOut(DiGraphNode<Node, Branch> node) {
    return toSymbols(getFlowState(node).getOut());
  }

  private ImmutableSet<QualifiedName> toSymbols(LiveVariableLattice lattice) {
    ImmutableSet.Builder<QualifiedName> live = ImmutableSet.builder();
    for (int i = lattice.liveSet.nextSetBit(0); i >= 0; i = lattice.liveSet.nextSetBit(i + 1)) {
      live.add(symbols.get(i));
    }
    return live.build();
  }
}
