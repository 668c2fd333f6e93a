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

import static com.google.common.base.Preconditions.checkState;

import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.Token;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * This is a compiler pass that computes a control flow graph.
 *
 * <p>Every statement of the scope is a control point. IF, WHILE and FOR nodes stand for their test
 * or header, and blocks are never control points. Expressions are part of their statement. The
 * scope root is the entry; for a lambda, the body expression is the single control point after it.
 *
 * <p>The edges are computed with a single post order traversal. The "follow()" of a given node, the
 * node control reaches when the node completes normally, is computed recursively on demand. A
 * follow() of null means control leaves the scope, and the edge goes to the implicit return.
 *
 * <p>The graph is only annotated on the scope root once it is complete; a scope with an
 * unsupported construct leaves no partial result. Not thread safe: use one instance per thread.
 */
public final class ControlFlowAnalysis implements NodeTraversal.Callback, AnalysisPass {

  private static final Logger logger = Logger.getLogger(ControlFlowAnalysis.class.getName());

  // CFG nodes that come first lexically are visited first, because they will often be executed
  // first. Node ids are assigned in pre-order, so they are the lexical position.
  private static final Comparator<DiGraphNode<Node, Branch>> LEXICAL_ORDER =
      Comparator.comparingInt(digraphNode -> digraphNode.getValue().getId());

  private @Nullable AnalysisSession session;
  private @Nullable ControlFlowGraph<Node> cfg;
  private @Nullable Node root;
  private int priorityCounter;

  @Override
  public void process(AnalysisSession session, Node scopeRoot) {
    ControlFlowGraph<Node> graph = computeCfg(session, scopeRoot);
    session
        .getAnnotations()
        .writer(AnnotationOwner.CONTROL_FLOW)
        .set(scopeRoot, NodeAnnotations.CFG, graph);
  }

  /**
   * Computes the control flow graph of the scope rooted at {@code scopeRoot} without annotating it.
   *
   * @throws InvalidScopeException if {@code scopeRoot} does not introduce a scope
   * @throws UnsupportedConstructException if the scope contains a statement that is not modeled
   */
  public ControlFlowGraph<Node> computeCfg(AnalysisSession session, Node scopeRoot) {
    session.checkScopeRoot(scopeRoot);
    this.session = session;
    this.root = scopeRoot;
    this.cfg = new AstControlFlowGraph(scopeRoot);
    try {
      NodeTraversal.traverse(session, scopeRoot, this);
      cfg.computeReachability();

      // Now, generate the priority of nodes by doing a depth-first
      // search on the CFG.
      priorityCounter = 0;
      prioritizeFromEntryNode(cfg.getEntry());

      // Unreachable nodes have not been given a priority. Put them last.
      for (DiGraphNode<Node, Branch> candidate : cfg.getControlPoints()) {
        if (!candidate.hasPriority()) {
          candidate.setPriority(++priorityCounter);
        }
      }
      // The implicit return is always last.
      cfg.getImplicitReturn().setPriority(++priorityCounter);

      ControlFlowGraph<Node> result = cfg;
      logger.fine(
          () ->
              "Built CFG of "
                  + scopeRoot
                  + ": "
                  + result.getNodeCount()
                  + " nodes, "
                  + result.getEdgeCount()
                  + " edges, "
                  + result.getUnreachableNodes().size()
                  + " unreachable");
      return result;
    } finally {
      this.session = null;
      this.root = null;
      this.cfg = null;
    }
  }

  /** Given an entry node, find all the nodes reachable from that node and prioritize them. */
  private void prioritizeFromEntryNode(DiGraphNode<Node, Branch> entry) {
    PriorityQueue<DiGraphNode<Node, Branch>> worklist = new PriorityQueue<>(10, LEXICAL_ORDER);
    worklist.add(entry);

    while (!worklist.isEmpty()) {
      DiGraphNode<Node, Branch> current = worklist.remove();
      if (current.hasPriority()) {
        continue;
      }

      current.setPriority(++priorityCounter);

      for (DiGraphNode<Node, Branch> successor : cfg.getDirectedSuccNodes(current)) {
        if (!cfg.isImplicitReturn(successor)) {
          worklist.add(successor);
        }
      }
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (parent == null) {
      return true;
    }
    if (parent.getToken().isScope() && parent != root) {
      // The inside of a nested function is a graph of its own.
      return false;
    }
    switch (n.getToken()) {
      case TRY, WITH -> throw new UnsupportedConstructException(n);
      default -> {}
    }
    // Only statements and the blocks holding them can contain control points.
    return n.isBlock() || n.isFunction() || n.getToken().getCategory() == Token.Category.STATEMENT;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case MODULE -> handleModule(n);
      case FUNCTION -> {
        if (n == root) {
          handleFunction(n);
        } else {
          // A nested def only binds a name here.
          handleStmt(n);
        }
      }
      case LAMBDA -> handleLambda(n);
      case BLOCK -> {}
      case IF -> handleIf(n);
      case WHILE, FOR -> handleLoop(n);
      case BREAK -> handleBreak(n);
      case CONTINUE -> handleContinue(n);
      case RETURN, RAISE -> handleExit(n);
      case GLOBAL -> {
        checkFeature(n, LanguageFeature.GLOBAL_DECLARATIONS);
        handleStmt(n);
      }
      case NONLOCAL -> {
        checkFeature(n, LanguageFeature.NONLOCAL_DECLARATIONS);
        handleStmt(n);
      }
      case EXPR_RESULT, ASSIGN, ASSIGN_ADD, ASSIGN_SUB, ASSIGN_MUL, ASSIGN_DIV, DEL, PASS ->
          handleStmt(n);
      default -> throw new UnsupportedConstructException(n);
    }
  }

  private void checkFeature(Node n, LanguageFeature feature) {
    if (!session.getContext().isEnabled(feature)) {
      throw new UnsupportedConstructException(
          n.getToken() + " requires language feature " + feature, n);
    }
  }

  private void handleModule(Node node) {
    checkState(node == root, node);
    // An empty module goes straight to the implicit return.
    Node first = node.getFirstChild();
    createEdge(node, Branch.UNCOND, first == null ? null : computeFallThrough(first));
  }

  private void handleFunction(Node node) {
    // The function node represents entering the function and binding the parameters. The next
    // change of control is going into the function's body.
    checkState(node.hasXChildren(3));
    createEdge(node, Branch.UNCOND, computeFallThrough(node.getLastChild()));
  }

  private void handleLambda(Node node) {
    checkState(node == root, node);
    Node body = node.getLastChild();
    createEdge(node, Branch.UNCOND, body);
    createEdge(body, Branch.UNCOND, null);
  }

  private void handleIf(Node node) {
    Node thenBlock = node.getSecondChild();
    Node elseBlock = thenBlock.getNext();
    createEdge(node, Branch.ON_TRUE, computeFallThrough(thenBlock));

    if (elseBlock == null) {
      createEdge(node, Branch.ON_FALSE, computeFollowNode(node)); // not taken branch
    } else {
      createEdge(node, Branch.ON_FALSE, computeFallThrough(elseBlock));
    }
  }

  private void handleLoop(Node node) {
    // Control goes to the first statement if the condition evaluates to true, or if there is
    // another element to iterate over.
    createEdge(node, Branch.ON_TRUE, computeFallThrough(node.getLastChild()));
    // Control goes to the follow() once the loop is done.
    createEdge(node, Branch.ON_FALSE, computeFollowNode(node));
  }

  private void handleBreak(Node node) {
    createEdge(node, Branch.UNCOND, computeFollowNode(getEnclosingLoop(node)));
  }

  private void handleContinue(Node node) {
    createEdge(node, Branch.UNCOND, getEnclosingLoop(node));
  }

  private Node getEnclosingLoop(Node node) {
    for (Node p = node.getParent(); p != null && p != root; p = p.getParent()) {
      if (p.isWhile() || p.isFor()) {
        return p;
      }
    }
    throw new UnsupportedConstructException(node.getToken() + " outside of a loop", node);
  }

  private void handleExit(Node node) {
    cfg.addExit(node);
  }

  private void handleStmt(Node node) {
    // Simply transfer to the next line.
    createEdge(node, Branch.UNCOND, computeFollowNode(node));
  }

  /**
   * Computes the follow() node of a given node, or null if control leaves the scope after it.
   *
   * @param node The node that follow() should compute.
   */
  private @Nullable Node computeFollowNode(Node node) {
    Node parent = node.getParent();
    if (node == root || parent == null) {
      return null;
    }

    // If we are just before a IF/WHILE/FOR:
    switch (parent.getToken()) {
      case IF -> {
        // The follow() of any of the path from IF would be what follows IF.
        return computeFollowNode(parent);
      }
      case WHILE, FOR -> {
        // The end of the body goes back to the header.
        return parent;
      }
      default -> {}
    }

    // Now that we are done with the special cases follow should be its
    // immediate sibling.
    Node nextSibling = node.getNext();
    if (nextSibling != null) {
      return computeFallThrough(nextSibling);
    } else if (parent == root) {
      return null;
    } else {
      // If there are no more siblings, control is transferred up the tree.
      return computeFollowNode(parent);
    }
  }

  /**
   * Computes the destination node of n when we want to fallthrough into the subtree of n. Blocks
   * are not control points, so entering a block enters its first statement.
   */
  private @Nullable Node computeFallThrough(Node n) {
    if (n.isBlock()) {
      Node first = n.getFirstChild();
      return first != null ? computeFallThrough(first) : computeFollowNode(n);
    }
    return n;
  }

  /**
   * Connects the two nodes in the control flow graph.
   *
   * @param fromNode Source.
   * @param toNode Destination, or null for the implicit return.
   */
  private void createEdge(Node fromNode, Branch branch, @Nullable Node toNode) {
    cfg.createNode(fromNode);
    if (toNode == null) {
      cfg.connectToImplicitReturn(fromNode, branch);
      return;
    }
    cfg.createNode(toNode);
    cfg.connectIfNotFound(fromNode, branch, toNode);
  }

  private static final class AstControlFlowGraph extends ControlFlowGraph<Node> {

    private AstControlFlowGraph(Node entry) {
      super(entry);
    }

    /**
     * Returns a node comparator based on the priorities computed from a depth first search of the
     * graph.
     *
     * @param isForward x 'before' y in the search implies x 'less than' y (if true) and x 'greater
     *     than' y (if false).
     */
    @Override
    public Comparator<DiGraphNode<Node, Branch>> getOptionalNodeComparator(boolean isForward) {
      return isForward
          ? Comparator.<DiGraphNode<Node, Branch>>comparingInt(DiGraphNode::getPriority)
          : Comparator.<DiGraphNode<Node, Branch>>comparingInt(DiGraphNode::getPriority).reversed();
    }
  }
}
