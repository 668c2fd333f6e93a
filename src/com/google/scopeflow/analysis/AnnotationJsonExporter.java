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
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphEdge;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;
import java.util.Comparator;

/**
 * Renders the annotations of a session as JSON, for consumers outside the JVM such as code
 * generators. Nodes are referred to by their id.
 *
 * <pre>
 * {
 *   "scope": "f", "unit": "a.py",
 *   "nodes": [{"id": 3, "kind": "ASSIGN", "annotations": {"live-in": ["a"], ...}}, ...]
 * }
 * </pre>
 */
public final class AnnotationJsonExporter {

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  // Documented keys first, in their documented order, then any other key by name.
  private static final Comparator<AnnotationKey<?>> KEY_ORDER =
      Comparator.<AnnotationKey<?>>comparingInt(
              key ->
                  NodeAnnotations.ALL_KEYS.contains(key)
                      ? NodeAnnotations.ALL_KEYS.asList().indexOf(key)
                      : Integer.MAX_VALUE)
          .thenComparing(AnnotationKey::getName);

  private final AnalysisSession session;

  public AnnotationJsonExporter(AnalysisSession session) {
    this.session = session;
  }

  /** Returns every annotation of the session, grouped by node in ascending id order. */
  public JsonObject export() {
    AnnotationStore store = session.getAnnotations();
    JsonObject json = new JsonObject();
    json.addProperty("scope", session.getContext().getScopeName());
    json.addProperty("unit", session.getContext().getUnitId());
    JsonArray nodes = new JsonArray();
    for (int id : store.annotatedNodeIds()) {
      Node n = session.getTree().getNode(id);
      JsonObject node = new JsonObject();
      node.addProperty("id", id);
      node.addProperty("kind", n.getToken().toString());
      if (n.getLineno() >= 0) {
        node.addProperty("line", n.getLineno());
      }
      JsonObject annotations = new JsonObject();
      for (AnnotationKey<?> key : ImmutableList.sortedCopyOf(KEY_ORDER, store.keys(n))) {
        annotations.add(key.getName(), toJson(n, key));
      }
      node.add("annotations", annotations);
      nodes.add(node);
    }
    json.add("nodes", nodes);
    return json;
  }

  /** Returns {@link #export()} as pretty printed text. */
  public String exportAsString() {
    return GSON.toJson(export());
  }

  private JsonElement toJson(Node n, AnnotationKey<?> key) {
    AnnotationStore store = session.getAnnotations();
    if (key == NodeAnnotations.CANONICAL_NAME) {
      return new JsonPrimitive(store.get(n, NodeAnnotations.CANONICAL_NAME).join());
    } else if (key == NodeAnnotations.SCOPE_ACTIVITY) {
      return toJson(store.get(n, NodeAnnotations.SCOPE_ACTIVITY));
    } else if (key == NodeAnnotations.STATEMENT_ACTIVITY) {
      StatementActivity activity = store.get(n, NodeAnnotations.STATEMENT_ACTIVITY);
      JsonObject json = new JsonObject();
      json.add("read", toJson(activity.getRead()));
      json.add("modified", toJson(activity.getModified()));
      return json;
    } else if (key == NodeAnnotations.CFG) {
      return toJson(store.get(n, NodeAnnotations.CFG));
    } else if (key == NodeAnnotations.LIVE_IN || key == NodeAnnotations.LIVE_OUT) {
      @SuppressWarnings("unchecked") // Both keys hold sets of names.
      AnnotationKey<Iterable<QualifiedName>> names = (AnnotationKey<Iterable<QualifiedName>>) key;
      return toJson(store.get(n, names));
    } else if (key == NodeAnnotations.DEFS_IN) {
      JsonArray definitions = new JsonArray();
      for (Definition definition : store.get(n, NodeAnnotations.DEFS_IN)) {
        JsonObject json = new JsonObject();
        json.addProperty("symbol", definition.getSymbol().join());
        json.addProperty("site", definition.getSite().getId());
        definitions.add(json);
      }
      return definitions;
    }
    return new JsonPrimitive(String.valueOf(store.get(n, key)));
  }

  private static JsonObject toJson(ScopeActivity activity) {
    JsonObject json = new JsonObject();
    json.add("read", toJson(activity.getRead()));
    json.add("modified", toJson(activity.getModified()));
    json.add("bound", toJson(activity.getBound()));
    json.add("globals", toJson(activity.getGlobals()));
    json.add("nonlocals", toJson(activity.getNonlocals()));
    json.add("parameters", toJson(activity.getParameters()));
    json.add("freeReads", toJson(activity.getFreeReads()));
    return json;
  }

  // Edges into the implicit return have "exit" as their destination.
  private static JsonObject toJson(ControlFlowGraph<Node> cfg) {
    JsonObject json = new JsonObject();
    json.addProperty("entry", cfg.getEntry().getValue().getId());
    JsonArray edges = new JsonArray();
    for (DiGraphEdge<Node, Branch> edge : cfg.getEdges()) {
      JsonObject e = new JsonObject();
      e.addProperty("from", edge.getSource().getValue().getId());
      DiGraphNode<Node, Branch> dest = edge.getDestination();
      if (cfg.isImplicitReturn(dest)) {
        e.addProperty("to", "exit");
      } else {
        e.addProperty("to", dest.getValue().getId());
      }
      e.addProperty("branch", edge.getValue().toString());
      edges.add(e);
    }
    json.add("edges", edges);
    JsonArray exits = new JsonArray();
    for (DiGraphNode<Node, Branch> exit : cfg.getExitNodes()) {
      exits.add(exit.getValue().getId());
    }
    json.add("exits", exits);
    JsonArray unreachable = new JsonArray();
    for (Node node : cfg.getUnreachableNodes()) {
      unreachable.add(node.getId());
    }
    json.add("unreachable", unreachable);
    return json;
  }

  private static JsonArray toJson(Iterable<QualifiedName> names) {
    JsonArray json = new JsonArray();
    for (QualifiedName name : names) {
      json.add(name.join());
    }
    return json;
  }
}
