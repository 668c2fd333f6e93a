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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.scopeflow.tree.IR;
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AnnotationJsonExporter}. */
@RunWith(JUnit4.class)
public final class AnnotationJsonExporterTest {

  private Node f;
  private Node assign;
  private Node ret;
  private AnalysisSession session;

  @Before
  public void setUp() {
    // def f():
    //   b = a + 1
    //   return b
    assign = IR.assign(IR.name("b"), IR.add(IR.name("a"), IR.number(1)));
    ret = IR.returnNode(IR.name("b"));
    ret.setLinenoCharno(3, 2);
    f = IR.function("f", IR.paramList(), IR.block(assign, ret));
    session =
        AnalysisSession.create(
            SyntaxTree.index(f),
            ScopeContext.create("f", "", "unit.py", LanguageFeature.defaults()));
    ScopeAnalyzer.create().analyze(session, f);
  }

  private JsonObject exportedNode(JsonObject export, Node n) {
    for (JsonElement node : export.getAsJsonArray("nodes")) {
      if (node.getAsJsonObject().get("id").getAsInt() == n.getId()) {
        return node.getAsJsonObject();
      }
    }
    throw new AssertionError("Node " + n + " was not exported");
  }

  private static List<String> strings(JsonArray array) {
    List<String> result = new ArrayList<>();
    for (JsonElement element : array) {
      result.add(element.getAsString());
    }
    return result;
  }

  @Test
  public void testHeader() {
    JsonObject export = new AnnotationJsonExporter(session).export();

    assertThat(export.get("scope").getAsString()).isEqualTo("f");
    assertThat(export.get("unit").getAsString()).isEqualTo("unit.py");
  }

  @Test
  public void testNodesAreInIdOrder() {
    JsonObject export = new AnnotationJsonExporter(session).export();

    List<Integer> ids = new ArrayList<>();
    for (JsonElement node : export.getAsJsonArray("nodes")) {
      ids.add(node.getAsJsonObject().get("id").getAsInt());
    }
    assertThat(ids).isInStrictOrder();
    assertThat(ids).containsExactlyElementsIn(session.getAnnotations().annotatedNodeIds());
  }

  @Test
  public void testScopeRoot() {
    JsonObject root = exportedNode(new AnnotationJsonExporter(session).export(), f);

    assertThat(root.get("kind").getAsString()).isEqualTo("FUNCTION");
    assertThat(root.has("line")).isFalse();
    JsonObject annotations = root.getAsJsonObject("annotations");
    assertThat(annotations.keySet())
        .containsExactly("scope-activity", "cfg", "live-in", "live-out")
        .inOrder();

    JsonObject activity = annotations.getAsJsonObject("scope-activity");
    assertThat(strings(activity.getAsJsonArray("read"))).containsExactly("a", "b");
    assertThat(strings(activity.getAsJsonArray("freeReads"))).containsExactly("a");

    JsonObject cfg = annotations.getAsJsonObject("cfg");
    assertThat(cfg.get("entry").getAsInt()).isEqualTo(f.getId());
    assertThat(cfg.getAsJsonArray("edges")).hasSize(2);
    assertThat(cfg.getAsJsonArray("exits").get(0).getAsInt()).isEqualTo(ret.getId());
    assertThat(cfg.getAsJsonArray("unreachable")).isEmpty();
  }

  @Test
  public void testFallingOffTheEndIsAnEdgeToExit() {
    // x = 1
    Node x = IR.assign(IR.name("x"), IR.number(1));
    Node module = IR.module(x);
    AnalysisSession moduleSession =
        AnalysisSession.create(SyntaxTree.index(module), ScopeContext.forScope("m"));
    ScopeAnalyzer.create().analyze(moduleSession, module);

    JsonObject root = exportedNode(new AnnotationJsonExporter(moduleSession).export(), module);
    JsonObject cfg = root.getAsJsonObject("annotations").getAsJsonObject("cfg");
    JsonArray edges = cfg.getAsJsonArray("edges");

    assertThat(edges).hasSize(2);
    List<String> rendered = new ArrayList<>();
    for (JsonElement edge : edges) {
      JsonObject e = edge.getAsJsonObject();
      rendered.add(
          e.get("from").getAsInt() + " " + e.get("branch").getAsString() + " " + e.get("to"));
    }
    assertThat(rendered)
        .containsExactly(
            module.getId() + " UNCOND " + x.getId(), x.getId() + " UNCOND \"exit\"");
    assertThat(cfg.getAsJsonArray("exits").get(0).getAsInt()).isEqualTo(x.getId());
  }

  @Test
  public void testControlPoint() {
    JsonObject node = exportedNode(new AnnotationJsonExporter(session).export(), assign);
    JsonObject annotations = node.getAsJsonObject("annotations");

    JsonObject activity = annotations.getAsJsonObject("statement-activity");
    assertThat(strings(activity.getAsJsonArray("read"))).containsExactly("a");
    assertThat(strings(activity.getAsJsonArray("modified"))).containsExactly("b");
    assertThat(strings(annotations.getAsJsonArray("live-in"))).containsExactly("a");
    assertThat(strings(annotations.getAsJsonArray("live-out"))).containsExactly("b");
  }

  @Test
  public void testLineNumbers() {
    JsonObject node = exportedNode(new AnnotationJsonExporter(session).export(), ret);
    assertThat(node.get("line").getAsInt()).isEqualTo(3);
  }

  @Test
  public void testCanonicalNames() {
    Node b = assign.getFirstChild();
    JsonObject node = exportedNode(new AnnotationJsonExporter(session).export(), b);

    assertThat(node.get("kind").getAsString()).isEqualTo("NAME");
    assertThat(node.getAsJsonObject("annotations").get("canonical-name").getAsString())
        .isEqualTo("b");
  }

  @Test
  public void testDefinitions() {
    new ReachingDefinitionsAnalyzer().process(session, f);

    JsonObject node = exportedNode(new AnnotationJsonExporter(session).export(), ret);
    JsonArray definitions = node.getAsJsonObject("annotations").getAsJsonArray("defs-in");
    assertThat(definitions).hasSize(1);
    JsonObject definition = definitions.get(0).getAsJsonObject();
    assertThat(definition.get("symbol").getAsString()).isEqualTo("b");
    assertThat(definition.get("site").getAsInt()).isEqualTo(assign.getId());
  }

  @Test
  public void testExportAsString() {
    AnnotationJsonExporter exporter = new AnnotationJsonExporter(session);
    assertThat(JsonParser.parseString(exporter.exportAsString())).isEqualTo(exporter.export());
  }
}
