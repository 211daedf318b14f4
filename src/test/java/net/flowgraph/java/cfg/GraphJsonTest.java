// Copyright 2026 The Flowgraph Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.flowgraph.java.cfg;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import net.flowgraph.java.syntax.ParserInput;
import net.flowgraph.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link GraphJson}. */
@RunWith(JUnit4.class)
public class GraphJsonTest {

  private static ControlFlowGraph build(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    return ControlFlowGraphBuilder.build("f", file.getStatements());
  }

  @Test
  public void testJsonTree() {
    JsonObject json = GraphJson.toJsonTree(build("if x:", "  y = '<b>'"));

    assertThat(json.keySet()).containsExactly("function", "nodes", "edges").inOrder();
    assertThat(json.get("function").getAsString()).isEqualTo("f");

    JsonArray nodes = json.getAsJsonArray("nodes");
    assertThat(nodes).hasSize(5);
    JsonObject condition = nodes.get(1).getAsJsonObject();
    assertThat(condition.keySet())
        .containsExactly("id", "kind", "label", "line", "successors")
        .inOrder();
    assertThat(condition.get("id").getAsInt()).isEqualTo(1);
    assertThat(condition.get("kind").getAsString()).isEqualTo("condition");
    assertThat(condition.get("label").getAsString()).isEqualTo("if x");
    assertThat(condition.get("line").getAsInt()).isEqualTo(1);
    assertThat(condition.getAsJsonArray("successors").toString()).isEqualTo("[2,3]");

    JsonObject merge = nodes.get(3).getAsJsonObject();
    assertThat(merge.get("line").isJsonNull()).isTrue();

    JsonArray edges = json.getAsJsonArray("edges");
    assertThat(edges.toString())
        .isEqualTo(
            "[{\"from\":0,\"to\":1,\"label\":\"\"},"
                + "{\"from\":1,\"to\":2,\"label\":\"true\"},"
                + "{\"from\":2,\"to\":3,\"label\":\"true\"},"
                + "{\"from\":1,\"to\":3,\"label\":\"false\"},"
                + "{\"from\":3,\"to\":4,\"label\":\"\"}]");
  }

  @Test
  public void testTextKeepsNullLinesAndDoesNotEscapeHtml() {
    String text = GraphJson.toJson(build("y = '<b>'"));
    assertThat(text).contains("\"line\": null");
    assertThat(text).contains("y = '<b>'");
    assertThat(JsonParser.parseString(text)).isEqualTo(GraphJson.toJsonTree(build("y = '<b>'")));
  }

  @Test
  public void testSerializationIsStable() {
    String[] source = {"for x in xs:", "  if x: break", "return"};
    ControlFlowGraph graph = build(source);
    assertThat(GraphJson.toJson(graph)).isEqualTo(GraphJson.toJson(graph));
    assertThat(GraphJson.toJson(graph)).isEqualTo(GraphJson.toJson(build(source)));
  }

  @Test
  public void testGraphsByName() {
    ControlFlowGraph graph = build("pass");
    JsonObject json = GraphJson.toJsonTree(ImmutableMap.of("b", graph, "a", graph));
    assertThat(json.keySet()).containsExactly("b", "a").inOrder();
  }
}
