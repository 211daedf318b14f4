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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Map;

/**
 * JSON view of control-flow graphs.
 *
 * <p>A graph is rendered as
 *
 * <pre>
 * {"function": name,
 *  "nodes": [{"id": 0, "kind": "entry", "label": "START: f", "line": 1, "successors": [1]}, ...],
 *  "edges": [{"from": 0, "to": 1, "label": ""}, ...]}
 * </pre>
 *
 * with nodes in id order and edges in insertion order. Synthetic nodes have a {@code null} line.
 * The output depends only on the graph, so serializing equal graphs gives identical text.
 */
public final class GraphJson {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  private GraphJson() {}

  /** Returns the JSON tree of the graph. */
  public static JsonObject toJsonTree(ControlFlowGraph graph) {
    JsonArray nodes = new JsonArray();
    for (CfgNode node : graph.getNodes()) {
      JsonObject json = new JsonObject();
      json.addProperty("id", node.getId());
      json.addProperty("kind", node.getKind().toString());
      json.addProperty("label", node.getLabel());
      Integer line = node.getLine();
      json.add("line", line == null ? JsonNull.INSTANCE : new JsonPrimitive(line));
      JsonArray successors = new JsonArray();
      for (int successor : node.getSuccessors()) {
        successors.add(successor);
      }
      json.add("successors", successors);
      nodes.add(json);
    }

    JsonArray edges = new JsonArray();
    for (CfgEdge edge : graph.getEdges()) {
      JsonObject json = new JsonObject();
      json.addProperty("from", edge.getFrom());
      json.addProperty("to", edge.getTo());
      json.addProperty("label", edge.getLabel().toString());
      edges.add(json);
    }

    JsonObject result = new JsonObject();
    result.addProperty("function", graph.getFunctionName());
    result.add("nodes", nodes);
    result.add("edges", edges);
    return result;
  }

  /** Returns a JSON object mapping each name to the JSON tree of its graph, in map order. */
  public static JsonObject toJsonTree(Map<String, ControlFlowGraph> graphs) {
    JsonObject result = new JsonObject();
    for (Map.Entry<String, ControlFlowGraph> entry : graphs.entrySet()) {
      result.add(entry.getKey(), toJsonTree(entry.getValue()));
    }
    return result;
  }

  /** Returns the graph as pretty-printed JSON text. */
  public static String toJson(ControlFlowGraph graph) {
    return toJson(toJsonTree(graph));
  }

  /** Returns the JSON tree as pretty-printed text, keeping null members. */
  public static String toJson(JsonElement json) {
    return GSON.toJson(json);
  }
}
