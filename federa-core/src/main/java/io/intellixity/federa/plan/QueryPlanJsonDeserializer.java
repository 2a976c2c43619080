package io.intellixity.federa.plan;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.federa.exec.PlanValidationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link QueryPlan}.\n
 *
 * Accepts the canonical camelCase form:\n
 * <pre>
 * { "relationalQueries": [ { "sourceId": "...", "statement": "...", "alias": "..." } ],
 *   "toolCalls": [ { "sourceId": "...", "toolName": "...", "parameters": {...}, "alias": "..." } ],
 *   "needsCombination": true }
 * </pre>
 * and the planner's snake_case form ({@code sql_queries[db_config_id, sql, source_alias]},
 * {@code mcp_calls[mcp_config_id, tool_name, parameters, source_alias]}, {@code needs_combination}).\n
 *
 * A plan flagged {@code no_data_source_match} deserializes to an empty plan.\n
 */
public final class QueryPlanJsonDeserializer extends JsonDeserializer<QueryPlan> {
  @Override
  public QueryPlan deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new PlanValidationException("QueryPlan JSON must be an object");

    if (root.path("no_data_source_match").asBoolean(false) || root.path("noDataSourceMatch").asBoolean(false)) {
      return QueryPlan.empty();
    }

    List<RelationalSubQuery> relational = new ArrayList<>();
    for (JsonNode q : arrayOf(root, "relationalQueries", "sql_queries")) {
      if (!q.isObject()) throw new PlanValidationException("Relational sub-query must be an object");
      relational.add(new RelationalSubQuery(
          text(q, "sourceId", "db_config_id"),
          text(q, "statement", "sql"),
          text(q, "alias", "source_alias")));
    }

    List<ToolCall> tools = new ArrayList<>();
    for (JsonNode t : arrayOf(root, "toolCalls", "mcp_calls")) {
      if (!t.isObject()) throw new PlanValidationException("Tool call must be an object");
      Map<String, Object> params = new LinkedHashMap<>();
      JsonNode pn = t.get("parameters");
      if (pn != null && pn.isObject()) {
        @SuppressWarnings("unchecked")
        Map<String, Object> m = codec.treeToValue(pn, Map.class);
        params.putAll(m);
      }
      tools.add(new ToolCall(
          text(t, "sourceId", "mcp_config_id"),
          text(t, "toolName", "tool_name"),
          params,
          text(t, "alias", "source_alias")));
    }

    boolean combine = bool(root, "needsCombination", "needs_combination");
    return new QueryPlan(relational, tools, combine);
  }

  private static Iterable<JsonNode> arrayOf(JsonNode root, String canonical, String legacy) {
    JsonNode n = root.get(canonical);
    if (n == null || n.isNull()) n = root.get(legacy);
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) throw new PlanValidationException(canonical + " must be an array");
    return n;
  }

  private static String text(JsonNode n, String canonical, String legacy) {
    JsonNode v = n.get(canonical);
    if (v == null || v.isNull()) v = n.get(legacy);
    return (v == null || v.isNull()) ? null : v.asText();
  }

  private static boolean bool(JsonNode n, String canonical, String legacy) {
    JsonNode v = n.get(canonical);
    if (v == null || v.isNull()) v = n.get(legacy);
    return v != null && v.asBoolean(false);
  }
}
