package io.intellixity.federa.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.exec.PlanValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryPlanJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesPlannerSnakeCaseForm() throws Exception {
    String s = """
        {
          "sql_queries": [
            { "db_config_id": "crm", "sql": "SELECT id, name FROM customers", "source_alias": "customers" }
          ],
          "mcp_calls": [
            { "mcp_config_id": "weather", "tool_name": "forecast",
              "parameters": { "city": "Berlin", "days": 3 }, "source_alias": "forecast" }
          ],
          "needs_combination": true,
          "combination_strategy": "ignored"
        }
        """;
    QueryPlan plan = JSON.readValue(s, QueryPlan.class);

    assertTrue(plan.needsCombination());
    assertEquals(1, plan.relationalQueries().size());
    RelationalSubQuery q = plan.relationalQueries().get(0);
    assertEquals("crm", q.sourceId());
    assertEquals("customers", q.resultAlias());

    ToolCall t = plan.toolCalls().get(0);
    assertEquals("forecast", t.toolName());
    assertEquals("Berlin", t.parameters().get("city"));
    assertEquals(3, t.parameters().get("days"));
  }

  @Test
  void noDataSourceMatch_yieldsEmptyPlan() throws Exception {
    QueryPlan plan = JSON.readValue("{\"no_data_source_match\": true, \"user_message\": \"nothing\"}", QueryPlan.class);
    assertTrue(plan.isEmpty());
  }

  @Test
  void canonicalFormSurvivesSerialization() throws Exception {
    QueryPlan plan = new QueryPlan(
        List.of(new RelationalSubQuery("crm", "SELECT 1 AS one", "ones")),
        List.of(new ToolCall("weather", "forecast", Map.of("city", "Oslo"), "forecast")),
        true);

    QueryPlan back = JSON.readValue(JSON.writeValueAsString(plan), QueryPlan.class);
    assertEquals(plan, back);
  }

  @Test
  void duplicateAliasIsRejected() {
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue("""
        { "sql_queries": [
            { "db_config_id": "a", "sql": "SELECT 1", "source_alias": "x" },
            { "db_config_id": "b", "sql": "SELECT 2", "source_alias": "x" } ] }
        """, QueryPlan.class));
    Throwable t = (ex instanceof PlanValidationException) ? ex : ex.getCause();
    assertInstanceOf(PlanValidationException.class, t);
    assertTrue(t.getMessage().contains("Duplicate result alias"));
  }
}
