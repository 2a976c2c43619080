package io.intellixity.federa.plan;

import io.intellixity.federa.exec.PlanValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryPlanTest {

  @Test
  void aliasWhoseScratchTableNameIsTooLongIsRejectedUpFront() {
    String alias = "a".repeat(62);

    PlanValidationException tool = assertThrows(PlanValidationException.class,
        () -> new ToolCall("weather", "forecast", Map.of(), alias));
    assertTrue(tool.getMessage().contains("too long"), tool.getMessage());

    assertThrows(PlanValidationException.class,
        () -> new RelationalSubQuery("crm", "SELECT 1", alias));
  }

  @Test
  void longestAliasThatStillFitsIsAccepted() {
    String alias = "a".repeat(59);
    RelationalSubQuery q = new RelationalSubQuery("crm", "SELECT 1", alias);
    assertEquals(alias, q.resultAlias());
  }

  @Test
  void unsafeAliasIsAPlanValidationError() {
    assertThrows(PlanValidationException.class,
        () -> new RelationalSubQuery("crm", "SELECT 1", "orders; DROP TABLE x"));
    assertThrows(PlanValidationException.class,
        () -> new ToolCall("weather", "forecast", Map.of(), "1abc"));
  }

  @Test
  void aliasNamingAnotherAliasScratchTableIsRejected() {
    PlanValidationException ex = assertThrows(PlanValidationException.class, () -> new QueryPlan(
        List.of(new RelationalSubQuery("crm", "SELECT 1", "q1"),
                new RelationalSubQuery("crm", "SELECT 2", "temp_q1")),
        List.of(), false));
    assertTrue(ex.getMessage().contains("temp_q1"));
  }
}
