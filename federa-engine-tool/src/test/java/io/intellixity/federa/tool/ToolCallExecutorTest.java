package io.intellixity.federa.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.exec.NonTabularResponseException;
import io.intellixity.federa.exec.SourceExecutionException;
import io.intellixity.federa.plan.ToolCall;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.spi.tool.ToolClient;
import io.intellixity.federa.spi.tool.ToolDescriptor;
import io.intellixity.federa.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ToolCallExecutorTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static ToolCallExecutor executorReturning(String json) {
    ToolClient client = new ToolClient() {
      @Override public JsonNode callTool(String toolName, Map<String, Object> parameters) {
        try {
          return JSON.readTree(json);
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
      }
      @Override public List<ToolDescriptor> listTools() { return List.of(new ToolDescriptor("forecast", null, null)); }
    };
    return new ToolCallExecutor(new ToolSourceHandle("weather", client));
  }

  private static final ToolCall CALL = new ToolCall("weather", "forecast", Map.of("days", 2), "w");

  @Test
  void tabularResponseBecomesTypedRows() {
    TabularResult r = executorReturning(
        "[{\"day\":\"mon\",\"temp\":4.5,\"rain\":true,\"n\":3,\"tags\":[\"a\"],\"x\":null},"
            + "{\"x\":null,\"tags\":{},\"n\":4,\"rain\":false,\"temp\":6,\"day\":\"tue\"}]")
        .execute(CALL);

    assertEquals(List.of("day", "temp", "rain", "n", "tags", "x"), r.columns());
    Map<String, Value> mon = r.rows().get(0);
    assertEquals(Value.of(4.5d), mon.get("temp"));
    assertEquals(Value.of(true), mon.get("rain"));
    assertEquals(Value.of(3L), mon.get("n"));
    assertEquals(Value.of("[\"a\"]"), mon.get("tags"));
    assertTrue(mon.get("x").isNull());
    assertEquals(Value.of("tue"), r.rows().get(1).get("day"));
  }

  @Test
  void emptyListIsAnEmptyResult() {
    TabularResult r = executorReturning("[]").execute(CALL);
    assertTrue(r.isEmpty());
    assertFalse(r.hasColumns());
  }

  @Test
  void mismatchedKeySetsAreNonTabular() {
    NonTabularResponseException e = assertThrows(NonTabularResponseException.class,
        () -> executorReturning("[{\"a\":1},{\"a\":2,\"b\":3}]").execute(CALL));
    assertTrue(e.getMessage().contains("forecast"), e.getMessage());
  }

  @Test
  void scalarAndObjectResponsesAreNonTabular() {
    assertThrows(NonTabularResponseException.class, () -> executorReturning("\"sunny\"").execute(CALL));
    assertThrows(NonTabularResponseException.class, () -> executorReturning("{\"a\":1}").execute(CALL));
  }

  @Test
  void transportFailuresAreSourceExecutionErrors() {
    ToolClient failing = new ToolClient() {
      @Override public JsonNode callTool(String toolName, Map<String, Object> parameters) {
        throw new IllegalStateException("connection refused");
      }
      @Override public List<ToolDescriptor> listTools() { return List.of(); }
    };
    ToolCallExecutor ex = new ToolCallExecutor(new ToolSourceHandle("weather", failing));
    SourceExecutionException e = assertThrows(SourceExecutionException.class, () -> ex.execute(CALL));
    assertEquals("w", e.alias());
    assertTrue(e.getMessage().contains("connection refused"));
  }

  @Test
  void pingListsTools() {
    ToolCallExecutor ex = executorReturning("[]");
    ex.ping();
    assertEquals("forecast", ex.listTools().get(0).name());
  }
}
