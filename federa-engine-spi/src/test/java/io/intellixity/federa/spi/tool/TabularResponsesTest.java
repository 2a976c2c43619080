package io.intellixity.federa.spi.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TabularResponsesTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static JsonNode json(String s) throws Exception {
    return JSON.readTree(s);
  }

  @Test
  void emptyListIsTabular() throws Exception {
    assertTrue(TabularResponses.isTabular(json("[]")));
    assertTrue(TabularResponses.columnsOf(json("[]")).isEmpty());
  }

  @Test
  void sameKeysInAnyOrderIsTabular() throws Exception {
    JsonNode r = json("[{\"id\":1,\"name\":\"a\"},{\"name\":\"b\",\"id\":2}]");
    assertTrue(TabularResponses.isTabular(r));
    assertEquals(List.of("id", "name"), List.copyOf(TabularResponses.columnsOf(r)));
  }

  @Test
  void differingKeySetsAreRejected() throws Exception {
    for (String s : List.of(
        "[{\"id\":1},{\"id\":2,\"extra\":true}]",
        "[{\"id\":1,\"name\":\"a\"},{\"id\":2}]",
        "[{\"id\":1},{\"other\":1}]")) {
      String reason = TabularResponses.violation(json(s));
      assertNotNull(reason, s);
      assertTrue(reason.contains("keys"), reason);
    }
  }

  @Test
  void nonListsAndNonObjectRowsAreRejected() throws Exception {
    assertFalse(TabularResponses.isTabular(json("{\"id\":1}")));
    assertFalse(TabularResponses.isTabular(json("[1,2,3]")));
    assertFalse(TabularResponses.isTabular(json("[{\"id\":1},\"x\"]")));
    assertFalse(TabularResponses.isTabular(null));
  }
}
