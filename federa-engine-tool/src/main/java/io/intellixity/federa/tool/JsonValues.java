package io.intellixity.federa.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.spi.tool.TabularResponses;
import io.intellixity.federa.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON cell decoding into the {@link Value} lattice. */
public final class JsonValues {
  private JsonValues() {}

  public static Value toValue(JsonNode n) {
    if (n == null || n.isNull() || n.isMissingNode()) return Value.ofNull();
    if (n.isBoolean()) return Value.of(n.booleanValue());
    if (n.isIntegralNumber()) return n.canConvertToLong() ? Value.of(n.longValue()) : Value.of(n.asText());
    if (n.isNumber()) return Value.of(n.doubleValue());
    if (n.isTextual()) return Value.of(n.textValue());
    // Nested objects/arrays are kept as compact JSON text.
    return Value.of(n.toString());
  }

  /** Rows of an already validated tabular response; columns follow the first row's key order. */
  public static TabularResult toResult(JsonNode tabular) {
    List<String> columns = List.copyOf(TabularResponses.columnsOf(tabular));
    List<Map<String, Value>> rows = new ArrayList<>(tabular.size());
    for (JsonNode obj : tabular) {
      Map<String, Value> row = new LinkedHashMap<>();
      for (String c : columns) row.put(c, toValue(obj.get(c)));
      rows.add(row);
    }
    return new TabularResult(columns, rows);
  }
}
