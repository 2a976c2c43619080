package io.intellixity.federa.spi.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tabular contract for tool responses.\n
 *
 * A response is tabular when it is an array of objects and every object has the key set of the
 * first one. An empty array is tabular.\n
 */
public final class TabularResponses {
  private TabularResponses() {}

  /** Returns null when {@code response} is tabular, else a reason it is not. */
  public static String violation(JsonNode response) {
    if (response == null || response.isNull() || response.isMissingNode()) return "response is empty (null)";
    if (!response.isArray()) return "expected a list of rows but got " + response.getNodeType();
    if (response.isEmpty()) return null;

    JsonNode first = response.get(0);
    if (!first.isObject()) return "row 0 is " + first.getNodeType() + ", not an object";
    Set<String> keys = keysOf(first);

    for (int i = 1; i < response.size(); i++) {
      JsonNode row = response.get(i);
      if (!row.isObject()) return "row " + i + " is " + row.getNodeType() + ", not an object";
      Set<String> k = keysOf(row);
      if (!k.equals(keys)) return "row " + i + " keys " + k + " differ from row 0 keys " + keys;
    }
    return null;
  }

  public static boolean isTabular(JsonNode response) {
    return violation(response) == null;
  }

  /** Column names in first-row key order; empty for an empty response. */
  public static Set<String> columnsOf(JsonNode tabular) {
    if (tabular == null || !tabular.isArray() || tabular.isEmpty()) return Set.of();
    return keysOf(tabular.get(0));
  }

  private static Set<String> keysOf(JsonNode obj) {
    Set<String> out = new LinkedHashSet<>();
    Iterator<String> it = obj.fieldNames();
    while (it.hasNext()) out.add(it.next());
    return out;
  }
}
