package io.intellixity.federa.result;

import io.intellixity.federa.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rows plus ordered column names, as produced by a source executor or the scratch store.\n
 *
 * Every row has exactly the key set of {@link #columns()}; rows are re-keyed in column order.\n
 */
public record TabularResult(List<String> columns, List<Map<String, Value>> rows) {
  private static final TabularResult EMPTY = new TabularResult(List.of(), List.of());

  public TabularResult {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    columns = List.copyOf(columns);
    Set<String> colSet = new LinkedHashSet<>(columns);
    if (colSet.size() != columns.size()) {
      throw new IllegalArgumentException("Duplicate column names: " + columns);
    }

    List<Map<String, Value>> copy = new ArrayList<>(rows.size());
    int i = 0;
    for (Map<String, Value> row : rows) {
      Objects.requireNonNull(row, "row " + i);
      if (!row.keySet().equals(colSet)) {
        throw new IllegalArgumentException(
            "Row " + i + " keys " + row.keySet() + " do not match columns " + columns);
      }
      Map<String, Value> ordered = new LinkedHashMap<>();
      for (String c : columns) {
        Value v = row.get(c);
        ordered.put(c, v == null ? Value.ofNull() : v);
      }
      copy.add(Collections.unmodifiableMap(ordered));
      i++;
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static TabularResult empty() {
    return EMPTY;
  }

  public static TabularResult empty(List<String> columns) {
    return new TabularResult(columns, List.of());
  }

  public int rowCount() { return rows.size(); }
  public boolean isEmpty() { return rows.isEmpty(); }
  public boolean hasColumns() { return !columns.isEmpty(); }

  /** Convenience builder for tests and adapters: each row is given as values in column order. */
  public static TabularResult ofRows(List<String> columns, List<List<?>> valueRows) {
    List<Map<String, Value>> out = new ArrayList<>(valueRows.size());
    for (List<?> vr : valueRows) {
      if (vr.size() != columns.size()) {
        throw new IllegalArgumentException("Row arity " + vr.size() + " != column count " + columns.size());
      }
      Map<String, Value> row = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) row.put(columns.get(i), Value.fromJava(vr.get(i)));
      out.add(row);
    }
    return new TabularResult(columns, out);
  }
}
