package io.intellixity.federa.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Ordered column name to {@link ColumnType} mapping. */
public final class InferredSchema {
  private static final InferredSchema EMPTY = new InferredSchema(Map.of());

  private final Map<String, ColumnType> columns;

  private InferredSchema(Map<String, ColumnType> columns) {
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static InferredSchema of(Map<String, ColumnType> columns) {
    Objects.requireNonNull(columns, "columns");
    for (var e : columns.entrySet()) {
      Objects.requireNonNull(e.getKey(), "column name");
      Objects.requireNonNull(e.getValue(), "column type for " + e.getKey());
    }
    return columns.isEmpty() ? EMPTY : new InferredSchema(columns);
  }

  public static InferredSchema allText(List<String> columnNames) {
    Map<String, ColumnType> m = new LinkedHashMap<>();
    for (String c : columnNames) m.put(c, ColumnType.TEXT);
    return of(m);
  }

  public static InferredSchema empty() {
    return EMPTY;
  }

  public Map<String, ColumnType> columns() { return columns; }
  public List<String> columnNames() { return List.copyOf(columns.keySet()); }
  public boolean isEmpty() { return columns.isEmpty(); }
  public int size() { return columns.size(); }

  public ColumnType typeOf(String column) {
    ColumnType t = columns.get(column);
    if (t == null) throw new IllegalArgumentException("Unknown column: " + column);
    return t;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof InferredSchema other)) return false;
    // Column order is part of the schema.
    return List.copyOf(columns.entrySet()).equals(List.copyOf(other.columns.entrySet()));
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
