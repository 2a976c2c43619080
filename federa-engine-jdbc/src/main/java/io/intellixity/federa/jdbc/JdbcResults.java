package io.intellixity.federa.jdbc;

import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.value.Value;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads a JDBC {@link ResultSet} into a {@link TabularResult} using the statement's own column labels. */
public final class JdbcResults {
  private JdbcResults() {}

  public static TabularResult read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> columns = uniqueLabels(md);

    List<Map<String, Value>> rows = new ArrayList<>();
    String[] declared = new String[n];
    boolean first = true;
    while (rs.next()) {
      if (first) {
        // SQLite only reports declared types reliably once a row is positioned.
        for (int i = 0; i < n; i++) declared[i] = md.getColumnTypeName(i + 1);
        first = false;
      }
      Map<String, Value> row = new LinkedHashMap<>();
      for (int i = 0; i < n; i++) row.put(columns.get(i), JdbcValues.read(rs, i + 1, declared[i]));
      rows.add(row);
    }
    return new TabularResult(columns, rows);
  }

  /** Column labels; a repeated label gets a {@code _2}, {@code _3}, ... suffix. */
  static List<String> uniqueLabels(ResultSetMetaData md) throws SQLException {
    int n = md.getColumnCount();
    List<String> out = new ArrayList<>(n);
    Set<String> seen = new HashSet<>();
    for (int i = 1; i <= n; i++) {
      String base = md.getColumnLabel(i);
      if (base == null || base.isEmpty()) base = "column_" + i;
      String label = base;
      for (int k = 2; !seen.add(label); k++) label = base + "_" + k;
      out.add(label);
    }
    return out;
  }
}
