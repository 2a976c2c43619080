package io.intellixity.federa.schema;

import java.util.Locale;

/** Minimal type lattice shared by inference, the scratch store DDL and result metadata. */
public enum ColumnType {
  NULL("TEXT"),
  BOOLEAN("BOOLEAN"),
  INTEGER("INTEGER"),
  FLOAT("REAL"),
  TEXT("TEXT");

  private final String sqlType;

  ColumnType(String sqlType) {
    this.sqlType = sqlType;
  }

  /** Declared column type used when creating a scratch table. */
  public String sqlType() {
    return sqlType;
  }

  /** Map a declared SQL column type back onto the lattice (SQLite affinity rules, simplified). */
  public static ColumnType fromSqlType(String declared) {
    if (declared == null || declared.isBlank()) return TEXT;
    String t = declared.trim().toUpperCase(Locale.ROOT);
    if (t.startsWith("BOOL")) return BOOLEAN;
    if (t.contains("INT")) return INTEGER;
    if (t.contains("REAL") || t.contains("FLOA") || t.contains("DOUB") || t.contains("NUMERIC") || t.contains("DECIMAL")) {
      return FLOAT;
    }
    return TEXT;
  }
}
