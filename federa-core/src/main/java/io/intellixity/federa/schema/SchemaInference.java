package io.intellixity.federa.schema;

import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.value.BoolValue;
import io.intellixity.federa.value.FloatValue;
import io.intellixity.federa.value.IntValue;
import io.intellixity.federa.value.TextValue;
import io.intellixity.federa.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Per-column type inference from row values.\n
 *
 * For each column the first non-null value (in row order) decides the type. Columns with no
 * non-null value, and every column of an empty result, are typed {@link ColumnType#TEXT}.\n
 *
 * Values already carry their lattice type, so BOOLEAN stays distinct from INTEGER even though the
 * scratch store keeps booleans as 0/1.\n
 *
 * {@link #conform(TabularResult, InferredSchema)} rewrites cells that disagree with their column's
 * type into the value the scratch store would give back for them, so a materialized result and a
 * {@code SELECT *} over its table hold equal rows.\n
 */
public final class SchemaInference {
  private static final Pattern NUMERIC = Pattern.compile("\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?\\s*");

  private SchemaInference() {}

  public static InferredSchema infer(TabularResult result) {
    Objects.requireNonNull(result, "result");
    Map<String, ColumnType> out = new LinkedHashMap<>();
    for (String col : result.columns()) {
      out.put(col, inferColumn(result, col));
    }
    return InferredSchema.of(out);
  }

  static ColumnType inferColumn(TabularResult result, String column) {
    for (Map<String, Value> row : result.rows()) {
      Value v = row.get(column);
      if (v == null || v.isNull()) continue;
      return v.type();
    }
    return ColumnType.TEXT;
  }

  /** {@link #conform(TabularResult, InferredSchema)} against the result's own inferred schema. */
  public static TabularResult conform(TabularResult result) {
    return conform(result, infer(result));
  }

  /** Coerce every cell to its column type; returns {@code result} itself when nothing changes. */
  public static TabularResult conform(TabularResult result, InferredSchema schema) {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(schema, "schema");
    List<Map<String, Value>> rows = new ArrayList<>(result.rowCount());
    boolean changed = false;
    for (Map<String, Value> row : result.rows()) {
      Map<String, Value> out = new LinkedHashMap<>();
      for (var e : row.entrySet()) {
        ColumnType type = schema.columns().getOrDefault(e.getKey(), ColumnType.TEXT);
        Value v = coerce(e.getValue(), type);
        changed |= !v.equals(e.getValue());
        out.put(e.getKey(), v);
      }
      rows.add(out);
    }
    return changed ? new TabularResult(result.columns(), rows) : result;
  }

  /**
   * Value a cell of {@code type} holds once stored.\n
   *
   * - TEXT: every non-null value as text\n
   * - FLOAT: integers and booleans widen; numeric text is parsed\n
   * - INTEGER: integral floats narrow; booleans become 0/1; numeric text is parsed\n
   * - BOOLEAN: numbers (and numeric text) read back as {@code n != 0}\n
   * Anything else is kept as is.\n
   */
  public static Value coerce(Value v, ColumnType type) {
    if (v == null || v.isNull() || v.type() == type) return v == null ? Value.ofNull() : v;
    return switch (type) {
      case TEXT -> Value.of(String.valueOf(v.raw()));
      case FLOAT -> {
        Double d = asDouble(v);
        yield d == null ? v : Value.of(d);
      }
      case INTEGER -> {
        Double d = asDouble(v);
        if (d == null || v instanceof IntValue) yield v;
        if (v instanceof TextValue t && isLong(t.value())) yield Value.of(Long.parseLong(t.value().trim()));
        long l = d.longValue();
        yield (double) l == d && !Double.isInfinite(d) ? Value.of(l) : Value.of(d);
      }
      case BOOLEAN -> {
        Double d = asDouble(v);
        yield d == null ? v : Value.of(d.longValue() != 0);
      }
      case NULL -> v;
    };
  }

  private static Double asDouble(Value v) {
    if (v instanceof BoolValue b) return b.value() ? 1.0 : 0.0;
    if (v instanceof IntValue i) return (double) i.value();
    if (v instanceof FloatValue f) return f.value();
    if (v instanceof TextValue t && NUMERIC.matcher(t.value()).matches()) return Double.parseDouble(t.value().trim());
    return null;
  }

  private static boolean isLong(String s) {
    try {
      Long.parseLong(s.trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
