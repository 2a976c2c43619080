package io.intellixity.federa.jdbc;

import io.intellixity.federa.value.Value;

import java.sql.Array;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;

/**
 * JDBC value decoding into the {@link Value} lattice, and binding back.\n
 *
 * Decoding rules:\n
 * - Boolean, or a number in a column declared BOOL* → Bool\n
 * - integral numbers (and decimals with no fraction that fit a long) → Int\n
 * - other numbers → Float\n
 * - binary → Text (base64); arrays → Text; everything else → Text via toString\n
 */
public final class JdbcValues {
  private JdbcValues() {}

  public static Value read(ResultSet rs, int column, String declaredType) throws SQLException {
    Object o = rs.getObject(column);
    if (o == null) return Value.ofNull();

    if (o instanceof Number n && isBooleanDecl(declaredType)) return Value.of(n.longValue() != 0);
    if (o instanceof byte[] bytes) return Value.of(Base64.getEncoder().encodeToString(bytes));
    if (o instanceof Clob clob) return Value.of(clob.getSubString(1, (int) clob.length()));
    if (o instanceof Array arr) return Value.of(arrayText(arr));
    return Value.fromJava(o);
  }

  public static void bind(PreparedStatement ps, int index, Value v) throws SQLException {
    switch (v.type()) {
      case NULL -> ps.setNull(index, Types.NULL);
      // Stored as 0/1; the BOOLEAN declared type restores the distinction on read.
      case BOOLEAN -> ps.setInt(index, Boolean.TRUE.equals(v.raw()) ? 1 : 0);
      case INTEGER -> ps.setLong(index, (Long) v.raw());
      case FLOAT -> ps.setDouble(index, (Double) v.raw());
      case TEXT -> ps.setString(index, (String) v.raw());
    }
  }

  static boolean isBooleanDecl(String declaredType) {
    return declaredType != null && declaredType.toUpperCase(Locale.ROOT).startsWith("BOOL");
  }

  private static String arrayText(Array arr) throws SQLException {
    Object a = arr.getArray();
    if (a instanceof Object[] oa) return Arrays.deepToString(oa);
    return String.valueOf(a);
  }
}
