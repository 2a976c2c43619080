package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

/**
 * A single cell value, closed over the scratch-store type lattice.\n
 *
 * Executors produce values of exactly one of:\n
 * - {@link NullValue}\n
 * - {@link BoolValue}\n
 * - {@link IntValue}\n
 * - {@link FloatValue}\n
 * - {@link TextValue}\n
 */
public interface Value {
  /** Lattice type of this value. */
  ColumnType type();

  /** Plain Java form (null, Boolean, Long, Double, String) for binding and display. */
  Object raw();

  default boolean isNull() {
    return type() == ColumnType.NULL;
  }

  static Value ofNull() {
    return NullValue.INSTANCE;
  }

  static Value of(boolean v) {
    return new BoolValue(v);
  }

  static Value of(long v) {
    return new IntValue(v);
  }

  static Value of(double v) {
    return new FloatValue(v);
  }

  static Value of(String v) {
    return v == null ? NullValue.INSTANCE : new TextValue(v);
  }

  /** Lift a plain Java object into the lattice; unknown kinds become text. */
  static Value fromJava(Object o) {
    if (o == null) return NullValue.INSTANCE;
    if (o instanceof Value v) return v;
    if (o instanceof Boolean b) return new BoolValue(b);
    if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
      return new IntValue(((Number) o).longValue());
    }
    if (o instanceof Double || o instanceof Float) return new FloatValue(((Number) o).doubleValue());
    if (o instanceof java.math.BigInteger bi) {
      return bi.bitLength() < 64 ? new IntValue(bi.longValue()) : new TextValue(bi.toString());
    }
    if (o instanceof java.math.BigDecimal bd) {
      try {
        return new IntValue(bd.longValueExact());
      } catch (ArithmeticException notIntegral) {
        return new FloatValue(bd.doubleValue());
      }
    }
    return new TextValue(String.valueOf(o));
  }
}
