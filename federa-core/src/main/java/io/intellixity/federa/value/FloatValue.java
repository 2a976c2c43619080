package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

public record FloatValue(double value) implements Value {
  @Override public ColumnType type() { return ColumnType.FLOAT; }
  @Override public Object raw() { return value; }
  @Override public String toString() { return String.valueOf(value); }
}
