package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

public record BoolValue(boolean value) implements Value {
  @Override public ColumnType type() { return ColumnType.BOOLEAN; }
  @Override public Object raw() { return value; }
  @Override public String toString() { return String.valueOf(value); }
}
