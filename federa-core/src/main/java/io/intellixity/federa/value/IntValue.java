package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

public record IntValue(long value) implements Value {
  @Override public ColumnType type() { return ColumnType.INTEGER; }
  @Override public Object raw() { return value; }
  @Override public String toString() { return String.valueOf(value); }
}
