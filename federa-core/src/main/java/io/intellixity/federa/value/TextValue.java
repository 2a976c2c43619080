package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

import java.util.Objects;

public record TextValue(String value) implements Value {
  public TextValue {
    Objects.requireNonNull(value, "value");
  }

  @Override public ColumnType type() { return ColumnType.TEXT; }
  @Override public Object raw() { return value; }
  @Override public String toString() { return value; }
}
