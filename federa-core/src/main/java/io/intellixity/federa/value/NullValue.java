package io.intellixity.federa.value;

import io.intellixity.federa.schema.ColumnType;

public final class NullValue implements Value {
  public static final NullValue INSTANCE = new NullValue();

  private NullValue() {}

  @Override public ColumnType type() { return ColumnType.NULL; }
  @Override public Object raw() { return null; }
  @Override public String toString() { return "NULL"; }
}
