package io.intellixity.federa.schema;

import java.util.Objects;

/**
 * A table materialized in the scratch store.\n
 *
 * {@code sourceAlias} is the plan alias the table was built from (or the session table name for
 * session tables).\n
 */
public record ScratchTable(String name, InferredSchema schema, String sourceAlias, long rowCount) {
  public ScratchTable {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(schema, "schema");
    if (rowCount < 0) throw new IllegalArgumentException("rowCount must be >= 0");
  }
}
