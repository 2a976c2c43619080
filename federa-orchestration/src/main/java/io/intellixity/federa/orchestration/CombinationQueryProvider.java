package io.intellixity.federa.orchestration;

import io.intellixity.federa.schema.ScratchTable;

import java.util.List;

/**
 * Supplies the combination statement once every source result is materialized.\n
 *
 * Typically backed by the external planner: it receives each table's name, schema and row count and
 * returns one read-only SQL statement over those tables.\n
 */
@FunctionalInterface
public interface CombinationQueryProvider {
  String combinationQuery(List<ScratchTable> tables);

  /** Provider for a statement already known up front. */
  static CombinationQueryProvider fixed(String sql) {
    return tables -> sql;
  }
}
