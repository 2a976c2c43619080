package io.intellixity.federa.result;

import io.intellixity.federa.schema.ScratchTable;
import io.intellixity.federa.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final output of a plan execution.\n
 *
 * {@code combined} tells whether the rows came from a combination query over the scratch store;
 * {@code tables} lists the scratch tables materialized for the plan.\n
 */
public record CombinedResult(TabularResult result, boolean combined, List<ScratchTable> tables) {
  public CombinedResult {
    Objects.requireNonNull(result, "result");
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  public List<String> columns() { return result.columns(); }
  public List<Map<String, Value>> rows() { return result.rows(); }
  public int rowCount() { return result.rowCount(); }
}
