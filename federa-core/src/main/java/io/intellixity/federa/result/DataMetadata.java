package io.intellixity.federa.result;

import io.intellixity.federa.schema.ColumnType;
import io.intellixity.federa.schema.InferredSchema;
import io.intellixity.federa.schema.SchemaInference;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Columns, inferred column types and row count of a result. */
public record DataMetadata(List<String> columns, Map<String, ColumnType> columnTypes, int rowCount) {
  public DataMetadata {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    columnTypes = InferredSchema.of(Objects.requireNonNull(columnTypes, "columnTypes")).columns();
  }

  public static DataMetadata of(TabularResult result) {
    InferredSchema schema = SchemaInference.infer(result);
    return new DataMetadata(result.columns(), schema.columns(), result.rowCount());
  }

  public static DataMetadata of(CombinedResult result) {
    return of(result.result());
  }
}
