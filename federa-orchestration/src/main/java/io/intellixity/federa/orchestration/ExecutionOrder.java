package io.intellixity.federa.orchestration;

public enum ExecutionOrder {
  /** Relational sub-queries run one by one, each materialized before the next starts. */
  SEQUENTIAL,
  /** Every sub-query and tool call runs concurrently; results are materialized after the join. */
  PARALLEL
}
