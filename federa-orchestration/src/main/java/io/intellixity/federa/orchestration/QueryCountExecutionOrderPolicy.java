package io.intellixity.federa.orchestration;

import io.intellixity.federa.plan.QueryPlan;

/**
 * More than one relational sub-query → {@link ExecutionOrder#SEQUENTIAL}, else
 * {@link ExecutionOrder#PARALLEL}.\n
 *
 * A later statement may read the table materialized for an earlier alias; this policy cannot tell
 * which ones do, so it serializes all of them.\n
 */
public final class QueryCountExecutionOrderPolicy implements ExecutionOrderPolicy {
  public static final QueryCountExecutionOrderPolicy INSTANCE = new QueryCountExecutionOrderPolicy();

  @Override
  public ExecutionOrder decide(QueryPlan plan) {
    return plan.relationalQueries().size() > 1 ? ExecutionOrder.SEQUENTIAL : ExecutionOrder.PARALLEL;
  }
}
