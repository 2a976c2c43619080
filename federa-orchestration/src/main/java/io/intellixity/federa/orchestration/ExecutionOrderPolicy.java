package io.intellixity.federa.orchestration;

import io.intellixity.federa.plan.QueryPlan;

/** Decides how the sub-queries of a plan are scheduled. */
@FunctionalInterface
public interface ExecutionOrderPolicy {
  ExecutionOrder decide(QueryPlan plan);
}
