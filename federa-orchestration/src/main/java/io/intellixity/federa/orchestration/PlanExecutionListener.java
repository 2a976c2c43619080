package io.intellixity.federa.orchestration;

import io.intellixity.federa.plan.SubQuery;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.ScratchTable;

/**
 * Observer of one plan execution.\n
 *
 * Source callbacks arrive on the worker threads that run the sub-queries; state and
 * materialization callbacks arrive on the calling thread. Implementations must not throw.\n
 */
public interface PlanExecutionListener {
  PlanExecutionListener NOOP = new PlanExecutionListener() {};

  default void onState(PlanState state) {}

  default void onSourceStarted(SubQuery query) {}

  default void onSourceFinished(SubQuery query, TabularResult result) {}

  default void onSourceFailed(SubQuery query, Throwable error) {}

  default void onMaterialized(ScratchTable table) {}
}
