package io.intellixity.federa.orchestration.session;

import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.plan.RelationalSubQuery;

/**
 * Whether a plan's result deserves its own session table.\n
 *
 * Yes if the plan touched an origin source (a relational source other than the scratch store, or
 * any tool) or combined results. A plan that only re-reads existing session tables produces a
 * subset of data the session already has, so no new table is created for it.\n
 */
public final class SessionTablePolicy {
  private SessionTablePolicy() {}

  public static boolean shouldCreate(QueryPlan plan) {
    if (plan.needsCombination() || !plan.toolCalls().isEmpty()) return true;
    for (RelationalSubQuery q : plan.relationalQueries()) {
      if (!q.targetsScratchStore()) return true;
    }
    return false;
  }
}
