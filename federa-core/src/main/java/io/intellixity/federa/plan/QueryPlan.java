package io.intellixity.federa.plan;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.federa.exec.PlanValidationException;
import io.intellixity.federa.sql.Identifiers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative description of a federated query.\n
 *
 * Result aliases are unique across both lists; they become scratch table name suffixes.\n
 */
@JsonSerialize(using = QueryPlanJsonSerializer.class)
@JsonDeserialize(using = QueryPlanJsonDeserializer.class)
public record QueryPlan(List<RelationalSubQuery> relationalQueries,
                        List<ToolCall> toolCalls,
                        boolean needsCombination) {
  public QueryPlan {
    relationalQueries = relationalQueries == null ? List.of() : List.copyOf(relationalQueries);
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);

    Set<String> seen = new HashSet<>();
    for (SubQuery q : concat(relationalQueries, toolCalls)) {
      if (!seen.add(q.resultAlias())) {
        throw new PlanValidationException("Duplicate result alias in plan: " + q.resultAlias());
      }
    }
    // Dependent queries read earlier results under the bare alias, so no alias may name another alias's table.
    for (String alias : seen) {
      if (seen.contains(Identifiers.scratchTableName(alias))) {
        throw new PlanValidationException("Result alias " + Identifiers.scratchTableName(alias)
            + " collides with the scratch table of alias " + alias);
      }
    }
  }

  public static QueryPlan empty() {
    return new QueryPlan(List.of(), List.of(), false);
  }

  public static QueryPlan of(RelationalSubQuery... queries) {
    return new QueryPlan(List.of(queries), List.of(), false);
  }

  public QueryPlan withToolCalls(List<ToolCall> calls) {
    return new QueryPlan(relationalQueries, calls, needsCombination);
  }

  public QueryPlan withCombination(boolean combine) {
    return new QueryPlan(relationalQueries, toolCalls, combine);
  }

  /** Relational queries followed by tool calls, in plan order. */
  public List<SubQuery> subQueries() {
    return concat(relationalQueries, toolCalls);
  }

  public boolean isEmpty() {
    return relationalQueries.isEmpty() && toolCalls.isEmpty();
  }

  private static List<SubQuery> concat(List<RelationalSubQuery> r, List<ToolCall> t) {
    List<SubQuery> out = new ArrayList<>(r.size() + t.size());
    out.addAll(r);
    out.addAll(t);
    return out;
  }
}
