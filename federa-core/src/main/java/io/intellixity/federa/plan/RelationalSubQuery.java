package io.intellixity.federa.plan;

import io.intellixity.federa.exec.PlanValidationException;

/**
 * Statement text dispatched to a pre-registered relational source.\n
 *
 * {@link #SCRATCH_SOURCE_ID} routes the statement to the executing engine's own scratch store.\n
 */
public record RelationalSubQuery(String sourceId, String statementText, String resultAlias) implements SubQuery {
  public static final String SCRATCH_SOURCE_ID = "__session__";

  public RelationalSubQuery {
    if (sourceId == null || sourceId.isBlank()) throw new PlanValidationException("Relational sub-query without sourceId");
    if (statementText == null || statementText.isBlank()) {
      throw new PlanValidationException("Relational sub-query '" + resultAlias + "' has no statement text");
    }
    SubQuery.requireValidAlias(resultAlias);
  }

  @Override
  public SourceKind kind() {
    return SourceKind.RELATIONAL;
  }

  public boolean targetsScratchStore() {
    return SCRATCH_SOURCE_ID.equals(sourceId);
  }
}
