package io.intellixity.federa.plan;

import io.intellixity.federa.exec.PlanValidationException;
import io.intellixity.federa.sql.Identifiers;

/** One unit of source work inside a {@link QueryPlan}. */
public interface SubQuery {
  String sourceId();

  /** Alias the result is materialized under; unique within a plan. */
  String resultAlias();

  SourceKind kind();

  /**
   * Check that {@code alias} and its scratch table name {@code temp_<alias>} are both valid
   * identifiers, so a plan never fails on naming after its sources have been queried.\n
   */
  static String requireValidAlias(String alias) {
    if (!Identifiers.isSafe(alias)) {
      throw new PlanValidationException("Invalid result alias '" + alias
          + "' (allowed: letter or '_' followed by letters, digits, '_'; max " + Identifiers.MAX_LENGTH + " chars)");
    }
    if (!Identifiers.isSafe(Identifiers.SCRATCH_PREFIX + alias)) {
      throw new PlanValidationException("Result alias '" + alias + "' is too long: scratch table name "
          + Identifiers.SCRATCH_PREFIX + alias + " exceeds " + Identifiers.MAX_LENGTH + " chars");
    }
    return alias;
  }
}
