package io.intellixity.federa.exec;

/** The caller-supplied combination statement was rejected or failed against the scratch store. */
public final class CombinationQueryException extends FederationException {
  private final String sql;

  public CombinationQueryException(String sql, String message) {
    super(message);
    this.sql = sql;
  }

  public CombinationQueryException(String sql, Throwable cause) {
    super("Combination query failed: " + cause.getMessage(), cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}
