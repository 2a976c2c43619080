package io.intellixity.federa.exec;

public final class UnknownSessionTableException extends FederationException {
  private final String tableName;

  public UnknownSessionTableException(String tableName) {
    super("Unknown session table: " + tableName);
    this.tableName = tableName;
  }

  public String tableName() { return tableName; }
}
