package io.intellixity.federa.exec;

/** Attempt to create a scratch table from a result without columns. */
public final class NoColumnsException extends FederationException {
  private final String tableName;

  public NoColumnsException(String tableName) {
    super("Cannot create table " + tableName + ": no column definitions");
    this.tableName = tableName;
  }

  public String tableName() { return tableName; }
}
