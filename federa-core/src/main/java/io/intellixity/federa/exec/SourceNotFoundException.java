package io.intellixity.federa.exec;

/** Raised when a plan references a source id no resolver knows about. */
public final class SourceNotFoundException extends FederationException {
  private final String sourceId;

  public SourceNotFoundException(String sourceId) {
    super("Unknown data source: " + sourceId);
    this.sourceId = sourceId;
  }

  public String sourceId() { return sourceId; }
}
