package io.intellixity.federa.exec;

/** A tool response was not a list of objects sharing one key set. */
public final class NonTabularResponseException extends FederationException {
  private final String sourceId;
  private final String toolName;

  public NonTabularResponseException(String sourceId, String toolName, String reason) {
    super("Tool '" + toolName + "' on source '" + sourceId + "' returned non-tabular data: " + reason);
    this.sourceId = sourceId;
    this.toolName = toolName;
  }

  public String sourceId() { return sourceId; }
  public String toolName() { return toolName; }
}
