package io.intellixity.federa.exec;

/** An origin query or tool call failed; wraps the transport/driver error unchanged. */
public final class SourceExecutionException extends FederationException {
  private final String sourceId;
  private final String alias;

  public SourceExecutionException(String sourceId, String alias, Throwable cause) {
    super("Source '" + sourceId + "' failed for alias '" + alias + "': " + describe(cause), cause);
    this.sourceId = sourceId;
    this.alias = alias;
  }

  public String sourceId() { return sourceId; }
  public String alias() { return alias; }

  private static String describe(Throwable t) {
    if (t == null) return "unknown error";
    String m = t.getMessage();
    return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
  }
}
