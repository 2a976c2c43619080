package io.intellixity.federa.exec;

import io.intellixity.federa.plan.SourceKind;

import java.util.Objects;

/** One failing source inside a plan execution. */
public record SourceFailure(String alias, String sourceId, SourceKind kind, Throwable cause) {
  public SourceFailure {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(cause, "cause");
  }

  public String describe() {
    String m = cause.getMessage();
    if (m == null || m.isBlank()) m = cause.getClass().getSimpleName();
    return kind + " " + alias + "@" + sourceId + ": " + m;
  }
}
