package io.intellixity.federa.exec;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated failure of a plan execution.\n
 *
 * Carries every failing source of the batch, not just the first one.\n
 */
public final class PlanExecutionException extends FederationException {
  private final List<SourceFailure> failures;

  public PlanExecutionException(List<SourceFailure> failures) {
    super("Query execution failed: " + join(failures), failures.isEmpty() ? null : failures.get(0).cause());
    this.failures = List.copyOf(failures);
    for (int i = 1; i < this.failures.size(); i++) addSuppressed(this.failures.get(i).cause());
  }

  public List<SourceFailure> failures() { return failures; }

  private static String join(List<SourceFailure> failures) {
    return failures.stream().map(SourceFailure::describe).collect(Collectors.joining("; "));
  }
}
