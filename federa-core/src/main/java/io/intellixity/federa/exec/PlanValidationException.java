package io.intellixity.federa.exec;

/** Raised when a {@code QueryPlan} is structurally invalid (duplicate alias, missing statement, ...). */
public final class PlanValidationException extends FederationException {
  public PlanValidationException(String message) {
    super(message);
  }
}
