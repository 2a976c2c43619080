package io.intellixity.federa.orchestration;

public enum PlanState {
  PLANNING,
  EXECUTING,
  MATERIALIZING,
  COMBINING,
  DONE,
  FAILED
}
