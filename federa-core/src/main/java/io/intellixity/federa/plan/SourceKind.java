package io.intellixity.federa.plan;

public enum SourceKind {
  /** A relational database addressed by source id, executed with statement text. */
  RELATIONAL,
  /** A remote tool endpoint invoked by tool name with a parameter mapping. */
  TOOL
}
