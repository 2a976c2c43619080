package io.intellixity.federa.spi.exec;

import io.intellixity.federa.plan.SubQuery;
import io.intellixity.federa.result.TabularResult;

/** Executes one kind of sub-query against the source behind {@link #handle()}. */
public interface SourceExecutor<Q extends SubQuery, H extends SourceHandle<?>> {
  H handle();

  /**
   * Run the sub-query and return its rows.\n
   *
   * Driver/transport failures surface as {@code SourceExecutionException}; contract violations
   * (e.g. non-tabular tool output) surface as their own {@code FederationException} subtype.\n
   */
  TabularResult execute(Q query);

  /** Cheap round trip proving the source is reachable; throws on failure. */
  void ping();
}
