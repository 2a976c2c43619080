package io.intellixity.federa.spi.exec;

import io.intellixity.federa.plan.SourceKind;

/**
 * Resolved runtime handle for one data source.\n
 *
 * Example:\n
 * - relational: client() is javax.sql.DataSource\n
 * - tool: client() is a ToolClient\n
 */
public interface SourceHandle<TClient> extends AutoCloseable {
  /** Source id this handle was resolved for (useful for logging/caching). */
  String id();

  /** Native client used by an executor (DataSource, ToolClient, ...). */
  TClient client();

  SourceKind kind();

  /** Release pooled resources held by the client; a no-op by default. */
  @Override
  default void close() {}
}
