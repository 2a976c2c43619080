package io.intellixity.federa.jdbc;

import io.intellixity.federa.plan.SourceKind;
import io.intellixity.federa.spi.exec.SourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Objects;

/** Relational source handle (resolved by application code). */
public final class JdbcSourceHandle implements SourceHandle<DataSource> {
  private static final Logger log = LoggerFactory.getLogger(JdbcSourceHandle.class);

  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcSourceHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public JdbcSourceHandle(String id, DataSource client) {
    this(id, client, null);
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public SourceKind kind() { return SourceKind.RELATIONAL; }

  /** Schema used to scope introspection; null means all schemas. */
  public String schema() { return schema; }

  /** Closes pooled data sources (e.g. HikariDataSource); plain data sources are left alone. */
  @Override
  public void close() {
    if (client instanceof AutoCloseable c) {
      try {
        c.close();
        log.info("federa.jdbc closed source={}", id);
      } catch (Exception e) {
        throw new IllegalStateException("Failed to close data source of " + id, e);
      }
    }
  }
}
