package io.intellixity.federa.orchestration.resolve;

import io.intellixity.federa.jdbc.JdbcSourceHandle;
import io.intellixity.federa.plan.SourceKind;
import io.intellixity.federa.spi.exec.SourceHandle;
import io.intellixity.federa.spi.tool.ToolClient;
import io.intellixity.federa.tool.ToolSourceHandle;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link SourceHandleResolver} over registered client factories.\n
 *
 * Factories run lazily on the first resolve of a source (and again after the cached handle
 * was evicted and closed), so a pooled data source is only opened for sources a plan uses.\n
 */
public final class SourceRegistry implements SourceHandleResolver {
  private record Registration(SourceKind kind, Supplier<SourceHandle<?>> factory) {}

  private final Map<String, Registration> sources = new ConcurrentHashMap<>();

  public SourceRegistry registerRelational(String sourceId, Supplier<? extends DataSource> dataSource) {
    return registerRelational(sourceId, null, dataSource);
  }

  public SourceRegistry registerRelational(String sourceId, String schema, Supplier<? extends DataSource> dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return register(sourceId, SourceKind.RELATIONAL, () -> new JdbcSourceHandle(sourceId, dataSource.get(), schema));
  }

  public SourceRegistry registerTool(String sourceId, Supplier<? extends ToolClient> client) {
    Objects.requireNonNull(client, "client");
    return register(sourceId, SourceKind.TOOL, () -> new ToolSourceHandle(sourceId, client.get()));
  }

  public Set<String> sourceIds() {
    return new TreeSet<>(sources.keySet());
  }

  @Override
  public SourceHandle<?> resolve(String sourceId, SourceKind kind) {
    Registration r = sources.get(sourceId);
    if (r == null || r.kind() != kind) return null;
    return r.factory().get();
  }

  private SourceRegistry register(String sourceId, SourceKind kind, Supplier<SourceHandle<?>> factory) {
    Objects.requireNonNull(sourceId, "sourceId");
    if (sourceId.isBlank()) throw new IllegalArgumentException("sourceId is blank");
    if (sources.putIfAbsent(sourceId, new Registration(kind, factory)) != null) {
      throw new IllegalArgumentException("Source already registered: " + sourceId);
    }
    return this;
  }
}
