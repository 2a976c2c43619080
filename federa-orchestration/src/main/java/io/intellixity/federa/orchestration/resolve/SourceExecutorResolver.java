package io.intellixity.federa.orchestration.resolve;

import io.intellixity.federa.exec.SourceNotFoundException;
import io.intellixity.federa.jdbc.JdbcSourceExecutor;
import io.intellixity.federa.orchestration.internal.LruTtlCache;
import io.intellixity.federa.plan.RelationalSubQuery;
import io.intellixity.federa.plan.SourceKind;
import io.intellixity.federa.plan.SubQuery;
import io.intellixity.federa.plan.ToolCall;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.spi.exec.SourceExecutor;
import io.intellixity.federa.spi.exec.SourceHandle;
import io.intellixity.federa.spi.tool.ToolDescriptor;
import io.intellixity.federa.tool.ToolCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Cache-backed resolver that turns (sourceId, kind) into a cached {@link SourceExecutor}.\n
 *
 * Caches:\n
 * - SourceHandle by (sourceId, kind); handles leaving the cache are closed\n
 * - SourceExecutor by (kind, handle), so a re-resolved handle never reuses a stale executor\n
 *
 * Leases: {@link #execute}, {@link #withExecutor} and the introspection calls hold a lease on the
 * handle while they run. A handle that expires, is evicted or is closed while leased is retired
 * instead: it leaves the cache at once but is closed only when its last lease is released. The
 * bare lookups ({@link #resolve}, {@link #relational}, {@link #tool}) take no lease.\n
 *
 * Every access to the handle cache happens under this resolver's monitor, which is always taken
 * before the cache's own.\n
 */
public final class SourceExecutorResolver implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SourceExecutorResolver.class);

  private final SourceHandleResolver handleResolver;
  private final SourceExecutorFactory executorFactory;

  private final LruTtlCache<HandleKey, SourceHandle<?>> handles;
  private final LruTtlCache<ExecutorKey, SourceExecutor<?, ?>> executors;

  // Guarded by this.
  private final Map<SourceHandle<?>, Integer> leases = new IdentityHashMap<>();
  private final Set<SourceHandle<?>> retired = Collections.newSetFromMap(new IdentityHashMap<>());

  public SourceExecutorResolver(SourceHandleResolver handleResolver,
                                SourceExecutorFactory executorFactory,
                                int maxHandles,
                                int maxExecutors,
                                long ttlMillis) {
    this(handleResolver, executorFactory, maxHandles, maxExecutors, ttlMillis, 0);
  }

  public SourceExecutorResolver(SourceHandleResolver handleResolver,
                                SourceExecutorFactory executorFactory,
                                int maxHandles,
                                int maxExecutors,
                                long ttlMillis,
                                long idleMillis) {
    this.handleResolver = Objects.requireNonNull(handleResolver, "handleResolver");
    this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
    this.handles = new LruTtlCache<>(maxHandles, ttlMillis, idleMillis, this::retire);
    this.executors = new LruTtlCache<>(maxExecutors, ttlMillis, idleMillis);
  }

  /** Cached executor for a source, without a lease. */
  public synchronized SourceExecutor<?, ?> resolve(String sourceId, SourceKind kind) {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(kind, "kind");
    String id = sourceId.trim();
    if (id.isEmpty()) throw new IllegalArgumentException("sourceId is blank");
    if (RelationalSubQuery.SCRATCH_SOURCE_ID.equals(id)) {
      throw new IllegalArgumentException(id + " is served by the engine's own scratch store");
    }

    HandleKey hk = new HandleKey(id, kind);
    SourceHandle<?> handle = handles.getOrCompute(hk, () -> {
      SourceHandle<?> h = handleResolver.resolve(id, kind);
      if (h == null) throw new SourceNotFoundException(id);
      if (h.kind() != kind) throw new IllegalStateException("Resolver returned " + h.kind() + " handle for " + hk);
      log.info("federa.resolve handle source={} kind={}", id, kind);
      return h;
    });

    ExecutorKey ek = new ExecutorKey(kind, handle);
    SourceExecutor<?, ?> executor = executors.getOrCompute(ek, () -> executorFactory.create(handle));
    if (executor == null) throw new IllegalStateException("SourceExecutorFactory returned null for " + hk);
    return executor;
  }

  public JdbcSourceExecutor relational(String sourceId) {
    return asRelational(sourceId, resolve(sourceId, SourceKind.RELATIONAL));
  }

  public ToolCallExecutor tool(String sourceId) {
    return asTool(sourceId, resolve(sourceId, SourceKind.TOOL));
  }

  /**
   * Run {@code work} with the executor of a source; the source's handle is not closed before
   * {@code work} returns, even if the cache drops it meanwhile.\n
   */
  public <T> T withExecutor(String sourceId, SourceKind kind, Function<SourceExecutor<?, ?>, T> work) {
    Objects.requireNonNull(work, "work");
    SourceExecutor<?, ?> executor = acquire(sourceId, kind);
    try {
      return work.apply(executor);
    } finally {
      release(executor.handle());
    }
  }

  /** Execute a relational sub-query or tool call against its (leased) source. */
  public TabularResult execute(SubQuery query) {
    Objects.requireNonNull(query, "query");
    if (query instanceof RelationalSubQuery rq) {
      return withExecutor(rq.sourceId(), SourceKind.RELATIONAL, ex -> asRelational(rq.sourceId(), ex).execute(rq));
    }
    if (query instanceof ToolCall tc) {
      return withExecutor(tc.sourceId(), SourceKind.TOOL, ex -> asTool(tc.sourceId(), ex).execute(tc));
    }
    throw new IllegalArgumentException("Unsupported sub-query type: " + query.getClass().getName());
  }

  /** Tables and their columns of a relational source. */
  public Map<String, List<String>> describeSource(String sourceId) {
    return withExecutor(sourceId, SourceKind.RELATIONAL, ex -> asRelational(sourceId, ex).describeSource());
  }

  public List<ToolDescriptor> listTools(String sourceId) {
    return withExecutor(sourceId, SourceKind.TOOL, ex -> asTool(sourceId, ex).listTools());
  }

  /** Connection test; throws if the source is unknown or unreachable. */
  public void ping(String sourceId, SourceKind kind) {
    withExecutor(sourceId, kind, ex -> {
      ex.ping();
      return null;
    });
  }

  /** Drop the cached handle of {@code sourceId} (closed once unleased); returns false if none was cached. */
  public synchronized boolean close(String sourceId) {
    int n = handles.removeIf(k -> k.sourceId().equals(sourceId));
    executors.removeIf(k -> k.handle().id().equals(sourceId));
    return n > 0;
  }

  public synchronized void closeAll() {
    handles.clear();
    executors.clear();
  }

  @Override
  public void close() {
    closeAll();
  }

  /** Number of handles dropped from the cache but still leased. */
  synchronized int retiredCount() {
    return retired.size();
  }

  private synchronized SourceExecutor<?, ?> acquire(String sourceId, SourceKind kind) {
    SourceExecutor<?, ?> executor = resolve(sourceId, kind);
    leases.merge(executor.handle(), 1, Integer::sum);
    return executor;
  }

  private synchronized void release(SourceHandle<?> handle) {
    Integer left = leases.merge(handle, -1, Integer::sum);
    if (left != null && left > 0) return;
    leases.remove(handle);
    if (retired.remove(handle)) closeQuietly(handle);
  }

  // Removal listener of the handle cache; runs under this resolver's monitor.
  private void retire(HandleKey key, SourceHandle<?> handle) {
    if (leases.containsKey(handle)) {
      retired.add(handle);
      log.info("federa.resolve retire_deferred source={} kind={} leases={}", key.sourceId(), key.kind(), leases.get(handle));
      return;
    }
    closeQuietly(handle);
  }

  private static void closeQuietly(SourceHandle<?> handle) {
    try {
      handle.close();
    } catch (RuntimeException e) {
      // Closing happens on eviction or release, inside another caller's work; report and carry on.
      log.warn("federa.resolve close_failed source={} kind={} error={}", handle.id(), handle.kind(), e.toString());
    }
  }

  private static JdbcSourceExecutor asRelational(String sourceId, SourceExecutor<?, ?> ex) {
    if (ex instanceof JdbcSourceExecutor j) return j;
    throw new IllegalStateException("Relational source " + sourceId + " resolved to " + ex.getClass().getName());
  }

  private static ToolCallExecutor asTool(String sourceId, SourceExecutor<?, ?> ex) {
    if (ex instanceof ToolCallExecutor t) return t;
    throw new IllegalStateException("Tool source " + sourceId + " resolved to " + ex.getClass().getName());
  }

  private record HandleKey(String sourceId, SourceKind kind) {}
  private record ExecutorKey(SourceKind kind, SourceHandle<?> handle) {}
}
