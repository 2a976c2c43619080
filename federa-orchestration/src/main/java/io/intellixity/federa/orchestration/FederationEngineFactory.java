package io.intellixity.federa.orchestration;

import io.intellixity.federa.jdbc.scratch.ScratchStore;
import io.intellixity.federa.orchestration.resolve.SourceExecutorResolver;
import io.intellixity.federa.sql.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link FederationEngine}, and so one scratch file {@code <dir>/federa-<session>.db},
 * per session.\n
 *
 * Session ids that sanitize to the same name share an engine; its lock keeps them apart.\n
 */
public final class FederationEngineFactory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FederationEngineFactory.class);

  private final Path scratchDir;
  private final SourceExecutorResolver resolver;
  private final ExecutionOrderPolicy orderPolicy;
  private final PlanExecutionListener listener;
  private final Map<String, FederationEngine> engines = new ConcurrentHashMap<>();

  public FederationEngineFactory(Path scratchDir,
                                 SourceExecutorResolver resolver,
                                 ExecutionOrderPolicy orderPolicy,
                                 PlanExecutionListener listener) {
    this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.orderPolicy = Objects.requireNonNull(orderPolicy, "orderPolicy");
    this.listener = listener == null ? PlanExecutionListener.NOOP : listener;
  }

  public FederationEngineFactory(Path scratchDir, SourceExecutorResolver resolver) {
    this(scratchDir, resolver, QueryCountExecutionOrderPolicy.INSTANCE, PlanExecutionListener.NOOP);
  }

  public FederationEngine forSession(String sessionId) {
    String key = Identifiers.sanitizeSessionId(sessionId);
    return engines.computeIfAbsent(key, k -> {
      Path file = scratchDir.resolve("federa-" + k + ".db");
      log.info("federa.engine open session={} file={}", k, file);
      return new FederationEngine(new ScratchStore(file), resolver, orderPolicy, listener);
    });
  }

  /** Close the session's engine and delete its scratch file; false if it had none. */
  public boolean release(String sessionId) {
    FederationEngine e = engines.remove(Identifiers.sanitizeSessionId(sessionId));
    if (e == null) return false;
    e.close();
    return true;
  }

  public SourceExecutorResolver resolver() { return resolver; }

  @Override
  public void close() {
    for (String k : engines.keySet()) {
      FederationEngine e = engines.remove(k);
      if (e != null) e.close();
    }
  }
}
