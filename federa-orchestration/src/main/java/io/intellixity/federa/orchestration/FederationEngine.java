package io.intellixity.federa.orchestration;

import io.intellixity.federa.jdbc.scratch.ScratchStore;
import io.intellixity.federa.orchestration.resolve.SourceExecutorResolver;
import io.intellixity.federa.orchestration.session.SessionTableRegistry;
import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.result.CombinedResult;
import io.intellixity.federa.result.DataMetadata;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.InferredSchema;
import io.intellixity.federa.schema.ScratchTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns one scratch store and executes plans against it.\n
 *
 * Plan executions, session-table operations and cleanup on the same engine are serialized on one
 * lock. Source executors come from a (possibly shared) {@link SourceExecutorResolver}.\n
 *
 * Example:\n
 * <pre>
 * CombinedResult r = engine.executePlan(plan, tables -> planner.combine(tables));
 * engine.dropPlanTables();
 * engine.createSessionTable("abc-123", 1, r.result());
 * </pre>
 */
public final class FederationEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FederationEngine.class);

  private final ScratchStore store;
  private final FederationOrchestrator orchestrator;
  private final SessionTableRegistry sessionTables;
  private final ReentrantLock lock = new ReentrantLock();

  private List<ScratchTable> lastMaterialized = List.of();

  public FederationEngine(ScratchStore store,
                          SourceExecutorResolver resolver,
                          ExecutionOrderPolicy orderPolicy,
                          PlanExecutionListener listener) {
    this.store = Objects.requireNonNull(store, "store");
    this.orchestrator = new FederationOrchestrator(store, resolver, orderPolicy, listener);
    this.sessionTables = new SessionTableRegistry(store);
  }

  public FederationEngine(ScratchStore store, SourceExecutorResolver resolver) {
    this(store, resolver, QueryCountExecutionOrderPolicy.INSTANCE, PlanExecutionListener.NOOP);
  }

  public ScratchStore store() { return store; }

  /** Execute a plan that does not need combination. */
  public CombinedResult executePlan(QueryPlan plan) {
    return executePlan(plan, null);
  }

  public CombinedResult executePlan(QueryPlan plan, CombinationQueryProvider combination) {
    return locked(() -> {
      lastMaterialized = List.of();
      CombinedResult r = orchestrator.execute(plan, combination);
      lastMaterialized = r.tables();
      return r;
    });
  }

  /** Columns, inferred types and row count of a plan result. */
  public DataMetadata metadataOf(CombinedResult result) {
    return DataMetadata.of(result);
  }

  /** Tables materialized by the last successful plan execution. */
  public List<ScratchTable> lastMaterialized() {
    return locked(() -> lastMaterialized);
  }

  public String createSessionTable(String sessionId, int interactionSeq, TabularResult result) {
    return locked(() -> sessionTables.create(sessionId, interactionSeq, result));
  }

  public List<String> listSessionTables(String sessionId) {
    return locked(() -> sessionTables.listForSession(sessionId));
  }

  public InferredSchema sessionTableSchema(String tableName) {
    return locked(() -> sessionTables.schemaOf(tableName));
  }

  public ScratchTable describeSessionTable(String tableName) {
    return locked(() -> sessionTables.describe(tableName));
  }

  public TabularResult querySessionTable(String tableName, Integer limit, int offset) {
    return locked(() -> sessionTables.query(tableName, limit, offset));
  }

  public int dropSessionTables(String sessionId) {
    return locked(() -> sessionTables.dropForSession(sessionId));
  }

  /**
   * Drop the {@code temp_} tables of the last plan, and the alias views over them; keep everything
   * else (e.g. session tables). Returns the number of tables dropped.\n
   */
  public int dropPlanTables() {
    return locked(() -> {
      int n = 0;
      for (ScratchTable t : lastMaterialized) {
        store.dropView(t.sourceAlias());
        if (store.dropTable(t.name())) n++;
      }
      lastMaterialized = List.of();
      return n;
    });
  }

  /** Discard all scratch state: the backing file is deleted, session tables included. */
  public void cleanup() {
    locked(() -> {
      store.dropAll();
      lastMaterialized = List.of();
      log.info("federa.engine cleanup file={}", store.file());
      return null;
    });
  }

  @Override
  public void close() {
    cleanup();
  }

  private <T> T locked(Supplier<T> work) {
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
