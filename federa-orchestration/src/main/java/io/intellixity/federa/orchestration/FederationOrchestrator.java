package io.intellixity.federa.orchestration;

import io.intellixity.federa.exec.PlanExecutionException;
import io.intellixity.federa.exec.SourceFailure;
import io.intellixity.federa.jdbc.JdbcSourceExecutor;
import io.intellixity.federa.jdbc.scratch.ScratchStore;
import io.intellixity.federa.orchestration.resolve.SourceExecutorResolver;
import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.plan.RelationalSubQuery;
import io.intellixity.federa.plan.SubQuery;
import io.intellixity.federa.plan.ToolCall;
import io.intellixity.federa.result.CombinedResult;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.SchemaInference;
import io.intellixity.federa.schema.ScratchTable;
import io.intellixity.federa.sql.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one plan: executes every sub-query, materializes each result as {@code temp_<alias>} in the
 * scratch store and, when the plan asks for it, runs the combination statement over those tables.\n
 *
 * Scheduling:\n
 * - {@link ExecutionOrder#SEQUENTIAL}: relational sub-queries run in plan order, each materialized
 *   before the next starts and also made readable under its bare alias (a view over
 *   {@code temp_<alias>}), so later statements can select from it; the first failure stops the
 *   chain. Tool calls run concurrently alongside.\n
 * - {@link ExecutionOrder#PARALLEL}: everything runs concurrently; results are materialized one by
 *   one after all of them have finished.\n
 *
 * A plan pool holds one thread per concurrent task and is discarded with the plan. Source failures
 * are collected across the batch and raised together as {@link PlanExecutionException}; failing
 * tasks do not cancel siblings already in flight. Scratch-store failures propagate as they are.\n
 *
 * Not thread-safe against one scratch store; callers serialize (see {@code FederationEngine}).\n
 */
public final class FederationOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(FederationOrchestrator.class);
  private static final AtomicInteger POOLS = new AtomicInteger();

  private final ScratchStore store;
  private final JdbcSourceExecutor scratchExecutor;
  private final SourceExecutorResolver resolver;
  private final ExecutionOrderPolicy orderPolicy;
  private final PlanExecutionListener listener;

  public FederationOrchestrator(ScratchStore store,
                                SourceExecutorResolver resolver,
                                ExecutionOrderPolicy orderPolicy,
                                PlanExecutionListener listener) {
    this.store = Objects.requireNonNull(store, "store");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.orderPolicy = Objects.requireNonNull(orderPolicy, "orderPolicy");
    this.listener = listener == null ? PlanExecutionListener.NOOP : listener;
    this.scratchExecutor = new JdbcSourceExecutor(store.sourceHandle());
  }

  public CombinedResult execute(QueryPlan plan, CombinationQueryProvider combination) {
    Objects.requireNonNull(plan, "plan");
    if (plan.needsCombination() && combination == null) {
      throw new IllegalArgumentException("Plan needs combination but no CombinationQueryProvider was given");
    }
    listener.onState(PlanState.PLANNING);
    ExecutionOrder order = orderPolicy.decide(plan);
    log.info("federa.plan start order={} relational={} tools={} combine={}",
        order, plan.relationalQueries().size(), plan.toolCalls().size(), plan.needsCombination());

    int fanOut = plan.toolCalls().size() + (order == ExecutionOrder.PARALLEL ? plan.relationalQueries().size() : 0);
    ExecutorService pool = fanOut == 0 ? null : Executors.newFixedThreadPool(fanOut, planThreads());
    try {
      listener.onState(PlanState.EXECUTING);
      Map<SubQuery, TabularResult> results = new LinkedHashMap<>();
      List<ScratchTable> tables = new ArrayList<>();
      List<SourceFailure> failures = new ArrayList<>();

      Map<SubQuery, CompletableFuture<TabularResult>> inFlight = new LinkedHashMap<>();
      if (order == ExecutionOrder.PARALLEL) {
        for (RelationalSubQuery q : plan.relationalQueries()) inFlight.put(q, submit(q, pool));
      }
      for (ToolCall c : plan.toolCalls()) inFlight.put(c, submit(c, pool));

      if (order == ExecutionOrder.SEQUENTIAL) {
        for (RelationalSubQuery q : plan.relationalQueries()) {
          TabularResult r;
          try {
            r = run(q);
          } catch (RuntimeException e) {
            failures.add(failureOf(q, e));
            break;
          }
          results.put(q, r);
          ScratchTable t = materialize(q, r, plan.needsCombination(), tables);
          if (t != null) store.createAliasView(q.resultAlias(), t.name());
        }
      }

      for (var e : inFlight.entrySet()) {
        try {
          results.put(e.getKey(), e.getValue().join());
        } catch (CompletionException ce) {
          failures.add(failureOf(e.getKey(), ce.getCause() == null ? ce : ce.getCause()));
        }
      }
      if (!failures.isEmpty()) {
        PlanExecutionException ex = new PlanExecutionException(failures);
        log.warn("federa.plan failed sources={} error={}", failures.size(), ex.getMessage());
        throw ex;
      }
      log.info("federa.plan joined results={}", results.size());

      listener.onState(PlanState.MATERIALIZING);
      for (var e : inFlight.keySet()) materialize(e, results.get(e), plan.needsCombination(), tables);

      CombinedResult out;
      if (!plan.needsCombination()) {
        out = new CombinedResult(primaryResult(plan, results), false, tables);
      } else {
        listener.onState(PlanState.COMBINING);
        String sql = combination.combinationQuery(List.copyOf(tables));
        out = new CombinedResult(store.query(sql), true, tables);
      }
      listener.onState(PlanState.DONE);
      log.info("federa.plan done combined={} tables={} rows={}", out.combined(), tables.size(), out.rowCount());
      return out;
    } catch (RuntimeException e) {
      listener.onState(PlanState.FAILED);
      throw e;
    } finally {
      if (pool != null) pool.shutdown();
    }
  }

  private CompletableFuture<TabularResult> submit(SubQuery q, ExecutorService pool) {
    return CompletableFuture.supplyAsync(() -> run(q), pool);
  }

  private TabularResult run(SubQuery q) {
    listener.onSourceStarted(q);
    try {
      TabularResult r = q instanceof RelationalSubQuery rq && rq.targetsScratchStore()
          ? scratchExecutor.execute(rq)
          : resolver.execute(q);
      // Cells take their column's inferred type, matching what the scratch table returns.
      r = SchemaInference.conform(r);
      listener.onSourceFinished(q, r);
      return r;
    } catch (RuntimeException e) {
      listener.onSourceFailed(q, e);
      throw e;
    }
  }

  /**
   * Columnless results (e.g. a statement that returned no result set) cannot become tables: when the
   * plan combines they fail it, otherwise they are skipped and null is returned.\n
   */
  private ScratchTable materialize(SubQuery q, TabularResult r, boolean combining, List<ScratchTable> tables) {
    String table = Identifiers.scratchTableName(q.resultAlias());
    if (!r.hasColumns() && !combining) {
      log.warn("federa.plan skip_materialize alias={} reason=no_columns", q.resultAlias());
      return null;
    }
    ScratchTable t = store.materialize(table, q.resultAlias(), r);
    tables.add(t);
    listener.onMaterialized(t);
    return t;
  }

  /** First relational result, else first tool result, else empty. */
  private static TabularResult primaryResult(QueryPlan plan, Map<SubQuery, TabularResult> results) {
    for (SubQuery q : plan.subQueries()) {
      TabularResult r = results.get(q);
      if (r != null) return r;
    }
    return TabularResult.empty();
  }

  private static SourceFailure failureOf(SubQuery q, Throwable cause) {
    return new SourceFailure(q.resultAlias(), q.sourceId(), q.kind(), cause);
  }

  private static ThreadFactory planThreads() {
    int pool = POOLS.incrementAndGet();
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "federa-plan-" + pool + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
