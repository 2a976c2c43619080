package io.intellixity.federa.orchestration;

import io.intellixity.federa.jdbc.scratch.ScratchStore;
import io.intellixity.federa.orchestration.resolve.DefaultSourceExecutorFactory;
import io.intellixity.federa.orchestration.resolve.SourceExecutorResolver;
import io.intellixity.federa.orchestration.resolve.SourceRegistry;
import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.plan.RelationalSubQuery;
import io.intellixity.federa.plan.ToolCall;
import io.intellixity.federa.result.CombinedResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ParallelExecutionTest {
  @TempDir Path dir;

  private static final long SLOW_MILLIS = 600;

  @Test
  void independentQueryAndToolCallRunConcurrently() throws Exception {
    // Both sources wait for each other: if they ran one after the other the barrier would time out.
    CyclicBarrier bothStarted = new CyclicBarrier(2);
    Runnable rendezvousThenWork = () -> {
      try {
        bothStarted.await(5, TimeUnit.SECONDS);
        Thread.sleep(SLOW_MILLIS);
      } catch (Exception e) {
        throw new IllegalStateException("sources did not overlap", e);
      }
    };

    DataSource crm = Fixtures.gated(Fixtures.crmDatabase(dir.resolve("crm.db")), rendezvousThenWork);
    SourceRegistry registry = new SourceRegistry()
        .registerRelational("crm", () -> crm)
        .registerTool("weather", () -> Fixtures.tool((name, params) -> {
          rendezvousThenWork.run();
          return "[{\"city\":\"Oslo\",\"temp\":4.5}]";
        }));

    try (SourceExecutorResolver resolver = new SourceExecutorResolver(registry, DefaultSourceExecutorFactory.INSTANCE, 10, 10, 60_000);
         FederationEngine engine = new FederationEngine(new ScratchStore(dir.resolve("scratch.db")), resolver)) {
      QueryPlan plan = new QueryPlan(
          List.of(new RelationalSubQuery("crm", "SELECT id, city FROM customers", "customers")),
          List.of(new ToolCall("weather", "weather", Map.of(), "weather")),
          false);

      long start = System.nanoTime();
      CombinedResult r = engine.executePlan(plan);
      long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

      assertEquals(2, r.tables().size());
      assertEquals(3, r.rowCount());
      assertTrue(elapsedMillis < 2 * SLOW_MILLIS, "took " + elapsedMillis + "ms");
    }
  }

  @Test
  void policyDecidesOnRelationalQueryCount() {
    RelationalSubQuery a = new RelationalSubQuery("crm", "SELECT 1", "a");
    RelationalSubQuery b = new RelationalSubQuery("crm", "SELECT 2", "b");
    ToolCall t = new ToolCall("weather", "weather", Map.of(), "t");
    ExecutionOrderPolicy p = QueryCountExecutionOrderPolicy.INSTANCE;

    assertEquals(ExecutionOrder.PARALLEL, p.decide(QueryPlan.empty()));
    assertEquals(ExecutionOrder.PARALLEL, p.decide(QueryPlan.of(a).withToolCalls(List.of(t))));
    assertEquals(ExecutionOrder.SEQUENTIAL, p.decide(QueryPlan.of(a, b)));
  }
}
