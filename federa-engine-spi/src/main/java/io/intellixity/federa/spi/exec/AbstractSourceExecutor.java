package io.intellixity.federa.spi.exec;

import io.intellixity.federa.exec.FederationException;
import io.intellixity.federa.exec.SourceExecutionException;
import io.intellixity.federa.plan.SubQuery;
import io.intellixity.federa.result.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Template-method base for source executors.\n
 *
 * Responsibilities:\n
 * - check the sub-query targets this executor's source\n
 * - time and log each execution\n
 * - wrap driver/transport failures into {@link SourceExecutionException}\n
 */
public abstract class AbstractSourceExecutor<Q extends SubQuery, H extends SourceHandle<?>> implements SourceExecutor<Q, H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractSourceExecutor.class);

  private final H handle;

  protected AbstractSourceExecutor(H handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public final H handle() {
    return handle;
  }

  @Override
  public final TabularResult execute(Q query) {
    Objects.requireNonNull(query, "query");
    if (query.kind() != handle.kind()) {
      throw new IllegalArgumentException("Cannot run " + query.kind() + " sub-query on " + handle.kind() + " source " + handle.id());
    }
    long start = System.nanoTime();
    try {
      TabularResult out = doExecute(query);
      if (log.isDebugEnabled()) {
        log.debug("federa.source_done kind={} source={} alias={} durationMs={} rows={} columns={}",
            handle.kind(), handle.id(), query.resultAlias(), (System.nanoTime() - start) / 1_000_000.0,
            out.rowCount(), out.columns().size());
      }
      return out;
    } catch (FederationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("federa.source_failed kind={} source={} alias={} error={}",
          handle.kind(), handle.id(), query.resultAlias(), e.toString());
      throw new SourceExecutionException(query.sourceId(), query.resultAlias(), unwrap(e));
    }
  }

  /** Backend-specific execution; may throw any runtime exception. */
  protected abstract TabularResult doExecute(Q query);

  private static Throwable unwrap(RuntimeException e) {
    // Backends wrap checked driver errors in bare RuntimeExceptions; report the driver error itself.
    if (e.getClass() == RuntimeException.class && e.getCause() != null) return e.getCause();
    return e;
  }
}
