package io.intellixity.federa.orchestration.resolve;

import io.intellixity.federa.plan.SourceKind;
import io.intellixity.federa.spi.exec.SourceHandle;

/**
 * Application-implemented resolver that maps (sourceId, kind) to a {@link SourceHandle}.\n
 *
 * Returning null means the source is unknown. Resolved handles are cached by
 * {@link SourceExecutorResolver}, so this is only called on a cache miss.\n
 */
@FunctionalInterface
public interface SourceHandleResolver {
  SourceHandle<?> resolve(String sourceId, SourceKind kind);
}
