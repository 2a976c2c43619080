package io.intellixity.federa.orchestration.resolve;

import io.intellixity.federa.spi.exec.SourceExecutor;
import io.intellixity.federa.spi.exec.SourceHandle;

@FunctionalInterface
public interface SourceExecutorFactory {
  SourceExecutor<?, ?> create(SourceHandle<?> handle);
}
