package io.intellixity.federa.orchestration.resolve;

import io.intellixity.federa.jdbc.JdbcSourceExecutor;
import io.intellixity.federa.jdbc.JdbcSourceHandle;
import io.intellixity.federa.spi.exec.SourceExecutor;
import io.intellixity.federa.spi.exec.SourceHandle;
import io.intellixity.federa.tool.ToolCallExecutor;
import io.intellixity.federa.tool.ToolSourceHandle;

/** Builds the relational or tool executor matching the handle type. */
public final class DefaultSourceExecutorFactory implements SourceExecutorFactory {
  public static final DefaultSourceExecutorFactory INSTANCE = new DefaultSourceExecutorFactory();

  @Override
  public SourceExecutor<?, ?> create(SourceHandle<?> handle) {
    if (handle instanceof JdbcSourceHandle h) return new JdbcSourceExecutor(h);
    if (handle instanceof ToolSourceHandle h) return new ToolCallExecutor(h);
    throw new IllegalArgumentException("No executor for handle type " + handle.getClass().getName());
  }
}
