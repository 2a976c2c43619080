package io.intellixity.federa.tool;

import io.intellixity.federa.plan.SourceKind;
import io.intellixity.federa.spi.exec.SourceHandle;
import io.intellixity.federa.spi.tool.ToolClient;

import java.util.Objects;

/** Remote tool source handle (resolved by application code). */
public final class ToolSourceHandle implements SourceHandle<ToolClient> {
  private final String id;
  private final ToolClient client;

  public ToolSourceHandle(String id, ToolClient client) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override public String id() { return id; }
  @Override public ToolClient client() { return client; }
  @Override public SourceKind kind() { return SourceKind.TOOL; }

  @Override
  public void close() {
    try {
      client.close();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close tool client of " + id, e);
    }
  }
}
