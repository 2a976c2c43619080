package io.intellixity.federa.spi.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Transport to a remote tool source.\n
 *
 * Implementations return the tool's raw structured response; tabular validation is the executor's job.\n
 */
public interface ToolClient extends AutoCloseable {
  JsonNode callTool(String toolName, Map<String, Object> parameters);

  List<ToolDescriptor> listTools();

  @Override
  default void close() {}
}
