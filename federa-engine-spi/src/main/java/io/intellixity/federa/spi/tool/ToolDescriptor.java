package io.intellixity.federa.spi.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/** Name, description and input schema of a remote tool. */
public record ToolDescriptor(String name, String description, JsonNode inputSchema) {
  public ToolDescriptor {
    Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
    inputSchema = inputSchema == null ? JsonNodeFactory.instance.objectNode() : inputSchema;
  }
}
