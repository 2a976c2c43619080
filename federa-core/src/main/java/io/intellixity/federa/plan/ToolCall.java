package io.intellixity.federa.plan;

import io.intellixity.federa.exec.PlanValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Named tool invocation against a remote tool source. */
public record ToolCall(String sourceId, String toolName, Map<String, Object> parameters, String resultAlias)
    implements SubQuery {
  public ToolCall {
    if (sourceId == null || sourceId.isBlank()) throw new PlanValidationException("Tool call without sourceId");
    if (toolName == null || toolName.isBlank()) {
      throw new PlanValidationException("Tool call '" + resultAlias + "' has no tool name");
    }
    SubQuery.requireValidAlias(resultAlias);
    // Parameter values may be null (JSON null), so Map.copyOf is not an option.
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters == null ? Map.of() : parameters));
  }

  @Override
  public SourceKind kind() {
    return SourceKind.TOOL;
  }
}
