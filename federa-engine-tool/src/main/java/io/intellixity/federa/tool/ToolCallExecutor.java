package io.intellixity.federa.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.federa.exec.NonTabularResponseException;
import io.intellixity.federa.plan.ToolCall;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.spi.exec.AbstractSourceExecutor;
import io.intellixity.federa.spi.tool.TabularResponses;
import io.intellixity.federa.spi.tool.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tool-call executor.\n
 *
 * Invokes the named tool and admits the response only if it is tabular (a list of objects sharing
 * one key set); anything else fails with {@link NonTabularResponseException}.\n
 */
public final class ToolCallExecutor extends AbstractSourceExecutor<ToolCall, ToolSourceHandle> {
  private static final Logger log = LoggerFactory.getLogger(ToolCallExecutor.class);

  public ToolCallExecutor(ToolSourceHandle handle) {
    super(handle);
  }

  @Override
  protected TabularResult doExecute(ToolCall call) {
    if (log.isDebugEnabled()) {
      // Parameter names only; values may carry user data.
      log.debug("federa.tool op=CALL source={} tool={} alias={} params={}",
          handle().id(), call.toolName(), call.resultAlias(), call.parameters().keySet());
    }
    JsonNode response = handle().client().callTool(call.toolName(), call.parameters());
    String violation = TabularResponses.violation(response);
    if (violation != null) {
      throw new NonTabularResponseException(call.sourceId(), call.toolName(), violation);
    }
    return JsonValues.toResult(response);
  }

  @Override
  public void ping() {
    listTools();
  }

  public List<ToolDescriptor> listTools() {
    return handle().client().listTools();
  }
}
