package io.intellixity.federa.tool.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.intellixity.federa.spi.tool.ToolClient;
import io.intellixity.federa.spi.tool.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tool client speaking JSON-RPC 2.0 over HTTP POST ({@code tools/call}, {@code tools/list}).\n
 *
 * The tool's payload is taken from the call result in this order:\n
 * - {@code structuredContent} (an object with exactly one array field is unwrapped to that array)\n
 * - the first {@code content} item of type text, parsed as JSON (kept as a string if it is not JSON)\n
 * - the result itself\n
 *
 * A result flagged {@code isError} and a JSON-RPC {@code error} both raise {@link ToolClientException}.\n
 */
public final class HttpJsonRpcToolClient implements ToolClient {
  private static final Logger log = LoggerFactory.getLogger(HttpJsonRpcToolClient.class);

  private final URI endpoint;
  private final String bearerToken;
  private final Duration timeout;
  private final ObjectMapper json;
  private final HttpClient http;
  private final AtomicLong ids = new AtomicLong();

  public HttpJsonRpcToolClient(URI endpoint, String bearerToken, Duration timeout, ObjectMapper json) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.bearerToken = (bearerToken == null || bearerToken.isBlank()) ? null : bearerToken;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.json = Objects.requireNonNull(json, "json");
    this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  public HttpJsonRpcToolClient(URI endpoint, String bearerToken, Duration timeout) {
    this(endpoint, bearerToken, timeout, new ObjectMapper());
  }

  public URI endpoint() { return endpoint; }

  @Override
  public JsonNode callTool(String toolName, Map<String, Object> parameters) {
    Objects.requireNonNull(toolName, "toolName");
    ObjectNode params = json.createObjectNode();
    params.put("name", toolName);
    params.set("arguments", json.valueToTree(parameters == null ? Map.of() : parameters));

    JsonNode result = rpc("tools/call", params);
    if (result.path("isError").asBoolean(false)) {
      throw new ToolClientException("Tool " + toolName + " reported an error: " + firstText(result));
    }
    return payloadOf(result);
  }

  @Override
  public List<ToolDescriptor> listTools() {
    JsonNode result = rpc("tools/list", json.createObjectNode());
    List<ToolDescriptor> out = new ArrayList<>();
    for (JsonNode t : result.path("tools")) {
      out.add(new ToolDescriptor(t.path("name").asText(), t.path("description").asText(""), t.get("inputSchema")));
    }
    return out;
  }

  private JsonNode rpc(String method, ObjectNode params) {
    long id = ids.incrementAndGet();
    ObjectNode body = json.createObjectNode();
    body.put("jsonrpc", "2.0");
    body.put("id", id);
    body.put("method", method);
    body.set("params", params);

    HttpRequest.Builder req = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
    if (bearerToken != null) req.header("Authorization", "Bearer " + bearerToken);

    long start = System.nanoTime();
    HttpResponse<String> resp;
    try {
      resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ToolClientException(method + " to " + endpoint + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ToolClientException(method + " to " + endpoint + " interrupted", e);
    }
    if (log.isDebugEnabled()) {
      log.debug("federa.tool_done op={} endpoint={} status={} durationMs={} bodyLen={}",
          method, endpoint, resp.statusCode(), (System.nanoTime() - start) / 1_000_000.0, resp.body().length());
    }
    if (resp.statusCode() / 100 != 2) {
      throw new ToolClientException(method + " to " + endpoint + " returned HTTP " + resp.statusCode());
    }

    JsonNode envelope;
    try {
      envelope = json.readTree(resp.body());
    } catch (JsonProcessingException e) {
      throw new ToolClientException(method + " to " + endpoint + " returned invalid JSON", e);
    }
    JsonNode error = envelope.get("error");
    if (error != null && !error.isNull()) {
      throw new ToolClientException(method + " failed: " + error.path("message").asText(error.toString())
          + " (code " + error.path("code").asText("?") + ")");
    }
    JsonNode result = envelope.get("result");
    if (result == null) throw new ToolClientException(method + " to " + endpoint + " returned no result");
    return result;
  }

  private JsonNode payloadOf(JsonNode result) {
    JsonNode structured = result.get("structuredContent");
    if (structured != null && !structured.isNull()) {
      if (structured.isObject() && structured.size() == 1) {
        JsonNode only = structured.elements().next();
        if (only.isArray()) return only;
      }
      return structured;
    }
    JsonNode content = result.get("content");
    if (content != null && content.isArray()) {
      for (JsonNode item : content) {
        if (!"text".equals(item.path("type").asText())) continue;
        String text = item.path("text").asText();
        try {
          return json.readTree(text);
        } catch (JsonProcessingException notJson) {
          // Plain-text tool output; the tabular check rejects it downstream.
          return TextNode.valueOf(text);
        }
      }
    }
    return result;
  }

  private static String firstText(JsonNode result) {
    Iterator<JsonNode> it = result.path("content").elements();
    while (it.hasNext()) {
      JsonNode item = it.next();
      if (item.has("text")) return item.get("text").asText();
    }
    return result.toString();
  }
}
