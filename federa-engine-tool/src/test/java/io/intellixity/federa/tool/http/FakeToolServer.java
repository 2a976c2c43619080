package io.intellixity.federa.tool.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/** In-process JSON-RPC endpoint; the handler maps a request envelope to a response envelope. */
public final class FakeToolServer implements AutoCloseable {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final HttpServer server;
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final List<String> authHeaders = new CopyOnWriteArrayList<>();
  private final List<JsonNode> requests = new CopyOnWriteArrayList<>();

  public FakeToolServer(Function<JsonNode, JsonNode> handler) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/rpc", exchange -> {
      JsonNode req = JSON.readTree(exchange.getRequestBody());
      requests.add(req);
      String auth = exchange.getRequestHeaders().getFirst("Authorization");
      authHeaders.add(auth == null ? "" : auth);
      byte[] body = JSON.writeValueAsBytes(handler.apply(req));
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(body);
      }
    });
    server.setExecutor(executor);
    server.start();
  }

  /** Serve {@code rows} (JSON text) as the text content of every tools/call. */
  public static FakeToolServer returningText(String rowsJson) throws IOException {
    return new FakeToolServer(req -> result(req, textContent(rowsJson)));
  }

  public static ObjectNode textContent(String text) {
    ObjectNode r = JSON.createObjectNode();
    ObjectNode item = r.putArray("content").addObject();
    item.put("type", "text");
    item.put("text", text);
    return r;
  }

  public static ObjectNode result(JsonNode req, JsonNode result) {
    ObjectNode env = JSON.createObjectNode();
    env.put("jsonrpc", "2.0");
    env.set("id", req.get("id"));
    env.set("result", result);
    return env;
  }

  public URI uri() {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/rpc");
  }

  public List<String> authHeaders() { return authHeaders; }
  public List<JsonNode> requests() { return requests; }

  @Override
  public void close() {
    server.stop(0);
    executor.shutdownNow();
  }
}
