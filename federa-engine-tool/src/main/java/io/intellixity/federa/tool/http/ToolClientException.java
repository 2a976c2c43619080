package io.intellixity.federa.tool.http;

/** Transport or protocol failure talking to a remote tool endpoint. */
public final class ToolClientException extends RuntimeException {
  public ToolClientException(String message) {
    super(message);
  }

  public ToolClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
