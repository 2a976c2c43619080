package io.intellixity.federa.exec;

/** Base type of every error raised by the federation engine. */
public class FederationException extends RuntimeException {
  public FederationException(String message) {
    super(message);
  }

  public FederationException(String message, Throwable cause) {
    super(message, cause);
  }
}
