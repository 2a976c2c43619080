package io.intellixity.federa.exec;

/** An alias, session id or table name is outside the identifier allow-list. */
public final class InvalidIdentifierException extends FederationException {
  public InvalidIdentifierException(String kind, String value) {
    super("Invalid " + kind + ": '" + value + "' (allowed: letter or '_' followed by letters, digits, '_'; max 64 chars)");
  }
}
