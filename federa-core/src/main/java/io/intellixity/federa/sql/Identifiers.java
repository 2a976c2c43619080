package io.intellixity.federa.sql;

import io.intellixity.federa.exec.InvalidIdentifierException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier allow-list and naming rules for every engine-generated SQL identifier.\n
 *
 * Aliases and table names are interpolated into SQL text, so they must match
 * {@code [A-Za-z_][A-Za-z0-9_]*} (max 64 chars) before use. Column names coming from sources are
 * never allow-listed; they are always double-quoted via {@link #quote(String)}.\n
 */
public final class Identifiers {
  public static final int MAX_LENGTH = 64;
  /** Prefix of tables materialized from plan aliases. */
  public static final String SCRATCH_PREFIX = "temp_";
  public static final String SESSION_PREFIX = "session_";
  public static final String INTERACTION_INFIX = "_interaction_";

  private static final Pattern SAFE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]");

  private Identifiers() {}

  public static boolean isSafe(String identifier) {
    return identifier != null
        && identifier.length() <= MAX_LENGTH
        && SAFE.matcher(identifier).matches();
  }

  /** Return {@code identifier} unchanged if it is on the allow-list, else throw. */
  public static String requireSafe(String kind, String identifier) {
    if (!isSafe(identifier)) throw new InvalidIdentifierException(kind, identifier);
    return identifier;
  }

  /** Scratch table name for a plan alias: {@code temp_<alias>}. */
  public static String scratchTableName(String alias) {
    return requireSafe("table name", SCRATCH_PREFIX + requireSafe("result alias", alias));
  }

  /** Replace every non-alphanumeric character of a session id with {@code _}. */
  public static String sanitizeSessionId(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    if (sessionId.isBlank()) throw new InvalidIdentifierException("session id", sessionId);
    return NON_ALNUM.matcher(sessionId).replaceAll("_");
  }

  /** {@code session_<sanitized>_interaction_<seq>} */
  public static String sessionTableName(String sessionId, int interactionSeq) {
    if (interactionSeq < 0) throw new IllegalArgumentException("interactionSeq must be >= 0");
    return requireSafe("session table name", sessionTablePrefix(sessionId) + interactionSeq);
  }

  /** {@code session_<sanitized>_interaction_}; every table of the session starts with it. */
  public static String sessionTablePrefix(String sessionId) {
    return SESSION_PREFIX + sanitizeSessionId(sessionId) + INTERACTION_INFIX;
  }

  /**
   * True if {@code tableName} is a session table of {@code sessionId}.\n
   *
   * The remainder after the prefix must be all digits, so session {@code a} never claims tables of
   * session {@code a_interaction_1}.\n
   */
  public static boolean isSessionTableOf(String tableName, String sessionId) {
    if (tableName == null) return false;
    String prefix = sessionTablePrefix(sessionId);
    if (!tableName.startsWith(prefix) || tableName.length() == prefix.length()) return false;
    for (int i = prefix.length(); i < tableName.length(); i++) {
      if (!Character.isDigit(tableName.charAt(i))) return false;
    }
    return true;
  }

  public static boolean isSessionTable(String tableName) {
    return isSafe(tableName) && tableName.startsWith(SESSION_PREFIX) && tableName.contains(INTERACTION_INFIX);
  }

  /** Double-quote a column or table identifier, doubling embedded quotes. */
  public static String quote(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
