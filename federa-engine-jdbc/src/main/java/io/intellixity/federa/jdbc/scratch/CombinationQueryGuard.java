package io.intellixity.federa.jdbc.scratch;

import io.intellixity.federa.exec.CombinationQueryException;
import io.intellixity.federa.jdbc.SqlScripts;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Admission check for caller-supplied combination SQL.\n
 *
 * Accepted: exactly one statement, starting with SELECT or WITH, with none of the keywords below
 * outside string literals, quoted identifiers and comments. A keyword directly followed by
 * {@code (} is a function call (e.g. {@code replace(x, 'a', 'b')}) and is allowed.\n
 *
 * The store additionally runs admitted statements on a {@code PRAGMA query_only} connection.\n
 */
public final class CombinationQueryGuard {
  private static final Set<String> FORBIDDEN = Set.of(
      "ATTACH", "DETACH", "PRAGMA", "INSERT", "UPDATE", "DELETE", "REPLACE", "UPSERT",
      "CREATE", "DROP", "ALTER", "TRUNCATE", "VACUUM", "REINDEX");

  private static final Pattern WORD = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(\\s*\\()?");
  private static final Pattern LITERALS = Pattern.compile(
      "'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|`[^`]*`|\\[[^\\]]*]|--[^\\n]*|(?s:/\\*.*?\\*/)");

  private CombinationQueryGuard() {}

  /** Returns the trimmed statement, or throws {@link CombinationQueryException}. */
  public static String check(String sql) {
    if (sql == null || sql.isBlank()) throw new CombinationQueryException(sql, "Combination query is empty");
    var statements = SqlScripts.split(sql);
    if (statements.size() != 1) {
      throw new CombinationQueryException(sql, "Combination query must be a single statement, got " + statements.size());
    }
    String stmt = statements.get(0);
    String code = LITERALS.matcher(stmt).replaceAll(" ");

    Matcher m = WORD.matcher(code);
    boolean first = true;
    while (m.find()) {
      String word = m.group(1).toUpperCase(Locale.ROOT);
      if (first) {
        if (!word.equals("SELECT") && !word.equals("WITH")) {
          throw new CombinationQueryException(sql, "Combination query must start with SELECT or WITH, got " + word);
        }
        first = false;
      }
      if (m.group(2) == null && FORBIDDEN.contains(word)) {
        throw new CombinationQueryException(sql, "Combination query must be read-only; found " + word);
      }
    }
    if (first) throw new CombinationQueryException(sql, "Combination query has no statement");
    return stmt;
  }
}
