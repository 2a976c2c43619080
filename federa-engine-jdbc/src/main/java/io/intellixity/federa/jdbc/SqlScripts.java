package io.intellixity.federa.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a statement string on {@code ;} separators.\n
 *
 * Separators inside single/double-quoted text, {@code --} line comments and block comments are
 * ignored. Blank statements are dropped.\n
 */
public final class SqlScripts {
  private SqlScripts() {}

  public static List<String> split(String script) {
    List<String> out = new ArrayList<>();
    if (script == null) return out;

    StringBuilder cur = new StringBuilder();
    int len = script.length();
    int i = 0;
    while (i < len) {
      char c = script.charAt(i);
      if (c == '\'' || c == '"') {
        int end = closingQuote(script, i, c);
        cur.append(script, i, end);
        i = end;
      } else if (c == '-' && i + 1 < len && script.charAt(i + 1) == '-') {
        int end = script.indexOf('\n', i);
        end = end < 0 ? len : end;
        cur.append(script, i, end);
        i = end;
      } else if (c == '/' && i + 1 < len && script.charAt(i + 1) == '*') {
        int end = script.indexOf("*/", i + 2);
        end = end < 0 ? len : end + 2;
        cur.append(script, i, end);
        i = end;
      } else if (c == ';') {
        add(out, cur);
        cur.setLength(0);
        i++;
      } else {
        cur.append(c);
        i++;
      }
    }
    add(out, cur);
    return out;
  }

  /** Index just past the closing quote; a doubled quote is an escaped quote. */
  private static int closingQuote(String s, int open, char q) {
    int i = open + 1;
    while (i < s.length()) {
      if (s.charAt(i) == q) {
        if (i + 1 < s.length() && s.charAt(i + 1) == q) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return s.length();
  }

  private static void add(List<String> out, StringBuilder cur) {
    String stmt = cur.toString().trim();
    if (!stmt.isEmpty() && !isOnlyComments(stmt)) out.add(stmt);
  }

  private static boolean isOnlyComments(String stmt) {
    String s = stmt.replaceAll("(?s)/\\*.*?\\*/", "").replaceAll("--[^\\n]*", "");
    return s.isBlank();
  }
}
