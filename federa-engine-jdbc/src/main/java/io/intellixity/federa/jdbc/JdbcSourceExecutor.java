package io.intellixity.federa.jdbc;

import io.intellixity.federa.plan.RelationalSubQuery;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.spi.exec.AbstractSourceExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational executor.\n
 *
 * Each execution borrows one connection from the handle's data source, runs every statement of the
 * (possibly multi-statement) text in order, and returns the rows of the last statement that
 * produced a result set. If no statement produced one, the result is empty with no columns.\n
 */
public final class JdbcSourceExecutor extends AbstractSourceExecutor<RelationalSubQuery, JdbcSourceHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcSourceExecutor.class);
  private final DataSource ds;

  public JdbcSourceExecutor(JdbcSourceHandle handle) {
    super(handle);
    this.ds = handle.client();
  }

  @Override
  protected TabularResult doExecute(RelationalSubQuery query) {
    List<String> statements = SqlScripts.split(query.statementText());
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      TabularResult last = null;
      for (String sql : statements) {
        long start = System.nanoTime();
        debugSql("QUERY", query.resultAlias(), sql);
        if (st.execute(sql)) {
          try (ResultSet rs = st.getResultSet()) {
            last = JdbcResults.read(rs);
          }
          debugDone("QUERY", last.rowCount(), System.nanoTime() - start);
        } else {
          debugDone("UPDATE", st.getUpdateCount(), System.nanoTime() - start);
        }
      }
      return last == null ? TabularResult.empty() : last;
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void ping() {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("SELECT 1");
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Tables of this source mapped to their column names, both in catalog order.\n
   *
   * Scoped to the handle's schema when it has one.\n
   */
  public Map<String, List<String>> describeSource() {
    String schema = handle().schema();
    Map<String, List<String>> out = new LinkedHashMap<>();
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      try (ResultSet tables = md.getTables(null, schema, "%", new String[]{"TABLE", "VIEW"})) {
        while (tables.next()) out.put(tables.getString("TABLE_NAME"), new ArrayList<>());
      }
      for (var e : out.entrySet()) {
        try (ResultSet cols = md.getColumns(null, schema, e.getKey(), "%")) {
          while (cols.next()) e.getValue().add(cols.getString("COLUMN_NAME"));
        }
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
    out.replaceAll((k, v) -> List.copyOf(v));
    return out;
  }

  private void debugSql(String op, String alias, String sql) {
    if (!log.isDebugEnabled()) return;
    JdbcSourceHandle h = handle();
    log.debug("federa.jdbc op={} source={} schema={} alias={} sql={}", op, h.id(), h.schema(), alias, sql);
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("federa.jdbc_done op={} source={} durationMs={} result={}",
        op, handle().id(), durationNanos / 1_000_000.0, result);
  }
}
