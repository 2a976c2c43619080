package io.intellixity.federa.jdbc.scratch;

import io.intellixity.federa.exec.CombinationQueryException;
import io.intellixity.federa.exec.NoColumnsException;
import io.intellixity.federa.exec.ScratchStoreException;
import io.intellixity.federa.jdbc.JdbcResults;
import io.intellixity.federa.jdbc.JdbcSourceHandle;
import io.intellixity.federa.jdbc.JdbcValues;
import io.intellixity.federa.plan.RelationalSubQuery;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.ColumnType;
import io.intellixity.federa.schema.InferredSchema;
import io.intellixity.federa.schema.SchemaInference;
import io.intellixity.federa.schema.ScratchTable;
import io.intellixity.federa.sql.Identifiers;
import io.intellixity.federa.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * One on-disk SQLite scratch database.\n
 *
 * Tables are created from inferred schemas and bulk-loaded with parameterized inserts; table names
 * must pass {@link Identifiers#requireSafe}, column names are always quoted. Mutations are
 * serialized on an internal lock. {@link #dropAll()} deletes the backing file.\n
 */
public final class ScratchStore {
  private static final Logger log = LoggerFactory.getLogger(ScratchStore.class);

  private final Path file;
  private final SQLiteDataSource ds;
  private final ReentrantLock lock = new ReentrantLock();

  public ScratchStore(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    try {
      Path parent = this.file.getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new ScratchStoreException("Cannot create scratch directory for " + this.file, e);
    }
    this.ds = new SQLiteDataSource();
    this.ds.setUrl("jdbc:sqlite:" + this.file);
  }

  public Path file() { return file; }

  public DataSource dataSource() { return ds; }

  /** Handle that lets relational sub-queries read this store like any other source. */
  public JdbcSourceHandle sourceHandle() {
    return new JdbcSourceHandle(RelationalSubQuery.SCRATCH_SOURCE_ID, ds);
  }

  /** Drop any table named {@code name}, then create it with the columns of {@code schema}. */
  public void createTable(String name, InferredSchema schema) {
    Identifiers.requireSafe("table name", name);
    Objects.requireNonNull(schema, "schema");
    if (schema.isEmpty()) throw new NoColumnsException(name);

    String cols = schema.columns().entrySet().stream()
        .map(e -> Identifiers.quote(e.getKey()) + " " + e.getValue().sqlType())
        .collect(Collectors.joining(", "));
    String ddl = "CREATE TABLE " + Identifiers.quote(name) + " (" + cols + ")";

    lock.lock();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.executeUpdate("DROP TABLE IF EXISTS " + Identifiers.quote(name));
      if (log.isDebugEnabled()) log.debug("federa.scratch op=CREATE file={} sql={}", file, ddl);
      st.executeUpdate(ddl);
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to create scratch table " + name + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Insert every row of {@code result} into an existing table in one batched transaction.\n
   *
   * A no-op for an empty result. Returns the number of rows loaded.\n
   */
  public long bulkLoad(String name, TabularResult result) {
    Identifiers.requireSafe("table name", name);
    Objects.requireNonNull(result, "result");
    if (result.isEmpty()) return 0;

    List<String> cols = result.columns();
    String sql = "INSERT INTO " + Identifiers.quote(name)
        + " (" + cols.stream().map(Identifiers::quote).collect(Collectors.joining(", ")) + ")"
        + " VALUES (" + cols.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

    long start = System.nanoTime();
    lock.lock();
    try (Connection c = ds.getConnection()) {
      c.setAutoCommit(false);
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        traceBinds(result.rows().get(0));
        for (Map<String, Value> row : result.rows()) {
          int idx = 1;
          for (String col : cols) JdbcValues.bind(ps, idx++, row.get(col));
          ps.addBatch();
        }
        ps.executeBatch();
        c.commit();
      } catch (SQLException e) {
        c.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to load scratch table " + name + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
    if (log.isDebugEnabled()) {
      log.debug("federa.scratch_done op=LOAD table={} rows={} durationMs={}",
          name, result.rowCount(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return result.rowCount();
  }

  /**
   * Infer, create and load {@code tableName} from {@code result}.\n
   *
   * Cells are first coerced to their column's inferred type ({@link SchemaInference#conform}), so
   * reading the table back yields the same rows as {@code SchemaInference.conform(result)}.\n
   */
  public ScratchTable materialize(String tableName, String sourceAlias, TabularResult result) {
    Objects.requireNonNull(result, "result");
    InferredSchema schema = SchemaInference.infer(result);
    TabularResult rows = SchemaInference.conform(result, schema);
    lock.lock();
    try {
      createTable(tableName, schema);
      long loaded = bulkLoad(tableName, rows);
      if (loaded == 0) log.warn("federa.scratch empty result materialized as empty table={}", tableName);
      log.info("federa.scratch materialized table={} alias={} columns={} rows={}",
          tableName, sourceAlias, schema.size(), loaded);
      return new ScratchTable(tableName, schema, sourceAlias, loaded);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Run a caller-supplied read statement.\n
   *
   * The statement must pass {@link CombinationQueryGuard} and runs on a query-only connection;
   * rejection and execution failures both raise {@link CombinationQueryException}.\n
   */
  public TabularResult query(String sql) {
    String stmt = CombinationQueryGuard.check(sql);
    // Opening a connection would silently recreate a dropped store as an empty file.
    if (!Files.exists(file)) throw new CombinationQueryException(sql, "Scratch store " + file + " does not exist");
    long start = System.nanoTime();
    if (log.isDebugEnabled()) log.debug("federa.scratch op=QUERY file={} sql={}", file, stmt);
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("PRAGMA query_only = 1");
      try (ResultSet rs = st.executeQuery(stmt)) {
        TabularResult out = JdbcResults.read(rs);
        if (log.isDebugEnabled()) {
          log.debug("federa.scratch_done op=QUERY rows={} durationMs={}",
              out.rowCount(), (System.nanoTime() - start) / 1_000_000.0);
        }
        return out;
      }
    } catch (SQLException e) {
      throw new CombinationQueryException(sql, e);
    }
  }

  /** Page through one table; a null {@code limit} returns every row from {@code offset}. */
  public TabularResult queryTable(String table, Integer limit, int offset) {
    Identifiers.requireSafe("table name", table);
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    String sql = "SELECT * FROM " + Identifiers.quote(table) + " LIMIT ? OFFSET ?";
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, limit == null ? -1 : limit);
      ps.setLong(2, offset);
      try (ResultSet rs = ps.executeQuery()) {
        return JdbcResults.read(rs);
      }
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to read scratch table " + table + ": " + e.getMessage(), e);
    }
  }

  public List<String> tableNames() {
    if (!Files.exists(file)) return List.of();
    String sql = "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' ORDER BY name";
    List<String> out = new ArrayList<>();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
      while (rs.next()) out.add(rs.getString(1));
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to list scratch tables: " + e.getMessage(), e);
    }
    return out;
  }

  public boolean exists(String table) {
    return tableNames().contains(table);
  }

  /** Declared column types and row count of {@code table}; empty if there is no such table. */
  public Optional<ScratchTable> describe(String table) {
    Identifiers.requireSafe("table name", table);
    if (!exists(table)) return Optional.empty();
    Map<String, ColumnType> cols = new LinkedHashMap<>();
    long count;
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      try (ResultSet rs = st.executeQuery("PRAGMA table_info(" + Identifiers.quote(table) + ")")) {
        while (rs.next()) cols.put(rs.getString("name"), ColumnType.fromSqlType(rs.getString("type")));
      }
      try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + Identifiers.quote(table))) {
        count = rs.next() ? rs.getLong(1) : 0;
      }
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to describe scratch table " + table + ": " + e.getMessage(), e);
    }
    return Optional.of(new ScratchTable(table, InferredSchema.of(cols), table, count));
  }

  /** Returns true if a table was dropped. */
  public boolean dropTable(String table) {
    Identifiers.requireSafe("table name", table);
    lock.lock();
    try {
      if (!exists(table)) return false;
      try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
        st.executeUpdate("DROP TABLE IF EXISTS " + Identifiers.quote(table));
      }
      log.info("federa.scratch dropped table={}", table);
      return true;
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to drop scratch table " + table + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Make {@code table} readable under {@code viewName} as well, replacing an earlier view of that
   * name. Refuses to shadow an existing table.\n
   */
  public void createAliasView(String viewName, String table) {
    Identifiers.requireSafe("view name", viewName);
    Identifiers.requireSafe("table name", table);
    String ddl = "CREATE VIEW " + Identifiers.quote(viewName) + " AS SELECT * FROM " + Identifiers.quote(table);
    lock.lock();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      String existing = objectType(c, viewName);
      if ("table".equals(existing)) {
        throw new ScratchStoreException("Cannot create view " + viewName + ": a table with that name exists", null);
      }
      if (existing != null) st.executeUpdate("DROP VIEW " + Identifiers.quote(viewName));
      if (log.isDebugEnabled()) log.debug("federa.scratch op=CREATE file={} sql={}", file, ddl);
      st.executeUpdate(ddl);
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to create scratch view " + viewName + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /** Returns true if a view was dropped; tables of the same name are left alone. */
  public boolean dropView(String viewName) {
    Identifiers.requireSafe("view name", viewName);
    if (!Files.exists(file)) return false;
    lock.lock();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      if (!"view".equals(objectType(c, viewName))) return false;
      st.executeUpdate("DROP VIEW " + Identifiers.quote(viewName));
      log.info("federa.scratch dropped view={}", viewName);
      return true;
    } catch (SQLException e) {
      throw new ScratchStoreException("Failed to drop scratch view " + viewName + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /** Drop only the tables of {@code sessionId}; returns how many were dropped. */
  public int dropBySessionPrefix(String sessionId) {
    lock.lock();
    try {
      int n = 0;
      for (String t : tableNames()) {
        if (Identifiers.isSessionTableOf(t, sessionId) && dropTable(t)) n++;
      }
      return n;
    } finally {
      lock.unlock();
    }
  }

  /** Full reset: delete the backing file (and any SQLite side files). */
  public void dropAll() {
    lock.lock();
    try {
      boolean deleted = Files.deleteIfExists(file);
      for (String suffix : List.of("-journal", "-wal", "-shm")) {
        Files.deleteIfExists(file.resolveSibling(file.getFileName() + suffix));
      }
      log.info("federa.scratch reset file={} deleted={}", file, deleted);
    } catch (IOException e) {
      throw new ScratchStoreException("Failed to delete scratch file " + file, e);
    } finally {
      lock.unlock();
    }
  }

  private static String objectType(Connection c, String name) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement("SELECT type FROM sqlite_master WHERE name = ?")) {
      ps.setString(1, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getString(1) : null;
      }
    }
  }

  private static void traceBinds(Map<String, Value> sample) {
    // Type and length only; raw row values never reach the log.
    if (!log.isTraceEnabled()) return;
    int idx = 1;
    for (var e : sample.entrySet()) {
      Object raw = e.getValue().raw();
      int len = raw instanceof CharSequence cs ? cs.length() : -1;
      log.trace("federa.scratch bind index={} column={} valueType={} valueLen={}",
          idx++, e.getKey(), e.getValue().type(), len);
    }
  }
}
