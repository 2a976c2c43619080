package io.intellixity.federa.orchestration.session;

import io.intellixity.federa.exec.NoColumnsException;
import io.intellixity.federa.exec.UnknownSessionTableException;
import io.intellixity.federa.jdbc.scratch.ScratchStore;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.InferredSchema;
import io.intellixity.federa.schema.ScratchTable;
import io.intellixity.federa.sql.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Session-scoped tables in a scratch store, named {@code session_<sanitizedId>_interaction_<seq>}.\n
 *
 * Plans can read them back through the {@code __session__} relational source.\n
 */
public final class SessionTableRegistry {
  private static final Logger log = LoggerFactory.getLogger(SessionTableRegistry.class);

  private final ScratchStore store;

  public SessionTableRegistry(ScratchStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /** Persist {@code result} for (sessionId, seq), replacing an existing table; returns its name. */
  public String create(String sessionId, int interactionSeq, TabularResult result) {
    Objects.requireNonNull(result, "result");
    String table = Identifiers.sessionTableName(sessionId, interactionSeq);
    if (!result.hasColumns()) throw new NoColumnsException(table);
    ScratchTable t = store.materialize(table, table, result);
    log.info("federa.session created table={} rows={}", table, t.rowCount());
    return table;
  }

  /** Table names of {@code sessionId}, sorted by name. */
  public List<String> listForSession(String sessionId) {
    return store.tableNames().stream()
        .filter(t -> Identifiers.isSessionTableOf(t, sessionId))
        .sorted()
        .collect(Collectors.toList());
  }

  public InferredSchema schemaOf(String tableName) {
    return describe(tableName).schema();
  }

  /** Declared schema and row count. */
  public ScratchTable describe(String tableName) {
    requireSessionTable(tableName);
    return store.describe(tableName).orElseThrow(() -> new UnknownSessionTableException(tableName));
  }

  /** Rows of a session table from {@code offset}; a null {@code limit} returns all of them. */
  public TabularResult query(String tableName, Integer limit, int offset) {
    requireSessionTable(tableName);
    if (!store.exists(tableName)) throw new UnknownSessionTableException(tableName);
    return store.queryTable(tableName, limit, offset);
  }

  /** Drop every table of {@code sessionId}; returns how many were dropped. */
  public int dropForSession(String sessionId) {
    int n = store.dropBySessionPrefix(sessionId);
    log.info("federa.session dropped session={} tables={}", Identifiers.sanitizeSessionId(sessionId), n);
    return n;
  }

  private static void requireSessionTable(String tableName) {
    if (!Identifiers.isSessionTable(tableName)) throw new UnknownSessionTableException(tableName);
  }
}
