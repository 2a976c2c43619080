package io.intellixity.federa.jdbc.scratch;

import io.intellixity.federa.exec.CombinationQueryException;
import io.intellixity.federa.exec.InvalidIdentifierException;
import io.intellixity.federa.exec.NoColumnsException;
import io.intellixity.federa.exec.ScratchStoreException;
import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.schema.ColumnType;
import io.intellixity.federa.schema.SchemaInference;
import io.intellixity.federa.schema.ScratchTable;
import io.intellixity.federa.sql.Identifiers;
import io.intellixity.federa.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ScratchStoreTest {
  @TempDir Path dir;
  private ScratchStore store;

  @BeforeEach
  void setUp() {
    store = new ScratchStore(dir.resolve("scratch").resolve("federa-test.db"));
  }

  private static TabularResult people() {
    return TabularResult.ofRows(List.of("id", "name", "active", "score", "note"), List.of(
        Arrays.asList(1, "Ada", true, 9.5d, null),
        Arrays.asList(2, "Linus", false, null, null),
        Arrays.asList(3, "O'Neil", null, 7.25d, null)));
  }

  @Test
  void materializeThenSelectReturnsTheSameRows() {
    TabularResult original = people();
    ScratchTable t = store.materialize("temp_people", "people", original);

    assertEquals(3, t.rowCount());
    assertEquals(ColumnType.BOOLEAN, t.schema().typeOf("active"));
    assertEquals(ColumnType.FLOAT, t.schema().typeOf("score"));
    assertEquals(ColumnType.TEXT, t.schema().typeOf("note"));

    TabularResult back = store.query("SELECT * FROM temp_people");
    assertEquals(original.columns(), back.columns());
    assertEquals(new HashSet<>(original.rows()), new HashSet<>(back.rows()));
  }

  @Test
  void mixedNumericColumnReadsBackAsItsInferredType() {
    TabularResult mixed = TabularResult.ofRows(List.of("p", "label", "flag"), List.of(
        Arrays.asList(1.5d, "a", true),
        Arrays.asList(2, 7, 0),
        Arrays.asList(null, 2.5d, 3)));
    ScratchTable t = store.materialize("temp_nums", "nums", mixed);
    assertEquals(ColumnType.FLOAT, t.schema().typeOf("p"));

    TabularResult back = store.query("SELECT * FROM temp_nums");
    TabularResult expected = SchemaInference.conform(mixed);
    assertEquals(expected.rows(), back.rows());
    assertEquals(Value.of(2.0d), back.rows().get(1).get("p"));
    assertEquals(Value.of("7"), back.rows().get(1).get("label"));
    assertEquals(Value.of(false), back.rows().get(1).get("flag"));
    assertEquals(Value.of(true), back.rows().get(2).get("flag"));
  }

  @Test
  void emptyResultCreatesQueryableAllTextTable() {
    ScratchTable t = store.materialize("temp_none", "none", TabularResult.empty(List.of("a", "b")));
    assertEquals(0, t.rowCount());
    assertEquals(Map.of("a", ColumnType.TEXT, "b", ColumnType.TEXT), t.schema().columns());

    TabularResult back = store.query("SELECT * FROM temp_none");
    assertEquals(List.of("a", "b"), back.columns());
    assertTrue(back.isEmpty());
    assertEquals(Map.of("a", ColumnType.TEXT, "b", ColumnType.TEXT), store.describe("temp_none").orElseThrow().schema().columns());
  }

  @Test
  void columnlessResultIsRejected() {
    assertThrows(NoColumnsException.class, () -> store.materialize("temp_x", "x", TabularResult.empty()));
  }

  @Test
  void createTableReplacesExistingTable() {
    store.materialize("temp_a", "a", people());
    store.materialize("temp_a", "a", TabularResult.ofRows(List.of("only"), List.of(List.of("x"))));
    TabularResult back = store.query("SELECT * FROM temp_a");
    assertEquals(List.of("only"), back.columns());
    assertEquals(1, back.rowCount());
  }

  @Test
  void unsafeTableNamesNeverReachSql() {
    assertThrows(InvalidIdentifierException.class, () -> store.materialize("temp_a; DROP TABLE x", "a", people()));
  }

  @Test
  void combinationQueryJoinsMaterializedTables() {
    store.materialize("temp_people", "people", people());
    store.materialize("temp_orders", "orders",
        TabularResult.ofRows(List.of("person_id", "total"), List.of(List.of(1, 30), List.of(1, 12), List.of(3, 5))));

    TabularResult r = store.query(
        "SELECT p.name, SUM(o.total) AS total FROM temp_people p JOIN temp_orders o ON o.person_id = p.id "
            + "GROUP BY p.name ORDER BY p.name");
    assertEquals(List.of("name", "total"), r.columns());
    assertEquals(Value.of("Ada"), r.rows().get(0).get("name"));
    assertEquals(Value.of(42L), r.rows().get(0).get("total"));
  }

  @Test
  void combinationQueryCannotWrite() {
    store.materialize("temp_people", "people", people());
    assertThrows(CombinationQueryException.class, () -> store.query("DELETE FROM temp_people"));
    assertEquals(3, store.describe("temp_people").orElseThrow().rowCount());
  }

  @Test
  void cleanupDeletesFileAndLaterQueriesFail() {
    store.materialize("temp_people", "people", people());
    assertTrue(Files.exists(store.file()));

    store.dropAll();

    assertFalse(Files.exists(store.file()));
    assertThrows(CombinationQueryException.class, () -> store.query("SELECT * FROM temp_people"));
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void aliasViewReadsTheTableAndIsDroppedSeparately() {
    store.materialize("temp_people", "people", people());
    store.createAliasView("people", "temp_people");
    store.createAliasView("people", "temp_people");

    assertEquals(3, store.query("SELECT * FROM people").rowCount());
    assertEquals(List.of("temp_people"), store.tableNames());

    assertTrue(store.dropView("people"));
    assertFalse(store.dropView("people"));
    assertFalse(store.dropView("temp_people"));
    assertTrue(store.exists("temp_people"));
  }

  @Test
  void aliasViewNeverShadowsATable() {
    store.materialize("temp_people", "people", people());
    store.materialize("people", "people", people());
    assertThrows(ScratchStoreException.class, () -> store.createAliasView("people", "temp_people"));
  }

  @Test
  void pagesThroughATable() {
    store.materialize("temp_people", "people", people());
    assertEquals(2, store.queryTable("temp_people", 2, 0).rowCount());
    TabularResult tail = store.queryTable("temp_people", null, 2);
    assertEquals(1, tail.rowCount());
    assertEquals(Value.of(3L), tail.rows().get(0).get("id"));
  }

  @Test
  void dropsOnlyTheSessionsOwnTables() {
    TabularResult r = TabularResult.ofRows(List.of("id"), List.of(List.of(1)));
    store.materialize(Identifiers.sessionTableName("abc-123", 1), "s", r);
    store.materialize(Identifiers.sessionTableName("abc-123", 2), "s", r);
    store.materialize(Identifiers.sessionTableName("abc-1234", 1), "s", r);
    store.materialize("temp_a", "a", r);

    assertEquals(2, store.dropBySessionPrefix("abc-123"));
    assertEquals(List.of("session_abc_1234_interaction_1", "temp_a"), store.tableNames());
    assertTrue(store.describe("session_abc_123_interaction_1").isEmpty());
  }
}
