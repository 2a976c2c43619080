package io.intellixity.federa.schema;

import io.intellixity.federa.result.TabularResult;
import io.intellixity.federa.value.Value;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaInferenceTest {

  @Test
  void booleansStayBoolean_notInteger() {
    TabularResult r = TabularResult.ofRows(List.of("flag"), List.of(List.of(true), List.of(false)));
    assertEquals(ColumnType.BOOLEAN, SchemaInference.infer(r).typeOf("flag"));
  }

  @Test
  void classifiesEachLatticeKind() {
    TabularResult r = TabularResult.ofRows(
        List.of("b", "i", "f", "t"),
        List.of(List.of(true, 1L, 1.5d, "x")));

    InferredSchema s = SchemaInference.infer(r);
    assertEquals(ColumnType.BOOLEAN, s.typeOf("b"));
    assertEquals(ColumnType.INTEGER, s.typeOf("i"));
    assertEquals(ColumnType.FLOAT, s.typeOf("f"));
    assertEquals(ColumnType.TEXT, s.typeOf("t"));
    assertEquals(List.of("b", "i", "f", "t"), s.columnNames());
  }

  @Test
  void skipsLeadingNulls_usesFirstNonNullValue() {
    TabularResult r = TabularResult.ofRows(
        List.of("amount"),
        List.of(Arrays.asList((Object) null), Arrays.asList((Object) null), List.of(12.25d)));
    assertEquals(ColumnType.FLOAT, SchemaInference.infer(r).typeOf("amount"));
  }

  @Test
  void allNullColumn_isText() {
    TabularResult r = TabularResult.ofRows(
        List.of("id", "note"),
        List.of(Arrays.asList(1, null), Arrays.asList(2, null)));
    InferredSchema s = SchemaInference.infer(r);
    assertEquals(ColumnType.INTEGER, s.typeOf("id"));
    assertEquals(ColumnType.TEXT, s.typeOf("note"));
  }

  @Test
  void emptyResult_isAllText() {
    InferredSchema s = SchemaInference.infer(TabularResult.empty(List.of("a", "b")));
    assertEquals(Map.of("a", ColumnType.TEXT, "b", ColumnType.TEXT), s.columns());
  }

  @Test
  void decimalsAreNormalisedByTheValueLattice() {
    assertEquals(ColumnType.INTEGER, Value.fromJava(new BigDecimal("42")).type());
    assertEquals(ColumnType.FLOAT, Value.fromJava(new BigDecimal("42.10")).type());
    assertEquals(ColumnType.TEXT, Value.fromJava(java.time.LocalDate.of(2024, 1, 31)).type());
  }

  @Test
  void declaredSqlTypesMapBackOntoLattice() {
    assertEquals(ColumnType.BOOLEAN, ColumnType.fromSqlType("BOOLEAN"));
    assertEquals(ColumnType.INTEGER, ColumnType.fromSqlType("bigint"));
    assertEquals(ColumnType.FLOAT, ColumnType.fromSqlType("REAL"));
    assertEquals(ColumnType.TEXT, ColumnType.fromSqlType("varchar(20)"));
    assertEquals(ColumnType.TEXT, ColumnType.fromSqlType(null));
  }

  @Test
  void conformCoercesCellsToTheFirstValuesType() {
    TabularResult r = TabularResult.ofRows(List.of("p", "n", "t"), List.of(
        Arrays.asList(1.5d, 1, "x"),
        Arrays.asList(2, 4.0d, 3),
        Arrays.asList(null, 4.5d, true)));

    TabularResult c = SchemaInference.conform(r);

    assertEquals(Value.of(2.0d), c.rows().get(1).get("p"));
    assertEquals(Value.ofNull(), c.rows().get(2).get("p"));
    assertEquals(Value.of(4L), c.rows().get(1).get("n"));
    assertEquals(Value.of(4.5d), c.rows().get(2).get("n"));
    assertEquals(Value.of("3"), c.rows().get(1).get("t"));
    assertEquals(Value.of("true"), c.rows().get(2).get("t"));
    assertSame(c, SchemaInference.conform(c));
  }

  @Test
  void coerceParsesNumericTextOnlyWhenWellFormed() {
    assertEquals(Value.of(42L), SchemaInference.coerce(Value.of("42"), ColumnType.INTEGER));
    assertEquals(Value.of(1.25d), SchemaInference.coerce(Value.of("1.25"), ColumnType.FLOAT));
    assertEquals(Value.of("NaN"), SchemaInference.coerce(Value.of("NaN"), ColumnType.FLOAT));
    assertEquals(Value.of(true), SchemaInference.coerce(Value.of(3L), ColumnType.BOOLEAN));
    assertEquals(Value.of("abc"), SchemaInference.coerce(Value.of("abc"), ColumnType.INTEGER));
  }
}
