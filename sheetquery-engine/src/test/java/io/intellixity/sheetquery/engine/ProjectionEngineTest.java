package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.Projection;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.value.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ProjectionEngineTest {
  private static final Set<String> ALIASES = Set.of("s", "b");

  private static CombinedRow row(Value amount, Value budget) {
    Map<String, Value> s = new LinkedHashMap<>();
    s.put("amount", amount);
    s.put("name", Value.text("n"));
    Map<String, Value> b = new LinkedHashMap<>();
    b.put("budget", budget);
    return CombinedRow.seed("s", s).with("b", b);
  }

  private static List<List<String>> run(List<CombinedRow> rows, String... expressions) {
    List<Projection> ps = new ArrayList<>();
    for (String e : expressions) ps.add(Projection.of(e, e));
    return ProjectionEngine.plan(ps, "s").project(rows, ALIASES);
  }

  @Test
  void mixingScalarAndAggregateFails() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> ProjectionEngine.plan(List.of(Projection.of("s.amount", "a"), Projection.of("count(*)", "n")), "s"));
    assertEquals("cannot mix aggregate and scalar projections", ex.getMessage());
  }

  @Test
  void scalarCellsAreStringifiedAndMissingLookupsAreEmpty() {
    List<CombinedRow> rows = List.of(row(Value.number(125000.0), Value.NULL), row(Value.text("x"), Value.number(0.25)));
    assertEquals(List.of(
        List.of("125000", "", "", ""),
        List.of("x", "0.25", "", "")
    ), run(rows, "amount", "b.budget", "s.missing", "ghost.amount"));
  }

  @Test
  void aggregatesSkipNonNumericValues() {
    List<CombinedRow> rows = List.of(
        row(Value.number(10), Value.text("5")),
        row(Value.text("2.5"), Value.text("n/a")),
        row(Value.text("abc"), Value.NULL));

    assertEquals(List.of(List.of("12.5", "6.25", "3", "3", "2", "5")),
        run(rows, "sum(s.amount)", "avg(amount)", "count(*)", "count(s.amount)", "count(b.budget)", "sum(b.budget)"));
  }

  @Test
  void aggregatesOverNoRowsAreZero() {
    assertEquals(List.of(List.of("0", "0", "0", "0")),
        run(List.of(), "sum(s.amount)", "avg(b.budget)", "count(*)", "count(s.amount)"));
  }

  @Test
  void aggregateOverUnknownAliasFails() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> run(List.of(row(Value.number(1), Value.number(1))), "sum(x.amount)"));
    assertEquals("unknown sheet alias 'x' in aggregate 'sum'", ex.getMessage());

    assertThrows(QueryValidationException.class, () -> run(List.of(), "avg(x.amount)"));
  }

  @Test
  void aggregatesDoNotDependOnRowOrder() {
    Random rnd = new Random(7);
    List<CombinedRow> rows = new ArrayList<>();
    for (int i = 0; i < 500; i++) {
      rows.add(row(Value.number(rnd.nextDouble() * 1e6 - 5e5), Value.text(Double.toString(rnd.nextDouble() / 3))));
    }
    List<List<String>> expected = run(rows, "sum(s.amount)", "avg(s.amount)", "sum(b.budget)", "count(b.budget)");

    for (int i = 0; i < 5; i++) {
      List<CombinedRow> shuffled = new ArrayList<>(rows);
      Collections.shuffle(shuffled, rnd);
      assertEquals(expected, run(shuffled, "sum(s.amount)", "avg(s.amount)", "sum(b.budget)", "count(b.budget)"));
    }
  }
}
