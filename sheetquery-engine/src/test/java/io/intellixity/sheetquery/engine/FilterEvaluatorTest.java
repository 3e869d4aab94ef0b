package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.Filter;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.value.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class FilterEvaluatorTest {
  private static final Set<String> ALIASES = Set.of("s");

  private static CombinedRow row(String name, Value amount) {
    Map<String, Value> m = new LinkedHashMap<>();
    m.put("name", Value.text(name));
    m.put("amount", amount);
    return CombinedRow.seed("s", m);
  }

  private static final List<CombinedRow> ROWS = List.of(
      row("Widget", Value.number(10)),
      row("gadget", Value.text("25.5")),
      row("Gizmo", Value.text("n/a")),
      row("thing", Value.NULL));

  private static List<String> names(List<CombinedRow> rows) {
    return rows.stream().map(r -> r.get("s", "name").toString()).toList();
  }

  private static List<String> apply(Filter... filters) {
    return names(FilterEvaluator.compile(List.of(filters), ALIASES).apply(ROWS));
  }

  @Test
  void eqAndNeUseRawEquality() {
    assertEquals(List.of("Widget"), apply(Filter.eq("s", "amount", 10)));
    assertEquals(List.of(), apply(Filter.eq("s", "amount", "10")));
    assertEquals(List.of("gadget"), apply(Filter.eq("s", "amount", "25.5")));
    assertEquals(List.of("thing"), apply(Filter.eq("s", "amount", null)));
    assertEquals(List.of("gadget", "Gizmo", "thing"), apply(Filter.ne("s", "amount", 10)));
  }

  @Test
  void containsIsCaseInsensitiveAndTextOnly() {
    assertEquals(List.of("Widget", "gadget"), apply(Filter.contains("s", "name", "DGE")));
    assertEquals(List.of(), apply(Filter.contains("s", "amount", "1")));
    assertEquals(List.of(), apply(Filter.contains("s", "name", 5)));
  }

  @Test
  void gtAndLtCoerceNumbersAndSkipTheRest() {
    assertEquals(List.of("gadget"), apply(Filter.gt("s", "amount", 10)));
    assertEquals(List.of("Widget", "gadget"), apply(Filter.gt("s", "amount", "9.99")));
    assertEquals(List.of("Widget"), apply(Filter.lt("s", "amount", 20)));
    assertEquals(List.of(), apply(Filter.lt("s", "amount", "abc")));
  }

  @Test
  void filtersCombineWithAnd() {
    assertEquals(List.of("gadget"), apply(Filter.gt("s", "amount", 0), Filter.contains("s", "name", "A")));
  }

  @Test
  void operatorIsCaseInsensitive() {
    assertEquals(List.of("Widget"), apply(Filter.of("s", "amount", "EQ", 10)));
  }

  @Test
  void rejectsUnknownAliasAndOperator() {
    QueryValidationException alias = assertThrows(QueryValidationException.class,
        () -> FilterEvaluator.compile(List.of(Filter.eq("x", "a", 1)), ALIASES));
    assertEquals("filter references unknown alias 'x'", alias.getMessage());

    QueryValidationException op = assertThrows(QueryValidationException.class,
        () -> FilterEvaluator.compile(List.of(Filter.of("s", "a", "between", 1)), ALIASES));
    assertEquals("unsupported filter operator 'between'", op.getMessage());
  }

  @Test
  void rowsWithoutTheAliasAreExcluded() {
    FilterEvaluator f = FilterEvaluator.compile(List.of(Filter.ne("t", "a", 1)), Set.of("s", "t"));
    assertTrue(f.apply(ROWS).isEmpty());
  }
}
