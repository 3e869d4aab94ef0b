package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.Filter;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AND-combination of per-column predicates.\n
 *
 * Filters are compiled up front (alias and operator checked) and then applied in request order.
 */
public final class FilterEvaluator {
  private final List<CompiledFilter> filters;

  private FilterEvaluator(List<CompiledFilter> filters) {
    this.filters = filters;
  }

  public static FilterEvaluator compile(List<Filter> filters, Set<String> aliases) {
    List<CompiledFilter> out = new ArrayList<>(filters.size());
    for (Filter f : filters) {
      if (!aliases.contains(f.alias())) {
        throw new QueryValidationException("filter references unknown alias '" + f.alias() + "'");
      }
      out.add(new CompiledFilter(f.alias(), f.column(), FilterOperator.parse(f.operator()), f.value()));
    }
    return new FilterEvaluator(List.copyOf(out));
  }

  public List<CombinedRow> apply(List<CombinedRow> rows) {
    List<CombinedRow> current = rows;
    for (CompiledFilter f : filters) {
      List<CombinedRow> kept = new ArrayList<>();
      for (CombinedRow r : current) {
        if (f.matches(r)) kept.add(r);
      }
      current = kept;
    }
    return current;
  }

  private record CompiledFilter(String alias, String column, FilterOperator operator, Value expected) {
    boolean matches(CombinedRow row) {
      Map<String, Value> sheet = row.sheet(alias);
      if (sheet == null) return false;
      Value actual = sheet.get(column);
      return operator.test(actual == null ? Value.NULL : actual, expected);
    }
  }
}
