package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.PreviewRequest;
import io.intellixity.sheetquery.query.PreviewResult;
import io.intellixity.sheetquery.query.Projection;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.query.SheetRole;
import io.intellixity.sheetquery.query.SheetSelection;
import io.intellixity.sheetquery.source.RowSource;
import io.intellixity.sheetquery.source.SheetCatalog;
import io.intellixity.sheetquery.source.SheetDescriptor;
import io.intellixity.sheetquery.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executes cross-sheet preview queries in memory.\n
 *
 * Pipeline: validate request and resolve sheets, load primary rows, join each further sheet off the
 * primary row, filter, project or aggregate, limit.\n
 *
 * Stateless: every call builds its own working set, so one instance can serve concurrent callers as
 * long as the catalog and row source tolerate concurrent reads. {@link QueryValidationException} is
 * raised for malformed requests; {@link io.intellixity.sheetquery.source.SourceUnavailableException}
 * from the row source propagates unchanged.
 */
public final class QueryBuilderService {
  private static final Logger log = LoggerFactory.getLogger(QueryBuilderService.class);

  private final SheetCatalog catalog;
  private final RowSource rowSource;

  public QueryBuilderService(SheetCatalog catalog, RowSource rowSource) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.rowSource = Objects.requireNonNull(rowSource, "rowSource");
  }

  public PreviewResult preview(PreviewRequest request) {
    Objects.requireNonNull(request, "request");
    long start = System.nanoTime();

    if (request.sheets().isEmpty()) throw new QueryValidationException("no sheets");
    if (request.projections().isEmpty()) throw new QueryValidationException("no projections");

    List<String> warnings = new ArrayList<>();
    Map<String, ResolvedSheet> byAlias = resolveSheets(request.sheets(), warnings);
    ResolvedSheet primary = choosePrimary(byAlias);
    List<ResolvedSheet> joins = joinTargets(byAlias, primary);

    Set<String> aliases = byAlias.keySet();
    ProjectionEngine projection = ProjectionEngine.plan(request.projections(), primary.alias());
    FilterEvaluator filters = FilterEvaluator.compile(request.filters(), aliases);

    debugStart(request, primary, projection);

    List<CombinedRow> combined = new ArrayList<>();
    for (Map<String, Value> row : rowSource.load(primary.sheetId())) {
      combined.add(CombinedRow.seed(primary.alias(), row));
    }

    for (ResolvedSheet join : joins) {
      warnings.addAll(JoinSchemaValidator.validate(
          primary.descriptor().schema(),
          join.descriptor().schema(),
          join.selection().joinKeys(),
          primary.alias(),
          join.alias()));

      if (combined.isEmpty()) {
        log.debug("sheetquery.join_skipped alias={} reason=empty_left", join.alias());
        continue;
      }
      List<Map<String, Value>> joinRows = rowSource.load(join.sheetId());
      int left = combined.size();
      combined = HashJoiner.join(combined, primary.alias(), join.alias(), joinRows, join.selection().joinKeys());
      log.debug("sheetquery.join alias={} keys={} leftRows={} rightRows={} outRows={}",
          join.alias(), join.selection().joinKeys(), left, joinRows.size(), combined.size());
    }

    List<CombinedRow> filtered = filters.apply(combined);
    List<List<String>> rows = projection.project(filtered, aliases);
    if (!projection.aggregate() && request.limit() != null) {
      int limit = Math.max(0, request.limit());
      if (rows.size() > limit) rows = rows.subList(0, limit);
    }

    List<String> headers = new ArrayList<>(request.projections().size());
    for (Projection p : request.projections()) headers.add(p.label());

    double executionMs = (System.nanoTime() - start) / 1_000_000.0;
    log.debug("sheetquery.preview_done durationMs={} combinedRows={} filteredRows={} rows={} warnings={}",
        executionMs, combined.size(), filtered.size(), rows.size(), warnings.size());
    return new PreviewResult(headers, rows, warnings, executionMs, rows.size());
  }

  private Map<String, ResolvedSheet> resolveSheets(List<SheetSelection> selections, List<String> warnings) {
    Map<String, ResolvedSheet> byAlias = new LinkedHashMap<>();
    for (SheetSelection s : selections) {
      if (byAlias.containsKey(s.alias())) throw new QueryValidationException("duplicate alias " + s.alias());

      SheetDescriptor d = catalog.resolve(s.sheetId())
          .orElseThrow(() -> new QueryValidationException("sheet not found"));
      if (!d.active()) {
        warnings.add("Sheet '" + s.alias() + "' (" + d.displayLabel() + ") is " + d.status().label());
      }
      byAlias.put(s.alias(), new ResolvedSheet(s, d));
    }
    return byAlias;
  }

  // First selection explicitly marked primary, else the first selection.
  private static ResolvedSheet choosePrimary(Map<String, ResolvedSheet> byAlias) {
    for (ResolvedSheet r : byAlias.values()) {
      if (r.selection().role() == SheetRole.PRIMARY) return r;
    }
    return byAlias.values().iterator().next();
  }

  private static List<ResolvedSheet> joinTargets(Map<String, ResolvedSheet> byAlias, ResolvedSheet primary) {
    List<ResolvedSheet> out = new ArrayList<>();
    for (ResolvedSheet r : byAlias.values()) {
      if (r == primary) continue;
      if (r.selection().role() == SheetRole.UNION) throw new QueryValidationException("union not supported");
      if (r.selection().joinKeys().isEmpty()) {
        throw new QueryValidationException("join keys required for alias " + r.alias());
      }
      out.add(r);
    }
    return out;
  }

  private static void debugStart(PreviewRequest request, ResolvedSheet primary, ProjectionEngine projection) {
    if (!log.isDebugEnabled()) return;
    log.debug("sheetquery.preview sheets={} primary={} mode={} projections={} filters={} limit={}",
        request.sheets().size(), primary.alias(), projection.aggregate() ? "aggregate" : "detail",
        request.projections().size(), request.filters().size(), request.limit());
  }

  private record ResolvedSheet(SheetSelection selection, SheetDescriptor descriptor) {
    String alias() { return selection.alias(); }
    String sheetId() { return selection.sheetId(); }
  }
}
