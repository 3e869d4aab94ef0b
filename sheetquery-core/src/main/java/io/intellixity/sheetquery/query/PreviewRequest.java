package io.intellixity.sheetquery.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * A read-only query across one or more sheets.
 *
 * @param limit maximum number of detail rows, or {@code null} for all; never applied to aggregates
 */
@JsonDeserialize(using = PreviewRequestJsonDeserializer.class)
public record PreviewRequest(List<SheetSelection> sheets,
                             List<Projection> projections,
                             List<Filter> filters,
                             Integer limit) {
  public PreviewRequest {
    sheets = List.copyOf(sheets == null ? List.of() : sheets);
    projections = List.copyOf(projections == null ? List.of() : projections);
    filters = List.copyOf(filters == null ? List.of() : filters);
  }

  public PreviewRequest(List<SheetSelection> sheets, List<Projection> projections) {
    this(sheets, projections, List.of(), null);
  }

  public PreviewRequest withFilters(List<Filter> filters) {
    return new PreviewRequest(sheets, projections, filters, limit);
  }

  public PreviewRequest withLimit(Integer limit) {
    return new PreviewRequest(sheets, projections, filters, limit);
  }

  public PreviewRequest withProjections(List<Projection> projections) {
    return new PreviewRequest(sheets, projections, filters, limit);
  }
}
