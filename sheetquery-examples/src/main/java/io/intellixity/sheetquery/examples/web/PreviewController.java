package io.intellixity.sheetquery.examples.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sheetquery.engine.QueryBuilderService;
import io.intellixity.sheetquery.query.PreviewRequest;
import io.intellixity.sheetquery.query.PreviewResult;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.source.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/queries")
public final class PreviewController {
  private static final Logger log = LoggerFactory.getLogger(PreviewController.class);

  private final QueryBuilderService queries;
  private final ObjectMapper json;

  public PreviewController(QueryBuilderService queries, ObjectMapper json) {
    this.queries = queries;
    this.json = json;
  }

  @PostMapping(value = "/preview", consumes = MediaType.APPLICATION_JSON_VALUE)
  public PreviewResult preview(@RequestBody JsonNode body) throws JsonProcessingException {
    if (body == null || !body.isObject()) throw new QueryValidationException("preview request must be an object");
    PreviewRequest request = json.treeToValue(body, PreviewRequest.class);
    return queries.preview(request);
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<Map<String, String>> invalid(QueryValidationException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("detail", e.getMessage()));
  }

  @ExceptionHandler(SourceUnavailableException.class)
  public ResponseEntity<Map<String, String>> unavailable(SourceUnavailableException e) {
    log.warn("sheetquery.source_unavailable sheetId={} reason={}", e.sheetId(), e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("detail", e.getMessage()));
  }
}
