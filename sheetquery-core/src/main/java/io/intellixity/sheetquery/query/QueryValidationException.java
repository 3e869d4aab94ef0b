package io.intellixity.sheetquery.query;

/**
 * Preview request rejected before or during execution: bad wire shape, unknown sheet or alias,
 * missing join column, unparseable projection, unsupported filter operator.
 * <p>
 * Mapped to HTTP 422 by the example app; the message is returned to the caller verbatim.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
