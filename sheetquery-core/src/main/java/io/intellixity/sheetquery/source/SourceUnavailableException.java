package io.intellixity.sheetquery.source;

/**
 * Raised by a {@link RowSource} when a sheet's backing data is missing or unreadable.
 * <p>
 * Not retried by the engine: a preview either fully succeeds or fails with this exception.
 */
public final class SourceUnavailableException extends RuntimeException {
  private final String sheetId;

  public SourceUnavailableException(String sheetId, String message) {
    super(message);
    this.sheetId = sheetId;
  }

  public SourceUnavailableException(String sheetId, String message, Throwable cause) {
    super(message, cause);
    this.sheetId = sheetId;
  }

  public String sheetId() {
    return sheetId;
  }
}
