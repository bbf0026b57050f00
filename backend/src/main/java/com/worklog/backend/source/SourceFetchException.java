package com.worklog.backend.source;

/** Raised when a source cannot be reached or its payload cannot be understood. */
public class SourceFetchException extends RuntimeException {

  private final Kind kind;
  private final String rawResponse;

  public SourceFetchException(Kind kind, String message, String rawResponse) {
    super(message);
    this.kind = kind;
    this.rawResponse = rawResponse;
  }

  public SourceFetchException(Kind kind, String message, String rawResponse, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.rawResponse = rawResponse;
  }

  public Kind getKind() {
    return kind;
  }

  public String getRawResponse() {
    return rawResponse;
  }

  public enum Kind {
    UNAVAILABLE,
    MALFORMED_RESPONSE
  }
}
