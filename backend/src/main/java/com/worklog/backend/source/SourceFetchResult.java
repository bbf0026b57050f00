package com.worklog.backend.source;

import com.worklog.backend.snapshot.ActivityEntry;
import java.util.List;

/**
 * Outcome of one source call for one date. A failed call carries no entries and keeps the error
 * text as its raw response so the stored snapshot shows what went wrong.
 */
public record SourceFetchResult<T extends ActivityEntry>(
    List<T> entries, String rawResponse, String error) {

  public SourceFetchResult {
    entries = entries != null ? List.copyOf(entries) : List.of();
    rawResponse = rawResponse != null ? rawResponse : "";
  }

  public static <T extends ActivityEntry> SourceFetchResult<T> success(
      List<T> entries, String rawResponse) {
    return new SourceFetchResult<>(entries, rawResponse, null);
  }

  public static <T extends ActivityEntry> SourceFetchResult<T> failure(
      String error, String rawResponse) {
    return new SourceFetchResult<>(List.of(), rawResponse != null ? rawResponse : error, error);
  }

  public boolean failed() {
    return error != null;
  }
}
