package com.worklog.backend.snapshot;

import java.util.Locale;
import java.util.Set;

/** Status vocabulary shared by task selection, carry-forward and insights. */
public final class IssueStatuses {

  public static final Set<String> COMPLETED =
      Set.of("done", "completed", "verified", "closed", "resolved");

  public static final String IN_PROGRESS = "in progress";

  private IssueStatuses() {}

  public static String normalize(String status) {
    return status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
  }

  public static boolean isCompleted(String status) {
    return COMPLETED.contains(normalize(status));
  }

  public static boolean isInProgress(String status) {
    return IN_PROGRESS.equals(normalize(status));
  }
}
