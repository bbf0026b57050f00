package com.worklog.backend.timesheet;

import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.IssueStatuses;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Picks the issue that represents a day when several were updated: completed work first, then
 * work in progress, then anything else. Ties keep the order in which the tracker returned them.
 */
@Component
public class TaskSelector {

  private static final Comparator<IssueEntry> BY_RANK = Comparator.comparingInt(TaskSelector::rank);

  public Optional<IssueEntry> select(List<IssueEntry> entries) {
    if (entries == null || entries.isEmpty()) {
      return Optional.empty();
    }
    // Stream.sorted is stable for ordered streams.
    return entries.stream().sorted(BY_RANK).findFirst();
  }

  static int rank(IssueEntry entry) {
    if (IssueStatuses.isCompleted(entry.status())) {
      return 0;
    }
    if (IssueStatuses.isInProgress(entry.status())) {
      return 1;
    }
    return 2;
  }
}
