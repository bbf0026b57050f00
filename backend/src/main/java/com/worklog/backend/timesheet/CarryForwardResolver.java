package com.worklog.backend.timesheet;

import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.IssueStatuses;
import com.worklog.backend.snapshot.SnapshotStore;
import com.worklog.backend.snapshot.SnapshotStoreException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the row for a day without any recorded activity. Unfinished work is assumed to continue
 * through idle days, so the nearest in-progress ticket within the lookback window is reused.
 */
@Component
public class CarryForwardResolver {

  private static final Logger log = LoggerFactory.getLogger(CarryForwardResolver.class);

  static final String NOT_AVAILABLE = "N/A";
  static final String NO_ACTIVITY_REMARK = "No activity found.";
  static final String CARRIED_STATUS = "In Progress";

  private final SnapshotStore snapshotStore;
  private final int lookbackDays;

  @Autowired
  public CarryForwardResolver(SnapshotStore snapshotStore, TimesheetProperties properties) {
    this(snapshotStore, properties.getLookbackDays());
  }

  CarryForwardResolver(SnapshotStore snapshotStore, int lookbackDays) {
    this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
    this.lookbackDays = Math.max(0, lookbackDays);
  }

  public TimesheetRow resolve(LocalDate date) {
    return findInProgress(date)
        .map(
            entry ->
                new TimesheetRow(
                    date,
                    entry.project(),
                    entry.summary(),
                    entry.description(),
                    CARRIED_STATUS,
                    "Continuing work on %s.".formatted(entry.summary())))
        .orElseGet(
            () ->
                new TimesheetRow(
                    date,
                    NOT_AVAILABLE,
                    NOT_AVAILABLE,
                    NOT_AVAILABLE,
                    NOT_AVAILABLE,
                    NO_ACTIVITY_REMARK));
  }

  /** Nearest day first, up to {@code lookbackDays} back; the first matching entry wins. */
  Optional<IssueEntry> findInProgress(LocalDate date) {
    for (int offset = 1; offset <= lookbackDays; offset++) {
      LocalDate previous = date.minusDays(offset);
      Optional<DailySnapshot> snapshot = readQuietly(previous);
      if (snapshot.isEmpty()) {
        continue;
      }
      for (IssueEntry entry : snapshot.get().issueEntries()) {
        if (IssueStatuses.isInProgress(entry.status())) {
          log.debug("Carrying forward {} from {} to {}", entry.key(), previous, date);
          return Optional.of(entry);
        }
      }
    }
    return Optional.empty();
  }

  private Optional<DailySnapshot> readQuietly(LocalDate date) {
    try {
      return snapshotStore.get(date);
    } catch (SnapshotStoreException ex) {
      log.warn("Skipping unreadable snapshot {} during carry-forward: {}", date, ex.getMessage());
      return Optional.empty();
    }
  }
}
