package com.worklog.backend.insight;

import com.worklog.backend.common.DateRange;
import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.SnapshotStore;
import com.worklog.backend.snapshot.SnapshotStoreException;
import java.time.LocalDate;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Read-only analysis over the snapshot store. */
@Service
@Slf4j
public class ProductivityInsightsService {

  private final SnapshotStore snapshotStore;
  private final int contextSwitchThreshold;

  @Autowired
  public ProductivityInsightsService(SnapshotStore snapshotStore, TimesheetProperties properties) {
    this(snapshotStore, properties.getContextSwitchThreshold());
  }

  ProductivityInsightsService(SnapshotStore snapshotStore, int contextSwitchThreshold) {
    this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
    this.contextSwitchThreshold = contextSwitchThreshold;
  }

  public InsightsReport analyze(DateRange range) {
    Objects.requireNonNull(range, "range must not be null");
    InsightsAccumulator accumulator = new InsightsAccumulator(range, contextSwitchThreshold);
    for (LocalDate date : range.ascendingDates()) {
      accumulator.accept(date, read(date));
    }
    InsightsReport report = accumulator.toReport();
    log.info(
        "Analyzed {}..{}: {} active days, {} commits, {} tickets",
        range.start(),
        range.end(),
        report.consistency().activeDays(),
        report.commitMetrics().totalCommits(),
        report.jiraMetrics().totalTicketsTouched());
    return report;
  }

  private DailySnapshot read(LocalDate date) {
    try {
      return snapshotStore.get(date).orElse(null);
    } catch (SnapshotStoreException ex) {
      log.warn("Treating unreadable snapshot {} as missing: {}", date, ex.getMessage());
      return null;
    }
  }
}
