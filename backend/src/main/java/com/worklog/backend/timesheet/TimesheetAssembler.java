package com.worklog.backend.timesheet;

import com.worklog.backend.common.DateRange;
import com.worklog.backend.common.Texts;
import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.ActivityEntry;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.SnapshotStore;
import com.worklog.backend.snapshot.SnapshotStoreException;
import com.worklog.backend.snapshot.VcsEntry;
import com.worklog.backend.source.ActivitySourceClient;
import com.worklog.backend.source.SourceFetchException;
import com.worklog.backend.source.SourceFetchResult;
import com.worklog.backend.summary.ActivitySummarizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces one timesheet row per day of a range. Days are processed oldest first so that a day
 * without activity can carry forward work recorded on the days just before it; the result is
 * returned newest first.
 */
@Service
public class TimesheetAssembler {

  private static final Logger log = LoggerFactory.getLogger(TimesheetAssembler.class);

  static final String GENERAL_PROJECT = "GitHub/General";
  static final String GENERAL_TASK = "General Development Activities";
  static final String GENERAL_DESCRIPTION = "See Remarks for details.";
  static final String GENERAL_STATUS = "Completed";

  private static final String ISSUE_SOURCE = "jira";
  private static final String VCS_SOURCE = "github";

  private final ActivitySourceClient sourceClient;
  private final SnapshotStore snapshotStore;
  private final TaskSelector taskSelector;
  private final CarryForwardResolver carryForwardResolver;
  private final ActivitySummarizer summarizer;
  private final Executor fetchExecutor;
  private final Duration fetchTimeout;
  private final int descriptionLimit;
  private final MeterRegistry meterRegistry;
  private final Counter snapshotWriteFailures;
  private final Timer assemblyTimer;

  public TimesheetAssembler(
      ActivitySourceClient sourceClient,
      SnapshotStore snapshotStore,
      TaskSelector taskSelector,
      CarryForwardResolver carryForwardResolver,
      ActivitySummarizer summarizer,
      TimesheetProperties properties,
      @Qualifier("activityFetchExecutor") Executor fetchExecutor,
      MeterRegistry meterRegistry) {
    this.sourceClient = Objects.requireNonNull(sourceClient, "sourceClient must not be null");
    this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
    this.taskSelector = Objects.requireNonNull(taskSelector, "taskSelector must not be null");
    this.carryForwardResolver =
        Objects.requireNonNull(carryForwardResolver, "carryForwardResolver must not be null");
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor must not be null");
    this.fetchTimeout = properties.getSource().getFetchTimeout();
    this.descriptionLimit = properties.getDescriptionLimit();
    this.meterRegistry = meterRegistry;
    if (meterRegistry != null) {
      this.snapshotWriteFailures =
          Counter.builder("timesheet_snapshot_write_failures_total")
              .description("Number of daily snapshots that could not be persisted")
              .register(meterRegistry);
      this.assemblyTimer =
          Timer.builder("timesheet_assembly_duration_seconds")
              .description("Latency of assembling a timesheet for a date range")
              .register(meterRegistry);
    } else {
      this.snapshotWriteFailures = null;
      this.assemblyTimer = null;
    }
  }

  public List<TimesheetRow> assemble(SourceCredentials credentials, DateRange range) {
    Objects.requireNonNull(credentials, "credentials must not be null");
    Objects.requireNonNull(range, "range must not be null");
    long startedAt = System.nanoTime();
    List<TimesheetRow> rows = new ArrayList<>();
    for (LocalDate date : range.ascendingDates()) {
      rows.add(processDate(credentials, date));
    }
    rows.sort(Comparator.comparing(TimesheetRow::date).reversed());
    if (assemblyTimer != null) {
      assemblyTimer.record(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
    }
    log.info("Assembled {} timesheet rows for {}..{}", rows.size(), range.start(), range.end());
    return rows;
  }

  private TimesheetRow processDate(SourceCredentials credentials, LocalDate date) {
    long deadline = System.nanoTime() + fetchTimeout.toNanos();
    CompletableFuture<SourceFetchResult<IssueEntry>> issueFuture =
        submit(() -> sourceClient.fetchIssues(credentials.jiraProjectKey(), date));
    CompletableFuture<SourceFetchResult<VcsEntry>> vcsFuture =
        submit(() -> sourceClient.fetchVcsActivity(credentials.githubUsername(), date));

    SourceFetchResult<IssueEntry> issues = await(issueFuture, ISSUE_SOURCE, "Jira", date, deadline);
    SourceFetchResult<VcsEntry> vcs = await(vcsFuture, VCS_SOURCE, "GitHub", date, deadline);

    DailySnapshot snapshot =
        new DailySnapshot(
            date, issues.entries(), vcs.entries(), issues.rawResponse(), vcs.rawResponse());
    persist(snapshot);

    log.info(
        "Processing {}: {} issue entries, {} vcs entries",
        date,
        snapshot.issueEntries().size(),
        snapshot.vcsEntries().size());
    return buildRow(date, snapshot.issueEntries(), snapshot.vcsEntries());
  }

  private TimesheetRow buildRow(LocalDate date, List<IssueEntry> issues, List<VcsEntry> vcs) {
    String vcsContext = vcsContext(vcs);
    Optional<IssueEntry> selected = taskSelector.select(issues);
    if (selected.isPresent()) {
      IssueEntry issue = selected.get();
      String remark = summarizer.summarize(issueContext(issue, descriptionLimit), vcsContext, date);
      return new TimesheetRow(
          date, issue.project(), issue.summary(), issue.description(), issue.status(), remark);
    }
    if (!vcs.isEmpty()) {
      String remark = summarizer.summarize("", vcsContext, date);
      return new TimesheetRow(
          date, GENERAL_PROJECT, GENERAL_TASK, GENERAL_DESCRIPTION, GENERAL_STATUS, remark);
    }
    return carryForwardResolver.resolve(date);
  }

  private void persist(DailySnapshot snapshot) {
    try {
      snapshotStore.put(snapshot.date(), snapshot);
    } catch (SnapshotStoreException ex) {
      log.error("Failed to persist snapshot for {}", snapshot.date(), ex);
      if (snapshotWriteFailures != null) {
        snapshotWriteFailures.increment();
      }
    }
  }

  private <T extends ActivityEntry> CompletableFuture<SourceFetchResult<T>> submit(
      Supplier<SourceFetchResult<T>> fetch) {
    return CompletableFuture.supplyAsync(fetch, fetchExecutor);
  }

  private <T extends ActivityEntry> SourceFetchResult<T> await(
      CompletableFuture<SourceFetchResult<T>> future,
      String source,
      String label,
      LocalDate date,
      long deadline) {
    try {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      SourceFetchResult<T> result = future.get(remaining, TimeUnit.NANOSECONDS);
      if (result == null) {
        return degrade(source, label, date, "no response", null);
      }
      return result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      return degrade(source, label, date, "timed out after " + fetchTimeout, null);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      if (cause instanceof SourceFetchException fetchException) {
        return degrade(
            source, label, date, fetchException.getMessage(), fetchException.getRawResponse());
      }
      return degrade(source, label, date, String.valueOf(cause.getMessage()), null);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return degrade(source, label, date, "interrupted", null);
    }
  }

  private <T extends ActivityEntry> SourceFetchResult<T> degrade(
      String source, String label, LocalDate date, String message, String rawResponse) {
    String error = "Error fetching %s: %s".formatted(label, message);
    log.warn("{} activity for {} unavailable: {}", label, date, message);
    if (meterRegistry != null) {
      Counter.builder("timesheet_source_failures_total")
          .description("Number of activity fetches that degraded to an empty result")
          .tag("source", source)
          .register(meterRegistry)
          .increment();
    }
    return SourceFetchResult.failure(error, rawResponse);
  }

  static String issueContext(IssueEntry issue, int descriptionLimit) {
    return "Task: %s\nStatus: %s\nDescription: %s"
        .formatted(
            issue.summary(), issue.status(), Texts.truncate(issue.description(), descriptionLimit));
  }

  static String vcsContext(List<VcsEntry> entries) {
    return entries.stream()
        .map(
            entry ->
                "- [%s] %s: %s"
                    .formatted(
                        entry.type() != null ? entry.type().wireName() : "",
                        entry.repo(),
                        entry.summary()))
        .collect(Collectors.joining("\n"));
  }
}
