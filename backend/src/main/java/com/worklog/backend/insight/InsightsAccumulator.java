package com.worklog.backend.insight;

import com.worklog.backend.common.DateRange;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.IssueStatuses;
import com.worklog.backend.snapshot.VcsEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.util.StringUtils;

/**
 * Mutable state of one analysis run. Days must be fed in chronological order; {@link #toReport()}
 * freezes the result.
 */
final class InsightsAccumulator {

  static final String UNKNOWN = "Unknown";

  private final DateRange range;
  private final int contextSwitchThreshold;

  private final Map<String, Integer> commitsPerDay = new TreeMap<>();
  private final Map<String, Integer> commitsPerRepo = new TreeMap<>();
  private final Map<String, Integer> issueTouchesPerProject = new TreeMap<>();
  private final Map<String, TicketHistory> tickets = new LinkedHashMap<>();

  private int totalCommits;
  private int totalIssueTouches;
  private int activeDays;
  private int currentInactivityStreak;
  private int longestInactivityStreak;
  private int contextSwitchingDays;

  InsightsAccumulator(DateRange range, int contextSwitchThreshold) {
    this.range = range;
    this.contextSwitchThreshold = contextSwitchThreshold;
  }

  /** Records one day; a null snapshot means nothing was stored (or it could not be read). */
  void accept(LocalDate date, DailySnapshot snapshot) {
    int commits = snapshot != null ? snapshot.vcsEntries().size() : 0;
    commitsPerDay.put(date.toString(), commits);
    totalCommits += commits;

    if (snapshot == null || !snapshot.hasActivity()) {
      currentInactivityStreak++;
      longestInactivityStreak = Math.max(longestInactivityStreak, currentInactivityStreak);
      return;
    }
    activeDays++;
    currentInactivityStreak = 0;

    Set<String> repos = new HashSet<>();
    for (VcsEntry entry : snapshot.vcsEntries()) {
      String repo = labelOf(entry.repo());
      commitsPerRepo.merge(repo, 1, Integer::sum);
      repos.add(repo);
    }

    Set<String> projects = new HashSet<>();
    for (IssueEntry entry : snapshot.issueEntries()) {
      String project = labelOf(entry.project());
      issueTouchesPerProject.merge(project, 1, Integer::sum);
      totalIssueTouches++;
      projects.add(project);
      if (StringUtils.hasText(entry.key())) {
        tickets.computeIfAbsent(entry.key(), key -> new TicketHistory(date)).observe(date, entry);
      }
    }

    if (repos.size() + projects.size() > contextSwitchThreshold) {
      contextSwitchingDays++;
    }
  }

  InsightsReport toReport() {
    int completed = 0;
    int inProgress = 0;
    long activeSpanTotal = 0;
    for (TicketHistory ticket : tickets.values()) {
      if (ticket.statuses.stream().anyMatch(IssueStatuses::isCompleted)) {
        completed++;
      } else if (ticket.statuses.stream().anyMatch(IssueStatuses::isInProgress)) {
        inProgress++;
      }
      activeSpanTotal += ChronoUnit.DAYS.between(ticket.firstSeen, ticket.lastSeen) + 1;
    }
    double averageDaysActive =
        tickets.isEmpty()
            ? 0.0
            : BigDecimal.valueOf(activeSpanTotal)
                .divide(BigDecimal.valueOf(tickets.size()), 2, RoundingMode.HALF_UP)
                .doubleValue();

    return new InsightsReport(
        new InsightsReport.Period(range.start(), range.end(), range.lengthInDays()),
        new InsightsReport.CommitMetrics(totalCommits, commitsPerDay, commitsPerRepo),
        new InsightsReport.JiraMetrics(tickets.size(), completed, inProgress, averageDaysActive),
        new InsightsReport.Distribution(
            percentages(issueTouchesPerProject, totalIssueTouches),
            percentages(commitsPerRepo, totalCommits)),
        new InsightsReport.Consistency(
            activeDays, longestInactivityStreak, contextSwitchingDays));
  }

  static Map<String, Double> percentages(Map<String, Integer> counts, int total) {
    Map<String, Double> result = new LinkedHashMap<>();
    if (total <= 0) {
      return result;
    }
    counts.forEach(
        (name, count) ->
            result.put(
                name,
                BigDecimal.valueOf(100L * count)
                    .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                    .doubleValue()));
    return result;
  }

  private static String labelOf(String value) {
    return StringUtils.hasText(value) ? value : UNKNOWN;
  }

  private static final class TicketHistory {
    private final LocalDate firstSeen;
    private LocalDate lastSeen;
    private final Set<String> statuses = new LinkedHashSet<>();

    private TicketHistory(LocalDate firstSeen) {
      this.firstSeen = firstSeen;
      this.lastSeen = firstSeen;
    }

    private TicketHistory observe(LocalDate date, IssueEntry entry) {
      lastSeen = date;
      String status = IssueStatuses.normalize(entry.status());
      if (!status.isEmpty()) {
        statuses.add(status);
      }
      return this;
    }
  }
}
