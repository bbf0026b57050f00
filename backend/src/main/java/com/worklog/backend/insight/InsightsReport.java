package com.worklog.backend.insight;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Productivity figures for a date range, derived from stored daily snapshots. */
@JsonPropertyOrder({"period", "commit_metrics", "jira_metrics", "distribution", "consistency"})
public record InsightsReport(
    @JsonProperty("period") Period period,
    @JsonProperty("commit_metrics") CommitMetrics commitMetrics,
    @JsonProperty("jira_metrics") JiraMetrics jiraMetrics,
    @JsonProperty("distribution") Distribution distribution,
    @JsonProperty("consistency") Consistency consistency) {

  @JsonPropertyOrder({"start", "end", "total_days"})
  public record Period(
      @JsonProperty("start") LocalDate start,
      @JsonProperty("end") LocalDate end,
      @JsonProperty("total_days") long totalDays) {}

  @JsonPropertyOrder({"total_commits", "commits_per_day", "commits_per_repo"})
  public record CommitMetrics(
      @JsonProperty("total_commits") int totalCommits,
      @JsonProperty("commits_per_day") Map<String, Integer> commitsPerDay,
      @JsonProperty("commits_per_repo") Map<String, Integer> commitsPerRepo) {

    public CommitMetrics {
      commitsPerDay = frozen(commitsPerDay);
      commitsPerRepo = frozen(commitsPerRepo);
    }
  }

  @JsonPropertyOrder({
    "total_tickets_touched",
    "tickets_completed",
    "tickets_in_progress",
    "average_days_active"
  })
  public record JiraMetrics(
      @JsonProperty("total_tickets_touched") int totalTicketsTouched,
      @JsonProperty("tickets_completed") int ticketsCompleted,
      @JsonProperty("tickets_in_progress") int ticketsInProgress,
      @JsonProperty("average_days_active") double averageDaysActive) {}

  @JsonPropertyOrder({"project_distribution_percent", "repo_distribution_percent"})
  public record Distribution(
      @JsonProperty("project_distribution_percent") Map<String, Double> projectDistributionPercent,
      @JsonProperty("repo_distribution_percent") Map<String, Double> repoDistributionPercent) {

    public Distribution {
      projectDistributionPercent = frozen(projectDistributionPercent);
      repoDistributionPercent = frozen(repoDistributionPercent);
    }
  }

  @JsonPropertyOrder({"active_days", "longest_inactivity_streak_days", "context_switching_days"})
  public record Consistency(
      @JsonProperty("active_days") int activeDays,
      @JsonProperty("longest_inactivity_streak_days") int longestInactivityStreakDays,
      @JsonProperty("context_switching_days") int contextSwitchingDays) {}

  // keeps the caller's iteration order
  private static <V> Map<String, V> frozen(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
