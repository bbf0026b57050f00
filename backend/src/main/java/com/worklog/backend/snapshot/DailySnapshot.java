package com.worklog.backend.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** Activity recorded for one calendar day. A stored snapshot is always replaced as a whole. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailySnapshot(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("jira") List<IssueEntry> issueEntries,
    @JsonProperty("github") List<VcsEntry> vcsEntries,
    @JsonProperty("raw_jira_response") String rawIssueResponse,
    @JsonProperty("raw_github_response") String rawVcsResponse) {

  public DailySnapshot {
    Objects.requireNonNull(date, "date");
    issueEntries = issueEntries != null ? List.copyOf(issueEntries) : List.of();
    vcsEntries = vcsEntries != null ? List.copyOf(vcsEntries) : List.of();
    rawIssueResponse = rawIssueResponse != null ? rawIssueResponse : "";
    rawVcsResponse = rawVcsResponse != null ? rawVcsResponse : "";
  }

  public static DailySnapshot of(
      LocalDate date, List<IssueEntry> issueEntries, List<VcsEntry> vcsEntries) {
    return new DailySnapshot(date, issueEntries, vcsEntries, "", "");
  }

  @JsonIgnore
  public boolean hasActivity() {
    return !issueEntries.isEmpty() || !vcsEntries.isEmpty();
  }
}
