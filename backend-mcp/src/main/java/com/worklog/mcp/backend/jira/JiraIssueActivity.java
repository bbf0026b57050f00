package com.worklog.mcp.backend.jira;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One issue updated on the requested day, in the shape the timesheet backend reads. */
public record JiraIssueActivity(
    @JsonProperty("key") String key,
    @JsonProperty("summary") String summary,
    @JsonProperty("status") String status,
    @JsonProperty("description") String description,
    @JsonProperty("assignee_name") String assigneeName,
    @JsonProperty("project") String project,
    @JsonProperty("updated") String updated,
    @JsonProperty("worklogs") List<Worklog> worklogs) {

  public record Worklog(
      @JsonProperty("author") String author,
      @JsonProperty("author_email") String authorEmail,
      @JsonProperty("date") String date,
      @JsonProperty("time_spent_seconds") long timeSpentSeconds) {}
}
