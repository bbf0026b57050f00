package com.worklog.backend.snapshot;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueEntry(
    @JsonProperty("key") String key,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("status") String status,
    @JsonProperty("project") String project,
    @JsonProperty("assignee") @JsonAlias("assignee_name") String assignee)
    implements ActivityEntry {

  public IssueEntry {
    summary = summary != null ? summary : "";
    description = description != null ? description : "";
    status = status != null ? status : "";
    project = project != null ? project : "";
  }

  @Override
  public String source() {
    return project;
  }
}
