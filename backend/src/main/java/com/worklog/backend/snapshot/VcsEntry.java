package com.worklog.backend.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VcsEntry(
    @JsonProperty("type") VcsEntryType type,
    @JsonProperty("repo") String repo,
    @JsonProperty("key") String key,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description)
    implements ActivityEntry {

  public VcsEntry {
    repo = repo != null && !repo.isBlank() ? repo : "unknown";
    summary = summary != null ? summary : "";
    description = description != null ? description : "";
  }

  @Override
  public String source() {
    return repo;
  }
}
