package com.worklog.mcp.backend.github;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitHubActivityEntry(
    @JsonProperty("type") String type,
    @JsonProperty("repo") String repo,
    @JsonProperty("key") String key,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("ref") String ref,
    @JsonProperty("ref_type") String refType,
    @JsonProperty("action") String action) {

  static final String COMMIT = "Commit";

  static GitHubActivityEntry commit(String repo, String sha, String message) {
    String text = message != null ? message : "";
    int newline = text.indexOf('\n');
    String summary = newline >= 0 ? text.substring(0, newline) : text;
    return new GitHubActivityEntry(COMMIT, repo, sha, summary.strip(), text, null, null, null);
  }
}
