package com.worklog.mcp.backend.jira;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/** Thin wrapper over the Jira REST v2 endpoints used by the activity tool. */
class JiraClient {

  static final String SEARCH_FIELDS = "summary,status,updated,description,assignee,project";

  private final WebClient webClient;
  private final String searchPath;
  private final Duration timeout;

  JiraClient(WebClient jiraWebClient, String searchPath, Duration timeout) {
    this.webClient = jiraWebClient;
    this.searchPath = searchPath;
    this.timeout = timeout;
  }

  JsonNode searchIssues(String jql, int maxResults) {
    return webClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path(searchPath)
                    .queryParam("jql", "{jql}")
                    .queryParam("maxResults", maxResults)
                    .queryParam("fields", SEARCH_FIELDS)
                    .build(jql))
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(ex -> new JiraClientException("Jira search failed: " + ex.getMessage(), ex))
        .blockOptional()
        .orElseThrow(() -> new JiraClientException("Jira search returned an empty body"));
  }

  JsonNode worklogs(String issueIdOrKey) {
    return webClient
        .get()
        .uri("/rest/api/2/issue/{issue}/worklog", issueIdOrKey)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(
            ex ->
                new JiraClientException(
                    "Failed to load worklogs for " + issueIdOrKey + ": " + ex.getMessage(), ex))
        .blockOptional()
        .orElseThrow(() -> new JiraClientException("Empty worklog response for " + issueIdOrKey));
  }
}
