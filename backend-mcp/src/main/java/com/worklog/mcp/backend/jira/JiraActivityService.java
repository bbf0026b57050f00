package com.worklog.mcp.backend.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.worklog.mcp.backend.config.JiraBackendProperties;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
class JiraActivityService {

  private static final Logger log = LoggerFactory.getLogger(JiraActivityService.class);

  private static final Pattern PROJECT_KEY = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
  static final String UNASSIGNED = "Unassigned";

  private final JiraClient client;
  private final JiraBackendProperties properties;

  JiraActivityService(JiraClient client, JiraBackendProperties properties) {
    this.client = Objects.requireNonNull(client, "client");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  boolean isConfigured() {
    return StringUtils.hasText(properties.getBaseUrl())
        && StringUtils.hasText(properties.getApiToken());
  }

  List<JiraIssueActivity> fetchActivity(String projectKey, LocalDate date, boolean fetchWorklogs) {
    if (!StringUtils.hasText(projectKey) || !PROJECT_KEY.matcher(projectKey.trim()).matches()) {
      throw new IllegalArgumentException("Invalid Jira project key: " + projectKey);
    }
    Objects.requireNonNull(date, "date");
    String jql = buildJql(projectKey.trim(), date);
    JsonNode response = client.searchIssues(jql, Math.max(1, properties.getMaxResults()));

    List<JiraIssueActivity> result = new ArrayList<>();
    for (JsonNode issue : response.path("issues")) {
      JsonNode fields = issue.path("fields");
      String key = issue.path("key").asText("");
      List<JiraIssueActivity.Worklog> worklogs =
          fetchWorklogs ? loadWorklogs(issue.path("id").asText(key)) : List.of();
      result.add(
          new JiraIssueActivity(
              key,
              fields.path("summary").asText(""),
              fields.path("status").path("name").asText(""),
              text(fields.path("description")),
              displayName(fields.path("assignee")),
              fields.path("project").path("name").asText(""),
              fields.path("updated").asText(""),
              worklogs));
    }
    log.info("Jira project {} has {} issues updated on {}", projectKey, result.size(), date);
    return result;
  }

  static String buildJql(String projectKey, LocalDate date) {
    return "project = %s AND updated >= '%s' AND updated < '%s 23:59'"
        .formatted(projectKey, date, date);
  }

  private List<JiraIssueActivity.Worklog> loadWorklogs(String issueId) {
    try {
      List<JiraIssueActivity.Worklog> worklogs = new ArrayList<>();
      for (JsonNode worklog : client.worklogs(issueId).path("worklogs")) {
        JsonNode author = worklog.path("author");
        String started = worklog.path("started").asText("");
        worklogs.add(
            new JiraIssueActivity.Worklog(
                author.path("displayName").asText("Unknown"),
                author.path("emailAddress").asText(""),
                started.length() >= 10 ? started.substring(0, 10) : started,
                worklog.path("timeSpentSeconds").asLong(0)));
      }
      return worklogs;
    } catch (JiraClientException ex) {
      log.warn("Skipping worklogs of {}: {}", issueId, ex.getMessage());
      return List.of();
    }
  }

  private static String displayName(JsonNode assignee) {
    if (assignee.isMissingNode() || assignee.isNull()) {
      return UNASSIGNED;
    }
    return assignee.path("displayName").asText(UNASSIGNED);
  }

  private static String text(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return "";
    }
    return node.isTextual() ? node.asText() : node.toString();
  }
}
