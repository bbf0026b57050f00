package com.worklog.mcp.backend.jira;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

@Component
public class JiraActivityTools {

  private static final Logger log = LoggerFactory.getLogger(JiraActivityTools.class);

  static final String NOT_CONFIGURED = "Jira credentials not configured.";

  private final JiraActivityService activityService;
  private final ObjectMapper objectMapper = new ObjectMapper();

  JiraActivityTools(JiraActivityService activityService) {
    this.activityService = activityService;
  }

  @Tool(
      name = "jira.get_activity",
      description =
          "Returns the Jira issues of a project updated on the given date (YYYY-MM-DD) as a JSON"
              + " array. Worklogs are included when fetchWorklogs is true. Failures are reported"
              + " as {\"error\": \"...\"}.")
  public String getActivity(
      @ToolParam(description = "Jira project key, for example PROJ") String projectKey,
      @ToolParam(description = "Day to report, YYYY-MM-DD") String date,
      @ToolParam(description = "Also load worklogs of each issue", required = false)
          Boolean fetchWorklogs) {
    if (!activityService.isConfigured()) {
      return error(NOT_CONFIGURED);
    }
    try {
      List<JiraIssueActivity> issues =
          activityService.fetchActivity(
              projectKey, LocalDate.parse(date), Boolean.TRUE.equals(fetchWorklogs));
      return objectMapper.writeValueAsString(issues);
    } catch (DateTimeParseException | IllegalArgumentException | JiraClientException ex) {
      log.warn("jira.get_activity failed for {} on {}: {}", projectKey, date, ex.getMessage());
      return error("Error fetching Jira data: " + ex.getMessage());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Jira activity", ex);
    }
  }

  private String error(String message) {
    try {
      return objectMapper.writeValueAsString(Map.of("error", message));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize error payload", ex);
    }
  }
}
