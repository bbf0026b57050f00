package com.worklog.mcp.backend.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

@Component
public class GitHubActivityTools {

  private static final Logger log = LoggerFactory.getLogger(GitHubActivityTools.class);

  static final String NOT_CONFIGURED = "GitHub token not configured.";

  private final GitHubActivityService activityService;
  private final ObjectMapper objectMapper = new ObjectMapper();

  GitHubActivityTools(GitHubActivityService activityService) {
    this.activityService = activityService;
  }

  @Tool(
      name = "github.get_activity",
      description =
          "Returns a GitHub user's activity on the given date (YYYY-MM-DD, UTC) across all"
              + " repositories as a JSON array: branch/tag creations, pull request events and"
              + " commits. Failures are reported as {\"error\": \"...\"}.")
  public String getActivity(
      @ToolParam(description = "GitHub login") String username,
      @ToolParam(description = "Day to report, YYYY-MM-DD") String date) {
    if (!activityService.isConfigured()) {
      return error(NOT_CONFIGURED);
    }
    try {
      return objectMapper.writeValueAsString(
          activityService.fetchActivity(username, LocalDate.parse(date)));
    } catch (DateTimeParseException | IllegalArgumentException | GitHubClientException ex) {
      log.warn("github.get_activity failed for {} on {}: {}", username, date, ex.getMessage());
      return error("Error fetching GitHub data: " + ex.getMessage());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize GitHub activity", ex);
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
