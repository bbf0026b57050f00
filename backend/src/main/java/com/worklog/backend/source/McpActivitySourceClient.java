package com.worklog.backend.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.VcsEntry;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.mcp.SyncMcpToolCallbackProvider;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Fetches activity through the {@code jira.get_activity} and {@code github.get_activity} tools. */
@Component
public class McpActivitySourceClient implements ActivitySourceClient {

  private static final Logger log = LoggerFactory.getLogger(McpActivitySourceClient.class);

  private final ObjectProvider<SyncMcpToolCallbackProvider> toolCallbackProvider;
  private final ActivityResponseParser responseParser;
  private final TimesheetProperties.SourceProperties sourceProperties;
  private final ObjectMapper objectMapper = new ObjectMapper();

  public McpActivitySourceClient(
      ObjectProvider<SyncMcpToolCallbackProvider> toolCallbackProvider,
      ActivityResponseParser responseParser,
      TimesheetProperties properties) {
    this.toolCallbackProvider = Objects.requireNonNull(toolCallbackProvider, "toolCallbackProvider");
    this.responseParser = Objects.requireNonNull(responseParser, "responseParser");
    this.sourceProperties = Objects.requireNonNull(properties, "properties").getSource();
  }

  @Override
  public SourceFetchResult<IssueEntry> fetchIssues(String projectKey, LocalDate date) {
    if (!StringUtils.hasText(projectKey)) {
      throw new SourceFetchException(
          SourceFetchException.Kind.UNAVAILABLE, "Jira project key not configured.", null);
    }
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("projectKey", projectKey.trim());
    arguments.put("date", format(date));
    arguments.put("fetchWorklogs", sourceProperties.isFetchWorklogs());
    String payload = invoke(sourceProperties.getJiraTool(), arguments);
    return SourceFetchResult.success(responseParser.parseIssues(payload), payload);
  }

  @Override
  public SourceFetchResult<VcsEntry> fetchVcsActivity(String username, LocalDate date) {
    if (!StringUtils.hasText(username)) {
      throw new SourceFetchException(
          SourceFetchException.Kind.UNAVAILABLE, "GitHub username not configured.", null);
    }
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("username", username.trim());
    arguments.put("date", format(date));
    String payload = invoke(sourceProperties.getGithubTool(), arguments);
    return SourceFetchResult.success(responseParser.parseVcsEntries(payload), payload);
  }

  public boolean isToolAvailable(String toolName) {
    return findTool(toolName).isPresent();
  }

  private String invoke(String toolName, Map<String, Object> arguments) {
    ToolCallback callback =
        findTool(toolName)
            .orElseThrow(
                () ->
                    new SourceFetchException(
                        SourceFetchException.Kind.UNAVAILABLE,
                        "MCP tool %s is not available".formatted(toolName),
                        null));
    String input;
    try {
      input = objectMapper.writeValueAsString(arguments);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize arguments for " + toolName, ex);
    }
    try {
      log.debug("Calling MCP tool {} with {}", toolName, input);
      return responseParser.unwrap(callback.call(input));
    } catch (RuntimeException ex) {
      throw new SourceFetchException(
          SourceFetchException.Kind.UNAVAILABLE,
          "MCP tool %s failed: %s".formatted(toolName, ex.getMessage()),
          null,
          ex);
    }
  }

  private Optional<ToolCallback> findTool(String toolName) {
    String expected = McpToolNameSanitizer.sanitize(toolName);
    SyncMcpToolCallbackProvider provider = toolCallbackProvider.getIfAvailable();
    if (expected == null || provider == null) {
      return Optional.empty();
    }
    ToolCallback[] callbacks = provider.getToolCallbacks();
    if (callbacks == null) {
      return Optional.empty();
    }
    return Arrays.stream(callbacks)
        .filter(Objects::nonNull)
        .filter(callback -> callback.getToolDefinition() != null)
        .filter(
            callback ->
                expected.equals(McpToolNameSanitizer.sanitize(callback.getToolDefinition().name())))
        .findFirst();
  }

  private String format(LocalDate date) {
    return Objects.requireNonNull(date, "date").format(DateTimeFormatter.ISO_LOCAL_DATE);
  }
}
