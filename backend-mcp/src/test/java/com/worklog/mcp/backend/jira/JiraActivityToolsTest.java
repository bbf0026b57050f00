package com.worklog.mcp.backend.jira;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JiraActivityToolsTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private JiraActivityService activityService;

  @Test
  void returnsIssuesAsJsonArray() throws Exception {
    given(activityService.isConfigured()).willReturn(true);
    given(activityService.fetchActivity("PROJ", LocalDate.of(2024, 5, 2), true))
        .willReturn(
            List.of(
                new JiraIssueActivity(
                    "PROJ-1", "Login", "Done", "", "Dana", "Portal", "2024-05-02", List.of())));

    JsonNode result =
        objectMapper.readTree(
            new JiraActivityTools(activityService).getActivity("PROJ", "2024-05-02", true));

    assertThat(result.isArray()).isTrue();
    assertThat(result.get(0).path("key").asText()).isEqualTo("PROJ-1");
    assertThat(result.get(0).path("assignee_name").asText()).isEqualTo("Dana");
    assertThat(result.get(0).has("worklogs")).isTrue();
  }

  @Test
  void reportsMissingCredentials() throws Exception {
    given(activityService.isConfigured()).willReturn(false);

    JsonNode result =
        objectMapper.readTree(
            new JiraActivityTools(activityService).getActivity("PROJ", "2024-05-02", null));

    assertThat(result.path("error").asText()).isEqualTo(JiraActivityTools.NOT_CONFIGURED);
    verify(activityService, never()).fetchActivity(anyString(), any(), anyBoolean());
  }

  @Test
  void reportsFetchFailuresAsErrorObject() throws Exception {
    given(activityService.isConfigured()).willReturn(true);
    given(activityService.fetchActivity("PROJ", LocalDate.of(2024, 5, 2), false))
        .willThrow(new JiraClientException("Jira search failed: 401 Unauthorized"));

    JsonNode result =
        objectMapper.readTree(
            new JiraActivityTools(activityService).getActivity("PROJ", "2024-05-02", false));

    assertThat(result.path("error").asText())
        .isEqualTo("Error fetching Jira data: Jira search failed: 401 Unauthorized");
  }

  @Test
  void reportsMalformedDate() throws Exception {
    given(activityService.isConfigured()).willReturn(true);

    JsonNode result =
        objectMapper.readTree(
            new JiraActivityTools(activityService).getActivity("PROJ", "02/05/2024", false));

    assertThat(result.path("error").asText()).startsWith("Error fetching Jira data:");
  }
}
