package com.worklog.backend.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.VcsEntry;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.ai.mcp.SyncMcpToolCallbackProvider;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class McpActivitySourceClientTest {

  private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

  @Mock private ObjectProvider<SyncMcpToolCallbackProvider> providerLookup;
  @Mock private SyncMcpToolCallbackProvider callbackProvider;
  @Mock private ToolCallback jiraTool;
  @Mock private ToolCallback githubTool;

  private McpActivitySourceClient client;

  @BeforeEach
  void setUp() {
    given(jiraTool.getToolDefinition()).willReturn(definition("jiraget_activity"));
    given(githubTool.getToolDefinition()).willReturn(definition("github.get_activity"));
    given(callbackProvider.getToolCallbacks()).willReturn(new ToolCallback[] {jiraTool, githubTool});
    given(providerLookup.getIfAvailable()).willReturn(callbackProvider);
    client =
        new McpActivitySourceClient(providerLookup, new ActivityResponseParser(), new TimesheetProperties());
  }

  @Test
  void callsJiraToolWithFlatArguments() {
    given(jiraTool.call(anyString()))
        .willReturn("[{\"type\":\"text\",\"text\":\"[{\\\"key\\\":\\\"P-1\\\",\\\"status\\\":\\\"Done\\\"}]\"}]");

    SourceFetchResult<IssueEntry> result = client.fetchIssues(" PROJ ", DAY);

    ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
    verify(jiraTool).call(input.capture());
    assertThat(input.getValue())
        .isEqualTo("{\"projectKey\":\"PROJ\",\"date\":\"2024-05-02\",\"fetchWorklogs\":false}");
    assertThat(result.failed()).isFalse();
    assertThat(result.entries()).extracting(IssueEntry::key).containsExactly("P-1");
    assertThat(result.rawResponse()).isEqualTo("[{\"key\":\"P-1\",\"status\":\"Done\"}]");
  }

  @Test
  void callsGithubTool() {
    given(githubTool.call(anyString()))
        .willReturn("[{\"type\":\"Commit\",\"repo\":\"org/a\",\"key\":\"s\",\"summary\":\"x\"}]");

    SourceFetchResult<VcsEntry> result = client.fetchVcsActivity("octocat", DAY);

    verify(githubTool).call("{\"username\":\"octocat\",\"date\":\"2024-05-02\"}");
    assertThat(result.entries()).hasSize(1);
  }

  @Test
  void missingProjectKeyIsUnavailable() {
    assertThatThrownBy(() -> client.fetchIssues("  ", DAY))
        .isInstanceOfSatisfying(
            SourceFetchException.class,
            ex -> {
              assertThat(ex.getKind()).isEqualTo(SourceFetchException.Kind.UNAVAILABLE);
              assertThat(ex.getMessage()).isEqualTo("Jira project key not configured.");
            });
  }

  @Test
  void unregisteredToolIsUnavailable() {
    given(callbackProvider.getToolCallbacks()).willReturn(new ToolCallback[] {githubTool});

    assertThat(client.isToolAvailable("jira.get_activity")).isFalse();
    assertThatThrownBy(() -> client.fetchIssues("PROJ", DAY))
        .isInstanceOf(SourceFetchException.class)
        .hasMessageContaining("not available");
  }

  @Test
  void toolFailureIsWrapped() {
    given(githubTool.call(anyString())).willThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> client.fetchVcsActivity("octocat", DAY))
        .isInstanceOfSatisfying(
            SourceFetchException.class,
            ex -> {
              assertThat(ex.getKind()).isEqualTo(SourceFetchException.Kind.UNAVAILABLE);
              assertThat(ex.getMessage()).contains("connection reset");
            });
  }

  @Test
  void noMcpClientMeansNoTools() {
    given(providerLookup.getIfAvailable()).willReturn(null);

    assertThat(client.isToolAvailable("github.get_activity")).isFalse();
  }

  private static ToolDefinition definition(String name) {
    return ToolDefinition.builder().name(name).description(name).inputSchema("{}").build();
  }
}
