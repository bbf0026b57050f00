package com.worklog.backend.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientActivitySummarizerTest {

  private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

  private ChatClient chatClient;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    chatClient = mock(ChatClient.class, Answers.RETURNS_DEEP_STUBS);
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  void returnsTrimmedModelOutput() {
    given(chatClient.prompt().user(anyString()).call().content())
        .willReturn("  Implemented CSV export.  ");
    ChatClientActivitySummarizer summarizer = new ChatClientActivitySummarizer(chatClient, 50, meterRegistry);

    String remark = summarizer.summarize("Task: Export", "- [Commit] org/a: csv", DAY);

    assertThat(remark).isEqualTo("Implemented CSV export.");
    assertThat(fallbacks()).isZero();
  }

  @Test
  void promptCarriesDateAndBothSections() {
    ChatClientActivitySummarizer summarizer = new ChatClientActivitySummarizer(chatClient, 50, meterRegistry);

    String prompt = summarizer.buildPrompt("Task: Export", "- [Commit] org/a: csv", DAY);

    assertThat(prompt)
        .contains("following activities on 2024-05-02")
        .contains("Jira Activity:\nTask: Export")
        .contains("GitHub Activity:\n- [Commit] org/a: csv")
        .contains("single paragraph");
  }

  @Test
  void failureFallsBackToRawDataSnippets() {
    given(chatClient.prompt().user(anyString()).call().content())
        .willThrow(new IllegalStateException("rate limited"));
    ChatClientActivitySummarizer summarizer = new ChatClientActivitySummarizer(chatClient, 5, meterRegistry);

    String remark = summarizer.summarize("Task: Export", "- [Commit] org/a: csv", DAY);

    assertThat(remark).isEqualTo("LLM Error: rate limited. Raw Data: Task:... - [Co...");
    assertThat(fallbacks()).isEqualTo(1.0);
  }

  @Test
  void emptyModelOutputCountsAsFailure() {
    given(chatClient.prompt().user(anyString()).call().content()).willReturn(" ");
    ChatClientActivitySummarizer summarizer = new ChatClientActivitySummarizer(chatClient, 50, meterRegistry);

    String remark = summarizer.summarize("", "- [Commit] org/a: csv", DAY);

    assertThat(remark).startsWith("LLM Error: ").contains("Raw Data: ... - [Commit] org/a: csv...");
  }

  @Test
  void withoutModelReturnsNotConfiguredRemark() {
    ChatClientActivitySummarizer summarizer = new ChatClientActivitySummarizer(null, 50, meterRegistry);

    assertThat(summarizer.summarize("Task: x", "", DAY))
        .isEqualTo("LLM not configured. Raw Data gathered.");
    assertThat(fallbacks()).isEqualTo(1.0);
  }

  private double fallbacks() {
    return meterRegistry.get("timesheet_summary_fallbacks_total").counter().count();
  }
}
