package com.worklog.backend.summary;

import com.worklog.backend.common.Texts;
import com.worklog.backend.config.TimesheetProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ChatClientActivitySummarizer implements ActivitySummarizer {

  static final String SYSTEM_PROMPT =
      "You are a helpful assistant that summarizes work activity for timesheets.";
  static final String NOT_CONFIGURED_REMARK = "LLM not configured. Raw Data gathered.";

  private static final String FALLBACK_METRIC = "timesheet_summary_fallbacks_total";

  private final ChatClient chatClient;
  private final int snippetLimit;
  private final Counter fallbackCounter;

  @Autowired
  public ChatClientActivitySummarizer(
      ObjectProvider<ChatClient.Builder> chatClientBuilderProvider,
      TimesheetProperties properties,
      MeterRegistry meterRegistry) {
    this(
        buildClient(chatClientBuilderProvider, properties.getSummarizer()),
        properties.getFallbackSnippetLimit(),
        meterRegistry);
  }

  ChatClientActivitySummarizer(ChatClient chatClient, int snippetLimit, MeterRegistry meterRegistry) {
    this.chatClient = chatClient;
    this.snippetLimit = snippetLimit;
    this.fallbackCounter =
        meterRegistry != null
            ? Counter.builder(FALLBACK_METRIC)
                .description("Number of timesheet remarks produced by the summariser fallback")
                .register(meterRegistry)
            : null;
  }

  private static ChatClient buildClient(
      ObjectProvider<ChatClient.Builder> builderProvider,
      TimesheetProperties.SummarizerProperties settings) {
    if (!settings.isEnabled()) {
      log.info("Timesheet summariser disabled by configuration");
      return null;
    }
    ChatClient.Builder builder = builderProvider.getIfAvailable();
    if (builder == null) {
      log.warn("No chat model configured, timesheet remarks will contain raw activity markers");
      return null;
    }
    ChatOptions options =
        ChatOptions.builder()
            .maxTokens(settings.getMaxTokens())
            .temperature(settings.getTemperature())
            .build();
    return builder
        .clone()
        .defaultSystem(SYSTEM_PROMPT)
        .defaultOptions(options)
        .defaultAdvisors(SimpleLoggerAdvisor.builder().build())
        .build();
  }

  @Override
  public String summarize(String issueContext, String vcsContext, LocalDate date) {
    if (chatClient == null) {
      recordFallback();
      return NOT_CONFIGURED_REMARK;
    }
    String prompt = buildPrompt(issueContext, vcsContext, date);
    try {
      String content = chatClient.prompt().user(prompt).call().content();
      if (!StringUtils.hasText(content)) {
        throw new SummarizationException("summariser returned an empty response");
      }
      return content.trim();
    } catch (RuntimeException ex) {
      log.warn("Summarisation for {} failed: {}", date, ex.getMessage());
      recordFallback();
      return fallbackRemark(ex, issueContext, vcsContext);
    }
  }

  String buildPrompt(String issueContext, String vcsContext, LocalDate date) {
    String day = date != null ? date.format(DateTimeFormatter.ISO_LOCAL_DATE) : "";
    return """
        Create a concise daily timesheet summary for the following activities on %s.

        Jira Activity:
        %s

        GitHub Activity:
        %s

        Format the output as a single paragraph describing the work done.
        """
        .formatted(day, orNone(issueContext), orNone(vcsContext));
  }

  private String fallbackRemark(Exception ex, String issueContext, String vcsContext) {
    return "LLM Error: %s. Raw Data: %s... %s..."
        .formatted(
            ex.getMessage(),
            Texts.truncate(issueContext, snippetLimit),
            Texts.truncate(vcsContext, snippetLimit));
  }

  private String orNone(String context) {
    return StringUtils.hasText(context) ? context : "(no activity)";
  }

  private void recordFallback() {
    if (fallbackCounter != null) {
      fallbackCounter.increment();
    }
  }
}
