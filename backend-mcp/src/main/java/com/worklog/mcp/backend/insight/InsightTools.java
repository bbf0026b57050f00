package com.worklog.mcp.backend.insight;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class InsightTools {

  private final InsightClient client;

  public InsightTools(InsightClient client) {
    this.client = client;
  }

  @Tool(
      name = "insight.productivity_report",
      description =
          "Returns productivity insights for a date range (YYYY-MM-DD, inclusive): commit counts,"
              + " ticket completion, project and repository distribution, active days and"
              + " inactivity streaks. Omitted bounds default to the last five days.")
  public JsonNode productivityReport(
      @ToolParam(description = "First day of the range", required = false) String start,
      @ToolParam(description = "Last day of the range", required = false) String end) {
    return client.productivityReport(parse(start), parse(end));
  }

  private LocalDate parse(String value) {
    return StringUtils.hasText(value) ? LocalDate.parse(value.trim()) : null;
  }
}
