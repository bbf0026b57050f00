package com.worklog.mcp.backend.insight;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.LocalDate;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

class InsightClient {

  private final WebClient webClient;
  private final Duration timeout;

  InsightClient(WebClient insightWebClient, Duration timeout) {
    this.webClient = insightWebClient;
    this.timeout = timeout;
  }

  /** Nulls are left out so the backend applies its default range. */
  JsonNode productivityReport(LocalDate start, LocalDate end) {
    return webClient
        .get()
        .uri(
            uriBuilder -> {
              uriBuilder.path("/api/insights");
              if (start != null) {
                uriBuilder.queryParam("start", start);
              }
              if (end != null) {
                uriBuilder.queryParam("end", end);
              }
              return uriBuilder.build();
            })
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(
            ex ->
                new InsightClientException(
                    "Failed to load productivity report: " + ex.getMessage(), ex))
        .block();
  }
}
