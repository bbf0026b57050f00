package com.worklog.mcp.backend.insight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class InsightToolsTest {

  private final List<URI> requests = new ArrayList<>();

  @Test
  void forwardsRangeToBackend() {
    JsonNode report = tools(HttpStatus.OK).productivityReport("2024-05-01", "2024-05-03");

    assertThat(report.path("period").path("total_days").asInt()).isEqualTo(3);
    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).getPath()).isEqualTo("/api/insights");
    assertThat(requests.get(0).getQuery()).isEqualTo("start=2024-05-01&end=2024-05-03");
  }

  @Test
  void omitsBlankBounds() {
    tools(HttpStatus.OK).productivityReport(" ", null);

    assertThat(requests.get(0).getQuery()).isNull();
  }

  @Test
  void wrapsBackendErrors() {
    InsightTools tools = tools(HttpStatus.BAD_REQUEST);

    assertThatThrownBy(() -> tools.productivityReport("2024-05-03", "2024-05-01"))
        .isInstanceOf(InsightClientException.class)
        .hasMessageStartingWith("Failed to load productivity report");
  }

  private InsightTools tools(HttpStatus status) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("http://localhost:8080")
            .exchangeFunction(
                request -> {
                  requests.add(request.url());
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body("{\"period\":{\"total_days\":3}}")
                          .build());
                })
            .build();
    return new InsightTools(new InsightClient(webClient, Duration.ofSeconds(5)));
  }
}
