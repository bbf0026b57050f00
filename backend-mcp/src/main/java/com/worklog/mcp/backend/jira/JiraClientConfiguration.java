package com.worklog.mcp.backend.jira;

import com.worklog.mcp.backend.config.JiraBackendProperties;
import com.worklog.mcp.backend.config.ReactorClientHttpConnectorBuilder;
import java.nio.charset.StandardCharsets;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
class JiraClientConfiguration {

  @Bean
  WebClient jiraWebClient(JiraBackendProperties properties) {
    WebClient.Builder builder =
        WebClient.builder()
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .clientConnector(
                new ReactorClientHttpConnectorBuilder()
                    .connectTimeout(properties.getConnectTimeout())
                    .readTimeout(properties.getReadTimeout())
                    .build());
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.baseUrl(properties.getBaseUrl().trim());
    }
    if (StringUtils.hasText(properties.getApiToken())) {
      builder.defaultHeaders(
          headers ->
              headers.setBasicAuth(
                  properties.getEmail() != null ? properties.getEmail().trim() : "",
                  properties.getApiToken().trim(),
                  StandardCharsets.UTF_8));
    }
    return builder.build();
  }

  @Bean
  JiraClient jiraClient(WebClient jiraWebClient, JiraBackendProperties properties) {
    return new JiraClient(jiraWebClient, properties.getSearchPath(), properties.getReadTimeout());
  }
}
