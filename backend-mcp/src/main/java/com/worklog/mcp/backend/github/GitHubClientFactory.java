package com.worklog.mcp.backend.github;

import com.worklog.mcp.backend.config.GitHubBackendProperties;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubBackendProperties properties;

  GitHubClientFactory(GitHubBackendProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  boolean hasToken() {
    return StringUtils.hasText(properties.getPersonalAccessToken());
  }

  GitHub createPatClient() throws IOException {
    if (!hasToken()) {
      throw new GitHubClientException("GitHub token not configured.");
    }
    GitHubBuilder builder = new GitHubBuilder();
    builder.withRateLimitHandler(RateLimitHandler.WAIT);
    builder.withAbuseLimitHandler(AbuseLimitHandler.WAIT);
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder.withOAuthToken(properties.getPersonalAccessToken().trim()).build();
  }
}
