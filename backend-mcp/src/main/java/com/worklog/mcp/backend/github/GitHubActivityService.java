package com.worklog.mcp.backend.github;

import com.worklog.mcp.backend.config.GitHubBackendProperties;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Collects a user's branch/tag creations, pull request events and commits for one UTC day. Event
 * and commit lookups degrade independently; only when both fail is the call reported as failed.
 */
@Service
class GitHubActivityService {

  private static final Logger log = LoggerFactory.getLogger(GitHubActivityService.class);
  private static final String UNKNOWN_REPO = "unknown";

  private final GitHubActivityGateway gateway;
  private final GitHubClientFactory clientFactory;
  private final GitHubBackendProperties properties;

  GitHubActivityService(
      GitHubActivityGateway gateway,
      GitHubClientFactory clientFactory,
      GitHubBackendProperties properties) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  boolean isConfigured() {
    return clientFactory.hasToken();
  }

  List<GitHubActivityEntry> fetchActivity(String username, LocalDate date) {
    if (!StringUtils.hasText(username)) {
      throw new IllegalArgumentException("username must not be blank");
    }
    Objects.requireNonNull(date, "date");
    String user = username.trim();

    List<GitHubActivityEntry> result = new ArrayList<>();
    RuntimeException eventFailure = null;
    try {
      result.addAll(collectEvents(user, date));
    } catch (RuntimeException ex) {
      log.warn("Failed to read events of {}: {}", user, ex.getMessage());
      eventFailure = ex;
    }
    try {
      result.addAll(collectCommits(user, date));
    } catch (RuntimeException ex) {
      log.warn("Failed to search commits of {}: {}", user, ex.getMessage());
      if (eventFailure != null) {
        GitHubClientException failure = new GitHubClientException(ex.getMessage(), ex);
        failure.addSuppressed(eventFailure);
        throw failure;
      }
    }
    log.info("GitHub user {} has {} activity entries on {}", user, result.size(), date);
    return result;
  }

  private List<GitHubActivityEntry> collectEvents(String username, LocalDate date) {
    List<GitHubActivityEntry> entries = new ArrayList<>();
    try (Stream<GitHubActivityGateway.UserEvent> events = gateway.userEvents(username)) {
      events
          .filter(event -> event.createdAt() != null)
          .takeWhile(event -> !utcDate(event).isBefore(date))
          .filter(event -> utcDate(event).equals(date))
          .forEach(event -> toEntry(event).ifPresent(entries::add));
    }
    return entries;
  }

  private Optional<GitHubActivityEntry> toEntry(GitHubActivityGateway.UserEvent event) {
    String repo = StringUtils.hasText(event.repo()) ? event.repo() : UNKNOWN_REPO;
    if (KohsukeGitHubActivityGateway.CREATE_EVENT.equals(event.type())) {
      String ref = event.ref() != null ? event.ref() : "unknown";
      String refType = event.refType() != null ? event.refType() : "";
      return Optional.of(
          new GitHubActivityEntry(
              event.type(),
              repo,
              "create-%s-%s".formatted(ref, event.createdAt()),
              "Created %s '%s'".formatted(refType, ref),
              "",
              ref,
              refType,
              null));
    }
    if (KohsukeGitHubActivityGateway.PULL_REQUEST_EVENT.equals(event.type())) {
      String action = event.action() != null ? event.action() : "";
      String title = event.title() != null ? event.title() : "";
      return Optional.of(
          new GitHubActivityEntry(
              event.type(),
              repo,
              event.htmlUrl() != null ? event.htmlUrl() : "",
              "PR %s: %s".formatted(action, title),
              "Pull Request: %s (%s)".formatted(title, action),
              null,
              null,
              action));
    }
    return Optional.empty();
  }

  private List<GitHubActivityEntry> collectCommits(String username, LocalDate date) {
    int limit = Math.max(1, properties.getMaxCommits());
    Set<String> seen = new LinkedHashSet<>();
    List<GitHubActivityEntry> entries = new ArrayList<>();
    for (GitHubActivityGateway.CommitInfo commit : gateway.searchCommits(username, date, limit)) {
      if (commit.sha() == null || !seen.add(commit.sha())) {
        continue;
      }
      String repo = StringUtils.hasText(commit.repo()) ? commit.repo() : UNKNOWN_REPO;
      entries.add(GitHubActivityEntry.commit(repo, commit.sha(), commit.message()));
    }
    return entries;
  }

  private static LocalDate utcDate(GitHubActivityGateway.UserEvent event) {
    return event.createdAt().atZone(ZoneOffset.UTC).toLocalDate();
  }
}
