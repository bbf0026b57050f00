package com.worklog.mcp.backend.github;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.worklog.mcp.backend.config.GitHubBackendProperties;
import com.worklog.mcp.backend.github.GitHubActivityGateway.CommitInfo;
import com.worklog.mcp.backend.github.GitHubActivityGateway.UserEvent;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GitHubActivityServiceTest {

  private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

  private final FakeGateway gateway = new FakeGateway();
  private GitHubActivityService service;

  @BeforeEach
  void setUp() {
    GitHubBackendProperties properties = new GitHubBackendProperties();
    properties.setPersonalAccessToken("ghp_test");
    service =
        new GitHubActivityService(gateway, new GitHubClientFactory(properties), properties);
  }

  @Test
  void keepsOnlyEventsOfTheRequestedUtcDay() {
    gateway.events.add(event("CreateEvent", "2024-05-03T00:30:00Z", "feature/x", "branch", null));
    gateway.events.add(event("CreateEvent", "2024-05-02T23:59:00Z", "feature/login", "branch", null));
    gateway.events.add(pullRequest("2024-05-02T08:00:00Z", "opened", "Add login"));
    gateway.events.add(event("WatchEvent", "2024-05-02T07:00:00Z", null, null, null));
    gateway.events.add(event("CreateEvent", "2024-05-01T22:00:00Z", "old", "branch", null));
    gateway.events.add(event("CreateEvent", "2024-05-02T06:00:00Z", "unreachable", "tag", null));

    List<GitHubActivityEntry> entries = service.fetchActivity("dev", DAY);

    assertThat(entries)
        .extracting(GitHubActivityEntry::summary)
        .containsExactly("Created branch 'feature/login'", "PR opened: Add login");
    assertThat(entries.get(0).key()).isEqualTo("create-feature/login-2024-05-02T23:59:00Z");
    assertThat(entries.get(0).refType()).isEqualTo("branch");
    assertThat(entries.get(1).key()).isEqualTo("https://github.com/org/api/pull/7");
    assertThat(entries.get(1).description()).isEqualTo("Pull Request: Add login (opened)");
    assertThat(gateway.eventsRead.get()).isEqualTo(5);
  }

  @Test
  void deduplicatesCommitsBySha() {
    gateway.commits.add(new CommitInfo("abc123", "org/api", "Fix login\n\nDetails"));
    gateway.commits.add(new CommitInfo("abc123", "org/api", "Fix login\n\nDetails"));
    gateway.commits.add(new CommitInfo("def456", null, "Bump version"));

    List<GitHubActivityEntry> entries = service.fetchActivity("dev", DAY);

    assertThat(entries).hasSize(2);
    assertThat(entries.get(0).type()).isEqualTo(GitHubActivityEntry.COMMIT);
    assertThat(entries.get(0).key()).isEqualTo("abc123");
    assertThat(entries.get(0).summary()).isEqualTo("Fix login");
    assertThat(entries.get(0).description()).isEqualTo("Fix login\n\nDetails");
    assertThat(entries.get(1).repo()).isEqualTo("unknown");
  }

  @Test
  void commitsSurviveEventFailure() {
    gateway.eventFailure = new GitHubClientException("events unavailable");
    gateway.commits.add(new CommitInfo("abc123", "org/api", "Fix login"));

    assertThat(service.fetchActivity("dev", DAY))
        .extracting(GitHubActivityEntry::key)
        .containsExactly("abc123");
  }

  @Test
  void eventsSurviveCommitSearchFailure() {
    gateway.events.add(pullRequest("2024-05-02T08:00:00Z", "closed", "Add login"));
    gateway.commitFailure = new GitHubClientException("search rate limited");

    assertThat(service.fetchActivity("dev", DAY))
        .extracting(GitHubActivityEntry::action)
        .containsExactly("closed");
  }

  @Test
  void failsWhenBothLookupsFail() {
    gateway.eventFailure = new GitHubClientException("events unavailable");
    gateway.commitFailure = new GitHubClientException("search rate limited");

    assertThatThrownBy(() -> service.fetchActivity("dev", DAY))
        .isInstanceOf(GitHubClientException.class)
        .hasMessage("search rate limited")
        .satisfies(ex -> assertThat(ex.getSuppressed()).hasSize(1));
  }

  @Test
  void rejectsBlankUsername() {
    assertThatThrownBy(() -> service.fetchActivity(" ", DAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static UserEvent event(
      String type, String createdAt, String ref, String refType, String action) {
    return new UserEvent(
        type, Instant.parse(createdAt), "org/api", ref, refType, action, null, null);
  }

  private static UserEvent pullRequest(String createdAt, String action, String title) {
    return new UserEvent(
        "PullRequestEvent",
        Instant.parse(createdAt),
        "org/api",
        null,
        null,
        action,
        title,
        "https://github.com/org/api/pull/7");
  }

  private static final class FakeGateway implements GitHubActivityGateway {

    private final List<UserEvent> events = new ArrayList<>();
    private final List<CommitInfo> commits = new ArrayList<>();
    private final AtomicInteger eventsRead = new AtomicInteger();
    private RuntimeException eventFailure;
    private RuntimeException commitFailure;

    @Override
    public Stream<UserEvent> userEvents(String username) {
      if (eventFailure != null) {
        throw eventFailure;
      }
      return events.stream().peek(event -> eventsRead.incrementAndGet());
    }

    @Override
    public List<CommitInfo> searchCommits(String username, LocalDate date, int limit) {
      if (commitFailure != null) {
        throw commitFailure;
      }
      return commits;
    }
  }
}
