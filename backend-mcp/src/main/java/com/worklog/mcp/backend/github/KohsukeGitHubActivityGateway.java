package com.worklog.mcp.backend.github;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHCommitSearchBuilder;
import org.kohsuke.github.GHDirection;
import org.kohsuke.github.GHEvent;
import org.kohsuke.github.GHEventInfo;
import org.kohsuke.github.GHEventPayload;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.PagedIterable;
import org.springframework.stereotype.Component;

@Component
class KohsukeGitHubActivityGateway implements GitHubActivityGateway {

  static final String CREATE_EVENT = "CreateEvent";
  static final String PULL_REQUEST_EVENT = "PullRequestEvent";

  private final GitHubClientFactory clientFactory;

  KohsukeGitHubActivityGateway(GitHubClientFactory clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public Stream<UserEvent> userEvents(String username) {
    try {
      PagedIterable<GHEventInfo> events = clientFactory.createPatClient().getUser(username).listEvents();
      return StreamSupport.stream(events.withPageSize(100).spliterator(), false).map(this::toEvent);
    } catch (IOException ex) {
      throw new GitHubClientException("Failed to list events of " + username, ex);
    }
  }

  @Override
  public List<CommitInfo> searchCommits(String username, LocalDate date, int limit) {
    try {
      GitHub github = clientFactory.createPatClient();
      PagedIterable<GHCommit> commits =
          github
              .searchCommits()
              .author(username)
              .committerDate(date.toString())
              .sort(GHCommitSearchBuilder.Sort.COMMITTER_DATE)
              .order(GHDirection.DESC)
              .list()
              .withPageSize(Math.min(100, Math.max(1, limit)));
      List<CommitInfo> result = new ArrayList<>();
      for (GHCommit commit : commits) {
        if (result.size() >= limit) {
          break;
        }
        GHRepository owner = commit.getOwner();
        result.add(
            new CommitInfo(
                commit.getSHA1(),
                owner != null ? owner.getFullName() : null,
                commit.getCommitShortInfo().getMessage()));
      }
      return result;
    } catch (IOException ex) {
      throw new GitHubClientException("Failed to search commits of " + username, ex);
    }
  }

  private UserEvent toEvent(GHEventInfo info) {
    try {
      Instant createdAt = createdAt(info);
      GHEvent type = info.getType();
      if (type == GHEvent.CREATE) {
        GHEventPayload.Create payload = info.getPayload(GHEventPayload.Create.class);
        return new UserEvent(
            CREATE_EVENT,
            createdAt,
            repoName(info),
            payload.getRef(),
            payload.getRefType(),
            null,
            null,
            null);
      }
      if (type == GHEvent.PULL_REQUEST) {
        GHEventPayload.PullRequest payload = info.getPayload(GHEventPayload.PullRequest.class);
        GHPullRequest pullRequest = payload.getPullRequest();
        return new UserEvent(
            PULL_REQUEST_EVENT,
            createdAt,
            repoName(info),
            null,
            null,
            payload.getAction(),
            pullRequest != null ? pullRequest.getTitle() : null,
            pullRequest != null && pullRequest.getHtmlUrl() != null
                ? pullRequest.getHtmlUrl().toString()
                : null);
      }
      return new UserEvent(
          type != null ? type.name() : null, createdAt, null, null, null, null, null, null);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private Instant createdAt(GHEventInfo info) throws IOException {
    Date created = info.getCreatedAt();
    return created != null ? created.toInstant() : null;
  }

  private String repoName(GHEventInfo info) throws IOException {
    GHRepository repository = info.getRepository();
    return repository != null ? repository.getFullName() : null;
  }
}
