package com.worklog.mcp.backend.github;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

/** Raw GitHub reads behind the activity tool. */
interface GitHubActivityGateway {

  /** Public events of {@code username}, newest first, mapped lazily while the stream is read. */
  Stream<UserEvent> userEvents(String username);

  /** Commits authored by {@code username} and committed on {@code date}, newest first. */
  List<CommitInfo> searchCommits(String username, LocalDate date, int limit);

  record UserEvent(
      String type,
      Instant createdAt,
      String repo,
      String ref,
      String refType,
      String action,
      String title,
      String htmlUrl) {}

  record CommitInfo(String sha, String repo, String message) {}
}
