package com.worklog.backend.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VcsEntryType {
  COMMIT("Commit"),
  CREATE("CreateEvent"),
  PULL_REQUEST("PullRequestEvent");

  private final String wireName;

  VcsEntryType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Accepts both the GitHub event names and their short forms; unknown values map to null. */
  @JsonCreator
  public static VcsEntryType fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "");
    return switch (normalized) {
      case "commit", "pushevent" -> COMMIT;
      case "create", "createevent" -> CREATE;
      case "pullrequest", "pullrequestevent" -> PULL_REQUEST;
      default -> null;
    };
  }
}
