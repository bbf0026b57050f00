package com.worklog.backend.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSnapshotStoreTest {

  private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

  @TempDir Path root;

  private FileSnapshotStore store;

  @BeforeEach
  void setUp() {
    store = new FileSnapshotStore(root);
  }

  @Test
  void writesOneFilePerDateAndReadsItBack() {
    DailySnapshot snapshot =
        new DailySnapshot(
            DAY,
            List.of(new IssueEntry("P-1", "Fix login", "desc", "Done", "Portal", "Ann")),
            List.of(new VcsEntry(VcsEntryType.COMMIT, "org/portal", "abc123", "Fix login", "Fix login\n\nbody")),
            "[{\"key\":\"P-1\"}]",
            "[]");

    store.put(DAY, snapshot);

    assertThat(root.resolve("2024-05-02.json")).exists();
    assertThat(store.get(DAY)).contains(snapshot);
  }

  @Test
  void overwriteReplacesPreviousSnapshot() {
    store.put(
        DAY,
        DailySnapshot.of(
            DAY, List.of(new IssueEntry("P-1", "a", "", "Done", "X", null)), List.of()));
    DailySnapshot replacement = DailySnapshot.of(DAY, List.of(), List.of());

    store.put(DAY, replacement);

    assertThat(store.get(DAY)).contains(replacement);
    assertThat(root.resolve("2024-05-02.json.tmp")).doesNotExist();
  }

  @Test
  void storesFieldNamesOfThePersistedRecord() throws IOException {
    store.put(DAY, DailySnapshot.of(DAY, List.of(), List.of()));

    String json = Files.readString(root.resolve("2024-05-02.json"));

    assertThat(json)
        .contains("\"date\" : \"2024-05-02\"")
        .contains("\"jira\"")
        .contains("\"github\"")
        .contains("\"raw_jira_response\"")
        .contains("\"raw_github_response\"");
  }

  @Test
  void readsLegacyEventTypesAndAssigneeName() throws IOException {
    Files.writeString(
        root.resolve("2024-05-02.json"),
        """
        {"date":"2024-05-02",
         "jira":[{"key":"P-2","summary":"s","status":"In Progress","project":"X","assignee_name":"Bob","updated":"2024-05-02T10:00:00"}],
         "github":[{"type":"PullRequestEvent","repo":"org/x","key":"u","summary":"PR opened: s"}],
         "raw_jira_response":"r1","raw_github_response":"r2"}
        """);

    DailySnapshot snapshot = store.get(DAY).orElseThrow();

    assertThat(snapshot.issueEntries()).singleElement().satisfies(entry -> {
      assertThat(entry.assignee()).isEqualTo("Bob");
      assertThat(entry.description()).isEmpty();
    });
    assertThat(snapshot.vcsEntries()).singleElement()
        .extracting(VcsEntry::type).isEqualTo(VcsEntryType.PULL_REQUEST);
  }

  @Test
  void missingDateIsEmpty() {
    assertThat(store.get(DAY)).isEmpty();
  }

  @Test
  void corruptFileIsReportedAsReadFailure() throws IOException {
    Files.writeString(root.resolve("2024-05-02.json"), "{not json");

    assertThatThrownBy(() -> store.get(DAY)).isInstanceOf(SnapshotStoreException.class);
  }

  @Test
  void rejectsSnapshotStoredUnderAnotherDate() {
    DailySnapshot snapshot = DailySnapshot.of(DAY.plusDays(1), List.of(), List.of());

    assertThatThrownBy(() -> store.put(DAY, snapshot)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void listsStoredDatesInRangeAscending() {
    store.put(DAY.plusDays(2), DailySnapshot.of(DAY.plusDays(2), List.of(), List.of()));
    store.put(DAY, DailySnapshot.of(DAY, List.of(), List.of()));
    store.put(DAY.plusDays(9), DailySnapshot.of(DAY.plusDays(9), List.of(), List.of()));

    assertThat(store.existsInRange(DAY, DAY.plusDays(3))).containsExactly(DAY, DAY.plusDays(2));
  }

  @Test
  void writeFailureSurfacesAsStoreException() throws IOException {
    Path blocked = root.resolve("blocked");
    Files.createDirectories(blocked);
    FileSnapshotStore blockedStore = new FileSnapshotStore(blocked);
    Files.createDirectories(blocked.resolve("2024-05-02.json.tmp"));

    assertThatThrownBy(() -> blockedStore.put(DAY, DailySnapshot.of(DAY, List.of(), List.of())))
        .isInstanceOf(SnapshotStoreException.class);
  }
}
