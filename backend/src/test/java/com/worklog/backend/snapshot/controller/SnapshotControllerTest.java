package com.worklog.backend.snapshot.controller;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.worklog.backend.common.DateRangeResolver;
import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.SnapshotStore;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SnapshotController.class)
class SnapshotControllerTest {

  @TestConfiguration
  @EnableConfigurationProperties(TimesheetProperties.class)
  @Import(DateRangeResolver.class)
  static class Config {}

  private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

  @Autowired private MockMvc mockMvc;

  @MockBean private SnapshotStore snapshotStore;

  @Test
  void listsStoredDates() throws Exception {
    given(snapshotStore.existsInRange(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3)))
        .willReturn(List.of(DAY));

    mockMvc
        .perform(get("/api/snapshots").param("start", "2024-05-01").param("end", "2024-05-03"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]", equalTo("2024-05-02")));
  }

  @Test
  void returnsStoredSnapshotWithRawResponses() throws Exception {
    DailySnapshot snapshot =
        new DailySnapshot(
            DAY,
            List.of(new IssueEntry("PROJ-1", "Login", "", "Done", "PROJ", "dev")),
            List.of(),
            "[{\"key\":\"PROJ-1\"}]",
            "");
    given(snapshotStore.get(DAY)).willReturn(Optional.of(snapshot));

    mockMvc
        .perform(get("/api/snapshots/2024-05-02"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.date", equalTo("2024-05-02")))
        .andExpect(jsonPath("$.jira[0].key", equalTo("PROJ-1")))
        .andExpect(jsonPath("$.raw_jira_response", equalTo("[{\"key\":\"PROJ-1\"}]")));
  }

  @Test
  void missingSnapshotIsNotFound() throws Exception {
    given(snapshotStore.get(DAY)).willReturn(Optional.empty());

    mockMvc.perform(get("/api/snapshots/2024-05-02")).andExpect(status().isNotFound());
  }
}
