package com.worklog.backend.timesheet.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record TimesheetRequest(
    LocalDate start,
    LocalDate end,
    @Size(max = 64) String jiraProjectKey,
    @Size(max = 100) String githubUsername,
    @Valid EmployeeDetails employee) {

  public static TimesheetRequest empty() {
    return new TimesheetRequest(null, null, null, null, null);
  }
}
