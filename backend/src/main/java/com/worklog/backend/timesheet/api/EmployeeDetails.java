package com.worklog.backend.timesheet.api;

import com.worklog.backend.config.TimesheetProperties;
import jakarta.validation.constraints.Size;
import org.springframework.util.StringUtils;

/** Static columns repeated on every exported row. */
public record EmployeeDetails(
    @Size(max = 64) String employeeId,
    @Size(max = 128) String employeeName,
    @Size(max = 16) String authorizedHours,
    @Size(max = 16) String billable,
    @Size(max = 64) String role,
    @Size(max = 64) String site) {

  public static EmployeeDetails defaults(TimesheetProperties.EmployeeProperties properties) {
    return new EmployeeDetails(
        properties.getEmployeeId(),
        properties.getEmployeeName(),
        properties.getAuthorizedHours(),
        properties.getBillable(),
        properties.getRole(),
        properties.getSite());
  }

  /** Fields left blank here are taken from {@code fallback}. */
  public EmployeeDetails orElse(EmployeeDetails fallback) {
    return new EmployeeDetails(
        pick(employeeId, fallback.employeeId()),
        pick(employeeName, fallback.employeeName()),
        pick(authorizedHours, fallback.authorizedHours()),
        pick(billable, fallback.billable()),
        pick(role, fallback.role()),
        pick(site, fallback.site()));
  }

  private static String pick(String value, String fallback) {
    if (StringUtils.hasText(value)) {
      return value.trim();
    }
    return fallback != null ? fallback : "";
  }
}
