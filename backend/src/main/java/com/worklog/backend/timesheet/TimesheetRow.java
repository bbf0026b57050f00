package com.worklog.backend.timesheet;

import java.time.LocalDate;

public record TimesheetRow(
    LocalDate date,
    String project,
    String task,
    String taskDescription,
    String status,
    String remark) {}
