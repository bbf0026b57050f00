package com.worklog.backend.timesheet.api;

import com.worklog.backend.timesheet.TimesheetRow;
import java.util.List;

public record TimesheetResponse(List<TimesheetRow> rows) {}
