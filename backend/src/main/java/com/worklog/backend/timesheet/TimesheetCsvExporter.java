package com.worklog.backend.timesheet;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.worklog.backend.timesheet.api.EmployeeDetails;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Writes timesheet rows as CSV with a fixed column order. */
@Component
public class TimesheetCsvExporter {

  static final List<String> COLUMNS =
      List.of(
          "Employee Id",
          "Employee Name",
          "Date",
          "Project",
          "Task",
          "Task Description",
          "Authorized Hours",
          "Billable",
          "Role",
          "Site",
          "Status",
          "Remark");

  private final CsvMapper mapper = new CsvMapper();
  private final CsvSchema schema;

  public TimesheetCsvExporter() {
    // quote only values holding separators, quotes or line breaks
    mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    CsvSchema.Builder builder = CsvSchema.builder();
    COLUMNS.forEach(builder::addColumn);
    this.schema = builder.setUseHeader(true).build();
  }

  public byte[] export(List<TimesheetRow> rows, EmployeeDetails employee) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (SequenceWriter writer = mapper.writer(schema).writeValues(out)) {
      for (TimesheetRow row : rows) {
        writer.write(toRecord(row, employee));
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write timesheet CSV", ex);
    }
    return out.toByteArray();
  }

  private Map<String, String> toRecord(TimesheetRow row, EmployeeDetails employee) {
    Map<String, String> record = new LinkedHashMap<>();
    record.put("Employee Id", employee.employeeId());
    record.put("Employee Name", employee.employeeName());
    record.put("Date", row.date().format(DateTimeFormatter.ISO_LOCAL_DATE));
    record.put("Project", row.project());
    record.put("Task", row.task());
    record.put("Task Description", row.taskDescription());
    record.put("Authorized Hours", employee.authorizedHours());
    record.put("Billable", employee.billable());
    record.put("Role", employee.role());
    record.put("Site", employee.site());
    record.put("Status", row.status());
    record.put("Remark", row.remark());
    return record;
  }
}
