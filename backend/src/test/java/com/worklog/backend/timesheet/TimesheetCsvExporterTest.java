package com.worklog.backend.timesheet;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.worklog.backend.timesheet.api.EmployeeDetails;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimesheetCsvExporterTest {

  private final TimesheetCsvExporter exporter = new TimesheetCsvExporter();
  private final EmployeeDetails employee =
      new EmployeeDetails("E-42", "Ann Lee", "8", "Yes", "Developer", "Offshore");

  @Test
  void writesHeaderInFixedColumnOrder() {
    List<TimesheetRow> rows =
        List.of(new TimesheetRow(LocalDate.of(2024, 5, 2), "Portal", "Export", "CSV", "Done", "Shipped"));

    String csv = new String(exporter.export(rows, employee), StandardCharsets.UTF_8);

    assertThat(csv.lines().findFirst().orElseThrow().replace("\"", ""))
        .isEqualTo(
            "Employee Id,Employee Name,Date,Project,Task,Task Description,Authorized Hours,"
                + "Billable,Role,Site,Status,Remark");
  }

  @Test
  void combinesEmployeeColumnsWithEachRow() throws IOException {
    List<TimesheetRow> rows =
        List.of(
            new TimesheetRow(
                LocalDate.of(2024, 5, 2), "Portal", "Export", "CSV", "Done", "Fixed paging, added tests"),
            new TimesheetRow(
                LocalDate.of(2024, 5, 1), "N/A", "N/A", "N/A", "N/A", "No activity found."));

    List<Map<String, String>> records = readBack(exporter.export(rows, employee));

    assertThat(records).hasSize(2);
    assertThat(records.get(0))
        .containsEntry("Employee Id", "E-42")
        .containsEntry("Employee Name", "Ann Lee")
        .containsEntry("Date", "2024-05-02")
        .containsEntry("Authorized Hours", "8")
        .containsEntry("Site", "Offshore")
        .containsEntry("Remark", "Fixed paging, added tests");
    assertThat(records.get(1)).containsEntry("Status", "N/A");
  }

  @Test
  void keepsMultiLineRemarksInOneCell() throws IOException {
    List<TimesheetRow> rows =
        List.of(
            new TimesheetRow(
                LocalDate.of(2024, 5, 2), "Portal", "Export", "CSV", "Done", "Line one\nLine \"two\""));

    List<Map<String, String>> records = readBack(exporter.export(rows, employee));

    assertThat(records).singleElement()
        .satisfies(record -> assertThat(record.get("Remark")).isEqualTo("Line one\nLine \"two\""));
  }

  private static List<Map<String, String>> readBack(byte[] csv) throws IOException {
    CsvMapper mapper = new CsvMapper();
    try (MappingIterator<Map<String, String>> iterator =
        mapper
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(csv)) {
      return iterator.readAll();
    }
  }
}
