package com.worklog.backend.timesheet.controller;

import com.worklog.backend.common.DateRange;
import com.worklog.backend.common.DateRangeResolver;
import com.worklog.backend.config.TimesheetProperties;
import com.worklog.backend.timesheet.SourceCredentials;
import com.worklog.backend.timesheet.TimesheetAssembler;
import com.worklog.backend.timesheet.TimesheetCsvExporter;
import com.worklog.backend.timesheet.TimesheetRow;
import com.worklog.backend.timesheet.api.EmployeeDetails;
import com.worklog.backend.timesheet.api.TimesheetRequest;
import com.worklog.backend.timesheet.api.TimesheetResponse;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/timesheet")
public class TimesheetController {

  static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
  private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

  private final TimesheetAssembler assembler;
  private final TimesheetCsvExporter csvExporter;
  private final DateRangeResolver dateRangeResolver;
  private final TimesheetProperties properties;
  private final Clock clock = Clock.systemDefaultZone();

  public TimesheetController(
      TimesheetAssembler assembler,
      TimesheetCsvExporter csvExporter,
      DateRangeResolver dateRangeResolver,
      TimesheetProperties properties) {
    this.assembler = assembler;
    this.csvExporter = csvExporter;
    this.dateRangeResolver = dateRangeResolver;
    this.properties = properties;
  }

  @PostMapping("/generate")
  public TimesheetResponse generate(@Valid @RequestBody(required = false) TimesheetRequest request) {
    return new TimesheetResponse(assemble(orEmpty(request)));
  }

  @PostMapping("/export")
  public ResponseEntity<byte[]> export(
      @Valid @RequestBody(required = false) TimesheetRequest request) {
    TimesheetRequest effective = orEmpty(request);
    List<TimesheetRow> rows = assemble(effective);
    EmployeeDetails defaults = EmployeeDetails.defaults(properties.getEmployee());
    EmployeeDetails employee =
        effective.employee() != null ? effective.employee().orElse(defaults) : defaults;

    String filename = "timesheet_%s.csv".formatted(LocalDate.now(clock).format(FILE_DATE));
    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(csvExporter.export(rows, employee));
  }

  private List<TimesheetRow> assemble(TimesheetRequest request) {
    DateRange range = dateRangeResolver.resolve(request.start(), request.end());
    SourceCredentials credentials =
        new SourceCredentials(
            firstText(request.jiraProjectKey(), properties.getJiraProjectKey()),
            firstText(request.githubUsername(), properties.getGithubUsername()));
    return assembler.assemble(credentials, range);
  }

  private static TimesheetRequest orEmpty(TimesheetRequest request) {
    return request != null ? request : TimesheetRequest.empty();
  }

  private static String firstText(String value, String fallback) {
    return StringUtils.hasText(value) ? value.trim() : fallback;
  }
}
