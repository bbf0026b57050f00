package com.worklog.backend.insight.controller;

import com.worklog.backend.common.DateRangeResolver;
import com.worklog.backend.insight.InsightsReport;
import com.worklog.backend.insight.ProductivityInsightsService;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/insights")
public class InsightController {

  private final ProductivityInsightsService insightsService;
  private final DateRangeResolver dateRangeResolver;

  public InsightController(
      ProductivityInsightsService insightsService, DateRangeResolver dateRangeResolver) {
    this.insightsService = insightsService;
    this.dateRangeResolver = dateRangeResolver;
  }

  @GetMapping
  public InsightsReport report(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate end) {
    return insightsService.analyze(dateRangeResolver.resolve(start, end));
  }
}
