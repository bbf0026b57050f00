package com.worklog.backend.snapshot.controller;

import com.worklog.backend.common.DateRange;
import com.worklog.backend.common.DateRangeResolver;
import com.worklog.backend.snapshot.DailySnapshot;
import com.worklog.backend.snapshot.SnapshotStore;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/** Read access to stored snapshots, mainly to inspect raw source responses. */
@RestController
@RequestMapping("/api/snapshots")
public class SnapshotController {

  private final SnapshotStore snapshotStore;
  private final DateRangeResolver dateRangeResolver;

  public SnapshotController(SnapshotStore snapshotStore, DateRangeResolver dateRangeResolver) {
    this.snapshotStore = snapshotStore;
    this.dateRangeResolver = dateRangeResolver;
  }

  @GetMapping
  public List<LocalDate> listDates(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate end) {
    DateRange range = dateRangeResolver.resolve(start, end);
    return snapshotStore.existsInRange(range.start(), range.end());
  }

  @GetMapping("/{date}")
  public DailySnapshot getSnapshot(
      @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return snapshotStore
        .get(date)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "No snapshot stored for " + date));
  }
}
