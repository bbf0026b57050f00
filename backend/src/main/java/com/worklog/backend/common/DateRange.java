package com.worklog.backend.common;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/** Inclusive calendar date range. */
public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    if (start == null || end == null) {
      throw new InvalidDateRangeException("start and end dates must be provided");
    }
    if (end.isBefore(start)) {
      throw new InvalidDateRangeException(
          "end date %s must not be before start date %s".formatted(end, start));
    }
  }

  public static DateRange of(LocalDate start, LocalDate end) {
    return new DateRange(start, end);
  }

  public static DateRange single(LocalDate date) {
    return new DateRange(date, date);
  }

  /** The {@code days} calendar days ending with {@code end}. */
  public static DateRange endingOn(LocalDate end, int days) {
    if (days < 1) {
      throw new InvalidDateRangeException("range must cover at least one day");
    }
    return new DateRange(end.minusDays(days - 1L), end);
  }

  public long lengthInDays() {
    return ChronoUnit.DAYS.between(start, end) + 1;
  }

  public List<LocalDate> ascendingDates() {
    List<LocalDate> dates = new ArrayList<>();
    for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
      dates.add(date);
    }
    return dates;
  }
}
