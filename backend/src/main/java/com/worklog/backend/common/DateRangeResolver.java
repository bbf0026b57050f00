package com.worklog.backend.common;

import com.worklog.backend.config.TimesheetProperties;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Turns optional request bounds into a validated range. */
@Component
public class DateRangeResolver {

  private final Clock clock;
  private final int defaultRangeDays;
  private final int maxRangeDays;

  @Autowired
  public DateRangeResolver(TimesheetProperties properties) {
    this(Clock.systemDefaultZone(), properties.getDefaultRangeDays(), properties.getMaxRangeDays());
  }

  DateRangeResolver(Clock clock, int defaultRangeDays, int maxRangeDays) {
    this.clock = clock;
    this.defaultRangeDays = defaultRangeDays;
    this.maxRangeDays = maxRangeDays;
  }

  /**
   * A missing end defaults to today; a missing start to {@code defaultRangeDays} days ending on
   * the end date.
   */
  public DateRange resolve(LocalDate start, LocalDate end) {
    LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock);
    DateRange range =
        start != null
            ? DateRange.of(start, effectiveEnd)
            : DateRange.endingOn(effectiveEnd, defaultRangeDays);
    if (range.lengthInDays() > maxRangeDays) {
      throw new InvalidDateRangeException(
          "range of %d days exceeds the maximum of %d days"
              .formatted(range.lengthInDays(), maxRangeDays));
    }
    return range;
  }
}
