package com.worklog.backend.summary;

import java.time.LocalDate;

/**
 * Produces the remark text of a timesheet row. Implementations never throw: when summarisation
 * fails they return a fallback text that embeds the error and the beginning of both contexts.
 */
public interface ActivitySummarizer {

  String summarize(String issueContext, String vcsContext, LocalDate date);
}
