package com.worklog.backend.snapshot;

/**
 * A single unit of recorded work coming from one of the activity sources. Issue-tracker entries
 * report their project as {@link #source()}, source-control entries report their repository.
 */
public sealed interface ActivityEntry permits IssueEntry, VcsEntry {

  String source();

  String key();

  String summary();

  String description();
}
