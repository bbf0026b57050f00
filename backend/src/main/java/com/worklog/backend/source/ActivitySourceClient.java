package com.worklog.backend.source;

import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.VcsEntry;
import java.time.LocalDate;

/**
 * Fetches one day of activity from the issue tracker and the source-control history.
 * Implementations throw {@link SourceFetchException} on failure; callers decide how to degrade.
 */
public interface ActivitySourceClient {

  SourceFetchResult<IssueEntry> fetchIssues(String projectKey, LocalDate date);

  SourceFetchResult<VcsEntry> fetchVcsActivity(String username, LocalDate date);
}
