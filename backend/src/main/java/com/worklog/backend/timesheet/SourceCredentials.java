package com.worklog.backend.timesheet;

/** Identifies whose activity to fetch from each source. */
public record SourceCredentials(String jiraProjectKey, String githubUsername) {}
