package com.worklog.mcp.backend.jira;

class JiraClientException extends RuntimeException {

  JiraClientException(String message) {
    super(message);
  }

  JiraClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
