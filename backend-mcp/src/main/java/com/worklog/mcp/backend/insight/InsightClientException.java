package com.worklog.mcp.backend.insight;

class InsightClientException extends RuntimeException {

  InsightClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
