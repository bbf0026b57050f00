package com.worklog.backend.summary;

class SummarizationException extends RuntimeException {

  SummarizationException(String message) {
    super(message);
  }
}
