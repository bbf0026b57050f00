package com.worklog.backend.common;

public class InvalidDateRangeException extends RuntimeException {

  public InvalidDateRangeException(String message) {
    super(message);
  }
}
