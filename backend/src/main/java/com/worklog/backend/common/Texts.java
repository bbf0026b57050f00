package com.worklog.backend.common;

public final class Texts {

  private Texts() {}

  /** First {@code limit} characters of {@code value}; null becomes an empty string. */
  public static String truncate(String value, int limit) {
    if (value == null) {
      return "";
    }
    if (limit < 0 || value.length() <= limit) {
      return value;
    }
    return value.substring(0, limit);
  }
}
