package com.worklog.backend.snapshot;

public class SnapshotStoreException extends RuntimeException {

  public SnapshotStoreException(String message) {
    super(message);
  }

  public SnapshotStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
