package com.worklog.backend.snapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable date-keyed storage of {@link DailySnapshot}s. Exactly one snapshot exists per date;
 * writes replace the whole record. Implementations throw {@link SnapshotStoreException} rather
 * than losing a write or returning partially read data.
 */
public interface SnapshotStore {

  void put(LocalDate date, DailySnapshot snapshot);

  Optional<DailySnapshot> get(LocalDate date);

  /** Dates in {@code [start, end]} that have a stored snapshot, ascending. */
  List<LocalDate> existsInRange(LocalDate start, LocalDate end);
}
