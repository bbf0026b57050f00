package com.worklog.backend.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.worklog.backend.config.TimesheetProperties;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Stores each day as {@code <root>/<yyyy-MM-dd>.json}. */
@Component
public class FileSnapshotStore implements SnapshotStore {

  private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

  private final Path root;
  private final ObjectMapper objectMapper;

  @Autowired
  public FileSnapshotStore(TimesheetProperties properties) {
    this(properties.storeRootPath());
  }

  FileSnapshotStore(Path root) {
    this.root = Objects.requireNonNull(root, "root");
    this.objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      Files.createDirectories(root);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to create snapshot store root: " + root, ex);
    }
  }

  @Override
  public void put(LocalDate date, DailySnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (!snapshotDate(date).equals(snapshot.date())) {
      throw new IllegalArgumentException(
          "Snapshot date %s does not match key %s".formatted(snapshot.date(), date));
    }
    Path snapshotPath = snapshotPath(date);
    Path tempPath = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
    try {
      byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
      Files.write(tempPath, bytes);
      try {
        Files.move(
            tempPath,
            snapshotPath,
            StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tempPath, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug(
          "Stored snapshot {} ({} issues, {} vcs entries)",
          date,
          snapshot.issueEntries().size(),
          snapshot.vcsEntries().size());
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(tempPath);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw new SnapshotStoreException("Failed to persist snapshot %s".formatted(date), ex);
    }
  }

  @Override
  public Optional<DailySnapshot> get(LocalDate date) {
    Path snapshotPath = snapshotPath(date);
    if (!Files.exists(snapshotPath)) {
      return Optional.empty();
    }
    try {
      DailySnapshot snapshot =
          objectMapper.readValue(Files.readAllBytes(snapshotPath), DailySnapshot.class);
      return Optional.of(snapshot);
    } catch (IOException | RuntimeException ex) {
      throw new SnapshotStoreException("Failed to read snapshot %s".formatted(date), ex);
    }
  }

  @Override
  public List<LocalDate> existsInRange(LocalDate start, LocalDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    List<LocalDate> dates = new ArrayList<>();
    for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
      if (Files.exists(snapshotPath(date))) {
        dates.add(date);
      }
    }
    return dates;
  }

  private LocalDate snapshotDate(LocalDate date) {
    return Objects.requireNonNull(date, "date");
  }

  private Path snapshotPath(LocalDate date) {
    return root.resolve("%s.json".formatted(snapshotDate(date).format(DateTimeFormatter.ISO_LOCAL_DATE)));
  }
}
