package ai.docindexer.indexing;

import ai.docindexer.exceptions.CheckpointException;
import ai.docindexer.indexing.models.Checkpoint;
import ai.docindexer.indexing.models.FileOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable record of the source files whose records have all reached a terminal state. The file is
 * replaced atomically on every advance, so a crash leaves either the previous or the next
 * checkpoint on disk and never a partial one.
 */
@Slf4j
public class CheckpointStore {
  private final Path checkpointPath;
  private final Clock clock;
  private final ObjectMapper mapper;
  private final Object writeLock = new Object();
  private volatile Checkpoint checkpoint = Checkpoint.initial();

  public CheckpointStore(@Nonnull Path checkpointPath) {
    this(checkpointPath, Clock.systemUTC());
  }

  public CheckpointStore(@Nonnull Path checkpointPath, @Nonnull Clock clock) {
    this.checkpointPath = checkpointPath;
    this.clock = clock;
    this.mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  /** Reads the checkpoint file. A missing file means nothing has been processed yet. */
  public Checkpoint load() {
    synchronized (writeLock) {
      if (!Files.exists(checkpointPath)) {
        log.info("No checkpoint at {}, starting from scratch", checkpointPath);
        checkpoint = Checkpoint.initial();
        return checkpoint;
      }
      Checkpoint loaded;
      try {
        loaded = mapper.readValue(checkpointPath.toFile(), Checkpoint.class);
      } catch (IOException e) {
        throw new CheckpointException("Checkpoint file " + checkpointPath + " is corrupt", e);
      }
      if (loaded.getVersion() != Checkpoint.CURRENT_VERSION) {
        throw new CheckpointException(
            String.format(
                "Checkpoint file %s has unsupported version %d, expected %d",
                checkpointPath, loaded.getVersion(), Checkpoint.CURRENT_VERSION));
      }
      checkpoint =
          loaded.toBuilder()
              .processedFiles(
                  Collections.unmodifiableSortedSet(new TreeSet<>(loaded.getProcessedFiles())))
              .build();
      log.info(
          "Loaded checkpoint from {} with {} processed files",
          checkpointPath,
          checkpoint.getProcessedFiles().size());
      return checkpoint;
    }
  }

  public boolean isProcessed(String fileId) {
    return checkpoint.getProcessedFiles().contains(fileId);
  }

  public Checkpoint current() {
    return checkpoint;
  }

  /**
   * Marks a committed file as processed and persists the result before returning. Advancing a
   * file that is already recorded changes nothing.
   */
  public Checkpoint advance(String fileId, FileOutcome outcome) {
    Preconditions.checkArgument(
        fileId.equals(outcome.getFileId()), "Outcome belongs to %s", outcome.getFileId());
    Preconditions.checkArgument(
        outcome.isCommitted(), "File %s is not committed: %s", fileId, outcome.getState());
    synchronized (writeLock) {
      if (checkpoint.getProcessedFiles().contains(fileId)) {
        return checkpoint;
      }
      SortedSet<String> processedFiles = new TreeSet<>(checkpoint.getProcessedFiles());
      processedFiles.add(fileId);
      Checkpoint next =
          checkpoint.toBuilder()
              .processedFiles(Collections.unmodifiableSortedSet(processedFiles))
              .counters(checkpoint.getCounters().plus(outcome))
              .updatedAt(clock.instant())
              .build();
      write(next);
      checkpoint = next;
      return next;
    }
  }

  private void write(Checkpoint next) {
    Path target = checkpointPath.toAbsolutePath();
    Path directory = target.getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
      mapper.writeValue(temp.toFile(), next);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported for {}, replacing in place", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new CheckpointException("Failed to write checkpoint " + target, e);
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Failed to delete temporary checkpoint file {}", temp, e);
    }
  }
}
