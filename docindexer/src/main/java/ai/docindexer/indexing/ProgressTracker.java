package ai.docindexer.indexing;

import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.ProgressMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;

/** Live run counters. Snapshots are derived on demand and never persisted. */
public class ProgressTracker {
  private final Clock clock;
  private final AtomicLong filesTotal = new AtomicLong();
  private final AtomicLong filesDone = new AtomicLong();
  private final AtomicLong recordsTotal = new AtomicLong();
  private final AtomicLong recordsDone = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private volatile Instant startedAt;

  public ProgressTracker() {
    this(Clock.systemUTC());
  }

  public ProgressTracker(@Nonnull Clock clock) {
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public void start(long totalFiles) {
    startedAt = clock.instant();
    filesTotal.set(totalFiles);
  }

  /** Records flattened for a file; grows the record total as files are read. */
  public void addRecordsDiscovered(long count) {
    recordsTotal.addAndGet(count);
  }

  public void recordFileDone(FileOutcome outcome) {
    filesDone.incrementAndGet();
    recordsDone.addAndGet(outcome.getRecordsSucceeded() + outcome.getRecordsFailed());
    failures.addAndGet(outcome.getRecordsFailed());
    if (outcome.getRecordsTotal() == 0 && !outcome.getFailures().isEmpty()) {
      // file level failure with no records attached
      failures.incrementAndGet();
    }
  }

  public Duration elapsed() {
    return Duration.between(startedAt, clock.instant());
  }

  public ProgressMetrics snapshot() {
    Duration elapsed = elapsed();
    long done = recordsDone.get();
    long total = recordsTotal.get();
    double seconds = elapsed.toMillis() / 1000.0;
    double rate = seconds > 0 ? done / seconds : 0.0;
    Duration eta = null;
    if (rate > 0 && total >= done) {
      eta = Duration.ofMillis((long) ((total - done) / rate * 1000));
    }
    return ProgressMetrics.builder()
        .filesDone(filesDone.get())
        .filesTotal(filesTotal.get())
        .recordsDone(done)
        .recordsTotal(total)
        .failures(failures.get())
        .elapsed(elapsed)
        .recordsPerSecond(rate)
        .eta(eta)
        .build();
  }
}
