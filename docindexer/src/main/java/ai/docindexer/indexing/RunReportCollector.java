package ai.docindexer.indexing;

import ai.docindexer.indexing.IndexLifecycleManager.IndexState;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.IndexingFailure;
import ai.docindexer.indexing.models.RunReport;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Accumulates file outcomes from concurrent workers into the final report. */
public class RunReportCollector {
  private final int maxSamplesPerCategory;
  private final Object lock = new Object();

  private long filesDiscovered;
  private long filesSkipped;
  private long filesProcessed;
  private long filesFailed;
  private long recordsTotal;
  private long recordsSucceeded;
  private long recordsFailed;
  private final Map<ErrorCategory, Long> failureCounts = new EnumMap<>(ErrorCategory.class);
  private final Map<ErrorCategory, List<IndexingFailure>> failureSamples =
      new EnumMap<>(ErrorCategory.class);
  private final List<IndexingFailure> fileErrors = new ArrayList<>();

  public RunReportCollector(int maxSamplesPerCategory) {
    this.maxSamplesPerCategory = maxSamplesPerCategory;
  }

  public void recordDiscovery(long discovered, long skipped) {
    synchronized (lock) {
      filesDiscovered = discovered;
      filesSkipped = skipped;
    }
  }

  public void recordFileOutcome(FileOutcome outcome) {
    synchronized (lock) {
      switch (outcome.getState()) {
        case COMMITTED:
        case VALIDATED:
          filesProcessed++;
          break;
        case FILE_FAILED:
          filesFailed++;
          fileErrors.addAll(outcome.getFailures());
          break;
        default:
          // stopped part way; counted through its records only
          break;
      }
      recordsTotal += outcome.getRecordsTotal();
      recordsSucceeded += outcome.getRecordsSucceeded();
      recordsFailed += outcome.getRecordsFailed();
      for (IndexingFailure failure : outcome.getFailures()) {
        recordFailureLocked(failure);
      }
    }
  }

  private void recordFailureLocked(IndexingFailure failure) {
    failureCounts.merge(failure.getCategory(), 1L, Long::sum);
    List<IndexingFailure> samples =
        failureSamples.computeIfAbsent(failure.getCategory(), category -> new ArrayList<>());
    if (samples.size() < maxSamplesPerCategory) {
      samples.add(failure);
    }
  }

  public RunReport build(
      Duration elapsed,
      boolean dryRun,
      boolean cancelled,
      @Nullable IndexState indexState,
      @Nullable Throwable abortCause) {
    synchronized (lock) {
      Map<ErrorCategory, Long> counts = new EnumMap<>(failureCounts);
      ErrorCategory abortCategory = null;
      if (abortCause != null) {
        abortCategory = IndexingErrors.classify(abortCause);
        counts.merge(abortCategory, 1L, Long::sum);
      }
      ImmutableMap.Builder<ErrorCategory, List<IndexingFailure>> samples = ImmutableMap.builder();
      failureSamples.forEach((category, list) -> samples.put(category, ImmutableList.copyOf(list)));
      return RunReport.builder()
          .filesDiscovered(filesDiscovered)
          .filesSkipped(filesSkipped)
          .filesProcessed(filesProcessed)
          .filesFailed(filesFailed)
          .recordsTotal(recordsTotal)
          .recordsSucceeded(recordsSucceeded)
          .recordsFailed(recordsFailed)
          .elapsed(elapsed)
          .dryRun(dryRun)
          .cancelled(cancelled)
          .indexState(indexState)
          .abortCategory(abortCategory)
          .abortCause(abortCause == null ? null : IndexingErrors.describe(abortCause))
          .failureCounts(ImmutableMap.copyOf(counts))
          .failureSamples(samples.build())
          .fileErrors(ImmutableList.copyOf(fileErrors))
          .build();
    }
  }
}
