package ai.docindexer.indexing.models;

import static ai.docindexer.constants.IndexerConstants.EXIT_CODE_CLEAN;
import static ai.docindexer.constants.IndexerConstants.EXIT_CODE_DEFECTS;
import static ai.docindexer.constants.IndexerConstants.EXIT_CODE_FATAL;

import ai.docindexer.indexing.IndexLifecycleManager.IndexState;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class RunReport {
  long filesDiscovered;
  long filesSkipped;
  long filesProcessed;
  long filesFailed;
  long recordsTotal;
  long recordsSucceeded;
  long recordsFailed;
  Duration elapsed;
  boolean dryRun;
  boolean cancelled;
  @Nullable IndexState indexState;
  // set when the run was aborted by a run-fatal condition
  @Nullable ErrorCategory abortCategory;
  @Nullable String abortCause;
  @Builder.Default Map<ErrorCategory, Long> failureCounts = ImmutableMap.of();
  @Builder.Default Map<ErrorCategory, List<IndexingFailure>> failureSamples = ImmutableMap.of();
  @Builder.Default List<IndexingFailure> fileErrors = ImmutableList.of();

  public boolean isAborted() {
    return abortCategory != null;
  }

  public boolean hasDefects() {
    return filesFailed > 0 || recordsFailed > 0 || cancelled;
  }

  public int exitCode() {
    if (isAborted()) {
      return EXIT_CODE_FATAL;
    }
    return hasDefects() ? EXIT_CODE_DEFECTS : EXIT_CODE_CLEAN;
  }

  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "Run %s in %ds%n",
            isAborted() ? "ABORTED" : cancelled ? "CANCELLED" : "COMPLETED",
            elapsed == null ? 0 : elapsed.getSeconds()));
    if (isAborted()) {
      sb.append(String.format("  abort cause: %s - %s%n", abortCategory, abortCause));
    }
    if (indexState != null) {
      sb.append(String.format("  index: %s%n", indexState));
    }
    sb.append(
        String.format(
            "  files: discovered=%d skipped=%d processed=%d failed=%d%n",
            filesDiscovered, filesSkipped, filesProcessed, filesFailed));
    sb.append(
        String.format(
            "  records: total=%d succeeded=%d failed=%d%s%n",
            recordsTotal, recordsSucceeded, recordsFailed, dryRun ? " (dry run)" : ""));
    for (Map.Entry<ErrorCategory, Long> entry : failureCounts.entrySet()) {
      sb.append(String.format("  %s: %d%n", entry.getKey(), entry.getValue()));
      List<IndexingFailure> samples =
          failureSamples.getOrDefault(entry.getKey(), ImmutableList.of());
      for (IndexingFailure sample : samples) {
        sb.append("    - ").append(sample).append(System.lineSeparator());
      }
    }
    if (!fileErrors.isEmpty()) {
      sb.append("  file errors:").append(System.lineSeparator());
      for (IndexingFailure fileError : fileErrors) {
        sb.append("    - ").append(fileError).append(System.lineSeparator());
      }
    }
    return sb.toString();
  }
}
