package ai.docindexer.indexing;

import static org.junit.jupiter.api.Assertions.*;

import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.indexing.IndexLifecycleManager.IndexState;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.FileState;
import ai.docindexer.indexing.models.IndexingFailure;
import ai.docindexer.indexing.models.RunReport;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RunReportCollectorTest {
  private RunReportCollector collector;

  @BeforeEach
  void setUp() {
    collector = new RunReportCollector(2);
  }

  private static IndexingFailure failure(ErrorCategory category, String fileId, String recordId) {
    return IndexingFailure.builder()
        .category(category)
        .fileId(fileId)
        .recordId(recordId)
        .message("failed")
        .build();
  }

  private static FileOutcome committed(String fileId, long succeeded, IndexingFailure... failures) {
    return FileOutcome.builder()
        .fileId(fileId)
        .state(FileState.COMMITTED)
        .recordsTotal(succeeded + failures.length)
        .recordsSucceeded(succeeded)
        .recordsFailed(failures.length)
        .failures(ImmutableList.copyOf(failures))
        .build();
  }

  @Test
  void testCleanRun() {
    collector.recordDiscovery(3, 1);
    collector.recordFileOutcome(committed("a.json", 5));
    collector.recordFileOutcome(committed("b.json", 7));

    RunReport report =
        collector.build(Duration.ofSeconds(3), false, false, IndexState.EXISTING, null);

    assertEquals(3, report.getFilesDiscovered());
    assertEquals(1, report.getFilesSkipped());
    assertEquals(2, report.getFilesProcessed());
    assertEquals(12, report.getRecordsSucceeded());
    assertFalse(report.isAborted());
    assertFalse(report.hasDefects());
    assertEquals(0, report.exitCode());
    assertTrue(report.describe().contains("COMPLETED"));
    assertTrue(report.describe().contains("index: EXISTING"));
  }

  @Test
  void testRecordFailuresAreCountedAndSampled() {
    collector.recordFileOutcome(
        committed(
            "a.json",
            1,
            failure(ErrorCategory.VALIDATION_ERROR, "a.json", "r1"),
            failure(ErrorCategory.VALIDATION_ERROR, "a.json", "r2"),
            failure(ErrorCategory.VALIDATION_ERROR, "a.json", "r3"),
            failure(ErrorCategory.PARTIAL_BATCH_FAILURE, "a.json", "r4")));

    RunReport report = collector.build(Duration.ZERO, false, false, IndexState.CREATED, null);

    assertEquals(4, report.getRecordsFailed());
    assertEquals(3L, report.getFailureCounts().get(ErrorCategory.VALIDATION_ERROR));
    assertEquals(1L, report.getFailureCounts().get(ErrorCategory.PARTIAL_BATCH_FAILURE));
    assertEquals(2, report.getFailureSamples().get(ErrorCategory.VALIDATION_ERROR).size());
    assertTrue(report.hasDefects());
    assertEquals(1, report.exitCode());
  }

  @Test
  void testFileFailuresAreListed() {
    IndexingFailure structural = failure(ErrorCategory.STRUCTURAL_ERROR, "bad.json", null);
    collector.recordFileOutcome(FileOutcome.failed("bad.json", structural));

    RunReport report = collector.build(Duration.ZERO, false, false, null, null);

    assertEquals(1, report.getFilesFailed());
    assertEquals(ImmutableList.of(structural), report.getFileErrors());
    assertEquals(1, report.exitCode());
    assertTrue(report.describe().contains("file errors:"));
  }

  @Test
  void testAbortIsFatal() {
    collector.recordFileOutcome(committed("a.json", 5));

    RunReport report =
        collector.build(
            Duration.ZERO,
            false,
            false,
            IndexState.EXISTING,
            new FatalAuthException("HTTP 401 from service", 401));

    assertTrue(report.isAborted());
    assertEquals(ErrorCategory.FATAL_AUTH_ERROR, report.getAbortCategory());
    assertEquals("HTTP 401 from service", report.getAbortCause());
    assertEquals(1L, report.getFailureCounts().get(ErrorCategory.FATAL_AUTH_ERROR));
    assertEquals(2, report.exitCode());
    assertTrue(report.describe().contains("ABORTED"));
  }

  @Test
  void testCancelledRunHasDefects() {
    RunReport report = collector.build(Duration.ZERO, false, true, null, null);

    assertEquals(1, report.exitCode());
    assertTrue(report.describe().contains("CANCELLED"));
  }

  @Test
  void testDryRunIsMarked() {
    collector.recordFileOutcome(
        FileOutcome.builder()
            .fileId("a.json")
            .state(FileState.VALIDATED)
            .recordsTotal(4)
            .recordsSucceeded(4)
            .build());

    RunReport report = collector.build(Duration.ZERO, true, false, null, null);

    assertEquals(1, report.getFilesProcessed());
    assertTrue(report.isDryRun());
    assertTrue(report.describe().contains("(dry run)"));
  }
}
