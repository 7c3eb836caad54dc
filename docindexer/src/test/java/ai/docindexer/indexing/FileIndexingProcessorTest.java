package ai.docindexer.indexing;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.docindexer.TestFixtures;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.FileState;
import ai.docindexer.indexing.models.IndexingFailure;
import ai.docindexer.indexing.models.RecordFailure;
import ai.docindexer.indexing.models.SourceFile;
import ai.docindexer.metrics.IndexerMetrics;
import ai.docindexer.schema.IndexSchema;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FileIndexingProcessorTest {
  private static final String INDEX_NAME = "document-chunks";

  @Mock private BatchUploader batchUploader;
  @Mock private IndexerMetrics indexerMetrics;

  @TempDir Path tempDir;

  private IndexSchema schema;
  private RunControl runControl;
  private ProgressTracker progressTracker;
  private SourceFile doc1;

  @BeforeEach
  void setUp() {
    schema = TestFixtures.chunkSchema();
    runControl = new RunControl();
    progressTracker = new ProgressTracker();
    doc1 =
        SourceFile.builder()
            .fileId("doc_1.json")
            .path(TestFixtures.DOCUMENTS_DIR.resolve("doc_1.json"))
            .build();
  }

  private FileIndexingProcessor processor(
      int batchSize, int batchConcurrency, boolean dryRun, ExecutorService executor) {
    return FileIndexingProcessor.builder()
        .sourceDocumentReader(new SourceDocumentReader())
        .documentFlattener(new DocumentFlattener(schema))
        .recordValidator(new RecordValidator())
        .batchUploader(batchUploader)
        .schema(schema)
        .runControl(runControl)
        .progressTracker(progressTracker)
        .indexerMetrics(indexerMetrics)
        .batchSize(batchSize)
        .batchConcurrency(batchConcurrency)
        .dryRun(dryRun)
        .batchExecutor(executor)
        .build();
  }

  private FileIndexingProcessor processor(int batchSize) {
    return processor(batchSize, 1, false, null);
  }

  private SourceFile write(String name, String content) throws IOException {
    Path path = tempDir.resolve(name);
    Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    return SourceFile.builder().fileId(name).path(path).build();
  }

  private void uploadsSucceed() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenAnswer(
            invocation ->
                BatchOutcome.allSucceeded(invocation.<Batch>getArgument(1).recordIds()));
  }

  @Test
  void testFileIsBatchedAndCommitted() {
    uploadsSucceed();

    FileOutcome outcome = processor(2).process(doc1);

    assertEquals(FileState.COMMITTED, outcome.getState());
    assertEquals(3, outcome.getRecordsTotal());
    assertEquals(3, outcome.getRecordsSucceeded());
    assertEquals(0, outcome.getRecordsFailed());
    assertTrue(outcome.getFailures().isEmpty());

    ArgumentCaptor<Batch> batches = ArgumentCaptor.forClass(Batch.class);
    verify(batchUploader, times(2)).upload(eq(INDEX_NAME), batches.capture());
    assertEquals(0, batches.getAllValues().get(0).getSequence());
    assertEquals(
        Arrays.asList("doc_1_p1_c0", "doc_1_p1_c1"), batches.getAllValues().get(0).recordIds());
    assertEquals(
        Collections.singletonList("doc_1_p2_c0"), batches.getAllValues().get(1).recordIds());
    verify(indexerMetrics).incrementRecordsUploadedCounter(3);
    assertEquals(3, progressTracker.snapshot().getRecordsTotal());
  }

  @Test
  void testInvalidRecordsAreReportedAndSkipped() throws IOException {
    uploadsSucceed();
    SourceFile file =
        write(
            "mixed.json",
            "{\"doc_id\":\"mixed\",\"pages\":[{\"page_number\":1,\"chunks\":["
                + "{\"content\":\"ok\"},"
                + "{\"content\":\"short vector\",\"content_vector\":[0.1,0.2]}]}]}");

    FileOutcome outcome = processor(10).process(file);

    assertEquals(FileState.COMMITTED, outcome.getState());
    assertEquals(2, outcome.getRecordsTotal());
    assertEquals(1, outcome.getRecordsSucceeded());
    assertEquals(1, outcome.getRecordsFailed());
    IndexingFailure failure = outcome.getFailures().get(0);
    assertEquals(ErrorCategory.VALIDATION_ERROR, failure.getCategory());
    assertEquals("mixed_p1_c1", failure.getRecordId());
    assertEquals("content_vector", failure.getField());

    ArgumentCaptor<Batch> batch = ArgumentCaptor.forClass(Batch.class);
    verify(batchUploader).upload(eq(INDEX_NAME), batch.capture());
    assertEquals(Collections.singletonList("mixed_p1_c0"), batch.getValue().recordIds());
    verify(indexerMetrics).incrementRecordsFailedCounter(ErrorCategory.VALIDATION_ERROR, 1);
  }

  @Test
  void testRecordWithSeveralBadFieldsCountsOnce() throws IOException {
    uploadsSucceed();
    SourceFile file =
        write(
            "two_bad_fields.json",
            "{\"doc_id\":\"bad\",\"pages\":[{\"page_number\":1,\"chunks\":["
                + "{\"content\":\"x\",\"score\":\"high\",\"content_vector\":[0.1]}]}]}");

    FileOutcome outcome = processor(10).process(file);

    assertEquals(1, outcome.getRecordsFailed());
    assertEquals(1, outcome.getFailures().size());
    IndexingFailure failure = outcome.getFailures().get(0);
    assertEquals("bad_p1_c0", failure.getRecordId());
    assertEquals("score,content_vector", failure.getField());
    assertTrue(failure.getMessage().startsWith("score: "));
    assertTrue(failure.getMessage().contains("; content_vector: "));
    verify(batchUploader, never()).upload(any(), any());
  }

  @Test
  void testUploadFailuresAreRecorded() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenAnswer(
            invocation -> {
              Batch batch = invocation.getArgument(1);
              List<String> ids = batch.recordIds();
              return BatchOutcome.partial(
                  ids.subList(1, ids.size()),
                  Collections.singletonList(
                      new RecordFailure(
                          ids.get(0), ErrorCategory.PARTIAL_BATCH_FAILURE, "bad vector")));
            });

    FileOutcome outcome = processor(10).process(doc1);

    assertEquals(FileState.COMMITTED, outcome.getState());
    assertEquals(2, outcome.getRecordsSucceeded());
    assertEquals(1, outcome.getRecordsFailed());
    assertEquals(ErrorCategory.PARTIAL_BATCH_FAILURE, outcome.getFailures().get(0).getCategory());
    assertEquals("doc_1_p1_c0", outcome.getFailures().get(0).getRecordId());
    verify(indexerMetrics).incrementRecordsFailedCounter(ErrorCategory.PARTIAL_BATCH_FAILURE, 1);
  }

  @Test
  void testDryRunNeverUploads() {
    FileOutcome outcome = processor(2, 1, true, null).process(doc1);

    assertEquals(FileState.VALIDATED, outcome.getState());
    assertEquals(3, outcome.getRecordsSucceeded());
    verify(batchUploader, never()).upload(any(), any());
  }

  @Test
  void testUnreadableFileFails() throws IOException {
    SourceFile file = write("broken.json", "{\"doc_id\": ");

    FileOutcome outcome = processor(10).process(file);

    assertEquals(FileState.FILE_FAILED, outcome.getState());
    assertEquals(ErrorCategory.DISCOVERY_ERROR, outcome.getFailures().get(0).getCategory());
    verify(batchUploader, never()).upload(any(), any());
  }

  @Test
  void testMalformedDocumentFails() throws IOException {
    SourceFile file = write("no_id.json", "{\"pages\":[]}");

    FileOutcome outcome = processor(10).process(file);

    assertEquals(FileState.FILE_FAILED, outcome.getState());
    assertEquals(ErrorCategory.STRUCTURAL_ERROR, outcome.getFailures().get(0).getCategory());
    assertEquals("no_id.json", outcome.getFailures().get(0).getFileId());
  }

  @Test
  void testDocumentWithoutPagesCommitsEmpty() throws IOException {
    SourceFile file = write("empty_pages.json", "{\"doc_id\":\"e\",\"pages\":[]}");

    FileOutcome outcome = processor(10).process(file);

    assertEquals(FileState.COMMITTED, outcome.getState());
    assertEquals(0, outcome.getRecordsTotal());
    verify(batchUploader, never()).upload(any(), any());
  }

  @Test
  void testCancellationLeavesFileUncommitted() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenAnswer(
            invocation -> {
              runControl.cancel();
              return BatchOutcome.allSucceeded(invocation.<Batch>getArgument(1).recordIds());
            });

    FileOutcome outcome = processor(1).process(doc1);

    assertEquals(FileState.UPLOADING, outcome.getState());
    assertFalse(outcome.isCommitted());
    assertEquals(1, outcome.getRecordsSucceeded());
    verify(batchUploader, times(1)).upload(eq(INDEX_NAME), any());
  }

  @Test
  void testBatchCutShortByAbortLeavesFileUncommitted() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenAnswer(
            invocation -> BatchOutcome.allSucceeded(invocation.<Batch>getArgument(1).recordIds()))
        .thenAnswer(
            invocation -> {
              runControl.abort(new FatalAuthException("HTTP 401 elsewhere", 401));
              return BatchOutcome.interrupted(1);
            });

    FileOutcome outcome = processor(1).process(doc1);

    assertEquals(FileState.UPLOADING, outcome.getState());
    assertEquals(1, outcome.getRecordsSucceeded());
    assertEquals(0, outcome.getRecordsFailed());
    assertTrue(outcome.getFailures().isEmpty());
    verify(batchUploader, times(2)).upload(eq(INDEX_NAME), any());
  }

  @Test
  void testAuthFailureEscapes() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenThrow(new FatalAuthException("HTTP 401", 401));

    assertThrows(FatalAuthException.class, () -> processor(10).process(doc1));
  }

  @Test
  void testConcurrentBatchesKeepOrder() {
    uploadsSucceed();
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      FileOutcome outcome = processor(1, 2, false, executor).process(doc1);

      assertEquals(FileState.COMMITTED, outcome.getState());
      assertEquals(3, outcome.getRecordsSucceeded());
      verify(batchUploader, times(3)).upload(eq(INDEX_NAME), any());
      verify(indexerMetrics).incrementRecordsUploadedCounter(3);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testConcurrentAuthFailureEscapes() {
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenThrow(new FatalAuthException("HTTP 403", 403));
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      FatalAuthException exception =
          assertThrows(
              FatalAuthException.class, () -> processor(1, 2, false, executor).process(doc1));
      assertEquals(403, exception.getStatusCode());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testOutcomesFromEachBatchAreSummed() {
    List<Integer> sizes = Collections.synchronizedList(new ArrayList<>());
    when(batchUploader.upload(eq(INDEX_NAME), any()))
        .thenAnswer(
            invocation -> {
              Batch batch = invocation.getArgument(1);
              sizes.add(batch.size());
              return BatchOutcome.allSucceeded(batch.recordIds());
            });

    FileOutcome outcome = processor(2).process(doc1);

    assertEquals(Arrays.asList(2, 1), sizes);
    assertEquals(3, outcome.getRecordsSucceeded());
  }
}
