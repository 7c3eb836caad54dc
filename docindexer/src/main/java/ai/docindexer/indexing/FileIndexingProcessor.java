package ai.docindexer.indexing;

import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FieldViolation;
import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.FileState;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.indexing.models.IndexingFailure;
import ai.docindexer.indexing.models.RecordFailure;
import ai.docindexer.indexing.models.SourceDocument;
import ai.docindexer.indexing.models.SourceFile;
import ai.docindexer.indexing.models.ValidationResult;
import ai.docindexer.metrics.IndexerMetrics;
import ai.docindexer.schema.IndexSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Carries one source file through load, flatten, validate and upload. Failures of the file itself
 * end in {@link FileState#FILE_FAILED}; failed records do not stop the file. Only an
 * authentication failure escapes, as {@link FatalAuthException}.
 */
@Slf4j
public class FileIndexingProcessor {
  private final SourceDocumentReader sourceDocumentReader;
  private final DocumentFlattener documentFlattener;
  private final RecordValidator recordValidator;
  private final BatchUploader batchUploader;
  private final IndexSchema schema;
  private final RunControl runControl;
  private final ProgressTracker progressTracker;
  private final IndexerMetrics indexerMetrics;
  private final int batchSize;
  private final int batchConcurrency;
  private final boolean dryRun;
  // only used when batchConcurrency > 1
  @Nullable private final ExecutorService batchExecutor;

  @Builder
  public FileIndexingProcessor(
      @Nonnull SourceDocumentReader sourceDocumentReader,
      @Nonnull DocumentFlattener documentFlattener,
      @Nonnull RecordValidator recordValidator,
      @Nonnull BatchUploader batchUploader,
      @Nonnull IndexSchema schema,
      @Nonnull RunControl runControl,
      @Nonnull ProgressTracker progressTracker,
      @Nonnull IndexerMetrics indexerMetrics,
      int batchSize,
      int batchConcurrency,
      boolean dryRun,
      @Nullable ExecutorService batchExecutor) {
    this.sourceDocumentReader = sourceDocumentReader;
    this.documentFlattener = documentFlattener;
    this.recordValidator = recordValidator;
    this.batchUploader = batchUploader;
    this.schema = schema;
    this.runControl = runControl;
    this.progressTracker = progressTracker;
    this.indexerMetrics = indexerMetrics;
    this.batchSize = batchSize;
    this.batchConcurrency = batchConcurrency;
    this.dryRun = dryRun;
    this.batchExecutor = batchExecutor;
  }

  public FileOutcome process(SourceFile sourceFile) {
    String fileId = sourceFile.getFileId();
    List<FlatRecord> records;
    try {
      SourceDocument document = sourceDocumentReader.read(sourceFile);
      log.debug("Loaded {} with doc_id {}", fileId, document.getDocId());
      records = documentFlattener.flatten(document);
    } catch (DiscoveryException e) {
      return fileFailed(fileId, ErrorCategory.DISCOVERY_ERROR, e);
    } catch (StructuralException e) {
      return fileFailed(fileId, ErrorCategory.STRUCTURAL_ERROR, e);
    }
    progressTracker.addRecordsDiscovered(records.size());

    List<FlatRecord> validRecords = new ArrayList<>(records.size());
    List<IndexingFailure> failures = new ArrayList<>();
    long rejectedRecords = 0;
    for (FlatRecord record : records) {
      ValidationResult result = recordValidator.validate(record, schema);
      if (result.isValid()) {
        validRecords.add(record);
        continue;
      }
      rejectedRecords++;
      for (FieldViolation violation : result.getErrors()) {
        log.warn(
            "Rejected record {} in {}, field {}: {}",
            record.getId(),
            fileId,
            violation.getField(),
            violation.getMessage());
      }
      failures.add(validationFailure(fileId, record, result.getErrors()));
    }
    indexerMetrics.incrementRecordsFailedCounter(ErrorCategory.VALIDATION_ERROR, rejectedRecords);

    if (dryRun) {
      log.info(
          "Dry run: {} has {} records, {} valid, {} rejected",
          fileId,
          records.size(),
          validRecords.size(),
          rejectedRecords);
      return FileOutcome.builder()
          .fileId(fileId)
          .state(FileState.VALIDATED)
          .recordsTotal(records.size())
          .recordsSucceeded(validRecords.size())
          .recordsFailed(rejectedRecords)
          .failures(ImmutableList.copyOf(failures))
          .build();
    }

    List<Batch> batches = toBatches(fileId, validRecords);
    List<BatchOutcome> batchOutcomes =
        uploadBatches(batches).stream()
            .filter(batchOutcome -> !batchOutcome.isInterrupted())
            .collect(Collectors.toList());
    boolean complete = batchOutcomes.size() == batches.size();

    long succeededRecords = 0;
    long failedUploads = 0;
    for (BatchOutcome batchOutcome : batchOutcomes) {
      succeededRecords += batchOutcome.getSucceeded().size();
      for (RecordFailure recordFailure : batchOutcome.getFailed()) {
        failedUploads++;
        indexerMetrics.incrementRecordsFailedCounter(recordFailure.getCategory(), 1);
        failures.add(
            IndexingFailure.builder()
                .category(recordFailure.getCategory())
                .fileId(fileId)
                .recordId(recordFailure.getId())
                .message(recordFailure.getReason())
                .build());
      }
    }
    indexerMetrics.incrementRecordsUploadedCounter(succeededRecords);

    FileState state = complete ? FileState.COMMITTED : FileState.UPLOADING;
    if (complete) {
      log.info(
          "Indexed {}: {} records, {} uploaded, {} failed",
          fileId,
          records.size(),
          succeededRecords,
          rejectedRecords + failedUploads);
    } else {
      log.warn(
          "Stopped {} after {} of {} batches, file will be retried on the next run",
          fileId,
          batchOutcomes.size(),
          batches.size());
    }
    return FileOutcome.builder()
        .fileId(fileId)
        .state(state)
        .recordsTotal(records.size())
        .recordsSucceeded(succeededRecords)
        .recordsFailed(rejectedRecords + failedUploads)
        .failures(ImmutableList.copyOf(failures))
        .build();
  }

  private List<Batch> toBatches(String fileId, List<FlatRecord> validRecords) {
    List<List<FlatRecord>> partitions = Lists.partition(validRecords, batchSize);
    List<Batch> batches = new ArrayList<>(partitions.size());
    for (int sequence = 0; sequence < partitions.size(); sequence++) {
      batches.add(new Batch(fileId, sequence, partitions.get(sequence)));
    }
    return batches;
  }

  /**
   * Uploads batches in order, up to batchConcurrency at a time. Stops starting new batches once
   * the run is cancelled or aborted, so the result may cover only a prefix of the batches, and
   * batches cut short by an abort come back interrupted.
   */
  private List<BatchOutcome> uploadBatches(List<Batch> batches) {
    String indexName = schema.getName();
    List<BatchOutcome> outcomes = new ArrayList<>(batches.size());
    if (batchConcurrency <= 1 || batchExecutor == null) {
      for (Batch batch : batches) {
        if (runControl.shouldStop()) {
          break;
        }
        BatchOutcome outcome = batchUploader.upload(indexName, batch);
        outcomes.add(outcome);
        if (outcome.isInterrupted()) {
          break;
        }
      }
      return outcomes;
    }

    for (List<Batch> window : Lists.partition(batches, batchConcurrency)) {
      if (runControl.shouldStop()) {
        break;
      }
      List<CompletableFuture<BatchOutcome>> inFlight =
          window.stream()
              .map(
                  batch ->
                      CompletableFuture.supplyAsync(
                          () -> batchUploader.upload(indexName, batch), batchExecutor))
              .collect(Collectors.toList());
      try {
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
      } catch (CompletionException e) {
        Throwable cause = IndexingErrors.unwrap(e);
        if (cause instanceof FatalAuthException) {
          throw (FatalAuthException) cause;
        }
        throw e;
      }
      inFlight.forEach(future -> outcomes.add(future.join()));
    }
    return outcomes;
  }

  /** One failure per rejected record, naming every field that failed. */
  private static IndexingFailure validationFailure(
      String fileId, FlatRecord record, List<FieldViolation> violations) {
    return IndexingFailure.builder()
        .category(ErrorCategory.VALIDATION_ERROR)
        .fileId(fileId)
        .recordId(record.getId())
        .field(
            violations.stream().map(FieldViolation::getField).collect(Collectors.joining(",")))
        .message(
            violations.stream()
                .map(FieldViolation::toString)
                .collect(Collectors.joining("; ")))
        .build();
  }

  private FileOutcome fileFailed(String fileId, ErrorCategory category, RuntimeException e) {
    log.error("Failed to index {}: {}", fileId, e.getMessage());
    return FileOutcome.failed(
        fileId,
        IndexingFailure.builder()
            .category(category)
            .fileId(fileId)
            .message(e.getMessage())
            .build());
  }
}
