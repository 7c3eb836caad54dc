package ai.docindexer.indexing;

import static ai.docindexer.constants.IndexerConstants.MAX_FAILURE_SAMPLES_PER_CATEGORY;
import static ai.docindexer.constants.IndexerConstants.PROGRESS_LOG_INTERVAL_FILES;

import ai.docindexer.config.Config;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.exceptions.CheckpointException;
import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.indexing.IndexLifecycleManager.IndexState;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FileOutcome;
import ai.docindexer.indexing.models.FileState;
import ai.docindexer.indexing.models.IndexingFailure;
import ai.docindexer.indexing.models.RunReport;
import ai.docindexer.indexing.models.SourceFile;
import ai.docindexer.metrics.IndexerMetrics;
import ai.docindexer.schema.IndexSchema;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one indexing pass: discover source files, skip the ones already checkpointed, make sure
 * the index exists, then process the remaining files on a bounded worker pool. Each committed
 * file advances the checkpoint before the next progress report.
 */
@Slf4j
public class DocumentIndexingJob {
  private static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 30;

  private final SourceFileDiscoveryService sourceFileDiscoveryService;
  private final CheckpointStore checkpointStore;
  private final IndexLifecycleManager indexLifecycleManager;
  private final FileIndexingProcessor fileIndexingProcessor;
  private final ProgressTracker progressTracker;
  private final RunControl runControl;
  private final IndexerMetrics indexerMetrics;
  private final IndexSchema schema;
  private final boolean dryRun;
  private final int fileConcurrency;
  private final AtomicLong filesDone = new AtomicLong();

  @Inject
  public DocumentIndexingJob(
      @Nonnull SourceFileDiscoveryService sourceFileDiscoveryService,
      @Nonnull CheckpointStore checkpointStore,
      @Nonnull IndexLifecycleManager indexLifecycleManager,
      @Nonnull FileIndexingProcessor fileIndexingProcessor,
      @Nonnull ProgressTracker progressTracker,
      @Nonnull RunControl runControl,
      @Nonnull IndexerMetrics indexerMetrics,
      @Nonnull IndexSchema schema,
      @Nonnull Config config) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    this.sourceFileDiscoveryService = sourceFileDiscoveryService;
    this.checkpointStore = checkpointStore;
    this.indexLifecycleManager = indexLifecycleManager;
    this.fileIndexingProcessor = fileIndexingProcessor;
    this.progressTracker = progressTracker;
    this.runControl = runControl;
    this.indexerMetrics = indexerMetrics;
    this.schema = schema;
    this.dryRun = indexerConfig.isDryRun();
    this.fileConcurrency = indexerConfig.getFileConcurrency();
  }

  public RunReport runOnce() {
    log.info(
        "Starting indexing run into {}{}",
        schema.getName() == null ? "<unnamed index>" : schema.getName(),
        dryRun ? " (dry run)" : "");
    RunReportCollector collector = new RunReportCollector(MAX_FAILURE_SAMPLES_PER_CATEGORY);

    List<SourceFile> pendingFiles;
    try {
      checkpointStore.load();
      List<SourceFile> discoveredFiles = sourceFileDiscoveryService.discoverFiles();
      pendingFiles =
          discoveredFiles.stream()
              .filter(file -> !checkpointStore.isProcessed(file.getFileId()))
              .collect(Collectors.toList());
      collector.recordDiscovery(
          discoveredFiles.size(), (long) discoveredFiles.size() - pendingFiles.size());
      log.info(
          "{} files discovered, {} already processed, {} to go",
          discoveredFiles.size(),
          discoveredFiles.size() - pendingFiles.size(),
          pendingFiles.size());
    } catch (DiscoveryException | CheckpointException e) {
      log.error("Run aborted before processing any file: {}", e.getMessage(), e);
      return collector.build(progressTracker.elapsed(), dryRun, false, null, e);
    }
    indexerMetrics.setDiscoveredFiles(pendingFiles.size());
    progressTracker.start(pendingFiles.size());

    IndexState indexState = null;
    if (!dryRun) {
      try {
        indexState = indexLifecycleManager.ensure(schema).join();
      } catch (CompletionException e) {
        Throwable cause = IndexingErrors.unwrap(e);
        log.error("Index lifecycle failed: {}", cause.getMessage(), cause);
        return collector.build(progressTracker.elapsed(), dryRun, false, null, cause);
      }
    }

    processFiles(pendingFiles, collector);

    RunReport report =
        collector.build(
            progressTracker.elapsed(),
            dryRun,
            runControl.isCancelled(),
            indexState,
            runControl.getAbortCause().orElse(null));
    if (report.isAborted()) {
      log.error("Run aborted: {}", report.getAbortCause());
    } else {
      log.info("Run finished: {}", progressTracker.snapshot().describe());
    }
    return report;
  }

  private void processFiles(List<SourceFile> pendingFiles, RunReportCollector collector) {
    if (pendingFiles.isEmpty()) {
      return;
    }
    ExecutorService fileWorkers =
        Executors.newFixedThreadPool(
            fileConcurrency,
            new ThreadFactoryBuilder()
                .setNameFormat("file-indexer-%d")
                .setUncaughtExceptionHandler(
                    (thread, throwable) ->
                        log.error("Uncaught exception in thread {}", thread.getName(), throwable))
                .build());
    try {
      List<CompletableFuture<Void>> futures =
          pendingFiles.stream()
              .map(
                  file ->
                      CompletableFuture.runAsync(() -> processFile(file, collector), fileWorkers))
              .collect(Collectors.toList());
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    } finally {
      shutdownWorkers(fileWorkers);
    }
  }

  private void processFile(SourceFile sourceFile, RunReportCollector collector) {
    if (runControl.shouldStop()) {
      log.debug("Not starting {}, run is stopping", sourceFile.getFileId());
      return;
    }
    FileOutcome outcome;
    try {
      outcome = fileIndexingProcessor.process(sourceFile);
    } catch (FatalAuthException e) {
      runControl.abort(e);
      return;
    } catch (RuntimeException e) {
      log.error("Unexpected failure while indexing {}", sourceFile.getFileId(), e);
      outcome =
          FileOutcome.failed(
              sourceFile.getFileId(),
              IndexingFailure.builder()
                  .category(ErrorCategory.UNKNOWN)
                  .fileId(sourceFile.getFileId())
                  .message(IndexingErrors.describe(e))
                  .build());
    }

    if (outcome.isCommitted() && runControl.isAborted()) {
      // nothing is checkpointed after an abort, the next run redoes this file
      log.warn("Not checkpointing {}, run was aborted", sourceFile.getFileId());
      outcome = outcome.toBuilder().state(FileState.UPLOADING).build();
    }
    if (outcome.isCommitted() && !dryRun) {
      try {
        checkpointStore.advance(sourceFile.getFileId(), outcome);
      } catch (CheckpointException e) {
        runControl.abort(e);
      }
    }
    collector.recordFileOutcome(outcome);
    progressTracker.recordFileDone(outcome);
    emitFileMetrics(outcome);

    long done = filesDone.incrementAndGet();
    if (done % PROGRESS_LOG_INTERVAL_FILES == 0) {
      log.info("Progress: {}", progressTracker.snapshot().describe());
    }
  }

  private void emitFileMetrics(FileOutcome outcome) {
    if (outcome.getState() == FileState.FILE_FAILED) {
      ErrorCategory category =
          outcome.getFailures().isEmpty()
              ? ErrorCategory.UNKNOWN
              : outcome.getFailures().get(0).getCategory();
      indexerMetrics.incrementFileFailureCounter(category);
    } else if (outcome.isCommitted() || outcome.getState() == FileState.VALIDATED) {
      indexerMetrics.incrementFilesIndexedCounter();
    }
  }

  private static void shutdownWorkers(ExecutorService workers) {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("File workers did not stop within {}s", WORKER_SHUTDOWN_TIMEOUT_SECONDS);
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }
}
