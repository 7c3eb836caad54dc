package ai.docindexer.indexing;

import ai.docindexer.api.RateLimitGate;
import ai.docindexer.api.RetryPolicy;
import ai.docindexer.api.Sleeper;
import ai.docindexer.backend.IndexBackend;
import ai.docindexer.exceptions.BatchRejectedException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.exceptions.TransientUploadException;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.metrics.IndexerMetrics;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends batches to the index backend, repeating transient failures with backoff.
 *
 * <p>Every outcome other than an authentication failure is returned as a {@link BatchOutcome}: a
 * batch that exhausts its attempts or is rejected outright comes back with all of its records
 * failed, so the caller can keep going. {@link FatalAuthException} is thrown and ends the run.
 * Once the run is aborted no further attempt is sent, and the batch comes back
 * {@link BatchOutcome#isInterrupted() interrupted} rather than failed.
 */
@Slf4j
public class BatchUploader {
  private final IndexBackend indexBackend;
  private final RetryPolicy retryPolicy;
  private final RateLimitGate rateLimitGate;
  private final Sleeper sleeper;
  private final RunControl runControl;
  private final IndexerMetrics indexerMetrics;
  private final Duration callTimeout;

  public BatchUploader(
      @Nonnull IndexBackend indexBackend,
      @Nonnull RetryPolicy retryPolicy,
      @Nonnull RateLimitGate rateLimitGate,
      @Nonnull Sleeper sleeper,
      @Nonnull RunControl runControl,
      @Nonnull IndexerMetrics indexerMetrics,
      @Nonnull Duration callTimeout) {
    this.indexBackend = indexBackend;
    this.retryPolicy = retryPolicy;
    this.rateLimitGate = rateLimitGate;
    this.sleeper = sleeper;
    this.runControl = runControl;
    this.indexerMetrics = indexerMetrics;
    this.callTimeout = callTimeout;
  }

  public BatchOutcome upload(String indexName, Batch batch) {
    int attempt = 0;
    while (true) {
      if (runControl.isAborted()) {
        return stoppedByAbort(batch, attempt);
      }
      attempt++;
      Throwable failure;
      CompletableFuture<BatchOutcome> future = null;
      try {
        rateLimitGate.awaitClearance();
        if (runControl.isAborted()) {
          return stoppedByAbort(batch, attempt - 1);
        }
        long startNanos = System.nanoTime();
        future = indexBackend.uploadBatch(indexName, batch);
        BatchOutcome outcome = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        indexerMetrics.recordBatchUploadLatency(Duration.ofNanos(System.nanoTime() - startNanos));
        log.debug(
            "Uploaded batch {} of {}: {} succeeded, {} failed, attempt {}",
            batch.getSequence(),
            batch.getFileId(),
            outcome.getSucceeded().size(),
            outcome.getFailed().size(),
            attempt);
        return outcome.toBuilder().attempts(attempt).build();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Upload of batch {} of {} interrupted", batch.getSequence(), batch.getFileId());
        return BatchOutcome.interrupted(attempt);
      } catch (TimeoutException e) {
        future.cancel(true);
        failure =
            new TransientUploadException(
                String.format("Upload timed out after %d ms", callTimeout.toMillis()), e);
      } catch (ExecutionException | RuntimeException e) {
        failure = IndexingErrors.unwrap(e);
      }

      if (failure instanceof FatalAuthException) {
        throw (FatalAuthException) failure;
      }
      if (failure instanceof BatchRejectedException) {
        log.error(
            "Batch {} of {} rejected, not retrying: {}",
            batch.getSequence(),
            batch.getFileId(),
            failure.getMessage());
        return BatchOutcome.allFailed(
            batch, ErrorCategory.BATCH_REJECTED, failure.getMessage(), attempt);
      }
      if (!(failure instanceof TransientUploadException) && !(failure instanceof IOException)) {
        log.error(
            "Batch {} of {} failed unexpectedly", batch.getSequence(), batch.getFileId(), failure);
        return BatchOutcome.allFailed(
            batch, ErrorCategory.UNKNOWN, IndexingErrors.describe(failure), attempt);
      }

      long retryAfterMillis = 0;
      boolean rateLimited = false;
      if (failure instanceof TransientUploadException) {
        TransientUploadException transientFailure = (TransientUploadException) failure;
        retryAfterMillis = transientFailure.getRetryAfterMillis();
        rateLimited = transientFailure.isRateLimited();
      }
      long delayMillis = retryPolicy.delayForAttempt(attempt, retryAfterMillis);
      if (rateLimited) {
        // every worker holds off, not only the one that was throttled
        rateLimitGate.pauseFor(delayMillis);
      }
      if (!retryPolicy.canRetry(attempt)) {
        log.error(
            "Batch {} of {} failed after {} attempt(s): {}",
            batch.getSequence(),
            batch.getFileId(),
            attempt,
            failure.getMessage());
        return BatchOutcome.allFailed(
            batch, ErrorCategory.TRANSIENT_UPLOAD_ERROR, failure.getMessage(), attempt);
      }
      if (runControl.isAborted()) {
        return stoppedByAbort(batch, attempt);
      }

      log.warn(
          "Batch {} of {} failed on attempt {}: {}, retrying in {} ms",
          batch.getSequence(),
          batch.getFileId(),
          attempt,
          failure.getMessage(),
          delayMillis);
      indexerMetrics.incrementBatchRetryCounter();
      try {
        sleeper.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Retry of batch {} of {} interrupted", batch.getSequence(), batch.getFileId());
        return BatchOutcome.interrupted(attempt);
      }
    }
  }

  private static BatchOutcome stoppedByAbort(Batch batch, int attempts) {
    log.warn(
        "Run aborted, not sending batch {} of {} after {} attempt(s)",
        batch.getSequence(),
        batch.getFileId(),
        attempts);
    return BatchOutcome.interrupted(attempts);
  }
}
