package ai.docindexer.backend;

import ai.docindexer.backend.models.IndexDescription;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.schema.IndexSchema;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Target index service. Uploads are insert-or-replace by record id, so sending the same batch
 * twice leaves the index as if it had been sent once.
 */
public interface IndexBackend {

  /** Empty when the index does not exist. */
  CompletableFuture<Optional<IndexDescription>> describeIndex(String indexName);

  CompletableFuture<Void> createIndex(String indexName, IndexSchema schema);

  /**
   * Sends one batch in a single call. Completes with the per-record outcome, or exceptionally
   * with {@link ai.docindexer.exceptions.TransientUploadException}, {@link
   * ai.docindexer.exceptions.FatalAuthException} or {@link
   * ai.docindexer.exceptions.BatchRejectedException}.
   */
  CompletableFuture<BatchOutcome> uploadBatch(String indexName, Batch batch);
}
