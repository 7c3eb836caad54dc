package ai.docindexer.indexing;

import ai.docindexer.exceptions.BatchRejectedException;
import ai.docindexer.exceptions.CheckpointException;
import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.exceptions.IndexLifecycleException;
import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.exceptions.TransientUploadException;
import ai.docindexer.indexing.models.ErrorCategory;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public final class IndexingErrors {
  private IndexingErrors() {}

  /** Strips the wrappers added by futures and executors. */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public static ErrorCategory classify(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof DiscoveryException) {
      return ErrorCategory.DISCOVERY_ERROR;
    } else if (cause instanceof StructuralException) {
      return ErrorCategory.STRUCTURAL_ERROR;
    } else if (cause instanceof FatalAuthException) {
      return ErrorCategory.FATAL_AUTH_ERROR;
    } else if (cause instanceof TransientUploadException
        || cause instanceof TimeoutException
        || cause instanceof IOException) {
      return ErrorCategory.TRANSIENT_UPLOAD_ERROR;
    } else if (cause instanceof BatchRejectedException) {
      return ErrorCategory.BATCH_REJECTED;
    } else if (cause instanceof IndexLifecycleException) {
      return ErrorCategory.INDEX_LIFECYCLE_ERROR;
    } else if (cause instanceof CheckpointException) {
      return ErrorCategory.CHECKPOINT_ERROR;
    }
    return ErrorCategory.UNKNOWN;
  }

  public static String describe(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
