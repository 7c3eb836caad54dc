package ai.docindexer.indexing;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared stop signals for a run. Cancellation is requested from outside (shutdown hook) and lets
 * in-flight batches finish; an abort is raised by a run-fatal failure inside the pipeline.
 */
@Slf4j
public class RunControl {
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final AtomicReference<Throwable> abortCause = new AtomicReference<>();

  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.warn("Cancellation requested, no new files or batches will be started");
    }
  }

  /** Returns true for the first abort only; later causes are dropped. */
  public boolean abort(Throwable cause) {
    if (abortCause.compareAndSet(null, cause)) {
      log.error("Aborting run: {}", cause.getMessage());
      return true;
    }
    return false;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public boolean isAborted() {
    return abortCause.get() != null;
  }

  public Optional<Throwable> getAbortCause() {
    return Optional.ofNullable(abortCause.get());
  }

  public boolean shouldStop() {
    return isCancelled() || isAborted();
  }
}
