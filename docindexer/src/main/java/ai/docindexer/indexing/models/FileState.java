package ai.docindexer.indexing.models;

/** Per-file processing states. COMMITTED, FILE_FAILED and SKIPPED are terminal. */
public enum FileState {
  DISCOVERED,
  LOADED,
  FLATTENED,
  VALIDATED,
  UPLOADING,
  COMMITTED,
  FILE_FAILED,
  // already in the checkpoint, or not started because the run was cancelled
  SKIPPED
}
