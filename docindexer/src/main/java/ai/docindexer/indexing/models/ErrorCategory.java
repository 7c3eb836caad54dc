package ai.docindexer.indexing.models;

public enum ErrorCategory {
  DISCOVERY_ERROR,
  STRUCTURAL_ERROR,
  VALIDATION_ERROR,
  TRANSIENT_UPLOAD_ERROR,
  BATCH_REJECTED,
  PARTIAL_BATCH_FAILURE,
  FATAL_AUTH_ERROR,
  INDEX_LIFECYCLE_ERROR,
  CHECKPOINT_ERROR,
  UNKNOWN
}
