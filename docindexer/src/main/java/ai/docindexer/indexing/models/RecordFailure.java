package ai.docindexer.indexing.models;

import lombok.Value;

@Value
public class RecordFailure {
  String id;
  ErrorCategory category;
  String reason;
}
