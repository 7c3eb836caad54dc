package ai.docindexer.indexing.models;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** A recorded failure with enough context to trace it back to the upstream data. */
@Builder
@Value
public class IndexingFailure {
  @NonNull ErrorCategory category;
  @NonNull String fileId;
  @Nullable String recordId;
  @Nullable String field;
  String message;

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(category).append(" file=").append(fileId);
    if (recordId != null) {
      sb.append(" record=").append(recordId);
    }
    if (field != null) {
      sb.append(" field=").append(field);
    }
    return sb.append(": ").append(message).toString();
  }
}
