package ai.docindexer.indexing.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Terminal result of processing one source file. */
@Builder(toBuilder = true)
@Value
public class FileOutcome {
  @NonNull String fileId;
  @NonNull FileState state;
  long recordsTotal;
  long recordsSucceeded;
  // rejected by validation plus failed on upload
  long recordsFailed;
  @Builder.Default List<IndexingFailure> failures = ImmutableList.of();

  public boolean isCommitted() {
    return state == FileState.COMMITTED;
  }

  public static FileOutcome failed(String fileId, IndexingFailure failure) {
    return FileOutcome.builder()
        .fileId(fileId)
        .state(FileState.FILE_FAILED)
        .failures(ImmutableList.of(failure))
        .build();
  }

  public static FileOutcome skipped(String fileId) {
    return FileOutcome.builder().fileId(fileId).state(FileState.SKIPPED).build();
  }
}
