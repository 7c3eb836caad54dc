package ai.docindexer.indexing.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

@Builder(toBuilder = true)
@Value
public class BatchOutcome {
  @Builder.Default List<String> succeeded = ImmutableList.of();
  @Builder.Default List<RecordFailure> failed = ImmutableList.of();
  // attempts made for the batch, 0 when it was never sent
  int attempts;
  // cut short by an abort or interrupt before reaching a terminal outcome
  boolean interrupted;

  public static BatchOutcome allSucceeded(List<String> ids) {
    return BatchOutcome.builder().succeeded(ImmutableList.copyOf(ids)).attempts(1).build();
  }

  public static BatchOutcome allFailed(
      Batch batch, ErrorCategory category, String reason, int attempts) {
    return BatchOutcome.builder()
        .failed(
            batch.getRecords().stream()
                .map(record -> new RecordFailure(record.getId(), category, reason))
                .collect(ImmutableList.toImmutableList()))
        .attempts(attempts)
        .build();
  }

  public static BatchOutcome interrupted(int attempts) {
    return BatchOutcome.builder().attempts(attempts).interrupted(true).build();
  }

  public static BatchOutcome partial(List<String> succeeded, List<RecordFailure> failed) {
    return BatchOutcome.builder()
        .succeeded(ImmutableList.copyOf(succeeded))
        .failed(ImmutableList.copyOf(failed))
        .attempts(1)
        .build();
  }

  public boolean isFullySucceeded() {
    return failed.isEmpty();
  }

  public List<String> failedIds() {
    return failed.stream().map(RecordFailure::getId).collect(Collectors.toList());
  }
}
