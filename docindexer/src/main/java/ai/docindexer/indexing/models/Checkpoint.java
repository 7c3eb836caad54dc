package ai.docindexer.indexing.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Checkpoint implements Serializable {
  public static final int CURRENT_VERSION = 1;

  int version;
  @NonNull SortedSet<String> processedFiles;
  @NonNull Counters counters;
  Instant updatedAt;

  public static Checkpoint initial() {
    return Checkpoint.builder()
        .version(CURRENT_VERSION)
        .processedFiles(Collections.unmodifiableSortedSet(new TreeSet<>()))
        .counters(Counters.builder().build())
        .build();
  }

  @Builder(toBuilder = true)
  @Value
  @Jacksonized
  public static class Counters implements Serializable {
    long documents;
    long records;
    long failures;

    public Counters plus(FileOutcome outcome) {
      return toBuilder()
          .documents(documents + 1)
          .records(records + outcome.getRecordsSucceeded())
          .failures(failures + outcome.getRecordsFailed())
          .build();
    }
  }
}
