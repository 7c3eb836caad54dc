package ai.docindexer.indexing.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/** Ordered, size-bounded slice of valid records from one source file. */
@Value
public class Batch {
  String fileId;
  int sequence;
  ImmutableList<FlatRecord> records;

  public Batch(String fileId, int sequence, List<FlatRecord> records) {
    this.fileId = fileId;
    this.sequence = sequence;
    this.records = ImmutableList.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public List<String> recordIds() {
    return records.stream().map(FlatRecord::getId).collect(Collectors.toList());
  }
}
