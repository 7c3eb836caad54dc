package ai.docindexer.indexing.models;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One chunk with its document and page metadata denormalized onto it. {@code fields} holds the
 * synthesized id under the schema key field name and keeps insertion order.
 */
@Builder
@Value
public class FlatRecord {
  @NonNull String id;
  @NonNull String docId;
  int pageNumber;
  int chunkPosition;
  @NonNull Map<String, Object> fields;

  public Object get(String fieldName) {
    return fields.get(fieldName);
  }
}
