package ai.docindexer.indexing.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Hierarchical document emitted by the extraction stage. Read-only to the indexer. */
@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceDocument {
  @JsonProperty("doc_id")
  String docId;

  @JsonProperty("file_metadata")
  @Builder.Default
  Map<String, Object> fileMetadata = Collections.emptyMap();

  @JsonProperty("pages")
  @Builder.Default
  List<Page> pages = Collections.emptyList();
}
