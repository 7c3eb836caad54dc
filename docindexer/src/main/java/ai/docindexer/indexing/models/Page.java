package ai.docindexer.indexing.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Page {
  @JsonProperty("page_number")
  Integer pageNumber;

  @JsonProperty("page_metadata")
  @Builder.Default
  Map<String, Object> pageMetadata = Collections.emptyMap();

  // each chunk is a free-form field map; "chunk_position" orders it within the page
  @JsonProperty("chunks")
  @Builder.Default
  List<Map<String, Object>> chunks = Collections.emptyList();
}
