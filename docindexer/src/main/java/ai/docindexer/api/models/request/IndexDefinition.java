package ai.docindexer.api.models.request;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@Builder
public class IndexDefinition {
  @Getter @NonNull private final String name;
  @Getter @NonNull private final List<IndexField> fields;
  // vectorSearch, semantic and similar sections, serialized next to name and fields
  @Builder.Default private final Map<String, Object> settings = Collections.emptyMap();

  @JsonAnyGetter
  public Map<String, Object> settings() {
    return settings;
  }
}
