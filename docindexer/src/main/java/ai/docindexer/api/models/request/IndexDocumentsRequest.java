package ai.docindexer.api.models.request;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Value
@Jacksonized
public class IndexDocumentsRequest {
  // each entry carries "@search.action" next to the document fields
  @NonNull List<Map<String, Object>> value;
}
