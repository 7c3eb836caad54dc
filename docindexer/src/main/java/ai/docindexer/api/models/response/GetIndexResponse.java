package ai.docindexer.api.models.response;

import ai.docindexer.api.models.request.IndexField;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Builder
@Getter
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GetIndexResponse extends ApiResponse {
  private String name;
  private List<IndexField> fields;
}
