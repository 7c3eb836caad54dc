package ai.docindexer.api.models.response;

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
public class IndexDocumentsResponse extends ApiResponse {
  @Builder
  @Getter
  @AllArgsConstructor
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class IndexingResult {
    String key;
    boolean status;
    String errorMessage;
    int statusCode;
  }

  private List<IndexingResult> value;
}
