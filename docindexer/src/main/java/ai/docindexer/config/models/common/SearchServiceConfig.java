package ai.docindexer.config.models.common;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Setter
@Jacksonized
@EqualsAndHashCode
@ToString
public class SearchServiceConfig {
  // e.g. https://my-service.search.windows.net
  @Nullable private String endpoint;
  @ToString.Exclude @Nullable private String apiKey;
  @Nullable private String apiVersion;
  // optional yaml file holding endpoint and apiKey, takes precedence over inline values
  @Nullable private String file;
}
