package ai.docindexer.config.models.configv1;

import ai.docindexer.config.Config;
import ai.docindexer.config.ConfigVersion;
import ai.docindexer.config.models.common.SearchServiceConfig;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
public class ConfigV1 implements Config {
  @NonNull private String version;

  // not needed for dry runs
  @Builder.Default
  private SearchServiceConfig searchServiceConfig = SearchServiceConfig.builder().build();

  @NonNull private IndexerConfig indexerConfig;

  @Override
  public ConfigVersion getVersion() {
    return ConfigVersion.valueOf(version);
  }
}
