package ai.docindexer.config;

import ai.docindexer.config.models.common.SearchServiceConfig;
import ai.docindexer.config.models.configv1.IndexerConfig;

public interface Config {
  ConfigVersion getVersion();

  SearchServiceConfig getSearchServiceConfig();

  IndexerConfig getIndexerConfig();
}
