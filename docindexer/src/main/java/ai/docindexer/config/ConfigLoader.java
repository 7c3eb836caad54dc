package ai.docindexer.config;

import static ai.docindexer.constants.ApiConstants.SEARCH_API_KEY_ENV_KEYS;
import static ai.docindexer.constants.ApiConstants.SEARCH_API_VERSION_ENV_KEYS;
import static ai.docindexer.constants.ApiConstants.SEARCH_ENDPOINT_ENV_KEYS;

import ai.docindexer.config.models.common.SearchServiceConfig;
import ai.docindexer.config.models.configv1.ConfigV1;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.env.EnvironmentLookupProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;

public class ConfigLoader {
  private static final String DEFAULT_CONFIG_YAML = "version: V1\nindexerConfig: {}\n";
  private final ObjectMapper MAPPER;
  private final EnvironmentLookupProvider environmentLookupProvider;

  @Inject
  public ConfigLoader(@NonNull EnvironmentLookupProvider environmentLookupProvider) {
    this.MAPPER = new ObjectMapper(new YAMLFactory());
    MAPPER.registerModule(new Jdk8Module());
    this.environmentLookupProvider = environmentLookupProvider;
  }

  public ConfigLoader() {
    this(new EnvironmentLookupProvider.System());
  }

  public Config loadConfigFromConfigFile(String configFilePath) {
    try (InputStream in = Files.newInputStream(Paths.get(configFilePath))) {
      return loadConfigFromJsonNode(MAPPER.readTree(in));
    } catch (Exception e) {
      throw new RuntimeException("Failed to load config", e);
    }
  }

  /** Config for runs driven by command line options alone. */
  public Config loadDefaultConfig() {
    return loadConfigFromString(DEFAULT_CONFIG_YAML);
  }

  public Config loadConfigFromString(String configYaml) {
    try {
      return loadConfigFromJsonNode(MAPPER.readTree(configYaml));
    } catch (Exception e) {
      throw new RuntimeException("Failed to load config", e);
    }
  }

  private Config loadConfigFromJsonNode(JsonNode jsonNode) throws IOException {
    if (jsonNode == null || !jsonNode.hasNonNull("version")) {
      throw new IllegalArgumentException("Config is missing 'version'");
    }
    ConfigVersion version = ConfigVersion.valueOf(jsonNode.get("version").asText());
    switch (version) {
      case V1:
        ConfigV1 configV1 = MAPPER.treeToValue(jsonNode, ConfigV1.class);
        SearchServiceConfig searchServiceConfig = configV1.getSearchServiceConfig();
        if (StringUtils.isNotBlank(searchServiceConfig.getFile())) {
          String searchServiceConfigFileContent =
              new String(Files.readAllBytes(Paths.get(searchServiceConfig.getFile())));
          SearchServiceConfig searchServiceConfigFromFile =
              MAPPER.readValue(searchServiceConfigFileContent, SearchServiceConfig.class);
          searchServiceConfig.setEndpoint(searchServiceConfigFromFile.getEndpoint());
          searchServiceConfig.setApiKey(searchServiceConfigFromFile.getApiKey());
          if (StringUtils.isNotBlank(searchServiceConfigFromFile.getApiVersion())) {
            searchServiceConfig.setApiVersion(searchServiceConfigFromFile.getApiVersion());
          }
        }
        applyEnvironmentFallbacks(searchServiceConfig);
        return configV1;
      default:
        throw new UnsupportedOperationException("Unsupported config version: " + version);
    }
  }

  private void applyEnvironmentFallbacks(SearchServiceConfig searchServiceConfig) {
    if (StringUtils.isBlank(searchServiceConfig.getEndpoint())) {
      searchServiceConfig.setEndpoint(
          environmentLookupProvider.getFirstValue(SEARCH_ENDPOINT_ENV_KEYS));
    }
    if (StringUtils.isBlank(searchServiceConfig.getApiKey())) {
      searchServiceConfig.setApiKey(
          environmentLookupProvider.getFirstValue(SEARCH_API_KEY_ENV_KEYS));
    }
    if (StringUtils.isBlank(searchServiceConfig.getApiVersion())) {
      searchServiceConfig.setApiVersion(
          environmentLookupProvider.getFirstValue(SEARCH_API_VERSION_ENV_KEYS));
    }
  }

  /**
   * Checks the fully resolved config, after command line overrides. Search service credentials
   * are only required when documents are actually uploaded.
   */
  public void validateConfig(Config config) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    List<String> missingFields = new ArrayList<>();
    if (StringUtils.isBlank(indexerConfig.getInputPath())) {
      missingFields.add("inputPath");
    }
    if (StringUtils.isBlank(indexerConfig.getSchemaPath())) {
      missingFields.add("schemaPath");
    }
    if (!indexerConfig.isDryRun()) {
      SearchServiceConfig searchServiceConfig = config.getSearchServiceConfig();
      if (StringUtils.isBlank(searchServiceConfig.getEndpoint())) {
        missingFields.add("endpoint");
      }
      if (StringUtils.isBlank(searchServiceConfig.getApiKey())) {
        missingFields.add("apiKey");
      }
    }
    if (!missingFields.isEmpty()) {
      throw new IllegalArgumentException(
          String.format(
              "Missing config params: %s",
              missingFields.stream().reduce((a, b) -> a + ", " + b).orElse("")));
    }

    List<String> invalidFields = new ArrayList<>();
    if (indexerConfig.getBatchSize() <= 0) {
      invalidFields.add("batchSize");
    }
    if (indexerConfig.getFileConcurrency() <= 0) {
      invalidFields.add("fileConcurrency");
    }
    if (indexerConfig.getBatchConcurrency() <= 0) {
      invalidFields.add("batchConcurrency");
    }
    if (indexerConfig.getMaxUploadAttempts() <= 0) {
      invalidFields.add("maxUploadAttempts");
    }
    if (indexerConfig.getRetryBaseDelayMillis() < 0
        || indexerConfig.getMaxRetryDelayMillis() < indexerConfig.getRetryBaseDelayMillis()) {
      invalidFields.add("retryBaseDelayMillis/maxRetryDelayMillis");
    }
    if (indexerConfig.getRequestTimeoutSeconds() <= 0) {
      invalidFields.add("requestTimeoutSeconds");
    }
    if (!invalidFields.isEmpty()) {
      throw new IllegalArgumentException(
          String.format("Invalid config params: %s", String.join(", ", invalidFields)));
    }
  }
}
