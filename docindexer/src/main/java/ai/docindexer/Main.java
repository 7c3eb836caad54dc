package ai.docindexer;

import static ai.docindexer.constants.IndexerConstants.EXIT_CODE_CLEAN;
import static ai.docindexer.constants.IndexerConstants.EXIT_CODE_FATAL;

import ai.docindexer.api.AsyncHttpClientWithRetry;
import ai.docindexer.cli_parser.CliParser;
import ai.docindexer.config.Config;
import ai.docindexer.config.ConfigLoader;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.exceptions.SchemaException;
import ai.docindexer.indexing.DocumentIndexingJob;
import ai.docindexer.indexing.RunControl;
import ai.docindexer.indexing.models.RunReport;
import ai.docindexer.metrics.MetricsModule;
import ai.docindexer.metrics.MetricsServer;
import ai.docindexer.schema.IndexSchema;
import ai.docindexer.schema.SchemaLoader;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class Main {
  // how long a shutdown signal waits for in-flight batches to finish
  private static final long SHUTDOWN_GRACE_PERIOD_SECONDS = 60;

  private DocumentIndexingJob job;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;
  private MetricsServer metricsServer;
  private RunControl runControl;
  private final CliParser parser;
  private final ConfigLoader configLoader;
  private final SchemaLoader schemaLoader;
  private final CountDownLatch runFinished = new CountDownLatch(1);

  public Main(CliParser parser, ConfigLoader configLoader, SchemaLoader schemaLoader) {
    this.parser = parser;
    this.configLoader = configLoader;
    this.schemaLoader = schemaLoader;
  }

  public static void main(String[] args) {
    Main main = new Main(new CliParser(), new ConfigLoader(), new SchemaLoader());
    System.exit(main.start(args));
  }

  /** Runs the indexer once and returns the process exit code. */
  public int start(String[] args) {
    log.info("Starting document indexer");
    Config config;
    IndexSchema schema;
    try {
      parser.parse(args);
      if (parser.isHelpRequested()) {
        return EXIT_CODE_CLEAN;
      }
      config =
          parser.applyOverrides(
              loadConfig(parser.getConfigFilePath(), parser.getConfigYamlString()));
      configLoader.validateConfig(config);
      schema = loadSchema(config.getIndexerConfig());
    } catch (ParseException e) {
      log.error("Failed to parse command line arguments", e);
      return EXIT_CODE_FATAL;
    } catch (SchemaException e) {
      log.error("Invalid schema: {}", e.getMessage(), e);
      return EXIT_CODE_FATAL;
    } catch (RuntimeException e) {
      log.error("Invalid configuration: {}", e.getMessage(), e);
      return EXIT_CODE_FATAL;
    }

    try {
      Injector injector =
          Guice.createInjector(new RuntimeModule(config, schema), new MetricsModule());
      job = injector.getInstance(DocumentIndexingJob.class);
      asyncHttpClientWithRetry = injector.getInstance(AsyncHttpClientWithRetry.class);
      metricsServer = injector.getInstance(MetricsServer.class);
      runControl = injector.getInstance(RunControl.class);
    } catch (RuntimeException e) {
      log.error("Failed to initialize the indexer", e);
      return EXIT_CODE_FATAL;
    }
    Runtime.getRuntime().addShutdownHook(new Thread(this::onShutdownSignal, "shutdown-hook"));

    try {
      RunReport report = job.runOnce();
      log.info("Run report:{}{}", System.lineSeparator(), report.describe());
      return report.exitCode();
    } catch (RuntimeException e) {
      log.error(e.getMessage(), e);
      return EXIT_CODE_FATAL;
    } finally {
      runFinished.countDown();
      shutdown();
    }
  }

  private Config loadConfig(String configFilePath, String configYamlString) {
    if (configFilePath != null) {
      return configLoader.loadConfigFromConfigFile(configFilePath);
    } else if (configYamlString != null) {
      return configLoader.loadConfigFromString(configYamlString);
    }
    log.info("No configuration provided, using command line options and environment");
    return configLoader.loadDefaultConfig();
  }

  /**
   * Loads the schema and settles the index name: the configured name wins over the one declared
   * in the schema file. Only dry runs may go without a name.
   */
  @VisibleForTesting
  IndexSchema loadSchema(IndexerConfig indexerConfig) {
    IndexSchema schema = schemaLoader.loadSchemaFromFile(Paths.get(indexerConfig.getSchemaPath()));
    String indexName = StringUtils.defaultIfBlank(indexerConfig.getIndexName(), schema.getName());
    if (StringUtils.isBlank(indexName)) {
      if (indexerConfig.isDryRun()) {
        return schema;
      }
      throw new IllegalArgumentException(
          "No index name: set indexName in the config or declare a name in the schema file");
    }
    return schema.withName(indexName);
  }

  private void onShutdownSignal() {
    if (runFinished.getCount() == 0) {
      return;
    }
    runControl.cancel();
    try {
      if (!runFinished.await(SHUTDOWN_GRACE_PERIOD_SECONDS, TimeUnit.SECONDS)) {
        log.warn(
            "Run did not stop within {}s of the shutdown signal", SHUTDOWN_GRACE_PERIOD_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @VisibleForTesting
  void shutdown() {
    asyncHttpClientWithRetry.shutdownScheduler();
    metricsServer.shutdown();
  }
}
