package ai.docindexer.cli_parser;

import static org.junit.jupiter.api.Assertions.*;

import ai.docindexer.config.Config;
import ai.docindexer.config.models.common.SearchServiceConfig;
import ai.docindexer.config.models.configv1.ConfigV1;
import ai.docindexer.config.models.configv1.IndexerConfig;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

class CliParserTest {

  @Test
  void testParsePathOption() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {"-p", "config.yaml"};
    parser.parse(args);
    assertEquals("config.yaml", parser.getConfigFilePath());
    assertNull(parser.getConfigYamlString());
  }

  @Test
  void testParseConfigOption() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {"-c", "version: V1"};
    parser.parse(args);
    assertEquals("version: V1", parser.getConfigYamlString());
    assertNull(parser.getConfigFilePath());
  }

  @Test
  void testParseBothOptions() {
    CliParser parser = new CliParser();
    String[] args = {"-p", "config.yaml", "-c", "version: V1"};

    Exception exception = assertThrows(ParseException.class, () -> parser.parse(args));

    assertTrue(exception.getMessage().contains("Cannot specify both a file path and a config"));
  }

  @Test
  void testHelpOption() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {"-h"};
    parser.parse(args);
    assertTrue(parser.isHelpRequested());
  }

  @Test
  void testNoOptions() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {};
    parser.parse(args);
    assertFalse(parser.isHelpRequested());
    assertFalse(parser.isDryRun());
    assertNull(parser.getConfigFilePath());
    assertNull(parser.getConfigYamlString());
    assertNull(parser.getInputPath());
  }

  @Test
  void testParseIndexingOptions() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {
      "--input", "./extracted", "-s", "schema.json", "-n", "chunks", "--dry-run", "-r"
    };
    parser.parse(args);
    assertEquals("./extracted", parser.getInputPath());
    assertEquals("schema.json", parser.getSchemaPath());
    assertEquals("chunks", parser.getIndexName());
    assertTrue(parser.isDryRun());
  }

  @Test
  void testBatchSizeMustBePositive() {
    CliParser parser = new CliParser();

    Exception notANumber =
        assertThrows(ParseException.class, () -> parser.parse(new String[] {"-b", "many"}));
    assertTrue(notANumber.getMessage().contains("-b expects a positive integer"));
    assertThrows(ParseException.class, () -> parser.parse(new String[] {"-b", "0"}));
    assertThrows(ParseException.class, () -> parser.parse(new String[] {"-w", "-3"}));
  }

  @Test
  void testUnknownOption() {
    CliParser parser = new CliParser();
    assertThrows(ParseException.class, () -> parser.parse(new String[] {"--upload-everything"}));
  }

  @Test
  void testOverridesReplaceConfiguredValues() throws ParseException {
    Config config =
        ConfigV1.builder()
            .version("V1")
            .searchServiceConfig(SearchServiceConfig.builder().endpoint("https://s").build())
            .indexerConfig(
                IndexerConfig.builder()
                    .inputPath("./from-config")
                    .schemaPath("config-schema.json")
                    .batchSize(500)
                    .fileConcurrency(8)
                    .build())
            .build();
    CliParser parser = new CliParser();
    parser.parse(
        new String[] {
          "-i", "./from-cli", "-b", "50", "-g", "*_extraction.json", "-k", "state.json", "-r"
        });

    Config overridden = parser.applyOverrides(config);

    IndexerConfig indexerConfig = overridden.getIndexerConfig();
    assertEquals("./from-cli", indexerConfig.getInputPath());
    assertEquals("config-schema.json", indexerConfig.getSchemaPath());
    assertEquals(50, indexerConfig.getBatchSize());
    assertEquals(8, indexerConfig.getFileConcurrency());
    assertEquals("*_extraction.json", indexerConfig.getFilePattern());
    assertEquals("state.json", indexerConfig.getCheckpointPath());
    assertTrue(indexerConfig.isRecursive());
    assertFalse(indexerConfig.isDryRun());
    assertEquals("https://s", overridden.getSearchServiceConfig().getEndpoint());
    // the loaded config is left as it was
    assertEquals("./from-config", config.getIndexerConfig().getInputPath());
  }
}
