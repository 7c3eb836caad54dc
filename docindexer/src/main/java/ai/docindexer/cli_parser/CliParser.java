package ai.docindexer.cli_parser;

import ai.docindexer.config.Config;
import ai.docindexer.config.models.configv1.ConfigV1;
import ai.docindexer.config.models.configv1.IndexerConfig;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public class CliParser {
  private static final String PATH_OPTION = "p";
  private static final String CONFIG_OPTION = "c";
  private static final String INPUT_OPTION = "i";
  private static final String SCHEMA_OPTION = "s";
  private static final String INDEX_OPTION = "n";
  private static final String BATCH_SIZE_OPTION = "b";
  private static final String DRY_RUN_OPTION = "d";
  private static final String RECURSIVE_OPTION = "r";
  private static final String PATTERN_OPTION = "g";
  private static final String CHECKPOINT_OPTION = "k";
  private static final String CONCURRENCY_OPTION = "w";
  private static final String HELP_OPTION = "h";

  private String configFilePath;
  private String configYamlString;
  private String inputPath;
  private String schemaPath;
  private String indexName;
  private Integer batchSize;
  private boolean dryRun = false;
  private boolean recursive = false;
  private String filePattern;
  private String checkpointPath;
  private Integer fileConcurrency;
  private boolean helpRequested = false;

  public void parse(String[] args) throws ParseException {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(options, args);

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      helpRequested = true;
      formatter.printHelp("docindexer", options);
      return;
    }

    if (cmd.hasOption(PATH_OPTION) && cmd.hasOption(CONFIG_OPTION)) {
      throw new ParseException("Cannot specify both a file path and a config string.");
    }

    configFilePath = cmd.getOptionValue(PATH_OPTION);
    configYamlString = cmd.getOptionValue(CONFIG_OPTION);
    inputPath = cmd.getOptionValue(INPUT_OPTION);
    schemaPath = cmd.getOptionValue(SCHEMA_OPTION);
    indexName = cmd.getOptionValue(INDEX_OPTION);
    batchSize = parsePositiveInt(cmd, BATCH_SIZE_OPTION);
    dryRun = cmd.hasOption(DRY_RUN_OPTION);
    recursive = cmd.hasOption(RECURSIVE_OPTION);
    filePattern = cmd.getOptionValue(PATTERN_OPTION);
    checkpointPath = cmd.getOptionValue(CHECKPOINT_OPTION);
    fileConcurrency = parsePositiveInt(cmd, CONCURRENCY_OPTION);
  }

  private static Options buildOptions() {
    Options options = new Options();
    options.addOption(
        Option.builder(PATH_OPTION)
            .longOpt("path")
            .hasArg()
            .desc("The file path to the configuration file")
            .build());
    options.addOption(
        Option.builder(CONFIG_OPTION)
            .longOpt("config")
            .hasArg()
            .desc("The YAML configuration string")
            .build());
    options.addOption(
        Option.builder(INPUT_OPTION)
            .longOpt("input")
            .hasArg()
            .desc("Extracted document file, or directory of them")
            .build());
    options.addOption(
        Option.builder(SCHEMA_OPTION)
            .longOpt("schema")
            .hasArg()
            .desc("Index schema JSON file")
            .build());
    options.addOption(
        Option.builder(INDEX_OPTION)
            .longOpt("index")
            .hasArg()
            .desc("Target index name, overrides the name in the schema file")
            .build());
    options.addOption(
        Option.builder(BATCH_SIZE_OPTION)
            .longOpt("batch-size")
            .hasArg()
            .desc("Records per upload request")
            .build());
    options.addOption(
        Option.builder(DRY_RUN_OPTION)
            .longOpt("dry-run")
            .desc("Flatten and validate only; nothing is uploaded or checkpointed")
            .build());
    options.addOption(
        Option.builder(RECURSIVE_OPTION)
            .longOpt("recursive")
            .desc("Scan the input directory recursively")
            .build());
    options.addOption(
        Option.builder(PATTERN_OPTION)
            .longOpt("pattern")
            .hasArg()
            .desc("File name glob for directory scans, default *.json")
            .build());
    options.addOption(
        Option.builder(CHECKPOINT_OPTION)
            .longOpt("checkpoint")
            .hasArg()
            .desc("Checkpoint file path")
            .build());
    options.addOption(
        Option.builder(CONCURRENCY_OPTION)
            .longOpt("concurrency")
            .hasArg()
            .desc("Number of files processed in parallel")
            .build());
    options.addOption(
        Option.builder(HELP_OPTION).longOpt("help").desc("Display help information").build());
    return options;
  }

  private static Integer parsePositiveInt(CommandLine cmd, String option) throws ParseException {
    String value = cmd.getOptionValue(option);
    if (value == null) {
      return null;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw notPositiveInt(option, value);
    }
    if (parsed <= 0) {
      throw notPositiveInt(option, value);
    }
    return parsed;
  }

  private static ParseException notPositiveInt(String option, String value) {
    return new ParseException(
        String.format("Option -%s expects a positive integer, got '%s'", option, value));
  }

  /** Returns a copy of the config with every option given on the command line applied. */
  public Config applyOverrides(Config config) {
    ConfigV1 configV1 = (ConfigV1) config;
    IndexerConfig.IndexerConfigBuilder builder = configV1.getIndexerConfig().toBuilder();
    if (inputPath != null) {
      builder.inputPath(inputPath);
    }
    if (schemaPath != null) {
      builder.schemaPath(schemaPath);
    }
    if (indexName != null) {
      builder.indexName(indexName);
    }
    if (batchSize != null) {
      builder.batchSize(batchSize);
    }
    if (dryRun) {
      builder.dryRun(true);
    }
    if (recursive) {
      builder.recursive(true);
    }
    if (filePattern != null) {
      builder.filePattern(filePattern);
    }
    if (checkpointPath != null) {
      builder.checkpointPath(checkpointPath);
    }
    if (fileConcurrency != null) {
      builder.fileConcurrency(fileConcurrency);
    }
    return configV1.toBuilder().indexerConfig(builder.build()).build();
  }

  public boolean isHelpRequested() {
    return helpRequested;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }

  public String getConfigYamlString() {
    return configYamlString;
  }

  public String getInputPath() {
    return inputPath;
  }

  public String getSchemaPath() {
    return schemaPath;
  }

  public String getIndexName() {
    return indexName;
  }

  public boolean isDryRun() {
    return dryRun;
  }
}
