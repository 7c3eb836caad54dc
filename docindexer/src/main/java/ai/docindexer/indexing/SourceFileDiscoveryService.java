package ai.docindexer.indexing;

import ai.docindexer.config.Config;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.indexing.models.SourceFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;

/*
 * Finds the source files of a run. The input is either a single file or a directory scanned
 * for file names matching the configured glob. Results are sorted by file id, the path relative
 * to the input root with '/' separators.
 */
@Slf4j
public class SourceFileDiscoveryService {
  private final Path inputPath;
  private final String filePattern;
  private final boolean recursive;
  private final Path checkpointPath;

  @Inject
  public SourceFileDiscoveryService(@Nonnull Config config) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    this.inputPath = Paths.get(indexerConfig.getInputPath());
    this.filePattern = indexerConfig.getFilePattern();
    this.recursive = indexerConfig.isRecursive();
    this.checkpointPath =
        Paths.get(indexerConfig.getCheckpointPath()).toAbsolutePath().normalize();
  }

  public List<SourceFile> discoverFiles() {
    if (!Files.exists(inputPath)) {
      throw new DiscoveryException("Input path does not exist: " + inputPath);
    }
    if (Files.isRegularFile(inputPath)) {
      log.info("Input is a single file: {}", inputPath);
      return Collections.singletonList(
          SourceFile.builder()
              .fileId(inputPath.getFileName().toString())
              .path(inputPath)
              .build());
    }

    try (Stream<Path> paths = recursive ? Files.walk(inputPath) : Files.list(inputPath)) {
      List<SourceFile> files =
          paths
              .filter(Files::isRegularFile)
              .filter(this::matchesPattern)
              .filter(path -> !isCheckpointFile(path))
              .map(this::toSourceFile)
              .sorted(Comparator.comparing(SourceFile::getFileId))
              .collect(Collectors.toList());
      log.info(
          "Discovered {} files matching '{}' under {}{}",
          files.size(),
          filePattern,
          inputPath,
          recursive ? " (recursive)" : "");
      return files;
    } catch (IOException | UncheckedIOException e) {
      throw new DiscoveryException("Failed to list input directory " + inputPath, e);
    }
  }

  private boolean matchesPattern(Path path) {
    return FilenameUtils.wildcardMatch(
        path.getFileName().toString(), filePattern, IOCase.INSENSITIVE);
  }

  // the checkpoint and its temporary siblings may live inside the input directory
  private boolean isCheckpointFile(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    return absolute.getParent().equals(checkpointPath.getParent())
        && absolute.getFileName().toString().startsWith(checkpointPath.getFileName().toString());
  }

  private SourceFile toSourceFile(Path path) {
    String fileId = FilenameUtils.separatorsToUnix(inputPath.relativize(path).toString());
    return SourceFile.builder().fileId(fileId).path(path).build();
  }
}
