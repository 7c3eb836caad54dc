package ai.docindexer.indexing;

import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.indexing.models.SourceDocument;
import ai.docindexer.indexing.models.SourceFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;

public class SourceDocumentReader {
  private final ObjectMapper mapper;

  public SourceDocumentReader() {
    this.mapper = new ObjectMapper();
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Parses one source file. Unreadable files and invalid JSON raise {@link DiscoveryException};
   * JSON that does not have the document shape, or no JSON at all, raises {@link
   * StructuralException}.
   */
  public SourceDocument read(SourceFile sourceFile) {
    JsonNode root;
    try (InputStream in = Files.newInputStream(sourceFile.getPath())) {
      root = mapper.readTree(in);
    } catch (JsonProcessingException e) {
      throw new DiscoveryException(
          String.format(
              "File %s is not valid JSON: %s", sourceFile.getFileId(), e.getOriginalMessage()),
          e);
    } catch (IOException e) {
      throw new DiscoveryException("Failed to read " + sourceFile.getFileId(), e);
    }

    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new StructuralException("File " + sourceFile.getFileId() + " is empty");
    }
    if (!root.isObject()) {
      throw new StructuralException(
          String.format(
              "File %s is not a document: expected an object, found %s",
              sourceFile.getFileId(), root.getNodeType()));
    }
    try {
      return mapper.treeToValue(root, SourceDocument.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new StructuralException(
          String.format("File %s is not a document: %s", sourceFile.getFileId(), e.getMessage()),
          e);
    }
  }
}
