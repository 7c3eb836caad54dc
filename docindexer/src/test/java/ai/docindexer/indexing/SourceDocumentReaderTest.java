package ai.docindexer.indexing;

import static org.junit.jupiter.api.Assertions.*;

import ai.docindexer.TestFixtures;
import ai.docindexer.exceptions.DiscoveryException;
import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.indexing.models.SourceDocument;
import ai.docindexer.indexing.models.SourceFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceDocumentReaderTest {
  private final SourceDocumentReader reader = new SourceDocumentReader();

  @TempDir Path tempDir;

  private SourceFile write(String name, String content) throws IOException {
    Path path = tempDir.resolve(name);
    Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    return SourceFile.builder().fileId(name).path(path).build();
  }

  @Test
  void testReadsDocument() {
    SourceDocument document =
        reader.read(
            SourceFile.builder()
                .fileId("doc_1.json")
                .path(TestFixtures.DOCUMENTS_DIR.resolve("doc_1.json"))
                .build());

    assertEquals("doc_1", document.getDocId());
    assertEquals("Annual Report", document.getFileMetadata().get("title"));
    assertEquals(2, document.getPages().size());
    assertEquals(2, document.getPages().get(0).getChunks().size());
  }

  @Test
  void testUnknownTopLevelKeysAreIgnored() throws IOException {
    SourceDocument document =
        reader.read(write("extra.json", "{\"doc_id\":\"d\",\"pages\":[],\"extractor\":\"v2\"}"));

    assertEquals("d", document.getDocId());
    assertTrue(document.getPages().isEmpty());
  }

  @Test
  void testInvalidJsonIsDiscoveryError() throws IOException {
    SourceFile broken = write("broken.json", "{\"doc_id\": \"d\", \"pages\": [");

    DiscoveryException exception =
        assertThrows(DiscoveryException.class, () -> reader.read(broken));
    assertTrue(exception.getMessage().contains("broken.json"));
  }

  @Test
  void testWrongShapeIsStructuralError() throws IOException {
    SourceFile wrongShape = write("shape.json", "{\"doc_id\":\"d\",\"pages\":\"none\"}");

    assertThrows(StructuralException.class, () -> reader.read(wrongShape));
  }

  @Test
  void testEmptyFileIsStructuralError() throws IOException {
    SourceFile empty = write("empty.json", "");

    assertThrows(StructuralException.class, () -> reader.read(empty));
  }

  @Test
  void testMissingFileIsDiscoveryError() {
    SourceFile missing =
        SourceFile.builder().fileId("gone.json").path(tempDir.resolve("gone.json")).build();

    assertThrows(DiscoveryException.class, () -> reader.read(missing));
  }
}
