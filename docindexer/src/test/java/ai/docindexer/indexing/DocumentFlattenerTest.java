package ai.docindexer.indexing;

import static ai.docindexer.TestFixtures.chunk;
import static ai.docindexer.TestFixtures.document;
import static ai.docindexer.TestFixtures.page;
import static org.junit.jupiter.api.Assertions.*;

import ai.docindexer.TestFixtures;
import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.indexing.models.Page;
import ai.docindexer.indexing.models.SourceDocument;
import ai.docindexer.indexing.models.SourceFile;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DocumentFlattenerTest {
  private final DocumentFlattener flattener = new DocumentFlattener(TestFixtures.chunkSchema());

  @Test
  void testFlattenTwoPagesInChunkOrder() {
    SourceDocument doc =
        document(
            "doc_1",
            page(1, chunk("content", "a"), chunk("content", "b")),
            page(2, chunk("content", "c")));

    List<FlatRecord> records = flattener.flatten(doc);

    assertEquals(
        Arrays.asList("doc_1_p1_c0", "doc_1_p1_c1", "doc_1_p2_c0"),
        records.stream().map(FlatRecord::getId).collect(Collectors.toList()));
    FlatRecord first = records.get(0);
    assertEquals("doc_1_p1_c0", first.get("id"));
    assertEquals("doc_1", first.get("doc_id"));
    assertEquals(1, first.get("page_number"));
    assertEquals(0, first.get("chunk_position"));
    assertEquals("Annual Report", first.get("title"));
    assertEquals("a", first.get("content"));
  }

  @Test
  void testChunksOrderedByDeclaredPosition() {
    SourceDocument doc =
        document(
            "doc_1",
            page(
                3,
                chunk("chunk_position", 2, "content", "third"),
                chunk("chunk_position", 0, "content", "first"),
                chunk("chunk_position", 1, "content", "second")));

    List<FlatRecord> records = flattener.flatten(doc);

    assertEquals(
        Arrays.asList("first", "second", "third"),
        records.stream().map(r -> r.get("content")).collect(Collectors.toList()));
    assertEquals("doc_1_p3_c2", records.get(2).getId());
  }

  @Test
  void testLaterSourcesWinOnNameCollision() {
    Map<String, Object> fileMetadata = new HashMap<>();
    fileMetadata.put("title", "file title");
    fileMetadata.put("source", "file source");
    fileMetadata.put("lang", "en");
    Page page =
        Page.builder()
            .pageNumber(1)
            .pageMetadata(chunk("title", "page title", "source", "page source"))
            .chunks(Collections.singletonList(chunk("title", "chunk title")))
            .build();
    SourceDocument doc =
        SourceDocument.builder()
            .docId("doc_9")
            .fileMetadata(fileMetadata)
            .pages(Collections.singletonList(page))
            .build();

    FlatRecord record = flattener.flatten(doc).get(0);

    assertEquals("chunk title", record.get("title"));
    assertEquals("page source", record.get("source"));
    assertEquals("en", record.get("lang"));
  }

  @Test
  void testSynthesizedFieldsOverrideChunkValues() {
    SourceDocument doc =
        document("doc_1", page(1, chunk("id", "spoofed", "doc_id", "other", "content", "x")));

    FlatRecord record = flattener.flatten(doc).get(0);

    assertEquals("doc_1_p1_c0", record.get("id"));
    assertEquals("doc_1", record.get("doc_id"));
  }

  @Test
  void testFlattenIsDeterministicAndDoesNotMutateInput() {
    Map<String, Object> chunk = chunk("chunk_position", 1, "content", "x");
    SourceDocument doc = document("doc_1", page(1, chunk, chunk("content", "y")));
    Map<String, Object> chunkBefore = new HashMap<>(chunk);

    List<FlatRecord> first = flattener.flatten(doc);
    List<FlatRecord> second = flattener.flatten(doc);

    assertEquals(first, second);
    assertEquals(chunkBefore, chunk);
    assertThrows(UnsupportedOperationException.class, () -> first.get(0).getFields().put("k", 1));
  }

  @Test
  void testEmptyPagesProduceNoRecords() {
    assertTrue(flattener.flatten(document("doc_1")).isEmpty());
    assertTrue(flattener.flatten(document("doc_1", page(1), page(2))).isEmpty());
  }

  @Test
  void testDuplicatePositionIsStructuralError() {
    SourceDocument doc =
        document(
            "doc_1",
            page(
                1,
                chunk("chunk_position", 0, "content", "a"),
                chunk("chunk_position", 0, "content", "b")));

    StructuralException exception =
        assertThrows(StructuralException.class, () -> flattener.flatten(doc));
    assertTrue(exception.getMessage().contains("page 1 position 0"));
  }

  @Test
  void testDeclaredPositionCollidingWithArrayIndex() {
    // second chunk falls back to array index 1, which the first chunk declared
    SourceDocument doc =
        document("doc_1", page(1, chunk("chunk_position", 1), chunk("content", "b")));

    assertThrows(StructuralException.class, () -> flattener.flatten(doc));
  }

  @Test
  void testStructuralErrors() {
    assertThrows(StructuralException.class, () -> flattener.flatten(null));
    assertThrows(
        StructuralException.class, () -> flattener.flatten(document(" ", page(1, chunk()))));
    Page pageWithoutNumber = Page.builder().chunks(Collections.singletonList(chunk())).build();
    assertThrows(
        StructuralException.class,
        () -> flattener.flatten(document("doc_1", pageWithoutNumber)));
    assertThrows(
        StructuralException.class,
        () -> flattener.flatten(document("doc_1", page(1, chunk("chunk_position", -1)))));
    assertThrows(
        StructuralException.class,
        () -> flattener.flatten(document("doc_1", page(1, chunk("chunk_position", 1.5)))));
    assertThrows(
        StructuralException.class,
        () -> flattener.flatten(document("doc_1", page(1, chunk("chunk_position", "first")))));
  }

  @Test
  void testRecordIdsDoNotCollideAcrossDocuments() {
    // doc ids that themselves look like suffixes still produce distinct ids
    String a = DocumentFlattener.recordId("doc_p1", 1, 0);
    String b = DocumentFlattener.recordId("doc", 1, 0);
    String c = DocumentFlattener.recordId("doc_p1_c0", 1, 0);

    assertEquals("doc_p1_p1_c0", a);
    assertNotEquals(a, b);
    assertNotEquals(a, c);
    assertNotEquals(b, c);
  }

  @Test
  void testFlattenFixtureDocument() {
    SourceDocument doc =
        new SourceDocumentReader()
            .read(
                SourceFile.builder()
                    .fileId("doc_1.json")
                    .path(TestFixtures.DOCUMENTS_DIR.resolve("doc_1.json"))
                    .build());

    List<FlatRecord> records = flattener.flatten(doc);

    assertEquals(3, records.size());
    assertEquals("doc_1_p2_c0", records.get(2).getId());
    assertEquals("2024-03-01T10:15:00", records.get(0).get("created_at"));
    assertNull(records.get(2).get("created_at"));
  }
}
