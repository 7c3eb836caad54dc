package ai.docindexer.indexing;

import static ai.docindexer.constants.IndexerConstants.CHUNK_POSITION_FIELD;
import static ai.docindexer.constants.IndexerConstants.DOC_ID_FIELD;
import static ai.docindexer.constants.IndexerConstants.PAGE_NUMBER_FIELD;
import static ai.docindexer.constants.IndexerConstants.RECORD_ID_FORMAT;

import ai.docindexer.exceptions.StructuralException;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.indexing.models.Page;
import ai.docindexer.indexing.models.SourceDocument;
import ai.docindexer.schema.IndexSchema;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Turns one hierarchical document into one record per chunk. Output order is page order, then
 * ascending chunk position; the same document always yields the same records.
 *
 * <p>Record fields are merged from the file metadata, the page metadata and the chunk, with later
 * sources winning on a name collision. The denormalized {@code doc_id}, {@code page_number} and
 * {@code chunk_position} values and the record id under the key field are applied last.
 */
public class DocumentFlattener {
  private final String keyFieldName;

  @Inject
  public DocumentFlattener(@Nonnull IndexSchema schema) {
    this(schema.getKeyField().getName());
  }

  public DocumentFlattener(@Nonnull String keyFieldName) {
    this.keyFieldName = keyFieldName;
  }

  public List<FlatRecord> flatten(SourceDocument document) {
    if (document == null) {
      throw new StructuralException("Document is empty");
    }
    String docId = document.getDocId();
    if (StringUtils.isBlank(docId)) {
      throw new StructuralException("Document has no doc_id");
    }

    List<Page> pages = document.getPages() == null ? Collections.emptyList() : document.getPages();
    Map<String, Object> fileMetadata = nullToEmpty(document.getFileMetadata());
    Set<Pair<Integer, Integer>> seenPositions = new HashSet<>();
    List<FlatRecord> records = new ArrayList<>();

    for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
      Page page = pages.get(pageIndex);
      if (page == null || page.getPageNumber() == null) {
        throw new StructuralException(
            String.format("Page at index %d of document %s has no page_number", pageIndex, docId));
      }
      int pageNumber = page.getPageNumber();
      Map<String, Object> pageMetadata = nullToEmpty(page.getPageMetadata());

      for (PositionedChunk chunk : orderChunks(docId, page)) {
        if (!seenPositions.add(Pair.of(pageNumber, chunk.getPosition()))) {
          throw new StructuralException(
              String.format(
                  "Document %s has more than one chunk at page %d position %d",
                  docId, pageNumber, chunk.getPosition()));
        }
        String recordId = recordId(docId, pageNumber, chunk.getPosition());

        Map<String, Object> fields = new LinkedHashMap<>(fileMetadata);
        fields.putAll(pageMetadata);
        fields.putAll(chunk.getFields());
        fields.put(DOC_ID_FIELD, docId);
        fields.put(PAGE_NUMBER_FIELD, pageNumber);
        fields.put(CHUNK_POSITION_FIELD, chunk.getPosition());
        fields.put(keyFieldName, recordId);

        records.add(
            FlatRecord.builder()
                .id(recordId)
                .docId(docId)
                .pageNumber(pageNumber)
                .chunkPosition(chunk.getPosition())
                .fields(Collections.unmodifiableMap(fields))
                .build());
      }
    }
    return Collections.unmodifiableList(records);
  }

  @VisibleForTesting
  static String recordId(String docId, int pageNumber, int chunkPosition) {
    return String.format(RECORD_ID_FORMAT, docId, pageNumber, chunkPosition);
  }

  private static List<PositionedChunk> orderChunks(String docId, Page page) {
    List<Map<String, Object>> chunks =
        page.getChunks() == null ? Collections.emptyList() : page.getChunks();
    List<PositionedChunk> positioned = new ArrayList<>(chunks.size());
    for (int index = 0; index < chunks.size(); index++) {
      Map<String, Object> chunk = chunks.get(index);
      if (chunk == null) {
        throw new StructuralException(
            String.format(
                "Chunk %d on page %d of document %s is empty", index, page.getPageNumber(), docId));
      }
      int position = chunkPosition(docId, page.getPageNumber(), chunk, index);
      positioned.add(new PositionedChunk(position, chunk));
    }
    // stable, so equal positions keep array order until the duplicate check rejects them
    positioned.sort(Comparator.comparingInt(PositionedChunk::getPosition));
    return positioned;
  }

  private static int chunkPosition(
      String docId, int pageNumber, Map<String, Object> chunk, int arrayIndex) {
    Object declared = chunk.get(CHUNK_POSITION_FIELD);
    if (declared == null) {
      return arrayIndex;
    }
    int position;
    try {
      position = new BigDecimal(declared.toString().trim()).intValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new StructuralException(
          String.format(
              "Chunk %d on page %d of document %s has a non-integral chunk_position: %s",
              arrayIndex, pageNumber, docId, declared));
    }
    if (position < 0) {
      throw new StructuralException(
          String.format(
              "Chunk %d on page %d of document %s has a negative chunk_position: %d",
              arrayIndex, pageNumber, docId, position));
    }
    return position;
  }

  private static Map<String, Object> nullToEmpty(Map<String, Object> map) {
    return map == null ? Collections.emptyMap() : map;
  }

  @Value
  private static class PositionedChunk {
    int position;
    Map<String, Object> fields;
  }
}
