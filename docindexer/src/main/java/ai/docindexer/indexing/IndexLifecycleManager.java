package ai.docindexer.indexing;

import ai.docindexer.backend.IndexBackend;
import ai.docindexer.backend.models.IndexDescription;
import ai.docindexer.exceptions.IndexLifecycleException;
import ai.docindexer.schema.FieldSchema;
import ai.docindexer.schema.FieldType;
import ai.docindexer.schema.IndexSchema;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Makes sure the target index exists before any upload. An existing index is never altered; a
 * layout that differs from the schema is reported and left as it is.
 */
@Slf4j
public class IndexLifecycleManager {
  private final IndexBackend indexBackend;

  public enum IndexState {
    CREATED,
    EXISTING,
    INCOMPATIBLE
  }

  @Inject
  public IndexLifecycleManager(@Nonnull IndexBackend indexBackend) {
    this.indexBackend = indexBackend;
  }

  /** Completes exceptionally with {@link IndexLifecycleException} when the backend fails. */
  public CompletableFuture<IndexState> ensure(IndexSchema schema) {
    String indexName = schema.getName();
    if (StringUtils.isBlank(indexName)) {
      CompletableFuture<IndexState> failed = new CompletableFuture<>();
      failed.completeExceptionally(
          new IndexLifecycleException("No index name configured or declared in the schema"));
      return failed;
    }
    return indexBackend
        .describeIndex(indexName)
        .thenCompose(existing -> resolveState(indexName, schema, existing))
        .exceptionally(
            throwable -> {
              Throwable cause = IndexingErrors.unwrap(throwable);
              if (cause instanceof IndexLifecycleException) {
                throw (IndexLifecycleException) cause;
              }
              throw new IndexLifecycleException(
                  String.format("Failed to ensure index %s: %s", indexName, cause.getMessage()),
                  cause);
            });
  }

  private CompletableFuture<IndexState> resolveState(
      String indexName, IndexSchema schema, Optional<IndexDescription> existing) {
    if (!existing.isPresent()) {
      log.info("Index {} not found, creating it from schema", indexName);
      return indexBackend.createIndex(indexName, schema).thenApply(ignored -> IndexState.CREATED);
    }
    List<String> mismatches = findMismatches(schema, existing.get());
    if (mismatches.isEmpty()) {
      log.info("Index {} exists and matches the schema", indexName);
      return CompletableFuture.completedFuture(IndexState.EXISTING);
    }
    for (String mismatch : mismatches) {
      log.warn("Index {} differs from schema: {}", indexName, mismatch);
    }
    return CompletableFuture.completedFuture(IndexState.INCOMPATIBLE);
  }

  @VisibleForTesting
  static List<String> findMismatches(IndexSchema schema, IndexDescription description) {
    List<String> mismatches = new ArrayList<>();
    for (FieldSchema field : schema.getFields()) {
      Optional<IndexDescription.DescribedField> described = description.getField(field.getName());
      if (!described.isPresent()) {
        mismatches.add(String.format("field %s is missing from the index", field.getName()));
        continue;
      }
      String indexType = described.get().getType();
      if (!field.getType().getEdmName().equalsIgnoreCase(indexType)) {
        mismatches.add(
            String.format(
                "field %s is %s in the index but %s in the schema",
                field.getName(), indexType, field.getType().getEdmName()));
      } else if (field.getType() == FieldType.FLOAT_VECTOR
          && !Objects.equals(field.getDimensions(), described.get().getDimensions())) {
        mismatches.add(
            String.format(
                "vector field %s has %s dimensions in the index but %s in the schema",
                field.getName(), described.get().getDimensions(), field.getDimensions()));
      }
    }
    for (IndexDescription.DescribedField described : description.getFields()) {
      if (!schema.hasField(described.getName())) {
        mismatches.add(
            String.format("index field %s is not declared in the schema", described.getName()));
      }
    }
    return mismatches;
  }
}
