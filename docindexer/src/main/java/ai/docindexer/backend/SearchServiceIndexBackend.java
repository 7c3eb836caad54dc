package ai.docindexer.backend;

import static ai.docindexer.constants.ApiConstants.AUTH_FAILURE_STATUS_CODES;
import static ai.docindexer.constants.ApiConstants.MERGE_OR_UPLOAD_ACTION;
import static ai.docindexer.constants.ApiConstants.SEARCH_ACTION_KEY;
import static ai.docindexer.constants.ApiConstants.STATUS_NOT_FOUND;
import static ai.docindexer.constants.ApiConstants.STATUS_TOO_MANY_REQUESTS;

import ai.docindexer.api.SearchServiceApiClient;
import ai.docindexer.api.models.request.IndexDefinition;
import ai.docindexer.api.models.request.IndexDocumentsRequest;
import ai.docindexer.api.models.request.IndexField;
import ai.docindexer.api.models.response.ApiResponse;
import ai.docindexer.api.models.response.GetIndexResponse;
import ai.docindexer.api.models.response.IndexDocumentsResponse;
import ai.docindexer.api.models.response.IndexDocumentsResponse.IndexingResult;
import ai.docindexer.backend.models.IndexDescription;
import ai.docindexer.exceptions.BatchRejectedException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.exceptions.IndexLifecycleException;
import ai.docindexer.exceptions.TransientUploadException;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.indexing.models.RecordFailure;
import ai.docindexer.schema.FieldSchema;
import ai.docindexer.schema.FieldValueConverter;
import ai.docindexer.schema.IndexSchema;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SearchServiceIndexBackend implements IndexBackend {
  private static final int STATUS_CONFLICT = 409;
  private static final int STATUS_REQUEST_TIMEOUT = 408;

  private final SearchServiceApiClient apiClient;
  // fields outside the schema never reach the service
  private final IndexSchema schema;

  @Inject
  public SearchServiceIndexBackend(
      @Nonnull SearchServiceApiClient apiClient, @Nonnull IndexSchema schema) {
    this.apiClient = apiClient;
    this.schema = schema;
  }

  @Override
  public CompletableFuture<Optional<IndexDescription>> describeIndex(String indexName) {
    return apiClient
        .getIndex(indexName)
        .thenApply(
            response -> {
              if (response.isFailure()) {
                if (response.getStatusCode() == STATUS_NOT_FOUND) {
                  return Optional.empty();
                }
                throw new IndexLifecycleException(
                    String.format(
                        "Failed to describe index %s: %d %s",
                        indexName, response.getStatusCode(), response.getCause()));
              }
              return Optional.of(toIndexDescription(indexName, response));
            });
  }

  @Override
  public CompletableFuture<Void> createIndex(String indexName, IndexSchema indexSchema) {
    IndexDefinition definition =
        IndexDefinition.builder()
            .name(indexName)
            .fields(
                indexSchema.getFields().stream()
                    .map(IndexField::fromFieldSchema)
                    .collect(Collectors.toList()))
            .settings(indexSchema.getSettings())
            .build();
    return apiClient
        .createOrUpdateIndex(definition)
        .thenAccept(
            response -> {
              if (!response.isFailure()) {
                log.info(
                    "Created index {} with {} fields", indexName, definition.getFields().size());
              } else if (response.getStatusCode() == STATUS_CONFLICT) {
                log.info("Index {} already exists", indexName);
              } else {
                throw new IndexLifecycleException(
                    String.format(
                        "Failed to create index %s: %d %s",
                        indexName, response.getStatusCode(), response.getCause()));
              }
            });
  }

  @Override
  public CompletableFuture<BatchOutcome> uploadBatch(String indexName, Batch batch) {
    IndexDocumentsRequest request;
    try {
      request =
          IndexDocumentsRequest.builder()
              .value(
                  batch.getRecords().stream().map(this::toDocument).collect(Collectors.toList()))
              .build();
    } catch (IllegalArgumentException e) {
      CompletableFuture<BatchOutcome> rejected = new CompletableFuture<>();
      rejected.completeExceptionally(
          new BatchRejectedException("Batch payload could not be built: " + e.getMessage(), 0));
      return rejected;
    }

    return apiClient
        .indexDocuments(indexName, request)
        .handle(
            (response, throwable) -> {
              if (throwable != null) {
                Throwable cause =
                    throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause()
                        : throwable;
                if (cause instanceof IOException) {
                  throw new TransientUploadException(
                      "Upload of " + describe(batch) + " failed: " + cause.getMessage(), cause);
                }
                throw new CompletionException(cause);
              }
              if (response.isFailure()) {
                throw toUploadException(response, batch);
              }
              return toOutcome(batch, response);
            });
  }

  @VisibleForTesting
  Map<String, Object> toDocument(FlatRecord record) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(SEARCH_ACTION_KEY, MERGE_OR_UPLOAD_ACTION);
    for (FieldSchema field : schema.getFields()) {
      Object value = record.get(field.getName());
      if (value != null) {
        document.put(field.getName(), FieldValueConverter.convert(field, value));
      }
    }
    return document;
  }

  private RuntimeException toUploadException(ApiResponse response, Batch batch) {
    int statusCode = response.getStatusCode();
    String message =
        String.format(
            "Upload of %s failed with HTTP %d: %s",
            describe(batch),
            statusCode,
            response.getCause());
    if (AUTH_FAILURE_STATUS_CODES.contains(statusCode)) {
      return new FatalAuthException(message, statusCode);
    }
    if (statusCode == STATUS_TOO_MANY_REQUESTS
        || statusCode == STATUS_REQUEST_TIMEOUT
        || statusCode >= 500) {
      return new TransientUploadException(message, statusCode, response.getRetryAfterMillis());
    }
    return new BatchRejectedException(message, statusCode);
  }

  private BatchOutcome toOutcome(Batch batch, IndexDocumentsResponse response) {
    List<IndexingResult> results =
        response.getValue() == null ? Collections.emptyList() : response.getValue();
    Map<String, IndexingResult> resultsByKey = new HashMap<>();
    for (IndexingResult result : results) {
      resultsByKey.put(result.getKey(), result);
    }

    List<String> succeeded = new ArrayList<>();
    List<RecordFailure> failed = new ArrayList<>();
    for (FlatRecord record : batch.getRecords()) {
      IndexingResult result = resultsByKey.get(record.getId());
      if (result == null || result.isStatus()) {
        succeeded.add(record.getId());
      } else {
        failed.add(
            new RecordFailure(
                record.getId(),
                ErrorCategory.PARTIAL_BATCH_FAILURE,
                String.format("%s (status %d)", result.getErrorMessage(), result.getStatusCode())));
      }
    }
    if (failed.isEmpty()) {
      return BatchOutcome.allSucceeded(succeeded);
    }
    log.warn(
        "{}: {} of {} records rejected by the service",
        describe(batch),
        failed.size(),
        batch.size());
    return BatchOutcome.partial(succeeded, failed);
  }

  private static IndexDescription toIndexDescription(String indexName, GetIndexResponse response) {
    List<IndexField> fields =
        response.getFields() == null ? ImmutableList.of() : response.getFields();
    return IndexDescription.builder()
        .name(response.getName() == null ? indexName : response.getName())
        .fields(
            fields.stream()
                .map(
                    field ->
                        IndexDescription.DescribedField.builder()
                            .name(field.getName())
                            .type(field.getType())
                            .dimensions(field.getDimensions())
                            .build())
                .collect(ImmutableList.toImmutableList()))
        .build();
  }

  private static String describe(Batch batch) {
    return String.format("batch %d of %s", batch.getSequence(), batch.getFileId());
  }
}
