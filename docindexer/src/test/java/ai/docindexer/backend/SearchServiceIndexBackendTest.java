package ai.docindexer.backend;

import static org.junit.jupiter.api.Assertions.*;

import ai.docindexer.TestFixtures;
import ai.docindexer.api.AsyncHttpClientWithRetry;
import ai.docindexer.api.RetryPolicy;
import ai.docindexer.api.SearchServiceApiClient;
import ai.docindexer.backend.models.IndexDescription;
import ai.docindexer.config.models.common.SearchServiceConfig;
import ai.docindexer.config.models.configv1.ConfigV1;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.exceptions.BatchRejectedException;
import ai.docindexer.exceptions.FatalAuthException;
import ai.docindexer.exceptions.IndexLifecycleException;
import ai.docindexer.exceptions.TransientUploadException;
import ai.docindexer.indexing.models.Batch;
import ai.docindexer.indexing.models.BatchOutcome;
import ai.docindexer.indexing.models.ErrorCategory;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.metrics.IndexerMetrics;
import ai.docindexer.schema.IndexSchema;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceIndexBackendTest {
  private static final String INDEX_NAME = "document-chunks";

  @Mock private IndexerMetrics indexerMetrics;

  private MockWebServer mockWebServer;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;
  private IndexSchema schema;
  private SearchServiceIndexBackend backend;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    asyncHttpClientWithRetry =
        new AsyncHttpClientWithRetry(
            new RetryPolicy(2, 10, 100), new OkHttpClient.Builder().build());
    ConfigV1 config =
        ConfigV1.builder()
            .version("V1")
            .searchServiceConfig(
                SearchServiceConfig.builder()
                    .endpoint(mockWebServer.url("/").toString())
                    .apiKey("key")
                    .build())
            .indexerConfig(IndexerConfig.builder().build())
            .build();
    schema = TestFixtures.chunkSchema();
    backend =
        new SearchServiceIndexBackend(
            new SearchServiceApiClient(asyncHttpClientWithRetry, config, indexerMetrics), schema);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
    asyncHttpClientWithRetry.shutdownScheduler();
  }

  private static FlatRecord record(String id, String content) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", id);
    fields.put("doc_id", "doc_1");
    fields.put("page_number", 1);
    fields.put("chunk_position", 0);
    fields.put("content", content);
    return FlatRecord.builder()
        .id(id)
        .docId("doc_1")
        .pageNumber(1)
        .chunkPosition(0)
        .fields(fields)
        .build();
  }

  private static Batch batchOf(FlatRecord... records) {
    return new Batch("doc_1.json", 0, Arrays.asList(records));
  }

  private static Throwable uploadFailure(
      SearchServiceIndexBackend backend, Batch batch) {
    ExecutionException exception =
        assertThrows(
            ExecutionException.class, () -> backend.uploadBatch(INDEX_NAME, batch).get());
    return exception.getCause();
  }

  @Test
  void testDescribeMissingIndex() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(404));

    assertEquals(Optional.empty(), backend.describeIndex(INDEX_NAME).join());
  }

  @Test
  void testDescribeExistingIndex() {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                "{\"name\":\"document-chunks\",\"fields\":["
                    + "{\"name\":\"id\",\"type\":\"Edm.String\",\"key\":true},"
                    + "{\"name\":\"content_vector\",\"type\":\"Collection(Edm.Single)\","
                    + "\"dimensions\":4}]}"));

    IndexDescription description = backend.describeIndex(INDEX_NAME).join().get();

    assertEquals(INDEX_NAME, description.getName());
    assertEquals(2, description.getFields().size());
    assertEquals(4, description.getField("content_vector").get().getDimensions());
  }

  @Test
  void testDescribeFailsOnServerError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> backend.describeIndex(INDEX_NAME).get());
    assertInstanceOf(IndexLifecycleException.class, exception.getCause());
  }

  @Test
  void testCreateIndexSendsSchema() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(201));

    backend.createIndex(INDEX_NAME, schema).join();

    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("PUT", request.getMethod());
    String body = request.getBody().readUtf8();
    assertTrue(body.contains("\"name\":\"content_vector\""));
    assertTrue(body.contains("\"dimensions\":4"));
    assertTrue(body.contains("\"vectorSearchProfile\":\"default-vector-profile\""));
    assertTrue(body.contains("\"vectorSearch\""));
    assertTrue(body.contains("\"suggesters\""));
  }

  @Test
  void testCreateIndexConflictMeansAlreadyExists() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(409));

    assertDoesNotThrow(() -> backend.createIndex(INDEX_NAME, schema).join());
  }

  @Test
  void testCreateIndexRejected() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(400).setBody("bad definition"));

    ExecutionException exception =
        assertThrows(
            ExecutionException.class, () -> backend.createIndex(INDEX_NAME, schema).get());
    assertInstanceOf(IndexLifecycleException.class, exception.getCause());
    assertTrue(exception.getCause().getMessage().contains("bad definition"));
  }

  @Test
  void testUploadAllSucceeded() throws Exception {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                "{\"value\":[{\"key\":\"a\",\"status\":true,\"statusCode\":201},"
                    + "{\"key\":\"b\",\"status\":true,\"statusCode\":200}]}"));

    BatchOutcome outcome =
        backend.uploadBatch(INDEX_NAME, batchOf(record("a", "x"), record("b", "y"))).get();

    assertTrue(outcome.isFullySucceeded());
    assertEquals(Arrays.asList("a", "b"), outcome.getSucceeded());
    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals(
        "/indexes/document-chunks/docs/index?api-version=2024-07-01", request.getPath());
  }

  @Test
  void testUploadPartialFailure() throws Exception {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(207)
            .setBody(
                "{\"value\":[{\"key\":\"a\",\"status\":true,\"statusCode\":201},"
                    + "{\"key\":\"b\",\"status\":false,\"statusCode\":400,"
                    + "\"errorMessage\":\"field too long\"}]}"));

    BatchOutcome outcome =
        backend.uploadBatch(INDEX_NAME, batchOf(record("a", "x"), record("b", "y"))).get();

    assertFalse(outcome.isFullySucceeded());
    assertEquals(Collections.singletonList("a"), outcome.getSucceeded());
    assertEquals(Collections.singletonList("b"), outcome.failedIds());
    assertEquals(ErrorCategory.PARTIAL_BATCH_FAILURE, outcome.getFailed().get(0).getCategory());
    assertTrue(outcome.getFailed().get(0).getReason().contains("field too long"));
  }

  @Test
  void testUploadUnauthorizedIsFatal() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(401));

    Throwable failure = uploadFailure(backend, batchOf(record("a", "x")));

    assertInstanceOf(FatalAuthException.class, failure);
    assertEquals(401, ((FatalAuthException) failure).getStatusCode());
  }

  @Test
  void testUploadThrottledIsTransient() {
    mockWebServer.enqueue(
        new MockResponse().setResponseCode(429).setHeader("retry-after-ms", "1500"));

    Throwable failure = uploadFailure(backend, batchOf(record("a", "x")));

    assertInstanceOf(TransientUploadException.class, failure);
    TransientUploadException transientFailure = (TransientUploadException) failure;
    assertTrue(transientFailure.isRateLimited());
    assertEquals(1500, transientFailure.getRetryAfterMillis());
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testUploadServerErrorIsTransient() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    Throwable failure = uploadFailure(backend, batchOf(record("a", "x")));

    assertInstanceOf(TransientUploadException.class, failure);
    assertFalse(((TransientUploadException) failure).isRateLimited());
  }

  @Test
  void testUploadBadRequestIsRejected() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(413).setBody("payload too large"));

    Throwable failure = uploadFailure(backend, batchOf(record("a", "x")));

    assertInstanceOf(BatchRejectedException.class, failure);
    assertEquals(413, ((BatchRejectedException) failure).getStatusCode());
  }

  @Test
  void testUploadConnectionFailureIsTransient() throws IOException {
    mockWebServer.shutdown();

    Throwable failure = uploadFailure(backend, batchOf(record("a", "x")));

    assertInstanceOf(TransientUploadException.class, failure);
    assertInstanceOf(IOException.class, failure.getCause());
  }

  @Test
  void testToDocumentKeepsSchemaFieldsOnly() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", "doc_1_p1_c0");
    fields.put("doc_id", "doc_1");
    fields.put("page_number", 1L);
    fields.put("content", "text");
    fields.put("created_at", "2024-03-01T10:15:00");
    fields.put("content_vector", Arrays.asList(0.1, 0.2, 0.3, 0.4));
    fields.put("source", "s3://bucket/doc_1.pdf");
    FlatRecord record =
        FlatRecord.builder()
            .id("doc_1_p1_c0")
            .docId("doc_1")
            .pageNumber(1)
            .chunkPosition(0)
            .fields(fields)
            .build();

    Map<String, Object> document = backend.toDocument(record);

    assertEquals("mergeOrUpload", document.get("@search.action"));
    assertEquals(1, document.get("page_number"));
    assertEquals("2024-03-01T10:15:00Z", document.get("created_at"));
    List<?> vector = (List<?>) document.get("content_vector");
    assertEquals(0.1f, vector.get(0));
    assertFalse(document.containsKey("source"));
    assertFalse(document.containsKey("title"));
  }
}
