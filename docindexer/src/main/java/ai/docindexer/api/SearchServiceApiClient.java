package ai.docindexer.api;

import static ai.docindexer.constants.ApiConstants.ACCEPTABLE_HTTP_FAILURE_STATUS_CODES;
import static ai.docindexer.constants.ApiConstants.API_KEY_HEADER;
import static ai.docindexer.constants.ApiConstants.AUTH_FAILURE_STATUS_CODES;
import static ai.docindexer.constants.ApiConstants.DEFAULT_API_VERSION;
import static ai.docindexer.constants.ApiConstants.INDEX_DEFINITION;
import static ai.docindexer.constants.ApiConstants.INDEX_DOCUMENTS;
import static ai.docindexer.constants.ApiConstants.UNAUTHORIZED_ERROR_MESSAGE;

import ai.docindexer.api.models.request.IndexDefinition;
import ai.docindexer.api.models.request.IndexDocumentsRequest;
import ai.docindexer.api.models.response.ApiResponse;
import ai.docindexer.api.models.response.CreateIndexResponse;
import ai.docindexer.api.models.response.GetIndexResponse;
import ai.docindexer.api.models.response.IndexDocumentsResponse;
import ai.docindexer.config.Config;
import ai.docindexer.config.models.common.SearchServiceConfig;
import ai.docindexer.constants.MetricsConstants;
import ai.docindexer.metrics.IndexerMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.text.MessageFormat;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import lombok.SneakyThrows;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

/**
 * REST client for an Azure AI Search compatible service. Index definition calls retry on their
 * own; document uploads are sent once and the caller decides whether to repeat them.
 */
public class SearchServiceApiClient {
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

  private final AsyncHttpClientWithRetry asyncClient;
  private final Headers headers;
  private final String endpoint;
  private final String apiVersion;
  private final IndexerMetrics indexerMetrics;
  private final ObjectMapper mapper;

  @Inject
  public SearchServiceApiClient(
      @Nonnull AsyncHttpClientWithRetry asyncClient,
      @Nonnull Config config,
      @Nonnull IndexerMetrics indexerMetrics) {
    SearchServiceConfig searchServiceConfig = config.getSearchServiceConfig();
    this.asyncClient = asyncClient;
    this.headers = getHeaders(searchServiceConfig);
    this.endpoint = StringUtils.removeEnd(searchServiceConfig.getEndpoint(), "/");
    this.apiVersion =
        StringUtils.defaultIfBlank(searchServiceConfig.getApiVersion(), DEFAULT_API_VERSION);
    this.indexerMetrics = indexerMetrics;
    this.mapper = new ObjectMapper();
  }

  public CompletableFuture<GetIndexResponse> getIndex(String indexName) {
    Request request =
        new Request.Builder()
            .url(endpoint + MessageFormat.format(INDEX_DEFINITION, indexName, apiVersion))
            .headers(headers)
            .get()
            .build();
    return asyncClient
        .makeRequestWithRetry(request)
        .thenApply(response -> handleResponse(response, GetIndexResponse.class));
  }

  @SneakyThrows
  public CompletableFuture<CreateIndexResponse> createOrUpdateIndex(IndexDefinition definition) {
    Request request =
        new Request.Builder()
            .url(
                endpoint
                    + MessageFormat.format(INDEX_DEFINITION, definition.getName(), apiVersion))
            .headers(headers)
            .put(RequestBody.create(mapper.writeValueAsString(definition), JSON))
            .build();
    return asyncClient
        .makeRequestWithRetry(request)
        .thenApply(response -> handleResponse(response, CreateIndexResponse.class));
  }

  @SneakyThrows
  public CompletableFuture<IndexDocumentsResponse> indexDocuments(
      String indexName, IndexDocumentsRequest documentsRequest) {
    Request request =
        new Request.Builder()
            .url(endpoint + MessageFormat.format(INDEX_DOCUMENTS, indexName, apiVersion))
            .headers(headers)
            .post(RequestBody.create(mapper.writeValueAsString(documentsRequest), JSON))
            .build();
    return asyncClient
        .makeRequest(request)
        .thenApply(response -> handleResponse(response, IndexDocumentsResponse.class));
  }

  @VisibleForTesting
  Headers getHeaders(SearchServiceConfig searchServiceConfig) {
    Headers.Builder headersBuilder = new Headers.Builder();
    // absent in dry runs, which never reach the service
    if (StringUtils.isNotBlank(searchServiceConfig.getApiKey())) {
      headersBuilder.add(API_KEY_HEADER, searchServiceConfig.getApiKey());
    }
    return headersBuilder.build();
  }

  @VisibleForTesting
  String getApiVersion() {
    return apiVersion;
  }

  private <T> T handleResponse(Response response, Class<T> typeReference) {
    if (response.isSuccessful()) {
      try (ResponseBody body = response.body()) {
        if (body != null) {
          String content = body.string();
          if (StringUtils.isNotBlank(content)) {
            return mapper.readValue(content, typeReference);
          }
        }
        return typeReference.getDeclaredConstructor().newInstance();
      } catch (IOException jsonProcessingException) {
        throw new UncheckedIOException("Failed to deserialize", jsonProcessingException);
      } catch (ReflectiveOperationException e) {
        throw new RuntimeException("Failed to instantiate response object", e);
      }
    } else {
      try {
        T errorResponse = typeReference.getDeclaredConstructor().newInstance();
        if (errorResponse instanceof ApiResponse) {
          ApiResponse apiResponse = (ApiResponse) errorResponse;
          if (AUTH_FAILURE_STATUS_CODES.contains(response.code())) {
            apiResponse.setError(response.code(), UNAUTHORIZED_ERROR_MESSAGE);
          } else {
            apiResponse.setError(response.code(), readErrorCause(response));
          }
          apiResponse.setRetryAfterMillis(RetryAfter.parseMillis(response));
        }
        response.close();
        emmitApiErrorMetric(response.code());
        return errorResponse;
      } catch (InstantiationException
          | IllegalAccessException
          | NoSuchMethodException
          | InvocationTargetException e) {
        throw new RuntimeException("Failed to instantiate error response object", e);
      }
    }
  }

  private String readErrorCause(Response response) {
    try (ResponseBody body = response.body()) {
      String content = body == null ? "" : body.string();
      return StringUtils.isNotBlank(content)
          ? StringUtils.abbreviate(content, 500)
          : response.message();
    } catch (IOException e) {
      return response.message();
    }
  }

  private void emmitApiErrorMetric(int apiStatusCode) {
    if (ACCEPTABLE_HTTP_FAILURE_STATUS_CODES.contains(apiStatusCode)) {
      indexerMetrics.incrementApiFailureCounter(
          MetricsConstants.ApiFailureType.API_FAILURE_USER_ERROR);
    } else {
      indexerMetrics.incrementApiFailureCounter(
          MetricsConstants.ApiFailureType.API_FAILURE_SYSTEM_ERROR);
    }
  }
}
