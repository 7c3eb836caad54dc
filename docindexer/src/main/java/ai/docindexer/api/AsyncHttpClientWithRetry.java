package ai.docindexer.api;

import static ai.docindexer.constants.ApiConstants.ACCEPTABLE_HTTP_FAILURE_STATUS_CODES;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

@Slf4j
public class AsyncHttpClientWithRetry {

  private final ScheduledExecutorService scheduler;
  private final RetryPolicy retryPolicy;
  private final OkHttpClient okHttpClient;

  public AsyncHttpClientWithRetry(
      @Nonnull RetryPolicy retryPolicy, @Nonnull OkHttpClient okHttpClient) {
    this.retryPolicy = retryPolicy;
    this.scheduler = Executors.newSingleThreadScheduledExecutor();
    this.okHttpClient = okHttpClient;
  }

  /**
   * Makes an asynchronous HTTP request, retrying connection failures and retryable status codes
   * with the configured backoff. The returned future completes with the last response received.
   */
  public CompletableFuture<Response> makeRequestWithRetry(Request request) {
    return attemptRequest(request, 1, retryPolicy.getMaxAttempts());
  }

  /** Single attempt; the caller owns the retry decision. */
  public CompletableFuture<Response> makeRequest(Request request) {
    return attemptRequest(request, 1, 1);
  }

  private CompletableFuture<Response> attemptRequest(
      Request request, int tryCount, int maxAttempts) {
    CompletableFuture<Response> future = new CompletableFuture<>();
    okHttpClient
        .newCall(request)
        .enqueue(
            new Callback() {
              @Override
              public void onFailure(@Nonnull Call call, @Nonnull IOException e) {
                if (tryCount < maxAttempts) {
                  Request request = call.request();
                  HttpUrl url = request.url();
                  String method = request.method();
                  log.warn(
                      "API Request failed with error: {}, attempt: {}, url: {}, method: {}",
                      e.getMessage(),
                      tryCount,
                      url,
                      method);

                  scheduleRetry(request, tryCount, maxAttempts, 0, future);
                } else {
                  future.completeExceptionally(e);
                }
              }

              @Override
              public void onResponse(@Nonnull Call call, @Nonnull Response response) {
                if (!response.isSuccessful()
                    && !ACCEPTABLE_HTTP_FAILURE_STATUS_CODES.contains(response.code())
                    && tryCount < maxAttempts) {
                  Request request = call.request();
                  HttpUrl url = request.url();
                  String method = request.method();
                  int statusCode = response.code();
                  log.warn(
                      "API Request failed with HTTP status: {}, attempt: {}, url: {}, method: {}",
                      statusCode,
                      tryCount,
                      url,
                      method);
                  long retryAfterMillis = RetryAfter.parseMillis(response);
                  response.close();
                  scheduleRetry(request, tryCount, maxAttempts, retryAfterMillis, future);
                } else {
                  future.complete(response);
                }
              }
            });

    return future;
  }

  private void scheduleRetry(
      Request request,
      int tryCount,
      int maxAttempts,
      long retryAfterMillis,
      CompletableFuture<Response> future) {
    scheduler.schedule(
        () -> {
          log.info("Scheduling request with attempt: {}", (tryCount + 1));
          attemptRequest(request, tryCount + 1, maxAttempts)
              .whenComplete(
                  (resp, throwable) -> {
                    if (throwable != null) {
                      future.completeExceptionally(throwable);
                    } else {
                      future.complete(resp);
                    }
                  });
        },
        retryPolicy.delayForAttempt(tryCount, retryAfterMillis),
        TimeUnit.MILLISECONDS);
  }

  public void shutdownScheduler() {
    scheduler.shutdown();
    okHttpClient.connectionPool().evictAll();
    okHttpClient.dispatcher().executorService().shutdown();
  }
}
