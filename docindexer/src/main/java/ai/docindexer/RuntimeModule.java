package ai.docindexer;

import ai.docindexer.api.AsyncHttpClientWithRetry;
import ai.docindexer.api.RateLimitGate;
import ai.docindexer.api.RetryPolicy;
import ai.docindexer.api.Sleeper;
import ai.docindexer.backend.IndexBackend;
import ai.docindexer.backend.SearchServiceIndexBackend;
import ai.docindexer.config.Config;
import ai.docindexer.config.ConfigProvider;
import ai.docindexer.config.models.configv1.IndexerConfig;
import ai.docindexer.env.EnvironmentLookupProvider;
import ai.docindexer.indexing.BatchUploader;
import ai.docindexer.indexing.CheckpointStore;
import ai.docindexer.indexing.DocumentFlattener;
import ai.docindexer.indexing.FileIndexingProcessor;
import ai.docindexer.indexing.ProgressTracker;
import ai.docindexer.indexing.RecordValidator;
import ai.docindexer.indexing.RunControl;
import ai.docindexer.indexing.SourceDocumentReader;
import ai.docindexer.metrics.IndexerMetrics;
import ai.docindexer.schema.IndexSchema;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.BindingAnnotation;
import com.google.inject.Provides;
import java.io.IOException;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class RuntimeModule extends AbstractModule {
  private static final int IO_WORKLOAD_NUM_THREAD_MULTIPLIER = 5;
  private static final int HTTP_CLIENT_CONNECT_TIMEOUT_SECONDS = 15;
  private static final String HTTP_PROXY_ENV = "HTTP_PROXY";
  private static final String NO_PROXY_ENV = "NO_PROXY";
  private final Config config;
  private final IndexSchema schema;

  public RuntimeModule(Config config, IndexSchema schema) {
    this.config = config;
    this.schema = schema;
  }

  /** Threads that run the HTTP client's callbacks; never blocked on upload results. */
  @Retention(RetentionPolicy.RUNTIME)
  @BindingAnnotation
  public @interface HttpClientExecutor {}

  /** Threads that run a file's batches in parallel when batchConcurrency is above one. */
  @Retention(RetentionPolicy.RUNTIME)
  @BindingAnnotation
  public @interface BatchUploadExecutor {}

  @Provides
  @Singleton
  static ConfigProvider configProvider(Config config) {
    return new ConfigProvider(config);
  }

  @Provides
  @Singleton
  static EnvironmentLookupProvider providesEnvironmentLookupProvider() {
    return new EnvironmentLookupProvider.System();
  }

  @Provides
  @Singleton
  static OkHttpClient providesOkHttpClient(
      Config config,
      @HttpClientExecutor ExecutorService executorService,
      EnvironmentLookupProvider environmentLookupProvider) {
    int timeoutSeconds = config.getIndexerConfig().getRequestTimeoutSeconds();
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(HTTP_CLIENT_CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .dispatcher(new Dispatcher(executorService));

    String httpProxyEnv = environmentLookupProvider.getValue(HTTP_PROXY_ENV);
    if (StringUtils.isNotBlank(httpProxyEnv)) {
      Proxy proxy = buildProxy(httpProxyEnv);
      String noProxyEnv = environmentLookupProvider.getValue(NO_PROXY_ENV);
      if (StringUtils.isNotBlank(noProxyEnv)) {
        builder.proxySelector(new EnvProxySelector(proxy, noProxyEnv));
      } else {
        builder.proxy(proxy);
      }
      log.info("Configured HTTP client to use proxy from HTTP_PROXY env var: {}", httpProxyEnv);
    }
    return builder.build();
  }

  @Provides
  @Singleton
  static RetryPolicy providesRetryPolicy(Config config) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    return new RetryPolicy(
        indexerConfig.getMaxUploadAttempts(),
        indexerConfig.getRetryBaseDelayMillis(),
        indexerConfig.getMaxRetryDelayMillis());
  }

  @Provides
  @Singleton
  static AsyncHttpClientWithRetry providesHttpAsyncClient(
      RetryPolicy retryPolicy, OkHttpClient okHttpClient) {
    return new AsyncHttpClientWithRetry(retryPolicy, okHttpClient);
  }

  @Provides
  @Singleton
  static Sleeper providesSleeper() {
    return new Sleeper.Default();
  }

  @Provides
  @Singleton
  static RateLimitGate providesRateLimitGate() {
    return new RateLimitGate();
  }

  @Provides
  @Singleton
  static RunControl providesRunControl() {
    return new RunControl();
  }

  @Provides
  @Singleton
  static ProgressTracker providesProgressTracker() {
    return new ProgressTracker();
  }

  @Provides
  @Singleton
  static CheckpointStore providesCheckpointStore(Config config) {
    return new CheckpointStore(Paths.get(config.getIndexerConfig().getCheckpointPath()));
  }

  @Provides
  @Singleton
  static BatchUploader providesBatchUploader(
      Config config,
      IndexBackend indexBackend,
      RetryPolicy retryPolicy,
      RateLimitGate rateLimitGate,
      Sleeper sleeper,
      RunControl runControl,
      IndexerMetrics indexerMetrics) {
    return new BatchUploader(
        indexBackend,
        retryPolicy,
        rateLimitGate,
        sleeper,
        runControl,
        indexerMetrics,
        Duration.ofSeconds(config.getIndexerConfig().getRequestTimeoutSeconds()));
  }

  @Provides
  @Singleton
  static FileIndexingProcessor providesFileIndexingProcessor(
      Config config,
      IndexSchema schema,
      SourceDocumentReader sourceDocumentReader,
      DocumentFlattener documentFlattener,
      RecordValidator recordValidator,
      BatchUploader batchUploader,
      RunControl runControl,
      ProgressTracker progressTracker,
      IndexerMetrics indexerMetrics,
      @Nullable @BatchUploadExecutor ExecutorService batchExecutor) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    return FileIndexingProcessor.builder()
        .sourceDocumentReader(sourceDocumentReader)
        .documentFlattener(documentFlattener)
        .recordValidator(recordValidator)
        .batchUploader(batchUploader)
        .schema(schema)
        .runControl(runControl)
        .progressTracker(progressTracker)
        .indexerMetrics(indexerMetrics)
        .batchSize(indexerConfig.getBatchSize())
        .batchConcurrency(indexerConfig.getBatchConcurrency())
        .dryRun(indexerConfig.isDryRun())
        .batchExecutor(batchExecutor)
        .build();
  }

  @Provides
  @Singleton
  @Nullable
  @BatchUploadExecutor
  static ExecutorService providesBatchUploadExecutor(Config config) {
    IndexerConfig indexerConfig = config.getIndexerConfig();
    if (indexerConfig.getBatchConcurrency() <= 1) {
      return null;
    }
    int numThreads = indexerConfig.getFileConcurrency() * indexerConfig.getBatchConcurrency();
    log.info("Spinning up {} batch upload threads", numThreads);
    return Executors.newFixedThreadPool(
        numThreads,
        new ThreadFactoryBuilder().setNameFormat("batch-uploader-%d").setDaemon(true).build());
  }

  @Provides
  @Singleton
  @HttpClientExecutor
  static ExecutorService providesHttpClientExecutor() {
    // more threads as most operation are IO intensive workload
    int numThreads = Runtime.getRuntime().availableProcessors() * IO_WORKLOAD_NUM_THREAD_MULTIPLIER;
    log.info("Spinning up {} http client threads", numThreads);
    class ApplicationThreadFactory implements ForkJoinPool.ForkJoinWorkerThreadFactory {
      private static final String THREAD_GROUP_NAME_TEMPLATE = "http-client-%d";
      private final AtomicInteger counter = new AtomicInteger(1);

      @Override
      public ForkJoinWorkerThread newThread(ForkJoinPool pool) {
        return new ForkJoinWorkerThread(pool) {
          {
            setName(String.format(THREAD_GROUP_NAME_TEMPLATE, counter.getAndIncrement()));
          }
        };
      }
    }

    return new ForkJoinPool(
        numThreads,
        new ApplicationThreadFactory(),
        (thread, throwable) -> {
          if (throwable != null) {
            log.error(
                String.format("Uncaught exception in a thread (%s)", thread.getName()), throwable);
          }
        },
        // async applications need asyncMode
        true);
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
    bind(IndexSchema.class).toInstance(schema);
    bind(IndexBackend.class).to(SearchServiceIndexBackend.class).in(Singleton.class);
  }

  /** Builds a java.net.Proxy from the HTTP_PROXY environment variable. */
  @VisibleForTesting
  static Proxy buildProxy(String proxyEnv) {
    try {
      String proxyUrl = proxyEnv.matches("^[a-zA-Z]+://.*") ? proxyEnv : "http://" + proxyEnv;
      URI uri = URI.create(proxyUrl);
      int port = uri.getPort() == -1 ? 80 : uri.getPort();
      return new Proxy(Proxy.Type.HTTP, new InetSocketAddress(uri.getHost(), port));
    } catch (IllegalArgumentException e) {
      log.error("Failed to parse proxy url: {}", proxyEnv, e);
      return Proxy.NO_PROXY;
    }
  }

  /** ProxySelector that bypasses the proxy for hosts listed in NO_PROXY. */
  @VisibleForTesting
  static class EnvProxySelector extends ProxySelector {
    private final Proxy proxy;
    private final List<String> noProxyHosts;

    EnvProxySelector(Proxy proxy, String noProxyEnv) {
      this.proxy = proxy;
      this.noProxyHosts = new ArrayList<>();
      for (String part : noProxyEnv.split(",")) {
        if (StringUtils.isNotBlank(part)) {
          noProxyHosts.add(part.trim());
        }
      }
    }

    @Override
    public List<Proxy> select(URI uri) {
      String host = uri.getHost();
      if (host != null) {
        for (String pattern : noProxyHosts) {
          if (host.equals(pattern) || host.endsWith(pattern)) {
            return Collections.singletonList(Proxy.NO_PROXY);
          }
        }
      }
      return Collections.singletonList(proxy);
    }

    @Override
    public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
      log.error("Proxy connection failed to {} via {}", uri, sa, ioe);
    }
  }
}
