package ai.docindexer.metrics;

import ai.docindexer.config.Config;
import ai.docindexer.config.ConfigProvider;
import ai.docindexer.constants.MetricsConstants;
import ai.docindexer.indexing.models.ErrorCategory;
import io.micrometer.core.instrument.Tag;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.Getter;

public class IndexerMetrics {
  private final Metrics metrics;
  private final Metrics.Gauge filesDiscoveredGaugeMetric;
  private final Metrics.Gauge filesProcessedGaugeMetric;
  private final Config indexerConfig;

  static final String METRICS_COMMON_PREFIX = "docIndexer_";

  // Tag keys
  static final String CONFIG_VERSION_TAG_KEY = "config_version";
  static final String DRY_RUN_TAG_KEY = "dry_run";
  static final String FAILURE_CATEGORY_TAG_KEY = "failure_category";
  static final String API_FAILURE_TYPE_TAG_KEY = "api_failure_type";

  // Metrics
  static final String FILE_INDEXED_COUNTER = METRICS_COMMON_PREFIX + "file_indexed";
  static final String FILE_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "file_failure";
  static final String RECORDS_UPLOADED_COUNTER = METRICS_COMMON_PREFIX + "records_uploaded";
  static final String RECORDS_FAILED_COUNTER = METRICS_COMMON_PREFIX + "records_failed";
  static final String BATCH_RETRY_COUNTER = METRICS_COMMON_PREFIX + "batch_retry";
  static final String API_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "api_failure";
  static final String BATCH_UPLOAD_TIMER = METRICS_COMMON_PREFIX + "batch_upload_latency";

  @Inject
  public IndexerMetrics(@Nonnull Metrics metrics, @Nonnull ConfigProvider configProvider) {
    this.metrics = metrics;
    this.indexerConfig = configProvider.getConfig();
    this.filesDiscoveredGaugeMetric =
        metrics.gauge(
            FilesDiscoveredGaugeMetricsMetadata.NAME,
            FilesDiscoveredGaugeMetricsMetadata.DESCRIPTION,
            getDefaultTags());
    this.filesProcessedGaugeMetric =
        metrics.gauge(
            FilesProcessedGaugeMetricsMetadata.NAME,
            FilesProcessedGaugeMetricsMetadata.DESCRIPTION,
            getDefaultTags());
  }

  public void setDiscoveredFiles(long numFilesDiscovered) {
    filesDiscoveredGaugeMetric.setValue(numFilesDiscovered);
    filesProcessedGaugeMetric.setValue(0L);
  }

  public void incrementFilesIndexedCounter() {
    metrics.increment(FILE_INDEXED_COUNTER, getDefaultTags());
    filesProcessedGaugeMetric.increment();
  }

  public void incrementFileFailureCounter(ErrorCategory category) {
    List<Tag> tags = getDefaultTags();
    tags.add(Tag.of(FAILURE_CATEGORY_TAG_KEY, category.name()));
    metrics.increment(FILE_FAILURE_COUNTER, tags);
    filesProcessedGaugeMetric.increment();
  }

  public void incrementRecordsUploadedCounter(long count) {
    if (count > 0) {
      metrics.increment(RECORDS_UPLOADED_COUNTER, count, getDefaultTags());
    }
  }

  public void incrementRecordsFailedCounter(ErrorCategory category, long count) {
    if (count > 0) {
      List<Tag> tags = getDefaultTags();
      tags.add(Tag.of(FAILURE_CATEGORY_TAG_KEY, category.name()));
      metrics.increment(RECORDS_FAILED_COUNTER, count, tags);
    }
  }

  public void incrementBatchRetryCounter() {
    metrics.increment(BATCH_RETRY_COUNTER, getDefaultTags());
  }

  public void incrementApiFailureCounter(MetricsConstants.ApiFailureType apiFailureType) {
    List<Tag> tags = getDefaultTags();
    tags.add(Tag.of(API_FAILURE_TYPE_TAG_KEY, apiFailureType.name()));
    metrics.increment(API_FAILURE_COUNTER, tags);
  }

  public void recordBatchUploadLatency(Duration duration) {
    metrics.timer(BATCH_UPLOAD_TIMER, duration, getDefaultTags());
  }

  private List<Tag> getDefaultTags() {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(CONFIG_VERSION_TAG_KEY, indexerConfig.getVersion().toString()));
    tags.add(
        Tag.of(
            DRY_RUN_TAG_KEY, String.valueOf(indexerConfig.getIndexerConfig().isDryRun())));
    return tags;
  }

  @Getter
  private static class FilesDiscoveredGaugeMetricsMetadata {
    public static final String NAME = METRICS_COMMON_PREFIX + "discovered_files";
    public static final String DESCRIPTION = "Number of source files discovered for the run";
  }

  @Getter
  private static class FilesProcessedGaugeMetricsMetadata {
    public static final String NAME = METRICS_COMMON_PREFIX + "processed_files";
    public static final String DESCRIPTION = "Number of source files processed during the run";
  }
}
