package ai.docindexer.config.models.configv1;

import static ai.docindexer.constants.IndexerConstants.DEFAULT_BATCH_CONCURRENCY;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_BATCH_SIZE;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_CHECKPOINT_FILE;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_FILE_CONCURRENCY;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_FILE_PATTERN;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_MAX_RETRY_DELAY_MILLIS;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_MAX_UPLOAD_ATTEMPTS;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_REQUEST_TIMEOUT_SECONDS;
import static ai.docindexer.constants.IndexerConstants.DEFAULT_RETRY_BASE_DELAY_MILLIS;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
@ToString
public class IndexerConfig {
  // file or directory of extracted documents; may come from the command line instead
  @Nullable private String inputPath;
  @Nullable private String schemaPath;
  // falls back to the name declared in the schema file
  @Nullable private String indexName;

  @Builder.Default private String filePattern = DEFAULT_FILE_PATTERN;
  @Builder.Default private boolean recursive = false;
  @Builder.Default private String checkpointPath = DEFAULT_CHECKPOINT_FILE;
  @Builder.Default private boolean dryRun = false;

  @Builder.Default private int batchSize = DEFAULT_BATCH_SIZE;
  @Builder.Default private int fileConcurrency = DEFAULT_FILE_CONCURRENCY;
  @Builder.Default private int batchConcurrency = DEFAULT_BATCH_CONCURRENCY;

  @Builder.Default private int maxUploadAttempts = DEFAULT_MAX_UPLOAD_ATTEMPTS;
  @Builder.Default private long retryBaseDelayMillis = DEFAULT_RETRY_BASE_DELAY_MILLIS;
  @Builder.Default private long maxRetryDelayMillis = DEFAULT_MAX_RETRY_DELAY_MILLIS;
  @Builder.Default private int requestTimeoutSeconds = DEFAULT_REQUEST_TIMEOUT_SECONDS;
}
