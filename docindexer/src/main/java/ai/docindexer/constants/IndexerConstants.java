package ai.docindexer.constants;

public class IndexerConstants {
  private IndexerConstants() {}

  public static final String DOC_ID_FIELD = "doc_id";
  public static final String PAGE_NUMBER_FIELD = "page_number";
  public static final String CHUNK_POSITION_FIELD = "chunk_position";
  public static final String RECORD_ID_FORMAT = "%s_p%d_c%d";

  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_FILE_CONCURRENCY = 4;
  public static final int DEFAULT_BATCH_CONCURRENCY = 1;
  public static final int DEFAULT_MAX_UPLOAD_ATTEMPTS = 3;
  public static final long DEFAULT_RETRY_BASE_DELAY_MILLIS = 1000;
  public static final long DEFAULT_MAX_RETRY_DELAY_MILLIS = 30000;
  public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;
  public static final String DEFAULT_FILE_PATTERN = "*.json";
  public static final String DEFAULT_CHECKPOINT_FILE = ".docindexer-checkpoint.json";
  public static final int MAX_FAILURE_SAMPLES_PER_CATEGORY = 5;
  public static final int PROGRESS_LOG_INTERVAL_FILES = 10;

  public static final int EXIT_CODE_CLEAN = 0;
  public static final int EXIT_CODE_DEFECTS = 1;
  public static final int EXIT_CODE_FATAL = 2;
}
