package ai.docindexer.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ApiConstants {

  private ApiConstants() {}

  public static final String DEFAULT_API_VERSION = "2024-07-01";

  // Environment fallbacks for credentials, first non-blank wins
  public static final String[] SEARCH_ENDPOINT_ENV_KEYS = {
    "SEARCH_SERVICE_ENDPOINT", "AZURE_SEARCH_ENDPOINT"
  };
  public static final String[] SEARCH_API_KEY_ENV_KEYS = {
    "SEARCH_SERVICE_KEY", "AZURE_SEARCH_KEY"
  };
  public static final String[] SEARCH_API_VERSION_ENV_KEYS = {"SEARCH_SERVICE_API_VERSION"};

  // API Endpoints
  public static final String INDEX_DEFINITION = "/indexes/{0}?api-version={1}";
  public static final String INDEX_DOCUMENTS = "/indexes/{0}/docs/index?api-version={1}";

  // Header constants
  public static final String API_KEY_HEADER = "api-key";
  public static final String RETRY_AFTER_HEADER = "Retry-After";
  public static final String RETRY_AFTER_MS_HEADER = "retry-after-ms";

  public static final String SEARCH_ACTION_KEY = "@search.action";
  public static final String MERGE_OR_UPLOAD_ACTION = "mergeOrUpload";

  public static final int STATUS_MULTI_STATUS = 207;
  public static final int STATUS_NOT_FOUND = 404;
  public static final int STATUS_TOO_MANY_REQUESTS = 429;
  public static final List<Integer> AUTH_FAILURE_STATUS_CODES =
      Collections.unmodifiableList(Arrays.asList(401, 403));
  // not worth repeating: the same request will fail the same way
  public static final List<Integer> ACCEPTABLE_HTTP_FAILURE_STATUS_CODES =
      Collections.unmodifiableList(Arrays.asList(400, 401, 403, 404, 409, 413));

  public static final String UNAUTHORIZED_ERROR_MESSAGE =
      "Confirm that the search service api key is valid and has write access to the index.";
}
