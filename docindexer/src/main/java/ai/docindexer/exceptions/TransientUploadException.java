package ai.docindexer.exceptions;

import lombok.Getter;

/** A failed backend call that may succeed when repeated: throttling, server errors, timeouts. */
@Getter
public class TransientUploadException extends RuntimeException {
  private final int statusCode;
  // 0 when the backend did not ask for a specific delay
  private final long retryAfterMillis;

  public TransientUploadException(String message, int statusCode, long retryAfterMillis) {
    super(message);
    this.statusCode = statusCode;
    this.retryAfterMillis = retryAfterMillis;
  }

  public TransientUploadException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.retryAfterMillis = 0;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }
}
