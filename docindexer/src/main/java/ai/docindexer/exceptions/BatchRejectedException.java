package ai.docindexer.exceptions;

import lombok.Getter;

/** The backend refused the whole request for a reason that repeating it will not change. */
@Getter
public class BatchRejectedException extends RuntimeException {
  private final int statusCode;

  public BatchRejectedException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }
}
