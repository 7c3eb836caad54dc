package ai.docindexer.exceptions;

import lombok.Getter;

@Getter
public class FatalAuthException extends RuntimeException {
  private final int statusCode;

  public FatalAuthException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }
}
