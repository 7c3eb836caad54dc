package ai.docindexer.exceptions;

public class IndexLifecycleException extends RuntimeException {
  public IndexLifecycleException(String message) {
    super(message);
  }

  public IndexLifecycleException(String message, Throwable cause) {
    super(message, cause);
  }
}
