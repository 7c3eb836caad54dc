package ai.docindexer.exceptions;

public class StructuralException extends RuntimeException {
  public StructuralException(String message) {
    super(message);
  }

  public StructuralException(String message, Throwable cause) {
    super(message, cause);
  }
}
