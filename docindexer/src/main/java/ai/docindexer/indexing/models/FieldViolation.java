package ai.docindexer.indexing.models;

import lombok.Value;

@Value
public class FieldViolation {
  String field;
  String message;

  @Override
  public String toString() {
    return field + ": " + message;
  }
}
