package ai.docindexer.indexing.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/** Outcome of validating one record. A record is either fully accepted or fully rejected. */
@Value
public class ValidationResult {
  String recordId;
  boolean valid;
  List<FieldViolation> errors;

  public static ValidationResult accepted(String recordId) {
    return new ValidationResult(recordId, true, ImmutableList.of());
  }

  public static ValidationResult rejected(String recordId, List<FieldViolation> errors) {
    return new ValidationResult(recordId, false, ImmutableList.copyOf(errors));
  }
}
