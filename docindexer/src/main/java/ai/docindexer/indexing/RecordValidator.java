package ai.docindexer.indexing;

import ai.docindexer.indexing.models.FieldViolation;
import ai.docindexer.indexing.models.FlatRecord;
import ai.docindexer.indexing.models.ValidationResult;
import ai.docindexer.schema.FieldSchema;
import ai.docindexer.schema.FieldValueConverter;
import ai.docindexer.schema.IndexSchema;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a record against the schema. Fields the schema does not declare are ignored; a null
 * value counts as absent. Every violation is reported, not only the first.
 */
public class RecordValidator {

  public ValidationResult validate(FlatRecord record, IndexSchema schema) {
    List<FieldViolation> errors = new ArrayList<>();

    FieldSchema keyField = schema.getKeyField();
    Object keyValue = record.get(keyField.getName());
    if (!(keyValue instanceof String) || ((String) keyValue).trim().isEmpty()) {
      errors.add(new FieldViolation(keyField.getName(), "key field is missing or blank"));
    }

    for (FieldSchema field : schema.getFields()) {
      if (field.isKey()) {
        continue;
      }
      Object value = record.get(field.getName());
      if (value == null) {
        if (field.isRequired()) {
          errors.add(new FieldViolation(field.getName(), "required field is missing"));
        }
        continue;
      }
      try {
        FieldValueConverter.convert(field, value);
      } catch (IllegalArgumentException e) {
        errors.add(new FieldViolation(field.getName(), e.getMessage()));
      }
    }

    return errors.isEmpty()
        ? ValidationResult.accepted(record.getId())
        : ValidationResult.rejected(record.getId(), errors);
  }
}
