package ai.docindexer.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Declared type of an index field. Each constant carries the Edm name used by the search service
 * and the short name accepted in hand-written schema files.
 */
@Getter
public enum FieldType {
  STRING("Edm.String", "string"),
  INT32("Edm.Int32", "int32"),
  INT64("Edm.Int64", "int64"),
  DOUBLE("Edm.Double", "double"),
  BOOLEAN("Edm.Boolean", "boolean"),
  DATETIME("Edm.DateTimeOffset", "datetime"),
  STRING_COLLECTION("Collection(Edm.String)", "string-collection"),
  FLOAT_VECTOR("Collection(Edm.Single)", "float-vector");

  private final String edmName;
  private final String shortName;

  FieldType(String edmName, String shortName) {
    this.edmName = edmName;
    this.shortName = shortName;
  }

  @JsonValue
  public String toEdmName() {
    return edmName;
  }

  @JsonCreator
  public static FieldType fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("field type cannot be null");
    }
    String trimmed = name.trim();
    for (FieldType fieldType : values()) {
      if (fieldType.edmName.equalsIgnoreCase(trimmed)
          || fieldType.shortName.equalsIgnoreCase(trimmed)
          || fieldType.name().equalsIgnoreCase(trimmed)) {
        return fieldType;
      }
    }
    throw new IllegalArgumentException("Unsupported field type: " + name);
  }
}
