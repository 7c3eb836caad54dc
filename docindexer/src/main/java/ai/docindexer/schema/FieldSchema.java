package ai.docindexer.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Definition of one index field. The searchable/filterable/facetable/sortable/retrievable flags
 * are passed through to index creation and are not interpreted by validation.
 */
@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldSchema {
  @NonNull String name;
  @NonNull FieldType type;
  boolean key;
  boolean required;
  // only meaningful for FLOAT_VECTOR
  Integer dimensions;
  String vectorSearchProfile;
  Boolean searchable;
  Boolean filterable;
  Boolean facetable;
  Boolean sortable;
  Boolean retrievable;

  public boolean isRequired() {
    return required || key;
  }
}
