package ai.docindexer.api.models.request;

import ai.docindexer.schema.FieldSchema;
import ai.docindexer.schema.FieldType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Field entry as the search service exchanges it; the type is kept as the raw type name. */
@Builder
@Value
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexField {
  @NonNull String name;
  @NonNull String type;
  Boolean key;
  Boolean searchable;
  Boolean filterable;
  Boolean facetable;
  Boolean sortable;
  Boolean retrievable;
  Integer dimensions;
  String vectorSearchProfile;

  public static IndexField fromFieldSchema(FieldSchema field) {
    IndexFieldBuilder builder =
        IndexField.builder()
            .name(field.getName())
            .type(field.getType().getEdmName())
            .searchable(field.getSearchable())
            .filterable(field.getFilterable())
            .facetable(field.getFacetable())
            .sortable(field.getSortable())
            .retrievable(field.getRetrievable());
    if (field.isKey()) {
      // the service refuses a key that cannot be retrieved
      builder.key(true).retrievable(true);
    }
    if (field.getType() == FieldType.FLOAT_VECTOR) {
      builder.dimensions(field.getDimensions()).vectorSearchProfile(field.getVectorSearchProfile());
    }
    return builder.build();
  }
}
