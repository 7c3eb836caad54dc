package ai.docindexer.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable set of field definitions for the target index. Built once at startup and shared by
 * every worker; exactly one field is the key.
 */
@Getter
@EqualsAndHashCode
@ToString
public class IndexSchema {
  @Nullable private final String name;
  private final List<FieldSchema> fields;
  @ToString.Exclude @EqualsAndHashCode.Exclude private final Map<String, FieldSchema> fieldsByName;
  @ToString.Exclude @EqualsAndHashCode.Exclude private final FieldSchema keyField;
  // index-level settings (vectorSearch, semantic, ...) sent verbatim on creation
  private final Map<String, Object> settings;

  private IndexSchema(
      @Nullable String name, List<FieldSchema> fields, Map<String, Object> settings) {
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
    this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    Map<String, FieldSchema> byName = new LinkedHashMap<>();
    FieldSchema key = null;
    for (FieldSchema field : fields) {
      if (byName.put(field.getName(), field) != null) {
        throw new IllegalArgumentException("Duplicate field in schema: " + field.getName());
      }
      if (field.getType() == FieldType.FLOAT_VECTOR
          && (field.getDimensions() == null || field.getDimensions() <= 0)) {
        throw new IllegalArgumentException(
            String.format("Vector field %s must declare positive dimensions", field.getName()));
      }
      if (field.isKey()) {
        if (key != null) {
          throw new IllegalArgumentException(
              String.format(
                  "Schema declares more than one key field: %s, %s",
                  key.getName(), field.getName()));
        }
        if (field.getType() != FieldType.STRING) {
          throw new IllegalArgumentException(
              String.format("Key field %s must be of type %s", field.getName(), FieldType.STRING));
        }
        key = field;
      }
    }
    if (key == null) {
      throw new IllegalArgumentException("Schema must declare exactly one key field");
    }
    this.fieldsByName = ImmutableMap.copyOf(byName);
    this.keyField = key;
  }

  public static IndexSchema of(@Nullable String name, @Nonnull List<FieldSchema> fields) {
    return new IndexSchema(name, fields, Collections.emptyMap());
  }

  public static IndexSchema of(
      @Nullable String name,
      @Nonnull List<FieldSchema> fields,
      @Nonnull Map<String, Object> settings) {
    return new IndexSchema(name, fields, settings);
  }

  public Optional<FieldSchema> getField(String fieldName) {
    return Optional.ofNullable(fieldsByName.get(fieldName));
  }

  public boolean hasField(String fieldName) {
    return fieldsByName.containsKey(fieldName);
  }

  public IndexSchema withName(String indexName) {
    return new IndexSchema(indexName, fields, settings);
  }
}
