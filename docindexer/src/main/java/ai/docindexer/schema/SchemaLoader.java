package ai.docindexer.schema;

import ai.docindexer.exceptions.SchemaException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/*
 * Reads index schema files. Two layouts are accepted: a bare JSON array of field entries, or an
 * index definition object carrying "name" and "fields".
 */
@Slf4j
public class SchemaLoader {
  private static final String FIELDS_NODE = "fields";
  private static final String NAME_NODE = "name";
  private static final String TYPE_NODE = "type";
  // never part of an index definition sent to the service
  private static final Set<String> IGNORED_NODES =
      ImmutableSet.of("$schema", "comment", "suggesters");
  private final ObjectMapper mapper;

  public SchemaLoader() {
    this.mapper = new ObjectMapper();
  }

  public IndexSchema loadSchemaFromFile(Path schemaPath) {
    try (InputStream in = Files.newInputStream(schemaPath)) {
      IndexSchema schema = loadSchemaFromJsonNode(mapper.readTree(in));
      log.info(
          "Loaded schema from {} with {} fields, key field: {}",
          schemaPath,
          schema.getFields().size(),
          schema.getKeyField().getName());
      return schema;
    } catch (IOException e) {
      throw new SchemaException("Failed to read schema file " + schemaPath, e);
    }
  }

  public IndexSchema loadSchemaFromString(String schemaJson) {
    try {
      return loadSchemaFromJsonNode(mapper.readTree(schemaJson));
    } catch (IOException e) {
      throw new SchemaException("Failed to parse schema", e);
    }
  }

  private IndexSchema loadSchemaFromJsonNode(JsonNode root) throws IOException {
    JsonNode fieldsNode;
    String indexName = null;
    Map<String, Object> settings = new LinkedHashMap<>();
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new SchemaException("Schema is empty");
    } else if (root.isArray()) {
      fieldsNode = root;
    } else if (root.isObject() && root.has(FIELDS_NODE)) {
      fieldsNode = root.get(FIELDS_NODE);
      if (root.hasNonNull(NAME_NODE)) {
        indexName = root.get(NAME_NODE).asText();
      }
      Iterator<Map.Entry<String, JsonNode>> nodes = root.fields();
      while (nodes.hasNext()) {
        Map.Entry<String, JsonNode> node = nodes.next();
        if (!FIELDS_NODE.equals(node.getKey())
            && !NAME_NODE.equals(node.getKey())
            && !IGNORED_NODES.contains(node.getKey())) {
          settings.put(node.getKey(), mapper.treeToValue(node.getValue(), Object.class));
        }
      }
    } else {
      throw new SchemaException("Schema must be an array of fields or an object with 'fields'");
    }

    List<FieldSchema> fields = new ArrayList<>();
    if (!fieldsNode.isArray() || fieldsNode.isEmpty()) {
      throw new SchemaException("Schema 'fields' must be a non-empty array");
    }
    for (JsonNode fieldNode : fieldsNode) {
      if (!fieldNode.hasNonNull(NAME_NODE) || !fieldNode.hasNonNull(TYPE_NODE)) {
        throw new SchemaException("Field definition must have a name and a type: " + fieldNode);
      }
      try {
        fields.add(mapper.treeToValue(fieldNode, FieldSchema.class));
      } catch (IOException | IllegalArgumentException e) {
        throw new SchemaException("Invalid field definition: " + fieldNode, e);
      }
    }
    try {
      return IndexSchema.of(indexName, fields, settings);
    } catch (IllegalArgumentException e) {
      throw new SchemaException(e.getMessage(), e);
    }
  }
}
