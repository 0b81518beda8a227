package com.github.dbmdz.altopipeline.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads dictionaries from JSON.
 *
 * <p>Two layouts are supported: a plain object mapping keys to values ({@code {"Berlin": "DE"}})
 * and an array of objects where the key and the value are read from the given fields ({@code
 * [{"entry": "Berlin", "geonames_id": "2950159"}]}). Objects without the key field are skipped,
 * objects without the value field use the key as value. Duplicate keys keep their first value.
 */
public class DictionaryLoader {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final ObjectMapper mapper = new ObjectMapper();
  private final String keyField;
  private final String valueField;

  public DictionaryLoader() {
    this("entry", "value");
  }

  public DictionaryLoader(String keyField, String valueField) {
    this.keyField = keyField;
    this.valueField = valueField;
  }

  public MapDictionaryProvider load(String name, Path path) throws IOException {
    try (InputStream input = Files.newInputStream(path)) {
      MapDictionaryProvider dictionary = load(name, input);
      log.info(
          "Loaded {} entries for dictionary '{}' from {}",
          dictionary.getTable().size(),
          name,
          path);
      return dictionary;
    }
  }

  public MapDictionaryProvider load(String name, InputStream input) throws IOException {
    JsonNode root = mapper.readTree(input);
    Map<String, String> table = new LinkedHashMap<>();
    if (root.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        put(name, table, field.getKey(), field.getValue().asText());
      }
    } else if (root.isArray()) {
      for (JsonNode entry : root) {
        JsonNode key = entry.get(keyField);
        if (key == null || key.isNull()) {
          log.warn("Skipping entry without '{}' in dictionary '{}': {}", keyField, name, entry);
          continue;
        }
        JsonNode value = entry.get(valueField);
        String text = key.asText();
        put(name, table, text, value == null || value.isNull() ? text : value.asText());
      }
    } else {
      throw new IOException(
          String.format(
              "Dictionary '%s' must be a JSON object or array, got %s",
              name, root.getNodeType()));
    }
    return new MapDictionaryProvider(name, table);
  }

  private static void put(String name, Map<String, String> table, String key, String value) {
    if (table.containsKey(key)) {
      log.warn("Duplicate key '{}' in dictionary '{}', keeping '{}'", key, name, table.get(key));
      return;
    }
    table.put(key, value);
  }
}
