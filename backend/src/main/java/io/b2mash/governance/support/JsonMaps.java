package io.b2mash.governance.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/** Lenient conversion between JSON text columns and {@code Map<String, Object>}. */
public final class JsonMaps {

  private static final Logger log = LoggerFactory.getLogger(JsonMaps.class);

  private static final JsonMapper MAPPER = JsonMapper.builder().build();
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private JsonMaps() {}

  /**
   * Parses a JSON object. Blank input yields an empty map; malformed input is logged and also
   * yields an empty map so that one bad configuration row cannot stop a run.
   */
  public static Map<String, Object> parse(String json) {
    if (json == null || json.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, Object> parsed = MAPPER.readValue(json, MAP_TYPE);
      return parsed != null ? parsed : new LinkedHashMap<>();
    } catch (JacksonException e) {
      log.warn("Failed to parse JSON column; falling back to defaults: {}", e.getOriginalMessage());
      return new LinkedHashMap<>();
    }
  }

  public static String write(Map<String, Object> value) {
    return MAPPER.writeValueAsString(value != null ? value : Map.of());
  }
}
