package io.b2mash.governance.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonMapsTest {

  @Test
  void parse_object_preservesNestedValues() {
    var parsed = JsonMaps.parse("{\"days\": 30, \"tags\": [\"a\", \"b\"], \"flag\": true}");

    assertThat(parsed).containsEntry("days", 30).containsEntry("flag", true);
    assertThat(parsed.get("tags")).isEqualTo(List.of("a", "b"));
  }

  @Test
  void parse_blankOrMalformed_returnsEmptyMutableMap() {
    assertThat(JsonMaps.parse(null)).isEmpty();
    assertThat(JsonMaps.parse("  ")).isEmpty();

    var malformed = JsonMaps.parse("{not json");
    assertThat(malformed).isEmpty();
    malformed.put("ok", 1);
    assertThat(malformed).containsEntry("ok", 1);
  }

  @Test
  void write_serializesEntriesAndHandlesNull() {
    var value = new LinkedHashMap<String, Object>();
    value.put("b", 2);
    value.put("a", "x");

    assertThat(JsonMaps.write(value)).contains("\"b\":2").contains("\"a\":\"x\"");
    assertThat(JsonMaps.write(null)).isEqualTo("{}");
  }

  @Test
  void converter_delegatesToJsonMaps() {
    var converter = new JsonMapConverter();

    String column = converter.convertToDatabaseColumn(Map.of("k", 1));

    assertThat(converter.convertToEntityAttribute(column)).containsEntry("k", 1);
  }
}
