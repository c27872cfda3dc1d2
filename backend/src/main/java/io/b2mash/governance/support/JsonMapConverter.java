package io.b2mash.governance.support;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Map;

/**
 * Maps a {@code jsonb} column to {@code Map<String, Object>}. Entities pair it with a
 * {@code ColumnTransformer} that casts the bound text to jsonb.
 */
@Converter
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

  @Override
  public String convertToDatabaseColumn(Map<String, Object> attribute) {
    return JsonMaps.write(attribute);
  }

  @Override
  public Map<String, Object> convertToEntityAttribute(String dbData) {
    return JsonMaps.parse(dbData);
  }
}
