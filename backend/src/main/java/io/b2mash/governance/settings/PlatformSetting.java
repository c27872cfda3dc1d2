package io.b2mash.governance.settings;

import io.b2mash.governance.support.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import org.hibernate.annotations.ColumnTransformer;

@Entity
@Table(name = "platform_settings")
public class PlatformSetting {

  @Id
  @Column(name = "setting_key", length = 150)
  private String key;

  @Convert(converter = JsonMapConverter.class)
  @ColumnTransformer(write = "?::jsonb")
  @Column(name = "value", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> value;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PlatformSetting() {}

  public PlatformSetting(String key, Map<String, Object> value, Instant updatedAt) {
    this.key = key;
    this.value = value;
    this.updatedAt = updatedAt;
  }

  public String getKey() {
    return key;
  }

  public Map<String, Object> getValue() {
    return value;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void update(Map<String, Object> value, Instant updatedAt) {
    this.value = value;
    this.updatedAt = updatedAt;
  }
}
