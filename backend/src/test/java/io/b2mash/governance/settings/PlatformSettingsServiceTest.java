package io.b2mash.governance.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlatformSettingsServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-15T02:30:00Z");
  private static final String KEY = "governance.retention.resume_gate";

  @Mock private PlatformSettingRepository repository;

  private PlatformSettingsService service() {
    return new PlatformSettingsService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void findByKey_returnsDetachedCopy() {
    var stored = new HashMap<String, Object>(Map.of("token", "abc"));
    when(repository.findById(KEY))
        .thenReturn(Optional.of(new PlatformSetting(KEY, stored, NOW.minusSeconds(60))));

    var value = service().findByKey(KEY).orElseThrow();
    value.put("token", "changed");

    assertThat(stored).containsEntry("token", "abc");
  }

  @Test
  void upsert_newKey_savesSetting() {
    when(repository.findById(KEY)).thenReturn(Optional.empty());

    service().upsert(KEY, Map.of("token", "abc"));

    var captor = ArgumentCaptor.forClass(PlatformSetting.class);
    verify(repository).save(captor.capture());
    assertThat(captor.getValue().getKey()).isEqualTo(KEY);
    assertThat(captor.getValue().getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void upsert_existingKey_updatesInPlace() {
    var existing = new PlatformSetting(KEY, Map.of("token", "old"), NOW.minusSeconds(600));
    when(repository.findById(KEY)).thenReturn(Optional.of(existing));

    service().upsert(KEY, Map.of("token", "new"));

    assertThat(existing.getValue()).containsEntry("token", "new");
    assertThat(existing.getUpdatedAt()).isEqualTo(NOW);
    verify(repository, never()).save(any());
  }
}
