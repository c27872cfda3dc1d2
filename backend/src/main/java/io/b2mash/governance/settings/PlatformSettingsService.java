package io.b2mash.governance.settings;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Key/value store for operator-managed state such as the retention resume gate. */
@Service
public class PlatformSettingsService {

  private final PlatformSettingRepository repository;
  private final Clock clock;

  public PlatformSettingsService(PlatformSettingRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Optional<Map<String, Object>> findByKey(String key) {
    return repository
        .findById(key)
        .<Map<String, Object>>map(setting -> new LinkedHashMap<>(setting.getValue()));
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void upsert(String key, Map<String, Object> value) {
    var now = clock.instant();
    repository
        .findById(key)
        .ifPresentOrElse(
            existing -> existing.update(value, now),
            () -> repository.save(new PlatformSetting(key, value, now)));
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void delete(String key) {
    repository.deleteById(key);
  }
}
