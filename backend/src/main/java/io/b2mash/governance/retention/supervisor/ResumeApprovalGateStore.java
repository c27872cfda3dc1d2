package io.b2mash.governance.retention.supervisor;

import io.b2mash.governance.settings.PlatformSettingsService;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the retention resume gate in {@code platform_settings}. The stored gate is the
 * source of truth across restarts.
 */
@Component
public class ResumeApprovalGateStore {

  private static final Logger log = LoggerFactory.getLogger(ResumeApprovalGateStore.class);

  static final String SETTING_KEY = "governance.data_retention.resume_gate";

  private final PlatformSettingsService settingsService;
  private final Clock clock;

  public ResumeApprovalGateStore(PlatformSettingsService settingsService, Clock clock) {
    this.settingsService = settingsService;
    this.clock = clock;
  }

  /**
   * Loads the persisted gate.
   *
   * @throws RuntimeException when the store cannot be read; callers treat that as "not approved"
   */
  public Optional<ResumeApprovalGate> load() {
    return settingsService.findByKey(SETTING_KEY).map(ResumeApprovalGate::fromSetting);
  }

  /** Persists the gate. Returns false (and logs) when the write fails. */
  public boolean save(ResumeApprovalGate gate) {
    try {
      settingsService.upsert(SETTING_KEY, gate.toSetting());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to persist retention resume gate", e);
      return false;
    }
  }

  public void clear() {
    try {
      settingsService.delete(SETTING_KEY);
    } catch (RuntimeException e) {
      log.error("Failed to clear retention resume gate", e);
    }
  }

  /**
   * Approves the persisted gate if its token matches.
   *
   * @return true when the gate was approved
   */
  public boolean approve(String token, String approvedBy) {
    Optional<ResumeApprovalGate> gate;
    try {
      gate = load();
    } catch (RuntimeException e) {
      log.error("Failed to read retention resume gate for approval", e);
      return false;
    }
    if (gate.isEmpty() || token == null || !token.equals(gate.get().resumeToken())) {
      log.warn("Resume approval by {} rejected: no paused gate with the given token", approvedBy);
      return false;
    }
    boolean saved = save(gate.get().approve(approvedBy, clock.instant()));
    if (saved) {
      log.info("Retention resume approved by {}", approvedBy);
    }
    return saved;
  }
}
