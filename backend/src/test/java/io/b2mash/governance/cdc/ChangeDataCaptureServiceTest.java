package io.b2mash.governance.cdc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChangeDataCaptureServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-15T02:30:00Z");

  @Mock private ChangeEventRepository changeEventRepository;

  private ChangeDataCaptureService service() {
    return new ChangeDataCaptureService(changeEventRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void recordEvent_persistsPendingEventWithFreshUuid() {
    when(changeEventRepository.save(any(ChangeEvent.class))).thenAnswer(inv -> inv.getArgument(0));
    var request =
        new ChangeEventRequest(
            ChangeEventRequest.DOMAIN_COMPLIANCE,
            "user_sessions",
            "7",
            "RETENTION_ENFORCED",
            Map.of("rowsAffected", 12),
            false,
            "run-1");

    var first = service().recordEvent(request);
    var second = service().recordEvent(request);

    assertThat(first.getStatus()).isEqualTo(ChangeEvent.STATUS_PENDING);
    assertThat(first.getCreatedAt()).isEqualTo(NOW);
    assertThat(first.getCorrelationId()).isEqualTo("run-1");
    assertThat(first.getPayload()).containsEntry("rowsAffected", 12);
    assertThat(first.getEventUuid()).isNotEqualTo(second.getEventUuid());
  }

  @Test
  void recordEvent_missingOperation_isRejected() {
    var request =
        new ChangeEventRequest(
            ChangeEventRequest.DOMAIN_GOVERNANCE,
            "audit_events",
            null,
            null,
            Map.of(),
            false,
            null);

    assertThatThrownBy(() -> service().recordEvent(request))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(changeEventRepository);
  }
}
