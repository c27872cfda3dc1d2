package io.b2mash.governance.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.governance.cdc.ChangeDataCaptureService;
import io.b2mash.governance.cdc.ChangeEventRequest;
import io.b2mash.governance.testutil.NoOpTransactionManager;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetentionEnforcementServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-01T03:00:00Z");

  @Mock private RetentionPolicyRepository policyRepository;
  @Mock private RetentionSelectionRepository selectionRepository;
  @Mock private RetentionAuditLogRepository auditLogRepository;
  @Mock private ChangeDataCaptureService changeDataCaptureService;

  private final RetentionStrategyRegistry registry = new RetentionStrategyRegistry();
  private final NoOpTransactionManager transactionManager = new NoOpTransactionManager();
  private RetentionEnforcementService service;

  @BeforeEach
  void setUp() {
    registry.register(
        "unit_records",
        policy ->
            RetentionPlan.of(
                RetentionSelection.from("unit_records")
                    .where(
                        "created_at < now() - make_interval(days => :days)",
                        "days",
                        policy.retentionPeriodDays()),
                "purge unit records"));
    service =
        new RetentionEnforcementService(
            registry,
            policyRepository,
            selectionRepository,
            auditLogRepository,
            changeDataCaptureService,
            transactionManager,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static RetentionPolicy policy(String action) {
    return new RetentionPolicy(99L, "unit_records", action, 30, "unit records", Map.of(), true);
  }

  private static RetentionPolicy hardDelete() {
    return policy("hard-delete");
  }

  @Test
  void enforce_commitMode_deletesAndVerifiesCleared() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(11L, 12L));
    when(selectionRepository.count(any())).thenReturn(2L, 0L);
    when(selectionRepository.delete(any())).thenReturn(2);

    var summary =
        service.enforce(EnforcementOptions.builder().policies(List.of(hardDelete())).build());

    assertThat(summary.dryRun()).isFalse();
    assertThat(summary.results()).hasSize(1);
    var result = summary.results().get(0);
    assertThat(result.policyId()).isEqualTo(99L);
    assertThat(result.status()).isEqualTo(RetentionStatus.EXECUTED);
    assertThat(result.affectedRows()).isEqualTo(2);
    assertThat(result.sampleIds()).containsExactly(11L, 12L);
    assertThat(result.verification())
        .isEqualTo(new VerificationOutcome(VerificationStatus.CLEARED, 0));

    var auditCaptor = ArgumentCaptor.forClass(RetentionAuditLog.class);
    verify(auditLogRepository, times(1)).save(auditCaptor.capture());
    assertThat(auditCaptor.getValue().getRowsAffected()).isEqualTo(2);
    assertThat(auditCaptor.getValue().getPolicyId()).isEqualTo(99L);
    assertThat(auditCaptor.getValue().isDryRun()).isFalse();
    assertThat(auditCaptor.getValue().getDetails())
        .containsEntry("reason", "purge unit records")
        .containsEntry("runId", summary.runId());
    assertThat(transactionManager.commits()).isEqualTo(1);
  }

  @Test
  void enforce_simulateMode_reportsMatchesWithoutMutating() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(11L));
    when(selectionRepository.count(any())).thenReturn(1L);

    var summary =
        service.enforce(
            EnforcementOptions.builder()
                .mode(RetentionMode.SIMULATE)
                .policies(List.of(hardDelete()))
                .build());

    var result = summary.results().get(0);
    assertThat(summary.dryRun()).isTrue();
    assertThat(result.status()).isEqualTo(RetentionStatus.EXECUTED);
    assertThat(result.affectedRows()).isEqualTo(1);
    assertThat(result.preRunCount()).isEqualTo(1);
    assertThat(result.verification()).isEqualTo(VerificationOutcome.simulated(1));
    verify(selectionRepository, never()).delete(any());
    verify(selectionRepository, never()).softDelete(any());
    verify(auditLogRepository, never()).save(any());
  }

  @Test
  void enforce_dryRunWithNoMatches_writesNoAuditRow() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of());

    var summary =
        service.enforce(
            EnforcementOptions.builder().dryRun(true).policies(List.of(hardDelete())).build());

    var result = summary.results().get(0);
    assertThat(result.affectedRows()).isZero();
    assertThat(result.verification().status()).isEqualTo(VerificationStatus.SIMULATED);
    verify(auditLogRepository, never()).save(any());
  }

  @Test
  void enforce_commitWithNoMatches_stillWritesAuditRow() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of());

    var summary =
        service.enforce(EnforcementOptions.builder().policies(List.of(hardDelete())).build());

    var result = summary.results().get(0);
    assertThat(result.status()).isEqualTo(RetentionStatus.EXECUTED);
    assertThat(result.verification().status()).isEqualTo(VerificationStatus.CLEARED);
    verify(selectionRepository, never()).count(any());
    verify(selectionRepository, never()).delete(any());
    verify(auditLogRepository).save(any());
  }

  @Test
  void enforce_inactivePolicy_skipsWithoutQueries() {
    var inactive =
        new RetentionPolicy(5L, "unit_records", "hard-delete", 30, null, Map.of(), false);

    var summary = service.enforce(EnforcementOptions.builder().policies(List.of(inactive)).build());

    assertThat(summary.results().get(0).status()).isEqualTo(RetentionStatus.SKIPPED_INACTIVE);
    verifyNoInteractions(selectionRepository, auditLogRepository, changeDataCaptureService);
  }

  @Test
  void enforce_unregisteredEntity_skipsAsUnsupported() {
    var unknown = new RetentionPolicy(6L, "ledger_rows", "hard-delete", 30, null, Map.of(), true);

    var summary = service.enforce(EnforcementOptions.builder().policies(List.of(unknown)).build());

    assertThat(summary.results().get(0).status())
        .isEqualTo(RetentionStatus.SKIPPED_UNSUPPORTED);
    verifyNoInteractions(selectionRepository);
  }

  @Test
  void enforce_legalHold_skipsAndEmitsDryRunEvent() {
    var held =
        new RetentionPolicy(
            7L,
            "unit_records",
            "hard-delete",
            30,
            null,
            Map.of("legalHold", Map.of("active", true, "reason", "litigation", "owner", "legal")),
            true);

    var summary = service.enforce(EnforcementOptions.builder().policies(List.of(held)).build());

    var result = summary.results().get(0);
    assertThat(result.status()).isEqualTo(RetentionStatus.SKIPPED_LEGAL_HOLD);
    assertThat(result.reason()).isEqualTo("litigation");
    assertThat(result.context()).containsEntry("owner", "legal");
    assertThat(result.dryRun()).isTrue();
    verifyNoInteractions(selectionRepository);

    var eventCaptor = ArgumentCaptor.forClass(ChangeEventRequest.class);
    verify(changeDataCaptureService).recordEvent(eventCaptor.capture());
    assertThat(eventCaptor.getValue().dryRun()).isTrue();
    assertThat(eventCaptor.getValue().operation()).isEqualTo("RETENTION_SIMULATED");
  }

  @Test
  void enforce_residualRows_failsPolicyWithoutRollback() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(1L, 2L, 3L));
    when(selectionRepository.count(any())).thenReturn(3L, 1L);
    when(selectionRepository.delete(any())).thenReturn(2);

    var summary =
        service.enforce(EnforcementOptions.builder().policies(List.of(hardDelete())).build());

    var result = summary.results().get(0);
    assertThat(result.status()).isEqualTo(RetentionStatus.FAILED);
    assertThat(result.affectedRows()).isEqualTo(2);
    assertThat(result.isResidual()).isTrue();
    assertThat(result.error()).isEqualTo("1 rows still match policy 99 after hard-delete");
    assertThat(transactionManager.commits()).isEqualTo(1);
    assertThat(transactionManager.rollbacks()).isZero();
    verify(auditLogRepository).save(any());
  }

  @Test
  void enforce_residualRowsWithoutFailOnResidual_staysExecuted() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(1L));
    when(selectionRepository.count(any())).thenReturn(3L, 1L);
    when(selectionRepository.delete(any())).thenReturn(2);

    var summary =
        service.enforce(
            EnforcementOptions.builder()
                .policies(List.of(hardDelete()))
                .verification(new VerificationSettings(true, false, 5))
                .build());

    var result = summary.results().get(0);
    assertThat(result.status()).isEqualTo(RetentionStatus.EXECUTED);
    assertThat(result.verification().status()).isEqualTo(VerificationStatus.RESIDUAL);
  }

  @Test
  void enforce_softDelete_updatesSoftDeleteColumn() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(4L));
    when(selectionRepository.count(any())).thenReturn(1L, 0L);
    when(selectionRepository.softDelete(any())).thenReturn(1);

    var summary =
        service.enforce(
            EnforcementOptions.builder().policies(List.of(policy("soft-delete"))).build());

    assertThat(summary.results().get(0).status()).isEqualTo(RetentionStatus.EXECUTED);
    verify(selectionRepository).softDelete(any());
    verify(selectionRepository, never()).delete(any());
  }

  @Test
  void enforce_softDelete_excludesAlreadySoftDeletedRowsFromEveryQuery() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(4L));
    when(selectionRepository.count(any())).thenReturn(1L, 0L);
    when(selectionRepository.softDelete(any())).thenReturn(1);

    var summary =
        service.enforce(
            EnforcementOptions.builder().policies(List.of(policy("soft-delete"))).build());

    assertThat(summary.results().get(0).verification().status())
        .isEqualTo(VerificationStatus.CLEARED);
    var sampled = ArgumentCaptor.forClass(RetentionPlan.class);
    var counted = ArgumentCaptor.forClass(RetentionPlan.class);
    var updated = ArgumentCaptor.forClass(RetentionPlan.class);
    verify(selectionRepository).sampleIds(sampled.capture(), anyInt());
    verify(selectionRepository, times(2)).count(counted.capture());
    verify(selectionRepository).softDelete(updated.capture());
    var plans = new ArrayList<RetentionPlan>();
    plans.add(sampled.getValue());
    plans.addAll(counted.getAllValues());
    plans.add(updated.getValue());
    assertThat(plans)
        .allSatisfy(
            plan -> assertThat(plan.selection().predicates()).contains("\"deleted_at\" IS NULL"));
  }

  @Test
  void enforce_hardDelete_doesNotFilterOnSoftDeleteColumn() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(4L));
    when(selectionRepository.count(any())).thenReturn(1L, 0L);
    when(selectionRepository.delete(any())).thenReturn(1);

    service.enforce(EnforcementOptions.builder().policies(List.of(hardDelete())).build());

    var deleted = ArgumentCaptor.forClass(RetentionPlan.class);
    verify(selectionRepository).delete(deleted.capture());
    assertThat(deleted.getValue().selection().predicates())
        .doesNotContain("\"deleted_at\" IS NULL");
  }

  @Test
  void enforce_unsupportedAction_failsPolicyAndRollsBack() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(4L));
    when(selectionRepository.count(any())).thenReturn(1L);

    var summary =
        service.enforce(EnforcementOptions.builder().policies(List.of(policy("archive"))).build());

    var result = summary.results().get(0);
    assertThat(result.status()).isEqualTo(RetentionStatus.FAILED);
    assertThat(result.error()).isEqualTo("Unsupported data retention action \"archive\"");
    assertThat(transactionManager.rollbacks()).isEqualTo(1);
    verify(auditLogRepository, never()).save(any());

    var eventCaptor = ArgumentCaptor.forClass(ChangeEventRequest.class);
    verify(changeDataCaptureService).recordEvent(eventCaptor.capture());
    assertThat(eventCaptor.getValue().operation()).isEqualTo("RETENTION_FAILED");
  }

  @Test
  void enforce_queryFailure_isolatedToPolicy() {
    var second = new RetentionPolicy(100L, "unit_records", "hard-delete", 30, null, Map.of(), true);
    when(selectionRepository.sampleIds(any(), anyInt()))
        .thenThrow(new IllegalStateException("connection reset"))
        .thenReturn(List.of());

    var summary =
        service.enforce(
            EnforcementOptions.builder().policies(List.of(hardDelete(), second)).build());

    assertThat(summary.results())
        .extracting(RetentionExecutionResult::status)
        .containsExactly(RetentionStatus.FAILED, RetentionStatus.EXECUTED);
    assertThat(summary.results().get(0).error()).isEqualTo("connection reset");
  }

  @Test
  void enforce_alertThresholdReached_invokesCallbackAndIsolatesErrors() {
    var second = new RetentionPolicy(100L, "unit_records", "hard-delete", 30, null, Map.of(), true);
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(1L));
    when(selectionRepository.count(any())).thenReturn(10L, 0L, 10L, 0L);
    when(selectionRepository.delete(any())).thenReturn(10);
    List<RetentionAlert> alerts = new ArrayList<>();

    var summary =
        service.enforce(
            EnforcementOptions.builder()
                .policies(List.of(hardDelete(), second))
                .alertThreshold(10)
                .onAlert(
                    alert -> {
                      alerts.add(alert);
                      throw new IllegalStateException("pager down");
                    })
                .build());

    assertThat(alerts).hasSize(2);
    assertThat(alerts.get(0).runId()).isEqualTo(summary.runId());
    assertThat(alerts.get(0).mode()).isEqualTo(RetentionMode.COMMIT);
    assertThat(summary.results())
        .extracting(RetentionExecutionResult::status)
        .containsOnly(RetentionStatus.EXECUTED);
  }

  @Test
  void enforce_dryRun_neverInvokesAlert() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(1L));
    when(selectionRepository.count(any())).thenReturn(10_000L);
    List<RetentionAlert> alerts = new ArrayList<>();

    service.enforce(
        EnforcementOptions.builder()
            .dryRun(true)
            .policies(List.of(hardDelete()))
            .alertThreshold(1)
            .onAlert(alerts::add)
            .build());

    assertThat(alerts).isEmpty();
  }

  @Test
  void enforce_eventSinkFailure_doesNotAbortRun() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of(11L));
    when(selectionRepository.count(any())).thenReturn(1L, 0L);
    when(selectionRepository.delete(any())).thenReturn(1);
    doThrow(new IllegalStateException("outbox unavailable"))
        .when(changeDataCaptureService)
        .recordEvent(any());

    var summary =
        service.enforce(EnforcementOptions.builder().policies(List.of(hardDelete())).build());

    assertThat(summary.results().get(0).status()).isEqualTo(RetentionStatus.EXECUTED);
  }

  @Test
  void enforce_emitEventsDisabled_recordsNoEvents() {
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of());

    service.enforce(
        EnforcementOptions.builder()
            .policies(List.of(hardDelete()))
            .emitEvents(false)
            .build());

    verifyNoInteractions(changeDataCaptureService);
  }

  @Test
  void enforce_withoutPolicies_loadsActivePoliciesFromStore() {
    when(policyRepository.findActive()).thenReturn(List.of(hardDelete()));
    when(selectionRepository.sampleIds(any(), anyInt())).thenReturn(List.of());

    var summary = service.enforce(EnforcementOptions.builder().build());

    assertThat(summary.results()).hasSize(1);
    verify(policyRepository).findActive();
  }
}
