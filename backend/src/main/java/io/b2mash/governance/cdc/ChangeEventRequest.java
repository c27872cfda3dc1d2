package io.b2mash.governance.cdc;

import java.util.Map;

/**
 * Input to {@link ChangeDataCaptureService#recordEvent(ChangeEventRequest)}.
 *
 * @param domain e.g. "compliance" or "governance"
 * @param entityName table or logical entity the operation applies to
 * @param entityId policy id, partition name or run id; nullable
 * @param operation e.g. RETENTION_ENFORCED, PARTITION_DROPPED
 * @param payload operation details
 * @param dryRun whether the operation was simulated
 * @param correlationId run id tying events of one cycle together; nullable
 */
public record ChangeEventRequest(
    String domain,
    String entityName,
    String entityId,
    String operation,
    Map<String, Object> payload,
    boolean dryRun,
    String correlationId) {

  public static final String DOMAIN_COMPLIANCE = "compliance";
  public static final String DOMAIN_GOVERNANCE = "governance";
}
