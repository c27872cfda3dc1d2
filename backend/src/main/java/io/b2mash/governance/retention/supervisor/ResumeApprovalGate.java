package io.b2mash.governance.retention.supervisor;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted state that holds the retention supervisor after repeated failures until an operator
 * approves a resume with the matching token.
 *
 * @param status "paused" while the gate holds, "active" once cleared
 * @param resumeApproved set by the operator
 * @param resumeToken opaque token the approval must quote
 * @param pausedAt when the supervisor paused
 * @param pausedUntil end of the backoff window
 * @param failureReason message of the failure that caused the pause
 * @param approvedBy operator who approved; nullable
 * @param approvedAt approval time; nullable
 */
public record ResumeApprovalGate(
    String status,
    boolean resumeApproved,
    String resumeToken,
    Instant pausedAt,
    Instant pausedUntil,
    String failureReason,
    String approvedBy,
    Instant approvedAt) {

  public static final String STATUS_PAUSED = "paused";
  public static final String STATUS_ACTIVE = "active";

  public static ResumeApprovalGate paused(
      String resumeToken, Instant pausedAt, Instant pausedUntil, String failureReason) {
    return new ResumeApprovalGate(
        STATUS_PAUSED, false, resumeToken, pausedAt, pausedUntil, failureReason, null, null);
  }

  public ResumeApprovalGate approve(String approvedBy, Instant approvedAt) {
    return new ResumeApprovalGate(
        status, true, resumeToken, pausedAt, pausedUntil, failureReason, approvedBy, approvedAt);
  }

  public boolean approves(String token) {
    return resumeApproved && resumeToken != null && resumeToken.equals(token);
  }

  Map<String, Object> toSetting() {
    var value = new LinkedHashMap<String, Object>();
    value.put("status", status);
    value.put("resumeApproved", resumeApproved);
    value.put("resumeToken", resumeToken);
    value.put("pausedAt", pausedAt != null ? pausedAt.toString() : null);
    value.put("pausedUntil", pausedUntil != null ? pausedUntil.toString() : null);
    value.put("failureReason", failureReason);
    value.put("approvedBy", approvedBy);
    value.put("approvedAt", approvedAt != null ? approvedAt.toString() : null);
    return value;
  }

  static ResumeApprovalGate fromSetting(Map<String, Object> value) {
    return new ResumeApprovalGate(
        stringOf(value.get("status")),
        Boolean.TRUE.equals(value.get("resumeApproved")),
        stringOf(value.get("resumeToken")),
        instantOf(value.get("pausedAt")),
        instantOf(value.get("pausedUntil")),
        stringOf(value.get("failureReason")),
        stringOf(value.get("approvedBy")),
        instantOf(value.get("approvedAt")));
  }

  private static String stringOf(Object value) {
    return value != null ? value.toString() : null;
  }

  private static Instant instantOf(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value.toString());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Malformed resume gate timestamp: " + value, e);
    }
  }
}
