package io.b2mash.governance.retention.supervisor;

public enum SupervisorState {
  IDLE,
  SCHEDULED,
  RUNNING,
  PAUSED,
  AWAITING_RESUME_APPROVAL
}
