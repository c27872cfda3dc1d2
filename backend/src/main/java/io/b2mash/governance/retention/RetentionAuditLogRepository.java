package io.b2mash.governance.retention;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RetentionAuditLogRepository extends JpaRepository<RetentionAuditLog, UUID> {

  List<RetentionAuditLog> findByPolicyIdOrderByCreatedAtDesc(Long policyId);
}
