package io.b2mash.governance.cdc;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChangeEventRepository extends JpaRepository<ChangeEvent, UUID> {

  List<ChangeEvent> findByCorrelationIdOrderByCreatedAtAsc(String correlationId);
}
