package io.b2mash.governance.partition;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ArchiveRecordRepository extends JpaRepository<ArchiveRecord, UUID> {

  Optional<ArchiveRecord> findByTableNameAndPartitionName(String tableName, String partitionName);

  List<ArchiveRecord> findAllByOrderByArchivedAtDesc(Limit limit);

  List<ArchiveRecord> findByDroppedAtIsNullOrderByArchivedAtDesc(Limit limit);

  List<ArchiveRecord> findByTableNameOrderByArchivedAtDesc(String tableName, Limit limit);

  List<ArchiveRecord> findByTableNameAndDroppedAtIsNullOrderByArchivedAtDesc(
      String tableName, Limit limit);
}
