package com.example.dbmonitor.repository;

import com.example.dbmonitor.domain.TableSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TableSnapshotRepository extends JpaRepository<TableSnapshot, String> {

    Optional<TableSnapshot> findByTargetIdAndSchemaNameAndTableName(String targetId, String schemaName, String tableName);

    List<TableSnapshot> findByTargetIdOrderByTableNameAsc(String targetId);
}
