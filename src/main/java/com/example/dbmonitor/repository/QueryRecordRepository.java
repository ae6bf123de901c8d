package com.example.dbmonitor.repository;

import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.query.StatementStatistics;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueryRecordRepository extends JpaRepository<QueryRecord, String> {

    Optional<QueryRecord> findByTargetIdAndQueryHash(String targetId, String queryHash);

    List<QueryRecord> findByTargetId(String targetId);

    List<QueryRecord> findByAlertsEnabledTrue();

    List<QueryRecord> findByTargetIdAndAlertsEnabledTrueOrderByMeanTimeMsDesc(String targetId);

    List<QueryRecord> findByTargetIdOrderByMeanTimeMsDesc(String targetId, Pageable pageable);

    List<QueryRecord> findByTargetIdOrderByCollectedAtDesc(String targetId, Pageable pageable);

    List<QueryRecord> findByTargetIdAndMeanTimeMsGreaterThanOrderByMeanTimeMsDesc(String targetId, double meanTimeMs);

    boolean existsByIdAndAlertsEnabledTrue(String id);

    /**
     * Overwrites the polled metric columns of one record. The alert flag is not
     * part of the update, so a concurrent opt-in or opt-out is never reverted.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QueryRecord r set
                r.calls = :calls,
                r.totalTimeMs = :totalTimeMs,
                r.meanTimeMs = :meanTimeMs,
                r.minTimeMs = :minTimeMs,
                r.maxTimeMs = :maxTimeMs,
                r.rowsReturned = :rowsReturned,
                r.statementType = :statementType,
                r.firstTable = :firstTable,
                r.collectedAt = :collectedAt
            where r.id = :id
            """)
    int updateStatistics(@Param("id") String id,
                         @Param("calls") long calls,
                         @Param("totalTimeMs") double totalTimeMs,
                         @Param("meanTimeMs") double meanTimeMs,
                         @Param("minTimeMs") double minTimeMs,
                         @Param("maxTimeMs") double maxTimeMs,
                         @Param("rowsReturned") long rowsReturned,
                         @Param("statementType") QueryRecord.StatementType statementType,
                         @Param("firstTable") String firstTable,
                         @Param("collectedAt") Instant collectedAt);

    default int updateStatistics(String id, StatementStatistics stats, Instant collectedAt) {
        return updateStatistics(id, stats.calls(), stats.totalTimeMs(), stats.meanTimeMs(),
                stats.minTimeMs(), stats.maxTimeMs(), stats.rows(), stats.statementType(),
                stats.firstTable(), collectedAt);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update QueryRecord r set r.alertsEnabled = :enabled where r.id = :id")
    int updateAlertsEnabled(@Param("id") String id, @Param("enabled") boolean enabled);
}
