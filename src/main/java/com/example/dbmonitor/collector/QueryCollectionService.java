package com.example.dbmonitor.collector;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.exception.TargetConnectionException;
import com.example.dbmonitor.query.QueryIdentity;
import com.example.dbmonitor.query.StatementStatistics;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.repository.QueryRecordRepository;
import com.example.dbmonitor.target.StatementStatsPoller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Query Collection Engine.
 *
 * Polls pg_stat_statements on every monitored target and mirrors each
 * statement into a {@link QueryRecord} keyed by (target, query hash). The
 * extension reports cumulative counters, so an existing record is simply
 * overwritten with the latest values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCollectionService {

    private final MonitoredTargetRepository targetRepository;
    private final QueryRecordRepository queryRecordRepository;
    private final StatementStatsPoller statsPoller;
    private final ContextCacheService cacheService;
    private final MonitorProperties properties;

    public List<CollectionResult> collectAll() {
        List<MonitoredTarget> targets = targetRepository.findByMonitoringEnabled(true);
        log.info("Collecting query statistics from {} monitored targets", targets.size());

        List<CollectionResult> results = new ArrayList<>();
        for (MonitoredTarget target : targets) {
            try {
                results.add(collectTarget(target));
            } catch (TargetConnectionException e) {
                log.error("Skipping query collection for {}: {}", target.describe(), e.getMessage());
            } catch (Exception e) {
                log.error("Query collection failed for {}: {}", target.describe(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * Poll one target and upsert a record per returned statement.
     * A failure to write one row is logged and does not stop the others.
     */
    public CollectionResult collectTarget(MonitoredTarget target) {
        List<StatementStatistics> rows = statsPoller.poll(target, properties.getCollection().getTopStatements());
        Instant collectedAt = Instant.now();

        int created = 0;
        int updated = 0;
        int failed = 0;
        for (StatementStatistics row : rows) {
            try {
                if (upsert(target.getId(), row, collectedAt)) {
                    created++;
                } else {
                    updated++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to store statistics for query on {}: {}", target.describe(), e.getMessage());
            }
        }

        cacheService.invalidate(target.getId());

        log.info("Collected {} statements from {} ({} new, {} updated, {} failed)",
                rows.size(), target.describe(), created, updated, failed);
        return new CollectionResult(target.getId(), rows.size(), created, updated, failed);
    }

    /** @return true when a new record was created */
    private boolean upsert(String targetId, StatementStatistics row, Instant collectedAt) {
        QueryIdentity identity = row.identity();
        Optional<QueryRecord> existing = queryRecordRepository.findByTargetIdAndQueryHash(targetId, identity.hash());
        boolean created = existing.isEmpty();
        if (created) {
            QueryRecord record = QueryRecord.builder()
                    .targetId(targetId)
                    .queryText(row.query())
                    .queryHash(identity.hash())
                    .alertsEnabled(false)
                    .build();
            record.applyStatistics(row, collectedAt);
            queryRecordRepository.save(record);
        } else {
            queryRecordRepository.updateStatistics(existing.get().getId(), row, collectedAt);
        }
        log.debug("{} query record {} on target {}", created ? "Created" : "Updated", identity.hash(), targetId);
        return created;
    }

    public record CollectionResult(String targetId, int statements, int created, int updated, int failed) {}
}
