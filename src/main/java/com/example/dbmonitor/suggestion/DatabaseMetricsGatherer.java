package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.TableSnapshot;
import com.example.dbmonitor.repository.CriticalQueryEventRepository;
import com.example.dbmonitor.repository.QueryRecordRepository;
import com.example.dbmonitor.repository.TableSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects the metrics of one target from the persistent store.
 */
@Component
@RequiredArgsConstructor
public class DatabaseMetricsGatherer {

    private static final int MOST_USED_TABLES = 5;

    private final QueryRecordRepository queryRecordRepository;
    private final TableSnapshotRepository tableSnapshotRepository;
    private final CriticalQueryEventRepository eventRepository;
    private final MonitorProperties properties;

    public DatabaseMetrics gather(String targetId) {
        MonitorProperties.SuggestionsConfig config = properties.getSuggestions();

        List<QueryRecord> significant = queryRecordRepository
                .findByTargetIdAndMeanTimeMsGreaterThanOrderByMeanTimeMsDesc(targetId, config.getSignificanceThresholdMs());
        List<QueryRecord> top = queryRecordRepository
                .findByTargetIdOrderByMeanTimeMsDesc(targetId, PageRequest.of(0, config.getTopQueries()));
        List<TableSnapshot> tables = tableSnapshotRepository.findByTargetIdOrderByTableNameAsc(targetId);
        List<CriticalQueryEvent> recentEvents = eventRepository.findByTargetIdAndDetectedAtAfterOrderByDetectedAtDesc(
                targetId,
                Instant.now().minus(Duration.ofHours(config.getCriticalEventLookbackHours())),
                PageRequest.of(0, config.getRecentCriticalEvents()));

        List<DatabaseMetrics.TableUsage> usage = tableUsage(queryRecordRepository.findByTargetId(targetId));
        List<String> unused = tables.stream()
                .map(TableSnapshot::getTableName)
                .filter(name -> usage.stream().noneMatch(u -> u.tableName().equalsIgnoreCase(name)))
                .toList();

        return new DatabaseMetrics(
                targetId,
                significant,
                top,
                tables,
                usage,
                usage.stream().limit(MOST_USED_TABLES).toList(),
                unused,
                recentEvents,
                performanceStats(top),
                tables.size(),
                top.size());
    }

    /**
     * Calls per table, summed over the first table each query references. Busiest first.
     */
    static List<DatabaseMetrics.TableUsage> tableUsage(List<QueryRecord> records) {
        Map<String, Long> callsByTable = new TreeMap<>();
        for (QueryRecord record : records) {
            if (record.getFirstTable() != null) {
                callsByTable.merge(record.getFirstTable(), record.getCalls(), Long::sum);
            }
        }
        return callsByTable.entrySet().stream()
                .map(e -> new DatabaseMetrics.TableUsage(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(DatabaseMetrics.TableUsage::callCount).reversed())
                .toList();
    }

    /** @param queries ordered by mean time, slowest first */
    static DatabaseMetrics.PerformanceStats performanceStats(List<QueryRecord> queries) {
        if (queries.isEmpty()) {
            return DatabaseMetrics.PerformanceStats.empty();
        }
        long totalCalls = queries.stream().mapToLong(QueryRecord::getCalls).sum();
        double totalTime = queries.stream().mapToDouble(QueryRecord::getTotalTimeMs).sum();
        long avg = totalCalls > 0 ? Math.round(totalTime / totalCalls) : 0;
        QueryRecord slowest = queries.get(0);
        return new DatabaseMetrics.PerformanceStats(avg, totalCalls, Math.round(totalTime),
                slowest.getQueryText(), slowest.getMeanTimeMs());
    }
}
