package com.example.dbmonitor.service;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.exception.TargetNotFoundException;
import com.example.dbmonitor.query.QueryIdentity;
import com.example.dbmonitor.query.QueryPerformanceCategory;
import com.example.dbmonitor.query.StatementClassifier;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.repository.QueryRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Operator opt-in and opt-out of alerting for individual queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryAlertService {

    private final MonitoredTargetRepository targetRepository;
    private final QueryRecordRepository queryRecordRepository;
    private final ContextCacheService cacheService;
    private final MonitorProperties properties;

    /**
     * Watch a query. Flags the existing record for the query, or creates one with
     * zeroed metrics when the query has not been collected yet.
     */
    public QueryRecord enableAlerts(String targetId, String queryText) {
        requireTarget(targetId);
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }

        QueryIdentity identity = QueryIdentity.of(queryText);
        QueryRecord record = queryRecordRepository.findByTargetIdAndQueryHash(targetId, identity.hash())
                .orElseGet(() -> QueryRecord.builder()
                        .targetId(targetId)
                        .queryText(queryText.strip())
                        .queryHash(identity.hash())
                        .statementType(StatementClassifier.statementType(queryText))
                        .firstTable(StatementClassifier.firstTable(queryText))
                        .createdAt(Instant.now())
                        .build());

        boolean created = record.getId() == null;
        record.setAlertsEnabled(true);
        QueryRecord saved;
        if (created) {
            saved = queryRecordRepository.save(record);
        } else {
            queryRecordRepository.updateAlertsEnabled(record.getId(), true);
            saved = record;
        }
        if (created) {
            cacheService.invalidate(targetId);
        }
        log.info("Alerts enabled for query {} on target {}{}", saved.getQueryHash(), targetId,
                created ? " (not yet collected)" : "");
        return saved;
    }

    public QueryRecord disableAlerts(String targetId, String recordId) {
        QueryRecord record = queryRecordRepository.findById(recordId)
                .filter(r -> r.getTargetId().equals(targetId))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Query record " + recordId + " not found for target " + targetId));
        queryRecordRepository.updateAlertsEnabled(record.getId(), false);
        record.setAlertsEnabled(false);
        log.info("Alerts disabled for query {} on target {}", record.getQueryHash(), targetId);
        return record;
    }

    public List<AlertQueryView> listAlertQueries(String targetId) {
        requireTarget(targetId);
        MonitorProperties.AlertConfig alerts = properties.getAlerts();
        return queryRecordRepository.findByTargetIdAndAlertsEnabledTrueOrderByMeanTimeMsDesc(targetId).stream()
                .map(record -> {
                    QueryPerformanceCategory category = QueryPerformanceCategory.of(
                            record.getMeanTimeMs(), alerts.getCriticalThresholdMs(), alerts.getWarningThresholdMs());
                    return new AlertQueryView(record, category.label(), category.severity());
                })
                .toList();
    }

    private void requireTarget(String targetId) {
        if (!targetRepository.existsById(targetId)) {
            throw new TargetNotFoundException(targetId);
        }
    }

    public record AlertQueryView(QueryRecord record, String category, String severity) {}
}
