package com.example.dbmonitor.collector;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.exception.TargetConnectionException;
import com.example.dbmonitor.notification.NotificationDispatcher;
import com.example.dbmonitor.query.StatementStatistics;
import com.example.dbmonitor.repository.CriticalQueryEventRepository;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.repository.QueryRecordRepository;
import com.example.dbmonitor.target.StatementStatsPoller;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Alert Detection &amp; Dispatch Engine.
 *
 * Polls only the targets that have at least one alert-enabled query record.
 * Statement rows are matched to watched records through the same
 * {@link com.example.dbmonitor.query.QueryIdentity} the collection engine
 * uses. A matched row above the critical threshold appends a
 * {@link CriticalQueryEvent}; each poll that produced events notifies once
 * with the whole batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertDetectionService {

    private final MonitoredTargetRepository targetRepository;
    private final QueryRecordRepository queryRecordRepository;
    private final CriticalQueryEventRepository eventRepository;
    private final StatementStatsPoller statsPoller;
    private final ContextCacheService cacheService;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    // Last successful dispatch per target; only consulted when a cooldown is configured
    private final Map<String, Instant> lastDispatch = new ConcurrentHashMap<>();

    public List<AlertPollResult> detectAll() {
        Map<String, List<QueryRecord>> watchedByTarget = queryRecordRepository.findByAlertsEnabledTrue().stream()
                .collect(Collectors.groupingBy(QueryRecord::getTargetId, LinkedHashMap::new, Collectors.toList()));
        log.info("Running alert detection for {} targets with watched queries", watchedByTarget.size());

        List<AlertPollResult> results = new ArrayList<>();
        for (Map.Entry<String, List<QueryRecord>> entry : watchedByTarget.entrySet()) {
            Optional<MonitoredTarget> target = targetRepository.findById(entry.getKey());
            if (target.isEmpty()) {
                log.warn("Watched queries reference unknown target {}", entry.getKey());
                continue;
            }
            try {
                results.add(detectTarget(target.get(), entry.getValue()));
            } catch (TargetConnectionException e) {
                log.error("Skipping alert detection for {}: {}", target.get().describe(), e.getMessage());
            } catch (Exception e) {
                log.error("Alert detection failed for {}: {}", target.get().describe(), e.getMessage());
            }
        }
        return results;
    }

    public AlertPollResult detectTarget(MonitoredTarget target, List<QueryRecord> watched) {
        Map<String, QueryRecord> watchedByHash = watched.stream()
                .collect(Collectors.toMap(QueryRecord::getQueryHash, Function.identity(), (a, b) -> a));
        double threshold = properties.getAlerts().getCriticalThresholdMs();

        List<StatementStatistics> rows = statsPoller.poll(target, properties.getAlerts().getTopStatements());
        Instant now = Instant.now();

        List<CriticalQueryEvent> events = new ArrayList<>();
        int matched = 0;
        int critical = 0;
        try {
            for (StatementStatistics row : rows) {
                QueryRecord record = watchedByHash.get(row.identity().hash());
                if (record == null) {
                    continue;
                }
                try {
                    if (queryRecordRepository.updateStatistics(record.getId(), row, now) == 0) {
                        log.debug("Watched query {} on {} was removed during the poll", record.getQueryHash(),
                                target.describe());
                        continue;
                    }
                    matched++;

                    if (row.meanTimeMs() > threshold) {
                        // watched set was read before the poll; an opt-out since then wins
                        if (!queryRecordRepository.existsByIdAndAlertsEnabledTrue(record.getId())) {
                            log.info("Alerts disabled for query {} on {} during the poll, no event recorded",
                                    record.getQueryHash(), target.describe());
                            continue;
                        }
                        events.add(eventRepository.save(toEvent(target, record, row, critical + 1, threshold, now)));
                        critical++;
                    }
                } catch (Exception e) {
                    log.error("Failed to record alert poll for query {} on {}: {}",
                            record.getQueryHash(), target.describe(), e.getMessage());
                }
            }
        } finally {
            if (matched > 0) {
                cacheService.invalidate(target.getId());
            }
        }

        boolean dispatched = false;
        if (!events.isEmpty()) {
            Counter.builder("dbmonitor.alert.events")
                    .tag("target", target.getId())
                    .register(meterRegistry)
                    .increment(events.size());
            log.warn("{} critical queries detected on {}", events.size(), target.describe());
            dispatched = dispatch(target, events);
        }

        log.info("Alert poll for {}: {} of {} watched queries matched, {} critical",
                target.describe(), matched, watched.size(), events.size());
        return new AlertPollResult(target.getId(), matched, events.size(), dispatched);
    }

    private CriticalQueryEvent toEvent(MonitoredTarget target, QueryRecord record, StatementStatistics row,
                                       int rank, double threshold, Instant detectedAt) {
        return CriticalQueryEvent.builder()
                .targetId(target.getId())
                .queryRecordId(record.getId())
                .queryHash(record.getQueryHash())
                .queryText(row.query())
                .calls(row.calls())
                .totalTimeMs(row.totalTimeMs())
                .meanTimeMs(row.meanTimeMs())
                .rowsReturned(row.rows())
                .rank(rank)
                .thresholdMs(threshold)
                .detectedAt(detectedAt)
                .build();
    }

    private boolean dispatch(MonitoredTarget target, List<CriticalQueryEvent> events) {
        int cooldownSeconds = properties.getAlerts().getNotificationCooldownSeconds();
        Instant previous = lastDispatch.get(target.getId());
        if (cooldownSeconds > 0 && previous != null
                && Duration.between(previous, Instant.now()).getSeconds() < cooldownSeconds) {
            log.info("Suppressing alert notification for {}: last sent at {}", target.describe(), previous);
            return false;
        }

        try {
            notificationDispatcher.send(events, target.toTargetInfo());
            lastDispatch.put(target.getId(), Instant.now());
            return true;
        } catch (Exception e) {
            log.error("Failed to dispatch alert notification for {}: {}", target.describe(), e.getMessage());
            return false;
        }
    }

    public record AlertPollResult(String targetId, int matched, int criticalEvents, boolean notified) {}
}
