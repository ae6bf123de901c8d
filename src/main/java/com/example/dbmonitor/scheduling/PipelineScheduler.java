package com.example.dbmonitor.scheduling;

import com.example.dbmonitor.collector.AlertDetectionService;
import com.example.dbmonitor.collector.QueryCollectionService;
import com.example.dbmonitor.collector.SchemaSnapshotService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.suggestion.SuggestionSynthesisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fires the pipeline jobs.
 *
 * Uses fixed delays, so the next firing of a job is measured from the end of
 * its previous run. Manual runs go through the same {@link JobRunner} and are
 * subject to the same overlap policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineScheduler {

    private final JobRunner jobRunner;
    private final QueryCollectionService queryCollectionService;
    private final AlertDetectionService alertDetectionService;
    private final SchemaSnapshotService schemaSnapshotService;
    private final SuggestionSynthesisService suggestionSynthesisService;
    private final MonitorProperties properties;

    @Scheduled(fixedDelayString = "${db-monitor.jobs.query-collection.interval-ms:300000}",
            initialDelayString = "${db-monitor.jobs.query-collection.initial-delay-ms:60000}")
    public void collectQueries() {
        run(PipelineJob.QUERY_COLLECTION);
    }

    @Scheduled(fixedDelayString = "${db-monitor.jobs.alert-detection.interval-ms:120000}",
            initialDelayString = "${db-monitor.jobs.alert-detection.initial-delay-ms:90000}")
    public void detectAlerts() {
        run(PipelineJob.ALERT_DETECTION);
    }

    @Scheduled(fixedDelayString = "${db-monitor.jobs.schema-snapshot.interval-ms:1800000}",
            initialDelayString = "${db-monitor.jobs.schema-snapshot.initial-delay-ms:1800000}")
    public void snapshotSchemas() {
        run(PipelineJob.SCHEMA_SNAPSHOT);
    }

    @Scheduled(fixedDelayString = "${db-monitor.jobs.suggestion-synthesis.interval-ms:1200000}",
            initialDelayString = "${db-monitor.jobs.suggestion-synthesis.initial-delay-ms:300000}")
    public void synthesizeSuggestions() {
        run(PipelineJob.SUGGESTION_SYNTHESIS);
    }

    /**
     * Eager schema snapshot once the application is up, so new deployments do
     * not wait a full interval for table metadata.
     */
    @Async("startupExecutor")
    @EventListener(ApplicationReadyEvent.class)
    public void snapshotSchemasOnStartup() {
        if (!properties.getSchema().isCollectOnStartup()) {
            return;
        }
        log.info("Running startup schema snapshot");
        run(PipelineJob.SCHEMA_SNAPSHOT);
    }

    public JobRunner.RunOutcome run(PipelineJob job) {
        return jobRunner.run(job, body(job));
    }

    public Map<PipelineJob, JobRunner.RunOutcome> runAll() {
        Map<PipelineJob, JobRunner.RunOutcome> outcomes = new EnumMap<>(PipelineJob.class);
        for (PipelineJob job : PipelineJob.values()) {
            outcomes.put(job, run(job));
        }
        return outcomes;
    }

    private Runnable body(PipelineJob job) {
        return switch (job) {
            case QUERY_COLLECTION -> queryCollectionService::collectAll;
            case ALERT_DETECTION -> alertDetectionService::detectAll;
            case SCHEMA_SNAPSHOT -> schemaSnapshotService::snapshotAll;
            case SUGGESTION_SYNTHESIS -> suggestionSynthesisService::synthesizeAll;
        };
    }
}
