package com.example.dbmonitor.scheduling;

import java.util.Arrays;

/**
 * The independently scheduled jobs of the observation pipeline.
 */
public enum PipelineJob {
    QUERY_COLLECTION("query-collection"),
    ALERT_DETECTION("alert-detection"),
    SCHEMA_SNAPSHOT("schema-snapshot"),
    SUGGESTION_SYNTHESIS("suggestion-synthesis");

    private final String key;

    PipelineJob(String key) {
        this.key = key;
    }

    /** Name used in configuration keys, URLs and metric tags. */
    public String key() {
        return key;
    }

    /**
     * Resolve a job from its key ("alert-detection") or constant name ("ALERT_DETECTION").
     */
    public static PipelineJob fromKey(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase().replace('_', '-');
            for (PipelineJob job : values()) {
                if (job.key.equals(normalized)) {
                    return job;
                }
            }
        }
        throw new IllegalArgumentException("Unknown job: " + value + ". Expected one of "
                + Arrays.stream(values()).map(PipelineJob::key).toList());
    }
}
