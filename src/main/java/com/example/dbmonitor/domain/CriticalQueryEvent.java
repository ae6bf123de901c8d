package com.example.dbmonitor.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time record of a watched query breaching the critical threshold.
 * Append-only: events are never updated or deleted.
 */
@Entity
@Table(name = "critical_query_events", indexes = {
        @Index(name = "idx_critical_event_target_time", columnList = "target_id, detected_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriticalQueryEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "target_id", nullable = false, updatable = false)
    private String targetId;

    @Column(name = "query_record_id", updatable = false)
    private String queryRecordId;

    @Column(name = "query_hash", length = 64, updatable = false)
    private String queryHash;

    @Column(name = "query_text", nullable = false, length = 100000, updatable = false)
    private String queryText;

    @Column(updatable = false)
    private long calls;

    @Column(name = "total_time_ms", updatable = false)
    private double totalTimeMs;

    @Column(name = "mean_time_ms", updatable = false)
    private double meanTimeMs;

    @Column(name = "rows_returned", updatable = false)
    private long rowsReturned;

    /** 1-based position among the critical rows found by one poll of one target */
    @Column(name = "poll_rank", updatable = false)
    private int rank;

    @Column(name = "threshold_ms", updatable = false)
    private double thresholdMs;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @PrePersist
    protected void onCreate() {
        if (detectedAt == null) detectedAt = Instant.now();
    }
}
