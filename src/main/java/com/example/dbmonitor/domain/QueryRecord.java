package com.example.dbmonitor.domain;

import com.example.dbmonitor.query.StatementStatistics;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest cumulative statistics for one distinct query on one target.
 * Identity is (targetId, queryHash); each poll overwrites the metric fields.
 */
@Entity
@Table(name = "query_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_query_record_target_hash",
                columnNames = {"target_id", "query_hash"}),
        indexes = {
                @Index(name = "idx_query_record_alerts", columnList = "alerts_enabled"),
                @Index(name = "idx_query_record_mean", columnList = "target_id, mean_time_ms")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Column(name = "query_text", nullable = false, length = 100000)
    private String queryText;

    @Column(name = "query_hash", nullable = false, length = 64)
    private String queryHash;

    private long calls;

    @Column(name = "total_time_ms")
    private double totalTimeMs;

    @Column(name = "mean_time_ms")
    private double meanTimeMs;

    @Column(name = "min_time_ms")
    private double minTimeMs;

    @Column(name = "max_time_ms")
    private double maxTimeMs;

    @Column(name = "rows_returned")
    private long rowsReturned;

    @Enumerated(EnumType.STRING)
    @Column(name = "statement_type")
    @Builder.Default
    private StatementType statementType = StatementType.OTHER;

    @Column(name = "first_table")
    private String firstTable;

    @Column(name = "alerts_enabled")
    private boolean alertsEnabled;

    @Column(name = "collected_at")
    private Instant collectedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    /**
     * Overwrite the aggregate fields with the latest snapshot from the statistics extension.
     */
    public void applyStatistics(StatementStatistics stats, Instant collectedAt) {
        this.calls = stats.calls();
        this.totalTimeMs = stats.totalTimeMs();
        this.meanTimeMs = stats.meanTimeMs();
        this.minTimeMs = stats.minTimeMs();
        this.maxTimeMs = stats.maxTimeMs();
        this.rowsReturned = stats.rows();
        this.statementType = stats.statementType();
        this.firstTable = stats.firstTable();
        this.collectedAt = collectedAt;
    }

    public enum StatementType {
        SELECT, INSERT, UPDATE, DELETE, OTHER
    }
}
