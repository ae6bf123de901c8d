package com.example.dbmonitor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * An externally hosted PostgreSQL instance observed by the pipeline.
 * The pipeline only ever changes {@code monitoringEnabled}, {@code lastProbeAt} and {@code updatedAt}.
 */
@Entity
@Table(name = "monitored_targets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredTarget {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "owner_id")
    private String ownerId;

    private String name;

    @Column(nullable = false)
    private String host;

    @Column(nullable = false)
    private int port;

    @Column(name = "database_name", nullable = false)
    private String databaseName;

    @Column(nullable = false)
    private String username;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "password_encrypted", nullable = false, length = 1024)
    private String passwordEncrypted;

    @Column(name = "ssl_mode")
    private String sslMode;

    @Column(name = "monitoring_enabled")
    private boolean monitoringEnabled;

    @Column(name = "last_probe_at")
    private Instant lastProbeAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    /** Host and database name, as shown in alerts and logs. */
    public TargetInfo toTargetInfo() {
        return new TargetInfo(id, host, databaseName);
    }

    public String describe() {
        return databaseName + "@" + host + ":" + port;
    }
}
