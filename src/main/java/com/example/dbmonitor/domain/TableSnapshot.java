package com.example.dbmonitor.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structure of one table on a target, replaced wholesale on every schema poll.
 * Snapshots of tables that were dropped on the target are kept.
 */
@Entity
@Table(name = "table_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "uk_table_snapshot_target_table",
                columnNames = {"target_id", "schema_name", "table_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Column(name = "schema_name", nullable = false)
    @Builder.Default
    private String schemaName = "public";

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Convert(converter = JsonListConverter.Columns.class)
    @Column(length = 100000)
    @Builder.Default
    private List<ColumnDescriptor> columns = new ArrayList<>();

    @Convert(converter = JsonListConverter.Strings.class)
    @Column(name = "primary_keys", length = 4096)
    @Builder.Default
    private List<String> primaryKeys = new ArrayList<>();

    @Convert(converter = JsonListConverter.ForeignKeys.class)
    @Column(name = "foreign_keys", length = 32768)
    @Builder.Default
    private List<ForeignKeyDescriptor> foreignKeys = new ArrayList<>();

    @Convert(converter = JsonListConverter.Indexes.class)
    @Column(length = 65536)
    @Builder.Default
    private List<IndexDescriptor> indexes = new ArrayList<>();

    /** Null when the row count could not be read */
    @Column(name = "row_count")
    private Long rowCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
