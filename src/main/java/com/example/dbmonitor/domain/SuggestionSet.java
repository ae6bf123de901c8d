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
 * The current top three recommendations for a target. At most one per target.
 */
@Entity
@Table(name = "suggestion_sets",
        uniqueConstraints = @UniqueConstraint(name = "uk_suggestion_set_target", columnNames = "target_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionSet {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Convert(converter = JsonListConverter.Suggestions.class)
    @Column(length = 32768)
    @Builder.Default
    private List<Suggestion> suggestions = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    private Source source;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum Source {
        AI, FALLBACK
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
