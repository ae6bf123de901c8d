package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.SuggestionSet;
import com.example.dbmonitor.exception.SynthesisParseException;
import com.example.dbmonitor.llm.TextGenerationClient;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.repository.SuggestionSetRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suggestion Synthesis Engine.
 *
 * Gathers the metrics of each monitored target, asks the model for three
 * recommendations and stores them as the target's {@link SuggestionSet}.
 * Targets without slow queries or recent critical events are skipped and
 * keep whatever set they had. An unusable answer is replaced by the
 * deterministic fallback; a failed call leaves the old set in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionSynthesisService {

    static final String SYSTEM_PROMPT = """
            You are a database performance expert. Analyze the provided comprehensive database metrics and provide exactly 3 specific, actionable recommendations for optimization.
            Don't analyze queries related to create or system queries.
            Return your response as a JSON array with exactly 3 objects, each containing:
            - "title": A brief title for the suggestion
            - "description": Detailed explanation of the issue and solution
            - "priority": "high", "medium", or "low"
            - "category": One of "indexing", "query_optimization", "schema_design", "configuration", "monitoring", "table_optimization", "partitioning", "maintenance", or "capacity_planning"

            Focus on:
            1. Missing indexes and index optimization
            2. Query structure and performance issues
            3. Table usage patterns and optimization
            4. Schema design improvements
            5. Database configuration tuning
            6. Table partitioning opportunities
            7. Maintenance and cleanup tasks
            8. Capacity planning and resource optimization

            Be specific and actionable. Example format:
            [
              {
                "title": "Add Composite Index on User Table",
                "description": "The users table is heavily accessed but missing a composite index on (status, created_at) which would improve query performance.",
                "priority": "high",
                "category": "indexing"
              },
              {
                "title": "Partition Large Log Table",
                "description": "The query_logs table has 2M+ rows and should be partitioned by date to improve query performance and maintenance.",
                "priority": "medium",
                "category": "partitioning"
              },
              {
                "title": "Clean Up Unused Tables",
                "description": "Remove 3 unused tables (temp_data, old_logs, backup_users) to reduce storage overhead and simplify maintenance.",
                "priority": "low",
                "category": "maintenance"
              }
            ]
            """;

    private final MonitoredTargetRepository targetRepository;
    private final SuggestionSetRepository suggestionSetRepository;
    private final DatabaseMetricsGatherer metricsGatherer;
    private final SuggestionResponseParser responseParser;
    private final FallbackSuggestionGenerator fallbackGenerator;
    private final TextGenerationClient textGenerationClient;
    private final ContextCacheService cacheService;
    private final MonitorProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public List<SynthesisResult> synthesizeAll() {
        List<MonitoredTarget> targets = targetRepository.findByMonitoringEnabled(true);
        log.info("Synthesizing suggestions for {} monitored targets", targets.size());

        List<SynthesisResult> results = new ArrayList<>();
        for (MonitoredTarget target : targets) {
            try {
                synthesizeTarget(target).ifPresent(results::add);
            } catch (Exception e) {
                log.error("Suggestion synthesis failed for {}, keeping previous suggestions: {}",
                        target.describe(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * @return empty when the target had nothing significant to analyze
     */
    public Optional<SynthesisResult> synthesizeTarget(MonitoredTarget target) {
        DatabaseMetrics metrics = metricsGatherer.gather(target.getId());
        if (!metrics.hasSignificantData()) {
            log.info("No significant data for {}, suggestions left unchanged", target.describe());
            return Optional.empty();
        }

        SynthesisResult result;
        if (properties.getSuggestions().isAiEnabled()) {
            String narrative = cacheService.getOrBuild(target.getId()).narrative();
            String response = textGenerationClient.generate(SYSTEM_PROMPT, buildPrompt(metrics, narrative));
            result = resolve(response, metrics);
        } else {
            result = new SynthesisResult.Fallback(fallbackGenerator.generate(metrics), "AI suggestions disabled");
        }

        store(target.getId(), result);
        Counter.builder("dbmonitor.suggestions.generated")
                .tag("source", result.source().name().toLowerCase())
                .register(meterRegistry)
                .increment();
        log.info("Updated suggestions for {} ({})", target.describe(), result.source());
        return Optional.of(result);
    }

    /**
     * Parse the model answer, falling back to metric-derived suggestions when it is unusable.
     */
    public SynthesisResult resolve(String response, DatabaseMetrics metrics) {
        try {
            return new SynthesisResult.Parsed(responseParser.parse(response));
        } catch (SynthesisParseException e) {
            log.warn("Unusable suggestion response for target {}, using fallback: {}",
                    metrics.targetId(), e.getMessage());
            return new SynthesisResult.Fallback(fallbackGenerator.generate(metrics), e.getMessage());
        }
    }

    String buildPrompt(DatabaseMetrics metrics, String narrative) {
        String metricsJson;
        try {
            metricsJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize database metrics", e);
        }
        return "Please analyze this comprehensive database data and provide exactly 3 optimization "
                + "recommendations in the specified JSON format:\n\n"
                + metricsJson
                + (narrative == null ? "" : narrative);
    }

    private void store(String targetId, SynthesisResult result) {
        SuggestionSet set = suggestionSetRepository.findByTargetId(targetId)
                .orElseGet(() -> SuggestionSet.builder().targetId(targetId).build());
        set.setSuggestions(new ArrayList<>(result.suggestions()));
        set.setSource(result.source());
        set.setUpdatedAt(Instant.now());
        suggestionSetRepository.save(set);
    }
}
