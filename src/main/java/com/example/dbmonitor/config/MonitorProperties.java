package com.example.dbmonitor.config;

import com.example.dbmonitor.scheduling.OverlapPolicy;
import com.example.dbmonitor.scheduling.PipelineJob;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Central configuration for the monitoring pipeline.
 * Maps to the 'db-monitor' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "db-monitor")
public class MonitorProperties {

    private SecurityConfig security = new SecurityConfig();
    private TargetConfig target = new TargetConfig();
    private CollectionConfig collection = new CollectionConfig();
    private AlertConfig alerts = new AlertConfig();
    private SchemaConfig schema = new SchemaConfig();
    private SuggestionsConfig suggestions = new SuggestionsConfig();
    private CacheConfig cache = new CacheConfig();
    private LlmConfig llm = new LlmConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private Map<PipelineJob, JobConfig> jobs = new EnumMap<>(PipelineJob.class);

    @Data
    public static class SecurityConfig {
        /** AES-256 key, exactly 32 characters */
        private String encryptionSecret = "defaultsecretkeydefaultsecretkey";
    }

    @Data
    public static class TargetConfig {
        private int connectTimeoutSeconds = 10;
        private int socketTimeoutSeconds = 60;
        private int statementTimeoutSeconds = 30;
        private String sslMode = "prefer";
        private String defaultSchema = "public";
        private String applicationName = "db-monitor";
    }

    @Data
    public static class CollectionConfig {
        private int topStatements = 50;
    }

    @Data
    public static class AlertConfig {
        private int topStatements = 100;
        private double criticalThresholdMs = 500;
        private double warningThresholdMs = 300;
        /** 0 disables the cooldown: every breaching poll notifies */
        private int notificationCooldownSeconds = 0;
    }

    @Data
    public static class SchemaConfig {
        private boolean collectOnStartup = true;
        private int metadataQueryTimeoutSeconds = 30;
    }

    @Data
    public static class SuggestionsConfig {
        private boolean aiEnabled = true;
        private double significanceThresholdMs = 1000;
        private int topQueries = 20;
        private int criticalEventLookbackHours = 24;
        private int recentCriticalEvents = 10;
        private double fallbackAvgQueryTimeMs = 100;
        private int partitioningTableCount = 10;
    }

    @Data
    public static class CacheConfig {
        /** redis or memory */
        private String type = "memory";
        private String keyPrefix = "query_context:";
        private int ttlSeconds = 3600;
        private int recentQueries = 20;
        private int maxEntries = 1000;
        private RedisConfig redis = new RedisConfig();

        @Data
        public static class RedisConfig {
            private String host = "localhost";
            private int port = 6379;
            private int database = 0;
            private String password;
            private int commandTimeoutSeconds = 2;
        }
    }

    @Data
    public static class LlmConfig {
        /** gemini or openai (any OpenAI-compatible endpoint) */
        private String provider = "gemini";
        private String model = "gemini-2.5-pro";
        private String apiKey = "";
        private String baseUrl = "";
        private double temperature = 0.2;
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();
        private EmailConfig email = new EmailConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }

        @Data
        public static class EmailConfig {
            private boolean enabled = false;
            private String from = "db-monitor@localhost";
            private String to = "";
        }
    }

    /**
     * Per-job scheduling. The interval and initial delay are read by the
     * {@code @Scheduled} placeholders under the same keys; they are bound here
     * so that the job status endpoint can report them.
     */
    @Data
    public static class JobConfig {
        private long intervalMs;
        private long initialDelayMs;
        private OverlapPolicy overlapPolicy = OverlapPolicy.SKIP;
    }

    public synchronized JobConfig getJob(PipelineJob job) {
        return jobs.computeIfAbsent(job, j -> new JobConfig());
    }
}
