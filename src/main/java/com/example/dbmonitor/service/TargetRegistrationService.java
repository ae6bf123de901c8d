package com.example.dbmonitor.service;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.exception.TargetNotFoundException;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.security.CredentialCodec;
import com.example.dbmonitor.target.CapabilityProbe;
import com.example.dbmonitor.target.ConnectionUrlParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Registers targets and (re)runs the capability probe that decides whether
 * they take part in scheduled collection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TargetRegistrationService {

    private static final int DEFAULT_PORT = 5432;

    private final MonitoredTargetRepository targetRepository;
    private final CredentialCodec credentialCodec;
    private final CapabilityProbe capabilityProbe;
    private final MonitorProperties properties;

    /**
     * Either {@code url} or the discrete connection fields must be given.
     */
    public record RegisterTargetRequest(String name, String ownerId, String url, String host, Integer port,
                                        String databaseName, String username, String password, String sslMode) {}

    public MonitoredTarget register(RegisterTargetRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }

        MonitoredTarget target;
        if (request.url() != null && !request.url().isBlank()) {
            ConnectionUrlParser.ParsedUrl parsed = ConnectionUrlParser.parse(request.url());
            target = MonitoredTarget.builder()
                    .host(parsed.host())
                    .port(parsed.port())
                    .databaseName(parsed.databaseName())
                    .username(parsed.username())
                    .passwordEncrypted(credentialCodec.encrypt(parsed.password()))
                    .sslMode(parsed.sslMode() != null ? parsed.sslMode() : request.sslMode())
                    .build();
        } else {
            requireField(request.host(), "host");
            requireField(request.databaseName(), "databaseName");
            requireField(request.username(), "username");
            requireField(request.password(), "password");
            target = MonitoredTarget.builder()
                    .host(request.host().trim())
                    .port(request.port() != null ? request.port() : DEFAULT_PORT)
                    .databaseName(request.databaseName().trim())
                    .username(request.username().trim())
                    .passwordEncrypted(credentialCodec.encrypt(request.password()))
                    .sslMode(request.sslMode())
                    .build();
        }
        if (target.getSslMode() == null) {
            target.setSslMode(properties.getTarget().getSslMode());
        }
        target.setName(request.name() != null && !request.name().isBlank() ? request.name() : target.describe());
        target.setOwnerId(request.ownerId());

        boolean capable = capabilityProbe.hasStatisticsExtension(target);
        target.setMonitoringEnabled(capable);
        target.setLastProbeAt(Instant.now());
        MonitoredTarget saved = targetRepository.save(target);

        if (capable) {
            log.info("Registered target {} ({}), monitoring enabled", saved.getId(), saved.describe());
        } else {
            log.warn("Registered target {} ({}) without pg_stat_statements, monitoring disabled",
                    saved.getId(), saved.describe());
        }
        return saved;
    }

    /**
     * Re-run the capability probe and update {@code monitoringEnabled} accordingly.
     */
    public MonitoredTarget probe(String targetId) {
        MonitoredTarget target = get(targetId);
        boolean capable = capabilityProbe.hasStatisticsExtension(target);
        Instant now = Instant.now();
        target.setMonitoringEnabled(capable);
        target.setLastProbeAt(now);
        target.setUpdatedAt(now);
        log.info("Probe of {}: monitoring {}", target.describe(), capable ? "enabled" : "disabled");
        return targetRepository.save(target);
    }

    public MonitoredTarget get(String targetId) {
        return targetRepository.findById(targetId)
                .orElseThrow(() -> new TargetNotFoundException(targetId));
    }

    public List<MonitoredTarget> list(String ownerId) {
        return ownerId == null || ownerId.isBlank()
                ? targetRepository.findAll()
                : targetRepository.findByOwnerId(ownerId);
    }

    private static void requireField(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required when no url is given");
        }
    }
}
