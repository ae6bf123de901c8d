package com.example.dbmonitor.cache;

import com.example.dbmonitor.config.MonitorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-aside access to per-target {@link DatabaseContext} entries.
 *
 * The cache is an optimization only. Any failure of the underlying store is
 * logged and reported as a miss (reads) or as {@code false} (writes); nothing
 * here ever throws at the caller because the store is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextCacheService {

    private final ContextCacheStore store;
    private final DatabaseContextBuilder contextBuilder;
    private final ObjectMapper objectMapper;
    private final MonitorProperties properties;

    public String key(String targetId) {
        return properties.getCache().getKeyPrefix() + targetId;
    }

    public Optional<DatabaseContext> get(String targetId) {
        Optional<String> cached;
        try {
            cached = store.get(key(targetId));
        } catch (Exception e) {
            log.warn("Context cache unavailable, treating {} as a miss: {}", targetId, e.getMessage());
            return Optional.empty();
        }

        if (cached.isEmpty()) {
            log.debug("Context cache miss for target {}", targetId);
            return Optional.empty();
        }

        try {
            log.debug("Context cache hit for target {}", targetId);
            return Optional.of(objectMapper.readValue(cached.get(), DatabaseContext.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable context cache entry for {}: {}", targetId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public boolean set(String targetId, DatabaseContext context) {
        try {
            String json = objectMapper.writeValueAsString(context);
            store.setWithTtl(key(targetId), json, Duration.ofSeconds(properties.getCache().getTtlSeconds()));
            log.debug("Cached database context for target {}", targetId);
            return true;
        } catch (Exception e) {
            log.warn("Failed to cache database context for {}: {}", targetId, e.getMessage());
            return false;
        }
    }

    /**
     * Drop the cached context of a target. Called after every write to its
     * query records or table snapshots.
     */
    public boolean invalidate(String targetId) {
        try {
            store.delete(key(targetId));
            log.debug("Invalidated context cache for target {}", targetId);
            return true;
        } catch (Exception e) {
            log.warn("Failed to invalidate context cache for {}: {}", targetId, e.getMessage());
            return false;
        }
    }

    public DatabaseContext getOrBuild(String targetId) {
        Optional<DatabaseContext> cached = get(targetId);
        if (cached.isPresent()) {
            return cached.get();
        }
        DatabaseContext context = contextBuilder.build(targetId);
        set(targetId, context);
        return context;
    }

    public CacheStatus status() {
        boolean available;
        try {
            available = store.isAvailable();
        } catch (Exception e) {
            available = false;
        }
        return new CacheStatus(store.type(), available, properties.getCache().getTtlSeconds(),
                properties.getCache().getKeyPrefix());
    }

    public record CacheStatus(String type, boolean available, int ttlSeconds, String keyPrefix) {}
}
