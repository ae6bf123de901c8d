package com.example.dbmonitor.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process store with a per-entry time-to-live. Used when no Redis is configured.
 */
public class CaffeineContextCacheStore implements ContextCacheStore {

    private final Cache<String, TimedValue> cache;

    public CaffeineContextCacheStore(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    CaffeineContextCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new TtlExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        TimedValue entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        cache.put(key, new TimedValue(value, ttl.toNanos()));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String type() {
        return "memory";
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record TimedValue(String value, long ttlNanos) {}

    private static class TtlExpiry implements Expiry<String, TimedValue> {

        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
