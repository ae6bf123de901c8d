package com.example.dbmonitor.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store backing the context cache. Implementations may throw on
 * any operation when the backing store is unreachable; callers treat that as a miss.
 */
public interface ContextCacheStore {

    Optional<String> get(String key);

    void setWithTtl(String key, String value, Duration ttl);

    void delete(String key);

    boolean isAvailable();

    /** Short name of the backing store, e.g. "redis" or "memory". */
    String type();
}
