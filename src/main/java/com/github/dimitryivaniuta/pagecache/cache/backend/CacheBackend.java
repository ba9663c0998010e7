package com.github.dimitryivaniuta.pagecache.cache.backend;

import java.util.Optional;

/**
 * Key-value store the page cache reads from and writes to. Eviction, persistence and
 * per-key atomicity are the implementation's concern.
 */
public interface CacheBackend {

    /** Name the backend was selected by. */
    String alias();

    /**
     * @return the value stored under {@code key}, or empty when absent, expired or not of {@code type}
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Stores {@code value} for {@code ttlSeconds}. A non-positive TTL stores nothing.
     */
    void set(String key, Object value, long ttlSeconds);

    int defaultTtlSeconds();
}
