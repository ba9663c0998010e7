package com.github.dimitryivaniuta.pagecache.cache.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link CacheBackend} over one Spring {@link Cache}. Values are wrapped in {@link ExpiringValue}
 * so caches that understand per-entry TTL (see {@link TtlCaffeineCacheManager}) honour it.
 */
@Slf4j
public class SpringCacheBackend implements CacheBackend {

    private final String alias;
    private final Cache cache;
    private final int defaultTtlSeconds;

    public SpringCacheBackend(String alias, Cache cache, int defaultTtlSeconds) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Cache.ValueWrapper wrapper;
        try {
            wrapper = cache.get(key);
        } catch (RuntimeException ex) {
            throw new CacheBackendException("Unable to read key '" + key + "' from cache '" + alias + "'", ex);
        }
        if (wrapper == null) {
            return Optional.empty();
        }

        Object value = wrapper.get();
        if (value instanceof ExpiringValue ev) {
            value = ev.value();
        }
        if (!type.isInstance(value)) {
            log.debug("Ignoring entry {} in cache {}: expected {} but found {}",
                    key, alias, type.getSimpleName(), value == null ? "null" : value.getClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(value));
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return;
        }
        try {
            cache.put(key, new ExpiringValue(value, ttlSeconds));
        } catch (RuntimeException ex) {
            throw new CacheBackendException("Unable to write key '" + key + "' to cache '" + alias + "'", ex);
        }
    }

    @Override
    public int defaultTtlSeconds() {
        return defaultTtlSeconds;
    }
}
