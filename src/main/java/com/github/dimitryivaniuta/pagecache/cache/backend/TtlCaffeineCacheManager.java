package com.github.dimitryivaniuta.pagecache.cache.backend;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager whose caches expire entries individually.
 *
 *   "pages"          -> entries default to the fallback TTL
 *   "pages:ttl=600"  -> entries default to 600 seconds
 *
 * An entry stored as {@link ExpiringValue} lives for its own TTL instead of the cache default,
 * which is how the page cache gives every page the TTL of its response.
 * <p>
 * IMPORTANT:
 * Caffeine builders are mutable and variable expiry cannot be combined with
 * expireAfterWrite/expireAfterAccess. The base builder factory must not set either.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_PATTERN = Pattern.compile("^(?<base>.+?)(?::ttl=(?<ttl>\\d+))?$");
    private static final long MIN_TTL_SECONDS = 1;
    private static final long MAX_TTL_SECONDS = 365L * 24 * 60 * 60; // 1y safety cap

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final long fallbackTtlSeconds;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory, long fallbackTtlSeconds) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
        this.fallbackTtlSeconds = clamp(fallbackTtlSeconds, MIN_TTL_SECONDS, MAX_TTL_SECONDS);
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        // no predefined caches; created lazily in getMissingCache(...)
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    /**
     * Default TTL of the cache with the given name: its ":ttl=" suffix, or the fallback.
     */
    public long defaultTtlSeconds(String name) {
        Long parsed = parseTtl(name);
        return parsed != null ? parsed : fallbackTtlSeconds;
    }

    private Cache createCache(String name) {
        // fresh builder per cache
        Caffeine<Object, Object> builder = baseBuilderFactory.get()
                .expireAfter(new EntryTtlExpiry(defaultTtlSeconds(name)));
        return new CaffeineCache(name, builder.build(), false);
    }

    private static Long parseTtl(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }

        Matcher m = TTL_PATTERN.matcher(name.trim());
        if (!m.matches()) {
            return null;
        }

        String ttlGroup = m.group("ttl");
        if (ttlGroup == null) {
            return null;
        }

        try {
            return clamp(Long.parseLong(ttlGroup), MIN_TTL_SECONDS, MAX_TTL_SECONDS);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        return Math.min(v, max);
    }

    private static final class EntryTtlExpiry implements Expiry<Object, Object> {

        private final long defaultTtlNanos;

        EntryTtlExpiry(long defaultTtlSeconds) {
            this.defaultTtlNanos = TimeUnit.SECONDS.toNanos(defaultTtlSeconds);
        }

        @Override
        public long expireAfterCreate(Object key, Object value, long currentTime) {
            return ttlNanos(value);
        }

        @Override
        public long expireAfterUpdate(Object key, Object value, long currentTime, long currentDuration) {
            // an overwrite restarts the clock with the new value's TTL
            return ttlNanos(value);
        }

        @Override
        public long expireAfterRead(Object key, Object value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long ttlNanos(Object value) {
            if (value instanceof ExpiringValue ev) {
                return TimeUnit.SECONDS.toNanos(clamp(ev.ttlSeconds(), MIN_TTL_SECONDS, MAX_TTL_SECONDS));
            }
            return defaultTtlNanos;
        }
    }
}
