package com.github.dimitryivaniuta.pagecache.cache.backend;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheConfigurationException;
import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves backends by alias. Every alias maps to one Spring cache of the same name and is
 * returned wrapped in a {@link FailOpenCacheBackend}; instances are memoised per alias.
 */
@Slf4j
public class CacheBackendRegistry {

    private final CacheManager cacheManager;
    private final long fallbackTtlSeconds;
    private final PageCacheMetrics metrics;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Map<String, CacheBackend> backends = new ConcurrentHashMap<>();

    /**
     * @param circuitBreakers may be {@code null} to run backends without a circuit breaker
     */
    public CacheBackendRegistry(CacheManager cacheManager,
                                long fallbackTtlSeconds,
                                PageCacheMetrics metrics,
                                CircuitBreakerRegistry circuitBreakers) {
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager must not be null");
        this.fallbackTtlSeconds = fallbackTtlSeconds;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.circuitBreakers = circuitBreakers;
    }

    public CacheBackend forAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new PageCacheConfigurationException("Cache backend alias must not be blank");
        }
        return backends.computeIfAbsent(alias.trim(), this::create);
    }

    public int defaultTtlSeconds(String alias) {
        return forAlias(alias).defaultTtlSeconds();
    }

    private CacheBackend create(String alias) {
        Cache cache = cacheManager.getCache(alias);
        if (cache == null) {
            throw new PageCacheConfigurationException("No cache named '" + alias + "' is available from "
                    + cacheManager.getClass().getSimpleName());
        }

        long ttl = (cacheManager instanceof TtlCaffeineCacheManager ttlManager)
                ? ttlManager.defaultTtlSeconds(alias)
                : fallbackTtlSeconds;

        CircuitBreaker breaker = circuitBreakers != null
                ? circuitBreakers.circuitBreaker("pagecache-" + alias)
                : null;

        log.info("Page cache backend '{}' ready (default TTL {}s, circuit breaker {})",
                alias, ttl, breaker != null ? "on" : "off");

        CacheBackend backend = new SpringCacheBackend(alias, cache, (int) Math.min(ttl, Integer.MAX_VALUE));
        return new FailOpenCacheBackend(backend, metrics, breaker);
    }
}
