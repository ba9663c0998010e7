package com.github.dimitryivaniuta.pagecache.cache.backend;

import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Decorator that never lets a backend failure reach the request: failed reads are misses,
 * failed writes are logged and counted. While the circuit breaker is open the delegate is not
 * called at all.
 */
@Slf4j
public class FailOpenCacheBackend implements CacheBackend {

    private final CacheBackend delegate;
    private final PageCacheMetrics metrics;
    private final CircuitBreaker circuitBreaker;

    /**
     * @param circuitBreaker may be {@code null} to call the delegate unguarded
     */
    public FailOpenCacheBackend(CacheBackend delegate, PageCacheMetrics metrics, CircuitBreaker circuitBreaker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String alias() {
        return delegate.alias();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            if (circuitBreaker == null) {
                return delegate.get(key, type);
            }
            return circuitBreaker.executeSupplier(() -> delegate.get(key, type));
        } catch (CallNotPermittedException ex) {
            log.debug("Backend {} circuit open, treating {} as absent", alias(), key);
            return Optional.empty();
        } catch (RuntimeException ex) {
            metrics.backendError(alias(), "get");
            log.warn("Backend {} read failed for {}, treating as absent", alias(), key, ex);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        try {
            if (circuitBreaker == null) {
                delegate.set(key, value, ttlSeconds);
            } else {
                circuitBreaker.executeRunnable(() -> delegate.set(key, value, ttlSeconds));
            }
        } catch (CallNotPermittedException ex) {
            log.debug("Backend {} circuit open, skipped write of {}", alias(), key);
        } catch (RuntimeException ex) {
            metrics.backendError(alias(), "set");
            log.warn("Backend {} write failed for {}, response served uncached", alias(), key, ex);
        }
    }

    @Override
    public int defaultTtlSeconds() {
        return delegate.defaultTtlSeconds();
    }
}
