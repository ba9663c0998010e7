package com.github.dimitryivaniuta.pagecache.cache.backend;

import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FailOpenCacheBackendTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PageCacheMetrics metrics = new PageCacheMetrics(registry);
    private final BrokenBackend broken = new BrokenBackend();

    @Test
    void failedReadShouldBeAMiss() {
        FailOpenCacheBackend backend = new FailOpenCacheBackend(broken, metrics, null);

        assertThat(backend.get("k", String.class)).isEmpty();
        assertThat(errors("get")).isEqualTo(1.0);
    }

    @Test
    void failedWriteShouldBeSwallowed() {
        FailOpenCacheBackend backend = new FailOpenCacheBackend(broken, metrics, null);

        assertThatCode(() -> backend.set("k", "v", 60)).doesNotThrowAnyException();
        assertThat(errors("set")).isEqualTo(1.0);
    }

    @Test
    void openCircuitShouldStopCallingTheDelegate() {
        CircuitBreaker breaker = CircuitBreaker.of("pagecache-test", CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .build());
        FailOpenCacheBackend backend = new FailOpenCacheBackend(broken, metrics, breaker);

        backend.get("a", String.class);
        backend.get("b", String.class);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThat(backend.get("c", String.class)).isEmpty();
        backend.set("d", "v", 60);

        assertThat(broken.calls.get()).isEqualTo(2);
        assertThat(errors("get")).isEqualTo(2.0);
    }

    @Test
    void healthyDelegateShouldPassThrough() {
        SpringCacheBackend healthy = new SpringCacheBackend("pages",
                new ConcurrentMapCache("pages"), 300);
        FailOpenCacheBackend backend = new FailOpenCacheBackend(healthy, metrics, null);

        backend.set("k", "v", 60);

        assertThat(backend.get("k", String.class)).contains("v");
        assertThat(backend.alias()).isEqualTo("pages");
        assertThat(backend.defaultTtlSeconds()).isEqualTo(300);
    }

    private double errors(String operation) {
        return registry.counter("pagecache_backend_errors_total", "backend", "broken", "operation", operation).count();
    }

    private static final class BrokenBackend implements CacheBackend {

        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public String alias() {
            return "broken";
        }

        @Override
        public <T> Optional<T> get(String key, Class<T> type) {
            calls.incrementAndGet();
            throw new CacheBackendException("read failed", new IllegalStateException("down"));
        }

        @Override
        public void set(String key, Object value, long ttlSeconds) {
            calls.incrementAndGet();
            throw new CacheBackendException("write failed", new IllegalStateException("down"));
        }

        @Override
        public int defaultTtlSeconds() {
            return 300;
        }
    }
}
