package com.github.dimitryivaniuta.pagecache.cache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class PageCacheMetrics {

    private final MeterRegistry registry;

    public PageCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Fetch phase ----
    public void lookupHit(String backend) {
        lookup(backend, "hit");
    }

    public void lookupMiss(String backend) {
        lookup(backend, "miss");
    }

    /** No header list on file: the path has to be generated to learn its Vary headers. */
    public void lookupUnknown(String backend) {
        lookup(backend, "unknown");
    }

    /** Method not cacheable, no backend read. */
    public void lookupSkipped(String backend) {
        lookup(backend, "skipped");
    }

    private void lookup(String backend, String outcome) {
        Counter.builder("pagecache_lookups_total")
                .tag("backend", backend)
                .tag("outcome", outcome) // hit | miss | unknown | skipped
                .register(registry)
                .increment();
    }

    // ---- Update phase ----
    public void stored(String backend) {
        Counter.builder("pagecache_stores_total")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void storeSkipped(String backend, String reason) {
        Counter.builder("pagecache_store_skipped_total")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // ---- Backend ----
    public void backendError(String backend, String operation) {
        Counter.builder("pagecache_backend_errors_total")
                .tag("backend", backend)
                .tag("operation", operation) // get | set
                .register(registry)
                .increment();
    }
}
