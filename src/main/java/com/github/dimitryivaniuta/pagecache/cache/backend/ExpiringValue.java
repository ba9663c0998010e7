package com.github.dimitryivaniuta.pagecache.cache.backend;

import java.io.Serializable;

/**
 * Cache value carrying its own time-to-live; read by {@link TtlCaffeineCacheManager}'s expiry policy.
 */
public record ExpiringValue(Object value, long ttlSeconds) implements Serializable {
}
