package com.github.dimitryivaniuta.pagecache.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.pagecache.cache.PageCacheProperties;
import com.github.dimitryivaniuta.pagecache.cache.backend.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Page cache storage:
 * - Caffeine local cache, one cache per backend alias
 * - default TTL per cache via name convention: "pages:ttl=600"
 * - per-entry TTL taken from the stored response (see TtlCaffeineCacheManager)
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(PageCacheProperties props) {
        PageCacheProperties.Store store = props.getCache();
        // no expireAfterWrite/expireAfterAccess here, expiry is per entry
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(store.getMaximumSize())
                        .recordStats(),
                store.getDefaultTtlSeconds()
        );
    }
}
