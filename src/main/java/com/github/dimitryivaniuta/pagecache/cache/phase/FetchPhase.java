package com.github.dimitryivaniuta.pagecache.cache.phase;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheSettings;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackend;
import com.github.dimitryivaniuta.pagecache.cache.http.CachedPage;
import com.github.dimitryivaniuta.pagecache.cache.key.CacheKeyDeriver;
import com.github.dimitryivaniuta.pagecache.cache.key.HeaderList;
import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

import static com.github.dimitryivaniuta.pagecache.cache.http.PageCacheRequestAttributes.setShouldStore;

/**
 * Pre-generation half of the page cache.
 *
 * <p>Looks up the header list learned for the request path, derives the page key from it and
 * reads the page. Every call decides the request's {@code shouldStore} flag:
 * <ul>
 *   <li>method other than GET/HEAD: false, no backend read</li>
 *   <li>no header list on file, or no page: true (generate, then learn and store)</li>
 *   <li>page found: false, the cached page is returned</li>
 * </ul>
 * It never invokes the handler; on an empty result the caller does.
 */
@Slf4j
@RequiredArgsConstructor
public class FetchPhase {

    private final PageCacheSettings settings;
    private final CacheBackend backend;
    private final CacheKeyDeriver keys;
    private final PageCacheMetrics metrics;

    public Optional<CachedPage> lookup(HttpServletRequest request) {
        String method = request.getMethod();
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            setShouldStore(request, false);
            metrics.lookupSkipped(backend.alias());
            return Optional.empty();
        }

        String prefix = settings.keyPrefix();
        String headerListKey = keys.headerListKey(prefix, request);
        Optional<HeaderList> headerList = backend.get(headerListKey, HeaderList.class);
        if (headerList.isEmpty()) {
            log.debug("No header list for {} {}, page must be generated", method, request.getRequestURI());
            setShouldStore(request, true);
            metrics.lookupUnknown(backend.alias());
            return Optional.empty();
        }

        boolean head = "HEAD".equals(method);
        Optional<CachedPage> page = (!head || settings.headReusesGet())
                ? backend.get(keys.pageKey(request, "GET", headerList.get(), prefix), CachedPage.class)
                : Optional.empty();
        if (page.isEmpty() && head) {
            // a HEAD response may have been stored under its own key
            page = backend.get(keys.pageKey(request, "HEAD", headerList.get(), prefix), CachedPage.class);
        }

        if (page.isEmpty()) {
            log.debug("Cache miss for {} {}", method, request.getRequestURI());
            setShouldStore(request, true);
            metrics.lookupMiss(backend.alias());
            return Optional.empty();
        }

        log.debug("Cache hit for {} {}", method, request.getRequestURI());
        setShouldStore(request, false);
        metrics.lookupHit(backend.alias());
        return Optional.of(page.get().copy());
    }
}
