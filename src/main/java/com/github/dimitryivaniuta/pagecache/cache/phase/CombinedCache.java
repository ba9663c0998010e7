package com.github.dimitryivaniuta.pagecache.cache.phase;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheProperties;
import com.github.dimitryivaniuta.pagecache.cache.PageCacheSettings;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackend;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackendRegistry;
import com.github.dimitryivaniuta.pagecache.cache.http.CachedPage;
import com.github.dimitryivaniuta.pagecache.cache.http.CachedPageWriter;
import com.github.dimitryivaniuta.pagecache.cache.identity.IdentityResolver;
import com.github.dimitryivaniuta.pagecache.cache.key.CacheKeyDeriver;
import com.github.dimitryivaniuta.pagecache.cache.key.LocaleContextSource;
import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Fetch, generate on miss, update: the whole page cache behind one entry point, for
 * deployments where nothing between the two phases affects the cache key.
 */
@RequiredArgsConstructor
public class CombinedCache {

    private final FetchPhase fetchPhase;
    private final UpdatePhase updatePhase;
    private final CachedPageWriter writer;

    /**
     * Resolves settings (explicit {@code overrides} &gt; deployment {@code props} &gt; built-in
     * defaults) and wires both phases against the one selected backend.
     */
    public static CombinedCache create(PageCacheProperties props,
                                       PageCacheSettings.Overrides overrides,
                                       CacheBackendRegistry backends,
                                       LocaleContextSource localeSource,
                                       IdentityResolver identity,
                                       PageCacheMetrics metrics,
                                       Clock clock) {
        PageCacheSettings settings = PageCacheSettings.resolve(props, overrides, backends::defaultTtlSeconds);
        CacheBackend backend = backends.forAlias(settings.backendAlias());
        CacheKeyDeriver keys = new CacheKeyDeriver(localeSource, settings.i18nAware(), settings.timeZoneAware());
        return new CombinedCache(
                new FetchPhase(settings, backend, keys, metrics),
                new UpdatePhase(settings, backend, keys, identity, metrics, clock),
                new CachedPageWriter(settings.statusHeader())
        );
    }

    public void execute(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        // lookup already happened on the initial dispatch
        if (request.getDispatcherType() != DispatcherType.ASYNC) {
            Optional<CachedPage> cached = fetchPhase.lookup(request);
            if (cached.isPresent()) {
                writer.write(request, response, cached.get());
                return;
            }
        }
        updatePhase.handle(request, response, chain);
    }
}
