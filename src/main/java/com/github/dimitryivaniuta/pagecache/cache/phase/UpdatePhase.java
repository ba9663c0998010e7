package com.github.dimitryivaniuta.pagecache.cache.phase;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheConfigurationException;
import com.github.dimitryivaniuta.pagecache.cache.PageCacheSettings;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackend;
import com.github.dimitryivaniuta.pagecache.cache.http.CacheControlDirectives;
import com.github.dimitryivaniuta.pagecache.cache.http.FreshnessHeaders;
import com.github.dimitryivaniuta.pagecache.cache.http.PageCacheRequestAttributes;
import com.github.dimitryivaniuta.pagecache.cache.http.PageCacheResponseWrapper;
import com.github.dimitryivaniuta.pagecache.cache.http.SessionTrackingRequestWrapper;
import com.github.dimitryivaniuta.pagecache.cache.identity.IdentityResolver;
import com.github.dimitryivaniuta.pagecache.cache.key.CacheKeyDeriver;
import com.github.dimitryivaniuta.pagecache.cache.key.HeaderList;
import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Post-generation half of the page cache.
 *
 * <p>When the fetch phase asked for it, checks that the generated response may be cached,
 * stamps freshness headers onto it, learns the path's header list from {@code Vary} (the only
 * place the header list is written) and stores the page under the key derived from that list.
 * Checks run in order and the first failing one leaves the response untouched:
 * <ol>
 *   <li>{@code shouldStore} set by the fetch phase</li>
 *   <li>anonymous-only policy: no caching once an authenticated user's session was used</li>
 *   <li>status 200</li>
 *   <li>Cache-Control allows storing; {@code max-age=0} never stores</li>
 * </ol>
 */
@Slf4j
public class UpdatePhase {

    private static final String VARY = "Vary";

    private final PageCacheSettings settings;
    private final CacheBackend backend;
    private final CacheKeyDeriver keys;
    private final IdentityResolver identity;
    private final PageCacheMetrics metrics;
    private final Clock clock;

    /**
     * @param identity may be {@code null} unless {@link PageCacheSettings#anonymousOnly()} is set
     * @throws PageCacheConfigurationException when anonymous-only caching has no identity resolver
     */
    public UpdatePhase(PageCacheSettings settings,
                       CacheBackend backend,
                       CacheKeyDeriver keys,
                       IdentityResolver identity,
                       PageCacheMetrics metrics,
                       Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (settings.anonymousOnly() && identity == null) {
            throw new PageCacheConfigurationException(
                    "Anonymous-only page caching requires an IdentityResolver. "
                            + "Enable page-cache.identity.enabled or register an IdentityResolver bean.");
        }
        this.identity = identity;
    }

    /**
     * Runs {@code chain} on a buffering response and then {@link #maybeStore}. Also serves the
     * async dispatch of the same request: the buffered body is released once processing ends.
     */
    public void handle(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        boolean asyncDispatch = request.getDispatcherType() == DispatcherType.ASYNC;
        PageCacheResponseWrapper wrapper = PageCacheResponseWrapper.wrap(response);

        chain.doFilter(SessionTrackingRequestWrapper.wrap(request), wrapper);

        if (!asyncDispatch) {
            if (request.isAsyncStarted()) {
                wrapper.deferRendering();
            }
            maybeStore(request, wrapper);
        }
        if (!request.isAsyncStarted()) {
            wrapper.finish();
        }
    }

    public HttpServletResponse maybeStore(HttpServletRequest request, PageCacheResponseWrapper response) {
        if (response.isRenderDeferred()) {
            // status and headers are not final yet either; decide once rendering completes
            response.onFinalize(() -> maybeStore(request, response));
            return response;
        }

        if (!PageCacheRequestAttributes.shouldStore(request)) {
            return response;
        }
        // consumed exactly once
        PageCacheRequestAttributes.setShouldStore(request, false);

        if (settings.statusHeader()) {
            response.setHeader(PageCacheRequestAttributes.STATUS_HEADER, "MISS");
        }

        if (settings.anonymousOnly()
                && identity.sessionAccessed(request)
                && identity.isAuthenticated(request)) {
            return skip(request, response, "authenticated");
        }

        if (response.getStatus() != HttpServletResponse.SC_OK) {
            return skip(request, response, "status");
        }

        CacheControlDirectives cacheControl =
                CacheControlDirectives.parse(response.getHeaders(CacheControlDirectives.HEADER));
        if (cacheControl.forbidsStorage()) {
            return skip(request, response, "no-store");
        }
        OptionalInt maxAge = cacheControl.maxAge();
        int ttl = maxAge.isPresent() ? maxAge.getAsInt() : settings.defaultTtlSeconds();
        if (maxAge.isPresent() && ttl == 0) {
            return skip(request, response, "max-age");
        }

        FreshnessHeaders.patch(response, response.getContentAsByteArray(), ttl, clock.instant(), settings.etags());
        if (ttl <= 0) {
            return skip(request, response, "ttl");
        }

        String vary = joined(response.getHeaders(VARY));
        if (HeaderList.isWildcard(vary)) {
            return skip(request, response, "vary");
        }

        String pageKey = learnCacheKey(request, vary, ttl);
        backend.set(pageKey, response.snapshot(), ttl);
        metrics.stored(backend.alias());
        log.debug("Stored {} {} under {} for {}s", request.getMethod(), request.getRequestURI(), pageKey, ttl);
        return response;
    }

    /**
     * Records the header list for the request path and returns the page key derived from it.
     */
    String learnCacheKey(HttpServletRequest request, String vary, int ttl) {
        HeaderList headerList = HeaderList.fromVary(vary);
        String prefix = settings.keyPrefix();
        backend.set(keys.headerListKey(prefix, request), headerList, ttl);
        return keys.pageKey(request, request.getMethod(), headerList, prefix);
    }

    private HttpServletResponse skip(HttpServletRequest request, HttpServletResponse response, String reason) {
        log.debug("Not caching {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
        metrics.storeSkipped(backend.alias(), reason);
        return response;
    }

    private static String joined(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return String.join(", ", values);
    }
}
