package com.github.dimitryivaniuta.pagecache.cache.http;

import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers the generated body so freshness headers can still be patched and a {@link CachedPage}
 * taken after the handler returned. Nothing reaches the client until {@link #finish()}.
 *
 * <p>For async requests the owning filter calls {@link #deferRendering()} at the end of the
 * initial dispatch and {@link #finish()} at the end of the last one; callbacks registered
 * in between run at that point.
 */
@Slf4j
public class PageCacheResponseWrapper extends ContentCachingResponseWrapper implements DeferredRenderable {

    private final List<Runnable> finalizeCallbacks = new ArrayList<>();
    private boolean deferred;

    public PageCacheResponseWrapper(HttpServletResponse response) {
        super(response);
    }

    /**
     * Returns the wrapper already present in the response chain (e.g. on an async dispatch),
     * or a new one around {@code response}.
     */
    public static PageCacheResponseWrapper wrap(HttpServletResponse response) {
        PageCacheResponseWrapper existing = WebUtils.getNativeResponse(response, PageCacheResponseWrapper.class);
        return existing != null ? existing : new PageCacheResponseWrapper(response);
    }

    public void deferRendering() {
        this.deferred = true;
    }

    @Override
    public boolean isRenderDeferred() {
        return deferred;
    }

    @Override
    public void onFinalize(Runnable callback) {
        if (deferred) {
            finalizeCallbacks.add(callback);
        } else {
            callback.run();
        }
    }

    public CachedPage snapshot() {
        return CachedPage.of(this);
    }

    /**
     * Marks the response final, runs pending callbacks, then releases the buffered body.
     */
    public void finish() throws IOException {
        deferred = false;
        List<Runnable> pending = new ArrayList<>(finalizeCallbacks);
        finalizeCallbacks.clear();
        for (Runnable callback : pending) {
            try {
                callback.run();
            } catch (RuntimeException ex) {
                log.warn("Page cache finalize callback failed, response is sent uncached", ex);
            }
        }
        copyBodyToResponse();
    }
}
