package com.github.dimitryivaniuta.pagecache.cache.http;

/**
 * A response whose body is finalised after the point where caching is decided.
 */
public interface DeferredRenderable {

    boolean isRenderDeferred();

    /**
     * Runs {@code callback} once the response is final; immediately when it already is.
     */
    void onFinalize(Runnable callback);
}
