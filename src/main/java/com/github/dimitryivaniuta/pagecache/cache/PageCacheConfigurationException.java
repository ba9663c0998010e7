package com.github.dimitryivaniuta.pagecache.cache;

/**
 * Raised eagerly, at component construction, when the page cache is configured in a way it
 * cannot honour (e.g. anonymous-only caching without an identity subsystem).
 */
public class PageCacheConfigurationException extends IllegalStateException {

    public PageCacheConfigurationException(String message) {
        super(message);
    }
}
