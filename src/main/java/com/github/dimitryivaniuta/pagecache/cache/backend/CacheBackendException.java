package com.github.dimitryivaniuta.pagecache.cache.backend;

public class CacheBackendException extends RuntimeException {

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
