package com.github.dimitryivaniuta.pagecache.cache.identity;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Answers the two identity questions the anonymous-only policy asks, without forcing a session
 * into existence.
 */
public interface IdentityResolver {

    /** Whether this request used a session, wherever in the chain that happened. */
    boolean sessionAccessed(HttpServletRequest request);

    boolean isAuthenticated(HttpServletRequest request);
}
