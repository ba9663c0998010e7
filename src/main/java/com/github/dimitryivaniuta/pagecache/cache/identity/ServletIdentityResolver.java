package com.github.dimitryivaniuta.pagecache.cache.identity;

import com.github.dimitryivaniuta.pagecache.cache.http.PageCacheRequestAttributes;
import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;

/**
 * Session access comes from {@link com.github.dimitryivaniuta.pagecache.cache.http.SessionTrackingRequestWrapper}
 * for code downstream of the cache, and from the request's existing session for anything that ran
 * earlier in the chain; authentication from the container principal / remote user.
 */
public class ServletIdentityResolver implements IdentityResolver {

    @Override
    public boolean sessionAccessed(HttpServletRequest request) {
        if (PageCacheRequestAttributes.sessionAccessed(request)) {
            return true;
        }
        // filters ahead of the cache may have loaded the session without passing through the wrapper
        return request.getSession(false) != null;
    }

    @Override
    public boolean isAuthenticated(HttpServletRequest request) {
        Principal p = request.getUserPrincipal();
        if (p != null && p.getName() != null && !p.getName().isBlank()) {
            return true;
        }
        String remoteUser = request.getRemoteUser();
        return remoteUser != null && !remoteUser.isBlank();
    }
}
