package com.github.dimitryivaniuta.pagecache.cache.http;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpSession;
import org.springframework.web.util.WebUtils;

/**
 * Records in {@link PageCacheRequestAttributes#SESSION_ACCESSED} whether anything downstream
 * obtained an HTTP session. The flag lives on the request attributes so every wrapper and the
 * original request see it.
 */
public class SessionTrackingRequestWrapper extends HttpServletRequestWrapper {

    public SessionTrackingRequestWrapper(HttpServletRequest request) {
        super(request);
    }

    public static HttpServletRequest wrap(HttpServletRequest request) {
        if (WebUtils.getNativeRequest(request, SessionTrackingRequestWrapper.class) != null) {
            return request;
        }
        return new SessionTrackingRequestWrapper(request);
    }

    @Override
    public HttpSession getSession() {
        HttpSession session = super.getSession();
        markAccessed(session);
        return session;
    }

    @Override
    public HttpSession getSession(boolean create) {
        HttpSession session = super.getSession(create);
        markAccessed(session);
        return session;
    }

    private void markAccessed(HttpSession session) {
        if (session != null) {
            setAttribute(PageCacheRequestAttributes.SESSION_ACCESSED, Boolean.TRUE);
        }
    }
}
