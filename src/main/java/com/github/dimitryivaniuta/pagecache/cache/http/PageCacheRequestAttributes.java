package com.github.dimitryivaniuta.pagecache.cache.http;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Request attribute names shared by the fetch and update phases and by collaborating filters.
 */
public final class PageCacheRequestAttributes {
    private PageCacheRequestAttributes() {}

    private static final String PREFIX = PageCacheRequestAttributes.class.getName() + ".";

    /** Boolean; written once by the fetch phase, consumed once by the update phase. */
    public static final String SHOULD_STORE = PREFIX + "shouldStore";

    /** Boolean; set when downstream code materialised an HTTP session. */
    public static final String SESSION_ACCESSED = PREFIX + "sessionAccessed";

    /** String language tag an upstream locale filter resolved for this request. */
    public static final String LANGUAGE_CODE = PREFIX + "languageCode";

    /** String time zone id an upstream filter resolved for this request. */
    public static final String TIME_ZONE = PREFIX + "timeZone";

    public static final String STATUS_HEADER = "X-Page-Cache";

    public static boolean shouldStore(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(SHOULD_STORE));
    }

    public static void setShouldStore(HttpServletRequest request, boolean value) {
        request.setAttribute(SHOULD_STORE, value);
    }

    public static boolean sessionAccessed(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(SESSION_ACCESSED));
    }
}
