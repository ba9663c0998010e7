package com.github.dimitryivaniuta.pagecache.cache.key;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the locale/time zone context of a request.
 *
 * <p>Implementations must return the same result before and after the handler runs, since
 * the fetch and update phases both derive keys from it.
 */
@FunctionalInterface
public interface LocaleContextSource {

    LocaleContext resolve(HttpServletRequest request);
}
