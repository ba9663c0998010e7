package com.github.dimitryivaniuta.pagecache.cache.key;

import com.github.dimitryivaniuta.pagecache.cache.http.PageCacheRequestAttributes;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Locale;
import java.util.TimeZone;

/**
 * Reads the language from the {@link PageCacheRequestAttributes#LANGUAGE_CODE} attribute when an
 * upstream filter set one, otherwise from {@link HttpServletRequest#getLocale()}; the time zone
 * from {@link PageCacheRequestAttributes#TIME_ZONE}, otherwise the configured default.
 *
 * <p>{@code LocaleContextHolder} is not consulted: {@code RequestContextFilter} binds it for
 * only part of the filter chain.
 */
public class ServletLocaleContextSource implements LocaleContextSource {

    private final String defaultTimeZone;

    public ServletLocaleContextSource(String defaultTimeZone) {
        this.defaultTimeZone = (defaultTimeZone == null || defaultTimeZone.isBlank())
                ? TimeZone.getDefault().getID()
                : TimeZone.getTimeZone(defaultTimeZone.trim()).getID();
    }

    @Override
    public LocaleContext resolve(HttpServletRequest request) {
        return new LocaleContext(language(request), timeZone(request));
    }

    private static String language(HttpServletRequest request) {
        Object code = request.getAttribute(PageCacheRequestAttributes.LANGUAGE_CODE);
        if (code instanceof String s && !s.isBlank()) {
            return s;
        }
        Locale locale = request.getLocale();
        return locale != null ? locale.toLanguageTag() : Locale.getDefault().toLanguageTag();
    }

    private String timeZone(HttpServletRequest request) {
        Object tz = request.getAttribute(PageCacheRequestAttributes.TIME_ZONE);
        if (tz instanceof String s && !s.isBlank()) {
            return s;
        }
        return defaultTimeZone;
    }
}
