package com.github.dimitryivaniuta.pagecache.cache.key;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.Objects;

/**
 * Derives the two key kinds of the page cache.
 *
 * <pre>
 *   header-list key: pagecache.header.&lt;prefix&gt;.&lt;md5(path)&gt;[.&lt;lang&gt;][.&lt;tz&gt;]
 *   page key:        pagecache.page.&lt;prefix&gt;.&lt;METHOD&gt;.&lt;md5(path)&gt;.&lt;md5(header values)&gt;[.&lt;lang&gt;][.&lt;tz&gt;]
 * </pre>
 *
 * Both functions are pure: identical inputs always give identical keys, across restarts too.
 * Header values are concatenated without separator in header-list order, so a missing header
 * and an empty one hash the same.
 */
public final class CacheKeyDeriver {

    public static final String HEADER_NAMESPACE = "pagecache.header";
    public static final String PAGE_NAMESPACE = "pagecache.page";

    private final LocaleContextSource localeSource;
    private final boolean i18nAware;
    private final boolean timeZoneAware;

    public CacheKeyDeriver(LocaleContextSource localeSource, boolean i18nAware, boolean timeZoneAware) {
        this.localeSource = Objects.requireNonNull(localeSource, "localeSource must not be null");
        this.i18nAware = i18nAware;
        this.timeZoneAware = timeZoneAware;
    }

    public String headerListKey(String prefix, HttpServletRequest request) {
        String key = HEADER_NAMESPACE + "." + prefix + "." + md5(RequestPaths.fullPath(request));
        return withLocaleSuffix(request, key);
    }

    public String pageKey(HttpServletRequest request, String method, HeaderList headerList, String prefix) {
        StringBuilder values = new StringBuilder();
        for (String canonical : headerList.names()) {
            String value = headerValue(request, HeaderNames.toHttpName(canonical));
            if (value != null) {
                values.append(value);
            }
        }
        String key = PAGE_NAMESPACE + "." + prefix + "." + method + "."
                + md5(RequestPaths.fullPath(request)) + "." + md5(values.toString());
        return withLocaleSuffix(request, key);
    }

    private String withLocaleSuffix(HttpServletRequest request, String key) {
        if (!i18nAware && !timeZoneAware) {
            return key;
        }
        LocaleContext ctx = localeSource.resolve(request);
        StringBuilder sb = new StringBuilder(key);
        if (i18nAware) sb.append('.').append(ctx.languageTag());
        if (timeZoneAware) sb.append('.').append(ctx.timeZoneId());
        return sb.toString();
    }

    private static String headerValue(HttpServletRequest request, String name) {
        Enumeration<String> values = request.getHeaders(name);
        if (values == null || !values.hasMoreElements()) {
            return null;
        }
        String first = values.nextElement();
        if (!values.hasMoreElements()) {
            return first;
        }
        StringBuilder sb = new StringBuilder(first);
        while (values.hasMoreElements()) {
            sb.append(',').append(values.nextElement());
        }
        return sb.toString();
    }

    private static String md5(String s) {
        return DigestUtils.md5DigestAsHex(s.getBytes(StandardCharsets.UTF_8));
    }
}
