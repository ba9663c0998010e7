package com.github.dimitryivaniuta.pagecache.cache.http;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.util.DigestUtils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Stamps ETag, Last-Modified, Expires and Cache-Control max-age onto a cacheable response.
 * Headers already present are left alone, except max-age which can only shrink, so patching
 * twice with the same TTL gives the same headers as patching once.
 */
public final class FreshnessHeaders {

    public static final String ETAG = "ETag";
    public static final String LAST_MODIFIED = "Last-Modified";
    public static final String EXPIRES = "Expires";

    // IMF-fixdate, two-digit day
    private static final DateTimeFormatter HTTP_DATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private FreshnessHeaders() {
    }

    public static void patch(HttpServletResponse response, byte[] body, int ttlSeconds, Instant now, boolean etags) {
        int ttl = Math.max(0, ttlSeconds);

        if (etags && !response.containsHeader(ETAG)) {
            response.setHeader(ETAG, "\"" + DigestUtils.md5DigestAsHex(body) + "\"");
        }
        if (!response.containsHeader(LAST_MODIFIED)) {
            response.setHeader(LAST_MODIFIED, httpDate(now));
        }
        if (!response.containsHeader(EXPIRES)) {
            response.setHeader(EXPIRES, httpDate(now.plusSeconds(ttl)));
        }

        CacheControlDirectives cc = CacheControlDirectives.parse(response.getHeaders(CacheControlDirectives.HEADER));
        response.setHeader(CacheControlDirectives.HEADER, cc.withMaxAge(ttl).format());
    }

    public static String httpDate(Instant instant) {
        return HTTP_DATE.format(instant.atOffset(ZoneOffset.UTC));
    }
}
