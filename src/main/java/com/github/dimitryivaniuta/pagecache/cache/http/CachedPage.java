package com.github.dimitryivaniuta.pagecache.cache.http;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a generated response as it is kept in the cache backend.
 *
 * <p>Every instance owns its header map, header value lists and body array, so a {@link #copy()}
 * can be mutated by the caller without touching the stored entry.
 */
public record CachedPage(
        int status,
        Map<String, List<String>> headers,
        String contentType,
        byte[] body
) implements Serializable {

    /** Headers re-derived when the page is replayed, or belonging to one client only. */
    private static final Set<String> NOT_STORED = Set.of(
            "content-length", "content-type", "transfer-encoding", "set-cookie",
            PageCacheRequestAttributes.STATUS_HEADER.toLowerCase(Locale.ROOT));

    public CachedPage {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, new ArrayList<>(values)));
        }
        headers = copy;
        body = body != null ? body.clone() : new byte[0];
    }

    public static CachedPage of(PageCacheResponseWrapper response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.getHeaderNames()) {
            if (NOT_STORED.contains(name.toLowerCase(Locale.ROOT)) || headers.containsKey(name)) {
                continue;
            }
            Collection<String> values = response.getHeaders(name);
            headers.put(name, new ArrayList<>(values));
        }
        return new CachedPage(response.getStatus(), headers, response.getContentType(), response.getContentAsByteArray());
    }

    public CachedPage copy() {
        return new CachedPage(status, headers, contentType, body);
    }

    /** First value of the header, matched case-insensitively. */
    public String header(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }
}
