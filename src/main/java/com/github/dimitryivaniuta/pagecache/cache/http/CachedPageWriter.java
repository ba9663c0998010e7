package com.github.dimitryivaniuta.pagecache.cache.http;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Replays a {@link CachedPage} onto a live response.
 */
public final class CachedPageWriter {

    private final boolean statusHeader;

    public CachedPageWriter(boolean statusHeader) {
        this.statusHeader = statusHeader;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, CachedPage page) throws IOException {
        response.setStatus(page.status());

        for (Map.Entry<String, List<String>> e : page.headers().entrySet()) {
            boolean first = true;
            for (String value : e.getValue()) {
                if (first) {
                    response.setHeader(e.getKey(), value);
                    first = false;
                } else {
                    response.addHeader(e.getKey(), value);
                }
            }
        }
        if (page.contentType() != null) {
            response.setContentType(page.contentType());
        }
        if (statusHeader) {
            response.setHeader(PageCacheRequestAttributes.STATUS_HEADER, "HIT");
        }

        byte[] body = page.body();
        response.setContentLength(body.length);
        // HEAD gets the GET headers, never a body
        if (!"HEAD".equals(request.getMethod()) && body.length > 0) {
            response.getOutputStream().write(body);
        }
    }
}
