package com.github.dimitryivaniuta.pagecache.cache.key;

import jakarta.servlet.http.HttpServletRequest;

import java.nio.charset.StandardCharsets;

/**
 * Normalised "full path" (path + query) used in cache keys.
 *
 * <p>IRI characters are converted to URI form: non-ASCII, control and unsafe characters are
 * percent-encoded as UTF-8; existing escapes are kept but their hex digits are upper-cased, so
 * {@code /caf%c3%a9} and {@code /café} map to the same path.
 */
public final class RequestPaths {

    private static final String UNSAFE = " \"<>\\^`{|}";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private RequestPaths() {
    }

    public static String fullPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String query = request.getQueryString();
        String raw = (uri == null || uri.isEmpty()) ? "/" : uri;
        if (query != null && !query.isEmpty()) {
            raw = raw + "?" + query;
        }
        return iriToUri(raw);
    }

    static String iriToUri(String iri) {
        StringBuilder sb = new StringBuilder(iri.length() + 16);
        int i = 0;
        while (i < iri.length()) {
            char c = iri.charAt(i);
            if (c == '%' && isHex(iri, i + 1) && isHex(iri, i + 2)) {
                sb.append('%')
                        .append(Character.toUpperCase(iri.charAt(i + 1)))
                        .append(Character.toUpperCase(iri.charAt(i + 2)));
                i += 3;
                continue;
            }
            int cp = iri.codePointAt(i);
            int len = Character.charCount(cp);
            if (cp < 0x80 && cp > 0x20 && cp != 0x7F && UNSAFE.indexOf(cp) < 0) {
                sb.append((char) cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
                }
            }
            i += len;
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int index) {
        return index < s.length() && Character.digit(s.charAt(index), 16) >= 0;
    }
}
