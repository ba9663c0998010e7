package com.github.dimitryivaniuta.pagecache.cache.key;

import java.util.Locale;

/**
 * Conversion between HTTP header names and the canonical, transport-style names kept in a
 * {@link HeaderList}: {@code Accept-Language} &lt;-&gt; {@code HTTP_ACCEPT_LANGUAGE}.
 */
public final class HeaderNames {

    public static final String PREFIX = "HTTP_";

    private HeaderNames() {
    }

    public static String canonicalize(String headerName) {
        return PREFIX + headerName.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }

    /** Servlet header lookups are case-insensitive, so the upper-cased form is enough. */
    public static String toHttpName(String canonicalName) {
        String name = canonicalName.startsWith(PREFIX)
                ? canonicalName.substring(PREFIX.length())
                : canonicalName;
        return name.replace('_', '-');
    }
}
