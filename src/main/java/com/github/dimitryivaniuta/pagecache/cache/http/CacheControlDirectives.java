package com.github.dimitryivaniuta.pagecache.cache.http;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Parsed {@code Cache-Control} directives, in header order. Directive names are lower-cased;
 * a directive without argument maps to {@code null}. Unparseable pieces are skipped.
 */
public final class CacheControlDirectives {

    public static final String HEADER = "Cache-Control";

    private static final Pattern DELIMITER = Pattern.compile("\\s*,\\s*");

    private final Map<String, String> directives;

    private CacheControlDirectives(Map<String, String> directives) {
        this.directives = directives;
    }

    public static CacheControlDirectives parse(Collection<String> headerValues) {
        Map<String, String> directives = new LinkedHashMap<>();
        if (headerValues == null) {
            return new CacheControlDirectives(directives);
        }
        for (String headerValue : headerValues) {
            if (headerValue == null || headerValue.isBlank()) continue;
            for (String piece : DELIMITER.split(headerValue.trim())) {
                if (piece.isBlank()) continue;
                int eq = piece.indexOf('=');
                String name = (eq < 0 ? piece : piece.substring(0, eq)).trim().toLowerCase(Locale.ROOT);
                if (name.isEmpty()) continue;
                String value = eq < 0 ? null : piece.substring(eq + 1).trim();
                // first occurrence wins
                directives.putIfAbsent(name, value);
            }
        }
        return new CacheControlDirectives(directives);
    }

    /**
     * @return the {@code max-age} value; empty when absent, malformed or negative
     */
    public OptionalInt maxAge() {
        String raw = directives.get("max-age");
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            int value = Integer.parseInt(unquote(raw));
            return value >= 0 ? OptionalInt.of(value) : OptionalInt.empty();
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    public boolean has(String directive) {
        return directives.containsKey(directive.toLowerCase(Locale.ROOT));
    }

    public boolean forbidsStorage() {
        return has("no-store") || has("private");
    }

    /**
     * Sets {@code max-age} to {@code seconds}, or keeps a smaller valid value already present.
     */
    public CacheControlDirectives withMaxAge(int seconds) {
        Map<String, String> copy = new LinkedHashMap<>(directives);
        OptionalInt current = maxAge();
        int effective = current.isPresent() ? Math.min(current.getAsInt(), seconds) : seconds;
        copy.put("max-age", Integer.toString(effective));
        return new CacheControlDirectives(copy);
    }

    public String format() {
        StringJoiner joiner = new StringJoiner(", ");
        directives.forEach((name, value) -> joiner.add(value == null ? name : name + "=" + value));
        return joiner.toString();
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
