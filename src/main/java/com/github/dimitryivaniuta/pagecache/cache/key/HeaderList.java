package com.github.dimitryivaniuta.pagecache.cache.key;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered canonical request-header names that a path's representation varies on, as learned
 * from the path's last {@code Vary} response header.
 *
 * <p>Order is significant: the page key hashes header values in this order.
 * An empty list means "known, nothing varies"; a missing entry in the backend means "unknown".
 */
public record HeaderList(List<String> names) implements Serializable {

    private static final Pattern DELIMITER = Pattern.compile("\\s*,\\s*");

    public static final HeaderList EMPTY = new HeaderList(List.of());

    public HeaderList {
        names = List.copyOf(names);
    }

    /**
     * Builds the list from a raw {@code Vary} value. Blank tokens are dropped, order is kept.
     * {@code null} or blank input yields {@link #EMPTY}.
     */
    public static HeaderList fromVary(String vary) {
        if (vary == null || vary.isBlank()) {
            return EMPTY;
        }
        List<String> names = new ArrayList<>();
        for (String token : DELIMITER.split(vary.trim())) {
            if (!token.isBlank()) {
                names.add(HeaderNames.canonicalize(token));
            }
        }
        return new HeaderList(names);
    }

    /** {@code Vary: *} - the representation depends on more than request headers. */
    public static boolean isWildcard(String vary) {
        if (vary == null) return false;
        for (String token : DELIMITER.split(vary.trim())) {
            if ("*".equals(token)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }
}
