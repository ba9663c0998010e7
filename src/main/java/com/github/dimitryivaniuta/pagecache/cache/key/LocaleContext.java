package com.github.dimitryivaniuta.pagecache.cache.key;

/**
 * Locale and time zone a request was resolved to; partitions both key kinds.
 */
public record LocaleContext(String languageTag, String timeZoneId) {
}
