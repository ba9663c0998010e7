package com.github.dimitryivaniuta.pagecache.cache;

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Resolved, immutable configuration handed to each cache component through its constructor.
 *
 * <p>Resolution precedence per field: explicit {@link Overrides} value, then the deployment
 * {@link PageCacheProperties}, then the built-in default. The built-in default TTL is the
 * selected backend's default TTL.
 */
public record PageCacheSettings(
        String keyPrefix,
        int defaultTtlSeconds,
        boolean anonymousOnly,
        String backendAlias,
        boolean i18nAware,
        boolean timeZoneAware,
        boolean etags,
        boolean statusHeader,
        boolean headReusesGet
) {

    public PageCacheSettings {
        Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
        Objects.requireNonNull(backendAlias, "backendAlias must not be null");
        if (defaultTtlSeconds < 0) {
            throw new PageCacheConfigurationException("defaultTtlSeconds must be >= 0 but was " + defaultTtlSeconds);
        }
    }

    /**
     * Per-instance overrides; {@code null} means "not provided".
     */
    public record Overrides(String keyPrefix, Integer ttlSeconds, Boolean anonymousOnly, String backendAlias) {

        public static Overrides none() {
            return new Overrides(null, null, null, null);
        }
    }

    public static PageCacheSettings from(PageCacheProperties props, ToIntFunction<String> backendDefaultTtl) {
        return resolve(props, Overrides.none(), backendDefaultTtl);
    }

    public static PageCacheSettings resolve(PageCacheProperties props,
                                            Overrides overrides,
                                            ToIntFunction<String> backendDefaultTtl) {
        Objects.requireNonNull(props, "props must not be null");
        Overrides o = overrides != null ? overrides : Overrides.none();

        String alias = firstNonNull(o.backendAlias(), props.getBackend(), "default");
        String prefix = firstNonNull(o.keyPrefix(), props.getKeyPrefix(), "");
        boolean anonymousOnly = firstNonNull(o.anonymousOnly(), props.isAnonymousOnly(), false);

        int ttl;
        if (o.ttlSeconds() != null) {
            ttl = o.ttlSeconds();
        } else if (props.getDefaultTtlSeconds() != null) {
            ttl = props.getDefaultTtlSeconds();
        } else {
            ttl = backendDefaultTtl.applyAsInt(alias);
        }

        return new PageCacheSettings(
                prefix,
                ttl,
                anonymousOnly,
                alias,
                props.isI18nAware(),
                props.isTimeZoneAware(),
                props.isEtags(),
                props.isStatusHeader(),
                props.isHeadReusesGet()
        );
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T c : candidates) {
            if (c != null) return c;
        }
        return null;
    }
}
