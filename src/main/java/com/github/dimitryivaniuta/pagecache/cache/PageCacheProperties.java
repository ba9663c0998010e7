package com.github.dimitryivaniuta.pagecache.cache;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Deployment-level page cache configuration ({@code page-cache.*}).
 *
 * <p>Values left unset fall back to the built-in defaults below; {@link #defaultTtlSeconds}
 * is the exception: when unset, the selected backend's own default TTL applies.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "page-cache")
public class PageCacheProperties {

    public enum Mode {
        /** single filter running fetch, handler and update */
        COMBINED,
        /** separate fetch (innermost) and update (outermost) filters */
        TWO_PHASE,
        DISABLED
    }

    @NotNull
    private Mode mode = Mode.COMBINED;

    /** Backend alias, i.e. a cache name optionally carrying a ":ttl=NN" suffix. */
    @NotBlank
    private String backend = "default";

    @Min(0)
    private Integer defaultTtlSeconds;

    @NotNull
    private String keyPrefix = "";

    private boolean anonymousOnly = false;

    private boolean i18nAware = true;

    private boolean timeZoneAware = false;

    /** Time zone used for the key suffix when the request does not carry one. Blank means JVM default. */
    private String timeZone;

    private boolean etags = true;

    /** HEAD lookups try the GET page first (HEAD and GET must then send identical headers). */
    private boolean headReusesGet = true;

    /** Adds X-Page-Cache: HIT|MISS to responses. */
    private boolean statusHeader = true;

    @Valid
    private Identity identity = new Identity();

    @Valid
    private Store cache = new Store();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Getter
    @Setter
    public static class Identity {
        /** Registers the servlet principal based identity resolver. */
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Store {
        @Min(1)
        private long maximumSize = 10_000;

        /** TTL used by backends whose alias carries no ":ttl=" suffix. */
        @Min(1)
        private long defaultTtlSeconds = 300;
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private boolean enabled = true;

        @Positive
        private float failureRateThreshold = 50f;

        @Min(1)
        private int slidingWindowSize = 20;

        @Min(1)
        private int minimumNumberOfCalls = 10;

        @NotNull
        private Duration waitInOpenState = Duration.ofSeconds(30);
    }
}
