package com.github.dimitryivaniuta.pagecache.config;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheProperties;
import com.github.dimitryivaniuta.pagecache.cache.PageCacheSettings;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackend;
import com.github.dimitryivaniuta.pagecache.cache.backend.CacheBackendRegistry;
import com.github.dimitryivaniuta.pagecache.cache.http.CachedPageWriter;
import com.github.dimitryivaniuta.pagecache.cache.identity.IdentityResolver;
import com.github.dimitryivaniuta.pagecache.cache.identity.ServletIdentityResolver;
import com.github.dimitryivaniuta.pagecache.cache.key.CacheKeyDeriver;
import com.github.dimitryivaniuta.pagecache.cache.key.LocaleContextSource;
import com.github.dimitryivaniuta.pagecache.cache.key.ServletLocaleContextSource;
import com.github.dimitryivaniuta.pagecache.cache.metrics.PageCacheMetrics;
import com.github.dimitryivaniuta.pagecache.cache.phase.CombinedCache;
import com.github.dimitryivaniuta.pagecache.cache.phase.FetchPhase;
import com.github.dimitryivaniuta.pagecache.cache.phase.UpdatePhase;
import com.github.dimitryivaniuta.pagecache.web.FetchFromCacheFilter;
import com.github.dimitryivaniuta.pagecache.web.PageCacheFilter;
import com.github.dimitryivaniuta.pagecache.web.UpdateCacheFilter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.servlet.DispatcherType;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Wires the page cache into the servlet filter chain according to {@code page-cache.mode}:
 * <ul>
 *   <li>combined: one {@link PageCacheFilter} late in the chain</li>
 *   <li>two-phase: {@link UpdateCacheFilter} near the outside, {@link FetchFromCacheFilter} late,
 *       with anything that adds {@code Vary} headers registered between them</li>
 *   <li>disabled: no filter</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(PageCacheProperties.class)
public class PageCacheConfig {

    static final int UPDATE_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;
    static final int FETCH_FILTER_ORDER = Ordered.LOWEST_PRECEDENCE - 10;

    @Bean
    @ConditionalOnMissingBean
    public Clock pageCacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheBackendRegistry cacheBackendRegistry(CacheManager cacheManager,
                                                     PageCacheProperties props,
                                                     PageCacheMetrics metrics) {
        PageCacheProperties.CircuitBreaker cb = props.getCircuitBreaker();
        CircuitBreakerRegistry breakers = null;
        if (cb.isEnabled()) {
            breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                    .failureRateThreshold(cb.getFailureRateThreshold())
                    .slidingWindowSize(cb.getSlidingWindowSize())
                    .minimumNumberOfCalls(cb.getMinimumNumberOfCalls())
                    .waitDurationInOpenState(cb.getWaitInOpenState())
                    .build());
        }
        return new CacheBackendRegistry(cacheManager, props.getCache().getDefaultTtlSeconds(), metrics, breakers);
    }

    @Bean
    @ConditionalOnMissingBean
    public LocaleContextSource localeContextSource(PageCacheProperties props) {
        return new ServletLocaleContextSource(props.getTimeZone());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "page-cache.identity", name = "enabled", matchIfMissing = true)
    public IdentityResolver identityResolver() {
        return new ServletIdentityResolver();
    }

    @Bean
    public PageCacheSettings pageCacheSettings(PageCacheProperties props, CacheBackendRegistry backends) {
        return PageCacheSettings.from(props, backends::defaultTtlSeconds);
    }

    @Bean
    @Conditional(PageCacheModeCondition.Combined.class)
    public CombinedCache combinedCache(PageCacheProperties props,
                                       CacheBackendRegistry backends,
                                       LocaleContextSource localeSource,
                                       ObjectProvider<IdentityResolver> identity,
                                       PageCacheMetrics metrics,
                                       Clock clock) {
        return CombinedCache.create(props, PageCacheSettings.Overrides.none(), backends,
                localeSource, identity.getIfAvailable(), metrics, clock);
    }

    @Bean
    @Conditional(PageCacheModeCondition.Combined.class)
    public FilterRegistrationBean<PageCacheFilter> pageCacheFilter(CombinedCache combinedCache) {
        FilterRegistrationBean<PageCacheFilter> reg = new FilterRegistrationBean<>(new PageCacheFilter(combinedCache));
        reg.setOrder(FETCH_FILTER_ORDER);
        reg.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
        return reg;
    }

    @Configuration
    @Conditional(PageCacheModeCondition.TwoPhase.class)
    static class TwoPhaseConfig {

        @Bean
        public CacheKeyDeriver cacheKeyDeriver(PageCacheSettings settings, LocaleContextSource localeSource) {
            return new CacheKeyDeriver(localeSource, settings.i18nAware(), settings.timeZoneAware());
        }

        @Bean
        public FetchPhase fetchPhase(PageCacheSettings settings,
                                     CacheBackendRegistry backends,
                                     CacheKeyDeriver keys,
                                     PageCacheMetrics metrics) {
            CacheBackend backend = backends.forAlias(settings.backendAlias());
            return new FetchPhase(settings, backend, keys, metrics);
        }

        @Bean
        public UpdatePhase updatePhase(PageCacheSettings settings,
                                       CacheBackendRegistry backends,
                                       CacheKeyDeriver keys,
                                       ObjectProvider<IdentityResolver> identity,
                                       PageCacheMetrics metrics,
                                       Clock clock) {
            CacheBackend backend = backends.forAlias(settings.backendAlias());
            return new UpdatePhase(settings, backend, keys, identity.getIfAvailable(), metrics, clock);
        }

        @Bean
        public FilterRegistrationBean<UpdateCacheFilter> updateCacheFilter(UpdatePhase updatePhase) {
            FilterRegistrationBean<UpdateCacheFilter> reg = new FilterRegistrationBean<>(new UpdateCacheFilter(updatePhase));
            reg.setOrder(UPDATE_FILTER_ORDER);
            reg.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
            return reg;
        }

        @Bean
        public FilterRegistrationBean<FetchFromCacheFilter> fetchFromCacheFilter(FetchPhase fetchPhase,
                                                                                 PageCacheSettings settings) {
            FetchFromCacheFilter filter = new FetchFromCacheFilter(fetchPhase, new CachedPageWriter(settings.statusHeader()));
            FilterRegistrationBean<FetchFromCacheFilter> reg = new FilterRegistrationBean<>(filter);
            reg.setOrder(FETCH_FILTER_ORDER);
            reg.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
            return reg;
        }
    }
}
