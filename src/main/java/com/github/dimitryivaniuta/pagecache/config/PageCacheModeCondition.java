package com.github.dimitryivaniuta.pagecache.config;

import com.github.dimitryivaniuta.pagecache.cache.PageCacheProperties;
import com.github.dimitryivaniuta.pagecache.cache.PageCacheProperties.Mode;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches on the bound {@code page-cache.mode}, so "two-phase" and "TWO_PHASE" both work.
 */
abstract class PageCacheModeCondition extends SpringBootCondition {

    private final Mode mode;

    PageCacheModeCondition(Mode mode) {
        this.mode = mode;
    }

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Mode configured = Binder.get(context.getEnvironment())
                .bind("page-cache.mode", PageCacheProperties.Mode.class)
                .orElse(Mode.COMBINED);
        return configured == mode
                ? ConditionOutcome.match("page-cache.mode is " + configured)
                : ConditionOutcome.noMatch("page-cache.mode is " + configured + ", not " + mode);
    }

    static class Combined extends PageCacheModeCondition {
        Combined() {
            super(Mode.COMBINED);
        }
    }

    static class TwoPhase extends PageCacheModeCondition {
        TwoPhase() {
            super(Mode.TWO_PHASE);
        }
    }
}
